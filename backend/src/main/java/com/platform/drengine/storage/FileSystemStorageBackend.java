package com.platform.drengine.storage;

import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.core.CircuitBreakerManager;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.StorageException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Storage backend on a local or mounted filesystem.
 * 
 * Writes go to a temp file in the target directory, are fsynced and then moved
 * atomically into place, so readers never observe a partial artifact.
 */
@Slf4j
@Component
public class FileSystemStorageBackend implements StorageBackend {
    
    private final Path root;
    
    @Autowired
    public FileSystemStorageBackend(DrEngineProperties properties) {
        this(Paths.get(properties.getStorage().getRootDirectory()));
    }
    
    public FileSystemStorageBackend(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }
    
    @Override
    @CircuitBreaker(name = CircuitBreakerManager.STORAGE, fallbackMethod = "putFallback")
    public String put(String key, byte[] data) {
        Path target = resolve(key);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(data);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
            
            String checksum = Checksums.sha256Hex(data);
            log.debug("Stored {} ({} bytes, sha256={})", key, data.length, checksum);
            return checksum;
            
        } catch (IOException e) {
            throw new StorageException(ErrorCode.STORAGE_UNAVAILABLE, key,
                "Failed to write object: " + e.getMessage(), e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }
    
    @Override
    @CircuitBreaker(name = CircuitBreakerManager.STORAGE, fallbackMethod = "getFallback")
    public byte[] get(String key) {
        Path path = resolve(key);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw notFound(key);
        } catch (IOException e) {
            throw new StorageException(ErrorCode.STORAGE_UNAVAILABLE, key,
                "Failed to read object: " + e.getMessage(), e);
        }
    }
    
    @Override
    @CircuitBreaker(name = CircuitBreakerManager.STORAGE, fallbackMethod = "getRangeFallback")
    public byte[] getRange(String key, long offset, int length) {
        if (offset < 0 || length < 0) {
            throw new StorageException(ErrorCode.STORAGE_KEY_INVALID, key,
                "Invalid range offset=" + offset + " length=" + length);
        }
        Path path = resolve(key);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long available = Math.max(0, channel.size() - offset);
            ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(length, available));
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, offset + buffer.position());
                if (read < 0) {
                    break;
                }
            }
            return buffer.array();
        } catch (NoSuchFileException e) {
            throw notFound(key);
        } catch (IOException e) {
            throw new StorageException(ErrorCode.STORAGE_UNAVAILABLE, key,
                "Failed to read range: " + e.getMessage(), e);
        }
    }
    
    @Override
    @CircuitBreaker(name = CircuitBreakerManager.STORAGE, fallbackMethod = "deleteFallback")
    public void delete(String key) {
        try {
            Files.deleteIfExists(resolve(key));
            log.debug("Deleted {}", key);
        } catch (IOException e) {
            throw new StorageException(ErrorCode.STORAGE_UNAVAILABLE, key,
                "Failed to delete object: " + e.getMessage(), e);
        }
    }
    
    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }
    
    @Override
    public long size(String key) {
        try {
            return Files.size(resolve(key));
        } catch (NoSuchFileException e) {
            throw notFound(key);
        } catch (IOException e) {
            throw new StorageException(ErrorCode.STORAGE_UNAVAILABLE, key,
                "Failed to stat object: " + e.getMessage(), e);
        }
    }
    
    private Path resolve(String key) {
        if (key == null || key.isBlank() || key.startsWith("/") || key.contains("\\")) {
            throw new StorageException(ErrorCode.STORAGE_KEY_INVALID, key, "Key must be a relative slash-separated path");
        }
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new StorageException(ErrorCode.STORAGE_KEY_INVALID, key, "Key escapes the storage root");
        }
        return resolved;
    }
    
    private StorageException notFound(String key) {
        return new StorageException(ErrorCode.STORAGE_OBJECT_NOT_FOUND, key, "Object not found: " + key);
    }
    
    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temp file {}: {}", temp, e.getMessage());
        }
    }
    
    @SuppressWarnings("unused")
    private String putFallback(String key, byte[] data, CallNotPermittedException e) {
        throw unavailable(key, e);
    }
    
    @SuppressWarnings("unused")
    private byte[] getFallback(String key, CallNotPermittedException e) {
        throw unavailable(key, e);
    }
    
    @SuppressWarnings("unused")
    private byte[] getRangeFallback(String key, long offset, int length, CallNotPermittedException e) {
        throw unavailable(key, e);
    }
    
    @SuppressWarnings("unused")
    private void deleteFallback(String key, CallNotPermittedException e) {
        throw unavailable(key, e);
    }
    
    private StorageException unavailable(String key, CallNotPermittedException e) {
        return new StorageException(ErrorCode.STORAGE_UNAVAILABLE, key, "Storage circuit breaker open", e);
    }
}
