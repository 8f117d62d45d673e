package com.platform.drengine.backup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.StorageException;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Backup artifact format: gzip-compressed JSON Lines. The first line is the
 * {@link ArtifactHeader}, every following line one {@link BackupRecord}.
 */
@Component
public class BackupArtifactCodec {
    
    private final ObjectMapper objectMapper;
    
    public BackupArtifactCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
    
    public byte[] encode(ArtifactHeader header, List<BackupRecord> records, CompressionLevel compression) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (OutputStream gzip = new LeveledGzipOutputStream(buffer, compression.getDeflateLevel());
             Writer writer = new OutputStreamWriter(gzip, StandardCharsets.UTF_8)) {
            writer.write(objectMapper.writeValueAsString(header));
            writer.write('\n');
            for (BackupRecord record : records) {
                writer.write(objectMapper.writeValueAsString(record));
                writer.write('\n');
            }
        } catch (IOException e) {
            throw new StorageException(ErrorCode.SERIALIZATION_ERROR, null,
                "Failed to encode artifact for execution " + header.executionId() + ": " + e.getMessage(), e);
        }
        return buffer.toByteArray();
    }
    
    public BackupArtifact decode(String key, byte[] data) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                new GZIPInputStream(new ByteArrayInputStream(data)), StandardCharsets.UTF_8))) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                throw new StorageException(ErrorCode.ARTIFACT_CORRUPT, key, "Artifact is empty");
            }
            ArtifactHeader header = objectMapper.readValue(headerLine, ArtifactHeader.class);
            List<BackupRecord> records = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isEmpty()) {
                    records.add(objectMapper.readValue(line, BackupRecord.class));
                }
            }
            return new BackupArtifact(header, records);
        } catch (JsonProcessingException e) {
            throw new StorageException(ErrorCode.ARTIFACT_CORRUPT, key, "Malformed artifact line: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new StorageException(ErrorCode.ARTIFACT_CORRUPT, key, "Unreadable artifact: " + e.getMessage(), e);
        }
    }
    
    /**
     * Uncompressed size of the JSON Lines payload.
     */
    public long rawSize(ArtifactHeader header, List<BackupRecord> records) {
        try {
            long size = objectMapper.writeValueAsBytes(header).length + 1L;
            for (BackupRecord record : records) {
                size += objectMapper.writeValueAsBytes(record).length + 1L;
            }
            return size;
        } catch (JsonProcessingException e) {
            throw new StorageException(ErrorCode.SERIALIZATION_ERROR, null, "Failed to size artifact: " + e.getMessage(), e);
        }
    }
    
    private static final class LeveledGzipOutputStream extends GZIPOutputStream {
        LeveledGzipOutputStream(OutputStream out, int level) throws IOException {
            super(out);
            def.setLevel(level);
        }
    }
}
