package com.platform.drengine.storage;

/**
 * Durable object storage for backup artifacts.
 * Keys are relative, slash separated paths. Checksums are lowercase SHA-256 hex.
 */
public interface StorageBackend {

    /**
     * Stores the bytes atomically under the key, replacing any previous object.
     *
     * @return checksum of the stored bytes
     */
    String put(String key, byte[] data);

    byte[] get(String key);

    /**
     * Reads up to {@code length} bytes starting at {@code offset}. Shorter near the end of the object.
     */
    byte[] getRange(String key, long offset, int length);

    void delete(String key);

    boolean exists(String key);

    long size(String key);
}
