package com.platform.drengine.backup;

/**
 * Artifact compression, mapped onto deflate levels.
 */
public enum CompressionLevel {
    NONE(0),
    LOW(1),
    MEDIUM(5),
    HIGH(7),
    MAXIMUM(9);
    
    private final int deflateLevel;
    
    CompressionLevel(int deflateLevel) {
        this.deflateLevel = deflateLevel;
    }
    
    public int getDeflateLevel() {
        return deflateLevel;
    }
}
