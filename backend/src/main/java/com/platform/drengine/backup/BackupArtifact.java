package com.platform.drengine.backup;

import java.util.List;

public record BackupArtifact(ArtifactHeader header, List<BackupRecord> records) {
}
