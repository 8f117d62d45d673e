package com.platform.drengine.backup;

public enum VerificationState {
    NOT_VERIFIED,
    VERIFIED,
    MISMATCH
}
