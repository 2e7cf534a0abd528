package com.sky.association.core.model;

/**
 * Highest pipeline step completed for an image.
 * Stages are strictly ordered; a stage requires its predecessor.
 */
public enum ProcessingStage {
    READ(1),
    EXTRACTED(2),
    ASSOCIATED(3),
    CATALOG_MATCHED(4);

    private final int code;

    ProcessingStage(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isAtLeast(ProcessingStage other) {
        return this.code >= other.code;
    }

    public static ProcessingStage fromCode(int code) {
        for (ProcessingStage stage : values()) {
            if (stage.code == code) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown processing stage: " + code);
    }
}
