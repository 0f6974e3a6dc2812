package io.mnemo.core.segmentation;

public enum SegmentationTrigger {
    NONE,
    COMMIT,
    EXPLICIT,
    THRESHOLD
}
