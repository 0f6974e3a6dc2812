package io.mnemo.core.segmentation;

/**
 * @param previousStart window pointer before evaluation
 * @param windowStart window pointer after evaluation; never lower than {@code previousStart}
 */
public record SegmentationDecision(SegmentationTrigger trigger, int previousStart, int windowStart) {

    public static SegmentationDecision unchanged(int windowStart) {
        return new SegmentationDecision(SegmentationTrigger.NONE, windowStart, windowStart);
    }

    public boolean advanced() {
        return windowStart > previousStart;
    }
}
