package com.poolpulse.indexer.modules.monitoring;

import lombok.Value;

import java.util.List;

/**
 * Finds distances between adjacent block numbers larger than a threshold.
 */
public final class BlockGapDetector {

    private BlockGapDetector() {
    }

    /**
     * @param sortedBlocks ascending block numbers
     */
    public static GapReport detect(List<Long> sortedBlocks, long threshold) {
        long gapCount = 0;
        long maxGap = 0;
        for (int i = 1; i < sortedBlocks.size(); i++) {
            long gap = sortedBlocks.get(i) - sortedBlocks.get(i - 1);
            if (gap > threshold) {
                gapCount++;
                maxGap = Math.max(maxGap, gap);
            }
        }
        Long min = sortedBlocks.isEmpty() ? null : sortedBlocks.get(0);
        Long max = sortedBlocks.isEmpty() ? null : sortedBlocks.get(sortedBlocks.size() - 1);
        return new GapReport(gapCount, maxGap, min, max);
    }

    @Value
    public static class GapReport {
        long gapCount;
        long maxGap;
        Long minBlock;
        Long maxBlock;
    }
}
