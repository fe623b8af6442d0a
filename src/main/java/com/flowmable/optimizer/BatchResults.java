package com.flowmable.optimizer;

import java.util.List;

/**
 * Per-file results of a batch run, in input order.
 *
 * @param results     One result per input file
 * @param totalMillis Wall time of the whole batch
 */
public record BatchResults(List<ConversionResult> results, long totalMillis) {

    public BatchResults {
        results = List.copyOf(results);
    }

    public int total() {
        return results.size();
    }

    public long successful() {
        return count(ConversionStatus.SUCCESS);
    }

    public long failed() {
        return count(ConversionStatus.FAILED);
    }

    public long skipped() {
        return count(ConversionStatus.SKIPPED);
    }

    /**
     * Successful conversions as a percentage of all files; 0 for an empty batch.
     */
    public double successRate() {
        return results.isEmpty() ? 0.0 : 100.0 * successful() / results.size();
    }

    public boolean hasFailures() {
        return failed() > 0;
    }

    private long count(ConversionStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }
}
