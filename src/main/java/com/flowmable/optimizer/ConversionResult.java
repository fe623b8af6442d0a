package com.flowmable.optimizer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of converting one input file.
 *
 * @param inputPath        Source file
 * @param outputPath       Written (or already existing, when skipped) JPEG; null on failure
 * @param status           Outcome
 * @param errorMessage     Failure or skip reason; null on success
 * @param metrics          Analysis of the source image; null unless converted
 * @param params           Parameters applied; null unless converted
 * @param processingMillis Wall time spent on this file
 */
public record ConversionResult(
        Path inputPath,
        Path outputPath,
        ConversionStatus status,
        String errorMessage,
        ImageMetrics metrics,
        OptimizationParams params,
        long processingMillis
) {
    public ConversionResult {
        Objects.requireNonNull(inputPath, "inputPath must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public static ConversionResult success(Path input, Path output, ImageMetrics metrics,
                                           OptimizationParams params, long millis) {
        return new ConversionResult(input, output, ConversionStatus.SUCCESS, null, metrics, params, millis);
    }

    public static ConversionResult skipped(Path input, Path output, String reason) {
        return new ConversionResult(input, output, ConversionStatus.SKIPPED, reason, null, null, 0L);
    }

    public static ConversionResult failed(Path input, String message, long millis) {
        return new ConversionResult(input, null, ConversionStatus.FAILED, message, null, null, millis);
    }

    public boolean succeeded() {
        return status == ConversionStatus.SUCCESS;
    }
}
