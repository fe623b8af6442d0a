package com.flowmable.optimizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists the analysis and parameters of a conversion as a JSON sidecar
 * next to the output, named {@code <output name>.metrics.json}.
 */
public class MetricsWriter {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsWriter.class);

    static final String SUFFIX = ".metrics.json";

    /**
     * Sidecar layout. Capture metadata is reported separately and omitted when
     * nothing was recorded.
     */
    record MetricsReport(
            String inputFile,
            String outputFile,
            long processingTimeMillis,
            ImageMetrics analysisMetrics,
            CaptureMetadata exifMetadata,
            OptimizationParams optimizationParams
    ) {}

    public static Path metricsPath(Path outputPath) {
        String name = outputPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return outputPath.resolveSibling(stem + SUFFIX);
    }

    /**
     * Write the sidecar for a successful conversion.
     *
     * @return the sidecar path
     * @throws IOException if the file cannot be written
     */
    public Path write(ConversionResult result) throws IOException {
        if (!result.succeeded() || result.metrics() == null || result.outputPath() == null) {
            throw new IllegalArgumentException("metrics can only be written for a successful conversion");
        }
        CaptureMetadata capture = result.metrics().captureMetadata();
        MetricsReport report = new MetricsReport(
                result.inputPath().toString(),
                result.outputPath().toString(),
                result.processingMillis(),
                result.metrics(),
                capture.isUnknown() ? null : capture,
                result.params()
        );
        Path path = metricsPath(result.outputPath());
        JsonUtils.MAPPER.writeValue(path.toFile(), report);
        LOG.debug("write: persisted metrics to {}", path);
        return path;
    }
}
