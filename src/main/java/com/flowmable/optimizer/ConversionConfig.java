package com.flowmable.optimizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Run-wide settings for file conversion, shared read-only by all workers.
 *
 * @param quality          JPEG quality [0, 100]
 * @param outputDir        Directory for outputs; null writes next to each input
 * @param noOverwrite      Skip inputs whose output already exists
 * @param verbose          Debug-level logging
 * @param workers          Worker thread count; null uses the available processors
 * @param writeMetrics     Write a {@code .metrics.json} sidecar per output
 * @param stylePreferences Parameter derivation bias
 */
public record ConversionConfig(
        int quality,
        Path outputDir,
        boolean noOverwrite,
        boolean verbose,
        Integer workers,
        boolean writeMetrics,
        StylePreferences stylePreferences
) {
    private static final Logger LOG = LoggerFactory.getLogger(ConversionConfig.class);

    public static final String QUALITY_ENV = "PRINT_OPTIMIZER_QUALITY";
    public static final int DEFAULT_QUALITY = 100;

    public ConversionConfig {
        if (quality < 0 || quality > 100) {
            throw new IllegalArgumentException("quality must be within [0, 100], got " + quality);
        }
        if (workers != null && workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got " + workers);
        }
        Objects.requireNonNull(stylePreferences, "stylePreferences must not be null");
    }

    public int effectiveWorkers() {
        return workers != null ? workers : Runtime.getRuntime().availableProcessors();
    }

    /**
     * Quality precedence: a valid explicit value, then a valid
     * {@value #QUALITY_ENV} environment value, then {@value #DEFAULT_QUALITY}.
     */
    public static int resolveQuality(Integer explicit, Map<String, String> environment) {
        if (explicit != null) {
            if (isValidQuality(explicit)) {
                return explicit;
            }
            LOG.warn("resolveQuality: ignoring out of range quality {}", explicit);
        }
        String fromEnv = environment.get(QUALITY_ENV);
        if (fromEnv != null) {
            try {
                int parsed = Integer.parseInt(fromEnv.trim());
                if (isValidQuality(parsed)) {
                    return parsed;
                }
                LOG.warn("resolveQuality: ignoring out of range {}={}", QUALITY_ENV, fromEnv);
            } catch (NumberFormatException e) {
                LOG.warn("resolveQuality: ignoring non-numeric {}={}", QUALITY_ENV, fromEnv);
            }
        }
        return DEFAULT_QUALITY;
    }

    private static boolean isValidQuality(int quality) {
        return quality >= 0 && quality <= 100;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Integer quality;
        private Path outputDir;
        private boolean noOverwrite;
        private boolean verbose;
        private Integer workers;
        private boolean writeMetrics = true;
        private StylePreferences stylePreferences = StylePreferences.DEFAULT;
        private Map<String, String> environment = System.getenv();

        private Builder() {}

        public Builder quality(Integer quality) {
            this.quality = quality;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder noOverwrite(boolean noOverwrite) {
            this.noOverwrite = noOverwrite;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder workers(Integer workers) {
            this.workers = workers;
            return this;
        }

        public Builder writeMetrics(boolean writeMetrics) {
            this.writeMetrics = writeMetrics;
            return this;
        }

        public Builder stylePreferences(StylePreferences stylePreferences) {
            this.stylePreferences = stylePreferences;
            return this;
        }

        /** Environment consulted for the quality fallback; defaults to the process environment. */
        public Builder environment(Map<String, String> environment) {
            this.environment = Objects.requireNonNull(environment, "environment must not be null");
            return this;
        }

        public ConversionConfig build() {
            return new ConversionConfig(resolveQuality(quality, environment), outputDir, noOverwrite,
                    verbose, workers, writeMetrics, stylePreferences);
        }
    }
}
