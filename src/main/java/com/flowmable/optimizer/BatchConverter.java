package com.flowmable.optimizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Converts many files in parallel, one task per image.
 * <p>
 * Workers share only the immutable {@link ImageConverter}. One file's failure
 * never aborts the batch; results come back in input order. Output paths are
 * planned up front so that no two files of a batch write the same output.
 */
public class BatchConverter {

    private static final Logger LOG = LoggerFactory.getLogger(BatchConverter.class);

    /** Called on a worker thread after each file finishes. */
    @FunctionalInterface
    public interface ProgressListener {
        void onProgress(int completed, int total, ConversionResult result);
    }

    private final ConversionConfig config;
    private final ImageConverter converter;

    public BatchConverter(ConversionConfig config) {
        this(config, new ImageConverter(config));
    }

    BatchConverter(ConversionConfig config, ImageConverter converter) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
    }

    public BatchResults convertAll(List<Path> inputs) {
        return convertAll(inputs, (completed, total, result) -> {});
    }

    public BatchResults convertAll(List<Path> inputs, ProgressListener listener) {
        long start = System.currentTimeMillis();
        if (inputs.isEmpty()) {
            return new BatchResults(List.of(), 0L);
        }

        int workers = Math.min(config.effectiveWorkers(), inputs.size());
        LOG.info("convertAll: converting {} files with {} workers", inputs.size(), workers);

        List<Path> outputs = planOutputPaths(inputs);
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        AtomicInteger completed = new AtomicInteger();
        List<Future<ConversionResult>> futures = new ArrayList<>(inputs.size());
        try {
            for (int i = 0; i < inputs.size(); i++) {
                Path input = inputs.get(i);
                Path output = outputs.get(i);
                futures.add(executor.submit(() -> {
                    ConversionResult result = converter.convert(input, output);
                    listener.onProgress(completed.incrementAndGet(), inputs.size(), result);
                    return result;
                }));
            }

            List<ConversionResult> results = new ArrayList<>(inputs.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), inputs.get(i)));
            }

            BatchResults batch = new BatchResults(results, System.currentTimeMillis() - start);
            LOG.info("convertAll: {} succeeded, {} failed, {} skipped in {} ms",
                     batch.successful(), batch.failed(), batch.skipped(), batch.totalMillis());
            return batch;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * One output path per input, in input order. An output already claimed by
     * an earlier file, or equal to one of the inputs, gets the source extension
     * appended to its name, then an ordinal.
     */
    List<Path> planOutputPaths(List<Path> inputs) {
        Set<Path> claimed = new HashSet<>();
        for (Path input : inputs) {
            claimed.add(normalize(input));
        }
        List<Path> planned = new ArrayList<>(inputs.size());
        for (Path input : inputs) {
            Path base = converter.outputPathFor(input);
            Path output = base;
            int ordinal = 0;
            while (!claimed.add(normalize(output))) {
                output = withCollisionSuffix(base, input, ordinal++);
            }
            if (!output.equals(base)) {
                LOG.warn("planOutputPaths: {} collides on {}, writing {} instead",
                         input.getFileName(), base.getFileName(), output.getFileName());
            }
            planned.add(output);
        }
        return planned;
    }

    static Path withCollisionSuffix(Path base, Path input, int ordinal) {
        String baseName = base.getFileName().toString();
        int baseDot = baseName.lastIndexOf('.');
        String stem = baseDot > 0 ? baseName.substring(0, baseDot) : baseName;
        String extension = baseDot > 0 ? baseName.substring(baseDot) : "";

        String inputName = input.getFileName().toString();
        int inputDot = inputName.lastIndexOf('.');
        String source = inputDot > 0 ? inputName.substring(inputDot + 1).toLowerCase(Locale.ROOT) : "copy";

        return base.resolveSibling(stem + "_" + source + (ordinal == 0 ? "" : "_" + ordinal) + extension);
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private ConversionResult await(Future<ConversionResult> future, Path input) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ConversionResult.failed(input, "interrupted", 0L);
        } catch (ExecutionException e) {
            LOG.error("convertAll: unexpected failure converting {}", input, e.getCause());
            return ConversionResult.failed(input, String.valueOf(e.getCause()), 0L);
        }
    }
}
