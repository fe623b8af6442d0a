package com.flowmable.optimizer;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * CLI driver that converts image files into print-optimized JPEGs.
 * <p>
 * Inputs may be files or directories (their supported images, non-recursive).
 * Exit code 0 when no file failed, 1 when any did, 2 on a usage error.
 */
public class ConverterDriver {

    private static final Logger LOG = LoggerFactory.getLogger(ConverterDriver.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;

    static class Parameters {

        @Parameter(description = "Image files or directories to convert")
        List<String> inputs = new ArrayList<>();

        @Parameter(names = {"-q", "--quality"}, description = "JPEG quality 0-100 (default: $PRINT_OPTIMIZER_QUALITY or 100)")
        Integer quality;

        @Parameter(names = {"-o", "--output-dir"}, description = "Directory for converted files (default: next to each input)")
        String outputDir;

        @Parameter(names = "--no-overwrite", description = "Skip files whose output already exists")
        boolean noOverwrite;

        @Parameter(names = {"-v", "--verbose"}, description = "Log per-image metrics and parameters")
        boolean verbose;

        @Parameter(names = {"-w", "--workers"}, description = "Parallel workers (default: available processors)")
        Integer workers;

        @Parameter(names = "--no-metrics", description = "Do not write .metrics.json sidecars")
        boolean noMetrics;

        @Parameter(names = "--no-natural-appearance", description = "Allow stronger corrections")
        boolean noNaturalAppearance;

        @Parameter(names = "--no-preserve-highlights", description = "Do not force highlight recovery")
        boolean noPreserveHighlights;

        @Parameter(names = "--no-stable-skin-tones", description = "Saturate skin tones like other hues")
        boolean noStableSkinTones;

        @Parameter(names = "--no-avoid-filter-look", description = "Lift the gentleness ceiling on adjustments")
        boolean noAvoidFilterLook;

        @Parameter(names = {"-h", "--help"}, description = "Display this note", help = true)
        boolean help;

        StylePreferences stylePreferences() {
            return new StylePreferences(!noNaturalAppearance, !noPreserveHighlights,
                    !noStableSkinTones, !noAvoidFilterLook);
        }
    }

    public static void main(String[] args) {
        System.exit(new ConverterDriver().run(args, System.out));
    }

    int run(String[] args, PrintStream out) {
        Parameters params = new Parameters();
        JCommander commander = JCommander.newBuilder()
                .addObject(params)
                .programName("print-optimizer")
                .build();
        try {
            commander.parse(args);
        } catch (ParameterException e) {
            out.println("ERROR: failed to parse command line arguments: " + e.getMessage());
            commander.usage();
            return EXIT_USAGE;
        }
        if (params.help) {
            commander.usage();
            return EXIT_OK;
        }
        // Unrecognized options end up among the main parameters
        for (String input : params.inputs) {
            if (input.startsWith("-")) {
                out.println("ERROR: unknown option " + input);
                commander.usage();
                return EXIT_USAGE;
            }
        }
        if (params.inputs.isEmpty()) {
            out.println("ERROR: no input files given");
            commander.usage();
            return EXIT_USAGE;
        }

        if (params.verbose) {
            setRootLogLevel(Level.DEBUG);
        }

        ConversionConfig config;
        try {
            config = ConversionConfig.builder()
                    .quality(params.quality)
                    .outputDir(params.outputDir != null ? Paths.get(params.outputDir) : null)
                    .noOverwrite(params.noOverwrite)
                    .verbose(params.verbose)
                    .workers(params.workers)
                    .writeMetrics(!params.noMetrics)
                    .stylePreferences(params.stylePreferences())
                    .build();
        } catch (IllegalArgumentException e) {
            out.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        List<Path> inputs = collectInputs(params.inputs);
        LOG.info("run: quality {}, {} inputs", config.quality(), inputs.size());

        BatchResults results = new BatchConverter(config).convertAll(inputs,
                (completed, total, result) -> out.printf("[%d/%d] %s %s%n",
                        completed, total, result.status(), result.inputPath().getFileName()));

        printSummary(results, out);
        return results.hasFailures() ? EXIT_FAILURES : EXIT_OK;
    }

    /**
     * Expands directories to the supported images they contain, sorted by name.
     * Plain paths are passed through so that missing files are reported as failures.
     */
    static List<Path> collectInputs(List<String> arguments) {
        List<Path> inputs = new ArrayList<>();
        for (String argument : arguments) {
            Path path = Paths.get(argument);
            if (Files.isDirectory(path)) {
                try (Stream<Path> children = Files.list(path)) {
                    children.filter(Files::isRegularFile)
                            .filter(ImageConverter::isSupported)
                            .sorted()
                            .forEach(inputs::add);
                } catch (IOException e) {
                    LOG.warn("collectInputs: cannot list {}", path, e);
                }
            } else {
                inputs.add(path);
            }
        }
        return inputs;
    }

    static void printSummary(BatchResults results, PrintStream out) {
        out.println();
        out.printf("Converted: %d, Failed: %d, Skipped: %d (success rate %.1f%%, %d ms)%n",
                results.successful(), results.failed(), results.skipped(),
                results.successRate(), results.totalMillis());
        for (ConversionResult result : results.results()) {
            if (result.status() == ConversionStatus.FAILED) {
                out.println("  FAILED " + result.inputPath() + ": " + result.errorMessage());
            }
        }
    }

    private static void setRootLogLevel(Level level) {
        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        loggerContext.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
    }
}
