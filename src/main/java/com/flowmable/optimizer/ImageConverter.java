package com.flowmable.optimizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts one image file into a print-optimized JPEG.
 * <p>
 * Decode, read capture metadata, analyze, derive parameters, transform,
 * encode. JPEG sources keep their native metadata (EXIF included) in the
 * output; when the writer rejects it the image is written without it.
 * <p>
 * Instances are immutable and safe to share between worker threads.
 */
public class ImageConverter {

    private static final Logger LOG = LoggerFactory.getLogger(ImageConverter.class);

    private static final String JPEG_FORMAT = "jpeg";
    private static final String OUTPUT_EXTENSION = ".jpg";
    private static final String COLLISION_SUFFIX = "_print";

    private final ConversionConfig config;
    private final MetadataReader metadataReader;
    private final ImageAnalyzer analyzer;
    private final OptimizationParamGenerator generator;
    private final TransformPipeline pipeline;
    private final MetricsWriter metricsWriter;

    public ImageConverter(ConversionConfig config) {
        this(config, new MetadataReader(), new ImageAnalyzer(), new TransformPipeline(), new MetricsWriter());
    }

    ImageConverter(ConversionConfig config,
                   MetadataReader metadataReader,
                   ImageAnalyzer analyzer,
                   TransformPipeline pipeline,
                   MetricsWriter metricsWriter) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.metadataReader = metadataReader;
        this.analyzer = analyzer;
        this.generator = new OptimizationParamGenerator(config.stylePreferences());
        this.pipeline = pipeline;
        this.metricsWriter = metricsWriter;
    }

    /**
     * Convert one file to {@link #outputPathFor its default output}.
     * Failures are reported in the result, never thrown.
     */
    public ConversionResult convert(Path input) {
        return convert(input, outputPathFor(input));
    }

    /**
     * Convert one file to {@code output}, as planned by a batch.
     */
    public ConversionResult convert(Path input, Path output) {
        long start = System.currentTimeMillis();

        if (config.noOverwrite() && Files.exists(output)) {
            LOG.info("convert: skipping {}, {} already exists", input, output);
            return ConversionResult.skipped(input, output, "output already exists");
        }

        ConversionResult result;
        try {
            result = process(input, output, start);
        } catch (InvalidFileException e) {
            LOG.error("convert: invalid input {}: {}", input, e.getMessage());
            return ConversionResult.failed(input, e.getMessage(), System.currentTimeMillis() - start);
        } catch (ConversionException e) {
            LOG.error("convert: failed to convert {}", input, e);
            return ConversionResult.failed(input, e.getMessage(), System.currentTimeMillis() - start);
        }

        if (config.writeMetrics()) {
            try {
                metricsWriter.write(result);
            } catch (IOException e) {
                LOG.warn("convert: failed to write metrics for {}", output, e);
            }
        }
        return result;
    }

    private ConversionResult process(Path input, Path output, long start) throws ConversionException {
        validateInput(input);

        DecodedImage decoded = decode(input);
        CaptureMetadata capture = metadataReader.read(input);
        PixelArray pixels = PixelArray.fromBufferedImage(decoded.image());

        ImageMetrics metrics = analyzer.analyze(pixels, capture);
        LOG.debug("convert: {} metrics {}", input.getFileName(), metrics);

        OptimizationParams params = generator.generate(metrics);
        LOG.debug("convert: {} params {}", input.getFileName(), params);

        PixelArray optimized = pipeline.apply(pixels, params, metrics);
        encode(optimized.toBufferedImage(), decoded.metadata(), output);

        long elapsed = System.currentTimeMillis() - start;
        LOG.info("convert: wrote {} in {} ms", output, elapsed);
        return ConversionResult.success(input, output, metrics, params, elapsed);
    }

    /**
     * {@code <name>.jpg} in the output directory, or next to the input. An
     * output that would replace its own input gets a suffix instead.
     */
    public Path outputPathFor(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;

        Path dir = config.outputDir() != null ? config.outputDir() : input.toAbsolutePath().getParent();
        Path output = dir.resolve(stem + OUTPUT_EXTENSION);
        if (output.toAbsolutePath().normalize().equals(input.toAbsolutePath().normalize())) {
            output = dir.resolve(stem + COLLISION_SUFFIX + OUTPUT_EXTENSION);
        }
        return output;
    }

    static Set<String> supportedExtensions() {
        return Arrays.stream(ImageIO.getReaderFileSuffixes())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    static boolean isSupported(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && supportedExtensions().contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private void validateInput(Path input) throws InvalidFileException {
        if (!Files.exists(input)) {
            throw new InvalidFileException("file not found: " + input);
        }
        if (!Files.isRegularFile(input)) {
            throw new InvalidFileException("not a regular file: " + input);
        }
        if (!Files.isReadable(input)) {
            throw new InvalidFileException("file is not readable: " + input);
        }
        if (!isSupported(input)) {
            throw new InvalidFileException("unsupported file type: " + input.getFileName());
        }
    }

    private record DecodedImage(BufferedImage image, IIOMetadata metadata) {}

    private DecodedImage decode(Path input) throws InvalidFileException {
        try (ImageInputStream stream = ImageIO.createImageInputStream(input.toFile())) {
            if (stream == null) {
                throw new InvalidFileException("cannot open " + input);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(stream);
            if (!readers.hasNext()) {
                throw new InvalidFileException("no decoder recognizes " + input.getFileName());
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(stream, true);
                BufferedImage image = reader.read(0);
                IIOMetadata metadata = null;
                if (JPEG_FORMAT.equalsIgnoreCase(reader.getFormatName())) {
                    metadata = reader.getImageMetadata(0);
                }
                return new DecodedImage(image, metadata);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new InvalidFileException("failed to decode " + input.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private void encode(BufferedImage image, IIOMetadata sourceMetadata, Path output) throws ProcessingException {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new ProcessingException("cannot create output directory for " + output, e);
        }

        if (sourceMetadata != null) {
            try {
                writeJpeg(image, sourceMetadata, output);
                return;
            } catch (IOException | RuntimeException e) {
                LOG.warn("encode: source metadata rejected for {}, writing without it: {}", output, e.getMessage());
            }
        }
        try {
            writeJpeg(image, null, output);
        } catch (IOException e) {
            throw new ProcessingException("failed to write " + output, e);
        }
    }

    private void writeJpeg(BufferedImage image, IIOMetadata metadata, Path output) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(JPEG_FORMAT);
        if (!writers.hasNext()) {
            throw new IOException("no JPEG encoder available");
        }
        ImageWriter writer = writers.next();
        Files.deleteIfExists(output);
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(output.toFile())) {
            writer.setOutput(stream);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(config.quality() / 100f);
            writer.write(null, new IIOImage(image, null, metadata), param);
        } finally {
            writer.dispose();
        }
    }
}
