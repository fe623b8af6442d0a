package com.flowmable.optimizer;

import com.drew.metadata.Metadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end file conversion against real encoders in a temporary directory.
 */
class ImageConverterTest {

    @TempDir
    Path tempDir;

    private static ConversionConfig.Builder config() {
        return ConversionConfig.builder().environment(java.util.Map.of()).quality(90);
    }

    @Test
    void convert_pngToJpegWithSidecar() throws Exception {
        Path input = TestImages.writeImage(TestImages.skinPatch(64, 48, 24), tempDir.resolve("portrait.png"), "png");

        ConversionResult result = new ImageConverter(config().build()).convert(input);

        assertEquals(ConversionStatus.SUCCESS, result.status(), result.errorMessage());
        assertEquals(tempDir.resolve("portrait.jpg"), result.outputPath());
        assertNotNull(result.metrics());
        assertNotNull(result.params());
        assertTrue(result.metrics().skinToneDetected());

        BufferedImage decoded = ImageIO.read(result.outputPath().toFile());
        assertEquals(64, decoded.getWidth());
        assertEquals(48, decoded.getHeight());
        assertTrue(Files.exists(tempDir.resolve("portrait.metrics.json")));
    }

    @Test
    void convert_jpegNextToItselfGetsSuffix() throws Exception {
        Path input = TestImages.writeImage(TestImages.backlit(50, 40), tempDir.resolve("scene.jpg"), "jpg");
        byte[] original = Files.readAllBytes(input);

        ConversionResult result = new ImageConverter(config().build()).convert(input);

        assertEquals(ConversionStatus.SUCCESS, result.status(), result.errorMessage());
        assertEquals(tempDir.resolve("scene_print.jpg"), result.outputPath());
        assertArrayEquals(original, Files.readAllBytes(input), "The source must not be overwritten");
        assertNotNull(ImageIO.read(result.outputPath().toFile()));
    }

    @Test
    void convert_writesIntoOutputDirectory() throws Exception {
        Path input = TestImages.writeImage(TestImages.gradient(32, 32), tempDir.resolve("ramp.png"), "png");
        Path outDir = tempDir.resolve("nested").resolve("out");

        ConversionResult result = new ImageConverter(config().outputDir(outDir).writeMetrics(false).build())
                .convert(input);

        assertEquals(ConversionStatus.SUCCESS, result.status(), result.errorMessage());
        assertEquals(outDir.resolve("ramp.jpg"), result.outputPath());
        assertTrue(Files.exists(outDir.resolve("ramp.jpg")));
        assertFalse(Files.exists(outDir.resolve("ramp.metrics.json")));
    }

    @Test
    void convert_skipsExistingOutputWhenNoOverwrite() throws Exception {
        Path input = TestImages.writeImage(TestImages.midGray(), tempDir.resolve("gray.png"), "png");
        Path existing = Files.write(tempDir.resolve("gray.jpg"), new byte[]{42});

        ConversionResult result = new ImageConverter(config().noOverwrite(true).build()).convert(input);

        assertEquals(ConversionStatus.SKIPPED, result.status());
        assertArrayEquals(new byte[]{42}, Files.readAllBytes(existing));
    }

    @Test
    void convert_overwritesExistingOutputByDefault() throws Exception {
        Path input = TestImages.writeImage(TestImages.midGray(), tempDir.resolve("gray.png"), "png");
        Files.write(tempDir.resolve("gray.jpg"), new byte[]{42});

        ConversionResult result = new ImageConverter(config().build()).convert(input);

        assertEquals(ConversionStatus.SUCCESS, result.status(), result.errorMessage());
        assertNotNull(ImageIO.read(tempDir.resolve("gray.jpg").toFile()));
    }

    @Test
    void convert_reportsInvalidInputsAsFailures() throws Exception {
        ImageConverter converter = new ImageConverter(config().build());

        ConversionResult missing = converter.convert(tempDir.resolve("missing.png"));
        assertEquals(ConversionStatus.FAILED, missing.status());
        assertTrue(missing.errorMessage().contains("not found"), missing.errorMessage());

        Path text = Files.writeString(tempDir.resolve("notes.txt"), "hello");
        ConversionResult unsupported = converter.convert(text);
        assertEquals(ConversionStatus.FAILED, unsupported.status());
        assertTrue(unsupported.errorMessage().contains("unsupported"), unsupported.errorMessage());

        Path corrupt = Files.write(tempDir.resolve("corrupt.png"), new byte[]{0, 1, 2, 3, 4, 5});
        ConversionResult undecodable = converter.convert(corrupt);
        assertEquals(ConversionStatus.FAILED, undecodable.status());
        assertNull(undecodable.outputPath());
    }

    @Test
    void convert_survivesMalformedMetadata() throws Exception {
        Path input = TestImages.writeImage(TestImages.gradient(32, 24), tempDir.resolve("odd.png"), "png");
        MetadataReader malformed = new MetadataReader() {
            @Override
            Metadata extract(Path imagePath) {
                throw new IllegalStateException("bad segment");
            }
        };
        ImageConverter converter = new ImageConverter(config().build(), malformed, new ImageAnalyzer(),
                new TransformPipeline(), new MetricsWriter());

        ConversionResult result = converter.convert(input);

        assertEquals(ConversionStatus.SUCCESS, result.status(), result.errorMessage());
        assertTrue(result.metrics().captureMetadata().isUnknown());
    }

    @Test
    void outputPathFor_usesJpgExtension() {
        ImageConverter converter = new ImageConverter(config().outputDir(tempDir).build());

        assertEquals(tempDir.resolve("IMG_0001.jpg"), converter.outputPathFor(Path.of("photos", "IMG_0001.HEIC")));
        assertEquals(tempDir.resolve("archive.tar.jpg"), converter.outputPathFor(Path.of("archive.tar.png")));
    }
}
