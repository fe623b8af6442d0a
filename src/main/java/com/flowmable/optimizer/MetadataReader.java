package com.flowmable.optimizer;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifSubIFDDirectory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads {@link CaptureMetadata} from the EXIF block of an image file.
 * <p>
 * Every tag is optional. A file with no EXIF, or one that cannot be parsed,
 * yields {@link CaptureMetadata#EMPTY} and a warning; reading never fails the
 * conversion.
 */
public class MetadataReader {

    private static final Logger LOG = LoggerFactory.getLogger(MetadataReader.class);

    private static final Map<Integer, String> SCENE_CAPTURE_TYPES = Map.of(
            0, "standard",
            1, "landscape",
            2, "portrait",
            3, "night"
    );

    private static final Map<Integer, String> METERING_MODES = Map.of(
            0, "unknown",
            1, "average",
            2, "center-weighted-average",
            3, "spot",
            4, "multi-spot",
            5, "pattern",
            6, "partial",
            255, "other"
    );

    public CaptureMetadata read(Path imagePath) {
        try {
            Metadata metadata = extract(imagePath);
            ExifSubIFDDirectory exif = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
            if (exif == null) {
                LOG.debug("read: no EXIF found in {}", imagePath);
                return CaptureMetadata.EMPTY;
            }
            return fromDirectory(exif);
        } catch (ImageProcessingException | IOException e) {
            LOG.warn("read: failed to read metadata from {}, continuing without it", imagePath, e);
            return CaptureMetadata.EMPTY;
        } catch (RuntimeException e) {
            // Malformed segments can surface as unchecked parser errors
            LOG.warn("read: malformed metadata in {}, continuing without it", imagePath, e);
            return CaptureMetadata.EMPTY;
        }
    }

    Metadata extract(Path imagePath) throws ImageProcessingException, IOException {
        return ImageMetadataReader.readMetadata(imagePath.toFile());
    }

    /**
     * Extract the capture fields present in an EXIF sub-IFD directory.
     */
    CaptureMetadata fromDirectory(Directory exif) {
        CaptureMetadata.Builder builder = CaptureMetadata.builder()
                .iso(readIso(exif))
                .exposureTime(exif.getDoubleObject(ExifSubIFDDirectory.TAG_EXPOSURE_TIME))
                .fNumber(exif.getDoubleObject(ExifSubIFDDirectory.TAG_FNUMBER))
                .exposureCompensation(exif.getDoubleObject(ExifSubIFDDirectory.TAG_EXPOSURE_BIAS))
                .brightnessValue(exif.getDoubleObject(ExifSubIFDDirectory.TAG_BRIGHTNESS_VALUE));

        Integer flash = exif.getInteger(ExifSubIFDDirectory.TAG_FLASH);
        if (flash != null) {
            builder.flashFired(flashFired(flash));
        }
        Integer scene = exif.getInteger(ExifSubIFDDirectory.TAG_SCENE_CAPTURE_TYPE);
        if (scene != null) {
            builder.sceneType(sceneTypeName(scene));
        }
        Integer metering = exif.getInteger(ExifSubIFDDirectory.TAG_METERING_MODE);
        if (metering != null) {
            builder.meteringMode(meteringModeName(metering));
        }
        return builder.build();
    }

    private static Integer readIso(Directory exif) {
        Integer iso = exif.getInteger(ExifSubIFDDirectory.TAG_ISO_EQUIVALENT);
        if (iso != null) {
            return iso;
        }
        // Some cameras record one value per sensitivity mode
        int[] values = exif.getIntArray(ExifSubIFDDirectory.TAG_ISO_EQUIVALENT);
        return values != null && values.length > 0 ? values[0] : null;
    }

    /** Bit 0 of the EXIF flash tag. */
    static boolean flashFired(int flashTag) {
        return (flashTag & 0x01) != 0;
    }

    static String sceneTypeName(int sceneCaptureType) {
        return SCENE_CAPTURE_TYPES.getOrDefault(sceneCaptureType, "unknown");
    }

    static String meteringModeName(int meteringMode) {
        return METERING_MODES.getOrDefault(meteringMode, "unknown");
    }
}
