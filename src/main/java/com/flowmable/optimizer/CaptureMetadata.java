package com.flowmable.optimizer;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Auxiliary capture information read from the source file.
 * <p>
 * Every field is independently optional ({@code null} = unknown). Absence never
 * raises an error; it only removes one signal from the metric or parameter that
 * would have used it.
 *
 * @param iso                  Sensor sensitivity (ISO speed)
 * @param exposureTime         Shutter time in seconds
 * @param fNumber              Aperture f-number
 * @param exposureCompensation Exposure bias in EV
 * @param flashFired           Whether the flash fired
 * @param sceneType            Scene capture type (standard, landscape, portrait, night)
 * @param brightnessValue      APEX brightness value
 * @param meteringMode         Metering mode name
 */
public record CaptureMetadata(
        Integer iso,
        Double exposureTime,
        Double fNumber,
        Double exposureCompensation,
        Boolean flashFired,
        String sceneType,
        Double brightnessValue,
        String meteringMode
) {
    /** No metadata available: analysis falls back to image-only heuristics. */
    public static final CaptureMetadata EMPTY = builder().build();

    public boolean hasIso() {
        return iso != null;
    }

    public boolean hasExposureTime() {
        return exposureTime != null;
    }

    public boolean hasExposureCompensation() {
        return exposureCompensation != null;
    }

    /** True only when the flash is known to have fired. */
    public boolean flashKnownFired() {
        return Boolean.TRUE.equals(flashFired);
    }

    @JsonIgnore
    public boolean isUnknown() {
        return equals(EMPTY);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Incremental construction for readers that discover fields one tag at a time.
     */
    public static final class Builder {
        private Integer iso;
        private Double exposureTime;
        private Double fNumber;
        private Double exposureCompensation;
        private Boolean flashFired;
        private String sceneType;
        private Double brightnessValue;
        private String meteringMode;

        private Builder() {}

        public Builder iso(Integer iso) {
            this.iso = iso;
            return this;
        }

        public Builder exposureTime(Double exposureTime) {
            this.exposureTime = exposureTime;
            return this;
        }

        public Builder fNumber(Double fNumber) {
            this.fNumber = fNumber;
            return this;
        }

        public Builder exposureCompensation(Double exposureCompensation) {
            this.exposureCompensation = exposureCompensation;
            return this;
        }

        public Builder flashFired(Boolean flashFired) {
            this.flashFired = flashFired;
            return this;
        }

        public Builder sceneType(String sceneType) {
            this.sceneType = sceneType;
            return this;
        }

        public Builder brightnessValue(Double brightnessValue) {
            this.brightnessValue = brightnessValue;
            return this;
        }

        public Builder meteringMode(String meteringMode) {
            this.meteringMode = meteringMode;
            return this;
        }

        public CaptureMetadata build() {
            return new CaptureMetadata(iso, exposureTime, fNumber, exposureCompensation,
                    flashFired, sceneType, brightnessValue, meteringMode);
        }
    }
}
