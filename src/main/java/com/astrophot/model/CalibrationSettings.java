package com.astrophot.model;

import java.util.Objects;

public final class CalibrationSettings {
    public final double exposureScale;
    public final DarkScaleMode darkScaleMode;
    public final double flatFloor;
    public final boolean clipNegative;

    private CalibrationSettings(Builder b) {
        if (!(b.exposureScale >= 0) || !Double.isFinite(b.exposureScale)) {
            throw new IllegalArgumentException("exposureScale invalido: " + b.exposureScale);
        }
        if (!(b.flatFloor > 0)) throw new IllegalArgumentException("flatFloor debe ser > 0");
        this.exposureScale = b.exposureScale;
        this.darkScaleMode = Objects.requireNonNull(b.darkScaleMode, "darkScaleMode");
        this.flatFloor = b.flatFloor;
        this.clipNegative = b.clipNegative;
    }

    public static CalibrationSettings defaults() { return builder().build(); }

    public static CalibrationSettings fromPreferences() {
        return builder()
                .exposureScale(PhotometryConfig.getExposureScale())
                .darkScaleMode(PhotometryConfig.getDarkScaleMode())
                .build();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private double exposureScale = 1.0;
        private DarkScaleMode darkScaleMode = DarkScaleMode.EXPOSURE_RATIO;
        private double flatFloor = 1e-6;
        private boolean clipNegative = false;

        private Builder() {}

        public Builder exposureScale(double v) { exposureScale = v; return this; }
        public Builder darkScaleMode(DarkScaleMode v) { darkScaleMode = v; return this; }
        public Builder flatFloor(double v) { flatFloor = v; return this; }
        public Builder clipNegative(boolean v) { clipNegative = v; return this; }

        public CalibrationSettings build() { return new CalibrationSettings(this); }
    }
}
