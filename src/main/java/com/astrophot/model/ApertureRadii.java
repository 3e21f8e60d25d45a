package com.astrophot.model;

import java.util.Locale;

public final class ApertureRadii {
    public final double sourceRadius;
    public final double innerSkyRadius;
    public final double outerSkyRadius;

    public ApertureRadii(double sourceRadius, double innerSkyRadius, double outerSkyRadius) {
        if (!(sourceRadius > 0 && sourceRadius < innerSkyRadius && innerSkyRadius < outerSkyRadius)
                || !Double.isFinite(outerSkyRadius)) {
            throw new InvalidApertureException(String.format(Locale.US,
                    "Radios invalidos: fuente=%.2f, cielo=[%.2f, %.2f]", sourceRadius, innerSkyRadius, outerSkyRadius));
        }
        this.sourceRadius = sourceRadius;
        this.innerSkyRadius = innerSkyRadius;
        this.outerSkyRadius = outerSkyRadius;
    }

    public static ApertureRadii defaults() { return new ApertureRadii(9, 12, 17); }

    public static ApertureRadii fromPreferences() {
        return new ApertureRadii(PhotometryConfig.getSourceRadius(),
                PhotometryConfig.getInnerSkyRadius(), PhotometryConfig.getOuterSkyRadius());
    }

    public ApertureSpec at(PixelPosition center) { return new ApertureSpec(center, this); }

    @Override
    public String toString() {
        return String.format(Locale.US, "r=%.1f sky=[%.1f, %.1f]", sourceRadius, innerSkyRadius, outerSkyRadius);
    }
}
