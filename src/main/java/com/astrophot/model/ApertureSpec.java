package com.astrophot.model;

import java.util.Objects;

public final class ApertureSpec {
    public final PixelPosition center;
    public final ApertureRadii radii;

    public ApertureSpec(PixelPosition center, ApertureRadii radii) {
        this.center = Objects.requireNonNull(center, "center");
        this.radii = Objects.requireNonNull(radii, "radii");
    }

    public ApertureSpec(double x, double y, double sourceRadius, double innerSkyRadius, double outerSkyRadius) {
        this(new PixelPosition(x, y), new ApertureRadii(sourceRadius, innerSkyRadius, outerSkyRadius));
    }

    public double sourceRadius() { return radii.sourceRadius; }
    public double innerSkyRadius() { return radii.innerSkyRadius; }
    public double outerSkyRadius() { return radii.outerSkyRadius; }

    @Override
    public String toString() { return "Aperture" + center + " " + radii; }
}
