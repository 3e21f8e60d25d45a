package com.astrophot.model;

public final class FluxMeasurement {
    public final Channel channel;
    public final double rawFlux;
    public final double skyBackgroundTotal;
    public final double correctedFlux;
    public final double poissonNoise;
    public final double skyNoiseContribution;
    public final double totalNoise;
    public final double snr; // NaN si el ruido total es ~0
    public final SkyStatistics sky;
    public final int apertureArea;
    public final int skyAnnulusArea;

    public FluxMeasurement(Channel channel, double rawFlux, double skyBackgroundTotal, double correctedFlux,
                           double poissonNoise, double skyNoiseContribution, double totalNoise, double snr,
                           SkyStatistics sky, int apertureArea, int skyAnnulusArea) {
        this.channel = channel;
        this.rawFlux = rawFlux;
        this.skyBackgroundTotal = skyBackgroundTotal;
        this.correctedFlux = correctedFlux;
        this.poissonNoise = poissonNoise;
        this.skyNoiseContribution = skyNoiseContribution;
        this.totalNoise = totalNoise;
        this.snr = snr;
        this.sky = sky;
        this.apertureArea = apertureArea;
        this.skyAnnulusArea = skyAnnulusArea;
    }

    public boolean hasSnr() { return !Double.isNaN(snr); }

    public double skyPerPixel() { return sky.median; }
    public double skyStd() { return sky.sigma; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FluxMeasurement)) return false;
        FluxMeasurement m = (FluxMeasurement) o;
        return channel == m.channel
                && Double.compare(rawFlux, m.rawFlux) == 0
                && Double.compare(skyBackgroundTotal, m.skyBackgroundTotal) == 0
                && Double.compare(correctedFlux, m.correctedFlux) == 0
                && Double.compare(poissonNoise, m.poissonNoise) == 0
                && Double.compare(skyNoiseContribution, m.skyNoiseContribution) == 0
                && Double.compare(totalNoise, m.totalNoise) == 0
                && Double.compare(snr, m.snr) == 0
                && apertureArea == m.apertureArea
                && skyAnnulusArea == m.skyAnnulusArea;
    }

    @Override
    public int hashCode() {
        int h = channel.hashCode();
        h = 31 * h + Double.hashCode(rawFlux);
        h = 31 * h + Double.hashCode(correctedFlux);
        h = 31 * h + Double.hashCode(totalNoise);
        return 31 * h + apertureArea;
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.US, "%s: flux=%.1f (raw %.1f, sky %.1f) noise=%.2f snr=%.1f",
                channel.prefix(), correctedFlux, rawFlux, skyBackgroundTotal, totalNoise, snr);
    }
}
