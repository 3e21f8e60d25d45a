package com.astrophot.model;

public final class SkyStatistics {
    public final double median;
    public final double sigma;
    public final double mean;
    public final int pixelsUsed;
    public final int pixelsRejected;

    public SkyStatistics(double median, double sigma, double mean, int pixelsUsed, int pixelsRejected) {
        this.median = median;
        this.sigma = sigma;
        this.mean = mean;
        this.pixelsUsed = pixelsUsed;
        this.pixelsRejected = pixelsRejected;
    }
}
