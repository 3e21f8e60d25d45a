package com.astrophot.model;

// Parámetros del centroide, de su validación y de la predicción por momento.
public final class TrackingTolerances {
    public final int searchRadius;
    public final double maxMovement;
    public final int maxConsecutiveFailures;
    public final double weightExponent;
    public final int refineIterations;
    public final int refineWindowRadius;
    public final double validationSigma;
    public final int validationWindowRadius;
    public final int edgeMargin;
    public final boolean refineFirstFrame;
    public final boolean momentum;
    public final int historySize;

    private TrackingTolerances(Builder b) {
        if (b.searchRadius < 1) throw new IllegalArgumentException("searchRadius debe ser >= 1");
        if (!(b.maxMovement > 0)) throw new IllegalArgumentException("maxMovement debe ser > 0");
        if (b.maxConsecutiveFailures < 0) throw new IllegalArgumentException("maxConsecutiveFailures debe ser >= 0");
        if (!(b.weightExponent > 0)) throw new IllegalArgumentException("weightExponent debe ser > 0");
        if (b.refineIterations < 1) throw new IllegalArgumentException("refineIterations debe ser >= 1");
        if (b.refineWindowRadius < 1) throw new IllegalArgumentException("refineWindowRadius debe ser >= 1");
        if (b.historySize < 2) throw new IllegalArgumentException("historySize debe ser >= 2");
        this.searchRadius = b.searchRadius;
        this.maxMovement = b.maxMovement;
        this.maxConsecutiveFailures = b.maxConsecutiveFailures;
        this.weightExponent = b.weightExponent;
        this.refineIterations = b.refineIterations;
        this.refineWindowRadius = b.refineWindowRadius;
        this.validationSigma = b.validationSigma;
        this.validationWindowRadius = b.validationWindowRadius;
        this.edgeMargin = b.edgeMargin;
        this.refineFirstFrame = b.refineFirstFrame;
        this.momentum = b.momentum;
        this.historySize = b.historySize;
    }

    public static TrackingTolerances defaults() { return builder().build(); }

    public static TrackingTolerances fromPreferences() {
        return builder()
                .searchRadius(PhotometryConfig.getSearchRadius())
                .maxMovement(PhotometryConfig.getMaxMovement())
                .maxConsecutiveFailures(PhotometryConfig.getMaxConsecutiveFailures())
                .weightExponent(PhotometryConfig.getCentroidWeightExponent())
                .momentum(PhotometryConfig.isMomentumEnabled())
                .build();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int searchRadius = 25;
        private double maxMovement = 12.0;
        private int maxConsecutiveFailures = 5;
        private double weightExponent = 1.0;
        private int refineIterations = 3;
        private int refineWindowRadius = 7;
        private double validationSigma = 3.0;
        private int validationWindowRadius = 5;
        private int edgeMargin = 5;
        private boolean refineFirstFrame = false;
        private boolean momentum = true;
        private int historySize = 5;

        private Builder() {}

        public Builder searchRadius(int v) { searchRadius = v; return this; }
        public Builder maxMovement(double v) { maxMovement = v; return this; }
        public Builder maxConsecutiveFailures(int v) { maxConsecutiveFailures = v; return this; }
        public Builder weightExponent(double v) { weightExponent = v; return this; }
        public Builder refineIterations(int v) { refineIterations = v; return this; }
        public Builder refineWindowRadius(int v) { refineWindowRadius = v; return this; }
        public Builder validationSigma(double v) { validationSigma = v; return this; }
        public Builder validationWindowRadius(int v) { validationWindowRadius = v; return this; }
        public Builder edgeMargin(int v) { edgeMargin = v; return this; }
        // Por defecto el primer frame se mide en la semilla tal cual
        public Builder refineFirstFrame(boolean v) { refineFirstFrame = v; return this; }
        public Builder momentum(boolean v) { momentum = v; return this; }
        public Builder historySize(int v) { historySize = v; return this; }

        public TrackingTolerances build() { return new TrackingTolerances(this); }
    }
}
