package com.astrophot.model;

public final class TrackStep {

    public enum Quality {
        // Centroide refinado y validado
        ACCEPTED,
        // Validación fallida: se mide en la última posición válida
        STALE,
        // Posición suministrada externamente
        MANUAL,
        // Sin posición: el seguimiento esta perdido
        LOST
    }

    public final TrackState state;
    public final PixelPosition center;
    public final Quality quality;
    public final double movementPixels;

    public TrackStep(TrackState state, PixelPosition center, Quality quality, double movementPixels) {
        this.state = state;
        this.center = center;
        this.quality = quality;
        this.movementPixels = movementPixels;
    }

    public boolean hasCenter() { return center != null; }

    // true solo cuando la posición salio de un refinamiento validado
    public boolean isTracked() { return quality == Quality.ACCEPTED; }
}
