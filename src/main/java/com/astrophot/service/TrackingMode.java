package com.astrophot.service;

public enum TrackingMode {
    // Centroide refinado y validado en cada frame
    AUTOMATIC,
    // Posiciones fijadas externamente, sin validación
    MANUAL
}
