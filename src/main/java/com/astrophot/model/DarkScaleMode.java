package com.astrophot.model;

public enum DarkScaleMode {
    // Factor fijo inyectado por configuracion
    FIXED,
    // EXPTIME light / EXPTIME dark cuando ambos están en los metadatos; si no, el factor fijo
    EXPOSURE_RATIO,
    // Factor por canal estimado con la mediana robusta del cociente light/dark
    OPTIMIZED
}
