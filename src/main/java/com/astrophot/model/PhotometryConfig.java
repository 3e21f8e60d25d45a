package com.astrophot.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.prefs.Preferences;

public class PhotometryConfig {
    private static final Logger logger = LoggerFactory.getLogger(PhotometryConfig.class);
    private static final Preferences prefs = Preferences.userNodeForPackage(PhotometryConfig.class);

    // Apertura
    private static final String KEY_SOURCE_RADIUS = "source_radius";
    private static final String KEY_INNER_SKY = "inner_sky_radius";
    private static final String KEY_OUTER_SKY = "outer_sky_radius";

    // Estadística robusta
    private static final String KEY_CLIP_SIGMA = "clip_sigma";
    private static final String KEY_CLIP_ITERS = "clip_iterations";

    // Seguimiento
    private static final String KEY_SEARCH_RADIUS = "search_radius";
    private static final String KEY_MAX_MOVEMENT = "max_movement";
    private static final String KEY_MAX_FAILURES = "max_consecutive_failures";
    private static final String KEY_WEIGHT_EXP = "centroid_weight_exponent";
    private static final String KEY_MOMENTUM = "momentum_prediction";

    // Calibración
    private static final String KEY_EXPOSURE_SCALE = "exposure_scale";
    private static final String KEY_DARK_MODE = "dark_scale_mode";
    private static final String KEY_COMBINE = "combine_method";
    private static final String KEY_WORKERS = "worker_threads";

    public static double getSourceRadius() { return prefs.getDouble(KEY_SOURCE_RADIUS, 9.0); }
    public static void setSourceRadius(double v) { prefs.putDouble(KEY_SOURCE_RADIUS, v); }

    public static double getInnerSkyRadius() { return prefs.getDouble(KEY_INNER_SKY, 12.0); }
    public static void setInnerSkyRadius(double v) { prefs.putDouble(KEY_INNER_SKY, v); }

    public static double getOuterSkyRadius() { return prefs.getDouble(KEY_OUTER_SKY, 17.0); }
    public static void setOuterSkyRadius(double v) { prefs.putDouble(KEY_OUTER_SKY, v); }

    public static double getClipSigma() { return prefs.getDouble(KEY_CLIP_SIGMA, 3.0); }
    public static void setClipSigma(double v) { prefs.putDouble(KEY_CLIP_SIGMA, v); }

    public static int getClipIterations() { return prefs.getInt(KEY_CLIP_ITERS, 10); }
    public static void setClipIterations(int v) { prefs.putInt(KEY_CLIP_ITERS, v); }

    public static int getSearchRadius() { return prefs.getInt(KEY_SEARCH_RADIUS, 25); }
    public static void setSearchRadius(int v) { prefs.putInt(KEY_SEARCH_RADIUS, v); }

    public static double getMaxMovement() { return prefs.getDouble(KEY_MAX_MOVEMENT, 12.0); }
    public static void setMaxMovement(double v) { prefs.putDouble(KEY_MAX_MOVEMENT, v); }

    public static int getMaxConsecutiveFailures() { return prefs.getInt(KEY_MAX_FAILURES, 5); }
    public static void setMaxConsecutiveFailures(int v) { prefs.putInt(KEY_MAX_FAILURES, v); }

    public static double getCentroidWeightExponent() { return prefs.getDouble(KEY_WEIGHT_EXP, 1.0); }
    public static void setCentroidWeightExponent(double v) { prefs.putDouble(KEY_WEIGHT_EXP, v); }

    public static boolean isMomentumEnabled() { return prefs.getBoolean(KEY_MOMENTUM, true); }
    public static void setMomentumEnabled(boolean v) { prefs.putBoolean(KEY_MOMENTUM, v); }

    public static double getExposureScale() { return prefs.getDouble(KEY_EXPOSURE_SCALE, 1.0); }
    public static void setExposureScale(double v) { prefs.putDouble(KEY_EXPOSURE_SCALE, v); }

    public static DarkScaleMode getDarkScaleMode() {
        return parseEnum(DarkScaleMode.class, prefs.get(KEY_DARK_MODE, null), DarkScaleMode.EXPOSURE_RATIO);
    }
    public static void setDarkScaleMode(DarkScaleMode v) { prefs.put(KEY_DARK_MODE, v.name()); }

    public static CombineMethod getCombineMethod() {
        return parseEnum(CombineMethod.class, prefs.get(KEY_COMBINE, null), CombineMethod.MEDIAN);
    }
    public static void setCombineMethod(CombineMethod v) { prefs.put(KEY_COMBINE, v.name()); }

    public static int getWorkerThreads() { return prefs.getInt(KEY_WORKERS, 4); }
    public static void setWorkerThreads(int v) { prefs.putInt(KEY_WORKERS, v); }

    static <E extends Enum<E>> E parseEnum(Class<E> type, String value, E fallback) {
        if (value == null || value.isEmpty()) return fallback;
        try {
            return Enum.valueOf(type, value);
        } catch (IllegalArgumentException e) {
            // valor guardado por una versión anterior
            logger.warn("Valor desconocido '{}' para {}, se usa {}", value, type.getSimpleName(), fallback);
            return fallback;
        }
    }
}
