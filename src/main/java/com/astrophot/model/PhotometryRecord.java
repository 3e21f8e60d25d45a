package com.astrophot.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public final class PhotometryRecord {

    public enum Status { OK, INSUFFICIENT_PIXELS, TRACK_LOST, FAILED }

    public final int imageIndex;
    public final String sourceName;
    public final Status status;
    public final String flag;
    public final PixelPosition position;
    public final boolean tracked;
    public final TrackStep.Quality quality;
    public final double movementPixels;
    public final int apertureArea;
    public final int skyAnnulusArea;
    public final boolean rgb;
    public final FrameMetadata metadata;

    private final Map<Channel, FluxMeasurement> measurements;

    private PhotometryRecord(int imageIndex, String sourceName, Status status, String flag, PixelPosition position,
                             boolean tracked, TrackStep.Quality quality, double movementPixels,
                             Map<Channel, FluxMeasurement> measurements, boolean rgb, FrameMetadata metadata) {
        this.imageIndex = imageIndex;
        this.sourceName = sourceName;
        this.status = status;
        this.flag = flag;
        this.position = position;
        this.tracked = tracked;
        this.quality = quality;
        this.movementPixels = movementPixels;
        EnumMap<Channel, FluxMeasurement> copy = new EnumMap<>(Channel.class);
        copy.putAll(measurements);
        this.measurements = Collections.unmodifiableMap(copy);
        FluxMeasurement any = copy.isEmpty() ? null : copy.values().iterator().next();
        this.apertureArea = any == null ? 0 : any.apertureArea;
        this.skyAnnulusArea = any == null ? 0 : any.skyAnnulusArea;
        this.rgb = rgb;
        this.metadata = metadata == null ? FrameMetadata.EMPTY : metadata;
    }

    public static PhotometryRecord measured(int imageIndex, TrackStep step, Map<Channel, FluxMeasurement> measurements,
                                            boolean rgb, FrameMetadata metadata) {
        return new PhotometryRecord(imageIndex, sourceName(metadata), Status.OK, null, step.center, step.isTracked(),
                step.quality, step.movementPixels, measurements, rgb, metadata);
    }

    public static PhotometryRecord flagged(int imageIndex, Status status, String flag, TrackStep step,
                                           boolean rgb, FrameMetadata metadata) {
        if (status == Status.OK) throw new IllegalArgumentException("Un registro marcado no puede tener estado OK");
        PixelPosition pos = step == null ? null : step.center;
        boolean tracked = step != null && step.isTracked();
        TrackStep.Quality quality = step == null ? null : step.quality;
        double movement = step == null ? Double.NaN : step.movementPixels;
        return new PhotometryRecord(imageIndex, sourceName(metadata), status, flag, pos, tracked, quality, movement,
                Collections.emptyMap(), rgb, metadata);
    }

    private static String sourceName(FrameMetadata metadata) {
        return metadata == null ? null : metadata.sourceName;
    }

    public boolean isFlagged() { return status != Status.OK; }

    public Map<Channel, FluxMeasurement> getMeasurements() { return measurements; }

    public FluxMeasurement getMeasurement(Channel channel) { return measurements.get(channel); }

    // Registro plano con los nombres de columna de exportación
    public Map<String, Object> toFieldMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("image_index", imageIndex);
        m.put("source_name", sourceName);
        m.put("status", status.name());
        m.put("flag", flag);
        m.put("x_position", position == null ? Double.NaN : position.x);
        m.put("y_position", position == null ? Double.NaN : position.y);
        m.put("tracked_position", tracked);
        m.put("movement_pixels", movementPixels);
        m.put("aperture_area", apertureArea);
        m.put("sky_annulus_area", skyAnnulusArea);
        m.put("is_rgb", rgb);

        for (FluxMeasurement f : measurements.values()) {
            String p = f.channel.prefix();
            m.put(p + "_star_flux_raw", f.rawFlux);
            m.put(p + "_flux_corrected", f.correctedFlux);
            m.put(p + "_sky_background_total", f.skyBackgroundTotal);
            m.put(p + "_sky_per_pixel", f.skyPerPixel());
            m.put(p + "_sky_std", f.skyStd());
            m.put(p + "_poisson_noise", f.poissonNoise);
            m.put(p + "_total_noise", f.totalNoise);
            m.put(p + "_snr", f.snr);
        }

        // --- METADATOS FITS ---
        if (metadata.hasExposureTime()) m.put("fits_exptime", metadata.exposureTime);
        putIfPresent(m, "fits_filter", metadata.filter);
        putIfPresent(m, "fits_date-obs", metadata.dateObs);
        putIfPresent(m, "fits_object", metadata.object);
        putIfPresent(m, "fits_telescop", metadata.telescope);
        putIfPresent(m, "fits_instrume", metadata.instrument);
        for (Map.Entry<String, String> e : metadata.getKeywords().entrySet()) {
            m.putIfAbsent("fits_" + e.getKey().toLowerCase(Locale.ROOT), e.getValue());
        }
        return m;
    }

    private static void putIfPresent(Map<String, Object> m, String key, String value) {
        if (value != null && !value.isEmpty()) m.put(key, value);
    }

    @Override
    public String toString() {
        return "PhotometryRecord[" + imageIndex + ", " + status + (flag != null ? " (" + flag + ")" : "")
                + ", pos=" + position + "]";
    }
}
