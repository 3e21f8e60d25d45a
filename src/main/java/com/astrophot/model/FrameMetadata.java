package com.astrophot.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class FrameMetadata {

    public static final String HISTORY_BIAS_DARK_CORRECTED = "BIAS_DARK_CORRECTED";
    public static final String HISTORY_CALIBRATED = "CALIBRATED";
    public static final String HISTORY_MASTER = "MASTER";

    public static final FrameMetadata EMPTY = builder().build();

    public final double exposureTime; // segundos, 0 = desconocido
    public final double gain;
    public final double offset;
    public final String filter;
    public final String dateObs;
    public final String instrument;
    public final String telescope;
    public final String object;
    public final String sourceName;

    private final List<String> history;
    private final Map<String, String> keywords;

    private FrameMetadata(Builder b) {
        this.exposureTime = b.exposureTime;
        this.gain = b.gain;
        this.offset = b.offset;
        this.filter = b.filter;
        this.dateObs = b.dateObs;
        this.instrument = b.instrument;
        this.telescope = b.telescope;
        this.object = b.object;
        this.sourceName = b.sourceName;
        this.history = Collections.unmodifiableList(new ArrayList<>(b.history));
        this.keywords = Collections.unmodifiableMap(new LinkedHashMap<>(b.keywords));
    }

    public boolean hasExposureTime() { return exposureTime > 0; }

    public List<String> getHistory() { return history; }

    public boolean hasHistory(String entry) { return history.contains(entry); }

    // Claves FITS adicionales (JD, MJD, XPIXSZ...) tal como venían en la cabecera
    public Map<String, String> getKeywords() { return keywords; }

    public FrameMetadata withHistory(String entry) {
        return toBuilder().history(entry).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.exposureTime = exposureTime;
        b.gain = gain;
        b.offset = offset;
        b.filter = filter;
        b.dateObs = dateObs;
        b.instrument = instrument;
        b.telescope = telescope;
        b.object = object;
        b.sourceName = sourceName;
        b.history.addAll(history);
        b.keywords.putAll(keywords);
        return b;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private double exposureTime = 0;
        private double gain = 0;
        private double offset = 0;
        private String filter;
        private String dateObs;
        private String instrument;
        private String telescope;
        private String object;
        private String sourceName;
        private final List<String> history = new ArrayList<>();
        private final Map<String, String> keywords = new LinkedHashMap<>();

        private Builder() {}

        public Builder exposureTime(double v) { this.exposureTime = v; return this; }
        public Builder gain(double v) { this.gain = v; return this; }
        public Builder offset(double v) { this.offset = v; return this; }
        public Builder filter(String v) { this.filter = v; return this; }
        public Builder dateObs(String v) { this.dateObs = v; return this; }
        public Builder instrument(String v) { this.instrument = v; return this; }
        public Builder telescope(String v) { this.telescope = v; return this; }
        public Builder object(String v) { this.object = v; return this; }
        public Builder sourceName(String v) { this.sourceName = v; return this; }
        public Builder history(String entry) { if (!history.contains(entry)) history.add(entry); return this; }
        public Builder keyword(String key, String value) { keywords.put(key, value); return this; }

        public FrameMetadata build() { return new FrameMetadata(this); }
    }
}
