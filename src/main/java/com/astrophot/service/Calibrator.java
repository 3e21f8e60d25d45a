package com.astrophot.service;

import com.astrophot.model.CalibrationSettings;
import com.astrophot.model.FrameMetadata;
import com.astrophot.model.MasterFrame;
import com.astrophot.model.PixelFrame;
import com.astrophot.model.ShapeMismatchException;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

public class Calibrator {

    private static final Logger logger = LoggerFactory.getLogger(Calibrator.class);

    // Optimización del dark (mismos límites que el procesado de referencia)
    private static final double OPT_CLIP_SIGMA = 2.5;
    private static final int OPT_CLIP_ITERS = 5;
    private static final double OPT_MIN_FACTOR = 0.1;
    private static final double OPT_MAX_FACTOR = 5.0;

    private final CalibrationSettings settings;

    public Calibrator() {
        this(CalibrationSettings.defaults());
    }

    public Calibrator(CalibrationSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public CalibrationSettings getSettings() { return settings; }

    // Precalcula el flat normalizado de un juego de masters
    public CalibrationSet prepare(MasterFrame bias, MasterFrame dark, MasterFrame flat) {
        CalibrationSet set = new CalibrationSet(bias, dark, flat, settings.flatFloor);
        logger.info("Calibracion preparada: bias={} dark={} flat={}", bias != null, dark != null, flat != null);
        if (set.hasFlat()) {
            logger.info("Referencia del flat: {} (medias por canal {})",
                    String.format(Locale.US, "%.1f", set.getFlatReference()), Arrays.toString(set.getFlatChannelMeans()));
            if (set.getClampedFlatPixels() > 0) {
                logger.warn("{} pixeles del flat normalizado por debajo de {} se limitaron",
                        set.getClampedFlatPixels(), settings.flatFloor);
            }
        }
        return set;
    }

    public PixelFrame calibrate(PixelFrame light, MasterFrame bias, MasterFrame dark, MasterFrame flat, double exposureScale) {
        return apply(light, prepare(bias, dark, flat), exposureScale);
    }

    // Igual que el anterior pero con la escala del dark resuelta según CalibrationSettings.darkScaleMode
    public PixelFrame calibrate(PixelFrame light, MasterFrame bias, MasterFrame dark, MasterFrame flat) {
        return apply(light, prepare(bias, dark, flat));
    }

    public PixelFrame apply(PixelFrame light, CalibrationSet set) {
        return apply(light, set, resolveDarkScales(light, set));
    }

    public PixelFrame apply(PixelFrame light, CalibrationSet set, double exposureScale) {
        double[] scales = new double[light.getChannelCount()];
        Arrays.fill(scales, exposureScale);
        return apply(light, set, scales);
    }

    PixelFrame apply(PixelFrame light, CalibrationSet set, double[] darkScales) {
        Objects.requireNonNull(light, "light");
        set.checkLight(light);

        int w = light.getWidth(), h = light.getHeight();
        List<FloatProcessor> out = new ArrayList<>(light.getChannelCount());
        for (int c = 0; c < light.getChannelCount(); c++) {
            float[] px = light.copyPixels(c);
            float[] bias = set.biasPlanes == null ? null : set.biasPlanes[c];
            float[] dark = set.darkPlanes == null ? null : set.darkPlanes[c];
            float[] flat = set.normalizedFlat == null ? null : set.normalizedFlat[c];
            double scale = darkScales[c];
            for (int i = 0; i < px.length; i++) {
                double v = px[i];
                if (bias != null) v -= bias[i];
                if (dark != null) v -= dark[i] * scale;
                if (flat != null) v /= flat[i];
                if (settings.clipNegative && v < 0) v = 0;
                px[i] = (float) v;
            }
            out.add(new FloatProcessor(w, h, px));
        }
        logger.debug("Light {} calibrado (escala dark {})", light.getMetadata().sourceName, Arrays.toString(darkScales));
        return new PixelFrame(out, light.getMetadata().withHistory(FrameMetadata.HISTORY_CALIBRATED));
    }

    // Resta bias y dark (sin escalar) y marca el frame como corregido
    public PixelFrame subtractBiasDark(PixelFrame frame, MasterFrame bias, MasterFrame dark) {
        Objects.requireNonNull(frame, "frame");
        if (bias != null) ShapeMismatchException.check(bias.getFrame(), frame, "frame frente a bias");
        if (dark != null) ShapeMismatchException.check(dark.getFrame(), frame, "frame frente a dark");

        List<FloatProcessor> out = new ArrayList<>(frame.getChannelCount());
        for (int c = 0; c < frame.getChannelCount(); c++) {
            float[] px = frame.copyPixels(c);
            float[] b = bias == null ? null : bias.getFrame().copyPixels(c);
            float[] d = dark == null ? null : dark.getFrame().copyPixels(c);
            for (int i = 0; i < px.length; i++) {
                double v = px[i];
                if (b != null) v -= b[i];
                if (d != null) v -= d[i];
                if (settings.clipNegative && v < 0) v = 0;
                px[i] = (float) v;
            }
            out.add(new FloatProcessor(frame.getWidth(), frame.getHeight(), px));
        }
        return new PixelFrame(out, frame.getMetadata().withHistory(FrameMetadata.HISTORY_BIAS_DARK_CORRECTED));
    }

    // Calibra lights independientes en paralelo conservando el orden
    public List<PixelFrame> calibrateAll(List<PixelFrame> lights, CalibrationSet set, ExecutorService executor) {
        logger.info("Calibrando {} lights", lights.size());
        if (executor == null) {
            List<PixelFrame> out = new ArrayList<>(lights.size());
            for (PixelFrame light : lights) out.add(apply(light, set));
            return out;
        }
        List<Future<PixelFrame>> futures = new ArrayList<>(lights.size());
        for (PixelFrame light : lights) futures.add(executor.submit(() -> apply(light, set)));
        return Workers.awaitAll(futures);
    }

    double[] resolveDarkScales(PixelFrame light, CalibrationSet set) {
        double[] scales = new double[light.getChannelCount()];
        Arrays.fill(scales, settings.exposureScale);
        MasterFrame dark = set.getDark();
        if (dark == null) return scales;

        switch (settings.darkScaleMode) {
            case EXPOSURE_RATIO: {
                FrameMetadata lm = light.getMetadata(), dm = dark.getFrame().getMetadata();
                if (lm.hasExposureTime() && dm.hasExposureTime()) {
                    Arrays.fill(scales, lm.exposureTime / dm.exposureTime);
                }
                return scales;
            }
            case OPTIMIZED:
                return estimateDarkScales(light, set);
            case FIXED:
            default:
                return scales;
        }
    }

    // Factor de dark por canal: mediana robusta de light/dark sobre los píxeles donde el dark tiene señal
    double[] estimateDarkScales(PixelFrame light, CalibrationSet set) {
        double[] factors = new double[light.getChannelCount()];
        for (int c = 0; c < factors.length; c++) {
            float[] img = light.copyPixels(c);
            if (set.biasPlanes != null) {
                for (int i = 0; i < img.length; i++) img[i] -= set.biasPlanes[c][i];
            }
            float[] dark = set.darkPlanes[c];
            double darkMedian = RobustStatistics.median(dark);
            double factor = 1.0;
            if (darkMedian > 0) {
                double[] ratios = new double[img.length];
                int n = 0;
                for (int i = 0; i < img.length; i++) {
                    if (dark[i] > darkMedian * 0.5 && img[i] > 0) {
                        ratios[n++] = img[i] / dark[i];
                    }
                }
                if (n > 0) {
                    double m = RobustStatistics.sigmaClip(Arrays.copyOf(ratios, n), OPT_CLIP_SIGMA, OPT_CLIP_ITERS).median;
                    factor = Double.isNaN(m) ? 1.0 : m;
                } else {
                    factor = RobustStatistics.median(img) / darkMedian;
                }
            }
            factors[c] = Math.max(OPT_MIN_FACTOR, Math.min(OPT_MAX_FACTOR, factor));
            logger.debug("Canal {}: factor de dark optimizado {}", c, String.format(Locale.US, "%.3f", factors[c]));
        }
        return factors;
    }
}
