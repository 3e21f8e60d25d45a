package com.astrophot.service;

import com.astrophot.model.CalibrationRole;
import com.astrophot.model.CalibrationSettings;
import com.astrophot.model.CombineMethod;
import com.astrophot.model.FrameMetadata;
import com.astrophot.model.MasterFrame;
import com.astrophot.model.PhotometryConfig;
import com.astrophot.model.PixelFrame;
import com.astrophot.model.ShapeMismatchException;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

public class MasterFrameBuilder {

    private static final Logger logger = LoggerFactory.getLogger(MasterFrameBuilder.class);

    private static final int ROWS_PER_TASK = 64;

    private final CombineMethod method;
    private final ExecutorService executor; // null = secuencial
    private final Calibrator calibrator;

    public MasterFrameBuilder() {
        this(CombineMethod.MEDIAN, null, new Calibrator());
    }

    public MasterFrameBuilder(CombineMethod method, ExecutorService executor, Calibrator calibrator) {
        this.method = Objects.requireNonNull(method, "method");
        this.executor = executor;
        this.calibrator = Objects.requireNonNull(calibrator, "calibrator");
    }

    // Método de combinación y ajustes de calibración guardados en las preferencias
    public static MasterFrameBuilder fromPreferences(ExecutorService executor) {
        return new MasterFrameBuilder(PhotometryConfig.getCombineMethod(), executor,
                new Calibrator(CalibrationSettings.fromPreferences()));
    }

    public CombineMethod getMethod() { return method; }

    public MasterFrame build(List<PixelFrame> frames, CalibrationRole role) {
        Objects.requireNonNull(role, "role");
        if (frames == null || frames.isEmpty()) {
            throw new IllegalArgumentException("No hay frames para construir el master " + role);
        }
        PixelFrame reference = frames.get(0);
        for (int i = 1; i < frames.size(); i++) {
            ShapeMismatchException.check(reference, frames.get(i), role + " frame " + i);
        }
        if (role == CalibrationRole.FLAT) {
            for (int i = 0; i < frames.size(); i++) {
                if (!frames.get(i).getMetadata().hasHistory(FrameMetadata.HISTORY_BIAS_DARK_CORRECTED)) {
                    throw new IllegalStateException("El flat " + i
                            + " no esta corregido de bias/dark; usar buildFlat con los masters disponibles");
                }
            }
        }

        logger.info("Creando master {} a partir de {} frames ({}, {})", role, frames.size(), method, reference.shapeString());

        int w = reference.getWidth(), h = reference.getHeight();
        List<FloatProcessor> planes = new ArrayList<>(reference.getChannelCount());
        for (int c = 0; c < reference.getChannelCount(); c++) {
            float[][] stack = new float[frames.size()][];
            for (int i = 0; i < frames.size(); i++) stack[i] = frames.get(i).copyPixels(c);
            float[] out = new float[w * h];
            combineRows(stack, out, w, h);
            planes.add(new FloatProcessor(w, h, out));
        }

        return new MasterFrame(role, new PixelFrame(planes, masterMetadata(frames, role)), frames.size());
    }

    // Flats: primero se restan bias y dark a cada frame y después se combinan
    public MasterFrame buildFlat(List<PixelFrame> rawFlats, MasterFrame bias, MasterFrame dark) {
        if (rawFlats == null || rawFlats.isEmpty()) {
            throw new IllegalArgumentException("No hay flats para combinar");
        }
        if (bias == null && dark == null) {
            logger.warn("Sin master bias ni dark: el master flat se crea con flats sin corregir");
        }
        List<PixelFrame> corrected = new ArrayList<>(rawFlats.size());
        for (PixelFrame flat : rawFlats) {
            // sin escalado de dark para los flats
            corrected.add(calibrator.subtractBiasDark(flat, bias, dark));
        }
        return build(corrected, CalibrationRole.FLAT);
    }

    private void combineRows(float[][] stack, float[] out, int w, int h) {
        if (executor == null) {
            combineBand(stack, out, w, 0, h);
            return;
        }
        List<Future<Void>> futures = new ArrayList<>();
        for (int y0 = 0; y0 < h; y0 += ROWS_PER_TASK) {
            final int start = y0, end = Math.min(h, y0 + ROWS_PER_TASK);
            futures.add(executor.submit(() -> {
                combineBand(stack, out, w, start, end);
                return null;
            }));
        }
        Workers.awaitAll(futures);
    }

    private void combineBand(float[][] stack, float[] out, int w, int rowStart, int rowEnd) {
        int n = stack.length;
        double[] buf = new double[n];
        for (int y = rowStart; y < rowEnd; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                for (int i = 0; i < n; i++) buf[i] = stack[i][idx];
                out[idx] = (float) combine(buf, n);
            }
        }
    }

    private double combine(double[] buf, int n) {
        switch (method) {
            case MEAN:
                return RobustStatistics.mean(buf, n);
            case SIGMA_CLIPPED_MEAN:
                return RobustStatistics.sigmaClip(buf, RobustStatistics.DEFAULT_SIGMA, RobustStatistics.DEFAULT_MAX_ITERATIONS).mean;
            case MEDIAN:
            default:
                return RobustStatistics.medianInPlace(buf, n);
        }
    }

    private FrameMetadata masterMetadata(List<PixelFrame> frames, CalibrationRole role) {
        FrameMetadata first = frames.get(0).getMetadata();
        double[] exposures = new double[frames.size()];
        boolean mixed = false;
        for (int i = 0; i < frames.size(); i++) {
            exposures[i] = frames.get(i).getMetadata().exposureTime;
            if (exposures[i] != exposures[0]) mixed = true;
        }
        if (mixed) logger.warn("Los frames {} tienen tiempos de exposicion distintos; se usa la mediana", role);

        FrameMetadata.Builder b = FrameMetadata.builder()
                .exposureTime(RobustStatistics.median(exposures))
                .gain(first.gain)
                .offset(first.offset)
                .filter(first.filter)
                .instrument(first.instrument)
                .telescope(first.telescope)
                .sourceName("master_" + role.name().toLowerCase())
                .history(FrameMetadata.HISTORY_MASTER)
                .keyword("IMAGETYP", role.name())
                .keyword("NFRAMES", Integer.toString(frames.size()))
                .keyword("COMBINE", method.name());
        if (role == CalibrationRole.FLAT) b.history(FrameMetadata.HISTORY_BIAS_DARK_CORRECTED);
        return b.build();
    }
}
