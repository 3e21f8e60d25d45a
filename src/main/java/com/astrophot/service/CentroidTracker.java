package com.astrophot.service;

import com.astrophot.model.Channel;
import com.astrophot.model.PixelFrame;
import com.astrophot.model.PixelPosition;
import com.astrophot.model.TrackLostException;
import com.astrophot.model.TrackState;
import com.astrophot.model.TrackStep;
import com.astrophot.model.TrackingTolerances;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Seguimiento automático de una estrella por centroide con umbral adaptativo.
 * <p>
 * El primer frame se mide en la semilla. Después se predice la posición con la velocidad reciente,
 * se centra una ventana pequeña sobre la predicción (o sobre el pico más brillante si ahí no hay
 * señal) y se itera el centroide dentro de esa ventana. El resultado solo se acepta si destaca sobre
 * el fondo, no se aleja de la predicción y no está pegado al borde.
 */
public class CentroidTracker implements CenterProvider {

    private static final Logger logger = LoggerFactory.getLogger(CentroidTracker.class);

    // Multiplicadores del umbral según lo que destaca el pico sobre el fondo
    private static final double K_BRIGHT = 2.0;
    private static final double K_MEDIUM = 2.5;
    private static final double K_FAINT = 3.0;
    private static final double RATIO_BRIGHT = 10.0;
    private static final double RATIO_MEDIUM = 5.0;

    private static final double CONVERGED = 0.01;

    private final TrackingTolerances tolerances;

    public CentroidTracker() {
        this(TrackingTolerances.defaults());
    }

    public CentroidTracker(TrackingTolerances tolerances) {
        this.tolerances = Objects.requireNonNull(tolerances, "tolerances");
    }

    public TrackingTolerances getTolerances() { return tolerances; }

    @Override
    public TrackState start(PixelPosition seed) {
        return TrackState.seeking().seed(seed);
    }

    @Override
    public TrackStep next(TrackState state, PixelFrame frame) {
        Objects.requireNonNull(frame, "frame");
        if (state.isLost()) {
            return new TrackStep(state.skipLost(), null, TrackStep.Quality.LOST, Double.NaN);
        }
        if (!state.isTracking()) {
            throw new IllegalStateException("El seguimiento no se ha iniciado: " + state);
        }

        if (state.frameIndex == 0 && !tolerances.refineFirstFrame) {
            PixelPosition seed = state.lastValidCenter;
            logger.debug("Frame 0: se mide en la semilla {}", seed);
            return new TrackStep(state.accept(seed, tolerances.historySize), seed, TrackStep.Quality.ACCEPTED, 0.0);
        }

        PlaneReader plane = PlaneReader.of(frame, Channel.GRAY);
        PixelPosition predicted = predict(state);
        int radius = searchRadiusFor(state);
        Refinement r = locate(plane, predicted, radius);

        String reason = r == null ? "sin señal sobre el umbral" : validate(plane, r.center, predicted, r.backgroundSigma);
        if (reason == null) {
            double movement = movement(state, r.center);
            logger.debug("Frame {}: centroide {} aceptado, movimiento {}", state.frameIndex, r.center,
                    String.format(Locale.US, "%.2f", movement));
            return new TrackStep(state.accept(r.center, tolerances.historySize), r.center,
                    TrackStep.Quality.ACCEPTED, movement);
        }

        PixelPosition fallback = fallback(state, predicted, radius, plane);
        TrackState rejected = state.reject(tolerances.maxConsecutiveFailures, fallback);
        if (rejected.isLost()) {
            logger.warn("Frame {}: seguimiento perdido tras {} fallos ({})", state.frameIndex,
                    rejected.consecutiveFailures, reason);
            return new TrackStep(rejected, null, TrackStep.Quality.LOST, Double.NaN);
        }
        logger.debug("Frame {}: centroide rechazado ({}), se mide en {}", state.frameIndex, reason, fallback);
        return new TrackStep(rejected, fallback, TrackStep.Quality.STALE, movement(state, fallback));
    }

    @Override
    public TrackState reseed(TrackState state, PixelPosition position) {
        logger.info("Seguimiento resembrado en {} (frame {})", position, state.frameIndex);
        return state.seed(position);
    }

    public void requireTracking(TrackState state) {
        if (state.isLost()) {
            throw new TrackLostException(state.frameIndex, state.consecutiveFailures);
        }
    }

    private static double movement(TrackState before, PixelPosition used) {
        return before.frameIndex == 0 ? 0.0 : used.distanceTo(before.currentCenter);
    }

    // --- PREDICCIÓN POR MOMENTO ---

    PixelPosition predict(TrackState state) {
        List<TrackState.Fix> history = state.getHistory();
        if (!tolerances.momentum || history.size() < 2) return state.lastValidCenter;

        int n = history.size() - 1;
        double vx = 0, vy = 0, weights = 0;
        for (int k = 1; k <= n; k++) {
            TrackState.Fix a = history.get(k - 1), b = history.get(k);
            int frames = Math.max(1, b.frameIndex - a.frameIndex);
            double w = (double) k / n;
            vx += w * (b.position.x - a.position.x) / frames;
            vy += w * (b.position.y - a.position.y) / frames;
            weights += w;
        }
        TrackState.Fix last = history.get(n);
        int gap = Math.max(1, state.frameIndex - last.frameIndex);
        return new PixelPosition(last.position.x + gap * vx / weights, last.position.y + gap * vy / weights);
    }

    // Radio base + 2 veces la dispersión de las posiciones recientes, entre base y 2*base
    int searchRadiusFor(TrackState state) {
        int base = tolerances.searchRadius;
        List<TrackState.Fix> history = state.getHistory();
        if (!tolerances.momentum || history.size() < 3) return base;

        double mx = 0, my = 0;
        for (TrackState.Fix f : history) {
            mx += f.position.x;
            my += f.position.y;
        }
        mx /= history.size();
        my /= history.size();
        double sx = 0, sy = 0;
        for (TrackState.Fix f : history) {
            sx += (f.position.x - mx) * (f.position.x - mx);
            sy += (f.position.y - my) * (f.position.y - my);
        }
        double spread = Math.sqrt(sx / history.size() + sy / history.size());
        int adaptive = (int) (base + 2 * spread);
        return Math.max(base, Math.min(adaptive, 2 * base));
    }

    // Sin centroide válido se mide en la predicción si es razonable; si no, en la última posición válida
    private PixelPosition fallback(TrackState state, PixelPosition predicted, int radius, PlaneReader plane) {
        PixelPosition last = state.lastValidCenter;
        if (predicted.equals(last) || predicted.distanceTo(last) > radius) return last;
        if (predicted.x < 0 || predicted.y < 0 || predicted.x > plane.width() - 1 || predicted.y > plane.height() - 1) {
            return last;
        }
        return predicted;
    }

    // --- CENTROIDE ---

    // Centroide ponderado con umbral adaptativo alrededor de la posición dada, con el radio de búsqueda base
    public PixelPosition refine(FloatProcessor plane, PixelPosition around) {
        Refinement r = locate(PlaneReader.of(plane), around, tolerances.searchRadius);
        return r == null ? null : r.center;
    }

    private Refinement locate(PlaneReader plane, PixelPosition around, int radius) {
        Window search = Window.around(plane, around, radius);
        if (search.isEmpty()) return null;

        double[] samples = search.samples(plane);
        RobustStatistics.ClippedStatistics stats = RobustStatistics.sigmaClip(samples,
                RobustStatistics.DEFAULT_SIGMA, RobustStatistics.DEFAULT_MAX_ITERATIONS);
        double peak = Double.NEGATIVE_INFINITY;
        for (double v : samples) if (v > peak) peak = v;
        double threshold = threshold(stats, peak);

        // Se parte de la posición esperada; solo si ahí no hay señal se salta al pico de la búsqueda.
        // Un centroide sobre toda la ventana de búsqueda se iría hacia las estrellas vecinas.
        PixelPosition center = around;
        if (!hasSignal(plane, Window.around(plane, around, tolerances.refineWindowRadius), threshold)) {
            center = brightest(plane, search, threshold);
            if (center == null) return null;
        }

        boolean found = false;
        for (int i = 0; i < tolerances.refineIterations; i++) {
            PixelPosition again = centroid(plane, Window.around(plane, center, tolerances.refineWindowRadius), threshold);
            if (again == null) break;
            found = true;
            boolean settled = again.distanceTo(center) < CONVERGED;
            center = again;
            if (settled) break;
        }
        if (!found) return null;
        return new Refinement(center, Double.isNaN(stats.stddev) ? 0.0 : stats.stddev);
    }

    static double threshold(RobustStatistics.ClippedStatistics stats, double peak) {
        double std = Double.isNaN(stats.stddev) ? 0.0 : stats.stddev;
        double ratio = (peak - stats.median) / (std + 1e-6);
        double k = ratio > RATIO_BRIGHT ? K_BRIGHT : ratio > RATIO_MEDIUM ? K_MEDIUM : K_FAINT;
        return stats.median + k * std;
    }

    private static boolean hasSignal(PlaneReader plane, Window w, double threshold) {
        for (int y = w.y0; y <= w.y1; y++) {
            for (int x = w.x0; x <= w.x1; x++) {
                if (plane.get(x, y) > threshold) return true;
            }
        }
        return false;
    }

    private static PixelPosition brightest(PlaneReader plane, Window w, double threshold) {
        double best = threshold;
        PixelPosition at = null;
        for (int y = w.y0; y <= w.y1; y++) {
            for (int x = w.x0; x <= w.x1; x++) {
                double v = plane.get(x, y);
                if (v > best) {
                    best = v;
                    at = new PixelPosition(x, y);
                }
            }
        }
        return at;
    }

    private PixelPosition centroid(PlaneReader plane, Window w, double threshold) {
        double sum = 0, sx = 0, sy = 0;
        double p = tolerances.weightExponent;
        for (int y = w.y0; y <= w.y1; y++) {
            for (int x = w.x0; x <= w.x1; x++) {
                double v = plane.get(x, y) - threshold;
                if (!(v > 0)) continue;
                double weight = p == 1.0 ? v : Math.pow(v, p);
                sum += weight;
                sx += weight * x;
                sy += weight * y;
            }
        }
        if (!(sum > 0)) return null;
        return new PixelPosition(sx / sum, sy / sum);
    }

    // --- VALIDACIÓN ---

    // Motivo del rechazo, o null si la posición es válida. sigma es la dispersión del fondo de la búsqueda.
    String validate(PlaneReader plane, PixelPosition candidate, PixelPosition expected, double sigma) {
        int m = tolerances.edgeMargin;
        if (candidate.x < m || candidate.y < m
                || candidate.x >= plane.width() - m || candidate.y >= plane.height() - m) {
            return "demasiado cerca del borde";
        }
        double distance = candidate.distanceTo(expected);
        if (distance > tolerances.maxMovement) {
            return String.format(Locale.US, "desplazamiento %.1f > %.1f", distance, tolerances.maxMovement);
        }

        // Solo cuenta lo que sobresale del fondo local: un pedestal de cielo no cambia el resultado
        int cx = (int) Math.round(candidate.x), cy = (int) Math.round(candidate.y);
        Window local = Window.around(plane, new PixelPosition(cx, cy), tolerances.validationWindowRadius);
        double localMedian = RobustStatistics.median(local.samples(plane));
        double center = plane.get(cx, cy);
        if (!(center - localMedian > tolerances.validationSigma * sigma)) {
            return String.format(Locale.US, "poco brillo (centro=%.1f, mediana=%.1f)", center, localMedian);
        }
        return null;
    }

    private static final class Refinement {
        final PixelPosition center;
        final double backgroundSigma;

        Refinement(PixelPosition center, double backgroundSigma) {
            this.center = center;
            this.backgroundSigma = backgroundSigma;
        }
    }

    // Ventana cuadrada inclusiva recortada al plano
    private static final class Window {
        final int x0, y0, x1, y1;

        private Window(int x0, int y0, int x1, int y1) {
            this.x0 = x0;
            this.y0 = y0;
            this.x1 = x1;
            this.y1 = y1;
        }

        static Window around(PlaneReader plane, PixelPosition c, int radius) {
            int cx = (int) Math.round(c.x), cy = (int) Math.round(c.y);
            return new Window(Math.max(0, cx - radius), Math.max(0, cy - radius),
                    Math.min(plane.width() - 1, cx + radius), Math.min(plane.height() - 1, cy + radius));
        }

        boolean isEmpty() { return x1 < x0 || y1 < y0; }

        double[] samples(PlaneReader plane) {
            if (isEmpty()) return new double[0];
            double[] out = new double[(x1 - x0 + 1) * (y1 - y0 + 1)];
            int k = 0;
            for (int y = y0; y <= y1; y++) {
                for (int x = x0; x <= x1; x++) out[k++] = plane.get(x, y);
            }
            return out;
        }
    }
}
