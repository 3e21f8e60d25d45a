package com.astrophot.service;

import com.astrophot.model.PixelFrame;
import com.astrophot.model.PixelPosition;
import com.astrophot.model.TrackState;
import com.astrophot.model.TrackStep;
import com.astrophot.model.TrackingTolerances;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;

public class ManualCenterProvider implements CenterProvider {

    private static final Logger logger = LoggerFactory.getLogger(ManualCenterProvider.class);

    private final IntFunction<PixelPosition> positions;
    private final int maxConsecutiveFailures;

    public ManualCenterProvider(List<PixelPosition> positions, int maxConsecutiveFailures) {
        this(indexed(positions), maxConsecutiveFailures);
    }

    public ManualCenterProvider(IntFunction<PixelPosition> positions, int maxConsecutiveFailures) {
        this.positions = Objects.requireNonNull(positions, "positions");
        if (maxConsecutiveFailures < 0) throw new IllegalArgumentException("maxConsecutiveFailures debe ser >= 0");
        this.maxConsecutiveFailures = maxConsecutiveFailures;
    }

    // La misma posición en todos los frames
    public static ManualCenterProvider fixed(PixelPosition position, TrackingTolerances tolerances) {
        Objects.requireNonNull(position, "position");
        return new ManualCenterProvider(i -> position, tolerances.maxConsecutiveFailures);
    }

    private static IntFunction<PixelPosition> indexed(List<PixelPosition> positions) {
        List<PixelPosition> copy = new ArrayList<>(Objects.requireNonNull(positions, "positions"));
        return i -> i < copy.size() ? copy.get(i) : null;
    }

    @Override
    public TrackState start(PixelPosition seed) {
        return TrackState.seeking().seed(seed);
    }

    @Override
    public TrackStep next(TrackState state, PixelFrame frame) {
        if (state.isLost()) {
            return new TrackStep(state.skipLost(), null, TrackStep.Quality.LOST, Double.NaN);
        }
        if (!state.isTracking()) {
            throw new IllegalStateException("El seguimiento no se ha iniciado: " + state);
        }

        PixelPosition given = positions.apply(state.frameIndex);
        if (given != null) {
            double movement = state.frameIndex == 0 ? 0.0 : given.distanceTo(state.currentCenter);
            return new TrackStep(state.accept(given), given, TrackStep.Quality.MANUAL, movement);
        }

        TrackState rejected = state.reject(maxConsecutiveFailures);
        if (rejected.isLost()) {
            logger.warn("Frame {}: sin posiciones manuales en {} frames seguidos", state.frameIndex,
                    rejected.consecutiveFailures);
            return new TrackStep(rejected, null, TrackStep.Quality.LOST, Double.NaN);
        }
        logger.debug("Frame {}: sin posicion manual, se reutiliza {}", state.frameIndex, state.lastValidCenter);
        return new TrackStep(rejected, state.lastValidCenter, TrackStep.Quality.STALE, 0.0);
    }
}
