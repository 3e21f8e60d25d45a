package com.astrophot.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Estado del seguimiento de una sesión. Valor inmutable: cada transición devuelve un estado nuevo
 * y avanza exactamente un frame (salvo la siembra, que no consume frame).
 */
public final class TrackState {

    public enum Status { SEEKING, TRACKING, LOST }

    private static final int DEFAULT_HISTORY = 5;

    // Posición aceptada y el frame en que se aceptó
    public static final class Fix {
        public final PixelPosition position;
        public final int frameIndex;

        Fix(PixelPosition position, int frameIndex) {
            this.position = position;
            this.frameIndex = frameIndex;
        }
    }

    public final Status status;
    public final PixelPosition currentCenter;
    public final PixelPosition lastValidCenter;
    public final int consecutiveFailures;
    public final int frameIndex;
    private final List<Fix> history;

    private TrackState(Status status, PixelPosition currentCenter, PixelPosition lastValidCenter,
                       int consecutiveFailures, int frameIndex, List<Fix> history) {
        this.status = status;
        this.currentCenter = currentCenter;
        this.lastValidCenter = lastValidCenter;
        this.consecutiveFailures = consecutiveFailures;
        this.frameIndex = frameIndex;
        this.history = history;
    }

    public static TrackState seeking() {
        return new TrackState(Status.SEEKING, null, null, 0, 0, Collections.emptyList());
    }

    public boolean isTracking() { return status == Status.TRACKING; }
    public boolean isLost() { return status == Status.LOST; }

    // Últimas posiciones aceptadas, la más antigua primero
    public List<Fix> getHistory() { return history; }

    // SEEKING/LOST -> TRACKING con una posición externa
    public TrackState seed(PixelPosition position) {
        if (position == null) throw new IllegalArgumentException("La semilla no puede ser nula");
        return new TrackState(Status.TRACKING, position, position, 0, frameIndex, Collections.emptyList());
    }

    public TrackState accept(PixelPosition position) {
        return accept(position, DEFAULT_HISTORY);
    }

    // La posición validada pasa a ser la última válida y entra en el historial (acotado a maxHistory)
    public TrackState accept(PixelPosition position, int maxHistory) {
        requireTracking();
        List<Fix> next = new ArrayList<>(history);
        next.add(new Fix(position, frameIndex));
        while (next.size() > maxHistory) next.remove(0);
        return new TrackState(Status.TRACKING, position, position, 0, frameIndex + 1,
                Collections.unmodifiableList(next));
    }

    public TrackState reject(int maxConsecutiveFailures) {
        return reject(maxConsecutiveFailures, lastValidCenter);
    }

    // Fallo de validación: la última posición válida no cambia y el frame se mide en la posición usada
    public TrackState reject(int maxConsecutiveFailures, PixelPosition used) {
        requireTracking();
        int failures = consecutiveFailures + 1;
        if (failures > maxConsecutiveFailures) {
            return new TrackState(Status.LOST, lastValidCenter, lastValidCenter, failures, frameIndex + 1, history);
        }
        return new TrackState(Status.TRACKING, used, lastValidCenter, failures, frameIndex + 1, history);
    }

    public TrackState skipLost() {
        if (status != Status.LOST) throw new IllegalStateException("skipLost solo aplica a un seguimiento perdido");
        return skip();
    }

    // Frame sin datos (no se pudo cargar): solo avanza el índice
    public TrackState skip() {
        return new TrackState(status, currentCenter, lastValidCenter, consecutiveFailures, frameIndex + 1, history);
    }

    private void requireTracking() {
        if (status != Status.TRACKING) {
            throw new IllegalStateException("Transición inválida desde " + status);
        }
    }

    @Override
    public String toString() {
        return "TrackState[" + status + ", frame=" + frameIndex + ", last=" + lastValidCenter
                + ", failures=" + consecutiveFailures + "]";
    }
}
