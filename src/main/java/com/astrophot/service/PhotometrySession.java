package com.astrophot.service;

import com.astrophot.model.ApertureRadii;
import com.astrophot.model.Channel;
import com.astrophot.model.FluxMeasurement;
import com.astrophot.model.InsufficientPixelsException;
import com.astrophot.model.PhotometryRecord;
import com.astrophot.model.PixelFrame;
import com.astrophot.model.PixelPosition;
import com.astrophot.model.TrackState;
import com.astrophot.model.TrackStep;
import com.astrophot.model.TrackingTolerances;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Recorre una secuencia de frames en orden: posición (seguimiento o manual), fotometría de todos los
 * canales y un registro por frame. Un frame que falla se marca y la sesión continua.
 */
public class PhotometrySession {

    private static final Logger logger = LoggerFactory.getLogger(PhotometrySession.class);

    private final PhotometryMeasurer measurer;

    public PhotometrySession() {
        this(new PhotometryMeasurer());
    }

    public PhotometrySession(PhotometryMeasurer measurer) {
        this.measurer = Objects.requireNonNull(measurer, "measurer");
    }

    // Sesión sobre frames ya cargados, con los radios por defecto
    public List<PhotometryRecord> run(List<PixelFrame> frames, PixelPosition seed, TrackingMode mode,
                                      TrackingTolerances tolerances) {
        CenterProvider provider = mode == TrackingMode.MANUAL
                ? ManualCenterProvider.fixed(seed, tolerances)
                : new CentroidTracker(tolerances);
        return run(listSource(frames), seed, provider, ApertureRadii.defaults(), null, r -> { }, () -> false);
    }

    public List<PhotometryRecord> run(FrameSource source, PixelPosition seed, CenterProvider provider,
                                      ApertureRadii radii, Consumer<PhotometryRecord> listener,
                                      BooleanSupplier cancelled) {
        return run(source, seed, provider, radii, null, listener, cancelled);
    }

    public List<PhotometryRecord> run(FrameSource source, PixelPosition seed, CenterProvider provider,
                                      ApertureRadii radii, SeedSupplier reseeder,
                                      Consumer<PhotometryRecord> listener, BooleanSupplier cancelled) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(seed, "seed");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(listener, "listener");
        Objects.requireNonNull(cancelled, "cancelled");
        // radios inválidos ya fallan al construir ApertureRadii, antes de tocar ningún frame
        Objects.requireNonNull(radii, "radii");

        int total = source.size();
        logger.info("Sesion de fotometria: {} frames, semilla {}, {} ({})", total, seed,
                provider.getClass().getSimpleName(), radii);

        List<PhotometryRecord> records = new ArrayList<>(total);
        TrackState state = provider.start(seed);
        int flagged = 0;

        for (int i = 0; i < total; i++) {
            if (cancelled.getAsBoolean()) {
                logger.info("Sesion cancelada en el frame {} de {}", i, total);
                break;
            }

            PhotometryRecord record;
            PixelFrame frame;
            try {
                frame = source.load(i);
            } catch (IOException | RuntimeException e) {
                logger.warn("Frame {}: no se pudo cargar", i, e);
                state = state.skip();
                record = PhotometryRecord.flagged(i, PhotometryRecord.Status.FAILED,
                        "error de lectura: " + e.getMessage(), null, false, null);
                flagged++;
                emit(record, records, listener);
                continue;
            }

            if (state.isLost() && reseeder != null) {
                PixelPosition again = reseeder.reseed(i, frame, state);
                if (again != null) state = provider.reseed(state, again);
            }

            TrackStep step;
            try {
                step = provider.next(state, frame);
            } catch (RuntimeException e) {
                logger.warn("Frame {}: fallo al determinar la posicion", i, e);
                state = state.skip();
                record = PhotometryRecord.flagged(i, PhotometryRecord.Status.FAILED,
                        "error de seguimiento: " + e.getMessage(), null, frame.isRgb(), frame.getMetadata());
                flagged++;
                emit(record, records, listener);
                continue;
            }
            state = step.state;

            record = measureFrame(i, frame, step, radii);
            if (record.isFlagged()) flagged++;
            emit(record, records, listener);
        }

        logger.info("Sesion terminada: {} registros, {} marcados", records.size(), flagged);
        return records;
    }

    private PhotometryRecord measureFrame(int index, PixelFrame frame, TrackStep step, ApertureRadii radii) {
        if (!step.hasCenter()) {
            logger.warn("Frame {}: seguimiento perdido, sin medida", index);
            return PhotometryRecord.flagged(index, PhotometryRecord.Status.TRACK_LOST,
                    "seguimiento perdido", step, frame.isRgb(), frame.getMetadata());
        }
        try {
            Map<Channel, FluxMeasurement> flux = measurer.measure(frame, radii.at(step.center));
            logger.debug("Frame {}: {}", index, flux.values());
            return PhotometryRecord.measured(index, step, flux, frame.isRgb(), frame.getMetadata());
        } catch (InsufficientPixelsException e) {
            logger.warn("Frame {}: {}", index, e.getMessage());
            return PhotometryRecord.flagged(index, PhotometryRecord.Status.INSUFFICIENT_PIXELS,
                    e.getMessage(), step, frame.isRgb(), frame.getMetadata());
        } catch (RuntimeException e) {
            logger.warn("Frame {}: fallo en la medida", index, e);
            return PhotometryRecord.flagged(index, PhotometryRecord.Status.FAILED,
                    "error de medida: " + e.getMessage(), step, frame.isRgb(), frame.getMetadata());
        }
    }

    private static void emit(PhotometryRecord record, List<PhotometryRecord> records,
                             Consumer<PhotometryRecord> listener) {
        records.add(record);
        listener.accept(record);
    }

    // Lanza la sesión en un hilo propio
    public SessionHandle submit(FrameSource source, PixelPosition seed, CenterProvider provider,
                                ApertureRadii radii, SeedSupplier reseeder, Consumer<PhotometryRecord> listener) {
        Objects.requireNonNull(radii, "radii");
        AtomicBoolean cancelled = new AtomicBoolean(false);
        ExecutorService executor = Workers.newSessionExecutor();
        try {
            Future<List<PhotometryRecord>> future = executor.submit(
                    () -> run(source, seed, provider, radii, reseeder, listener, cancelled::get));
            return new SessionHandle(future, cancelled);
        } finally {
            executor.shutdown();
        }
    }

    public SessionHandle submit(FrameSource source, PixelPosition seed, CenterProvider provider,
                                ApertureRadii radii, Consumer<PhotometryRecord> listener) {
        return submit(source, seed, provider, radii, null, listener);
    }

    static FrameSource listSource(List<PixelFrame> frames) {
        List<PixelFrame> copy = List.copyOf(frames);
        return new FrameSource() {
            @Override
            public int size() { return copy.size(); }

            @Override
            public PixelFrame load(int index) { return copy.get(index); }
        };
    }
}
