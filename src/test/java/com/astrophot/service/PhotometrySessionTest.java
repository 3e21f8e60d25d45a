package com.astrophot.service;

import com.astrophot.model.ApertureRadii;
import com.astrophot.model.Channel;
import com.astrophot.model.InvalidApertureException;
import com.astrophot.model.PhotometryRecord;
import com.astrophot.model.PixelFrame;
import com.astrophot.model.PixelPosition;
import com.astrophot.model.TrackingTolerances;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PhotometrySessionTest {

    private static final double[] FLUXES = {1000, 1010, 990, 1005, 995};

    private final PhotometrySession session = new PhotometrySession();

    @Test
    void staticStarLightCurve() {
        List<PixelFrame> frames = new ArrayList<>();
        for (double f : FLUXES) frames.add(SyntheticFrames.star(100, 100, 50, 50, f));

        List<PhotometryRecord> records = session.run(frames, new PixelPosition(50, 50),
                TrackingMode.AUTOMATIC, TrackingTolerances.defaults());

        assertEquals(5, records.size());
        for (int i = 0; i < 5; i++) {
            PhotometryRecord r = records.get(i);
            assertEquals(i, r.imageIndex);
            assertEquals(PhotometryRecord.Status.OK, r.status);
            assertTrue(r.tracked);
            assertEquals(0.0, r.movementPixels, 1e-9);
            double flux = r.getMeasurement(Channel.GRAY).correctedFlux;
            assertEquals(FLUXES[i], flux, FLUXES[i] * 0.01);
        }
    }

    @Test
    void staticStarWithNeighbourStaysTracked() {
        float[] px = SyntheticFrames.starPixels(100, 100, 50, 50, 3, 5000, 0f);
        float[] other = SyntheticFrames.starPixels(100, 100, 70, 50, 3, 5000, 0f);
        for (int i = 0; i < px.length; i++) px[i] += other[i];
        List<PixelFrame> frames = new ArrayList<>();
        for (int i = 0; i < 8; i++) frames.add(PixelFrame.grayscale(100, 100, px, null));

        List<PhotometryRecord> records = session.run(frames, new PixelPosition(50, 50),
                TrackingMode.AUTOMATIC, TrackingTolerances.defaults());

        for (PhotometryRecord r : records) {
            assertEquals(PhotometryRecord.Status.OK, r.status, "frame " + r.imageIndex);
            assertTrue(r.tracked);
            assertEquals(50.0, r.position.x, 1e-6);
            assertEquals(0.0, r.movementPixels, 1e-6);
        }
    }

    @Test
    void manualModeMeasuresAtSeed() {
        List<PixelFrame> frames = new ArrayList<>();
        for (double f : FLUXES) frames.add(SyntheticFrames.star(100, 100, 50, 50, f));

        List<PhotometryRecord> records = session.run(frames, new PixelPosition(50, 50),
                TrackingMode.MANUAL, TrackingTolerances.defaults());

        assertEquals(5, records.size());
        for (PhotometryRecord r : records) {
            assertFalse(r.tracked);
            assertEquals(new PixelPosition(50, 50), r.position);
        }
    }

    @Test
    void edgeFrameIsFlaggedAndSessionContinues() {
        List<PixelFrame> frames = new ArrayList<>();
        frames.add(SyntheticFrames.star(100, 100, 50, 50, 1000));
        frames.add(SyntheticFrames.star(100, 100, 50, 50, 1000));
        ManualCenterProvider provider = new ManualCenterProvider(List.of(
                new PixelPosition(50, 50), new PixelPosition(-200, -200)), 5);

        List<PhotometryRecord> records = session.run(PhotometrySession.listSource(frames), new PixelPosition(50, 50),
                provider, ApertureRadii.defaults(), r -> { }, () -> false);

        assertEquals(PhotometryRecord.Status.OK, records.get(0).status);
        assertEquals(PhotometryRecord.Status.INSUFFICIENT_PIXELS, records.get(1).status);
        assertTrue(records.get(1).getMeasurements().isEmpty());
    }

    @Test
    void lostTrackIsFlaggedUntilReseeded() {
        List<PixelFrame> frames = new ArrayList<>();
        frames.add(SyntheticFrames.star(100, 100, 50, 50, 2000));
        for (int i = 0; i < 3; i++) frames.add(SyntheticFrames.blank(100, 100, 0f));
        frames.add(SyntheticFrames.star(100, 100, 30, 30, 2000));
        CentroidTracker tracker = new CentroidTracker(TrackingTolerances.builder().maxConsecutiveFailures(1).build());
        SeedSupplier reseeder = (index, frame, lost) -> index == 4 ? new PixelPosition(30, 30) : null;

        List<PhotometryRecord> records = session.run(PhotometrySession.listSource(frames), new PixelPosition(50, 50),
                tracker, ApertureRadii.defaults(), reseeder, r -> { }, () -> false);

        assertEquals(5, records.size());
        assertEquals(PhotometryRecord.Status.OK, records.get(0).status);
        assertEquals(PhotometryRecord.Status.OK, records.get(1).status); // posición anterior
        assertFalse(records.get(1).tracked);
        assertEquals(PhotometryRecord.Status.TRACK_LOST, records.get(2).status);
        assertEquals(PhotometryRecord.Status.TRACK_LOST, records.get(3).status);
        assertEquals(PhotometryRecord.Status.OK, records.get(4).status);
        assertTrue(records.get(4).tracked);
    }

    @Test
    void unreadableFrameBecomesFailedRecord() {
        FrameSource source = new FrameSource() {
            @Override
            public int size() { return 3; }

            @Override
            public PixelFrame load(int index) throws IOException {
                if (index == 1) throw new IOException("fichero truncado");
                return SyntheticFrames.star(100, 100, 50, 50, 1000);
            }
        };

        List<PhotometryRecord> records = session.run(source, new PixelPosition(50, 50), new CentroidTracker(),
                ApertureRadii.defaults(), r -> { }, () -> false);

        assertEquals(3, records.size());
        assertEquals(PhotometryRecord.Status.FAILED, records.get(1).status);
        assertTrue(records.get(1).flag.contains("fichero truncado"));
        assertEquals(PhotometryRecord.Status.OK, records.get(2).status);
        assertEquals(2, records.get(2).imageIndex);
    }

    @Test
    void listenerSeesEveryRecordInOrder() {
        List<PixelFrame> frames = new ArrayList<>();
        for (double f : FLUXES) frames.add(SyntheticFrames.star(100, 100, 50, 50, f));
        List<Integer> seen = new ArrayList<>();

        session.run(PhotometrySession.listSource(frames), new PixelPosition(50, 50), new CentroidTracker(),
                ApertureRadii.defaults(), r -> seen.add(r.imageIndex), () -> false);

        assertEquals(List.of(0, 1, 2, 3, 4), seen);
    }

    @Test
    void cancellationStopsBetweenFrames() {
        List<PixelFrame> frames = new ArrayList<>();
        for (int i = 0; i < 10; i++) frames.add(SyntheticFrames.star(100, 100, 50, 50, 1000));
        AtomicInteger emitted = new AtomicInteger();

        List<PhotometryRecord> records = session.run(PhotometrySession.listSource(frames), new PixelPosition(50, 50),
                new CentroidTracker(), ApertureRadii.defaults(), r -> emitted.incrementAndGet(),
                () -> emitted.get() >= 3);

        assertEquals(3, records.size());
    }

    @Test
    void invalidRadiiFailBeforeAnyFrameIsRead() {
        AtomicInteger loads = new AtomicInteger();
        FrameSource source = new FrameSource() {
            @Override
            public int size() { return 3; }

            @Override
            public PixelFrame load(int index) {
                loads.incrementAndGet();
                return SyntheticFrames.star(100, 100, 50, 50, 1000);
            }
        };

        assertThrows(InvalidApertureException.class, () -> session.run(source, new PixelPosition(50, 50),
                new CentroidTracker(), new ApertureRadii(9, 8, 17), r -> { }, () -> false));
        assertEquals(0, loads.get());
    }

    @Test
    void backgroundSessionCanBeCancelled() throws Exception {
        List<PixelFrame> frames = new ArrayList<>();
        for (int i = 0; i < 50; i++) frames.add(SyntheticFrames.star(100, 100, 50, 50, 1000));
        CountDownLatch firstRecord = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        SessionHandle handle = session.submit(PhotometrySession.listSource(frames), new PixelPosition(50, 50),
                new CentroidTracker(), ApertureRadii.defaults(), r -> {
                    firstRecord.countDown();
                    awaitQuietly(release);
                });
        assertTrue(firstRecord.await(5, TimeUnit.SECONDS));
        handle.cancel();
        release.countDown();

        List<PhotometryRecord> records = handle.await();
        assertTrue(handle.isCancelled());
        assertTrue(handle.isDone());
        assertEquals(1, records.size());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("interrumpido");
        }
    }
}
