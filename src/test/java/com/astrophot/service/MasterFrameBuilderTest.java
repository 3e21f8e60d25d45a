package com.astrophot.service;

import com.astrophot.model.CalibrationRole;
import com.astrophot.model.CombineMethod;
import com.astrophot.model.FrameMetadata;
import com.astrophot.model.MasterFrame;
import com.astrophot.model.PhotometryConfig;
import com.astrophot.model.PixelFrame;
import com.astrophot.model.ShapeMismatchException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class MasterFrameBuilderTest {

    private final MasterFrameBuilder builder = new MasterFrameBuilder();

    @Test
    void constantFramesGiveConstantMaster() {
        for (int n = 1; n <= 4; n++) {
            List<PixelFrame> frames = Collections.nCopies(n, PixelFrame.constant(8, 6, 1, 512f, null));
            MasterFrame master = builder.build(frames, CalibrationRole.BIAS);

            assertEquals(n, master.getFrameCount());
            for (float v : master.getFrame().copyPixels(0)) assertEquals(512f, v, 0f);
        }
    }

    @Test
    void medianIgnoresSingleHotFrame() {
        List<PixelFrame> frames = new ArrayList<>();
        frames.add(PixelFrame.constant(4, 4, 1, 100f, null));
        frames.add(PixelFrame.constant(4, 4, 1, 102f, null));
        frames.add(PixelFrame.constant(4, 4, 1, 60000f, null));

        MasterFrame master = builder.build(frames, CalibrationRole.DARK);

        assertEquals(102f, master.getFrame().getValue(0, 2, 2), 0f);
    }

    @Test
    void meanCombination() {
        MasterFrameBuilder mean = new MasterFrameBuilder(CombineMethod.MEAN, null, new Calibrator());
        List<PixelFrame> frames = List.of(
                PixelFrame.constant(4, 4, 1, 10f, null),
                PixelFrame.constant(4, 4, 1, 20f, null));

        assertEquals(15f, mean.build(frames, CalibrationRole.BIAS).getFrame().getValue(0, 0, 0), 1e-6f);
    }

    @Test
    void rgbMasterKeepsOnePlanePerChannel() {
        PixelFrame rgb = PixelFrame.rgb(3, 3,
                filled(9, 1f), filled(9, 2f), filled(9, 3f), null);
        MasterFrame master = builder.build(List.of(rgb, rgb), CalibrationRole.BIAS);

        assertTrue(master.getFrame().isRgb());
        assertEquals(1f, master.getFrame().getValue(0, 1, 1), 0f);
        assertEquals(2f, master.getFrame().getValue(1, 1, 1), 0f);
        assertEquals(3f, master.getFrame().getValue(2, 1, 1), 0f);
    }

    @Test
    void parallelBuildMatchesSequential() {
        List<PixelFrame> frames = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            frames.add(PixelFrame.grayscale(70, 150, SyntheticFrames.gaussian(70, 150, 1000, 15, i), null));
        }
        ExecutorService pool = Workers.newPool(4);
        try {
            MasterFrame parallel = new MasterFrameBuilder(CombineMethod.MEDIAN, pool, new Calibrator())
                    .build(frames, CalibrationRole.DARK);
            MasterFrame sequential = builder.build(frames, CalibrationRole.DARK);
            assertArrayEquals(sequential.getFrame().copyPixels(0), parallel.getFrame().copyPixels(0));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void combineMethodComesFromPreferences() {
        CombineMethod saved = PhotometryConfig.getCombineMethod();
        try {
            PhotometryConfig.setCombineMethod(CombineMethod.MEAN);
            MasterFrameBuilder fromPrefs = MasterFrameBuilder.fromPreferences(null);
            List<PixelFrame> frames = List.of(
                    PixelFrame.constant(4, 4, 1, 10f, null),
                    PixelFrame.constant(4, 4, 1, 20f, null),
                    PixelFrame.constant(4, 4, 1, 60f, null));

            assertEquals(CombineMethod.MEAN, fromPrefs.getMethod());
            assertEquals(30f, fromPrefs.build(frames, CalibrationRole.BIAS).getFrame().getValue(0, 1, 1), 1e-5f);
        } finally {
            PhotometryConfig.setCombineMethod(saved);
        }
    }

    @Test
    void emptyInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> builder.build(List.of(), CalibrationRole.BIAS));
    }

    @Test
    void shapeMismatchIsRejected() {
        List<PixelFrame> frames = List.of(
                PixelFrame.constant(4, 4, 1, 1f, null),
                PixelFrame.constant(4, 5, 1, 1f, null));
        assertThrows(ShapeMismatchException.class, () -> builder.build(frames, CalibrationRole.BIAS));

        List<PixelFrame> channels = List.of(
                PixelFrame.constant(4, 4, 1, 1f, null),
                PixelFrame.constant(4, 4, 3, 1f, null));
        assertThrows(ShapeMismatchException.class, () -> builder.build(channels, CalibrationRole.BIAS));
    }

    @Test
    void uncorrectedFlatsAreRejected() {
        List<PixelFrame> raw = List.of(PixelFrame.constant(4, 4, 1, 20000f, null));
        assertThrows(IllegalStateException.class, () -> builder.build(raw, CalibrationRole.FLAT));
    }

    @Test
    void buildFlatSubtractsBiasAndDarkFirst() {
        MasterFrame bias = builder.build(List.of(PixelFrame.constant(4, 4, 1, 100f, null)), CalibrationRole.BIAS);
        MasterFrame dark = builder.build(List.of(PixelFrame.constant(4, 4, 1, 20f, null)), CalibrationRole.DARK);
        List<PixelFrame> raw = List.of(
                PixelFrame.constant(4, 4, 1, 20120f, null),
                PixelFrame.constant(4, 4, 1, 20120f, null));

        MasterFrame flat = builder.buildFlat(raw, bias, dark);

        assertEquals(CalibrationRole.FLAT, flat.getRole());
        assertTrue(flat.isBiasDarkCorrected());
        assertEquals(20000f, flat.getFrame().getValue(0, 3, 3), 0f);
    }

    @Test
    void masterMetadataRecordsCombination() {
        List<PixelFrame> frames = List.of(
                PixelFrame.constant(4, 4, 1, 5f, SyntheticFrames.exposure(60)),
                PixelFrame.constant(4, 4, 1, 5f, SyntheticFrames.exposure(60)));

        FrameMetadata meta = builder.build(frames, CalibrationRole.DARK).getFrame().getMetadata();

        assertEquals(60.0, meta.exposureTime, 0);
        assertEquals("DARK", meta.getKeywords().get("IMAGETYP"));
        assertEquals("2", meta.getKeywords().get("NFRAMES"));
        assertTrue(meta.hasHistory(FrameMetadata.HISTORY_MASTER));
    }

    private static float[] filled(int n, float v) {
        float[] a = new float[n];
        Arrays.fill(a, v);
        return a;
    }
}
