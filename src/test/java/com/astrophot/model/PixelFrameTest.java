package com.astrophot.model;

import ij.process.FloatProcessor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PixelFrameTest {

    @Test
    void inputArrayIsCopied() {
        float[] px = {1, 2, 3, 4};
        PixelFrame frame = PixelFrame.grayscale(2, 2, px, null);
        px[0] = 99;
        assertEquals(1.0, frame.getValue(0, 0, 0), 0);
    }

    @Test
    void planesHandedOutAreCopies() {
        PixelFrame frame = PixelFrame.constant(3, 3, 1, 5f, null);
        FloatProcessor plane = frame.getPlane(0);
        plane.setf(1, 1, 1000f);
        frame.copyPixels(0)[0] = -1f;

        assertEquals(5.0, frame.getValue(0, 1, 1), 0);
        assertEquals(5.0, frame.getValue(0, 0, 0), 0);
    }

    @Test
    void derivedGrayIsChannelMean() {
        PixelFrame rgb = PixelFrame.rgb(1, 2, new float[]{3, 0}, new float[]{6, 0}, new float[]{9, 3}, null);

        FloatProcessor gray = rgb.getPlane(Channel.GRAY);

        assertEquals(6.0, gray.getf(0, 0), 1e-6);
        assertEquals(1.0, gray.getf(0, 1), 1e-6);
        assertEquals(List.of(Channel.R, Channel.G, Channel.B, Channel.GRAY), rgb.getMeasurableChannels());
    }

    @Test
    void channelValuesAreReadWithoutCopying() {
        PixelFrame rgb = PixelFrame.rgb(1, 2, new float[]{3, 0}, new float[]{6, 0}, new float[]{9, 3}, null);

        assertEquals(6.0, rgb.getValue(Channel.G, 0, 0), 0);
        assertEquals(6.0, rgb.getValue(Channel.GRAY, 0, 0), 1e-6);
        assertEquals(1.0, rgb.getValue(Channel.GRAY, 0, 1), 1e-6);
        assertThrows(IllegalArgumentException.class,
                () -> PixelFrame.constant(2, 2, 1, 0f, null).getValue(Channel.R, 0, 0));
    }

    @Test
    void shapeIncludesChannelCount() {
        PixelFrame gray = PixelFrame.constant(4, 3, 1, 0f, null);
        PixelFrame rgb = PixelFrame.constant(4, 3, 3, 0f, null);
        assertFalse(gray.sameShape(rgb));
        assertEquals("3x3x4", rgb.shapeString());
    }

    @Test
    void rejectsUnsupportedPlaneCount() {
        FloatProcessor p = new FloatProcessor(2, 2);
        assertThrows(IllegalArgumentException.class, () -> new PixelFrame(List.of(p, p), null));
        assertThrows(IllegalArgumentException.class, () -> PixelFrame.grayscale(2, 2, new float[3], null));
    }

    @Test
    void missingMetadataBecomesEmpty() {
        PixelFrame frame = PixelFrame.constant(2, 2, 1, 0f, null);
        assertSame(FrameMetadata.EMPTY, frame.getMetadata());
        assertFalse(frame.getMetadata().hasExposureTime());
    }
}
