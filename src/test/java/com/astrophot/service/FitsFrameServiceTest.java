package com.astrophot.service;

import com.astrophot.model.CalibrationRole;
import com.astrophot.model.FrameMetadata;
import com.astrophot.model.MasterFrame;
import com.astrophot.model.PixelFrame;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.Header;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FitsFrameServiceTest {

    @TempDir
    Path tmp;

    private final FitsFrameService service = new FitsFrameService();

    @Test
    void grayscaleFrameSurvivesWriteAndRead() throws Exception {
        float[] px = SyntheticFrames.gaussian(32, 24, 1000, 30, 5);
        FrameMetadata meta = FrameMetadata.builder()
                .exposureTime(120)
                .filter("V")
                .dateObs("2024-03-01T21:15:00")
                .object("RR Lyr")
                .keyword("JD", "2460371.38542")
                .history(FrameMetadata.HISTORY_CALIBRATED)
                .build();
        File file = tmp.resolve("light_001.fits").toFile();

        service.write(PixelFrame.grayscale(32, 24, px, meta), file);
        PixelFrame back = service.read(file);

        assertEquals(32, back.getWidth());
        assertEquals(24, back.getHeight());
        assertFalse(back.isRgb());
        assertArrayEquals(px, back.copyPixels(0), 0f);
        assertEquals(120.0, back.getMetadata().exposureTime, 0);
        assertEquals("V", back.getMetadata().filter);
        assertEquals("2024-03-01T21:15:00", back.getMetadata().dateObs);
        assertEquals("RR Lyr", back.getMetadata().object);
        assertEquals("light_001", back.getMetadata().sourceName);
        assertEquals("2460371.38542", back.getMetadata().getKeywords().get("JD"));
        assertTrue(back.getMetadata().hasHistory(FrameMetadata.HISTORY_CALIBRATED));
    }

    @Test
    void rgbCubeKeepsChannelOrder() throws Exception {
        PixelFrame rgb = SyntheticFrames.rgbStar(20, 20, 10, 10, 100, 200, 300);
        File file = tmp.resolve("rgb.fits").toFile();

        service.write(rgb, file);
        PixelFrame back = service.read(file);

        assertTrue(back.isRgb());
        for (int c = 0; c < 3; c++) assertArrayEquals(rgb.copyPixels(c), back.copyPixels(c), 0f);
    }

    @Test
    void integerDataIsScaledWithBzero() throws Exception {
        short[][] raw = new short[4][5];
        for (int y = 0; y < 4; y++) for (int x = 0; x < 5; x++) raw[y][x] = (short) (y * 5 + x - 32768);
        File file = tmp.resolve("raw16.fits").toFile();
        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(raw);
            Header h = hdu.getHeader();
            h.addValue("BZERO", 32768.0, null);
            h.addValue("BSCALE", 1.0, null);
            h.addValue("EXPOSURE", 30.0, null);
            fits.addHDU(hdu);
            fits.write(file);
        }

        PixelFrame frame = service.read(file);

        assertEquals(0.0, frame.getValue(0, 0, 0), 0);
        assertEquals(19.0, frame.getValue(0, 4, 3), 0);
        assertEquals(30.0, frame.getMetadata().exposureTime, 0);
    }

    @Test
    void masterCarriesRoleAndFrameCount() throws Exception {
        MasterFrame master = new MasterFrameBuilder().build(
                List.of(PixelFrame.constant(6, 6, 1, 300f, null), PixelFrame.constant(6, 6, 1, 300f, null)),
                CalibrationRole.BIAS);
        File file = tmp.resolve("master_bias.fits").toFile();

        service.writeMaster(master, file);

        try (Fits fits = new Fits(file)) {
            Header h = fits.getHDU(0).getHeader();
            assertEquals("BIAS", h.getStringValue("IMAGETYP"));
            assertEquals(2, h.getIntValue("NCOMBINE"));
        }
        assertTrue(service.read(file).getMetadata().hasHistory(FrameMetadata.HISTORY_MASTER));
    }

    @Test
    void unreadableFileRaisesIOException() throws Exception {
        File file = tmp.resolve("broken.fits").toFile();
        Files.writeString(file.toPath(), "esto no es un FITS");
        assertThrows(IOException.class, () -> service.read(file));
    }

    @Test
    void directorySourceListsFitsFilesByName() throws Exception {
        service.write(SyntheticFrames.blank(4, 4, 1f), tmp.resolve("b.fits").toFile());
        service.write(SyntheticFrames.blank(4, 4, 2f), tmp.resolve("a.fit").toFile());
        Files.writeString(tmp.resolve("notes.txt"), "x");

        FitsFrameSource source = FitsFrameSource.fromDirectory(tmp.toFile(), service);

        assertEquals(2, source.size());
        assertEquals(2.0, source.load(0).getValue(0, 0, 0), 0);
        assertEquals(1.0, source.load(1).getValue(0, 0, 0), 0);
    }
}
