package com.astrophot.service;

import com.astrophot.model.ApertureRadii;
import com.astrophot.model.PhotometryRecord;
import com.astrophot.model.PixelFrame;
import com.astrophot.model.PixelPosition;
import ij.measure.ResultsTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultsExportServiceTest {

    @TempDir
    Path tmp;

    private final ResultsExportService export = new ResultsExportService();

    private List<PhotometryRecord> sessionRecords() {
        List<PixelFrame> frames = new ArrayList<>();
        frames.add(SyntheticFrames.rgbStar(100, 100, 50, 50, 300, 600, 900));
        frames.add(SyntheticFrames.rgbStar(100, 100, 50, 50, 310, 610, 910));
        return new PhotometrySession().run(PhotometrySession.listSource(frames), new PixelPosition(50, 50),
                new CentroidTracker(), ApertureRadii.defaults(), r -> { }, () -> false);
    }

    @Test
    void oneRowPerRecordWithChannelColumns() {
        ResultsTable rt = export.toResultsTable(sessionRecords());

        assertEquals(2, rt.size());
        assertTrue(rt.columnExists("r_flux_corrected"));
        assertTrue(rt.columnExists("gray_sky_std"));
        assertTrue(rt.columnExists("tracked_position"));
        assertEquals(900.0, rt.getValue("b_flux_corrected", 0), 0.1);
        assertEquals(1.0, rt.getValue("image_index", 1), 0);
        assertEquals("OK", rt.getStringValue("status", 0));
    }

    @Test
    void savesCsvWithHeader() throws Exception {
        File out = tmp.resolve("fotometria.csv").toFile();

        export.save(sessionRecords(), out);

        List<String> lines = Files.readAllLines(out.toPath());
        assertEquals(3, lines.size());
        assertTrue(lines.get(0).contains("image_index"));
        assertTrue(lines.get(0).contains("gray_flux_corrected"));
    }

    @Test
    void unwritablePathFails() {
        File out = tmp.resolve("no-existe").resolve("fotometria.csv").toFile();
        assertThrows(IOException.class, () -> export.save(sessionRecords(), out));
    }
}
