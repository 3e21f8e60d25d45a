package com.astrophot.service;

import com.astrophot.model.FrameMetadata;
import com.astrophot.model.MasterFrame;
import com.astrophot.model.PixelFrame;
import ij.process.FloatProcessor;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class FitsFrameService {

    private static final Logger logger = LoggerFactory.getLogger(FitsFrameService.class);

    // Claves que se copian tal cual a FrameMetadata.getKeywords()
    static final String[] EXTRA_KEYWORDS = {
            "JD", "JD-OBS", "MJD", "MJD-OBS", "XPIXSZ", "YPIXSZ", "XBINNING", "YBINNING",
            "CCD-TEMP", "AIRMASS", "RA", "DEC", "IMAGETYP", "FOCALLEN"
    };

    public PixelFrame read(File file) throws IOException {
        try (Fits fits = new Fits(file)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new IOException("Sin HDU primario: " + file.getName());
            Header header = hdu.getHeader();
            double bzero = header.getDoubleValue("BZERO", 0.0);
            double bscale = header.getDoubleValue("BSCALE", 1.0);

            List<FloatProcessor> planes = toPlanes(hdu.getKernel(), bzero, bscale, file);
            FrameMetadata meta = readMetadata(header, baseName(file));
            logger.debug("Leido {} ({} planos, {}x{})", file.getName(), planes.size(),
                    planes.get(0).getWidth(), planes.get(0).getHeight());
            return new PixelFrame(planes, meta);
        } catch (FitsException e) {
            throw new IOException("No se pudo leer " + file.getName() + ": " + e.getMessage(), e);
        }
    }

    FrameMetadata readMetadata(Header header, String sourceName) {
        FrameMetadata.Builder b = FrameMetadata.builder().sourceName(sourceName);

        // Intentar leer claves estándar y variantes
        double exposure = header.getDoubleValue("EXPTIME", 0);
        if (exposure == 0) exposure = header.getDoubleValue("EXPOSURE", 0);
        b.exposureTime(exposure);

        double gain = header.getDoubleValue("GAIN", -1);
        if (gain == -1) gain = header.getDoubleValue("EGAIN", 0);
        b.gain(gain);
        b.offset(header.getDoubleValue("OFFSET", 0));

        b.filter(header.getStringValue("FILTER"))
                .dateObs(header.getStringValue("DATE-OBS"))
                .instrument(header.getStringValue("INSTRUME"))
                .telescope(header.getStringValue("TELESCOP"))
                .object(header.getStringValue("OBJECT"));

        for (String key : EXTRA_KEYWORDS) {
            HeaderCard card = header.findCard(key);
            if (card != null && card.getValue() != null) b.keyword(key, card.getValue().trim());
        }
        // solo se reconocen las marcas de procesado que escribe esta clase
        for (String mark : new String[]{FrameMetadata.HISTORY_BIAS_DARK_CORRECTED,
                FrameMetadata.HISTORY_CALIBRATED, FrameMetadata.HISTORY_MASTER}) {
            if (header.getBooleanValue(historyKey(mark), false)) b.history(mark);
        }
        return b.build();
    }

    private static List<FloatProcessor> toPlanes(Object kernel, double bzero, double bscale, File file) throws IOException {
        List<FloatProcessor> planes = new ArrayList<>(3);
        if (kernel instanceof Object[] && ((Object[]) kernel).length > 0 && ((Object[]) kernel)[0] instanceof Object[]) {
            // cubo NAXIS3 = 3: un plano por canal
            Object[] cube = (Object[]) kernel;
            if (cube.length != 3) {
                throw new IOException(file.getName() + ": se esperaban 3 planos (RGB), hay " + cube.length);
            }
            for (Object plane : cube) planes.add(toProcessor(plane, bzero, bscale, file));
        } else {
            planes.add(toProcessor(kernel, bzero, bscale, file));
        }
        return planes;
    }

    private static FloatProcessor toProcessor(Object k, double bzero, double bscale, File file) throws IOException {
        if (!(k instanceof Object[]) || ((Object[]) k).length == 0) {
            throw new IOException(file.getName() + ": formato de datos no soportado");
        }
        int h = ((Object[]) k).length;
        int w = Array.getLength(((Object[]) k)[0]);
        float[] px = new float[w * h];
        for (int y = 0; y < h; y++) {
            Object row = ((Object[]) k)[y];
            for (int x = 0; x < w; x++) {
                px[y * w + x] = (float) (bzero + bscale * rawValue(row, x));
            }
        }
        return new FloatProcessor(w, h, px);
    }

    private static double rawValue(Object row, int x) {
        if (row instanceof short[]) return ((short[]) row)[x];
        if (row instanceof float[]) return ((float[]) row)[x];
        if (row instanceof int[]) return ((int[]) row)[x];
        if (row instanceof double[]) return ((double[]) row)[x];
        if (row instanceof byte[]) return ((byte[]) row)[x] & 0xFF; // BITPIX 8 es sin signo
        if (row instanceof long[]) return ((long[]) row)[x];
        throw new IllegalArgumentException("Tipo de fila no soportado: " + row.getClass().getSimpleName());
    }

    public void write(PixelFrame frame, File file) throws IOException {
        write(frame, file, null);
    }

    // Escribe un master con su rol y el número de frames combinados
    public void writeMaster(MasterFrame master, File file) throws IOException {
        write(master.getFrame(), file, master);
    }

    private void write(PixelFrame frame, File file, MasterFrame master) throws IOException {
        int w = frame.getWidth(), h = frame.getHeight();
        Object data;
        if (frame.isRgb()) {
            float[][][] cube = new float[3][][];
            for (int c = 0; c < 3; c++) cube[c] = toRows(frame.copyPixels(c), w, h);
            data = cube;
        } else {
            data = toRows(frame.copyPixels(0), w, h);
        }

        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(data);
            writeHeader(hdu.getHeader(), frame.getMetadata(), master);
            fits.addHDU(hdu);
            fits.write(file);
            logger.info("Guardado {} ({})", file.getName(), frame.shapeString());
        } catch (FitsException e) {
            throw new IOException("No se pudo escribir " + file.getName() + ": " + e.getMessage(), e);
        }
    }

    private static void writeHeader(Header header, FrameMetadata meta, MasterFrame master) throws FitsException {
        if (meta.hasExposureTime()) header.addValue("EXPTIME", meta.exposureTime, "Exposure time [s]");
        if (meta.gain != 0) header.addValue("GAIN", meta.gain, "Sensor gain");
        if (meta.offset != 0) header.addValue("OFFSET", meta.offset, "Sensor offset");
        addString(header, "FILTER", meta.filter);
        addString(header, "DATE-OBS", meta.dateObs);
        addString(header, "INSTRUME", meta.instrument);
        addString(header, "TELESCOP", meta.telescope);
        addString(header, "OBJECT", meta.object);

        for (Map.Entry<String, String> e : meta.getKeywords().entrySet()) {
            if (e.getKey().length() > 8 || header.containsKey(e.getKey())) {
                logger.debug("Clave {} omitida al escribir", e.getKey());
                continue;
            }
            header.addValue(e.getKey(), e.getValue(), null);
        }
        if (master != null) {
            if (!header.containsKey("IMAGETYP")) header.addValue("IMAGETYP", master.getRole().name(), "Calibration role");
            header.addValue("NCOMBINE", master.getFrameCount(), "Frames combined");
        }
        for (String mark : meta.getHistory()) {
            header.addValue(historyKey(mark), true, "Processing history");
        }
    }

    private static void addString(Header header, String key, String value) throws FitsException {
        if (value != null && !value.isEmpty()) header.addValue(key, value, null);
    }

    // Las marcas de procesado van como claves lógicas cortas (8 caracteres máximo)
    static String historyKey(String mark) {
        switch (mark) {
            case FrameMetadata.HISTORY_BIAS_DARK_CORRECTED: return "BDCORR";
            case FrameMetadata.HISTORY_CALIBRATED: return "CALIBRAT";
            case FrameMetadata.HISTORY_MASTER: return "MASTER";
            default: return mark.length() > 8 ? mark.substring(0, 8) : mark;
        }
    }

    private static float[][] toRows(float[] px, int w, int h) {
        float[][] rows = new float[h][w];
        for (int y = 0; y < h; y++) System.arraycopy(px, y * w, rows[y], 0, w);
        return rows;
    }

    static String baseName(File file) {
        String name = file.getName();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
