package com.astrophot.model;

import ij.process.FloatProcessor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class PixelFrame {

    private static final List<Channel> GRAY_CHANNELS = Collections.singletonList(Channel.GRAY);
    private static final List<Channel> RGB_CHANNELS = List.of(Channel.R, Channel.G, Channel.B, Channel.GRAY);

    private final FloatProcessor[] planes;
    private final FrameMetadata metadata;
    private final int width;
    private final int height;

    private volatile FloatProcessor derivedGray;

    public PixelFrame(List<FloatProcessor> planes, FrameMetadata metadata) {
        Objects.requireNonNull(planes, "planes");
        if (planes.size() != 1 && planes.size() != 3) {
            throw new IllegalArgumentException("Se esperaba 1 plano (gris) o 3 (RGB), llegaron " + planes.size());
        }
        this.width = planes.get(0).getWidth();
        this.height = planes.get(0).getHeight();
        this.planes = new FloatProcessor[planes.size()];
        for (int i = 0; i < planes.size(); i++) {
            FloatProcessor p = planes.get(i);
            if (p.getWidth() != width || p.getHeight() != height) {
                throw new ShapeMismatchException("Planos de distinto tamano dentro del mismo frame");
            }
            this.planes[i] = (FloatProcessor) p.duplicate();
        }
        this.metadata = metadata == null ? FrameMetadata.EMPTY : metadata;
    }

    public static PixelFrame grayscale(int width, int height, float[] pixels, FrameMetadata metadata) {
        return new PixelFrame(Collections.singletonList(toProcessor(width, height, pixels)), metadata);
    }

    public static PixelFrame rgb(int width, int height, float[] r, float[] g, float[] b, FrameMetadata metadata) {
        List<FloatProcessor> list = new ArrayList<>(3);
        list.add(toProcessor(width, height, r));
        list.add(toProcessor(width, height, g));
        list.add(toProcessor(width, height, b));
        return new PixelFrame(list, metadata);
    }

    // Frame de valor constante, útil para masters sintéticos
    public static PixelFrame constant(int width, int height, int channels, float value, FrameMetadata metadata) {
        List<FloatProcessor> list = new ArrayList<>(channels);
        for (int c = 0; c < channels; c++) {
            float[] px = new float[width * height];
            Arrays.fill(px, value);
            list.add(new FloatProcessor(width, height, px));
        }
        return new PixelFrame(list, metadata);
    }

    private static FloatProcessor toProcessor(int width, int height, float[] pixels) {
        if (pixels.length != width * height) {
            throw new IllegalArgumentException("Se esperaban " + (width * height) + " pixeles, llegaron " + pixels.length);
        }
        return new FloatProcessor(width, height, pixels.clone());
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getChannelCount() { return planes.length; }
    public boolean isRgb() { return planes.length == 3; }
    public FrameMetadata getMetadata() { return metadata; }

    public boolean contains(int x, int y) { return x >= 0 && y >= 0 && x < width && y < height; }

    public double getValue(int plane, int x, int y) { return planes[plane].getf(x, y); }

    // Lectura directa por canal, sin copiar el plano
    public double getValue(Channel channel, int x, int y) {
        return readable(channel).getf(x, y);
    }

    // Copia del plano físico con ese índice
    public FloatProcessor getPlane(int index) { return (FloatProcessor) planes[index].duplicate(); }

    // Copia de los píxeles del plano físico con ese índice
    public float[] copyPixels(int index) { return ((float[]) planes[index].getPixels()).clone(); }

    // Copia del plano de un canal; GRAY en un frame RGB es la media por pixel de R, G y B
    public FloatProcessor getPlane(Channel channel) {
        return (FloatProcessor) readable(channel).duplicate();
    }

    private FloatProcessor readable(Channel channel) {
        if (channel == Channel.GRAY) {
            return isRgb() ? derivedGray() : planes[0];
        }
        if (!isRgb()) {
            throw new IllegalArgumentException("El canal " + channel + " no existe en un frame en escala de grises");
        }
        return planes[channel.planeIndex()];
    }


    public List<Channel> getMeasurableChannels() { return isRgb() ? RGB_CHANNELS : GRAY_CHANNELS; }

    public PixelFrame withMetadata(FrameMetadata newMetadata) {
        return new PixelFrame(Arrays.asList(planes), newMetadata);
    }

    public boolean sameShape(PixelFrame other) {
        return other != null && width == other.width && height == other.height && planes.length == other.planes.length;
    }

    public String shapeString() { return planes.length + "x" + height + "x" + width; }

    private FloatProcessor derivedGray() {
        FloatProcessor gray = derivedGray;
        if (gray == null) {
            float[] r = (float[]) planes[0].getPixels();
            float[] g = (float[]) planes[1].getPixels();
            float[] b = (float[]) planes[2].getPixels();
            float[] out = new float[r.length];
            for (int i = 0; i < out.length; i++) out[i] = (float) (((double) r[i] + g[i] + b[i]) / 3.0);
            gray = new FloatProcessor(width, height, out);
            derivedGray = gray;
        }
        return gray;
    }
}
