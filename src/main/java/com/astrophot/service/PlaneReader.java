package com.astrophot.service;

import com.astrophot.model.Channel;
import com.astrophot.model.PixelFrame;
import ij.process.FloatProcessor;

// Acceso de solo lectura a un plano, sin copiarlo
interface PlaneReader {

    int width();

    int height();

    double get(int x, int y);

    static PlaneReader of(FloatProcessor plane) {
        return new PlaneReader() {
            @Override
            public int width() { return plane.getWidth(); }

            @Override
            public int height() { return plane.getHeight(); }

            @Override
            public double get(int x, int y) { return plane.getf(x, y); }
        };
    }

    static PlaneReader of(PixelFrame frame, Channel channel) {
        if (!frame.getMeasurableChannels().contains(channel)) {
            throw new IllegalArgumentException("El canal " + channel + " no existe en un frame " + frame.shapeString());
        }
        return new PlaneReader() {
            @Override
            public int width() { return frame.getWidth(); }

            @Override
            public int height() { return frame.getHeight(); }

            @Override
            public double get(int x, int y) { return frame.getValue(channel, x, y); }
        };
    }
}
