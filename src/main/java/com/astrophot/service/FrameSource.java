package com.astrophot.service;

import com.astrophot.model.PixelFrame;

import java.io.IOException;

/**
 * Secuencia ordenada de frames que se cargan bajo demanda.
 */
public interface FrameSource {

    int size();

    PixelFrame load(int index) throws IOException;
}
