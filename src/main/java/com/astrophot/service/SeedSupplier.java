package com.astrophot.service;

import com.astrophot.model.PixelFrame;
import com.astrophot.model.PixelPosition;
import com.astrophot.model.TrackState;

/**
 * Nueva semilla para un seguimiento perdido (p. ej. una seleccion del usuario). {@code null} = seguir perdido.
 */
@FunctionalInterface
public interface SeedSupplier {
    PixelPosition reseed(int frameIndex, PixelFrame frame, TrackState lostState);
}
