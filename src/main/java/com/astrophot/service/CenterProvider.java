package com.astrophot.service;

import com.astrophot.model.PixelFrame;
import com.astrophot.model.PixelPosition;
import com.astrophot.model.TrackState;
import com.astrophot.model.TrackStep;

/**
 * Decide el centro de medida de cada frame de una sesión.
 */
public interface CenterProvider {

    /** Estado inicial a partir de la posición elegida en el primer frame. */
    TrackState start(PixelPosition seed);

    /** Consume un frame: devuelve el nuevo estado y el centro a medir (o ninguno si esta perdido). */
    TrackStep next(TrackState state, PixelFrame frame);

    /** Vuelve a sembrar el seguimiento, normalmente tras perderlo. */
    default TrackState reseed(TrackState state, PixelPosition position) {
        return state.seed(position);
    }
}
