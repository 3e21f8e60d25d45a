package com.astrophot.model;

public class TrackLostException extends PhotometryException {
    private final int frameIndex;

    public TrackLostException(int frameIndex, int failures) {
        super(String.format("Seguimiento perdido en frame %d tras %d fallos consecutivos", frameIndex, failures));
        this.frameIndex = frameIndex;
    }

    public int getFrameIndex() { return frameIndex; }
}
