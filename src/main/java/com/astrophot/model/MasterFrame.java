package com.astrophot.model;

import ij.process.FloatProcessor;

import java.util.Objects;

public final class MasterFrame {
    private final CalibrationRole role;
    private final PixelFrame frame;
    private final int frameCount;

    public MasterFrame(CalibrationRole role, PixelFrame frame, int frameCount) {
        this.role = Objects.requireNonNull(role, "role");
        this.frame = Objects.requireNonNull(frame, "frame");
        this.frameCount = frameCount;
    }

    public CalibrationRole getRole() { return role; }
    public PixelFrame getFrame() { return frame; }
    public int getFrameCount() { return frameCount; }
    public FloatProcessor getPlane(int index) { return frame.getPlane(index); }

    // Un flat construido con buildFlat ya lleva restados bias y dark
    public boolean isBiasDarkCorrected() {
        return frame.getMetadata().hasHistory(FrameMetadata.HISTORY_BIAS_DARK_CORRECTED);
    }

    @Override
    public String toString() {
        return "MasterFrame[" + role + ", " + frame.shapeString() + ", n=" + frameCount + "]";
    }
}
