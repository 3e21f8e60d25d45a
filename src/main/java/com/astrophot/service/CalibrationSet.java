package com.astrophot.service;

import com.astrophot.model.CalibrationRole;
import com.astrophot.model.MasterFrame;
import com.astrophot.model.PhotometryException;
import com.astrophot.model.PixelFrame;
import com.astrophot.model.ShapeMismatchException;

import java.util.Arrays;

public final class CalibrationSet {

    final MasterFrame bias;
    final MasterFrame dark;
    final MasterFrame flat;

    final float[][] biasPlanes;
    final float[][] darkPlanes;
    final float[][] normalizedFlat;

    private final double flatReference;
    private final double[] flatChannelMeans;
    private final int clampedFlatPixels;
    private final PixelFrame shapeReference;

    CalibrationSet(MasterFrame bias, MasterFrame dark, MasterFrame flat, double flatFloor) {
        checkRole(bias, CalibrationRole.BIAS);
        checkRole(dark, CalibrationRole.DARK);
        checkRole(flat, CalibrationRole.FLAT);
        this.bias = bias;
        this.dark = dark;
        this.flat = flat;

        PixelFrame ref = null;
        for (MasterFrame m : new MasterFrame[]{bias, dark, flat}) {
            if (m == null) continue;
            if (ref == null) ref = m.getFrame();
            else ShapeMismatchException.check(ref, m.getFrame(), "master " + m.getRole());
        }
        this.shapeReference = ref;

        this.biasPlanes = planes(bias);
        this.darkPlanes = planes(dark);

        if (flat == null) {
            normalizedFlat = null;
            flatReference = Double.NaN;
            flatChannelMeans = new double[0];
            clampedFlatPixels = 0;
            return;
        }

        // Si el master flat ya viene corregido no se vuelve a restar el pedestal
        boolean subtractPedestal = !flat.isBiasDarkCorrected();
        int channels = flat.getFrame().getChannelCount();
        float[][] net = new float[channels][];
        flatChannelMeans = new double[channels];
        for (int c = 0; c < channels; c++) {
            float[] f = flat.getFrame().copyPixels(c);
            double sum = 0;
            for (int i = 0; i < f.length; i++) {
                double v = f[i];
                if (subtractPedestal) {
                    if (biasPlanes != null) v -= biasPlanes[c][i];
                    if (darkPlanes != null) v -= darkPlanes[c][i];
                }
                f[i] = (float) v;
                sum += v;
            }
            net[c] = f;
            flatChannelMeans[c] = sum / f.length;
        }

        // RGB: referencia común = mínimo de las medias por canal, conserva los cocientes de color
        double reference = Arrays.stream(flatChannelMeans).min().orElse(Double.NaN);
        if (!(reference > 0) || !Double.isFinite(reference)) {
            throw new PhotometryException("El master flat no tiene senal util (media " + reference + ")");
        }
        this.flatReference = reference;

        int clamped = 0;
        for (int c = 0; c < channels; c++) {
            float[] f = net[c];
            for (int i = 0; i < f.length; i++) {
                double nf = f[i] / reference;
                if (!(nf >= flatFloor)) {
                    nf = flatFloor;
                    clamped++;
                }
                f[i] = (float) nf;
            }
        }
        this.normalizedFlat = net;
        this.clampedFlatPixels = clamped;
    }

    private static void checkRole(MasterFrame m, CalibrationRole expected) {
        if (m != null && m.getRole() != expected) {
            throw new IllegalArgumentException("Se esperaba un master " + expected + " y llego " + m.getRole());
        }
    }

    private static float[][] planes(MasterFrame m) {
        if (m == null) return null;
        float[][] out = new float[m.getFrame().getChannelCount()][];
        for (int c = 0; c < out.length; c++) out[c] = m.getFrame().copyPixels(c);
        return out;
    }

    public MasterFrame getBias() { return bias; }
    public MasterFrame getDark() { return dark; }
    public MasterFrame getFlat() { return flat; }
    public boolean hasFlat() { return normalizedFlat != null; }

    // Valor que divide al flat neto; NaN sin flat
    public double getFlatReference() { return flatReference; }

    public double[] getFlatChannelMeans() { return flatChannelMeans.clone(); }

    // Píxeles del flat normalizado que se llevaron al suelo para no dividir por ~0
    public int getClampedFlatPixels() { return clampedFlatPixels; }

    public double normalizedFlatValue(int channel, int x, int y) {
        if (normalizedFlat == null) return 1.0;
        return normalizedFlat[channel][y * shapeReference.getWidth() + x];
    }

    void checkLight(PixelFrame light) {
        if (shapeReference != null) ShapeMismatchException.check(shapeReference, light, "light");
    }
}
