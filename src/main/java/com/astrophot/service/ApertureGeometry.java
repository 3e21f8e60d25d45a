package com.astrophot.service;

import com.astrophot.model.ApertureSpec;

import java.util.Arrays;
import java.util.Objects;

public final class ApertureGeometry {

    private final ApertureSpec spec;
    private final int[] apertureX;
    private final int[] apertureY;
    private final int[] annulusX;
    private final int[] annulusY;

    private ApertureGeometry(ApertureSpec spec, int[] apertureX, int[] apertureY, int[] annulusX, int[] annulusY) {
        this.spec = spec;
        this.apertureX = apertureX;
        this.apertureY = apertureY;
        this.annulusX = annulusX;
        this.annulusY = annulusY;
    }

    public static ApertureGeometry of(ApertureSpec spec, int width, int height) {
        Objects.requireNonNull(spec, "spec");
        double cx = spec.center.x, cy = spec.center.y;
        double rSrc = spec.sourceRadius(), rIn = spec.innerSkyRadius(), rOut = spec.outerSkyRadius();

        // caja envolvente del anillo exterior, recortada al frame
        int x0 = Math.max(0, (int) Math.floor(cx - rOut));
        int x1 = Math.min(width - 1, (int) Math.ceil(cx + rOut));
        int y0 = Math.max(0, (int) Math.floor(cy - rOut));
        int y1 = Math.min(height - 1, (int) Math.ceil(cy + rOut));

        int capacity = Math.max(0, (x1 - x0 + 1)) * Math.max(0, (y1 - y0 + 1));
        int[] ax = new int[capacity], ay = new int[capacity];
        int[] sx = new int[capacity], sy = new int[capacity];
        int na = 0, ns = 0;

        double src2 = rSrc * rSrc, in2 = rIn * rIn, out2 = rOut * rOut;
        for (int y = y0; y <= y1; y++) {
            double dy = y - cy;
            for (int x = x0; x <= x1; x++) {
                double dx = x - cx;
                double d2 = dx * dx + dy * dy;
                if (d2 <= src2) {
                    ax[na] = x;
                    ay[na++] = y;
                } else if (d2 >= in2 && d2 <= out2) {
                    sx[ns] = x;
                    sy[ns++] = y;
                }
            }
        }
        return new ApertureGeometry(spec, Arrays.copyOf(ax, na), Arrays.copyOf(ay, na),
                Arrays.copyOf(sx, ns), Arrays.copyOf(sy, ns));
    }

    public ApertureSpec getSpec() { return spec; }

    public int apertureArea() { return apertureX.length; }
    public int skyAnnulusArea() { return annulusX.length; }

    public int apertureX(int i) { return apertureX[i]; }
    public int apertureY(int i) { return apertureY[i]; }
    public int annulusX(int i) { return annulusX[i]; }
    public int annulusY(int i) { return annulusY[i]; }

    @Override
    public String toString() {
        return "ApertureGeometry[" + spec + ", apertura=" + apertureArea() + ", anillo=" + skyAnnulusArea() + "]";
    }
}
