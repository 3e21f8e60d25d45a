package com.astrophot.model;

import java.util.Locale;

public final class PixelPosition {
    public final double x;
    public final double y;

    public PixelPosition(double x, double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("Posicion no finita: " + x + ", " + y);
        }
        this.x = x;
        this.y = y;
    }

    public double distanceTo(PixelPosition other) {
        double dx = x - other.x, dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelPosition)) return false;
        PixelPosition p = (PixelPosition) o;
        return Double.compare(x, p.x) == 0 && Double.compare(y, p.y) == 0;
    }

    @Override
    public int hashCode() { return 31 * Double.hashCode(x) + Double.hashCode(y); }

    @Override
    public String toString() { return String.format(Locale.US, "(%.2f, %.2f)", x, y); }
}
