package com.astrophot.service;

import java.util.Arrays;

/**
 * Estadística con rechazo iterativo sigma-clipping.
 * <p>
 * En cada iteración se calculan mediana y desviacion estándar de las muestras que sobreviven y se
 * descartan las que se alejan de la mediana más de {@code sigma} desviaciones. Termina cuando una
 * iteración no descarta nada o se alcanza el tope de iteraciones. Con menos de 5 muestras o
 * dispersión nula devuelve la estadística sin recortar.
 */
public final class RobustStatistics {

    public static final double DEFAULT_SIGMA = 3.0;
    public static final int DEFAULT_MAX_ITERATIONS = 10;
    public static final int MIN_SAMPLES = 5;

    private RobustStatistics() {}

    public static final class ClippedStatistics {
        public final double median;
        public final double mean;
        public final double stddev;
        public final int nUsed;
        public final int nRejected;
        public final int iterations;
        // true si no hubo recorte por falta de muestras o de dispersión
        public final boolean degenerate;

        ClippedStatistics(double median, double mean, double stddev, int nUsed, int nRejected,
                          int iterations, boolean degenerate) {
            this.median = median;
            this.mean = mean;
            this.stddev = stddev;
            this.nUsed = nUsed;
            this.nRejected = nRejected;
            this.iterations = iterations;
            this.degenerate = degenerate;
        }
    }

    public static ClippedStatistics sigmaClip(double[] samples) {
        return sigmaClip(samples, DEFAULT_SIGMA, DEFAULT_MAX_ITERATIONS);
    }

    public static ClippedStatistics sigmaClip(float[] samples, double sigma, int maxIterations) {
        double[] d = new double[samples.length];
        for (int i = 0; i < samples.length; i++) d[i] = samples[i];
        return sigmaClip(d, sigma, maxIterations);
    }

    public static ClippedStatistics sigmaClip(double[] samples, double sigma, int maxIterations) {
        if (!(sigma > 0)) throw new IllegalArgumentException("sigma debe ser > 0");
        if (maxIterations < 0) throw new IllegalArgumentException("maxIterations debe ser >= 0");

        double[] data = finiteSorted(samples);
        int n = data.length;
        if (n == 0) return new ClippedStatistics(Double.NaN, Double.NaN, Double.NaN, 0, 0, 0, true);

        double mean = mean(data, n);
        double std = std(data, n, mean);
        if (n < MIN_SAMPLES || std == 0) {
            return new ClippedStatistics(medianOfSorted(data, n), mean, std, n, 0, 0, true);
        }

        double[] cur = data;
        int size = n;
        int iterations = 0;
        while (iterations < maxIterations) {
            double median = medianOfSorted(cur, size);
            double limit = sigma * std;
            double[] next = new double[size];
            int kept = 0;
            for (int i = 0; i < size; i++) {
                if (Math.abs(cur[i] - median) <= limit) next[kept++] = cur[i];
            }
            iterations++;
            if (kept == size || kept == 0) break;
            cur = next; // sigue ordenado
            size = kept;
            mean = mean(cur, size);
            std = std(cur, size, mean);
            if (std == 0) break;
        }

        return new ClippedStatistics(medianOfSorted(cur, size), mean, std, size, n - size, iterations, false);
    }

    public static double median(double[] values) {
        double[] sorted = finiteSorted(values);
        return sorted.length == 0 ? Double.NaN : medianOfSorted(sorted, sorted.length);
    }

    public static double median(float[] values) {
        double[] d = new double[values.length];
        for (int i = 0; i < values.length; i++) d[i] = values[i];
        return median(d);
    }

    // Mediana in situ: reordena values
    static double medianInPlace(double[] values, int n) {
        Arrays.sort(values, 0, n);
        return medianOfSorted(values, n);
    }

    static double medianOfSorted(double[] sorted, int n) {
        int mid = n / 2;
        return (n % 2 == 0) ? (sorted[mid - 1] + sorted[mid]) / 2.0 : sorted[mid];
    }

    static double mean(double[] v, int n) {
        double s = 0;
        for (int i = 0; i < n; i++) s += v[i];
        return s / n;
    }

    // desviacion poblacional (ddof = 0)
    static double std(double[] v, int n, double mean) {
        double s = 0;
        for (int i = 0; i < n; i++) {
            double d = v[i] - mean;
            s += d * d;
        }
        return Math.sqrt(s / n);
    }

    private static double[] finiteSorted(double[] samples) {
        double[] out = new double[samples.length];
        int k = 0;
        for (double v : samples) if (Double.isFinite(v)) out[k++] = v;
        if (k != out.length) out = Arrays.copyOf(out, k);
        Arrays.sort(out);
        return out;
    }
}
