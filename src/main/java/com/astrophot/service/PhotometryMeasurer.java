package com.astrophot.service;

import com.astrophot.model.ApertureSpec;
import com.astrophot.model.Channel;
import com.astrophot.model.FluxMeasurement;
import com.astrophot.model.InsufficientPixelsException;
import com.astrophot.model.PhotometryConfig;
import com.astrophot.model.PixelFrame;
import com.astrophot.model.SkyStatistics;
import ij.process.FloatProcessor;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fotometría de apertura con cielo robusto del anillo.
 * <pre>
 * cielo_total = mediana_cielo * área_apertura
 * corregido   = suma_apertura - cielo_total
 * ruido       = sqrt(poisson^2 + (sigma_cielo * sqrt(área))^2),  poisson = sqrt(suma_apertura)
 * </pre>
 * Sin estado: la misma entrada da siempre el mismo resultado.
 */
public class PhotometryMeasurer {

    private static final double MIN_NOISE = 1e-12;

    private final double clipSigma;
    private final int clipIterations;

    public PhotometryMeasurer() {
        this(RobustStatistics.DEFAULT_SIGMA, RobustStatistics.DEFAULT_MAX_ITERATIONS);
    }

    public PhotometryMeasurer(double clipSigma, int clipIterations) {
        if (!(clipSigma > 0)) throw new IllegalArgumentException("clipSigma debe ser > 0");
        if (clipIterations < 0) throw new IllegalArgumentException("clipIterations debe ser >= 0");
        this.clipSigma = clipSigma;
        this.clipIterations = clipIterations;
    }

    public static PhotometryMeasurer fromPreferences() {
        return new PhotometryMeasurer(PhotometryConfig.getClipSigma(), PhotometryConfig.getClipIterations());
    }

    // Mide todos los canales medibles del frame: R, G, B y gris para RGB; solo gris en otro caso
    public Map<Channel, FluxMeasurement> measure(PixelFrame frame, ApertureSpec aperture) {
        ApertureGeometry geometry = geometryFor(frame.getWidth(), frame.getHeight(), aperture);
        Map<Channel, FluxMeasurement> out = new EnumMap<>(Channel.class);
        for (Channel channel : frame.getMeasurableChannels()) {
            out.put(channel, measure(PlaneReader.of(frame, channel), channel, geometry));
        }
        return out;
    }

    public FluxMeasurement measure(PixelFrame frame, Channel channel, ApertureSpec aperture) {
        PlaneReader plane = PlaneReader.of(frame, channel);
        return measure(plane, channel, geometryFor(frame.getWidth(), frame.getHeight(), aperture));
    }

    public FluxMeasurement measure(FloatProcessor plane, Channel channel, ApertureSpec aperture) {
        Objects.requireNonNull(plane, "plane");
        return measure(PlaneReader.of(plane), channel, geometryFor(plane.getWidth(), plane.getHeight(), aperture));
    }

    private static ApertureGeometry geometryFor(int width, int height, ApertureSpec aperture) {
        Objects.requireNonNull(aperture, "aperture");
        ApertureGeometry geometry = ApertureGeometry.of(aperture, width, height);
        if (geometry.apertureArea() == 0) {
            throw new InsufficientPixelsException("La apertura en " + aperture.center + " cae fuera del frame");
        }
        if (geometry.skyAnnulusArea() == 0) {
            throw new InsufficientPixelsException("El anillo de cielo en " + aperture.center + " cae fuera del frame");
        }
        return geometry;
    }

    FluxMeasurement measure(PlaneReader plane, Channel channel, ApertureGeometry geometry) {
        // --- CIELO ---
        int nSky = geometry.skyAnnulusArea();
        double[] sky = new double[nSky];
        for (int i = 0; i < nSky; i++) {
            sky[i] = plane.get(geometry.annulusX(i), geometry.annulusY(i));
        }
        RobustStatistics.ClippedStatistics clipped = RobustStatistics.sigmaClip(sky, clipSigma, clipIterations);
        SkyStatistics skyStats = new SkyStatistics(clipped.median, clipped.stddev, clipped.mean,
                clipped.nUsed, clipped.nRejected);

        // --- FLUJO ---
        int area = geometry.apertureArea();
        double raw = 0;
        for (int i = 0; i < area; i++) {
            raw += plane.get(geometry.apertureX(i), geometry.apertureY(i));
        }
        double skyTotal = skyStats.median * area;
        double corrected = raw - skyTotal;

        // --- RUIDO ---
        double poisson = raw > 0 ? Math.sqrt(raw) : 0.0;
        double skyNoise = skyStats.sigma * Math.sqrt(area);
        double total = Math.sqrt(poisson * poisson + skyNoise * skyNoise);
        double snr = total < MIN_NOISE ? Double.NaN : corrected / total;

        return new FluxMeasurement(channel, raw, skyTotal, corrected, poisson, skyNoise, total, snr,
                skyStats, area, nSky);
    }
}
