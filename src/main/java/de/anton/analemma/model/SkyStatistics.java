package de.anton.analemma.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * Extent of an analemma on the sky: altitude and azimuth ranges and spans in degrees.
 * Positions without an azimuth only contribute to the altitude range.
 * <p>
 * The azimuth range is the smallest arc covering every azimuth. When that arc crosses North,
 * {@code minAzimuth} is negative (for example -6° for 354°) so that {@code maxAzimuth - minAzimuth}
 * stays the arc length.
 */
public record SkyStatistics(double minAltitude, double maxAltitude, double minAzimuth, double maxAzimuth, int count) {

    public static final SkyStatistics EMPTY = new SkyStatistics(Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0);

    public double altitudeSpan() { return count == 0 ? Double.NaN : maxAltitude - minAltitude; }
    public double azimuthSpan() { return Double.isNaN(minAzimuth) ? Double.NaN : maxAzimuth - minAzimuth; }

    public static SkyStatistics ofHorizon(Collection<HorizonPosition> positions) {
        Objects.requireNonNull(positions, "Positions cannot be null.");
        double minAlt = Double.POSITIVE_INFINITY, maxAlt = Double.NEGATIVE_INFINITY;
        double[] azimuths = new double[positions.size()];
        int azimuthCount = 0;
        int count = 0;
        for (HorizonPosition p : positions) {
            if (p == null) continue;
            count++;
            minAlt = Math.min(minAlt, p.getAltitude()); maxAlt = Math.max(maxAlt, p.getAltitude());
            if (p.hasAzimuth()) azimuths[azimuthCount++] = p.getAzimuth();
        }
        return build(minAlt, maxAlt, Arrays.copyOf(azimuths, azimuthCount), count);
    }

    public static SkyStatistics ofProjected(Collection<ProjectedPoint> points) {
        Objects.requireNonNull(points, "Points cannot be null.");
        double minAlt = Double.POSITIVE_INFINITY, maxAlt = Double.NEGATIVE_INFINITY;
        double[] azimuths = new double[points.size()];
        int count = 0;
        for (ProjectedPoint p : points) {
            if (p == null) continue;
            minAlt = Math.min(minAlt, p.altitude()); maxAlt = Math.max(maxAlt, p.altitude());
            azimuths[count++] = p.azimuth();
        }
        return build(minAlt, maxAlt, Arrays.copyOf(azimuths, count), count);
    }

    private static SkyStatistics build(double minAlt, double maxAlt, double[] azimuths, int count) {
        if (count == 0) return EMPTY;
        if (azimuths.length == 0) return new SkyStatistics(minAlt, maxAlt, Double.NaN, Double.NaN, count);
        double[] range = azimuthRange(azimuths);
        return new SkyStatistics(minAlt, maxAlt, range[0], range[1], count);
    }

    /**
     * Smallest arc covering all azimuths in [0, 360), as {start, end}. The arc lies opposite the
     * largest gap between neighbouring azimuths; when it crosses North the start is negative.
     */
    static double[] azimuthRange(double[] azimuths) {
        double[] sorted = azimuths.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        double largestGap = sorted[0] + 360.0 - sorted[n - 1];
        int gapAfter = -1; // -1: the largest gap is the one across North
        for (int i = 0; i < n - 1; i++) {
            double gap = sorted[i + 1] - sorted[i];
            if (gap > largestGap) {
                largestGap = gap;
                gapAfter = i;
            }
        }
        if (gapAfter < 0) return new double[]{sorted[0], sorted[n - 1]};
        return new double[]{sorted[gapAfter + 1] - 360.0, sorted[gapAfter]};
    }

    @Override
    public String toString() {
        return String.format("SkyStatistics[alt %.2f°..%.2f° (span %.2f°), az %.2f°..%.2f° (span %.2f°), n=%d]",
                minAltitude, maxAltitude, altitudeSpan(), minAzimuth, maxAzimuth, azimuthSpan(), count);
    }
}
