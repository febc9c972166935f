package de.anton.analemma.model;

import java.util.Objects;

/**
 * The Sun's position as seen by a local observer.
 * Azimuth is measured clockwise from North and is undefined (NaN) when the Sun
 * stands exactly at the zenith or nadir; check {@link #hasAzimuth()} first.
 * This class is immutable.
 */
public final class HorizonPosition {

    private final double altitude;       // Degrees above the horizon, [-90, 90]
    private final double azimuth;        // Degrees from North, [0, 360) or NaN
    private final double hourAngle;      // Degrees west of the local meridian
    private final double declination;
    private final double equationOfTime;
    private final SolarPosition solarPosition; // May be null for ad-hoc projections

    public HorizonPosition(double altitude, double azimuth, double hourAngle,
                           double declination, double equationOfTime, SolarPosition solarPosition) {
        if (Double.isNaN(altitude) || altitude < -90.0 || altitude > 90.0) {
            throw new IllegalArgumentException("Altitude must be within [-90, 90]. Got: " + altitude);
        }
        if (!Double.isNaN(azimuth) && (azimuth < 0.0 || azimuth >= 360.0)) {
            throw new IllegalArgumentException("Azimuth must be within [0, 360). Got: " + azimuth);
        }
        this.altitude = altitude;
        this.azimuth = azimuth;
        this.hourAngle = hourAngle;
        this.declination = declination;
        this.equationOfTime = equationOfTime;
        this.solarPosition = solarPosition;
    }

    // --- Getters ---
    public double getAltitude() { return altitude; }
    public double getAzimuth() { return azimuth; }
    public double getHourAngle() { return hourAngle; }
    public double getDeclination() { return declination; }
    public double getEquationOfTime() { return equationOfTime; }

    /** @return The source position, or null if projected from raw values. */
    public SolarPosition getSolarPosition() { return solarPosition; }

    /** False at the zenith/nadir singularity, where no compass bearing exists. */
    public boolean hasAzimuth() { return !Double.isNaN(azimuth); }

    public boolean isAboveHorizon() { return altitude >= 0.0; }

    /** Day of year of the source position, or -1 when there is none. */
    public int getDayOfYear() { return solarPosition != null ? solarPosition.getDayOfYear() : -1; }

    @Override
    public String toString() {
        return String.format("HorizonPosition[alt=%.3f°, az=%s, H=%.3f°, day=%d]",
                altitude, hasAzimuth() ? String.format("%.3f°", azimuth) : "undefined", hourAngle, getDayOfYear());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HorizonPosition that = (HorizonPosition) o;
        return Double.compare(that.altitude, altitude) == 0 &&
               Double.compare(that.azimuth, azimuth) == 0 &&
               Double.compare(that.hourAngle, hourAngle) == 0 &&
               Objects.equals(solarPosition, that.solarPosition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(altitude, azimuth, hourAngle, solarPosition);
    }
}
