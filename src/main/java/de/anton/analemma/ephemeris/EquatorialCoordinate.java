package de.anton.analemma.ephemeris;

import java.util.Objects;

/**
 * Position on the celestial sphere: right ascension in hours [0, 24), declination in degrees [-90, 90].
 */
public final class EquatorialCoordinate {

    private final double rightAscension;
    private final double declination;

    public EquatorialCoordinate(double rightAscension, double declination) {
        if (!Double.isFinite(rightAscension) || rightAscension < 0 || rightAscension >= 24) {
            throw new IllegalArgumentException("Right ascension must be within [0, 24) hours. Got: " + rightAscension);
        }
        if (!Double.isFinite(declination) || Math.abs(declination) > 90) {
            throw new IllegalArgumentException("Declination must be within [-90, 90]. Got: " + declination);
        }
        this.rightAscension = rightAscension;
        this.declination = declination;
    }

    public double getRightAscension() { return rightAscension; }
    public double getDeclination() { return declination; }

    @Override
    public String toString() {
        return String.format("EquatorialCoordinate[ra=%.4fh, dec=%.4f°]", rightAscension, declination);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EquatorialCoordinate that = (EquatorialCoordinate) o;
        return Double.compare(that.rightAscension, rightAscension) == 0
                && Double.compare(that.declination, declination) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rightAscension, declination);
    }
}
