package de.anton.analemma.model;

import java.util.Objects;

/**
 * A fixed point on Earth from which the Sun is observed.
 * The timezone offset defaults to the nominal zone of the longitude (15° per hour).
 * This class is immutable.
 */
public final class ObserverLocation {

    private final double latitude;            // Degrees, positive = North
    private final double longitude;           // Degrees, positive = East
    private final double timezoneOffsetHours; // Offset from UTC in hours

    /**
     * Constructor for ObserverLocation.
     *
     * @param latitude            Latitude in degrees, [-90, 90].
     * @param longitude           Longitude in degrees, [-180, 180].
     * @param timezoneOffsetHours Offset from UTC in hours, [-14, 14].
     */
    public ObserverLocation(double latitude, double longitude, double timezoneOffsetHours) {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("Latitude must be within [-90, 90]. Got: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("Longitude must be within [-180, 180]. Got: " + longitude);
        }
        if (Double.isNaN(timezoneOffsetHours) || Math.abs(timezoneOffsetHours) > 14.0) {
            throw new IllegalArgumentException("Timezone offset must be within [-14, 14] hours. Got: " + timezoneOffsetHours);
        }
        this.latitude = latitude;
        this.longitude = longitude;
        this.timezoneOffsetHours = timezoneOffsetHours;
    }

    /** Location whose timezone offset is derived as round(longitude / 15). */
    public static ObserverLocation of(double latitude, double longitude) {
        return new ObserverLocation(latitude, longitude, nominalTimezoneOffset(longitude));
    }

    /** Location with an explicit offset, or the nominal one when the offset is null. */
    public static ObserverLocation of(double latitude, double longitude, Double timezoneOffsetHours) {
        return timezoneOffsetHours == null ? of(latitude, longitude) : new ObserverLocation(latitude, longitude, timezoneOffsetHours);
    }

    /** Nominal timezone offset of a longitude, in whole hours. */
    public static double nominalTimezoneOffset(double longitude) {
        return Math.round(longitude / 15.0);
    }

    // --- Getters ---
    public double getLatitude() { return latitude; }
    public double getLongitude() { return longitude; }
    public double getTimezoneOffsetHours() { return timezoneOffsetHours; }

    /** Longitude of the timezone's reference meridian in degrees. */
    public double getTimezoneMeridian() { return timezoneOffsetHours * 15.0; }

    @Override
    public String toString() {
        return String.format("ObserverLocation[lat=%.4f°, lon=%.4f°, tz=%+.1fh]", latitude, longitude, timezoneOffsetHours);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ObserverLocation that = (ObserverLocation) o;
        return Double.compare(that.latitude, latitude) == 0 &&
               Double.compare(that.longitude, longitude) == 0 &&
               Double.compare(that.timezoneOffsetHours, timezoneOffsetHours) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(latitude, longitude, timezoneOffsetHours);
    }
}
