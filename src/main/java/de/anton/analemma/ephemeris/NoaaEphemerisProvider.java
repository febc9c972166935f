package de.anton.analemma.ephemeris;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.temporal.JulianFields;
import java.util.Objects;

/**
 * Ephemeris provider based on the NOAA solar position equations (Meeus, low precision).
 * Declination is good to about 0.01° for dates between 1900 and 2100.
 */
public class NoaaEphemerisProvider implements EphemerisProvider {

    private static final Logger logger = LoggerFactory.getLogger(NoaaEphemerisProvider.class);
    private static final double J2000 = 2451545.0;
    private static final double DAYS_PER_CENTURY = 36525.0;

    @Override
    public EquatorialCoordinate equatorialPosition(LocalDateTime utc) {
        Objects.requireNonNull(utc, "UTC timestamp cannot be null.");
        double t = (julianDay(utc) - J2000) / DAYS_PER_CENTURY;

        double meanLongitude = normalizeDegrees(280.46646 + t * (36000.76983 + t * 0.0003032));
        double meanAnomaly = 357.52911 + t * (35999.05029 - 0.0001537 * t);
        double centre = Math.sin(Math.toRadians(meanAnomaly)) * (1.914602 - t * (0.004817 + 0.000014 * t))
                + Math.sin(Math.toRadians(2 * meanAnomaly)) * (0.019993 - 0.000101 * t)
                + Math.sin(Math.toRadians(3 * meanAnomaly)) * 0.000289;
        double trueLongitude = meanLongitude + centre;
        double omega = Math.toRadians(125.04 - 1934.136 * t);
        double apparentLongitude = Math.toRadians(trueLongitude - 0.00569 - 0.00478 * Math.sin(omega));

        double meanObliquity = 23 + (26 + (21.448 - t * (46.815 + t * (0.00059 - t * 0.001813))) / 60) / 60;
        double obliquity = Math.toRadians(meanObliquity + 0.00256 * Math.cos(omega));

        double declination = Math.toDegrees(Math.asin(Math.sin(obliquity) * Math.sin(apparentLongitude)));
        double rightAscension = Math.toDegrees(Math.atan2(
                Math.cos(obliquity) * Math.sin(apparentLongitude), Math.cos(apparentLongitude)));
        double raHours = normalizeDegrees(rightAscension) / 15.0;
        if (raHours >= 24.0) raHours = 0.0;

        logger.trace("NOAA position for {} UTC: ra={}h, dec={}°", utc, raHours, declination);
        return new EquatorialCoordinate(raHours, declination);
    }

    @Override
    public boolean isAvailable() { return true; }

    @Override
    public String getName() { return "NOAA solar equations"; }

    /** Julian date of a UTC timestamp (the Julian day number starts at noon). */
    static double julianDay(LocalDateTime utc) {
        long dayNumber = utc.toLocalDate().getLong(JulianFields.JULIAN_DAY);
        double dayFraction = (utc.getHour() + utc.getMinute() / 60.0 + utc.getSecond() / 3600.0) / 24.0;
        return dayNumber - 0.5 + dayFraction;
    }

    private static double normalizeDegrees(double degrees) {
        double result = degrees % 360.0;
        return result < 0 ? result + 360.0 : result;
    }
}
