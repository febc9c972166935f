package de.anton.analemma.algorithms;

import de.anton.analemma.model.HorizonPosition;
import de.anton.analemma.model.ObserverLocation;
import de.anton.analemma.model.RiseSetHourAngles;
import de.anton.analemma.model.SolarPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Converts the Sun's declination and equation of time into altitude and azimuth for one
 * observer and a local clock time.
 * <p>
 * Azimuth is measured clockwise from North (0° N, 90° E, 180° S, 270° W). Hour angle is
 * positive west of the meridian.
 */
public class HorizonProjector {

    private static final Logger logger = LoggerFactory.getLogger(HorizonProjector.class);

    /** Below this value of cos(altitude) the Sun is treated as being at zenith or nadir. */
    static final double ZENITH_EPSILON = 1e-12;
    private static final int MINUTES_PER_DAY = 24 * 60;

    private final ObserverLocation observer;

    public HorizonProjector(ObserverLocation observer) {
        this.observer = Objects.requireNonNull(observer, "Observer location cannot be null.");
    }

    public ObserverLocation getObserver() { return observer; }

    /**
     * Hour angle in degrees: clock offset from noon, plus the equation of time (4 minutes per
     * degree), plus the observer's offset from the timezone meridian.
     */
    public double hourAngle(double equationOfTime, int hour, int minute) {
        SolarPositionSeries.validateClockTime(hour, minute);
        return 15.0 * (hour - 12 + minute / 60.0)
                + equationOfTime / 4.0
                + (observer.getLongitude() - observer.getTimezoneMeridian());
    }

    /** Altitude in degrees from the spherical law of cosines, clamped against rounding. */
    public double altitude(double declination, double hourAngle) {
        double lat = Math.toRadians(observer.getLatitude());
        double dec = Math.toRadians(declination);
        double h = Math.toRadians(hourAngle);
        double sinAlt = Math.sin(lat) * Math.sin(dec) + Math.cos(lat) * Math.cos(dec) * Math.cos(h);
        return Math.toDegrees(Math.asin(Math.max(-1.0, Math.min(1.0, sinAlt))));
    }

    /**
     * Azimuth in degrees [0, 360), or empty when the Sun stands at zenith or nadir and the
     * direction is undefined.
     */
    public OptionalDouble azimuth(double declination, double hourAngle, double altitude) {
        double cosAlt = Math.cos(Math.toRadians(altitude));
        if (Math.abs(cosAlt) < ZENITH_EPSILON) {
            return OptionalDouble.empty();
        }
        double lat = Math.toRadians(observer.getLatitude());
        double dec = Math.toRadians(declination);
        double h = Math.toRadians(hourAngle);
        double sinAz = Math.cos(dec) * Math.sin(h) / cosAlt;
        double cosAz = (Math.cos(dec) * Math.cos(h) * Math.sin(lat) - Math.sin(dec) * Math.cos(lat)) / cosAlt;
        // Rounding can leave cos(altitude) just above the limit at the zenith itself
        if (Math.hypot(sinAz, cosAz) * cosAlt < ZENITH_EPSILON) {
            return OptionalDouble.empty();
        }
        // atan2 yields azimuth from South
        return OptionalDouble.of(normalizeAzimuth(Math.toDegrees(Math.atan2(sinAz, cosAz)) + 180.0));
    }

    public HorizonPosition project(double declination, double equationOfTime, int hour, int minute) {
        return project(declination, equationOfTime, hour, minute, null);
    }

    /** Projects a solar position at its own clock time. */
    public HorizonPosition project(SolarPosition solarPosition) {
        Objects.requireNonNull(solarPosition, "Solar position cannot be null.");
        LocalDateTime time = solarPosition.getDateTime();
        return project(solarPosition.getDeclination(), solarPosition.getEquationOfTime(),
                time.getHour(), time.getMinute(), solarPosition);
    }

    public List<HorizonPosition> projectAll(List<SolarPosition> positions) {
        Objects.requireNonNull(positions, "Solar positions cannot be null.");
        List<HorizonPosition> result = new ArrayList<>(positions.size());
        int undefined = 0;
        for (SolarPosition position : positions) {
            HorizonPosition projected = project(position);
            if (!projected.hasAzimuth()) undefined++;
            result.add(projected);
        }
        if (undefined > 0) {
            logger.warn("{} of {} positions have the Sun at zenith or nadir; azimuth left undefined.", undefined, positions.size());
        }
        return Collections.unmodifiableList(result);
    }

    private HorizonPosition project(double declination, double equationOfTime, int hour, int minute, SolarPosition source) {
        double h = hourAngle(equationOfTime, hour, minute);
        double alt = altitude(declination, h);
        double az = azimuth(declination, h, alt).orElse(Double.NaN);
        return new HorizonPosition(alt, az, h, declination, equationOfTime, source);
    }

    /** Altitude of the meridian transit: 90 − |latitude − declination|. */
    public double maxAltitude(double declination) {
        return 90.0 - Math.abs(observer.getLatitude() - declination);
    }

    /**
     * Hour angles of sunrise and sunset on the geometric horizon (no refraction).
     * Returns a polar-day or polar-night sentinel when the Sun never crosses the horizon.
     */
    public RiseSetHourAngles sunriseSunsetHourAngles(double declination) {
        double cosH = -Math.tan(Math.toRadians(observer.getLatitude())) * Math.tan(Math.toRadians(declination));
        if (Double.isNaN(cosH) || cosH > 1.0) {
            return RiseSetHourAngles.polarNight();
        }
        if (cosH < -1.0) {
            return RiseSetHourAngles.polarDay();
        }
        return RiseSetHourAngles.of(Math.toDegrees(Math.acos(cosH)));
    }

    /**
     * Local clock time at which the hour angle is zero:
     * 12:00 − EoT − 4·(longitude − timezone meridian) minutes, wrapped to one day.
     */
    public LocalTime solarNoon(double equationOfTime) {
        double correction = equationOfTime + 4.0 * (observer.getLongitude() - observer.getTimezoneMeridian());
        double minutes = 12 * 60 - correction;
        long seconds = Math.round(minutes * 60.0);
        return LocalTime.ofSecondOfDay(Math.floorMod(seconds, MINUTES_PER_DAY * 60L));
    }

    static double normalizeAzimuth(double degrees) {
        double result = degrees % 360.0;
        if (result < 0) result += 360.0;
        return result >= 360.0 ? 0.0 : result;
    }
}
