package de.anton.analemma.ephemeris;

import java.time.LocalDateTime;

/**
 * External source of the Sun's apparent equatorial coordinates.
 * Implementations may block (e.g. a remote service); callers own any retry or timeout policy.
 */
public interface EphemerisProvider {

    /**
     * @param utc Instant of the observation in UTC.
     * @return Apparent right ascension (hours) and declination (degrees) of the Sun.
     */
    EquatorialCoordinate equatorialPosition(LocalDateTime utc);

    /** Whether the provider can currently answer requests. */
    boolean isAvailable();

    String getName();
}
