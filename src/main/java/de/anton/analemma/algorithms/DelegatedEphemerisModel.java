package de.anton.analemma.algorithms;

import de.anton.analemma.ephemeris.EphemerisProvider;
import de.anton.analemma.ephemeris.EquatorialCoordinate;
import de.anton.analemma.model.CalculationMode;
import de.anton.analemma.model.ConfigurationException;
import de.anton.analemma.model.SolarPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Declination taken from an external {@link EphemerisProvider}.
 * <p>
 * The equation of time still comes from {@link EquationOfTimeModel}: no provider-backed
 * equation of time exists yet, so high-precision series differ from approximate ones in
 * declination only.
 */
public class DelegatedEphemerisModel implements SolarPositionProvider {

    private static final Logger logger = LoggerFactory.getLogger(DelegatedEphemerisModel.class);

    private final EphemerisProvider provider;
    private final double timezoneOffsetHours;

    /**
     * @param provider            Ephemeris source; must be non-null and available.
     * @param timezoneOffsetHours Offset of the local civil time from UTC, used to build the UTC request.
     * @throws ConfigurationException If the provider is missing or unavailable.
     */
    public DelegatedEphemerisModel(EphemerisProvider provider, double timezoneOffsetHours) {
        if (provider == null) {
            throw new ConfigurationException("High-precision mode requires an ephemeris provider.");
        }
        if (!provider.isAvailable()) {
            throw new ConfigurationException("Ephemeris provider '" + provider.getName() + "' is not available.");
        }
        if (!Double.isFinite(timezoneOffsetHours) || Math.abs(timezoneOffsetHours) > 14) {
            throw new IllegalArgumentException("Timezone offset must be within [-14, 14] hours. Got: " + timezoneOffsetHours);
        }
        this.provider = provider;
        this.timezoneOffsetHours = timezoneOffsetHours;
        logger.debug("Delegated ephemeris model using '{}' (UTC offset {} h)", provider.getName(), timezoneOffsetHours);
    }

    @Override
    public SolarPosition calculate(LocalDateTime localDateTime) {
        Objects.requireNonNull(localDateTime, "Date/time cannot be null.");
        LocalDateTime utc = localDateTime.minusSeconds(Math.round(timezoneOffsetHours * 3600.0));
        EquatorialCoordinate coordinate = provider.equatorialPosition(utc);
        if (coordinate == null) {
            throw new IllegalStateException("Ephemeris provider '" + provider.getName() + "' returned no position for " + utc);
        }
        double eot = EquationOfTimeModel.approximate(localDateTime.getDayOfYear());
        return new SolarPosition(coordinate.getDeclination(), eot, localDateTime, CalculationMode.HIGH_PRECISION);
    }

    @Override
    public CalculationMode getMode() { return CalculationMode.HIGH_PRECISION; }

    public EphemerisProvider getProvider() { return provider; }

    @Override
    public String toString() { return "DelegatedEphemerisModel[" + provider.getName() + "]"; }
}
