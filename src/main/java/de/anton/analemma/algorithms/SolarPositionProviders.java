package de.anton.analemma.algorithms;

import de.anton.analemma.ephemeris.EphemerisProvider;
import de.anton.analemma.model.CalculationMode;

import java.util.Objects;

/** Factory selecting the {@link SolarPositionProvider} variant for a calculation mode. */
public final class SolarPositionProviders {

    private SolarPositionProviders() { throw new IllegalStateException("Utility class"); }

    /**
     * @param mode                Requested mode.
     * @param ephemerisProvider   Only used for {@link CalculationMode#HIGH_PRECISION}; may be null otherwise.
     * @param timezoneOffsetHours Observer's UTC offset.
     * @throws de.anton.analemma.model.ConfigurationException If high precision is requested without a usable provider.
     */
    public static SolarPositionProvider forMode(CalculationMode mode, EphemerisProvider ephemerisProvider,
                                                double timezoneOffsetHours) {
        Objects.requireNonNull(mode, "Calculation mode cannot be null.");
        switch (mode) {
            case HIGH_PRECISION:
                return new DelegatedEphemerisModel(ephemerisProvider, timezoneOffsetHours);
            case APPROXIMATE:
            default:
                return new ApproximateModel();
        }
    }
}
