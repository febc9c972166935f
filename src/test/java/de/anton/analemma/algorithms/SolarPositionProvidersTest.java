package de.anton.analemma.algorithms;

import de.anton.analemma.ephemeris.EphemerisProvider;
import de.anton.analemma.ephemeris.EquatorialCoordinate;
import de.anton.analemma.model.CalculationMode;
import de.anton.analemma.model.ConfigurationException;
import de.anton.analemma.model.SolarPosition;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SolarPositionProvidersTest {

    /** Provider answering with a fixed declination and remembering every request. */
    private static class FixedProvider implements EphemerisProvider {
        final List<LocalDateTime> requests = new ArrayList<>();
        final boolean available;

        FixedProvider(boolean available) { this.available = available; }

        @Override
        public EquatorialCoordinate equatorialPosition(LocalDateTime utc) {
            requests.add(utc);
            return new EquatorialCoordinate(6.0, 10.0);
        }

        @Override public boolean isAvailable() { return available; }
        @Override public String getName() { return "fixed"; }
    }

    @Test
    void approximateModelUsesClosedFormValues() {
        SolarPosition position = new ApproximateModel().calculate(LocalDateTime.of(2026, 6, 21, 12, 0));
        assertEquals(172, position.getDayOfYear());
        assertEquals(DeclinationModel.approximate(172), position.getDeclination(), 1e-12);
        assertEquals(EquationOfTimeModel.approximate(172), position.getEquationOfTime(), 1e-12);
        assertEquals(CalculationMode.APPROXIMATE, position.getMode());
    }

    @Test
    void delegatedModelFailsAtConstructionWithoutProvider() {
        assertThrows(ConfigurationException.class, () -> new DelegatedEphemerisModel(null, 0));
        assertThrows(ConfigurationException.class, () -> new DelegatedEphemerisModel(new FixedProvider(false), 0));
        assertThrows(ConfigurationException.class,
                () -> SolarPositionProviders.forMode(CalculationMode.HIGH_PRECISION, null, 0));
    }

    @Test
    void delegatedModelTakesDeclinationFromProviderAndKeepsApproximateEquationOfTime() {
        FixedProvider provider = new FixedProvider(true);
        SolarPosition position = new DelegatedEphemerisModel(provider, -6).calculate(LocalDateTime.of(2026, 3, 1, 12, 0));
        assertEquals(10.0, position.getDeclination());
        assertEquals(EquationOfTimeModel.approximate(60), position.getEquationOfTime(), 1e-12);
        assertEquals(CalculationMode.HIGH_PRECISION, position.getMode());
        assertEquals(List.of(LocalDateTime.of(2026, 3, 1, 18, 0)), provider.requests);
    }

    @Test
    void factorySelectsVariantByMode() {
        assertTrue(SolarPositionProviders.forMode(CalculationMode.APPROXIMATE, null, 0) instanceof ApproximateModel);
        SolarPositionProvider precise = SolarPositionProviders.forMode(CalculationMode.HIGH_PRECISION, new FixedProvider(true), 1);
        assertTrue(precise instanceof DelegatedEphemerisModel);
        assertEquals(CalculationMode.HIGH_PRECISION, precise.getMode());
    }
}
