package de.anton.analemma.service;

import de.anton.analemma.algorithms.SolarPositionSeries;
import de.anton.analemma.model.CalculationMode;
import de.anton.analemma.model.ObserverLocation;

import java.util.Objects;

/**
 * Immutable configuration object holding all parameters for a yearly analemma calculation.
 */
public record CalculationConfiguration(
    ObserverLocation observer,
    int year,
    int hour,   // Local clock time of the daily observation
    int minute,
    int days,   // Consecutive days from 1 January
    CalculationMode mode
) {
    public static final int DEFAULT_HOUR = 12;

    public CalculationConfiguration {
        Objects.requireNonNull(observer, "Observer location cannot be null.");
        Objects.requireNonNull(mode, "Calculation mode cannot be null.");
        if (hour < 0 || hour > 23) throw new IllegalArgumentException("Hour must be within [0, 23]. Got: " + hour);
        if (minute < 0 || minute > 59) throw new IllegalArgumentException("Minute must be within [0, 59]. Got: " + minute);
        if (days < 1 || days > 366) throw new IllegalArgumentException("Days must be within [1, 366]. Got: " + days);
    }

    /** Noon, a full 365-day series, approximate mode. */
    public static CalculationConfiguration defaults(ObserverLocation observer, int year) {
        return new CalculationConfiguration(observer, year, DEFAULT_HOUR, 0, SolarPositionSeries.DEFAULT_DAYS,
                CalculationMode.APPROXIMATE);
    }

    public CalculationConfiguration withMode(CalculationMode newMode) {
        return new CalculationConfiguration(observer, year, hour, minute, days, newMode);
    }
}
