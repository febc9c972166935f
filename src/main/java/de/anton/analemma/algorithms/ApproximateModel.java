package de.anton.analemma.algorithms;

import de.anton.analemma.model.CalculationMode;
import de.anton.analemma.model.SolarPosition;

import java.time.LocalDateTime;
import java.util.Objects;

/** Closed-form declination and equation of time, driven only by the day of year. */
public class ApproximateModel implements SolarPositionProvider {

    @Override
    public SolarPosition calculate(LocalDateTime localDateTime) {
        Objects.requireNonNull(localDateTime, "Date/time cannot be null.");
        int day = localDateTime.getDayOfYear();
        return new SolarPosition(DeclinationModel.approximate(day), EquationOfTimeModel.approximate(day),
                localDateTime, CalculationMode.APPROXIMATE);
    }

    @Override
    public CalculationMode getMode() { return CalculationMode.APPROXIMATE; }

    @Override
    public String toString() { return "ApproximateModel"; }
}
