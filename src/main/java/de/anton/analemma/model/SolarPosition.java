package de.anton.analemma.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * The Sun's celestial state for one instant: declination and equation of time.
 * This class is immutable.
 */
public final class SolarPosition {

    private final double declination;     // Degrees north (+) / south (-) of the celestial equator
    private final double equationOfTime;  // Minutes, apparent minus mean solar time
    private final int dayOfYear;          // 1..366
    private final LocalDateTime dateTime; // Local clock time the position was computed for
    private final CalculationMode mode;

    /**
     * Constructor for SolarPosition.
     *
     * @param declination    Solar declination in degrees.
     * @param equationOfTime Equation of time in minutes.
     * @param dateTime       Local date and time of the observation (must not be null).
     * @param mode           Mode that produced the values (must not be null).
     */
    public SolarPosition(double declination, double equationOfTime, LocalDateTime dateTime, CalculationMode mode) {
        this.dateTime = Objects.requireNonNull(dateTime, "Date/time cannot be null.");
        this.mode = Objects.requireNonNull(mode, "Calculation mode cannot be null.");
        if (Double.isNaN(declination) || Math.abs(declination) > 90.0) {
            throw new IllegalArgumentException("Declination must be within [-90, 90]. Got: " + declination);
        }
        if (Double.isNaN(equationOfTime)) {
            throw new IllegalArgumentException("Equation of time cannot be NaN.");
        }
        this.declination = declination;
        this.equationOfTime = equationOfTime;
        this.dayOfYear = dateTime.getDayOfYear();
    }

    // --- Getters ---
    public double getDeclination() { return declination; }
    public double getEquationOfTime() { return equationOfTime; }
    public int getDayOfYear() { return dayOfYear; }
    public LocalDateTime getDateTime() { return dateTime; }
    public CalculationMode getMode() { return mode; }

    @Override
    public String toString() {
        return String.format("SolarPosition[%s, day=%d, dec=%.3f°, eot=%.2f min, mode=%s]",
                dateTime, dayOfYear, declination, equationOfTime, mode);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SolarPosition that = (SolarPosition) o;
        return Double.compare(that.declination, declination) == 0 &&
               Double.compare(that.equationOfTime, equationOfTime) == 0 &&
               dateTime.equals(that.dateTime) &&
               mode == that.mode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(declination, equationOfTime, dateTime, mode);
    }
}
