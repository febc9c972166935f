package de.anton.analemma.model;

import java.util.OptionalDouble;

/**
 * Hour angles of sunrise and sunset on the geometric horizon.
 * During polar day or polar night there is no crossing; both hour angles are then
 * empty and {@link #getCondition()} tells which of the two applies.
 */
public final class RiseSetHourAngles {

    public enum Condition { NORMAL, POLAR_DAY, POLAR_NIGHT }

    private static final RiseSetHourAngles POLAR_DAY = new RiseSetHourAngles(Condition.POLAR_DAY, Double.NaN);
    private static final RiseSetHourAngles POLAR_NIGHT = new RiseSetHourAngles(Condition.POLAR_NIGHT, Double.NaN);

    private final Condition condition;
    private final double halfDayArc; // Degrees, sunset hour angle

    private RiseSetHourAngles(Condition condition, double halfDayArc) {
        this.condition = condition;
        this.halfDayArc = halfDayArc;
    }

    public static RiseSetHourAngles of(double halfDayArc) {
        if (Double.isNaN(halfDayArc) || halfDayArc < 0 || halfDayArc > 180) {
            throw new IllegalArgumentException("Half day arc must be within [0, 180]. Got: " + halfDayArc);
        }
        return new RiseSetHourAngles(Condition.NORMAL, halfDayArc);
    }

    public static RiseSetHourAngles polarDay() { return POLAR_DAY; }
    public static RiseSetHourAngles polarNight() { return POLAR_NIGHT; }

    public Condition getCondition() { return condition; }
    public boolean hasEvents() { return condition == Condition.NORMAL; }

    public OptionalDouble getSunriseHourAngle() {
        return hasEvents() ? OptionalDouble.of(-halfDayArc) : OptionalDouble.empty();
    }

    public OptionalDouble getSunsetHourAngle() {
        return hasEvents() ? OptionalDouble.of(halfDayArc) : OptionalDouble.empty();
    }

    /** Length of daylight in hours (24 during polar day, 0 during polar night). */
    public double getDaylightHours() {
        switch (condition) {
            case POLAR_DAY: return 24.0;
            case POLAR_NIGHT: return 0.0;
            default: return 2.0 * halfDayArc / 15.0;
        }
    }

    @Override
    public String toString() {
        return hasEvents() ? String.format("RiseSetHourAngles[-%.3f°, +%.3f°]", halfDayArc, halfDayArc)
                           : "RiseSetHourAngles[" + condition + "]";
    }
}
