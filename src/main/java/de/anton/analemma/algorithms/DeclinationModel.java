package de.anton.analemma.algorithms;

/**
 * Approximate solar declination as a function of the day of year.
 * <p>
 * δ = 23.45° · sin(360/365 · (284 + day)), which passes through zero at the vernal
 * equinox (day 81) and is bounded by the axial tilt.
 */
public final class DeclinationModel {

    /** Axial tilt used as the declination amplitude, in degrees. */
    public static final double OBLIQUITY = 23.45;

    private DeclinationModel() { throw new IllegalStateException("Utility class"); }

    /**
     * @param dayOfYear Day of year in [1, 366].
     * @return Declination in degrees, within [-23.45, 23.45].
     */
    public static double approximate(int dayOfYear) {
        validateDay(dayOfYear);
        return OBLIQUITY * Math.sin(Math.toRadians(360.0 / 365.0 * (284 + dayOfYear)));
    }

    /** Maximum and minimum declination of the approximate model, {max, min}. */
    public static double[] range() {
        return new double[]{OBLIQUITY, -OBLIQUITY};
    }

    static void validateDay(int dayOfYear) {
        if (dayOfYear < 1 || dayOfYear > 366) {
            throw new IllegalArgumentException("Day of year must be within [1, 366]. Got: " + dayOfYear);
        }
    }
}
