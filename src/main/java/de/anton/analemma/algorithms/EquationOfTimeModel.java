package de.anton.analemma.algorithms;

/**
 * Two-harmonic approximation of the equation of time.
 * <p>
 * With B = 2π(day − 81)/365: EoT = 9.87·sin(2B) − (7.53·cos(B) − 1.5·sin(B)) minutes.
 * The first term comes from the obliquity, the second from the orbit's eccentricity.
 * Used in both calculation modes; there is no high-precision variant.
 */
public final class EquationOfTimeModel {

    private static final double OBLIQUITY_AMPLITUDE = 9.87;
    private static final double ECCENTRICITY_COS = 7.53;
    private static final double ECCENTRICITY_SIN = 1.5;

    private EquationOfTimeModel() { throw new IllegalStateException("Utility class"); }

    /**
     * @param dayOfYear Day of year in [1, 366].
     * @return Equation of time in minutes, roughly within [-17, 15].
     */
    public static double approximate(int dayOfYear) {
        DeclinationModel.validateDay(dayOfYear);
        double b = 2.0 * Math.PI * (dayOfYear - 81) / 365.0;
        return OBLIQUITY_AMPLITUDE * Math.sin(2.0 * b)
                - (ECCENTRICITY_COS * Math.cos(b) - ECCENTRICITY_SIN * Math.sin(b));
    }
}
