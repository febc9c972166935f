package de.anton.analemma.model;

/**
 * Enumeration of the available solar-position calculation modes.
 * Includes a display name as used on the command line.
 */
public enum CalculationMode {
    APPROXIMATE("approximate"),        // Closed-form sine approximations
    HIGH_PRECISION("high-precision");  // Declination from an ephemeris provider

    private final String displayName;

    CalculationMode(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }

    /**
     * Finds a CalculationMode based on its display name (case-insensitive).
     *
     * @param displayName The display name to search for, e.g. "high-precision".
     * @return The matching mode, or null if no match is found.
     */
    public static CalculationMode fromDisplayName(String displayName) {
        if (displayName == null) {
            return null;
        }
        for (CalculationMode mode : CalculationMode.values()) {
            if (mode.displayName.equalsIgnoreCase(displayName.trim())) {
                return mode;
            }
        }
        return null;
    }
}
