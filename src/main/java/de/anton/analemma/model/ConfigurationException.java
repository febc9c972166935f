package de.anton.analemma.model;

/**
 * Raised when a computation is set up with inputs it cannot work with: a delegated
 * solar model without an ephemeris provider, a camera calibration with non-positive
 * focal length or field of view, or a pixel mapping requested without a calibration.
 * Always raised while wiring the pipeline, never half way through a series.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
