package de.anton.analemma.algorithms;

import de.anton.analemma.model.CameraCalibration;
import de.anton.analemma.model.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link CameraCalibration} values from a field of view or from lens and sensor data.
 * <p>
 * The calibration is a flat, small-angle mapping (constant pixels per degree on each axis),
 * not a perspective projection. It is accurate close to the anchor point and drifts further
 * away from it, noticeably so with wide-angle lenses.
 */
public final class CameraCalibrator {

    private static final Logger logger = LoggerFactory.getLogger(CameraCalibrator.class);

    /** Full-frame sensor width in mm. */
    public static final double DEFAULT_SENSOR_WIDTH_MM = 36.0;
    /** Full-frame sensor height in mm. */
    public static final double DEFAULT_SENSOR_HEIGHT_MM = 24.0;

    private CameraCalibrator() { throw new IllegalStateException("Utility class"); }

    public static CameraCalibration fromFieldOfView(int imageWidth, int imageHeight,
                                                    double horizontalFov, double verticalFov) {
        CameraCalibration calibration = new CameraCalibration(imageWidth, imageHeight, horizontalFov, verticalFov);
        logger.debug("Calibrated {}", calibration);
        return calibration;
    }

    public static CameraCalibration fromFocalLength(int imageWidth, int imageHeight, double focalLengthMm) {
        return fromFocalLength(imageWidth, imageHeight, focalLengthMm, DEFAULT_SENSOR_WIDTH_MM, DEFAULT_SENSOR_HEIGHT_MM);
    }

    /**
     * Derives the field of view with fov = 2·atan(sensor / (2·focal)) and calibrates from it.
     *
     * @throws ConfigurationException If the focal length or a sensor dimension is not positive and finite.
     */
    public static CameraCalibration fromFocalLength(int imageWidth, int imageHeight, double focalLengthMm,
                                                    double sensorWidthMm, double sensorHeightMm) {
        requirePositive(focalLengthMm, "Focal length");
        double hFov = fieldOfView(sensorWidthMm, focalLengthMm);
        double vFov = fieldOfView(sensorHeightMm, focalLengthMm);
        logger.info("Focal length {} mm on {}x{} mm sensor gives FOV {}° x {}°",
                focalLengthMm, sensorWidthMm, sensorHeightMm, String.format("%.2f", hFov), String.format("%.2f", vFov));
        return fromFieldOfView(imageWidth, imageHeight, hFov, vFov);
    }

    /** Angle of view in degrees covered by one sensor dimension. */
    public static double fieldOfView(double sensorDimensionMm, double focalLengthMm) {
        requirePositive(sensorDimensionMm, "Sensor dimension");
        requirePositive(focalLengthMm, "Focal length");
        return Math.toDegrees(2.0 * Math.atan(sensorDimensionMm / (2.0 * focalLengthMm)));
    }

    private static void requirePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new ConfigurationException(name + " must be positive. Got: " + value);
        }
    }
}
