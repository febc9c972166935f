package de.anton.analemma.service;

import de.anton.analemma.algorithms.CameraCalibrator;
import de.anton.analemma.model.CameraCalibration;
import de.anton.analemma.model.ConfigurationException;
import de.anton.analemma.model.ObserverLocation;
import de.anton.analemma.model.PixelCoordinate;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Immutable configuration object for anchoring an analemma to a photograph.
 * The calibration comes from the focal length when one is given, otherwise from the field of view.
 */
public record AnchorConfiguration(
    Path imagePath,
    LocalDateTime anchorDateTime,
    ObserverLocation observer,
    PixelCoordinate sunPixel,   // Null: detect the sun in the image
    Double focalLengthMm,
    double sensorWidthMm,
    double sensorHeightMm,
    Double horizontalFov,
    Double verticalFov,
    boolean showDates,
    int labelIntervalDays,
    Path outputPath             // Null: no overlay image is written
) {
    public static final int DEFAULT_LABEL_INTERVAL = 30;

    public AnchorConfiguration {
        Objects.requireNonNull(anchorDateTime, "Anchor date/time cannot be null.");
        Objects.requireNonNull(observer, "Observer location cannot be null.");
        if (focalLengthMm == null && (horizontalFov == null || verticalFov == null)) {
            throw new ConfigurationException("Either a focal length or a horizontal and vertical field of view is required.");
        }
        if (labelIntervalDays < 1) {
            throw new IllegalArgumentException("Label interval must be at least one day. Got: " + labelIntervalDays);
        }
    }

    public static AnchorConfiguration withFocalLength(Path imagePath, LocalDateTime anchorDateTime, ObserverLocation observer,
                                                      PixelCoordinate sunPixel, double focalLengthMm, Path outputPath) {
        return new AnchorConfiguration(imagePath, anchorDateTime, observer, sunPixel, focalLengthMm,
                CameraCalibrator.DEFAULT_SENSOR_WIDTH_MM, CameraCalibrator.DEFAULT_SENSOR_HEIGHT_MM,
                null, null, true, DEFAULT_LABEL_INTERVAL, outputPath);
    }

    public static AnchorConfiguration withFieldOfView(Path imagePath, LocalDateTime anchorDateTime, ObserverLocation observer,
                                                      PixelCoordinate sunPixel, double horizontalFov, double verticalFov,
                                                      Path outputPath) {
        return new AnchorConfiguration(imagePath, anchorDateTime, observer, sunPixel, null,
                CameraCalibrator.DEFAULT_SENSOR_WIDTH_MM, CameraCalibrator.DEFAULT_SENSOR_HEIGHT_MM,
                horizontalFov, verticalFov, true, DEFAULT_LABEL_INTERVAL, outputPath);
    }

    public boolean autoDetectSun() { return sunPixel == null; }

    /** Calibration for an image of the given size. */
    public CameraCalibration calibrationFor(int imageWidth, int imageHeight) {
        if (focalLengthMm != null) {
            return CameraCalibrator.fromFocalLength(imageWidth, imageHeight, focalLengthMm, sensorWidthMm, sensorHeightMm);
        }
        return CameraCalibrator.fromFieldOfView(imageWidth, imageHeight, horizontalFov, verticalFov);
    }
}
