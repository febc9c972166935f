package de.anton.analemma.algorithms;

import de.anton.analemma.model.CameraCalibration;
import de.anton.analemma.model.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CameraCalibratorTest {

    @Test
    void fieldOfViewGivesPixelsPerDegree() {
        CameraCalibration calibration = CameraCalibrator.fromFieldOfView(4000, 3000, 80.0, 60.0);
        assertEquals(50.0, calibration.getPixelsPerDegreeAzimuth(), 1e-12);
        assertEquals(50.0, calibration.getPixelsPerDegreeAltitude(), 1e-12);
    }

    @Test
    void focalLengthUsesFullFrameSensorByDefault() {
        CameraCalibration calibration = CameraCalibrator.fromFocalLength(6000, 4000, 50.0);
        double hFov = Math.toDegrees(2 * Math.atan(36.0 / 100.0));
        double vFov = Math.toDegrees(2 * Math.atan(24.0 / 100.0));
        assertEquals(39.60, hFov, 0.01);
        assertEquals(hFov, calibration.getHorizontalFov(), 1e-9);
        assertEquals(vFov, calibration.getVerticalFov(), 1e-9);
        assertEquals(6000 / hFov, calibration.getPixelsPerDegreeAzimuth(), 1e-9);
        assertEquals(4000 / vFov, calibration.getPixelsPerDegreeAltitude(), 1e-9);
    }

    @Test
    void customSensorChangesFieldOfView() {
        CameraCalibration apsc = CameraCalibrator.fromFocalLength(6000, 4000, 50.0, 23.5, 15.6);
        CameraCalibration fullFrame = CameraCalibrator.fromFocalLength(6000, 4000, 50.0);
        assertTrue(apsc.getHorizontalFov() < fullFrame.getHorizontalFov());
    }

    @Test
    void invalidInputsAreConfigurationErrors() {
        assertThrows(ConfigurationException.class, () -> CameraCalibrator.fromFocalLength(100, 100, 0.0));
        assertThrows(ConfigurationException.class, () -> CameraCalibrator.fromFocalLength(100, 100, -35.0));
        assertThrows(ConfigurationException.class, () -> CameraCalibrator.fromFocalLength(100, 100, Double.NaN));
        assertThrows(ConfigurationException.class, () -> CameraCalibrator.fromFocalLength(100, 100, 50.0, 0.0, 24.0));
        assertThrows(ConfigurationException.class, () -> CameraCalibrator.fromFieldOfView(100, 100, 0.0, 30.0));
        assertThrows(ConfigurationException.class, () -> CameraCalibrator.fromFieldOfView(100, 100, 40.0, -1.0));
        assertThrows(ConfigurationException.class, () -> CameraCalibrator.fromFieldOfView(0, 100, 40.0, 30.0));
    }
}
