package de.anton.analemma.algorithms;

import de.anton.analemma.model.*;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ImageProjectorTest {

    private static final CameraCalibration CALIBRATION = CameraCalibrator.fromFieldOfView(1000, 800, 50.0, 40.0); // 20 px/°

    private static AnchorPoint anchorAt(double altitude, double azimuth, double x, double y) {
        HorizonPosition position = new HorizonPosition(altitude, azimuth, 0.0, 0.0, 0.0, null);
        return new AnchorPoint(LocalDateTime.of(2026, 6, 21, 12, 0), position, new PixelCoordinate(x, y));
    }

    private static HorizonPosition dayPosition(int day, double altitude, double azimuth) {
        SolarPosition solar = new SolarPosition(0.0, 0.0, LocalDateTime.of(2026, 1, 1, 12, 0).plusDays(day - 1),
                CalculationMode.APPROXIMATE);
        return new HorizonPosition(altitude, azimuth, 0.0, 0.0, 0.0, solar);
    }

    @Test
    void anchorPositionMapsToAnchorPixelExactly() {
        AnchorPoint anchor = anchorAt(37.123456, 201.987654, 512.25, 300.75);
        PixelCoordinate pixel = ImageProjector.skyToPixel(anchor, CALIBRATION, anchor.getAltitude(), anchor.getAzimuth());
        assertEquals(anchor.getPixel(), pixel);
    }

    @Test
    void offsetsScaleWithCalibrationAndInvertVerticalAxis() {
        AnchorPoint anchor = anchorAt(30.0, 180.0, 500.0, 400.0);
        PixelCoordinate east = ImageProjector.skyToPixel(anchor, CALIBRATION, 30.0, 181.0);
        PixelCoordinate higher = ImageProjector.skyToPixel(anchor, CALIBRATION, 31.0, 180.0);
        assertEquals(520.0, east.x(), 1e-9);
        assertEquals(400.0, east.y(), 1e-9);
        assertEquals(500.0, higher.x(), 1e-9);
        assertEquals(380.0, higher.y(), 1e-9);
    }

    @Test
    void azimuthOffsetWrapsAcrossNorth() {
        AnchorPoint anchor = anchorAt(10.0, 359.0, 500.0, 400.0);
        assertEquals(540.0, ImageProjector.skyToPixel(anchor, CALIBRATION, 10.0, 1.0).x(), 1e-9);
        AnchorPoint other = anchorAt(10.0, 1.0, 500.0, 400.0);
        assertEquals(460.0, ImageProjector.skyToPixel(other, CALIBRATION, 10.0, 359.0).x(), 1e-9);
    }

    @Test
    void belowHorizonAndUndefinedAzimuthAreCountedNotProjected() {
        List<HorizonPosition> series = new ArrayList<>();
        series.add(dayPosition(1, 20.0, 170.0));
        series.add(dayPosition(2, -5.0, 175.0));
        series.add(dayPosition(3, 90.0, Double.NaN));
        series.add(dayPosition(4, 25.0, 185.0));

        ProjectionResult result = ImageProjector.projectYear(anchorAt(20.0, 180.0, 500.0, 400.0), CALIBRATION, series);
        assertEquals(2, result.getVisiblePoints().size());
        assertEquals(1, result.getFilteredBelowHorizon());
        assertEquals(1, result.getUndefinedAzimuth());
        assertEquals(4, result.getTotalPositions());
        assertEquals(1, result.getVisiblePoints().get(0).dayOfYear());
        assertEquals(4, result.getVisiblePoints().get(1).dayOfYear());
        assertEquals(300.0, result.getVisiblePoints().get(0).pixelX(), 1e-9);
        assertEquals(600.0, result.getVisiblePoints().get(1).pixelX(), 1e-9);
        assertEquals(300.0, result.getVisiblePoints().get(1).pixelY(), 1e-9);
    }

    @Test
    void projectionIsRepeatable() {
        List<HorizonPosition> series = List.of(dayPosition(1, 20.0, 170.0), dayPosition(2, 21.0, 171.0));
        AnchorPoint anchor = anchorAt(20.0, 180.0, 500.0, 400.0);
        ProjectionResult first = ImageProjector.projectYear(anchor, CALIBRATION, series);
        ProjectionResult second = ImageProjector.projectYear(anchor, CALIBRATION, series);
        assertEquals(first.getVisiblePoints(), second.getVisiblePoints());
    }

    @Test
    void missingCalibrationIsConfigurationError() {
        AnchorPoint anchor = anchorAt(20.0, 180.0, 500.0, 400.0);
        assertThrows(ConfigurationException.class, () -> ImageProjector.skyToPixel(anchor, null, 10.0, 10.0));
        assertThrows(ConfigurationException.class, () -> ImageProjector.projectYear(anchor, null, List.of()));
    }

    @Test
    void anchorRequiresDefinedAzimuth() {
        HorizonPosition zenith = new HorizonPosition(90.0, Double.NaN, 0.0, 0.0, 0.0, null);
        assertThrows(ConfigurationException.class,
                () -> new AnchorPoint(LocalDateTime.of(2026, 1, 1, 12, 0), zenith, new PixelCoordinate(1, 1)));
    }
}
