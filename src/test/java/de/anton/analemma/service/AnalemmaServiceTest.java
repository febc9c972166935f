package de.anton.analemma.service;

import de.anton.analemma.model.*;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

public class AnalemmaServiceTest {

    private static final ObserverLocation CHAMPAIGN = new ObserverLocation(40.1, -88.2, -6);

    private final AnalemmaService service = new AnalemmaService();

    @Test
    void calculatesNoonAnalemmaForAYear() {
        AnalemmaService.CalculationResult result = service.calculate(CalculationConfiguration.defaults(CHAMPAIGN, 2026));

        assertEquals(365, result.solarPositions.size());
        assertEquals(365, result.horizonPositions.size());
        assertEquals(46.9, result.statistics.altitudeSpan(), 1.0);
        assertEquals(73.25, result.statistics.maxAltitude(), 0.1);
        double eotSpan = result.equationOfTimeSpan();
        assertTrue(eotSpan > 30.0 && eotSpan < 35.0, "EoT span was " + eotSpan);
    }

    @Test
    void highPrecisionStaysCloseToApproximation() {
        AnalemmaService.ModeComparison comparison = service.compareModes(CalculationConfiguration.defaults(CHAMPAIGN, 2026));

        assertEquals(CalculationMode.APPROXIMATE, comparison.approximate.configuration.mode());
        assertEquals(CalculationMode.HIGH_PRECISION, comparison.highPrecision.configuration.mode());
        assertTrue(comparison.meanDeclinationDifference < 1.0);
        assertTrue(comparison.maxDeclinationDifference < 1.5);
        assertEquals(0.0, comparison.maxEquationOfTimeDifference, 1e-9);
    }

    @Test
    void anchorDayMapsOntoGivenSunPixel() {
        LocalDateTime anchorTime = LocalDateTime.of(2026, 6, 21, 12, 0);
        AnchorConfiguration config = AnchorConfiguration.withFieldOfView(null, anchorTime, CHAMPAIGN,
                new PixelCoordinate(500, 400), 50.0, 40.0, null);
        BufferedImage image = new BufferedImage(1000, 800, BufferedImage.TYPE_INT_RGB);

        AnalemmaService.AnchorResult result = service.anchor(config, image);

        assertNull(result.detectedSun);
        assertEquals(20.0, result.calibration.getPixelsPerDegreeAzimuth(), 1e-9);
        assertEquals(365, result.projection.getTotalPositions());
        assertEquals(0, result.projection.getFilteredBelowHorizon());
        ProjectedPoint anchorDay = result.projection.getVisiblePoints().get(171);
        assertEquals(172, anchorDay.dayOfYear());
        assertEquals(500.0, anchorDay.pixelX(), 1e-9);
        assertEquals(400.0, anchorDay.pixelY(), 1e-9);
        // Winter noon Sun is lower, so further down in the image
        assertTrue(result.projection.getVisiblePoints().get(354).pixelY() > 400.0);
    }

    @Test
    void anchorDetectsSunWhenNoPixelGiven() {
        BufferedImage image = new BufferedImage(400, 300, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                int dx = x - 250, dy = y - 120;
                image.setRGB(x, y, dx * dx + dy * dy <= 36 ? 0xFFFFFF : 0x203040);
            }
        }
        AnchorConfiguration config = AnchorConfiguration.withFocalLength(null, LocalDateTime.of(2026, 3, 20, 12, 0),
                CHAMPAIGN, null, 24.0, null);

        AnalemmaService.AnchorResult result = service.anchor(config, image);

        assertNotNull(result.detectedSun);
        assertEquals(250.0, result.anchor.getPixel().x(), 1.0);
        assertEquals(120.0, result.anchor.getPixel().y(), 1.0);
        assertFalse(result.projection.getVisiblePoints().isEmpty());
    }

    @Test
    void anchorConfigurationNeedsFocalLengthOrFieldOfView() {
        assertThrows(ConfigurationException.class, () -> new AnchorConfiguration(null, LocalDateTime.of(2026, 1, 1, 12, 0),
                CHAMPAIGN, null, null, 36, 24, 60.0, null, true, 30, null));
    }

    @Test
    void calculationConfigurationRejectsInvalidClockTime() {
        assertThrows(IllegalArgumentException.class,
                () -> new CalculationConfiguration(CHAMPAIGN, 2026, 24, 0, 365, CalculationMode.APPROXIMATE));
        assertThrows(IllegalArgumentException.class,
                () -> new CalculationConfiguration(CHAMPAIGN, 2026, 12, 0, 0, CalculationMode.APPROXIMATE));
    }
}
