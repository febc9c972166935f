package de.anton.analemma.service;

import de.anton.analemma.algorithms.*;
import de.anton.analemma.algorithms.detection.SunDetector;
import de.anton.analemma.ephemeris.EphemerisProvider;
import de.anton.analemma.ephemeris.NoaaEphemerisProvider;
import de.anton.analemma.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Service running the analemma pipelines: yearly series, mode comparison and anchoring to a photograph.
 * Holds only immutable collaborators; every call is independent.
 */
public class AnalemmaService {

    private static final Logger logger = LoggerFactory.getLogger(AnalemmaService.class);

    private final EphemerisProvider ephemerisProvider;
    private final SunDetector sunDetector;

    public AnalemmaService() {
        this(new NoaaEphemerisProvider(), SunDetector.createDefault());
    }

    /**
     * @param ephemerisProvider Used for high-precision runs; may be null when only approximate runs are made.
     * @param sunDetector       Used when an anchor run has no sun pixel.
     */
    public AnalemmaService(EphemerisProvider ephemerisProvider, SunDetector sunDetector) {
        this.ephemerisProvider = ephemerisProvider;
        this.sunDetector = Objects.requireNonNull(sunDetector, "Sun detector cannot be null.");
    }

    /** Result of a yearly calculation. */
    public static class CalculationResult {
        public final CalculationConfiguration configuration;
        public final List<SolarPosition> solarPositions;
        public final List<HorizonPosition> horizonPositions;
        public final SkyStatistics statistics;

        private CalculationResult(CalculationConfiguration configuration, List<SolarPosition> solar, List<HorizonPosition> horizon) {
            this.configuration = configuration;
            this.solarPositions = Collections.unmodifiableList(solar);
            this.horizonPositions = Collections.unmodifiableList(horizon);
            this.statistics = SkyStatistics.ofHorizon(horizon);
        }

        public double equationOfTimeSpan() {
            double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
            for (SolarPosition p : solarPositions) {
                min = Math.min(min, p.getEquationOfTime());
                max = Math.max(max, p.getEquationOfTime());
            }
            return solarPositions.isEmpty() ? Double.NaN : max - min;
        }
    }

    /** Day-by-day differences between the approximate and high-precision series. */
    public static class ModeComparison {
        public final CalculationResult approximate;
        public final CalculationResult highPrecision;
        public final double meanDeclinationDifference;
        public final double maxDeclinationDifference;
        public final double meanEquationOfTimeDifference;
        public final double maxEquationOfTimeDifference;

        private ModeComparison(CalculationResult approximate, CalculationResult highPrecision) {
            this.approximate = approximate;
            this.highPrecision = highPrecision;
            int n = Math.min(approximate.solarPositions.size(), highPrecision.solarPositions.size());
            double decSum = 0, decMax = 0, eotSum = 0, eotMax = 0;
            for (int i = 0; i < n; i++) {
                SolarPosition a = approximate.solarPositions.get(i);
                SolarPosition h = highPrecision.solarPositions.get(i);
                double dDec = Math.abs(a.getDeclination() - h.getDeclination());
                double dEot = Math.abs(a.getEquationOfTime() - h.getEquationOfTime());
                decSum += dDec; decMax = Math.max(decMax, dDec);
                eotSum += dEot; eotMax = Math.max(eotMax, dEot);
            }
            this.meanDeclinationDifference = n > 0 ? decSum / n : Double.NaN;
            this.maxDeclinationDifference = n > 0 ? decMax : Double.NaN;
            this.meanEquationOfTimeDifference = n > 0 ? eotSum / n : Double.NaN;
            this.maxEquationOfTimeDifference = n > 0 ? eotMax : Double.NaN;
        }
    }

    /** Result of anchoring a year of positions to a photograph. */
    public static class AnchorResult {
        public final AnchorConfiguration configuration;
        public final AnchorPoint anchor;
        public final SunBlob detectedSun; // Null when the sun pixel was given
        public final CameraCalibration calibration;
        public final List<HorizonPosition> horizonPositions;
        public final ProjectionResult projection;

        private AnchorResult(AnchorConfiguration configuration, AnchorPoint anchor, SunBlob detectedSun,
                             CameraCalibration calibration, List<HorizonPosition> horizon, ProjectionResult projection) {
            this.configuration = configuration;
            this.anchor = anchor;
            this.detectedSun = detectedSun;
            this.calibration = calibration;
            this.horizonPositions = Collections.unmodifiableList(horizon);
            this.projection = projection;
        }
    }

    /**
     * Calculates the solar and horizon position series for a year.
     *
     * @throws ConfigurationException If high precision is requested without an available ephemeris provider.
     */
    public CalculationResult calculate(CalculationConfiguration config) {
        Objects.requireNonNull(config, "Configuration cannot be null.");
        ObserverLocation observer = config.observer();
        logger.info("Service: Calculating {} days for {} at {}:{} ({} mode)",
                config.days(), observer, config.hour(), String.format("%02d", config.minute()), config.mode());

        SolarPositionProvider provider = SolarPositionProviders.forMode(config.mode(), ephemerisProvider,
                observer.getTimezoneOffsetHours());
        List<SolarPosition> solar = new SolarPositionSeries(provider, config.year())
                .calculateYear(config.hour(), config.minute(), config.days());
        List<HorizonPosition> horizon = new HorizonProjector(observer).projectAll(solar);

        CalculationResult result = new CalculationResult(config, solar, horizon);
        logger.info("Service: Calculation finished: {}", result.statistics);
        return result;
    }

    /** Runs the same configuration in both modes and compares them day by day. */
    public ModeComparison compareModes(CalculationConfiguration config) {
        Objects.requireNonNull(config, "Configuration cannot be null.");
        CalculationResult approximate = calculate(config.withMode(CalculationMode.APPROXIMATE));
        CalculationResult precise = calculate(config.withMode(CalculationMode.HIGH_PRECISION));
        ModeComparison comparison = new ModeComparison(approximate, precise);
        logger.info("Service: Mode comparison: declination diff mean {}° / max {}°, EoT diff mean {} / max {} min",
                String.format("%.3f", comparison.meanDeclinationDifference),
                String.format("%.3f", comparison.maxDeclinationDifference),
                String.format("%.3f", comparison.meanEquationOfTimeDifference),
                String.format("%.3f", comparison.maxEquationOfTimeDifference));
        return comparison;
    }

    /**
     * Anchors the analemma for the anchor's clock time to the photograph.
     *
     * @param config Anchor parameters.
     * @param image  The photograph (read-only).
     * @throws ConfigurationException If the calibration inputs are invalid or the anchor has no defined azimuth.
     */
    public AnchorResult anchor(AnchorConfiguration config, BufferedImage image) {
        Objects.requireNonNull(config, "Configuration cannot be null.");
        Objects.requireNonNull(image, "Image cannot be null.");
        LocalDateTime anchorTime = config.anchorDateTime();
        ObserverLocation observer = config.observer();

        SunBlob detected = null;
        PixelCoordinate sunPixel = config.sunPixel();
        if (config.autoDetectSun()) {
            detected = sunDetector.detectBlob(image);
            sunPixel = detected.getCentroid();
        } else if (!sunPixel.isWithin(image.getWidth(), image.getHeight())) {
            logger.warn("Service: Sun pixel {} lies outside the {}x{} image.", sunPixel, image.getWidth(), image.getHeight());
        }

        SolarPositionProvider provider = new ApproximateModel();
        HorizonProjector projector = new HorizonProjector(observer);
        HorizonPosition anchorPosition = projector.project(provider.calculate(anchorTime));
        AnchorPoint anchor = new AnchorPoint(anchorTime, anchorPosition, sunPixel);
        logger.info("Service: Anchor {}", anchor);

        CameraCalibration calibration = config.calibrationFor(image.getWidth(), image.getHeight());
        List<SolarPosition> solar = new SolarPositionSeries(provider, anchorTime.getYear())
                .calculateYear(anchorTime.getHour(), anchorTime.getMinute());
        List<HorizonPosition> horizon = projector.projectAll(solar);
        ProjectionResult projection = ImageProjector.projectYear(anchor, calibration, horizon);
        logger.info("Service: {} ({} inside the image)", projection, projection.getPointsInFrame().size());

        return new AnchorResult(config, anchor, detected, calibration, horizon, projection);
    }
}
