package de.anton.analemma.algorithms;

import de.anton.analemma.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Places sky positions into a photograph relative to an anchored observation of the Sun.
 * <p>
 * Each position is converted to an angular offset from the anchor and scaled by the
 * calibration: Δx = Δaz·px/°, Δy = −Δalt·px/° (image y grows downwards). The azimuth
 * offset is wrapped into [-180, 180) so paths crossing North stay continuous.
 */
public final class ImageProjector {

    private static final Logger logger = LoggerFactory.getLogger(ImageProjector.class);

    private ImageProjector() { throw new IllegalStateException("Utility class"); }

    /**
     * @param anchor         Observation the offsets are measured from.
     * @param calibration    Pixel scale; required.
     * @param horizonSeries  One horizon position per day.
     * @return Visible points ordered by day of year, plus filter counts.
     * @throws ConfigurationException If the calibration is missing.
     */
    public static ProjectionResult projectYear(AnchorPoint anchor, CameraCalibration calibration,
                                               List<HorizonPosition> horizonSeries) {
        requireCalibration(calibration);
        Objects.requireNonNull(anchor, "Anchor point cannot be null.");
        Objects.requireNonNull(horizonSeries, "Horizon series cannot be null.");

        List<ProjectedPoint> visible = new ArrayList<>();
        int belowHorizon = 0;
        int undefinedAzimuth = 0;
        for (int i = 0; i < horizonSeries.size(); i++) {
            HorizonPosition position = horizonSeries.get(i);
            if (position == null) continue;
            if (!position.isAboveHorizon()) {
                belowHorizon++;
                continue;
            }
            if (!position.hasAzimuth()) {
                undefinedAzimuth++;
                continue;
            }
            int day = position.getDayOfYear() > 0 ? position.getDayOfYear() : i + 1;
            LocalDate date = position.getSolarPosition() != null ? position.getSolarPosition().getDateTime().toLocalDate() : null;
            PixelCoordinate pixel = skyToPixel(anchor, calibration, position.getAltitude(), position.getAzimuth());
            visible.add(new ProjectedPoint(day, date, pixel, position.getAltitude(), position.getAzimuth()));
        }
        visible.sort(Comparator.comparingInt(ProjectedPoint::dayOfYear));

        if (belowHorizon > 0) {
            logger.info("{} of {} positions are below the horizon and were filtered.", belowHorizon, horizonSeries.size());
        }
        if (undefinedAzimuth > 0) {
            logger.warn("{} positions without a defined azimuth were skipped.", undefinedAzimuth);
        }
        return new ProjectionResult(anchor, calibration, visible, belowHorizon, undefinedAzimuth, horizonSeries.size());
    }

    /** Pixel position of a single sky position; the anchor's own position maps to the anchor pixel. */
    public static PixelCoordinate skyToPixel(AnchorPoint anchor, CameraCalibration calibration,
                                             double altitude, double azimuth) {
        requireCalibration(calibration);
        Objects.requireNonNull(anchor, "Anchor point cannot be null.");
        double deltaAz = wrapDegrees(azimuth - anchor.getAzimuth());
        double deltaAlt = altitude - anchor.getAltitude();
        PixelCoordinate origin = anchor.getPixel();
        return new PixelCoordinate(origin.x() + deltaAz * calibration.getPixelsPerDegreeAzimuth(),
                                   origin.y() - deltaAlt * calibration.getPixelsPerDegreeAltitude());
    }

    /** Wraps an angle difference into [-180, 180). */
    static double wrapDegrees(double degrees) {
        double wrapped = (degrees + 180.0) % 360.0;
        if (wrapped < 0) wrapped += 360.0;
        return wrapped - 180.0;
    }

    private static void requireCalibration(CameraCalibration calibration) {
        if (calibration == null) {
            throw new ConfigurationException("Camera calibration is required before mapping sky positions to pixels.");
        }
    }
}
