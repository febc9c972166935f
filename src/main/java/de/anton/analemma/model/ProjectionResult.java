package de.anton.analemma.model;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of projecting a year of horizon positions into an image.
 * Visible points are ordered by day of year. Days with the Sun below the horizon
 * and days without a defined azimuth are left out and only counted.
 */
public class ProjectionResult {

    private final AnchorPoint anchor;
    private final CameraCalibration calibration;
    private final List<ProjectedPoint> visiblePoints;
    private final int filteredBelowHorizon;
    private final int undefinedAzimuth;
    private final int totalPositions;

    public ProjectionResult(AnchorPoint anchor, CameraCalibration calibration, List<ProjectedPoint> visiblePoints,
                            int filteredBelowHorizon, int undefinedAzimuth, int totalPositions) {
        this.anchor = anchor;
        this.calibration = calibration;
        this.visiblePoints = visiblePoints != null ? Collections.unmodifiableList(visiblePoints) : Collections.emptyList();
        this.filteredBelowHorizon = filteredBelowHorizon;
        this.undefinedAzimuth = undefinedAzimuth;
        this.totalPositions = totalPositions;
    }

    // --- Getters ---
    public AnchorPoint getAnchor() { return anchor; }
    public CameraCalibration getCalibration() { return calibration; }
    public List<ProjectedPoint> getVisiblePoints() { return visiblePoints; }
    public int getFilteredBelowHorizon() { return filteredBelowHorizon; }
    public int getUndefinedAzimuth() { return undefinedAzimuth; }
    public int getTotalPositions() { return totalPositions; }

    /** Visible points that also fall inside the calibrated image frame. */
    public List<ProjectedPoint> getPointsInFrame() {
        return visiblePoints.stream()
                .filter(p -> p.pixel().isWithin(calibration.getImageWidth(), calibration.getImageHeight()))
                .collect(Collectors.toUnmodifiableList());
    }

    public SkyStatistics getStatistics() {
        return SkyStatistics.ofProjected(visiblePoints);
    }

    @Override
    public String toString() {
        return String.format("ProjectionResult[visible=%d, belowHorizon=%d, undefinedAzimuth=%d, total=%d]",
                visiblePoints.size(), filteredBelowHorizon, undefinedAzimuth, totalPositions);
    }
}
