package de.anton.analemma.model;

import java.util.Objects;

/**
 * Pixel-per-degree scale factors for one image.
 * <p>
 * The mapping is a flat small-angle approximation: one degree of azimuth is the same
 * number of pixels everywhere in the frame. It is accurate near the anchor point and
 * grows increasingly wrong towards the edges of wide-angle frames; no perspective or
 * lens-distortion model is applied.
 * This class is immutable; create it through {@code CameraCalibrator}.
 */
public final class CameraCalibration {

    private final double pixelsPerDegreeAzimuth;
    private final double pixelsPerDegreeAltitude;
    private final double horizontalFov; // Degrees
    private final double verticalFov;   // Degrees
    private final int imageWidth;
    private final int imageHeight;

    public CameraCalibration(int imageWidth, int imageHeight, double horizontalFov, double verticalFov) {
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new ConfigurationException(String.format("Image size must be positive. Got: %dx%d", imageWidth, imageHeight));
        }
        if (!(horizontalFov > 0) || !(verticalFov > 0) || !Double.isFinite(horizontalFov) || !Double.isFinite(verticalFov)) {
            throw new ConfigurationException(String.format("Field of view must be positive and finite. Got: %s x %s", horizontalFov, verticalFov));
        }
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;
        this.horizontalFov = horizontalFov;
        this.verticalFov = verticalFov;
        this.pixelsPerDegreeAzimuth = imageWidth / horizontalFov;
        this.pixelsPerDegreeAltitude = imageHeight / verticalFov;
    }

    // --- Getters ---
    public double getPixelsPerDegreeAzimuth() { return pixelsPerDegreeAzimuth; }
    public double getPixelsPerDegreeAltitude() { return pixelsPerDegreeAltitude; }
    public double getHorizontalFov() { return horizontalFov; }
    public double getVerticalFov() { return verticalFov; }
    public int getImageWidth() { return imageWidth; }
    public int getImageHeight() { return imageHeight; }

    @Override
    public String toString() {
        return String.format("CameraCalibration[%dx%d px, fov=%.2f°x%.2f°, %.3f px/° az, %.3f px/° alt]",
                imageWidth, imageHeight, horizontalFov, verticalFov, pixelsPerDegreeAzimuth, pixelsPerDegreeAltitude);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CameraCalibration that = (CameraCalibration) o;
        return imageWidth == that.imageWidth && imageHeight == that.imageHeight &&
               Double.compare(that.horizontalFov, horizontalFov) == 0 &&
               Double.compare(that.verticalFov, verticalFov) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(imageWidth, imageHeight, horizontalFov, verticalFov);
    }
}
