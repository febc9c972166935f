package de.anton.analemma.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Links one real observation of the Sun to one image pixel. All projected pixel
 * positions are offsets from this point.
 * This class is immutable.
 */
public final class AnchorPoint {

    private final LocalDateTime dateTime;
    private final HorizonPosition horizonPosition;
    private final PixelCoordinate pixel;

    /**
     * @param dateTime        Local time the photograph was taken.
     * @param horizonPosition Sun position at that time; its azimuth must be defined.
     * @param pixel           Pixel where the Sun appears in the photograph.
     * @throws ConfigurationException if the anchor position has no azimuth (zenith/nadir).
     */
    public AnchorPoint(LocalDateTime dateTime, HorizonPosition horizonPosition, PixelCoordinate pixel) {
        this.dateTime = Objects.requireNonNull(dateTime, "Anchor date/time cannot be null.");
        this.horizonPosition = Objects.requireNonNull(horizonPosition, "Anchor horizon position cannot be null.");
        this.pixel = Objects.requireNonNull(pixel, "Anchor pixel cannot be null.");
        if (!horizonPosition.hasAzimuth()) {
            throw new ConfigurationException("Cannot anchor at " + dateTime + ": the Sun is at the zenith/nadir and has no azimuth.");
        }
    }

    // --- Getters ---
    public LocalDateTime getDateTime() { return dateTime; }
    public HorizonPosition getHorizonPosition() { return horizonPosition; }
    public PixelCoordinate getPixel() { return pixel; }
    public double getAltitude() { return horizonPosition.getAltitude(); }
    public double getAzimuth() { return horizonPosition.getAzimuth(); }

    @Override
    public String toString() {
        return String.format("AnchorPoint[%s, alt=%.3f°, az=%.3f°, pixel=(%.1f, %.1f)]",
                dateTime, getAltitude(), getAzimuth(), pixel.x(), pixel.y());
    }
}
