package de.anton.analemma.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One visible point of the analemma mapped into an image.
 */
public record ProjectedPoint(int dayOfYear, LocalDate date, PixelCoordinate pixel, double altitude, double azimuth) {

    public ProjectedPoint {
        Objects.requireNonNull(date, "Date cannot be null.");
        Objects.requireNonNull(pixel, "Pixel cannot be null.");
    }

    public double pixelX() { return pixel.x(); }
    public double pixelY() { return pixel.y(); }
}
