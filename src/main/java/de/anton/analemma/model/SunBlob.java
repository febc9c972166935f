package de.anton.analemma.model;

import java.awt.Rectangle;
import java.util.Objects;

/**
 * A bright region found in a photograph that is taken to be the Sun's disc.
 * Transient result of sun detection; not persisted.
 */
public final class SunBlob {

    private final PixelCoordinate centroid;
    private final int pixelCount;
    private final Rectangle bounds;
    private final String strategy; // Name of the detection strategy that produced the blob

    public SunBlob(PixelCoordinate centroid, int pixelCount, Rectangle bounds, String strategy) {
        this.centroid = Objects.requireNonNull(centroid, "Centroid cannot be null.");
        if (pixelCount <= 0) {
            throw new IllegalArgumentException("Blob must cover at least one pixel. Got: " + pixelCount);
        }
        this.pixelCount = pixelCount;
        this.bounds = new Rectangle(Objects.requireNonNull(bounds, "Bounds cannot be null."));
        this.strategy = Objects.requireNonNull(strategy, "Strategy name cannot be null.");
    }

    // --- Getters ---
    public PixelCoordinate getCentroid() { return centroid; }
    public int getPixelCount() { return pixelCount; }
    public Rectangle getBounds() { return new Rectangle(bounds); }
    public String getStrategy() { return strategy; }

    @Override
    public String toString() {
        return String.format("SunBlob[centroid=(%.2f, %.2f), pixels=%d, bounds=%dx%d@%d,%d, strategy=%s]",
                centroid.x(), centroid.y(), pixelCount, bounds.width, bounds.height, bounds.x, bounds.y, strategy);
    }
}
