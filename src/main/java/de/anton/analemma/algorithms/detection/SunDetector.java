package de.anton.analemma.algorithms.detection;

import de.anton.analemma.model.PixelCoordinate;
import de.anton.analemma.model.SunBlob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Locates the Sun in a photograph by trying detection strategies in order until one succeeds.
 * The default chain is largest blob, then weighted threshold centroid, then brightest pixel,
 * so a non-empty image always yields a coordinate.
 */
public class SunDetector {

    private static final Logger logger = LoggerFactory.getLogger(SunDetector.class);

    private final List<SunDetectionStrategy> strategies;

    public SunDetector(List<SunDetectionStrategy> strategies) {
        Objects.requireNonNull(strategies, "Strategy list cannot be null.");
        if (strategies.isEmpty()) throw new IllegalArgumentException("At least one detection strategy is required.");
        this.strategies = List.copyOf(strategies);
    }

    public static SunDetector createDefault() {
        return new SunDetector(List.of(new LargestBlobStrategy(), new WeightedCentroidStrategy(), new BrightestPixelStrategy()));
    }

    /** Chain used when region labeling is not wanted: weighted centroid, then brightest pixel. */
    public static SunDetector withoutLabeling() {
        return new SunDetector(List.of(new WeightedCentroidStrategy(), new BrightestPixelStrategy()));
    }

    public PixelCoordinate detect(BufferedImage image) {
        return detectBlob(image).getCentroid();
    }

    public SunBlob detectBlob(BufferedImage image) {
        Objects.requireNonNull(image, "Image cannot be null.");
        return detectBlob(BrightnessGrid.fromImage(image));
    }

    /**
     * @throws IllegalStateException If no strategy in the chain produced a result.
     */
    public SunBlob detectBlob(BrightnessGrid grid) {
        Objects.requireNonNull(grid, "Brightness grid cannot be null.");
        logger.debug("Detecting sun in {}x{} grid, max brightness {}, threshold {}",
                grid.getWidth(), grid.getHeight(), grid.getMaxValue(), grid.getThreshold());
        for (int i = 0; i < strategies.size(); i++) {
            SunDetectionStrategy strategy = strategies.get(i);
            Optional<SunBlob> blob = strategy.detect(grid);
            if (blob.isPresent()) {
                if (i > 0) {
                    logger.warn("Sun detection fell back to '{}'.", strategy.getName());
                }
                logger.info("Sun detected at ({}, {}) using '{}' ({} px)",
                        String.format("%.1f", blob.get().getCentroid().x()),
                        String.format("%.1f", blob.get().getCentroid().y()),
                        strategy.getName(), blob.get().getPixelCount());
                return blob.get();
            }
            logger.debug("Strategy '{}' found no sun.", strategy.getName());
        }
        throw new IllegalStateException("No detection strategy located the sun.");
    }

    public List<SunDetectionStrategy> getStrategies() { return strategies; }
}
