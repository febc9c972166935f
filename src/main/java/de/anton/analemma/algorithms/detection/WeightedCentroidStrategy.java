package de.anton.analemma.algorithms.detection;

import de.anton.analemma.model.SunBlob;

import java.util.Optional;

/**
 * Brightness-weighted centroid of every thresholded pixel, without separating regions.
 * Declines when too few pixels pass the threshold to give a stable centroid.
 */
public class WeightedCentroidStrategy implements SunDetectionStrategy {

    public static final String NAME = "weighted-centroid";
    public static final int DEFAULT_MIN_PIXELS = 10;

    private final int minPixels;

    public WeightedCentroidStrategy() {
        this(DEFAULT_MIN_PIXELS);
    }

    /** @param minPixels The strategy succeeds only with more than this many thresholded pixels. */
    public WeightedCentroidStrategy(int minPixels) {
        if (minPixels < 0) throw new IllegalArgumentException("Minimum pixel count cannot be negative.");
        this.minPixels = minPixels;
    }

    @Override
    public Optional<SunBlob> detect(BrightnessGrid grid) {
        boolean[] mask = grid.thresholdMask();
        CentroidAccumulator accumulator = new CentroidAccumulator();
        int width = grid.getWidth();
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) accumulator.add(i % width, i / width, grid.getAt(i));
        }
        if (accumulator.getCount() <= minPixels) return Optional.empty();
        return Optional.of(accumulator.toBlob(NAME));
    }

    public int getMinPixels() { return minPixels; }

    @Override
    public String getName() { return NAME; }
}
