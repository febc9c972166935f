package de.anton.analemma.algorithms.detection;

import de.anton.analemma.model.SunBlob;

import java.util.Optional;

/**
 * Thresholds the grid, labels connected regions and takes the largest one as the solar disc.
 * Ties go to the region found first in row-major order.
 */
public class LargestBlobStrategy implements SunDetectionStrategy {

    public static final String NAME = "largest-blob";

    @Override
    public Optional<SunBlob> detect(BrightnessGrid grid) {
        boolean[] mask = grid.thresholdMask();
        BlobLabeler labeler = new BlobLabeler(mask, grid.getWidth(), grid.getHeight());
        int[] sizes = labeler.run();
        if (labeler.getComponentCount() == 0) return Optional.empty();

        int largest = 1;
        for (int label = 2; label < sizes.length; label++) {
            if (sizes[label] > sizes[largest]) largest = label;
        }

        CentroidAccumulator accumulator = new CentroidAccumulator();
        int width = grid.getWidth();
        for (int i = 0; i < grid.size(); i++) {
            if (labeler.getLabelAt(i) == largest) {
                accumulator.add(i % width, i / width, grid.getAt(i));
            }
        }
        return Optional.of(accumulator.toBlob(NAME));
    }

    @Override
    public String getName() { return NAME; }
}
