package de.anton.analemma.algorithms.detection;

import de.anton.analemma.model.SunBlob;
import de.anton.analemma.model.PixelCoordinate;

import java.awt.Rectangle;
import java.util.Optional;

/** The first pixel (row-major) holding the maximum brightness. Never declines. */
public class BrightestPixelStrategy implements SunDetectionStrategy {

    public static final String NAME = "brightest-pixel";

    @Override
    public Optional<SunBlob> detect(BrightnessGrid grid) {
        int best = 0;
        for (int i = 1; i < grid.size(); i++) {
            if (grid.getAt(i) > grid.getAt(best)) best = i;
        }
        int x = best % grid.getWidth();
        int y = best / grid.getWidth();
        return Optional.of(new SunBlob(new PixelCoordinate(x, y), 1, new Rectangle(x, y, 1, 1), NAME));
    }

    @Override
    public String getName() { return NAME; }
}
