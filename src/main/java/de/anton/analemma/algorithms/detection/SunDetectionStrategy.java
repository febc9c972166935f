package de.anton.analemma.algorithms.detection;

import de.anton.analemma.model.SunBlob;

import java.util.Optional;

/** One way of locating the Sun in a brightness grid. Empty means "not applicable, try the next one". */
public interface SunDetectionStrategy {

    Optional<SunBlob> detect(BrightnessGrid grid);

    String getName();
}
