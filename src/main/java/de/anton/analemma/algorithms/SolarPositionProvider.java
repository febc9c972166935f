package de.anton.analemma.algorithms;

import de.anton.analemma.model.CalculationMode;
import de.anton.analemma.model.SolarPosition;

import java.time.LocalDateTime;

/**
 * Source of the Sun's declination and equation of time for a local civil timestamp.
 * The concrete variant is chosen once, at construction; callers never branch on the mode.
 */
public interface SolarPositionProvider {

    SolarPosition calculate(LocalDateTime localDateTime);

    CalculationMode getMode();
}
