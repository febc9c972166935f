package de.anton.analemma.algorithms;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EquationOfTimeModelTest {

    @Test
    void staysWithinTwentyMinutes() {
        for (int day = 1; day <= 366; day++) {
            assertTrue(Math.abs(EquationOfTimeModel.approximate(day)) <= 20.0, "day " + day);
        }
    }

    @Test
    void yearContainsPositiveAndNegativeValues() {
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (int day = 1; day <= 365; day++) {
            double eot = EquationOfTimeModel.approximate(day);
            min = Math.min(min, eot);
            max = Math.max(max, eot);
        }
        assertTrue(min < 0);
        assertTrue(max > 0);
        assertEquals(31.05, max - min, 0.1);
    }

    @Test
    void crossesZeroFourTimesPerYear() {
        int crossings = 0;
        double previous = EquationOfTimeModel.approximate(1);
        for (int day = 2; day <= 365; day++) {
            double current = EquationOfTimeModel.approximate(day);
            if ((previous > 0) != (current > 0)) crossings++;
            previous = current;
        }
        assertEquals(4, crossings);
    }

    @Test
    void rejectsInvalidDay() {
        assertThrows(IllegalArgumentException.class, () -> EquationOfTimeModel.approximate(-5));
    }
}
