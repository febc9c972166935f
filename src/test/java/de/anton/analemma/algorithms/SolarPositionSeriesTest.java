package de.anton.analemma.algorithms;

import de.anton.analemma.model.SolarPosition;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SolarPositionSeriesTest {

    @Test
    void yearHasOneEntryPerDayInOrder() {
        List<SolarPosition> positions = new SolarPositionSeries(new ApproximateModel(), 2026).calculateYear(12, 0);
        assertEquals(365, positions.size());
        for (int i = 0; i < positions.size(); i++) {
            assertEquals(i + 1, positions.get(i).getDayOfYear());
            assertEquals(12, positions.get(i).getDateTime().getHour());
        }
        assertEquals(LocalDateTime.of(2026, 12, 31, 12, 0), positions.get(364).getDateTime());
    }

    @Test
    void leapYearAllowsDay366() {
        SolarPositionSeries series = new SolarPositionSeries(new ApproximateModel(), 2024);
        assertEquals(366, series.calculateYear(9, 30, 366).size());
        assertThrows(IllegalArgumentException.class, () -> series.calculateYear(9, 30, 367));
    }

    @Test
    void rejectsInvalidClockTime() {
        SolarPositionSeries series = new SolarPositionSeries(new ApproximateModel(), 2026);
        assertThrows(IllegalArgumentException.class, () -> series.calculateYear(24, 0));
        assertThrows(IllegalArgumentException.class, () -> series.calculateYear(12, 60));
        assertThrows(IllegalArgumentException.class, () -> series.calculateYear(12, 0, 0));
    }
}
