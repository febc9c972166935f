package de.anton.analemma.algorithms;

import de.anton.analemma.model.SolarPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Produces one {@link SolarPosition} per day at a fixed clock time, starting on 1 January.
 */
public class SolarPositionSeries {

    private static final Logger logger = LoggerFactory.getLogger(SolarPositionSeries.class);
    public static final int DEFAULT_DAYS = 365;

    private final SolarPositionProvider provider;
    private final int year;

    public SolarPositionSeries(SolarPositionProvider provider, int year) {
        this.provider = Objects.requireNonNull(provider, "Solar position provider cannot be null.");
        if (year < 1 || year > 9999) throw new IllegalArgumentException("Year must be within [1, 9999]. Got: " + year);
        this.year = year;
    }

    public List<SolarPosition> calculateYear(int hour, int minute) {
        return calculateYear(hour, minute, DEFAULT_DAYS);
    }

    /**
     * @param hour   Local clock hour [0, 23].
     * @param minute Local clock minute [0, 59].
     * @param days   Number of consecutive days, 1 to the length of the year.
     * @return Positions ordered by day of year.
     */
    public List<SolarPosition> calculateYear(int hour, int minute, int days) {
        validateClockTime(hour, minute);
        LocalDate start = LocalDate.of(year, 1, 1);
        if (days < 1 || days > start.lengthOfYear()) {
            throw new IllegalArgumentException("Days must be within [1, " + start.lengthOfYear() + "]. Got: " + days);
        }
        logger.debug("Calculating {} solar positions for {} at {}:{} using {}", days, year, hour, minute, provider);

        List<SolarPosition> positions = new ArrayList<>(days);
        for (int i = 0; i < days; i++) {
            LocalDateTime timestamp = start.plusDays(i).atTime(hour, minute);
            positions.add(provider.calculate(timestamp));
        }
        return Collections.unmodifiableList(positions);
    }

    public SolarPositionProvider getProvider() { return provider; }
    public int getYear() { return year; }

    static void validateClockTime(int hour, int minute) {
        if (hour < 0 || hour > 23) throw new IllegalArgumentException("Hour must be within [0, 23]. Got: " + hour);
        if (minute < 0 || minute > 59) throw new IllegalArgumentException("Minute must be within [0, 59]. Got: " + minute);
    }
}
