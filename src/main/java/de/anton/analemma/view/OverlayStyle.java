package de.anton.analemma.view;

import java.awt.Color;
import java.util.Objects;

/**
 * Drawing options for the analemma overlay.
 */
public record OverlayStyle(
    int dotSize,
    Color dotColor,
    Color lineColor,
    int lineWidth,
    boolean showDates,
    int dateInterval,
    boolean showAnchorLabel,
    String caption // Null: no caption
) {
    public OverlayStyle {
        Objects.requireNonNull(dotColor, "Dot color cannot be null.");
        Objects.requireNonNull(lineColor, "Line color cannot be null.");
        if (dotSize < 1) throw new IllegalArgumentException("Dot size must be positive. Got: " + dotSize);
        if (lineWidth < 1) throw new IllegalArgumentException("Line width must be positive. Got: " + lineWidth);
        if (dateInterval < 1) throw new IllegalArgumentException("Date interval must be positive. Got: " + dateInterval);
    }

    public static OverlayStyle defaults() {
        return new OverlayStyle(10, new Color(255, 255, 0), new Color(255, 200, 0), 2, true, 30, true, null);
    }

    public OverlayStyle withDates(boolean show, int interval) {
        return new OverlayStyle(dotSize, dotColor, lineColor, lineWidth, show, interval, showAnchorLabel, caption);
    }

    public OverlayStyle withCaption(String text) {
        return new OverlayStyle(dotSize, dotColor, lineColor, lineWidth, showDates, dateInterval, showAnchorLabel, text);
    }

    /** Markers and line only, no text at all. */
    public OverlayStyle withoutText() {
        return new OverlayStyle(dotSize, dotColor, lineColor, lineWidth, false, dateInterval, false, null);
    }
}
