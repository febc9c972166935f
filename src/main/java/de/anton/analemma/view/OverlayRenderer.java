package de.anton.analemma.view;

import de.anton.analemma.model.AnchorPoint;
import de.anton.analemma.model.ObserverLocation;
import de.anton.analemma.model.ProjectedPoint;
import de.anton.analemma.model.ProjectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.*;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Draws a projected analemma onto a copy of the photograph: a connecting line, one dot per
 * visible day, optional date labels, the highlighted anchor and a caption.
 * Only points inside the image frame are drawn.
 */
public class OverlayRenderer {

    private static final Logger logger = LoggerFactory.getLogger(OverlayRenderer.class);
    private static final DateTimeFormatter DATE_LABEL = DateTimeFormatter.ofPattern("MMM dd", Locale.ENGLISH);
    private static final DateTimeFormatter ANCHOR_LABEL = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final Color ANCHOR_FILL = new Color(255, 0, 0);
    private static final Color TEXT_COLOR = Color.WHITE;
    private static final Font TEXT_FONT = new Font(Font.SANS_SERIF, Font.PLAIN, 12);

    /** Rendered image plus how many days were drawn and left out. */
    public static class OverlayResult {
        public final BufferedImage image;
        public final int pointsDrawn;
        public final int pointsFiltered;

        OverlayResult(BufferedImage image, int pointsDrawn, int pointsFiltered) {
            this.image = image;
            this.pointsDrawn = pointsDrawn;
            this.pointsFiltered = pointsFiltered;
        }
    }

    /**
     * @param photograph Source image; not modified.
     * @param projection Projected analemma.
     * @param style      Drawing options.
     */
    public OverlayResult render(BufferedImage photograph, ProjectionResult projection, OverlayStyle style) {
        Objects.requireNonNull(photograph, "Image cannot be null.");
        Objects.requireNonNull(projection, "Projection cannot be null.");
        Objects.requireNonNull(style, "Overlay style cannot be null.");

        BufferedImage output = new BufferedImage(photograph.getWidth(), photograph.getHeight(), BufferedImage.TYPE_INT_RGB);
        List<ProjectedPoint> inFrame = projection.getVisiblePoints().stream()
                .filter(p -> p.pixel().isWithin(photograph.getWidth(), photograph.getHeight()))
                .collect(Collectors.toList());

        Graphics2D g = output.createGraphics();
        try {
            g.drawImage(photograph, 0, 0, null);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            drawLine(g, inFrame, style);
            drawDots(g, inFrame, style);
            drawAnchor(g, projection.getAnchor(), style);
            if (style.caption() != null && !style.caption().isBlank()) {
                drawText(g, style.caption(), 10, 10);
            }
        } finally {
            g.dispose();
        }

        int filtered = projection.getTotalPositions() - inFrame.size();
        logger.info("Overlay drawn: {} points inside the image, {} filtered.", inFrame.size(), filtered);
        return new OverlayResult(output, inFrame.size(), filtered);
    }

    /** Caption describing location and clock time of the analemma. */
    public static String defaultCaption(ObserverLocation observer, AnchorPoint anchor) {
        return String.format(Locale.ROOT, "Location: %.2f°, %.2f°%nAnalemma for %s throughout %d",
                observer.getLatitude(), observer.getLongitude(),
                anchor.getDateTime().toLocalTime().withSecond(0).withNano(0), anchor.getDateTime().getYear());
    }

    private void drawLine(Graphics2D g, List<ProjectedPoint> points, OverlayStyle style) {
        if (points.size() < 2) return;
        Path2D.Double path = new Path2D.Double();
        path.moveTo(points.get(0).pixelX(), points.get(0).pixelY());
        for (int i = 1; i < points.size(); i++) {
            path.lineTo(points.get(i).pixelX(), points.get(i).pixelY());
        }
        g.setColor(style.lineColor());
        g.setStroke(new BasicStroke(style.lineWidth(), BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
        g.draw(path);
    }

    private void drawDots(Graphics2D g, List<ProjectedPoint> points, OverlayStyle style) {
        double radius = style.dotSize() / 2.0;
        g.setStroke(new BasicStroke(1.0f));
        for (ProjectedPoint point : points) {
            Ellipse2D dot = new Ellipse2D.Double(point.pixelX() - radius, point.pixelY() - radius, style.dotSize(), style.dotSize());
            g.setColor(style.dotColor());
            g.fill(dot);
            g.setColor(Color.BLACK);
            g.draw(dot);
            if (style.showDates() && point.date() != null && (point.dayOfYear() - 1) % style.dateInterval() == 0) {
                drawText(g, point.date().format(DATE_LABEL), point.pixelX() + style.dotSize(), point.pixelY());
            }
        }
    }

    private void drawAnchor(Graphics2D g, AnchorPoint anchor, OverlayStyle style) {
        double size = style.dotSize() * 2.0;
        double x = anchor.getPixel().x();
        double y = anchor.getPixel().y();
        Ellipse2D highlight = new Ellipse2D.Double(x - size / 2, y - size / 2, size, size);
        g.setColor(ANCHOR_FILL);
        g.fill(highlight);
        g.setColor(Color.WHITE);
        g.setStroke(new BasicStroke(2.0f));
        g.draw(highlight);
        if (style.showAnchorLabel()) {
            drawText(g, "Anchor: " + anchor.getDateTime().format(ANCHOR_LABEL), x + size, y);
        }
    }

    private void drawText(Graphics2D g, String text, double x, double y) {
        g.setFont(TEXT_FONT);
        g.setColor(TEXT_COLOR);
        int lineHeight = g.getFontMetrics().getHeight();
        int line = 0;
        for (String part : text.split("\\R")) {
            g.drawString(part, (float) x, (float) (y + lineHeight * (line + 1)));
            line++;
        }
    }
}
