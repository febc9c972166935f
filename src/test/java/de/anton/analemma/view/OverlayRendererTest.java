package de.anton.analemma.view;

import de.anton.analemma.model.*;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OverlayRendererTest {

    private static final int BACKGROUND = 0x102030;

    @Test
    void drawsPointsInsideFrameOnCopy() {
        BufferedImage photo = new BufferedImage(200, 100, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 100; y++) {
            for (int x = 0; x < 200; x++) photo.setRGB(x, y, BACKGROUND);
        }
        AnchorPoint anchor = new AnchorPoint(LocalDateTime.of(2026, 6, 21, 12, 0),
                new HorizonPosition(70.0, 180.0, 0, 23.4, -1.5, null), new PixelCoordinate(100, 50));
        List<ProjectedPoint> visible = List.of(
                point(1, 30, 80),
                point(172, 100, 50),
                point(355, 250, 90));
        ProjectionResult projection = new ProjectionResult(anchor, new CameraCalibration(200, 100, 20, 10),
                visible, 1, 0, 4);

        OverlayRenderer.OverlayResult result = new OverlayRenderer().render(photo, projection, OverlayStyle.defaults().withoutText());

        assertEquals(2, result.pointsDrawn);
        assertEquals(2, result.pointsFiltered);
        assertEquals(200, result.image.getWidth());
        assertEquals(0xFF0000, result.image.getRGB(100, 50) & 0xFFFFFF);
        assertNotEquals(BACKGROUND, result.image.getRGB(30, 80) & 0xFFFFFF);
        assertEquals(BACKGROUND, result.image.getRGB(190, 5) & 0xFFFFFF);
        assertEquals(BACKGROUND, photo.getRGB(100, 50) & 0xFFFFFF);
    }

    @Test
    void withoutTextClearsLabelsAndCaption() {
        OverlayStyle style = OverlayStyle.defaults().withCaption("caption").withoutText();
        assertFalse(style.showDates());
        assertFalse(style.showAnchorLabel());
        assertNull(style.caption());
        assertThrows(IllegalArgumentException.class, () -> OverlayStyle.defaults().withDates(true, 0));
    }

    @Test
    void defaultCaptionNamesLocationAndTime() {
        AnchorPoint anchor = new AnchorPoint(LocalDateTime.of(2026, 6, 21, 9, 30, 15),
                new HorizonPosition(40.0, 100.0, -40, 23.4, -1.5, null), new PixelCoordinate(1, 1));
        String caption = OverlayRenderer.defaultCaption(new ObserverLocation(40.1, -88.2, -6), anchor);
        assertTrue(caption.contains("40.10°, -88.20°"), caption);
        assertTrue(caption.contains("09:30 throughout 2026"), caption);
    }

    private static ProjectedPoint point(int day, double x, double y) {
        return new ProjectedPoint(day, LocalDate.ofYearDay(2026, day), new PixelCoordinate(x, y), 30.0, 180.0);
    }
}
