package de.anton.analemma.algorithms.detection;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

public class BrightnessGridTest {

    @Test
    void colourPixelsUseMaximumChannel() {
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, (10 << 16) | (200 << 8) | 30);
        image.setRGB(1, 0, (90 << 16) | (20 << 8) | 40);
        BrightnessGrid grid = BrightnessGrid.fromImage(image);
        assertEquals(200.0, grid.get(0, 0));
        assertEquals(90.0, grid.get(1, 0));
        assertEquals(200.0, grid.getMaxValue());
    }

    @Test
    void alphaIsIgnored() {
        BufferedImage image = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, (255 << 24) | (50 << 16) | (60 << 8) | 70);
        assertEquals(70.0, BrightnessGrid.fromImage(image).get(0, 0));
    }

    @Test
    void thresholdKeepsPixelsNearMaximum() {
        BrightnessGrid grid = new BrightnessGrid(4, 1, new double[]{1000.0, 999.0, 998.9, 10.0});
        assertEquals(999.0, grid.getThreshold(), 1e-9);
        assertArrayEquals(new boolean[]{true, true, false, false}, grid.thresholdMask());
    }

    @Test
    void rejectsWrongValueCount() {
        assertThrows(IllegalArgumentException.class, () -> new BrightnessGrid(2, 2, new double[3]));
    }

    @Test
    void sixteenBitSamplesKeepFullRange() {
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_USHORT_GRAY);
        image.getRaster().setSample(0, 0, 0, 65535);
        image.getRaster().setSample(1, 0, 0, 65534);
        BrightnessGrid grid = BrightnessGrid.fromImage(image);
        assertEquals(65535.0, grid.getMaxValue());
        assertEquals(65534.0, grid.get(1, 0));
        assertArrayEquals(new boolean[]{true, true}, grid.thresholdMask());
    }
}
