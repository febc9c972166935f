package de.anton.analemma.algorithms.detection;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class BlobLabelerTest {

    private static boolean[] mask(String... rows) {
        int width = rows[0].length();
        boolean[] mask = new boolean[width * rows.length];
        for (int y = 0; y < rows.length; y++) {
            for (int x = 0; x < width; x++) {
                mask[y * width + x] = rows[y].charAt(x) == '#';
            }
        }
        return mask;
    }

    @Test
    void diagonalNeighboursAreSeparateComponents() {
        boolean[] mask = mask(
                "#...",
                ".#..",
                "..##");
        BlobLabeler labeler = new BlobLabeler(mask, 4, 3);
        int[] sizes = labeler.run();
        assertEquals(3, labeler.getComponentCount());
        assertEquals(1, sizes[1]);
        assertEquals(1, sizes[2]);
        assertEquals(2, sizes[3]);
        assertEquals(labeler.getLabel(2, 2), labeler.getLabel(3, 2));
        assertEquals(BlobLabeler.BACKGROUND, labeler.getLabel(1, 0));
    }

    @Test
    void concaveShapeIsOneComponent() {
        boolean[] mask = mask(
                "#.#",
                "#.#",
                "###");
        BlobLabeler labeler = new BlobLabeler(mask, 3, 3);
        int[] sizes = labeler.run();
        assertEquals(1, labeler.getComponentCount());
        assertEquals(7, sizes[1]);
    }

    @Test
    void emptyMaskHasNoComponents() {
        BlobLabeler labeler = new BlobLabeler(new boolean[6], 3, 2);
        assertEquals(1, labeler.run().length);
        assertEquals(0, labeler.getComponentCount());
    }

    @Test
    void rejectsMismatchedSize() {
        assertThrows(IllegalArgumentException.class, () -> new BlobLabeler(new boolean[5], 3, 2));
    }

    @Test
    void saturatedFullFrameIsOneComponent() {
        int width = 4000, height = 3000;
        boolean[] mask = new boolean[width * height];
        Arrays.fill(mask, true);
        BlobLabeler labeler = new BlobLabeler(mask, width, height);

        int[] sizes = labeler.run();

        assertEquals(1, labeler.getComponentCount());
        assertEquals(width * height, sizes[1]);
        assertEquals(1, labeler.getLabel(width - 1, height - 1));
    }

    @Test
    void repeatedRunsGiveSameLabels() {
        boolean[] mask = mask(
                "##..#",
                "....#",
                "###..");
        BlobLabeler labeler = new BlobLabeler(mask, 5, 3);
        int[] first = labeler.run();
        int[] second = labeler.run();
        assertArrayEquals(new int[]{0, 2, 2, 3}, first);
        assertArrayEquals(first, second);
        assertEquals(3, labeler.getLabel(2, 2));
    }
}
