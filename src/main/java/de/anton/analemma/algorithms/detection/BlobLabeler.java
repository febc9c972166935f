package de.anton.analemma.algorithms.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * 4-connected component labeling of a binary mask by region growing.
 * Labels start at 1; 0 marks background. Every pixel enters the work queue at most once, so
 * one {@code int[]} of the mask size serves all regions.
 */
public class BlobLabeler {

    private static final Logger logger = LoggerFactory.getLogger(BlobLabeler.class);
    public static final int BACKGROUND = 0;

    private final int width;
    private final int height;
    private final boolean[] mask;
    private final int[] labels;
    private int[] queue;
    private int componentCount = 0;

    public BlobLabeler(boolean[] mask, int width, int height) {
        this.mask = Objects.requireNonNull(mask, "Mask cannot be null.");
        if (width <= 0 || height <= 0 || mask.length != width * height) {
            throw new IllegalArgumentException("Mask size does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.labels = new int[mask.length];
    }

    /** Labels all components and returns the pixel count per label (index 0 unused). */
    public int[] run() {
        componentCount = 0;
        Arrays.fill(labels, BACKGROUND);
        if (queue == null) queue = new int[mask.length];
        int[] sizes = new int[16];
        for (int i = 0; i < mask.length; i++) {
            if (!mask[i] || labels[i] != BACKGROUND) continue;
            componentCount++;
            if (componentCount >= sizes.length) sizes = Arrays.copyOf(sizes, sizes.length * 2);
            sizes[componentCount] = growRegion(i, componentCount);
        }
        logger.debug("Labeled {} components in {}x{} mask.", componentCount, width, height);
        return Arrays.copyOf(sizes, componentCount + 1);
    }

    private int growRegion(int seed, int label) {
        int head = 0;
        int tail = 0;
        labels[seed] = label;
        queue[tail++] = seed;
        while (head < tail) {
            int index = queue[head++];
            int x = index % width;
            int y = index / width;
            if (x > 0) tail = visit(index - 1, label, tail);
            if (x < width - 1) tail = visit(index + 1, label, tail);
            if (y > 0) tail = visit(index - width, label, tail);
            if (y < height - 1) tail = visit(index + width, label, tail);
        }
        return tail;
    }

    private int visit(int index, int label, int tail) {
        if (mask[index] && labels[index] == BACKGROUND) {
            labels[index] = label;
            queue[tail++] = index;
        }
        return tail;
    }

    public int getLabel(int x, int y) { return labels[y * width + x]; }
    int getLabelAt(int index) { return labels[index]; }
    public int getComponentCount() { return componentCount; }
}
