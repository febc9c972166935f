package de.anton.analemma.algorithms.detection;

import de.anton.analemma.model.PixelCoordinate;
import de.anton.analemma.model.SunBlob;

import java.awt.Rectangle;

/**
 * Collects pixels of a region and yields its brightness-weighted centroid. Falls back to the
 * plain mean position when every weight is zero.
 */
final class CentroidAccumulator {

    private double weightSum, weightedX, weightedY;
    private long sumX, sumY;
    private int count;
    private int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE, maxX = -1, maxY = -1;

    void add(int x, int y, double weight) {
        weightSum += weight;
        weightedX += weight * x;
        weightedY += weight * y;
        sumX += x; sumY += y;
        count++;
        minX = Math.min(minX, x); minY = Math.min(minY, y);
        maxX = Math.max(maxX, x); maxY = Math.max(maxY, y);
    }

    int getCount() { return count; }

    SunBlob toBlob(String strategy) {
        if (count == 0) throw new IllegalStateException("No pixels accumulated.");
        PixelCoordinate centroid = weightSum > 0
                ? new PixelCoordinate(weightedX / weightSum, weightedY / weightSum)
                : new PixelCoordinate((double) sumX / count, (double) sumY / count);
        Rectangle bounds = new Rectangle(minX, minY, maxX - minX + 1, maxY - minY + 1);
        return new SunBlob(centroid, count, bounds, strategy);
    }
}
