package de.anton.analemma.model;

/**
 * An image position in pixels; x grows to the right, y grows downwards.
 */
public record PixelCoordinate(double x, double y) {

    public PixelCoordinate {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("Pixel coordinates must be finite. Got: (" + x + ", " + y + ")");
        }
    }

    public int roundedX() { return (int) Math.round(x); }
    public int roundedY() { return (int) Math.round(y); }

    public boolean isWithin(int width, int height) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public double distanceTo(PixelCoordinate other) {
        double dx = x - other.x; double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /** Parses "x,y" as given on the command line. */
    public static PixelCoordinate parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Pixel coordinate text cannot be null.");
        }
        String[] parts = text.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Pixel coordinate must be given as 'x,y'. Got: " + text);
        }
        try {
            return new PixelCoordinate(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Pixel coordinate must be numeric. Got: " + text, e);
        }
    }
}
