package de.anton.analemma.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Service responsible for reading and writing photographs.
 */
public class ImageDataService {

    private static final Logger logger = LoggerFactory.getLogger(ImageDataService.class);
    private static final String DEFAULT_FORMAT = "png";

    /**
     * Loads an image file.
     *
     * @param file The image to load.
     * @return The decoded image.
     * @throws IOException If the file is missing, unreadable or in an unsupported format.
     */
    public BufferedImage loadImage(Path file) throws IOException {
        Objects.requireNonNull(file, "Image file cannot be null.");
        logger.info("Image Service: Loading image {}", file.toAbsolutePath());
        try {
            BufferedImage image = ImageIO.read(file.toFile());
            if (image == null) {
                throw new IOException("Unsupported image format: " + file.getFileName());
            }
            logger.info("Image Service: Loaded {}x{} image from {}", image.getWidth(), image.getHeight(), file.getFileName());
            return image;
        } catch (IOException | RuntimeException e) {
            logger.error("Image Service: Failed to load image {}", file.toAbsolutePath(), e);
            throw new IOException("Error reading image " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes an image; the format follows the file extension (PNG when unknown).
     *
     * @throws IOException If no writer exists for the format or writing fails.
     */
    public void saveImage(BufferedImage image, Path file) throws IOException {
        Objects.requireNonNull(image, "Image cannot be null.");
        Objects.requireNonNull(file, "Output file cannot be null.");
        String format = formatFor(file);
        BufferedImage output = image;
        if (("jpg".equals(format) || "bmp".equals(format)) && image.getColorModel().hasAlpha()) {
            output = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
            Graphics2D g = output.createGraphics();
            try {
                g.drawImage(image, 0, 0, null);
            } finally {
                g.dispose();
            }
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!ImageIO.write(output, format, file.toFile())) {
            throw new IOException("No image writer available for format '" + format + "'");
        }
        logger.info("Image Service: Image written to {}", file);
    }

    static String formatFor(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        if (dot < 0) return DEFAULT_FORMAT;
        String extension = name.substring(dot + 1);
        switch (extension) {
            case "jpeg":
            case "jpg": return "jpg";
            case "bmp": return "bmp";
            case "gif": return "gif";
            default: return DEFAULT_FORMAT;
        }
    }
}
