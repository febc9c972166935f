package de.anton.analemma.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ImageDataServiceTest {

    private final ImageDataService service = new ImageDataService();

    @Test
    void savesIntoNewDirectoryAndLoadsBack(@TempDir Path dir) throws IOException {
        BufferedImage image = new BufferedImage(12, 8, BufferedImage.TYPE_INT_RGB);
        image.setRGB(3, 4, 0xFF0000);
        Path file = dir.resolve("out/nested/overlay.png");

        service.saveImage(image, file);
        BufferedImage loaded = service.loadImage(file);

        assertEquals(12, loaded.getWidth());
        assertEquals(8, loaded.getHeight());
        assertEquals(0xFF0000, loaded.getRGB(3, 4) & 0xFFFFFF);
    }

    @Test
    void writesJpegFromImageWithAlpha(@TempDir Path dir) throws IOException {
        BufferedImage image = new BufferedImage(10, 10, BufferedImage.TYPE_INT_ARGB);
        Path file = dir.resolve("overlay.jpg");
        service.saveImage(image, file);
        assertTrue(Files.size(file) > 0);
    }

    @Test
    void loadFailsForMissingOrUnsupportedFiles(@TempDir Path dir) throws IOException {
        assertThrows(IOException.class, () -> service.loadImage(dir.resolve("missing.png")));
        Path text = dir.resolve("notes.png");
        Files.writeString(text, "not an image", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> service.loadImage(text));
    }

    @Test
    void formatFollowsExtension() {
        assertEquals("jpg", ImageDataService.formatFor(Path.of("a.JPEG")));
        assertEquals("bmp", ImageDataService.formatFor(Path.of("a.bmp")));
        assertEquals("png", ImageDataService.formatFor(Path.of("a.tiff")));
        assertEquals("png", ImageDataService.formatFor(Path.of("noextension")));
    }
}
