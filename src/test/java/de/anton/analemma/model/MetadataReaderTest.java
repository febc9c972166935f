package de.anton.analemma.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MetadataReaderTest {

    private static final String METADATA = String.join("\n",
            "# Analemma input",
            "IMAGE_FILE=sky.png",
            "DATETIME=2026-06-21 12:00:00",
            "LATITUDE=40.1",
            "Longitude = -88.2",
            "ALTITUDE_M=222",
            "FOCAL_LENGTH_MM=24",
            "SENSOR_WIDTH_MM=23.5",
            "SENSOR_HEIGHT_MM=15.6",
            "TIMEZONE_OFFSET=-5",
            "CAMERA_MAKE=Canon",
            "LOCATION_NAME=Urbana, IL",
            "WEATHER=clear",
            "",
            "# --- REFERENCE DATA (not parsed) ---",
            "LATITUDE=not a number");

    private final MetadataReader reader = new MetadataReader();

    @Test
    void readsKnownKeysAndStopsAtSeparator(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("metadata.txt");
        Files.writeString(file, METADATA, StandardCharsets.UTF_8);

        ImageMetadata metadata = reader.readMetadata(file);
        assertEquals("sky.png", metadata.getImageFile());
        assertEquals(LocalDateTime.of(2026, 6, 21, 12, 0), metadata.getDateTime());
        assertEquals(40.1, metadata.getLatitude());
        assertEquals(-88.2, metadata.getLongitude());
        assertEquals(222.0, metadata.getAltitudeM());
        assertEquals(24.0, metadata.getFocalLengthMm());
        assertEquals(23.5, metadata.getSensorWidthMm());
        assertEquals(15.6, metadata.getSensorHeightMm());
        assertEquals(-5.0, metadata.getTimezoneOffsetHours());
        assertEquals("Canon", metadata.getCameraMake());
        assertEquals("Urbana, IL", metadata.getLocationName());
        assertEquals("clear", metadata.getExtras().get("weather"));
        assertTrue(metadata.isComplete());
    }

    @Test
    void reportsMissingRequiredFields(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("metadata.txt");
        Files.writeString(file, "LATITUDE=10\n", StandardCharsets.UTF_8);
        ImageMetadata metadata = reader.readMetadata(file);
        assertFalse(metadata.isComplete());
        assertEquals(List.of("datetime", "longitude", "focal_length_mm"), metadata.getMissingRequiredFields());
    }

    @Test
    void invalidNumberIsReportedWithLine(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("metadata.txt");
        Files.writeString(file, "DATETIME=2026-01-01 08:00:00\nLATITUDE=north\n", StandardCharsets.UTF_8);
        IOException e = assertThrows(IOException.class, () -> reader.readMetadata(file));
        assertTrue(e.getMessage().contains("line 2"), e.getMessage());
    }

    @Test
    void loadInputImageDetectsImageWhenNotNamed(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("metadata.txt"), "DATETIME=2026-06-21 12:00:00\n", StandardCharsets.UTF_8);
        ImageIO.write(new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB), "png", dir.resolve("b_photo.PNG").toFile());
        ImageIO.write(new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB), "png", dir.resolve("a_photo.png").toFile());
        Files.writeString(dir.resolve("notes.txt"), "ignore me", StandardCharsets.UTF_8);

        ImageMetadata metadata = reader.loadInputImage(dir);
        assertEquals("a_photo.png", metadata.getImageFile());
        assertEquals(dir.resolve("a_photo.png"), metadata.getImagePath());
    }

    @Test
    void loadInputImageFailsWithoutMetadataOrImage(@TempDir Path dir) throws IOException {
        assertThrows(FileNotFoundException.class, () -> reader.loadInputImage(dir));
        Files.writeString(dir.resolve("metadata.txt"), "LATITUDE=1\n", StandardCharsets.UTF_8);
        assertThrows(FileNotFoundException.class, () -> reader.loadInputImage(dir));
        Files.writeString(dir.resolve("metadata.txt"), "IMAGE_FILE=missing.jpg\n", StandardCharsets.UTF_8);
        assertThrows(FileNotFoundException.class, () -> reader.loadInputImage(dir));
    }
}
