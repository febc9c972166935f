package de.anton.analemma.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Reads the plain-text metadata file that accompanies a sky photograph.
 * <p>
 * Format: one {@code KEY=VALUE} pair per line, keys case-insensitive, lines starting
 * with '#' and blank lines ignored. Reading stops at the first separator line
 * ({@code # --- REFERENCE DATA ...} or {@code # --- ADDITIONAL METADATA ...});
 * everything after it is free-form reference material.
 */
public class MetadataReader {

    private static final Logger logger = LoggerFactory.getLogger(MetadataReader.class);

    public static final String METADATA_FILE_NAME = "metadata.txt";
    private static final List<String> STOP_MARKERS = List.of("--- REFERENCE DATA", "--- ADDITIONAL METADATA");
    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final List<String> IMAGE_EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".gif", ".bmp", ".tiff", ".tif");

    /**
     * Parses a metadata file.
     *
     * @param metadataFile Path of the metadata file.
     * @return The parsed metadata; fields absent from the file stay null.
     * @throws IOException If the file cannot be read or a typed value cannot be parsed.
     */
    public ImageMetadata readMetadata(Path metadataFile) throws IOException {
        Objects.requireNonNull(metadataFile, "Metadata file cannot be null.");
        logger.debug("Reading metadata file: {}", metadataFile.toAbsolutePath());

        ImageMetadata metadata = new ImageMetadata();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(metadataFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                line = line.strip();
                if (isStopMarker(line)) {
                    logger.debug("Separator reached at line {}, remaining lines are not parsed.", lineNumber);
                    break;
                }
                if (line.isEmpty() || line.startsWith("#")) continue;

                int separator = line.indexOf('=');
                if (separator < 0) {
                    logger.warn("Ignoring line {} without '=' in {}: {}", lineNumber, metadataFile.getFileName(), line);
                    continue;
                }
                String key = line.substring(0, separator).strip().toLowerCase(Locale.ROOT);
                String value = line.substring(separator + 1).strip();
                applyValue(metadata, key, value, lineNumber);
            }
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IOException("Invalid value at line " + lineNumber + " of " + metadataFile + ": " + e.getMessage(), e);
        }

        logger.info("Metadata read from {}: {}", metadataFile.getFileName(), metadata);
        return metadata;
    }

    /**
     * Loads the metadata of an input directory and resolves its image file. When the
     * metadata names no image, the first image file in the directory (by name) is used.
     *
     * @param directory Directory containing {@code metadata.txt} and the photograph.
     * @return Metadata with {@link ImageMetadata#getImagePath()} set.
     * @throws FileNotFoundException If the metadata file or an image file is missing.
     * @throws IOException           If reading fails.
     */
    public ImageMetadata loadInputImage(Path directory) throws IOException {
        Objects.requireNonNull(directory, "Input directory cannot be null.");
        Path metadataFile = directory.resolve(METADATA_FILE_NAME);
        if (!Files.isRegularFile(metadataFile)) {
            throw new FileNotFoundException("Metadata file not found: " + metadataFile);
        }
        ImageMetadata metadata = readMetadata(metadataFile);

        String imageFile = metadata.getImageFile();
        if (imageFile == null || imageFile.isBlank()) {
            List<Path> candidates = findImageFiles(directory);
            if (candidates.isEmpty()) {
                throw new FileNotFoundException("No image file found in " + directory);
            }
            if (candidates.size() > 1) {
                logger.warn("Multiple image files found in {}, using {}", directory, candidates.get(0).getFileName());
            }
            imageFile = candidates.get(0).getFileName().toString();
            metadata.setImageFile(imageFile);
        }

        Path imagePath = directory.resolve(imageFile);
        if (!Files.isRegularFile(imagePath)) {
            throw new FileNotFoundException("Image file named in metadata does not exist: " + imagePath);
        }
        metadata.setImagePath(imagePath);
        return metadata;
    }

    private static boolean isStopMarker(String line) {
        for (String marker : STOP_MARKERS) {
            if (line.contains(marker)) return true;
        }
        return false;
    }

    private static void applyValue(ImageMetadata metadata, String key, String value, int lineNumber) {
        switch (key) {
            case "image_file": metadata.setImageFile(value); break;
            case "datetime": metadata.setDateTime(LocalDateTime.parse(value, DATE_TIME_FORMAT)); break;
            case "latitude": metadata.setLatitude(Double.parseDouble(value)); break;
            case "longitude": metadata.setLongitude(Double.parseDouble(value)); break;
            case "altitude_m": metadata.setAltitudeM(Double.parseDouble(value)); break;
            case "focal_length_mm": metadata.setFocalLengthMm(Double.parseDouble(value)); break;
            case "sensor_width_mm": metadata.setSensorWidthMm(Double.parseDouble(value)); break;
            case "sensor_height_mm": metadata.setSensorHeightMm(Double.parseDouble(value)); break;
            case "timezone_offset": metadata.setTimezoneOffsetHours(Double.parseDouble(value)); break;
            case "camera_make": metadata.setCameraMake(value); break;
            case "camera_model": metadata.setCameraModel(value); break;
            case "location_name": metadata.setLocationName(value); break;
            default:
                logger.debug("Unknown metadata key '{}' at line {} kept as extra.", key, lineNumber);
                metadata.putExtra(key, value);
        }
    }

    private static List<Path> findImageFiles(Path directory) throws IOException {
        List<Path> images = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                String name = entry.getFileName().toString().toLowerCase(Locale.ROOT);
                if (Files.isRegularFile(entry) && IMAGE_EXTENSIONS.stream().anyMatch(name::endsWith)) {
                    images.add(entry);
                }
            }
        }
        images.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return images;
    }
}
