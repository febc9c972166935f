package de.anton.analemma.model;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Data Transfer Object holding everything read from a photograph's metadata file.
 * Numeric fields are null when the file does not provide them. Keys the reader does
 * not know are kept as raw strings in {@link #getExtras()}.
 */
public class ImageMetadata {

    private String imageFile = null;
    private Path imagePath = null;
    private LocalDateTime dateTime = null;
    private Double latitude = null;
    private Double longitude = null;
    private Double altitudeM = null;
    private Double focalLengthMm = null;
    private Double sensorWidthMm = null;
    private Double sensorHeightMm = null;
    private Double timezoneOffsetHours = null;
    private String cameraMake = null;
    private String cameraModel = null;
    private String locationName = null;
    private Map<String, String> extras = new LinkedHashMap<>();

    // --- Getters ---
    public String getImageFile() { return imageFile; }
    public Path getImagePath() { return imagePath; }
    public LocalDateTime getDateTime() { return dateTime; }
    public Double getLatitude() { return latitude; }
    public Double getLongitude() { return longitude; }
    public Double getAltitudeM() { return altitudeM; }
    public Double getFocalLengthMm() { return focalLengthMm; }
    public Double getSensorWidthMm() { return sensorWidthMm; }
    public Double getSensorHeightMm() { return sensorHeightMm; }
    public Double getTimezoneOffsetHours() { return timezoneOffsetHours; }
    public String getCameraMake() { return cameraMake; }
    public String getCameraModel() { return cameraModel; }
    public String getLocationName() { return locationName; }
    public Map<String, String> getExtras() { return Collections.unmodifiableMap(extras); }

    // --- Setters ---
    public void setImageFile(String imageFile) { this.imageFile = imageFile; }
    public void setImagePath(Path imagePath) { this.imagePath = imagePath; }
    public void setDateTime(LocalDateTime dateTime) { this.dateTime = dateTime; }
    public void setLatitude(Double latitude) { this.latitude = latitude; }
    public void setLongitude(Double longitude) { this.longitude = longitude; }
    public void setAltitudeM(Double altitudeM) { this.altitudeM = altitudeM; }
    public void setFocalLengthMm(Double focalLengthMm) { this.focalLengthMm = focalLengthMm; }
    public void setSensorWidthMm(Double sensorWidthMm) { this.sensorWidthMm = sensorWidthMm; }
    public void setSensorHeightMm(Double sensorHeightMm) { this.sensorHeightMm = sensorHeightMm; }
    public void setTimezoneOffsetHours(Double timezoneOffsetHours) { this.timezoneOffsetHours = timezoneOffsetHours; }
    public void setCameraMake(String cameraMake) { this.cameraMake = cameraMake; }
    public void setCameraModel(String cameraModel) { this.cameraModel = cameraModel; }
    public void setLocationName(String locationName) { this.locationName = locationName; }
    public void putExtra(String key, String value) { extras.put(Objects.requireNonNull(key), value); }

    /** Names of the fields an anchored overlay cannot do without. */
    public List<String> getMissingRequiredFields() {
        List<String> missing = new ArrayList<>();
        if (dateTime == null) missing.add("datetime");
        if (latitude == null) missing.add("latitude");
        if (longitude == null) missing.add("longitude");
        if (focalLengthMm == null) missing.add("focal_length_mm");
        return missing;
    }

    public boolean isComplete() { return getMissingRequiredFields().isEmpty(); }

    @Override
    public String toString() {
        return String.format("ImageMetadata[file=%s, datetime=%s, lat=%s, lon=%s, focal=%s mm, sensor=%sx%s mm, location=%s]",
                imageFile, dateTime, latitude, longitude, focalLengthMm, sensorWidthMm, sensorHeightMm, locationName);
    }
}
