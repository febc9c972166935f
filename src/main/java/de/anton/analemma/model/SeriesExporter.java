package de.anton.analemma.model;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Writes a yearly analemma series to an Excel file (.xlsx), one row per day.
 * When a projection is given, the pixel position of each visible day is added.
 */
public class SeriesExporter {

    private static final Logger logger = LoggerFactory.getLogger(SeriesExporter.class);

    public static final String SHEET_SERIES = "Analemma";
    public static final String SHEET_SUMMARY = "Summary";
    static final List<String> COLUMN_NAMES = List.of("Day", "Date", "Declination (°)", "Equation of Time (min)",
            "Hour Angle (°)", "Altitude (°)", "Azimuth (°)", "Pixel X", "Pixel Y");
    private static final int COLUMN_WIDTH = 18 * 256;

    public void exportSeries(List<HorizonPosition> series, ObserverLocation observer, Path file) throws IOException {
        exportSeries(series, observer, null, file);
    }

    /**
     * @param series     Horizon positions ordered by day.
     * @param observer   Observer the series was computed for (written to the summary sheet).
     * @param projection Optional projection into an image; may be null.
     * @param file       Target .xlsx file.
     * @throws IOException If the workbook cannot be written.
     */
    public void exportSeries(List<HorizonPosition> series, ObserverLocation observer, ProjectionResult projection,
                             Path file) throws IOException {
        Objects.requireNonNull(series, "Series cannot be null.");
        Objects.requireNonNull(observer, "Observer cannot be null.");
        if (file == null) throw new IllegalArgumentException("Output file path cannot be null.");
        if (series.isEmpty()) logger.warn("Exporting an empty series to {}", file);

        Map<Integer, ProjectedPoint> pixelsByDay = new HashMap<>();
        if (projection != null) {
            for (ProjectedPoint point : projection.getVisiblePoints()) pixelsByDay.put(point.dayOfYear(), point);
        }

        logger.info("Starting Excel export of {} days to: {}", series.size(), file);
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            CellStyle headerStyle = headerStyle(workbook);
            Sheet sheet = workbook.createSheet(SHEET_SERIES);
            Row header = sheet.createRow(0);
            for (int i = 0; i < COLUMN_NAMES.size(); i++) {
                Cell cell = header.createCell(i);
                cell.setCellValue(COLUMN_NAMES.get(i));
                cell.setCellStyle(headerStyle);
                sheet.setColumnWidth(i, COLUMN_WIDTH);
            }

            int rowNum = 1;
            for (HorizonPosition position : series) {
                if (position == null) continue;
                Row row = sheet.createRow(rowNum++);
                int day = position.getDayOfYear();
                SolarPosition source = position.getSolarPosition();
                int c = 0;
                row.createCell(c++).setCellValue(day);
                row.createCell(c++).setCellValue(source != null ? source.getDateTime().toLocalDate().toString() : "");
                createNumericCell(row, c++, position.getDeclination());
                createNumericCell(row, c++, position.getEquationOfTime());
                createNumericCell(row, c++, position.getHourAngle());
                createNumericCell(row, c++, position.getAltitude());
                createNumericCell(row, c++, position.getAzimuth());
                ProjectedPoint point = pixelsByDay.get(day);
                createNumericCell(row, c++, point != null ? point.pixelX() : Double.NaN);
                createNumericCell(row, c, point != null ? point.pixelY() : Double.NaN);
            }

            writeSummary(workbook, headerStyle, series, observer, projection);
            workbook.write(out);
            logger.info("Excel export completed successfully to: {}", file);
        } catch (IOException e) {
            logger.error("IOException during Excel export to {}", file, e);
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected error during Excel export to {}", file, e);
            throw new IOException("Unexpected error during Excel export: " + e.getMessage(), e);
        }
    }

    private void writeSummary(Workbook workbook, CellStyle headerStyle, List<HorizonPosition> series,
                              ObserverLocation observer, ProjectionResult projection) {
        Sheet sheet = workbook.createSheet(SHEET_SUMMARY);
        sheet.setColumnWidth(0, 26 * 256);
        sheet.setColumnWidth(1, COLUMN_WIDTH);
        SkyStatistics stats = SkyStatistics.ofHorizon(series);
        int r = 0;
        Row header = sheet.createRow(r++);
        header.createCell(0).setCellValue("Property");
        header.createCell(1).setCellValue("Value");
        header.getCell(0).setCellStyle(headerStyle);
        header.getCell(1).setCellStyle(headerStyle);
        r = summaryRow(sheet, r, "Latitude (°)", observer.getLatitude());
        r = summaryRow(sheet, r, "Longitude (°)", observer.getLongitude());
        r = summaryRow(sheet, r, "Timezone offset (h)", observer.getTimezoneOffsetHours());
        r = summaryRow(sheet, r, "Days", stats.count());
        r = summaryRow(sheet, r, "Min altitude (°)", stats.minAltitude());
        r = summaryRow(sheet, r, "Max altitude (°)", stats.maxAltitude());
        r = summaryRow(sheet, r, "Altitude span (°)", stats.altitudeSpan());
        r = summaryRow(sheet, r, "Azimuth span (°)", stats.azimuthSpan());
        if (projection != null) {
            r = summaryRow(sheet, r, "Visible days", projection.getVisiblePoints().size());
            summaryRow(sheet, r, "Filtered below horizon", projection.getFilteredBelowHorizon());
        }
    }

    private int summaryRow(Sheet sheet, int rowNum, String label, double value) {
        Row row = sheet.createRow(rowNum);
        row.createCell(0).setCellValue(label);
        createNumericCell(row, 1, value);
        return rowNum + 1;
    }

    private static CellStyle headerStyle(Workbook workbook) {
        Font headerFont = workbook.createFont();
        headerFont.setBold(true);
        CellStyle style = workbook.createCellStyle();
        style.setFont(headerFont);
        return style;
    }

    private void createNumericCell(Row row, int colIndex, double value) {
        if (Double.isFinite(value)) {
            row.createCell(colIndex).setCellValue(value);
        } else {
            row.createCell(colIndex, CellType.BLANK);
        }
    }
}
