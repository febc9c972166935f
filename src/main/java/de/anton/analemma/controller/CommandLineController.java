package de.anton.analemma.controller;

import de.anton.analemma.algorithms.CameraCalibrator;
import de.anton.analemma.algorithms.SolarPositionSeries;
import de.anton.analemma.model.*;
import de.anton.analemma.service.AnalemmaService;
import de.anton.analemma.service.AnalemmaService.AnchorResult;
import de.anton.analemma.service.AnalemmaService.CalculationResult;
import de.anton.analemma.service.AnalemmaService.ModeComparison;
import de.anton.analemma.service.AnchorConfiguration;
import de.anton.analemma.service.CalculationConfiguration;
import de.anton.analemma.service.ImageDataService;
import de.anton.analemma.view.AnalemmaChartFactory;
import de.anton.analemma.view.ChartDialog;
import de.anton.analemma.view.OverlayRenderer;
import de.anton.analemma.view.OverlayRenderer.OverlayResult;
import de.anton.analemma.view.OverlayStyle;
import org.jfree.chart.JFreeChart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Translates command-line arguments into service calls and reports results.
 * This is the only place where exceptions become exit codes.
 */
public class CommandLineController {

    private static final Logger logger = LoggerFactory.getLogger(CommandLineController.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;

    private static final Set<String> FLAGS = Set.of("plot", "show", "no-dates", "no-text", "help");
    private static final List<DateTimeFormatter> ANCHOR_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"), DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));
    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: analemma <command> [options]",
            "",
            "Commands:",
            "  calculate --lat DEG --lon DEG [--hour H] [--minute M] [--year Y] [--days N]",
            "            [--mode approximate|high-precision] [--tz H] [--plot] [--show] [--export FILE.xlsx] [--output DIR]",
            "  compare   --lat DEG --lon DEG [--year Y] [--hour H] [--minute M] [--tz H] [--plot] [--show] [--output DIR]",
            "  anchor    --image FILE --datetime \"YYYY-MM-DD HH:MM\" --lat DEG --lon DEG [--tz H]",
            "            (--focal-length MM [--sensor-width MM] [--sensor-height MM] | --fov H,V)",
            "            [--sun-pixel X,Y] [--no-dates] [--no-text] [--label-interval N] [--plot] [--export FILE.xlsx] [--output FILE]",
            "  process   --input DIR [--output FILE] [--no-dates] [--no-text] [--export FILE.xlsx]");

    private final AnalemmaService analemmaService;
    private final ImageDataService imageDataService;
    private final MetadataReader metadataReader;
    private final SeriesExporter seriesExporter;
    private final OverlayRenderer overlayRenderer;
    private final PrintStream out;
    private final PrintStream err;

    public CommandLineController(PrintStream out, PrintStream err) {
        this(new AnalemmaService(), new ImageDataService(), new MetadataReader(), new SeriesExporter(),
                new OverlayRenderer(), out, err);
    }

    public CommandLineController(AnalemmaService analemmaService, ImageDataService imageDataService,
                                 MetadataReader metadataReader, SeriesExporter seriesExporter,
                                 OverlayRenderer overlayRenderer, PrintStream out, PrintStream err) {
        this.analemmaService = Objects.requireNonNull(analemmaService);
        this.imageDataService = Objects.requireNonNull(imageDataService);
        this.metadataReader = Objects.requireNonNull(metadataReader);
        this.seriesExporter = Objects.requireNonNull(seriesExporter);
        this.overlayRenderer = Objects.requireNonNull(overlayRenderer);
        this.out = Objects.requireNonNull(out);
        this.err = Objects.requireNonNull(err);
    }

    /**
     * Runs one command.
     *
     * @return {@link #EXIT_OK} on success, {@link #EXIT_ERROR} on usage or processing errors.
     */
    public int run(String[] args) {
        if (args == null || args.length == 0) {
            err.println(USAGE);
            return EXIT_ERROR;
        }
        String command = args[0].toLowerCase(Locale.ROOT);
        try {
            Map<String, String> options = parseOptions(Arrays.copyOfRange(args, 1, args.length));
            if (options.containsKey("help")) {
                out.println(USAGE);
                return EXIT_OK;
            }
            switch (command) {
                case "calculate": return calculate(options);
                case "compare": return compare(options);
                case "anchor": return anchor(options);
                case "process": return process(options);
                case "help":
                case "--help":
                    out.println(USAGE);
                    return EXIT_OK;
                default:
                    err.println("Unknown command: " + args[0]);
                    err.println(USAGE);
                    return EXIT_ERROR;
            }
        } catch (IllegalArgumentException | ConfigurationException e) {
            logger.debug("Invalid input for '{}'", command, e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("Command '{}' failed", command, e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            logger.error("Unexpected error in command '{}'", command, e);
            err.println("Unexpected error: " + e);
            return EXIT_ERROR;
        }
    }

    private int calculate(Map<String, String> options) throws IOException {
        ObserverLocation observer = observer(options);
        CalculationMode mode = CalculationMode.APPROXIMATE;
        if (options.containsKey("mode")) {
            mode = CalculationMode.fromDisplayName(options.get("mode"));
            if (mode == null) throw new IllegalArgumentException("Unknown mode: " + options.get("mode"));
        }
        CalculationConfiguration config = new CalculationConfiguration(observer, year(options),
                intOption(options, "hour", CalculationConfiguration.DEFAULT_HOUR), intOption(options, "minute", 0),
                intOption(options, "days", SolarPositionSeries.DEFAULT_DAYS), mode);
        CalculationResult result = analemmaService.calculate(config);

        out.printf(Locale.ROOT, "Analemma for %s at %02d:%02d in %d (%s)%n",
                observer, config.hour(), config.minute(), config.year(), config.mode());
        printStatistics(result.statistics);
        out.printf(Locale.ROOT, "  Equation of time span: %.2f min%n", result.equationOfTimeSpan());

        if (options.containsKey("export")) {
            seriesExporter.exportSeries(result.horizonPositions, observer, Paths.get(options.get("export")));
            out.println("Series exported to " + options.get("export"));
        }
        if (options.containsKey("plot") || options.containsKey("show")) {
            String suffix = String.format(Locale.ROOT, "%d_%02d%02d", config.year(), config.hour(), config.minute());
            Map<String, JFreeChart> charts = new LinkedHashMap<>();
            charts.put("sky_chart_" + suffix, AnalemmaChartFactory.createSkyChart(result.horizonPositions,
                    "Analemma " + config.year(), AnchorConfiguration.DEFAULT_LABEL_INTERVAL));
            charts.put("sky_dome_" + suffix, AnalemmaChartFactory.createSkyDomeChart(result.horizonPositions,
                    "Analemma on the sky dome " + config.year()));
            charts.put("figure8_" + suffix, AnalemmaChartFactory.createFigureEightChart(result.solarPositions,
                    "Declination vs. equation of time"));
            charts.put("time_series_" + suffix, AnalemmaChartFactory.createTimeSeriesChart(result.solarPositions,
                    "Declination and equation of time"));
            publishCharts(charts, options);
        }
        return EXIT_OK;
    }

    private int compare(Map<String, String> options) throws IOException {
        ObserverLocation observer = observer(options);
        CalculationConfiguration config = new CalculationConfiguration(observer, year(options),
                intOption(options, "hour", CalculationConfiguration.DEFAULT_HOUR), intOption(options, "minute", 0),
                SolarPositionSeries.DEFAULT_DAYS, CalculationMode.APPROXIMATE);
        ModeComparison comparison = analemmaService.compareModes(config);

        out.printf(Locale.ROOT, "Mode comparison for %s in %d%n", observer, config.year());
        out.printf(Locale.ROOT, "  Declination difference: mean %.4f°, max %.4f°%n",
                comparison.meanDeclinationDifference, comparison.maxDeclinationDifference);
        out.printf(Locale.ROOT, "  Equation of time difference: mean %.4f min, max %.4f min%n",
                comparison.meanEquationOfTimeDifference, comparison.maxEquationOfTimeDifference);

        if (options.containsKey("plot") || options.containsKey("show")) {
            publishCharts(Map.of("mode_comparison_" + config.year(), AnalemmaChartFactory.createComparisonChart(
                    comparison.approximate.solarPositions, comparison.highPrecision.solarPositions)), options);
        }
        return EXIT_OK;
    }

    private int anchor(Map<String, String> options) throws IOException {
        Path image = Paths.get(required(options, "image"));
        LocalDateTime anchorTime = parseAnchorTime(required(options, "datetime"));
        ObserverLocation observer = observer(options);
        PixelCoordinate sunPixel = options.containsKey("sun-pixel") ? PixelCoordinate.parse(options.get("sun-pixel")) : null;
        Path output = options.containsKey("output") ? Paths.get(options.get("output")) : defaultOverlayPath(image);

        Double focal = options.containsKey("focal-length") ? doubleOption(options, "focal-length") : null;
        Double hFov = null, vFov = null;
        if (options.containsKey("fov")) {
            String[] parts = options.get("fov").split(",");
            if (parts.length != 2) throw new IllegalArgumentException("--fov must be given as H,V. Got: " + options.get("fov"));
            hFov = parseDouble(parts[0], "fov");
            vFov = parseDouble(parts[1], "fov");
        }
        AnchorConfiguration config = new AnchorConfiguration(image, anchorTime, observer, sunPixel, focal,
                doubleOption(options, "sensor-width", CameraCalibrator.DEFAULT_SENSOR_WIDTH_MM),
                doubleOption(options, "sensor-height", CameraCalibrator.DEFAULT_SENSOR_HEIGHT_MM),
                hFov, vFov, !options.containsKey("no-dates"),
                intOption(options, "label-interval", AnchorConfiguration.DEFAULT_LABEL_INTERVAL), output);
        return runAnchor(config, options);
    }

    private int process(Map<String, String> options) throws IOException {
        Path input = Paths.get(required(options, "input"));
        ImageMetadata metadata = metadataReader.loadInputImage(input);
        List<String> missing = metadata.getMissingRequiredFields();
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Metadata in " + input + " is missing: " + String.join(", ", missing));
        }
        ObserverLocation observer = ObserverLocation.of(metadata.getLatitude(), metadata.getLongitude(),
                metadata.getTimezoneOffsetHours());
        String sunPixelText = metadata.getExtras().get("sun_pixel");
        PixelCoordinate sunPixel = sunPixelText != null ? PixelCoordinate.parse(sunPixelText) : null;
        Path output = options.containsKey("output") ? Paths.get(options.get("output"))
                : defaultOverlayPath(metadata.getImagePath());

        AnchorConfiguration config = new AnchorConfiguration(metadata.getImagePath(), metadata.getDateTime(), observer,
                sunPixel, metadata.getFocalLengthMm(),
                Optional.ofNullable(metadata.getSensorWidthMm()).orElse(CameraCalibrator.DEFAULT_SENSOR_WIDTH_MM),
                Optional.ofNullable(metadata.getSensorHeightMm()).orElse(CameraCalibrator.DEFAULT_SENSOR_HEIGHT_MM),
                null, null, !options.containsKey("no-dates"), AnchorConfiguration.DEFAULT_LABEL_INTERVAL, output);
        if (metadata.getLocationName() != null) out.println("Location: " + metadata.getLocationName());
        return runAnchor(config, options);
    }

    private int runAnchor(AnchorConfiguration config, Map<String, String> options) throws IOException {
        BufferedImage image = imageDataService.loadImage(config.imagePath());
        AnchorResult result = analemmaService.anchor(config, image);

        OverlayStyle style = OverlayStyle.defaults().withDates(config.showDates(), config.labelIntervalDays())
                .withCaption(OverlayRenderer.defaultCaption(config.observer(), result.anchor));
        if (options.containsKey("no-text")) style = style.withoutText();
        OverlayResult overlay = overlayRenderer.render(image, result.projection, style);
        imageDataService.saveImage(overlay.image, config.outputPath());

        AnchorPoint anchor = result.anchor;
        out.printf(Locale.ROOT, "Sun pixel: (%.1f, %.1f)%s%n", anchor.getPixel().x(), anchor.getPixel().y(),
                result.detectedSun != null ? " detected by " + result.detectedSun.getStrategy() : "");
        out.printf(Locale.ROOT, "Sun position at anchor: altitude %.2f°, azimuth %.2f°%n", anchor.getAltitude(), anchor.getAzimuth());
        out.printf(Locale.ROOT, "Calibration: %.2f px/° (azimuth), %.2f px/° (altitude)%n",
                result.calibration.getPixelsPerDegreeAzimuth(), result.calibration.getPixelsPerDegreeAltitude());
        out.printf(Locale.ROOT, "Points drawn: %d, filtered: %d (below horizon: %d)%n",
                overlay.pointsDrawn, overlay.pointsFiltered, result.projection.getFilteredBelowHorizon());
        printStatistics(result.projection.getStatistics());
        out.println("Overlay written to " + config.outputPath());

        if (options.containsKey("export")) {
            seriesExporter.exportSeries(result.horizonPositions, config.observer(), result.projection,
                    Paths.get(options.get("export")));
            out.println("Series exported to " + options.get("export"));
        }
        if (options.containsKey("plot")) {
            Path chartFile = siblingWithSuffix(config.outputPath(), "_sky_chart.png");
            AnalemmaChartFactory.saveAsPng(AnalemmaChartFactory.createAnchorSkyChart(result.horizonPositions, anchor,
                    config.labelIntervalDays()), chartFile, AnalemmaChartFactory.DEFAULT_WIDTH, AnalemmaChartFactory.DEFAULT_HEIGHT);
            out.println("Sky chart written to " + chartFile);
        }
        return EXIT_OK;
    }

    private void publishCharts(Map<String, JFreeChart> charts, Map<String, String> options) throws IOException {
        Path outputDir = Paths.get(options.getOrDefault("output", "."));
        for (Map.Entry<String, JFreeChart> entry : charts.entrySet()) {
            if (options.containsKey("plot")) {
                Path file = outputDir.resolve(entry.getKey() + ".png");
                AnalemmaChartFactory.saveAsPng(entry.getValue(), file,
                        AnalemmaChartFactory.DEFAULT_WIDTH, AnalemmaChartFactory.DEFAULT_HEIGHT);
                out.println("Chart written to " + file);
            }
            if (options.containsKey("show")) {
                ChartDialog.showChart(entry.getValue(), entry.getKey());
            }
        }
    }

    private void printStatistics(SkyStatistics stats) {
        out.printf(Locale.ROOT, "  Altitude: %.2f° .. %.2f° (span %.2f°)%n", stats.minAltitude(), stats.maxAltitude(), stats.altitudeSpan());
        out.printf(Locale.ROOT, "  Azimuth:  %.2f° .. %.2f° (span %.2f°)%n", stats.minAzimuth(), stats.maxAzimuth(), stats.azimuthSpan());
    }

    // --- Argument parsing ---

    static Map<String, String> parseOptions(String[] args) {
        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--") || arg.length() == 2) {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
            String name = arg.substring(2);
            if (FLAGS.contains(name)) {
                options.put(name, "true");
            } else {
                if (i + 1 >= args.length) throw new IllegalArgumentException("Missing value for --" + name);
                options.put(name, args[++i]);
            }
        }
        return options;
    }

    private static ObserverLocation observer(Map<String, String> options) {
        double lat = parseDouble(required(options, "lat"), "lat");
        double lon = parseDouble(required(options, "lon"), "lon");
        Double tz = options.containsKey("tz") ? parseDouble(options.get("tz"), "tz") : null;
        return ObserverLocation.of(lat, lon, tz);
    }

    private static int year(Map<String, String> options) {
        return intOption(options, "year", LocalDate.now().getYear());
    }

    static LocalDateTime parseAnchorTime(String text) {
        for (DateTimeFormatter format : ANCHOR_FORMATS) {
            try {
                return LocalDateTime.parse(text.trim(), format);
            } catch (DateTimeParseException e) {
                logger.trace("'{}' does not match {}", text, format);
            }
        }
        throw new IllegalArgumentException("Date/time must be given as 'YYYY-MM-DD HH:MM'. Got: " + text);
    }

    private static String required(Map<String, String> options, String name) {
        String value = options.get(name);
        if (value == null || value.isBlank()) throw new IllegalArgumentException("Missing required option --" + name);
        return value;
    }

    private static int intOption(Map<String, String> options, String name, int defaultValue) {
        String value = options.get(name);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer. Got: " + value, e);
        }
    }

    private static double doubleOption(Map<String, String> options, String name) {
        return parseDouble(required(options, name), name);
    }

    private static double doubleOption(Map<String, String> options, String name, double defaultValue) {
        return options.containsKey(name) ? parseDouble(options.get(name), name) : defaultValue;
    }

    private static double parseDouble(String value, String name) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a number. Got: " + value, e);
        }
    }

    private static Path defaultOverlayPath(Path image) {
        return siblingWithSuffix(image, "_analemma.png");
    }

    private static Path siblingWithSuffix(Path file, String suffix) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        Path parent = file.toAbsolutePath().getParent();
        return parent != null ? parent.resolve(base + suffix) : Paths.get(base + suffix);
    }
}
