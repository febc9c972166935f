package de.anton.analemma.view;

import de.anton.analemma.model.AnchorPoint;
import de.anton.analemma.model.HorizonPosition;
import de.anton.analemma.model.SolarPosition;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.annotations.XYTextAnnotation;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.axis.NumberTickUnit;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.PolarPlot;
import org.jfree.chart.plot.ValueMarker;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.DefaultPolarItemRenderer;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.chart.ui.RectangleInsets;
import org.jfree.chart.ui.TextAnchor;
import org.jfree.chart.util.ShapeUtils;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.*;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds the JFreeChart charts of an analemma: sky chart, sky dome, figure-8, time series and mode comparison.
 */
public final class AnalemmaChartFactory {

    private static final Logger logger = LoggerFactory.getLogger(AnalemmaChartFactory.class);

    public static final int DEFAULT_WIDTH = 1000;
    public static final int DEFAULT_HEIGHT = 700;

    private static final Color ANALEMMA_COLOR = new Color(255, 127, 14);
    private static final Color SECONDARY_COLOR = new Color(31, 119, 180);
    private static final Color ANCHOR_COLOR = Color.RED;
    private static final Color MARKER_COLOR = new Color(127, 127, 127);
    private static final Shape POINT_SHAPE = ShapeUtils.createDiamond(2.5f);
    private static final Shape ANCHOR_SHAPE = ShapeUtils.createDiamond(8.0f);
    private static final Font LABEL_FONT = new Font(Font.SANS_SERIF, Font.PLAIN, 9);
    private static final DateTimeFormatter LABEL_FORMAT = DateTimeFormatter.ofPattern("MMM dd", Locale.ENGLISH);
    private static final String[] COMPASS = {"N", "E", "S", "W"};

    private AnalemmaChartFactory() { throw new IllegalStateException("Utility class"); }

    /**
     * Azimuth against altitude, one point per day, with compass markers and a date label every
     * {@code labelInterval} days (0 disables labels). Azimuths are unwrapped around North when
     * the figure straddles it.
     */
    public static JFreeChart createSkyChart(List<HorizonPosition> positions, String title, int labelInterval) {
        Objects.requireNonNull(positions, "Positions cannot be null.");
        boolean straddlesNorth = straddlesNorth(positions);
        XYSeries series = new XYSeries("Sun position", false, true);
        for (HorizonPosition p : positions) {
            if (p == null || !p.hasAzimuth()) continue;
            series.add(plotAzimuth(p.getAzimuth(), straddlesNorth), p.getAltitude());
        }
        XYSeriesCollection dataset = new XYSeriesCollection(series);

        JFreeChart chart = ChartFactory.createScatterPlot(title, "Azimuth (°)", "Altitude (°)", dataset,
                PlotOrientation.VERTICAL, true, true, false);
        XYPlot plot = chart.getXYPlot();
        stylePlot(plot);
        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, true);
        renderer.setSeriesPaint(0, ANALEMMA_COLOR);
        renderer.setSeriesShape(0, POINT_SHAPE);
        plot.setRenderer(renderer);

        for (int i = 0; i < COMPASS.length; i++) {
            double azimuth = plotAzimuth(i * 90.0, straddlesNorth);
            ValueMarker marker = new ValueMarker(azimuth, MARKER_COLOR, new BasicStroke(1.0f));
            marker.setLabel(COMPASS[i]);
            marker.setLabelTextAnchor(TextAnchor.TOP_LEFT);
            plot.addDomainMarker(marker);
        }
        ValueMarker horizon = new ValueMarker(0.0, MARKER_COLOR, new BasicStroke(1.0f));
        horizon.setLabel("Horizon");
        plot.addRangeMarker(horizon);
        ((NumberAxis) plot.getDomainAxis()).setAutoRangeIncludesZero(false);

        if (labelInterval > 0) {
            for (HorizonPosition p : positions) {
                if (p == null || !p.hasAzimuth() || p.getSolarPosition() == null) continue;
                if ((p.getDayOfYear() - 1) % labelInterval != 0) continue;
                XYTextAnnotation label = new XYTextAnnotation(
                        p.getSolarPosition().getDateTime().format(LABEL_FORMAT),
                        plotAzimuth(p.getAzimuth(), straddlesNorth), p.getAltitude());
                label.setFont(LABEL_FONT);
                label.setTextAnchor(TextAnchor.BOTTOM_LEFT);
                plot.addAnnotation(label);
            }
        }
        return chart;
    }

    /** Sky chart with the anchor observation highlighted as its own series. */
    public static JFreeChart createAnchorSkyChart(List<HorizonPosition> positions, AnchorPoint anchor, int labelInterval) {
        Objects.requireNonNull(anchor, "Anchor cannot be null.");
        JFreeChart chart = createSkyChart(positions, "Sky chart for " + anchor.getDateTime().toLocalTime(), labelInterval);
        XYPlot plot = chart.getXYPlot();
        XYSeries anchorSeries = new XYSeries("Anchor " + anchor.getDateTime().toLocalDate());
        anchorSeries.add(plotAzimuth(anchor.getAzimuth(), straddlesNorth(positions)), anchor.getAltitude());
        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(false, true);
        renderer.setSeriesPaint(0, ANCHOR_COLOR);
        renderer.setSeriesShape(0, ANCHOR_SHAPE);
        plot.setDataset(1, new XYSeriesCollection(anchorSeries));
        plot.setRenderer(1, renderer);
        return chart;
    }

    /**
     * Polar view of the sky: radius is the zenith distance (90° − altitude), angle the azimuth,
     * North at the top and East to the right. Days below the horizon are left out.
     */
    public static JFreeChart createSkyDomeChart(List<HorizonPosition> positions, String title) {
        Objects.requireNonNull(positions, "Positions cannot be null.");
        XYSeries series = new XYSeries("Sun position", false, true);
        for (HorizonPosition p : positions) {
            if (p == null || !p.hasAzimuth() || !p.isAboveHorizon()) continue;
            series.add(p.getAzimuth(), 90.0 - p.getAltitude());
        }
        JFreeChart chart = ChartFactory.createPolarChart(title, new XYSeriesCollection(series), true, true, false);
        PolarPlot plot = (PolarPlot) chart.getPlot();
        plot.setBackgroundPaint(Color.WHITE);
        plot.setAngleGridlinePaint(Color.LIGHT_GRAY);
        plot.setRadiusGridlinePaint(Color.LIGHT_GRAY);
        plot.setAngleOffset(-90.0);
        plot.setCounterClockwise(false);
        plot.setAngleTickUnit(new NumberTickUnit(45.0));

        NumberAxis radius = (NumberAxis) plot.getAxis();
        radius.setLabel("Zenith distance (°)");
        radius.setAutoRange(false);
        radius.setRange(0.0, 90.0);
        radius.setTickUnit(new NumberTickUnit(30.0));

        DefaultPolarItemRenderer renderer = (DefaultPolarItemRenderer) plot.getRenderer();
        renderer.setShapesVisible(true);
        renderer.setConnectFirstAndLastPoint(false);
        renderer.setSeriesPaint(0, ANALEMMA_COLOR);
        renderer.setSeriesShape(0, POINT_SHAPE);
        return chart;
    }

    /** The classic figure-8: equation of time (x) against declination (y). */
    public static JFreeChart createFigureEightChart(List<SolarPosition> positions, String title) {
        XYSeriesCollection dataset = new XYSeriesCollection(figureEightSeries("Analemma", positions));
        JFreeChart chart = ChartFactory.createScatterPlot(title, "Equation of Time (min)", "Declination (°)", dataset,
                PlotOrientation.VERTICAL, true, true, false);
        XYPlot plot = chart.getXYPlot();
        stylePlot(plot);
        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, true);
        renderer.setSeriesPaint(0, ANALEMMA_COLOR);
        renderer.setSeriesShape(0, POINT_SHAPE);
        plot.setRenderer(renderer);
        plot.addDomainMarker(new ValueMarker(0.0, MARKER_COLOR, new BasicStroke(1.0f)));
        plot.addRangeMarker(new ValueMarker(0.0, MARKER_COLOR, new BasicStroke(1.0f)));
        return chart;
    }

    /** Declination (left axis) and equation of time (right axis) against the day of year. */
    public static JFreeChart createTimeSeriesChart(List<SolarPosition> positions, String title) {
        Objects.requireNonNull(positions, "Positions cannot be null.");
        XYSeries declination = new XYSeries("Declination (°)");
        XYSeries eot = new XYSeries("Equation of Time (min)");
        for (SolarPosition p : positions) {
            declination.add(p.getDayOfYear(), p.getDeclination());
            eot.add(p.getDayOfYear(), p.getEquationOfTime());
        }
        JFreeChart chart = ChartFactory.createXYLineChart(title, "Day of year", "Declination (°)",
                new XYSeriesCollection(declination), PlotOrientation.VERTICAL, true, true, false);
        XYPlot plot = chart.getXYPlot();
        stylePlot(plot);
        plot.getRenderer().setSeriesPaint(0, SECONDARY_COLOR);

        NumberAxis eotAxis = new NumberAxis("Equation of Time (min)");
        plot.setRangeAxis(1, eotAxis);
        plot.setDataset(1, new XYSeriesCollection(eot));
        plot.mapDatasetToRangeAxis(1, 1);
        XYLineAndShapeRenderer eotRenderer = new XYLineAndShapeRenderer(true, false);
        eotRenderer.setSeriesPaint(0, ANALEMMA_COLOR);
        plot.setRenderer(1, eotRenderer);
        return chart;
    }

    /** Figure-8 of both calculation modes on one plot. */
    public static JFreeChart createComparisonChart(List<SolarPosition> approximate, List<SolarPosition> highPrecision) {
        XYSeriesCollection dataset = new XYSeriesCollection();
        dataset.addSeries(figureEightSeries("Approximate", approximate));
        dataset.addSeries(figureEightSeries("High precision", highPrecision));
        JFreeChart chart = ChartFactory.createScatterPlot("Approximate vs. high precision", "Equation of Time (min)",
                "Declination (°)", dataset, PlotOrientation.VERTICAL, true, true, false);
        XYPlot plot = chart.getXYPlot();
        stylePlot(plot);
        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, false);
        renderer.setSeriesPaint(0, ANALEMMA_COLOR);
        renderer.setSeriesPaint(1, SECONDARY_COLOR);
        plot.setRenderer(renderer);
        return chart;
    }

    /**
     * Writes a chart as PNG, creating parent directories as needed.
     *
     * @throws IOException If the file cannot be written.
     */
    public static void saveAsPng(JFreeChart chart, Path file, int width, int height) throws IOException {
        Objects.requireNonNull(chart, "Chart cannot be null.");
        Objects.requireNonNull(file, "Output file cannot be null.");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try {
            ChartUtils.saveChartAsPNG(file.toFile(), chart, width, height);
            logger.info("Chart written to {}", file);
        } catch (IOException e) {
            logger.error("Failed to write chart to {}", file, e);
            throw e;
        }
    }

    private static XYSeries figureEightSeries(String name, List<SolarPosition> positions) {
        Objects.requireNonNull(positions, "Positions cannot be null.");
        XYSeries series = new XYSeries(name, false, true);
        for (SolarPosition p : positions) {
            series.add(p.getEquationOfTime(), p.getDeclination());
        }
        return series;
    }

    private static void stylePlot(XYPlot plot) {
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(Color.LIGHT_GRAY);
        plot.setRangeGridlinePaint(Color.LIGHT_GRAY);
        plot.setAxisOffset(new RectangleInsets(5.0, 5.0, 5.0, 5.0));
    }

    static boolean straddlesNorth(List<HorizonPosition> positions) {
        boolean nearZero = false, nearFull = false;
        for (HorizonPosition p : positions) {
            if (p == null || !p.hasAzimuth()) continue;
            if (p.getAzimuth() < 90.0) nearZero = true;
            if (p.getAzimuth() > 270.0) nearFull = true;
        }
        return nearZero && nearFull;
    }

    private static double plotAzimuth(double azimuth, boolean straddlesNorth) {
        return straddlesNorth && azimuth > 180.0 ? azimuth - 360.0 : azimuth;
    }
}
