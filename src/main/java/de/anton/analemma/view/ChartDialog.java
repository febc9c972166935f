package de.anton.analemma.view;

import org.jfree.chart.ChartPanel;
import org.jfree.chart.JFreeChart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import java.awt.*;

/**
 * Non-modal window showing one chart.
 */
public class ChartDialog extends JDialog {

    private static final Logger logger = LoggerFactory.getLogger(ChartDialog.class);

    public ChartDialog(Frame owner, JFreeChart chart, String title) {
        super(owner, title, false);
        ChartPanel chartPanel = new ChartPanel(chart);
        chartPanel.setPreferredSize(new Dimension(AnalemmaChartFactory.DEFAULT_WIDTH, AnalemmaChartFactory.DEFAULT_HEIGHT));
        chartPanel.setMouseWheelEnabled(true);
        add(chartPanel, BorderLayout.CENTER);
        setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
        pack();
        setLocationByPlatform(true);
    }

    /** Opens the chart on the event dispatch thread; does nothing without a display. */
    public static void showChart(JFreeChart chart, String title) {
        if (GraphicsEnvironment.isHeadless()) {
            logger.warn("No display available, chart '{}' is not shown.", title);
            return;
        }
        SwingUtilities.invokeLater(() -> new ChartDialog(null, chart, title).setVisible(true));
    }
}
