package org.alarmlog.chart;

import org.alarmlog.config.EngineConfig;
import org.knowm.xchart.BitmapEncoder;
import org.knowm.xchart.BitmapEncoder.BitmapFormat;
import org.knowm.xchart.CategoryChart;
import org.knowm.xchart.CategoryChartBuilder;
import org.knowm.xchart.XYChart;
import org.knowm.xchart.XYChartBuilder;
import org.knowm.xchart.XYSeries;
import org.knowm.xchart.internal.chartpart.Chart;
import org.knowm.xchart.style.Styler;
import org.knowm.xchart.style.lines.SeriesLines;
import org.knowm.xchart.style.markers.SeriesMarkers;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Date;
import java.util.List;

/**
 * Builds XChart figures and encodes them as base64 PNG text.
 */
public class ChartRenderer {

    private static final Color[] CLUSTER_COLORS = {
            new Color(68, 1, 84), new Color(49, 104, 142), new Color(53, 183, 121),
            new Color(253, 231, 37), new Color(230, 85, 13), new Color(117, 107, 177)
    };

    private final int width;
    private final int height;

    public ChartRenderer(EngineConfig config) {
        this.width = config.getChartWidth();
        this.height = config.getChartHeight();
    }

    public String reconstructionErrors(double[] errors, double threshold) {
        XYChart chart = new XYChartBuilder().width(width).height(height)
                .title("Reconstruction Error").xAxisTitle("Sequence Index").yAxisTitle("Mean Absolute Error").build();
        double[] x = new double[errors.length];
        for (int i = 0; i < x.length; i++) x[i] = i;
        XYSeries errorSeries = chart.addSeries("Error", x, errors);
        errorSeries.setMarker(errors.length == 1 ? SeriesMarkers.CIRCLE : SeriesMarkers.NONE);

        double end = Math.max(1, errors.length - 1);
        XYSeries thresholdSeries = chart.addSeries("Threshold", new double[]{0, end}, new double[]{threshold, threshold});
        thresholdSeries.setLineColor(Color.RED);
        thresholdSeries.setLineStyle(SeriesLines.DASH_DASH);
        thresholdSeries.setMarker(SeriesMarkers.NONE);
        return encode(chart);
    }

    /**
     * Scatter of a 2-D projection coloured by cluster label, with the projected
     * cluster centroids.
     */
    public String latentClusters(double[][] projection, int[] labels, int clusterCount) {
        XYChart chart = new XYChartBuilder().width(width).height(width)
                .title("t-SNE of Latent Space").xAxisTitle("t-SNE Dimension 1").yAxisTitle("t-SNE Dimension 2").build();
        chart.getStyler().setDefaultSeriesRenderStyle(XYSeries.XYSeriesRenderStyle.Scatter);
        chart.getStyler().setLegendPosition(Styler.LegendPosition.OutsideE);

        List<Double> cx = new ArrayList<>();
        List<Double> cy = new ArrayList<>();
        for (int c = 0; c < clusterCount; c++) {
            List<Double> xs = new ArrayList<>();
            List<Double> ys = new ArrayList<>();
            for (int i = 0; i < projection.length; i++) {
                if (labels[i] == c) {
                    xs.add(projection[i][0]);
                    ys.add(projection[i][1]);
                }
            }
            if (xs.isEmpty()) continue;
            XYSeries series = chart.addSeries("Cluster " + c, xs, ys);
            series.setMarker(SeriesMarkers.CIRCLE);
            series.setMarkerColor(CLUSTER_COLORS[c % CLUSTER_COLORS.length]);
            cx.add(xs.stream().mapToDouble(Double::doubleValue).average().orElse(0));
            cy.add(ys.stream().mapToDouble(Double::doubleValue).average().orElse(0));
        }
        XYSeries centroids = chart.addSeries("Centroids", cx, cy);
        centroids.setMarker(SeriesMarkers.DIAMOND);
        centroids.setMarkerColor(Color.RED);
        return encode(chart);
    }

    public XYChart timeSeries(String title, String yTitle) {
        XYChart chart = new XYChartBuilder().width(width).height(height)
                .title(title).xAxisTitle("Period").yAxisTitle(yTitle).build();
        chart.getStyler().setDatePattern("yyyy-MM-dd");
        chart.getStyler().setLegendPosition(Styler.LegendPosition.InsideNW);
        return chart;
    }

    /**
     * Adds a line series, skipping NaN points. Returns {@code null} when no point is left.
     */
    public XYSeries addLine(XYChart chart, String name, List<LocalDateTime> periods, double[] values) {
        List<Date> xs = new ArrayList<>();
        List<Double> ys = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                xs.add(toDate(periods.get(i)));
                ys.add(values[i]);
            }
        }
        if (xs.isEmpty()) return null;
        XYSeries series = chart.addSeries(name, xs, ys);
        series.setMarker(SeriesMarkers.NONE);
        return series;
    }

    public CategoryChart bars(String title, String xTitle, String yTitle, List<String> categories, List<Double> values) {
        CategoryChart chart = new CategoryChartBuilder().width(width / 2).height(height)
                .title(title).xAxisTitle(xTitle).yAxisTitle(yTitle).build();
        chart.getStyler().setLegendVisible(false);
        chart.getStyler().setXAxisLabelRotation(45);
        chart.addSeries(title, categories, values);
        return chart;
    }

    public String encode(Chart<?, ?> chart) {
        try {
            return Base64.getEncoder().encodeToString(BitmapEncoder.getBitmapBytes(chart, BitmapFormat.PNG));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render chart " + chart.getTitle(), e);
        }
    }

    /**
     * Stacks several charts into a grid of the given column count and encodes the
     * result as one PNG.
     */
    public String encodeGrid(List<? extends Chart<?, ?>> charts, int columns) {
        List<BufferedImage> images = new ArrayList<>(charts.size());
        int cellWidth = 0;
        int cellHeight = 0;
        for (Chart<?, ?> chart : charts) {
            BufferedImage image = BitmapEncoder.getBufferedImage(chart);
            images.add(image);
            cellWidth = Math.max(cellWidth, image.getWidth());
            cellHeight = Math.max(cellHeight, image.getHeight());
        }
        int rows = (images.size() + columns - 1) / columns;
        BufferedImage grid = new BufferedImage(cellWidth * columns, Math.max(1, cellHeight * rows), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = grid.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, grid.getWidth(), grid.getHeight());
            for (int i = 0; i < images.size(); i++) {
                g.drawImage(images.get(i), (i % columns) * cellWidth, (i / columns) * cellHeight, null);
            }
        } finally {
            g.dispose();
        }
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(grid, "png", out);
            return Base64.getEncoder().encodeToString(out.toByteArray());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode chart grid", e);
        }
    }

    private static Date toDate(LocalDateTime time) {
        return Date.from(time.toInstant(ZoneOffset.UTC));
    }
}
