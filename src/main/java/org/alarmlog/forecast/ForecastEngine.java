package org.alarmlog.forecast;

import org.alarmlog.chart.ChartRenderer;
import org.alarmlog.config.EngineConfig;
import org.alarmlog.data.AlarmTable;
import org.alarmlog.data.DatasetLoader;
import org.alarmlog.error.AlarmEngineException;
import org.alarmlog.error.ConfigurationException;
import org.alarmlog.result.AnalysisOutcome;
import org.alarmlog.result.FailureReason;
import org.apache.commons.math3.random.EmpiricalDistribution;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.knowm.xchart.CategoryChart;
import org.knowm.xchart.XYChart;
import org.knowm.xchart.XYSeries;
import org.knowm.xchart.internal.chartpart.Chart;
import org.knowm.xchart.style.lines.SeriesLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Forecasts the alarm volume of a log. Alarms are counted per period, the
 * count series is checked for stationarity and decomposed, and a seasonal ARIMA
 * model projects the next periods with a confidence band.
 *
 * <p>Like {@link org.alarmlog.anomaly.AnomalyEngine} this never throws; failures
 * come back as a failed {@link AnalysisOutcome}.
 */
public class ForecastEngine {

    private static final Logger log = LoggerFactory.getLogger(ForecastEngine.class);

    public static final int DEFAULT_STEPS = 30;

    private static final int HISTOGRAM_BINS = 10;

    private final EngineConfig config;
    private final DatasetLoader loader;
    private final ChartRenderer charts;

    public ForecastEngine(EngineConfig config) {
        this(config, new DatasetLoader());
    }

    public ForecastEngine(EngineConfig config, DatasetLoader loader) {
        this.config = config;
        this.loader = loader;
        this.charts = new ChartRenderer(config);
    }

    public AnalysisOutcome<ForecastResult> run(Path path, int steps) {
        log.info("Starting forecasting on {} for {} periods", path, steps);
        AlarmTable table;
        try {
            table = loader.load(path);
        } catch (AlarmEngineException e) {
            log.error("Failed to load dataset: {}", e.getMessage());
            return AnalysisOutcome.failure(e.getReason(), "Error loading dataset: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to load dataset {}", path, e);
            return AnalysisOutcome.failure(FailureReason.LOAD_ERROR, "Error loading dataset: " + e.getMessage());
        }
        return forecast(table, steps);
    }

    public AnalysisOutcome<ForecastResult> forecast(AlarmTable table, int steps) {
        try {
            ForecastResult result = execute(table, steps);
            log.info("Forecasting completed: {}", result.summary());
            return AnalysisOutcome.success(result, result.summary(), result.getFigures());
        } catch (AlarmEngineException e) {
            log.error("Forecasting stopped: {}", e.getMessage());
            return AnalysisOutcome.failure(e.getReason(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Forecasting failed", e);
            return AnalysisOutcome.failure(FailureReason.INTERNAL_ERROR, "Error: " + e.getMessage());
        }
    }

    private ForecastResult execute(AlarmTable table, int steps) {
        if (steps < 1) {
            throw new ConfigurationException("Forecast steps must be at least 1, got " + steps);
        }

        // 1. Count series
        CountSeries series = CountSeries.resample(table, config.getForecastFrequency());
        double[] y = series.getCounts();

        // 2. Model
        SeasonalArimaModel model = SeasonalArimaModel.fit(y, config.getSeasonalPeriod());
        log.info("Seasonal ARIMA in-sample MSE: {}", model.getMse());

        // 3. Diagnostics, each one optional
        StationarityCheck.Result stationarity = null;
        try {
            stationarity = StationarityCheck.test(y);
            log.info("{}", stationarity);
        } catch (RuntimeException e) {
            log.warn("Skipping stationarity test: {}", e.getMessage());
        }
        SeasonalDecomposition decomposition = null;
        try {
            decomposition = SeasonalDecomposition.additive(y, config.getDecompositionPeriod());
        } catch (RuntimeException e) {
            log.warn("Skipping seasonal decomposition: {}", e.getMessage());
        }

        // 4. Forecast
        SeasonalArimaModel.Forecast forecast = model.forecast(steps, config.getConfidenceLevel());
        List<LocalDateTime> future = series.futurePeriods(steps);
        double[] mean = forecast.getMean();
        double[] lower = forecast.getLower();
        double[] upper = forecast.getUpper();
        List<ForecastPoint> points = new ArrayList<>(steps);
        for (int h = 0; h < steps; h++) {
            points.add(new ForecastPoint(future.get(h), mean[h], lower[h], upper[h]));
        }

        // 5. Secondary forecaster
        Map<LocalDateTime, Double> secondary = null;
        if (config.isSecondaryForecastEnabled()) {
            secondary = secondaryForecast(y, future);
        }

        // 6. Figures
        List<String> figures = new ArrayList<>();
        addFigure(figures, "history", () -> historyFigure(series));
        addFigure(figures, "forecast", () -> forecastFigure(series, future, forecast));
        if (decomposition != null) {
            SeasonalDecomposition d = decomposition;
            addFigure(figures, "decomposition", () -> decompositionFigure(series, d));
        }
        addFigure(figures, "diagnostics", () -> diagnosticsFigure(series, model));
        if (secondary != null) {
            Map<LocalDateTime, Double> s = secondary;
            addFigure(figures, "secondary forecast", () -> secondaryFigure(series, s));
        }

        return new ForecastResult(series, points, config.getConfidenceLevel(), model, stationarity, decomposition,
                secondary, figures);
    }

    private Map<LocalDateTime, Double> secondaryForecast(double[] y, List<LocalDateTime> future) {
        HoltWintersForecaster forecaster = new HoltWintersForecaster(config.getDecompositionPeriod());
        if (!forecaster.canFit(y.length)) {
            log.info("Series of {} periods too short for Holt-Winters, skipping secondary forecast", y.length);
            return null;
        }
        try {
            double[] values = forecaster.fit(y).forecast(future.size());
            Map<LocalDateTime, Double> map = new LinkedHashMap<>();
            for (int h = 0; h < values.length; h++) {
                map.put(future.get(h), values[h]);
            }
            return map;
        } catch (RuntimeException e) {
            log.warn("Secondary forecast failed: {}", e.getMessage());
            return null;
        }
    }

    private interface FigureSource {
        String render();
    }

    private void addFigure(List<String> figures, String name, FigureSource source) {
        try {
            String figure = source.render();
            if (figure != null) {
                figures.add(figure);
            }
        } catch (RuntimeException e) {
            log.warn("Skipping {} figure: {}", name, e.getMessage());
        }
    }

    private String historyFigure(CountSeries series) {
        XYChart chart = charts.timeSeries("Alarm Counts", "Count");
        charts.addLine(chart, "Observed", series.getPeriods(), series.getCounts());
        return charts.encode(chart);
    }

    private String forecastFigure(CountSeries series, List<LocalDateTime> future, SeasonalArimaModel.Forecast forecast) {
        XYChart chart = charts.timeSeries("Alarm Count Forecast", "Count");
        charts.addLine(chart, "Observed", series.getPeriods(), series.getCounts());
        XYSeries mean = charts.addLine(chart, "Forecast", future, forecast.getMean());
        if (mean != null) {
            mean.setLineColor(Color.RED);
        }
        String level = String.format(Locale.ROOT, "%.0f%%", config.getConfidenceLevel() * 100);
        styleBound(charts.addLine(chart, "Lower " + level, future, forecast.getLower()));
        styleBound(charts.addLine(chart, "Upper " + level, future, forecast.getUpper()));
        return charts.encode(chart);
    }

    private static void styleBound(XYSeries bound) {
        if (bound != null) {
            bound.setLineColor(Color.PINK);
            bound.setLineStyle(SeriesLines.DASH_DASH);
        }
    }

    private String decompositionFigure(CountSeries series, SeasonalDecomposition d) {
        List<LocalDateTime> periods = series.getPeriods();
        List<XYChart> panels = new ArrayList<>();
        String[] titles = {"Observed", "Trend", "Seasonal", "Residual"};
        double[][] parts = {d.getObserved(), d.getTrend(), d.getSeasonal(), d.getResidual()};
        for (int i = 0; i < titles.length; i++) {
            XYChart panel = charts.timeSeries(titles[i], titles[i]);
            charts.addLine(panel, titles[i], periods, parts[i]);
            panels.add(panel);
        }
        return charts.encodeGrid(panels, 1);
    }

    private String diagnosticsFigure(CountSeries series, SeasonalArimaModel model) {
        double[] residuals = model.standardizedResiduals();
        if (residuals.length < 2) {
            log.warn("Too few residuals for model diagnostics");
            return null;
        }
        List<LocalDateTime> periods = series.getPeriods();
        List<LocalDateTime> residualPeriods = periods.subList(periods.size() - residuals.length, periods.size());
        XYChart residualChart = charts.timeSeries("Standardized Residuals", "Residual");
        charts.addLine(residualChart, "Residual", residualPeriods, residuals);

        List<Chart<?, ?>> panels = new ArrayList<>();
        panels.add(residualChart);
        panels.add(histogram(residuals));
        panels.add(autocorrelation(residuals));
        return charts.encodeGrid(panels, 3);
    }

    private CategoryChart histogram(double[] values) {
        Map<Double, Long> bins = residualHistogram(values, HISTOGRAM_BINS);
        List<String> labels = new ArrayList<>(bins.size());
        List<Double> heights = new ArrayList<>(bins.size());
        bins.forEach((center, count) -> {
            labels.add(String.format(Locale.ROOT, "%.1f", center));
            heights.add(count.doubleValue());
        });
        return charts.bars("Residual Histogram", "Standardized Residual", "Frequency", labels, heights);
    }

    /**
     * Counts per equal-width bin, keyed by bin center. A constant sample gets a single bin.
     */
    static Map<Double, Long> residualHistogram(double[] values, int binCount) {
        double min = StatUtils.min(values);
        double max = StatUtils.max(values);
        int bins = max > min ? binCount : 1;
        EmpiricalDistribution distribution = new EmpiricalDistribution(bins);
        distribution.load(values);
        double width = (max - min) / bins;
        List<SummaryStatistics> stats = distribution.getBinStats();
        Map<Double, Long> histogram = new LinkedHashMap<>();
        for (int b = 0; b < bins; b++) {
            histogram.put(min + (b + 0.5) * width, stats.get(b).getN());
        }
        return histogram;
    }

    private CategoryChart autocorrelation(double[] values) {
        double[] acf = autocorrelations(values, Math.min(config.getAcfLags(), values.length - 1));
        List<String> labels = new ArrayList<>(acf.length);
        List<Double> heights = new ArrayList<>(acf.length);
        for (int k = 0; k < acf.length; k++) {
            labels.add(Integer.toString(k));
            heights.add(acf[k]);
        }
        return charts.bars("Residual Autocorrelation", "Lag", "ACF", labels, heights);
    }

    /**
     * Sample autocorrelation for lags 0..maxLag. A flat series has zero
     * correlation beyond lag 0.
     */
    static double[] autocorrelations(double[] x, int maxLag) {
        int n = x.length;
        double mean = 0;
        for (double v : x) mean += v;
        mean /= n;
        double denominator = 0;
        for (double v : x) denominator += (v - mean) * (v - mean);
        double[] acf = new double[maxLag + 1];
        acf[0] = 1;
        for (int k = 1; k <= maxLag; k++) {
            if (denominator == 0) continue;
            double sum = 0;
            for (int t = k; t < n; t++) {
                sum += (x[t] - mean) * (x[t - k] - mean);
            }
            acf[k] = sum / denominator;
        }
        return acf;
    }

    private String secondaryFigure(CountSeries series, Map<LocalDateTime, Double> secondary) {
        XYChart chart = charts.timeSeries("Holt-Winters Forecast", "Count");
        charts.addLine(chart, "Observed", series.getPeriods(), series.getCounts());
        List<LocalDateTime> periods = new ArrayList<>(secondary.keySet());
        double[] values = secondary.values().stream().mapToDouble(Double::doubleValue).toArray();
        XYSeries line = charts.addLine(chart, "Holt-Winters", periods, values);
        if (line != null) {
            line.setLineColor(new Color(0, 128, 0));
        }
        return charts.encode(chart);
    }
}
