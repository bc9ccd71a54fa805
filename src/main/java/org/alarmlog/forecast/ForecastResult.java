package org.alarmlog.forecast;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class ForecastResult {

    private final CountSeries history;
    private final List<ForecastPoint> points;
    private final double confidenceLevel;
    private final SeasonalArimaModel model;
    private final StationarityCheck.Result stationarity;
    private final SeasonalDecomposition decomposition;
    private final Map<LocalDateTime, Double> secondary;
    private final List<String> figures;

    ForecastResult(CountSeries history, List<ForecastPoint> points, double confidenceLevel, SeasonalArimaModel model,
                   StationarityCheck.Result stationarity, SeasonalDecomposition decomposition,
                   Map<LocalDateTime, Double> secondary, List<String> figures) {
        this.history = history;
        this.points = List.copyOf(points);
        this.confidenceLevel = confidenceLevel;
        this.model = model;
        this.stationarity = stationarity;
        this.decomposition = decomposition;
        this.secondary = secondary == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(secondary));
        this.figures = List.copyOf(figures);
    }

    /**
     * Predicted mean per future period, in period order.
     */
    public Map<LocalDateTime, Double> forecast() {
        Map<LocalDateTime, Double> map = new LinkedHashMap<>();
        for (ForecastPoint p : points) {
            map.put(p.getPeriod(), p.getMean());
        }
        return Collections.unmodifiableMap(map);
    }

    public Map<LocalDateTime, Double> lowerBounds() {
        Map<LocalDateTime, Double> map = new LinkedHashMap<>();
        for (ForecastPoint p : points) {
            map.put(p.getPeriod(), p.getLower());
        }
        return Collections.unmodifiableMap(map);
    }

    public Map<LocalDateTime, Double> upperBounds() {
        Map<LocalDateTime, Double> map = new LinkedHashMap<>();
        for (ForecastPoint p : points) {
            map.put(p.getPeriod(), p.getUpper());
        }
        return Collections.unmodifiableMap(map);
    }

    public List<ForecastPoint> getPoints() {
        return points;
    }

    public CountSeries getHistory() {
        return history;
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public SeasonalArimaModel getModel() {
        return model;
    }

    public double getInSampleMse() {
        return model.getMse();
    }

    public Optional<StationarityCheck.Result> getStationarity() {
        return Optional.ofNullable(stationarity);
    }

    public Optional<SeasonalDecomposition> getDecomposition() {
        return Optional.ofNullable(decomposition);
    }

    /**
     * Holt-Winters forecast, when the secondary forecaster ran.
     */
    public Optional<Map<LocalDateTime, Double>> getSecondaryForecast() {
        return Optional.ofNullable(secondary);
    }

    public List<String> getFigures() {
        return figures;
    }

    public String summary() {
        ForecastPoint first = points.get(0);
        ForecastPoint last = points.get(points.size() - 1);
        double total = points.stream().mapToDouble(ForecastPoint::getMean).sum();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "Forecast of %d periods from %s to %s: mean %.2f alarms per period",
                points.size(), label(first), label(last), total / points.size()));
        sb.append(String.format(Locale.ROOT, ", in-sample MSE %.4f", model.getMse()));
        if (stationarity != null) {
            sb.append(", series ").append(stationarity.isStationary() ? "stationary" : "non-stationary");
        }
        return sb.toString();
    }

    private String label(ForecastPoint point) {
        return history.getFrequency() == ChronoUnit.HOURS
                ? point.getPeriod().toString()
                : point.getPeriod().toLocalDate().toString();
    }
}
