package org.alarmlog.config;

import org.alarmlog.error.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Properties;

/**
 * Immutable settings shared by the engines of one invocation. Build it in code with
 * {@link #builder()} or read it from {@code alarm-engine.properties} on the classpath
 * with {@link #load()}; keys missing from the file keep their defaults.
 */
public final class EngineConfig {

    public static final String RESOURCE_NAME = "alarm-engine.properties";

    // anomaly
    private final int epochs;
    private final double learningRate;
    private final long seed;
    private final double thresholdQuantile;
    private final double trainFraction;
    private final int minSequences;
    private final int clusterCount;
    private final boolean visualizationEnabled;
    private final double tsnePerplexity;
    private final int tsneIterations;

    // forecast
    private final ChronoUnit forecastFrequency;
    private final int seasonalPeriod;
    private final int decompositionPeriod;
    private final double confidenceLevel;
    private final boolean secondaryForecastEnabled;
    private final int acfLags;

    // synthetic
    private final Path syntheticOutputPath;
    private final String anomalySentinel;
    private final Long syntheticSeed;

    // charts
    private final int chartWidth;
    private final int chartHeight;

    private EngineConfig(Builder b) {
        this.epochs = b.epochs;
        this.learningRate = b.learningRate;
        this.seed = b.seed;
        this.thresholdQuantile = b.thresholdQuantile;
        this.trainFraction = b.trainFraction;
        this.minSequences = b.minSequences;
        this.clusterCount = b.clusterCount;
        this.visualizationEnabled = b.visualizationEnabled;
        this.tsnePerplexity = b.tsnePerplexity;
        this.tsneIterations = b.tsneIterations;
        this.forecastFrequency = b.forecastFrequency;
        this.seasonalPeriod = b.seasonalPeriod;
        this.decompositionPeriod = b.decompositionPeriod;
        this.confidenceLevel = b.confidenceLevel;
        this.secondaryForecastEnabled = b.secondaryForecastEnabled;
        this.acfLags = b.acfLags;
        this.syntheticOutputPath = b.syntheticOutputPath;
        this.anomalySentinel = b.anomalySentinel;
        this.syntheticSeed = b.syntheticSeed;
        this.chartWidth = b.chartWidth;
        this.chartHeight = b.chartHeight;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EngineConfig defaults() {
        return new Builder().build();
    }

    /**
     * Reads {@value #RESOURCE_NAME} from the classpath, falling back to the defaults
     * when the resource does not exist.
     */
    public static EngineConfig load() {
        Properties props = new Properties();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + RESOURCE_NAME, e);
        }
        return fromProperties(props);
    }

    public static EngineConfig fromProperties(Properties props) {
        Builder b = new Builder();
        b.epochs(intProp(props, "anomaly.epochs", b.epochs));
        b.learningRate(doubleProp(props, "anomaly.learning-rate", b.learningRate));
        b.seed(longProp(props, "anomaly.seed", b.seed));
        b.thresholdQuantile(doubleProp(props, "anomaly.threshold-quantile", b.thresholdQuantile));
        b.trainFraction(doubleProp(props, "anomaly.train-fraction", b.trainFraction));
        b.minSequences(intProp(props, "anomaly.min-sequences", b.minSequences));
        b.clusterCount(intProp(props, "anomaly.cluster-count", b.clusterCount));
        b.visualizationEnabled(boolProp(props, "anomaly.visualization.enabled", b.visualizationEnabled));
        b.tsnePerplexity(doubleProp(props, "anomaly.tsne.perplexity", b.tsnePerplexity));
        b.tsneIterations(intProp(props, "anomaly.tsne.iterations", b.tsneIterations));

        String frequency = props.getProperty("forecast.frequency");
        if (frequency != null) {
            b.forecastFrequency(parseFrequency(frequency.trim()));
        }
        b.seasonalPeriod(intProp(props, "forecast.seasonal-period", b.seasonalPeriod));
        b.decompositionPeriod(intProp(props, "forecast.decomposition-period", b.decompositionPeriod));
        b.confidenceLevel(doubleProp(props, "forecast.confidence-level", b.confidenceLevel));
        b.secondaryForecastEnabled(boolProp(props, "forecast.secondary.enabled", b.secondaryForecastEnabled));
        b.acfLags(intProp(props, "forecast.acf-lags", b.acfLags));

        String output = props.getProperty("synthetic.output-path");
        if (output != null && !output.isBlank()) {
            b.syntheticOutputPath(Paths.get(output.trim()));
        }
        String sentinel = props.getProperty("synthetic.sentinel");
        if (sentinel != null && !sentinel.isBlank()) {
            b.anomalySentinel(sentinel.trim());
        }
        String synthSeed = props.getProperty("synthetic.seed");
        if (synthSeed != null && !synthSeed.isBlank()) {
            b.syntheticSeed(longProp(props, "synthetic.seed", 0L));
        }

        b.chartWidth(intProp(props, "chart.width", b.chartWidth));
        b.chartHeight(intProp(props, "chart.height", b.chartHeight));
        return b.build();
    }

    private static ChronoUnit parseFrequency(String value) {
        switch (value.toUpperCase(Locale.ROOT)) {
            case "H":
            case "HOURS":
                return ChronoUnit.HOURS;
            case "D":
            case "DAYS":
                return ChronoUnit.DAYS;
            case "W":
            case "WEEKS":
                return ChronoUnit.WEEKS;
            default:
                throw new ConfigurationException("Unsupported forecast.frequency '" + value + "', use HOURS, DAYS or WEEKS");
        }
    }

    private static int intProp(Properties props, String key, int def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property " + key + " is not an integer: " + v, e);
        }
    }

    private static long longProp(Properties props, String key, long def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property " + key + " is not an integer: " + v, e);
        }
    }

    private static double doubleProp(Properties props, String key, double def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property " + key + " is not a number: " + v, e);
        }
    }

    private static boolean boolProp(Properties props, String key, boolean def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        String s = v.trim().toLowerCase(Locale.ROOT);
        if (s.equals("true")) return true;
        if (s.equals("false")) return false;
        throw new ConfigurationException("Property " + key + " is not a boolean: " + v);
    }

    public int getEpochs() {
        return epochs;
    }

    public double getLearningRate() {
        return learningRate;
    }

    public long getSeed() {
        return seed;
    }

    public double getThresholdQuantile() {
        return thresholdQuantile;
    }

    public double getTrainFraction() {
        return trainFraction;
    }

    public int getMinSequences() {
        return minSequences;
    }

    public int getClusterCount() {
        return clusterCount;
    }

    public boolean isVisualizationEnabled() {
        return visualizationEnabled;
    }

    public double getTsnePerplexity() {
        return tsnePerplexity;
    }

    public int getTsneIterations() {
        return tsneIterations;
    }

    public ChronoUnit getForecastFrequency() {
        return forecastFrequency;
    }

    public int getSeasonalPeriod() {
        return seasonalPeriod;
    }

    public int getDecompositionPeriod() {
        return decompositionPeriod;
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public boolean isSecondaryForecastEnabled() {
        return secondaryForecastEnabled;
    }

    public int getAcfLags() {
        return acfLags;
    }

    public Path getSyntheticOutputPath() {
        return syntheticOutputPath;
    }

    public String getAnomalySentinel() {
        return anomalySentinel;
    }

    /**
     * Seed for synthetic sampling, {@code null} for a fresh random stream per call.
     */
    public Long getSyntheticSeed() {
        return syntheticSeed;
    }

    public int getChartWidth() {
        return chartWidth;
    }

    public int getChartHeight() {
        return chartHeight;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.epochs = epochs;
        b.learningRate = learningRate;
        b.seed = seed;
        b.thresholdQuantile = thresholdQuantile;
        b.trainFraction = trainFraction;
        b.minSequences = minSequences;
        b.clusterCount = clusterCount;
        b.visualizationEnabled = visualizationEnabled;
        b.tsnePerplexity = tsnePerplexity;
        b.tsneIterations = tsneIterations;
        b.forecastFrequency = forecastFrequency;
        b.seasonalPeriod = seasonalPeriod;
        b.decompositionPeriod = decompositionPeriod;
        b.confidenceLevel = confidenceLevel;
        b.secondaryForecastEnabled = secondaryForecastEnabled;
        b.acfLags = acfLags;
        b.syntheticOutputPath = syntheticOutputPath;
        b.anomalySentinel = anomalySentinel;
        b.syntheticSeed = syntheticSeed;
        b.chartWidth = chartWidth;
        b.chartHeight = chartHeight;
        return b;
    }

    public static final class Builder {
        private int epochs = 20;
        private double learningRate = 0.001;
        private long seed = 12345;
        private double thresholdQuantile = 0.95;
        private double trainFraction = 0.7;
        private int minSequences = 3;
        private int clusterCount = 4;
        private boolean visualizationEnabled = true;
        private double tsnePerplexity = 30.0;
        private int tsneIterations = 500;

        private ChronoUnit forecastFrequency = ChronoUnit.DAYS;
        private int seasonalPeriod = 12;
        private int decompositionPeriod = 7;
        private double confidenceLevel = 0.95;
        private boolean secondaryForecastEnabled = true;
        private int acfLags = 20;

        private Path syntheticOutputPath = Paths.get("test.csv");
        private String anomalySentinel = "-1";
        private Long syntheticSeed;

        private int chartWidth = 800;
        private int chartHeight = 400;

        private Builder() {
        }

        public Builder epochs(int epochs) {
            this.epochs = epochs;
            return this;
        }

        public Builder learningRate(double learningRate) {
            this.learningRate = learningRate;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder thresholdQuantile(double thresholdQuantile) {
            this.thresholdQuantile = thresholdQuantile;
            return this;
        }

        public Builder trainFraction(double trainFraction) {
            this.trainFraction = trainFraction;
            return this;
        }

        public Builder minSequences(int minSequences) {
            this.minSequences = minSequences;
            return this;
        }

        public Builder clusterCount(int clusterCount) {
            this.clusterCount = clusterCount;
            return this;
        }

        public Builder visualizationEnabled(boolean visualizationEnabled) {
            this.visualizationEnabled = visualizationEnabled;
            return this;
        }

        public Builder tsnePerplexity(double tsnePerplexity) {
            this.tsnePerplexity = tsnePerplexity;
            return this;
        }

        public Builder tsneIterations(int tsneIterations) {
            this.tsneIterations = tsneIterations;
            return this;
        }

        public Builder forecastFrequency(ChronoUnit forecastFrequency) {
            this.forecastFrequency = forecastFrequency;
            return this;
        }

        public Builder seasonalPeriod(int seasonalPeriod) {
            this.seasonalPeriod = seasonalPeriod;
            return this;
        }

        public Builder decompositionPeriod(int decompositionPeriod) {
            this.decompositionPeriod = decompositionPeriod;
            return this;
        }

        public Builder confidenceLevel(double confidenceLevel) {
            this.confidenceLevel = confidenceLevel;
            return this;
        }

        public Builder secondaryForecastEnabled(boolean secondaryForecastEnabled) {
            this.secondaryForecastEnabled = secondaryForecastEnabled;
            return this;
        }

        public Builder acfLags(int acfLags) {
            this.acfLags = acfLags;
            return this;
        }

        public Builder syntheticOutputPath(Path syntheticOutputPath) {
            this.syntheticOutputPath = syntheticOutputPath;
            return this;
        }

        public Builder anomalySentinel(String anomalySentinel) {
            this.anomalySentinel = anomalySentinel;
            return this;
        }

        public Builder syntheticSeed(Long syntheticSeed) {
            this.syntheticSeed = syntheticSeed;
            return this;
        }

        public Builder chartWidth(int chartWidth) {
            this.chartWidth = chartWidth;
            return this;
        }

        public Builder chartHeight(int chartHeight) {
            this.chartHeight = chartHeight;
            return this;
        }

        public EngineConfig build() {
            require(epochs >= 1, "anomaly.epochs must be >= 1");
            require(learningRate > 0, "anomaly.learning-rate must be > 0");
            require(thresholdQuantile >= 0 && thresholdQuantile <= 1, "anomaly.threshold-quantile must be in [0, 1]");
            require(trainFraction > 0 && trainFraction < 1, "anomaly.train-fraction must be in (0, 1)");
            require(minSequences >= 1, "anomaly.min-sequences must be >= 1");
            require(clusterCount >= 1, "anomaly.cluster-count must be >= 1");
            require(tsnePerplexity > 0, "anomaly.tsne.perplexity must be > 0");
            require(tsneIterations >= 1, "anomaly.tsne.iterations must be >= 1");
            require(forecastFrequency != null, "forecast.frequency is required");
            require(seasonalPeriod >= 2, "forecast.seasonal-period must be >= 2");
            require(decompositionPeriod >= 2, "forecast.decomposition-period must be >= 2");
            require(confidenceLevel > 0 && confidenceLevel < 1, "forecast.confidence-level must be in (0, 1)");
            require(acfLags >= 1, "forecast.acf-lags must be >= 1");
            require(syntheticOutputPath != null, "synthetic.output-path is required");
            require(anomalySentinel != null && !anomalySentinel.isBlank(), "synthetic.sentinel is required");
            require(chartWidth > 0 && chartHeight > 0, "chart size must be positive");
            return new EngineConfig(this);
        }

        private static void require(boolean condition, String message) {
            if (!condition) {
                throw new ConfigurationException(message);
            }
        }
    }
}
