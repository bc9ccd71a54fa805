package org.alarmlog.anomaly;

import java.util.Random;

/**
 * Exact t-SNE into two dimensions. Works for any number of points, including the
 * handful of training windows a short alarm log yields; the perplexity is lowered
 * to {@code (n - 1) / 3} when there are too few points for the configured value.
 */
public final class TsneProjector {

    private static final double EARLY_EXAGGERATION = 12.0;
    private static final double LEARNING_RATE = 200.0;
    private static final double MIN_GAIN = 0.01;
    private static final int BINARY_SEARCH_STEPS = 50;
    private static final double TOLERANCE = 1e-5;

    private final double perplexity;
    private final int iterations;
    private final long seed;

    public TsneProjector(double perplexity, int iterations, long seed) {
        this.perplexity = perplexity;
        this.iterations = iterations;
        this.seed = seed;
    }

    public double[][] project(double[][] x) {
        int n = x.length;
        if (n == 0) return new double[0][2];
        if (n == 1) return new double[][]{{0.0, 0.0}};

        double effectivePerplexity = Math.max(1.0, Math.min(perplexity, (n - 1) / 3.0));
        double[][] p = jointProbabilities(squaredDistances(x), effectivePerplexity);

        Random random = new Random(seed);
        double[][] y = new double[n][2];
        for (double[] row : y) {
            row[0] = random.nextGaussian() * 1e-4;
            row[1] = random.nextGaussian() * 1e-4;
        }
        double[][] velocity = new double[n][2];
        double[][] gains = new double[n][2];
        for (double[] g : gains) {
            g[0] = 1.0;
            g[1] = 1.0;
        }

        int exaggerationStop = Math.min(250, iterations / 4);
        double[][] num = new double[n][n];
        for (int iter = 0; iter < iterations; iter++) {
            double exaggeration = iter < exaggerationStop ? EARLY_EXAGGERATION : 1.0;
            double momentum = iter < exaggerationStop ? 0.5 : 0.8;

            // 1. Student-t affinities in the embedding
            double sumNum = 0;
            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    double dx = y[i][0] - y[j][0];
                    double dy = y[i][1] - y[j][1];
                    double v = 1.0 / (1.0 + dx * dx + dy * dy);
                    num[i][j] = v;
                    num[j][i] = v;
                    sumNum += 2 * v;
                }
            }
            sumNum = Math.max(sumNum, 1e-12);

            // 2. Gradient step with momentum and adaptive gains
            for (int i = 0; i < n; i++) {
                double gx = 0;
                double gy = 0;
                for (int j = 0; j < n; j++) {
                    if (i == j) continue;
                    double q = Math.max(num[i][j] / sumNum, 1e-12);
                    double mult = (exaggeration * p[i][j] - q) * num[i][j];
                    gx += mult * (y[i][0] - y[j][0]);
                    gy += mult * (y[i][1] - y[j][1]);
                }
                double[] grad = {4 * gx, 4 * gy};
                for (int d = 0; d < 2; d++) {
                    boolean sameSign = (grad[d] > 0) == (velocity[i][d] > 0);
                    gains[i][d] = sameSign ? Math.max(gains[i][d] * 0.8, MIN_GAIN) : gains[i][d] + 0.2;
                    velocity[i][d] = momentum * velocity[i][d] - LEARNING_RATE * gains[i][d] * grad[d];
                }
            }
            for (int i = 0; i < n; i++) {
                y[i][0] += velocity[i][0];
                y[i][1] += velocity[i][1];
            }
            center(y);
        }
        return y;
    }

    private static double[][] squaredDistances(double[][] x) {
        int n = x.length;
        double[][] d = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double s = 0;
                for (int k = 0; k < x[i].length; k++) {
                    double diff = x[i][k] - x[j][k];
                    s += diff * diff;
                }
                d[i][j] = s;
                d[j][i] = s;
            }
        }
        return d;
    }

    /**
     * Conditional probabilities matched to the target perplexity by binary search
     * on the Gaussian precision, then symmetrised.
     */
    private static double[][] jointProbabilities(double[][] d, double perplexity) {
        int n = d.length;
        double logU = Math.log(perplexity);
        double[][] conditional = new double[n][n];
        for (int i = 0; i < n; i++) {
            double beta = 1.0;
            double betaMin = Double.NEGATIVE_INFINITY;
            double betaMax = Double.POSITIVE_INFINITY;
            double[] row = conditional[i];
            for (int step = 0; step < BINARY_SEARCH_STEPS; step++) {
                double sumP = 0;
                double weighted = 0;
                for (int j = 0; j < n; j++) {
                    if (j == i) {
                        row[j] = 0;
                        continue;
                    }
                    row[j] = Math.exp(-d[i][j] * beta);
                    sumP += row[j];
                    weighted += d[i][j] * row[j];
                }
                sumP = Math.max(sumP, 1e-12);
                double entropy = Math.log(sumP) + beta * weighted / sumP;
                for (int j = 0; j < n; j++) {
                    row[j] /= sumP;
                }
                double diff = entropy - logU;
                if (Math.abs(diff) < TOLERANCE) break;
                if (diff > 0) {
                    betaMin = beta;
                    beta = Double.isInfinite(betaMax) ? beta * 2 : (beta + betaMax) / 2;
                } else {
                    betaMax = beta;
                    beta = Double.isInfinite(betaMin) ? beta / 2 : (beta + betaMin) / 2;
                }
            }
        }
        double[][] p = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                p[i][j] = Math.max((conditional[i][j] + conditional[j][i]) / (2.0 * n), 1e-12);
            }
        }
        return p;
    }

    private static void center(double[][] y) {
        double mx = 0;
        double my = 0;
        for (double[] row : y) {
            mx += row[0];
            my += row[1];
        }
        mx /= y.length;
        my /= y.length;
        for (double[] row : y) {
            row[0] -= mx;
            row[1] -= my;
        }
    }
}
