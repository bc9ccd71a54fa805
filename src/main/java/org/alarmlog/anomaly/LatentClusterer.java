package org.alarmlog.anomaly;

import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.JDKRandomGenerator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * k-means++ over latent vectors. The cluster count is capped by the number of
 * distinct vectors so no cluster ends up empty.
 */
public final class LatentClusterer {

    private static final int MAX_ITERATIONS = 300;

    private final int clusterCount;
    private final int seed;

    public LatentClusterer(int clusterCount, long seed) {
        this.clusterCount = clusterCount;
        this.seed = (int) seed;
    }

    public Clustering cluster(double[][] latent) {
        if (latent.length == 0) {
            throw new IllegalArgumentException("No latent vectors to cluster");
        }
        int k = Math.min(clusterCount, distinctCount(latent));
        int[] labels = new int[latent.length];
        if (k <= 1) {
            return new Clustering(labels, 1, Double.NaN);
        }

        List<LatentPoint> points = new ArrayList<>(latent.length);
        for (int i = 0; i < latent.length; i++) {
            points.add(new LatentPoint(i, latent[i]));
        }
        KMeansPlusPlusClusterer<LatentPoint> clusterer = new KMeansPlusPlusClusterer<>(
                k, MAX_ITERATIONS, new EuclideanDistance(), new JDKRandomGenerator(seed));
        List<CentroidCluster<LatentPoint>> clusters = clusterer.cluster(points);
        int label = 0;
        for (CentroidCluster<LatentPoint> cluster : clusters) {
            if (cluster.getPoints().isEmpty()) continue;
            for (LatentPoint p : cluster.getPoints()) {
                labels[p.index] = label;
            }
            label++;
        }
        return new Clustering(labels, label, silhouette(latent, labels, label));
    }

    private static int distinctCount(double[][] latent) {
        Set<List<Double>> distinct = new HashSet<>();
        for (double[] v : latent) {
            List<Double> key = new ArrayList<>(v.length);
            for (double d : v) key.add(d);
            distinct.add(key);
        }
        return distinct.size();
    }

    /**
     * Mean silhouette coefficient; singleton clusters score 0. NaN with fewer than
     * two clusters.
     */
    static double silhouette(double[][] x, int[] labels, int clusters) {
        if (clusters < 2) return Double.NaN;
        EuclideanDistance distance = new EuclideanDistance();
        int n = x.length;
        int[] sizes = new int[clusters];
        for (int l : labels) sizes[l]++;
        double total = 0;
        for (int i = 0; i < n; i++) {
            if (sizes[labels[i]] <= 1) continue;
            double[] sums = new double[clusters];
            for (int j = 0; j < n; j++) {
                if (i != j) sums[labels[j]] += distance.compute(x[i], x[j]);
            }
            double a = sums[labels[i]] / (sizes[labels[i]] - 1);
            double b = Double.POSITIVE_INFINITY;
            for (int c = 0; c < clusters; c++) {
                if (c != labels[i] && sizes[c] > 0) b = Math.min(b, sums[c] / sizes[c]);
            }
            double max = Math.max(a, b);
            total += max == 0 ? 0 : (b - a) / max;
        }
        return total / n;
    }

    private static final class LatentPoint implements Clusterable {
        private final int index;
        private final double[] point;

        LatentPoint(int index, double[] point) {
            this.index = index;
            this.point = point;
        }

        @Override
        public double[] getPoint() {
            return point;
        }
    }

    public static final class Clustering {
        private final int[] labels;
        private final int clusterCount;
        private final double silhouette;

        Clustering(int[] labels, int clusterCount, double silhouette) {
            this.labels = labels;
            this.clusterCount = clusterCount;
            this.silhouette = silhouette;
        }

        public int[] getLabels() {
            return labels.clone();
        }

        public int getClusterCount() {
            return clusterCount;
        }

        public double getSilhouette() {
            return silhouette;
        }

        @Override
        public String toString() {
            return "Clustering{clusters=" + clusterCount + ", labels=" + Arrays.toString(labels) + "}";
        }
    }
}
