package org.alarmlog.anomaly;

import org.alarmlog.error.DataInsufficiencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Chronological train / future partition of a machine's windows. Nothing is
 * shuffled: the model learns from the early history and scores the later one.
 */
public final class SequenceSplit {

    private static final Logger log = LoggerFactory.getLogger(SequenceSplit.class);

    private final List<double[]> train;
    private final List<double[]> future;
    private final boolean degenerate;

    private SequenceSplit(List<double[]> train, List<double[]> future, boolean degenerate) {
        this.train = Collections.unmodifiableList(train);
        this.future = Collections.unmodifiableList(future);
        this.degenerate = degenerate;
    }

    /**
     * Puts the first {@code max(1, floor(fraction * n))} sequences in the training
     * set and the rest in the future set. When one side comes out empty the last
     * sequence alone becomes the future set; a single sequence is used for both.
     */
    public static SequenceSplit chronological(List<double[]> sequences, double trainFraction) {
        int n = sequences.size();
        if (n == 0) {
            throw new DataInsufficiencyException("No sequences to split");
        }
        int split = Math.max(1, (int) (trainFraction * n));
        List<double[]> train = new ArrayList<>(sequences.subList(0, Math.min(split, n)));
        List<double[]> future = new ArrayList<>(sequences.subList(Math.min(split, n), n));

        if (train.isEmpty() || future.isEmpty()) {
            if (n >= 2) {
                train = new ArrayList<>(sequences.subList(0, n - 1));
                future = new ArrayList<>(sequences.subList(n - 1, n));
            } else {
                log.warn("Only one sequence available, using it for both training and evaluation");
                return new SequenceSplit(new ArrayList<>(sequences), new ArrayList<>(sequences), true);
            }
        }
        return new SequenceSplit(train, future, false);
    }

    public List<double[]> getTrain() {
        return train;
    }

    public List<double[]> getFuture() {
        return future;
    }

    /**
     * True when the same single sequence was placed in both partitions.
     */
    public boolean isDegenerate() {
        return degenerate;
    }

    static double[][] toMatrix(List<double[]> rows) {
        return rows.toArray(new double[0][]);
    }
}
