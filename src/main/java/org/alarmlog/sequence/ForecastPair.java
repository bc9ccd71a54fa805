package org.alarmlog.sequence;

/**
 * Supervised view of a window: the first {@code W - H} codes as input and the last
 * {@code H} codes as target.
 */
public final class ForecastPair {

    private final double[] input;
    private final double[] target;

    ForecastPair(double[] input, double[] target) {
        this.input = input;
        this.target = target;
    }

    public double[] getInput() {
        return input.clone();
    }

    public double[] getTarget() {
        return target.clone();
    }

    public int inputLength() {
        return input.length;
    }

    public int targetLength() {
        return target.length;
    }
}
