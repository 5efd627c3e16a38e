package com.cenalert.core.window;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Expanding trajectory of values observed since an anomaly began.
 *
 * <p>
 * The first value is the seed (the point just before onset); the remaining
 * values are the anomalous points. The efficiency ratio is the net
 * displacement of the trajectory over its total path length: close to one
 * while the values trend, close to zero once they flatten out or revert.
 * </p>
 *
 * <p>
 * Unlike {@link Window}, the trajectory accepts any value, including zero.
 * </p>
 *
 * @since 1.0.0
 */
public class EfficiencyRatio {

    private final List<Double> trajectory = new ArrayList<>();

    public void insert(double value) {
        trajectory.add(value);
    }

    public void clear() {
        trajectory.clear();
    }

    public int size() {
        return trajectory.size();
    }

    /**
     * |last − first| / Σ |successive differences|.
     *
     * @return the efficiency ratio; NaN with fewer than two values or a flat
     *         trajectory
     */
    public double efficiencyRatio() {
        if (trajectory.size() <= 1) {
            return Double.NaN;
        }
        double netChange = Math.abs(trajectory.get(trajectory.size() - 1) - trajectory.get(0));
        double totalChange = 0;
        for (int i = 1; i < trajectory.size(); i++) {
            totalChange += Math.abs(trajectory.get(i) - trajectory.get(i - 1));
        }
        return netChange / totalChange;
    }

    /**
     * @return every value after the seed, oldest first
     */
    public double[] withoutSeed() {
        if (trajectory.isEmpty()) {
            return new double[0];
        }
        return trajectory.subList(1, trajectory.size()).stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * @return all values including the seed
     */
    public double[] toArray() {
        return trajectory.stream().mapToDouble(Double::doubleValue).toArray();
    }

    @Override
    public String toString() {
        return "EfficiencyRatio" + Arrays.toString(toArray());
    }
}
