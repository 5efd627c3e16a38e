package com.cenalert.core.window;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.summary.Sum;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.OptionalLong;

/**
 * Ordered buffer of nonzero observations with their inter-arrival gaps.
 *
 * <p>
 * Every value is stored together with the time elapsed since the previous
 * insertion. The first insertion after construction or {@link #clear()} has no
 * predecessor and records the window capacity as its gap instead (one for an
 * expanding window).
 * </p>
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>values are never zero</li>
 * <li>insertion timestamps strictly increase</li>
 * <li>values and gaps always have the same length</li>
 * <li>a sliding window never holds more than {@code capacity} entries; the
 * oldest entry is evicted on overflow</li>
 * </ul>
 *
 * <h3>Degenerate statistics</h3>
 * <p>
 * Statistics over an empty window return {@link Double#NaN}; the normality
 * test returns {@code false} for samples it cannot evaluate.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. A window is owned by exactly one detector.
 * </p>
 *
 * @since 1.0.0
 */
public class Window {

    /** Default significance level of {@link #isNormal()}. */
    public static final double NORMALITY_ALPHA = 0.05;

    private static final int UNBOUNDED = Integer.MAX_VALUE;

    private final int capacity;

    private final Deque<Double> values = new ArrayDeque<>();
    private final Deque<Long> interarrivals = new ArrayDeque<>();

    /** Timestamp of the most recent insertion, {@code null} when unset. */
    private Long lastArrival;

    private Window(int capacity) {
        this.capacity = capacity;
    }

    /**
     * Create a window that keeps at most {@code capacity} entries.
     *
     * @param capacity maximum length; must be &gt;= 1
     * @return a new empty window
     * @throws IllegalArgumentException if {@code capacity} &lt; 1
     */
    public static Window sliding(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        return new Window(capacity);
    }

    /**
     * Create a window without a length bound.
     *
     * @return a new empty window
     */
    public static Window expanding() {
        return new Window(UNBOUNDED);
    }

    // ---------------------------------------------------------------
    // Mutation
    // ---------------------------------------------------------------

    /**
     * Append a value observed at {@code timestamp}.
     *
     * @param value     the observation; must not be zero
     * @param timestamp must be greater than the previous insertion's
     * @throws IllegalArgumentException if either invariant is violated
     */
    public void insert(double value, long timestamp) {
        if (value == 0) {
            throw new IllegalArgumentException("Zero values cannot enter the window");
        }
        if (lastArrival != null && timestamp <= lastArrival) {
            throw new IllegalArgumentException(
                    "Timestamps must strictly increase: " + timestamp + " <= " + lastArrival);
        }

        values.addLast(value);
        interarrivals.addLast(lastArrival != null ? timestamp - lastArrival : firstGap());
        lastArrival = timestamp;

        if (values.size() > capacity) {
            values.pollFirst();
            interarrivals.pollFirst();
        }
    }

    /**
     * Drop every entry and forget the last arrival.
     */
    public void clear() {
        values.clear();
        interarrivals.clear();
        lastArrival = null;
    }

    /**
     * Pretend the last insertion happened at {@code timestamp}, so that the
     * next insertion records a real gap instead of the capacity sentinel.
     *
     * @param timestamp new last-arrival timestamp
     */
    public void resetLastArrival(long timestamp) {
        this.lastArrival = timestamp;
    }

    /**
     * Multiply every value by {@code factor}.
     *
     * @param factor scale factor
     */
    public void scale(double factor) {
        replaceValues(Arrays.stream(toArray()).map(v -> v * factor).toArray());
    }

    /**
     * Z-score normalize the window and remap it so that its mean and standard
     * deviation become {@code targetMean} and {@code targetStd}.
     *
     * <p>
     * A window without spread has no z-scores; every value is set to
     * {@code targetMean} instead.
     * </p>
     *
     * @param targetMean mean after rescaling
     * @param targetStd  standard deviation after rescaling
     */
    public void standardize(double targetMean, double targetStd) {
        double[] current = toArray();
        double mean = mean();
        double std = std();
        for (int i = 0; i < current.length; i++) {
            double z = std > 0 ? (current[i] - mean) / std : 0;
            current[i] = z * targetStd + targetMean;
        }
        replaceValues(current);
    }

    /**
     * Clip the extreme tails of the window in place.
     *
     * <p>
     * {@code floor(lower * n)} of the smallest values are raised to the next
     * smallest and {@code floor(upper * n)} of the largest values are lowered
     * to the next largest. Positions and gaps are unchanged.
     * </p>
     *
     * @param lower fraction of the lower tail to clip, in [0, 1)
     * @param upper fraction of the upper tail to clip, in [0, 1)
     */
    public void winsorize(double lower, double upper) {
        double[] current = toArray();
        int n = current.length;
        int lowCount = (int) (lower * n);
        int highCount = (int) (upper * n);
        if (n == 0 || (lowCount == 0 && highCount == 0) || lowCount + highCount >= n) {
            return;
        }

        double[] sorted = current.clone();
        Arrays.sort(sorted);
        double floor = sorted[lowCount];
        double ceiling = sorted[n - highCount - 1];
        for (int i = 0; i < n; i++) {
            current[i] = Math.min(Math.max(current[i], floor), ceiling);
        }
        replaceValues(current);
    }

    // ---------------------------------------------------------------
    // Statistics
    // ---------------------------------------------------------------

    public double sum() {
        return isEmpty() ? Double.NaN : new Sum().evaluate(toArray());
    }

    public double mean() {
        return isEmpty() ? Double.NaN : new Mean().evaluate(toArray());
    }

    /**
     * @return population standard deviation, NaN when empty
     */
    public double std() {
        return isEmpty() ? Double.NaN : new StandardDeviation(false).evaluate(toArray());
    }

    public double median() {
        return isEmpty() ? Double.NaN : new Median().evaluate(toArray());
    }

    /**
     * @return differences between successive values, one shorter than the
     *         window (empty for fewer than two values)
     */
    public double[] diff() {
        double[] current = toArray();
        if (current.length < 2) {
            return new double[0];
        }
        double[] out = new double[current.length - 1];
        for (int i = 1; i < current.length; i++) {
            out[i - 1] = current[i] - current[i - 1];
        }
        return out;
    }

    /**
     * Shapiro-Wilk normality test at {@value #NORMALITY_ALPHA}.
     *
     * @return {@code true} if normality is not rejected
     */
    public boolean isNormal() {
        return isNormal(NORMALITY_ALPHA);
    }

    /**
     * @param alpha significance level
     * @return {@code true} if the Shapiro-Wilk p-value is at least
     *         {@code alpha}; {@code false} for degenerate samples
     */
    public boolean isNormal(double alpha) {
        double p = ShapiroWilk.pValue(toArray());
        return !Double.isNaN(p) && p >= alpha;
    }

    /**
     * @return coefficient of variation (std / mean), NaN when empty
     */
    public double cv() {
        return isEmpty() ? Double.NaN : std() / mean();
    }

    /**
     * @return squared coefficient of variation
     */
    public double cv2() {
        double cv = cv();
        return cv * cv;
    }

    /**
     * Mean of the stored gaps plus the hypothetical gap from the last arrival
     * to {@code now}.
     *
     * @param now current timestamp
     * @return the average inter-demand interval, NaN when no arrival is known
     */
    public double averageInterdemandInterval(long now) {
        if (lastArrival == null) {
            return Double.NaN;
        }
        double total = now - lastArrival;
        for (long gap : interarrivals) {
            total += gap;
        }
        return total / (interarrivals.size() + 1);
    }

    /**
     * @return fraction of positions of the dense reconstruction that are zero,
     *         NaN when empty
     */
    public double sparsity() {
        double[] dense = toDenseArray();
        if (dense.length == 0) {
            return Double.NaN;
        }
        long zeros = Arrays.stream(dense).filter(v -> v == 0).count();
        return (double) zeros / dense.length;
    }

    /**
     * Expand the window into a zero-filled series, placing every value at the
     * cumulative sum of the gaps up to and including its own.
     *
     * @return the dense series; empty when no arrival is known
     */
    public double[] toDenseArray() {
        if (lastArrival == null || isEmpty()) {
            return new double[0];
        }
        long length = 0;
        for (long gap : interarrivals) {
            length += gap;
        }
        double[] dense = new double[Math.toIntExact(length)];
        Iterator<Long> gaps = interarrivals.iterator();
        int position = -1;
        for (double value : values) {
            position += Math.toIntExact(gaps.next());
            dense[position] = value;
        }
        return dense;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * @return maximum length, {@link Integer#MAX_VALUE} for an expanding
     *         window
     */
    public int capacity() {
        return capacity;
    }

    /**
     * @return timestamp of the most recent insertion, empty after
     *         {@link #clear()}
     */
    public OptionalLong lastArrival() {
        return lastArrival == null ? OptionalLong.empty() : OptionalLong.of(lastArrival);
    }

    /**
     * @return copy of the values, oldest first
     */
    public double[] toArray() {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * @return copy of the gaps, oldest first
     */
    public long[] interarrivals() {
        return interarrivals.stream().mapToLong(Long::longValue).toArray();
    }

    private long firstGap() {
        return capacity == UNBOUNDED ? 1L : capacity;
    }

    private void replaceValues(double[] replacement) {
        values.clear();
        for (double v : replacement) {
            values.addLast(v);
        }
    }

    @Override
    public String toString() {
        return "Window{values=" + values + ", interarrivals=" + interarrivals + '}';
    }
}
