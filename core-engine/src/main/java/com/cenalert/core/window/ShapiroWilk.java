package com.cenalert.core.window;

import org.apache.commons.math3.distribution.NormalDistribution;

import java.util.Arrays;

/**
 * Shapiro-Wilk test for normality, using Royston's (1995) approximations for
 * the coefficients and the p-value.
 *
 * <p>
 * Valid for 3 &lt;= n &lt;= 5000. Samples outside that range, samples
 * containing non-finite values and samples without spread are degenerate:
 * {@link #pValue(double[])} returns {@link Double#NaN} for them.
 * </p>
 *
 * @since 1.0.0
 */
public final class ShapiroWilk {

    static final int MIN_SAMPLE = 3;
    static final int MAX_SAMPLE = 5000;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0, 1);

    private static final double[] C1 = { 0.0, 0.221157, -0.147981, -2.071190, 4.434685, -2.706056 };
    private static final double[] C2 = { 0.0, 0.042981, -0.293762, -1.752461, 5.682633, -3.582633 };

    private ShapiroWilk() {
        // utility class, not instantiable
    }

    /**
     * @param sample observations, in any order
     * @return the W statistic, NaN for degenerate samples
     */
    public static double statistic(double[] sample) {
        double[] x = sortedOrNull(sample);
        if (x == null) {
            return Double.NaN;
        }
        int n = x.length;
        double[] a = coefficients(n);

        double mean = Arrays.stream(x).average().orElse(Double.NaN);
        double ssq = 0;
        double weighted = 0;
        for (int i = 0; i < n; i++) {
            ssq += (x[i] - mean) * (x[i] - mean);
            weighted += a[i] * x[i];
        }
        return Math.min(1.0, weighted * weighted / ssq);
    }

    /**
     * @param sample observations, in any order
     * @return the p-value of the test, NaN for degenerate samples
     */
    public static double pValue(double[] sample) {
        double w = statistic(sample);
        if (Double.isNaN(w)) {
            return Double.NaN;
        }
        int n = sample.length;

        if (n == 3) {
            double p = 6.0 / Math.PI * (Math.asin(Math.sqrt(w)) - Math.asin(Math.sqrt(0.75)));
            return Math.max(0.0, Math.min(1.0, p));
        }

        double z;
        if (n <= 11) {
            double gamma = 0.459 * n - 2.273;
            double m = 0.5440 - 0.39978 * n + 0.025054 * n * n - 0.0006714 * n * n * n;
            double s = Math.exp(1.3822 - 0.77857 * n + 0.062767 * n * n - 0.0020322 * n * n * n);
            double arg = gamma - Math.log1p(-w);
            if (arg <= 0) {
                return 0.0;
            }
            z = (-Math.log(arg) - m) / s;
        } else {
            double ln = Math.log(n);
            double m = -1.5861 - 0.31082 * ln - 0.083751 * ln * ln + 0.0038915 * ln * ln * ln;
            double s = Math.exp(-0.4803 - 0.082676 * ln + 0.0030302 * ln * ln);
            z = (Math.log1p(-w) - m) / s;
        }
        return 1.0 - STANDARD_NORMAL.cumulativeProbability(z);
    }

    private static double[] sortedOrNull(double[] sample) {
        if (sample == null || sample.length < MIN_SAMPLE || sample.length > MAX_SAMPLE) {
            return null;
        }
        double[] x = sample.clone();
        Arrays.sort(x);
        if (!Double.isFinite(x[0]) || !Double.isFinite(x[x.length - 1]) || x[0] == x[x.length - 1]) {
            return null;
        }
        return x;
    }

    private static double[] coefficients(int n) {
        double[] a = new double[n];
        if (n == 3) {
            a[0] = -Math.sqrt(0.5);
            a[2] = Math.sqrt(0.5);
            return a;
        }

        double[] m = new double[n];
        double mm = 0;
        for (int i = 0; i < n; i++) {
            m[i] = STANDARD_NORMAL.inverseCumulativeProbability((i + 1 - 0.375) / (n + 0.25));
            mm += m[i] * m[i];
        }

        double u = 1.0 / Math.sqrt(n);
        double an = polynomial(C1, u) + m[n - 1] / Math.sqrt(mm);
        double phi;
        int tail;
        if (n > 5) {
            double an1 = polynomial(C2, u) + m[n - 2] / Math.sqrt(mm);
            phi = (mm - 2 * m[n - 1] * m[n - 1] - 2 * m[n - 2] * m[n - 2])
                    / (1 - 2 * an * an - 2 * an1 * an1);
            a[n - 2] = an1;
            a[1] = -an1;
            tail = 2;
        } else {
            phi = (mm - 2 * m[n - 1] * m[n - 1]) / (1 - 2 * an * an);
            tail = 1;
        }
        a[n - 1] = an;
        a[0] = -an;
        for (int i = tail; i < n - tail; i++) {
            a[i] = m[i] / Math.sqrt(phi);
        }
        return a;
    }

    private static double polynomial(double[] c, double u) {
        double result = 0;
        for (int i = c.length - 1; i >= 0; i--) {
            result = result * u + c[i];
        }
        return result;
    }
}
