package com.cenalert.core.detection;

import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;

import java.util.function.DoubleUnaryOperator;

/**
 * Inverts a score function numerically: finds the value whose score is
 * closest to the minimum score.
 *
 * <p>
 * Minimizes {@code |score(x) − minScore|} over {@code [lower, initialGuess]}
 * with bounded Brent search. If the search ends at the initial guess (no
 * crossing inside the interval) or the interval is empty, {@code lower} is
 * returned.
 * </p>
 */
final class ThresholdSearch {

    static final double ABSOLUTE_TOLERANCE = 1e-5;
    static final double RELATIVE_TOLERANCE = 1e-10;
    static final int MAX_EVALUATIONS = 500;

    private ThresholdSearch() {
        // utility class, not instantiable
    }

    static double find(DoubleUnaryOperator score, double minScore, double lower, double initialGuess) {
        if (!(lower < initialGuess)) {
            return lower;
        }
        BrentOptimizer optimizer = new BrentOptimizer(RELATIVE_TOLERANCE, ABSOLUTE_TOLERANCE);
        UnivariatePointValuePair best = optimizer.optimize(
                new MaxEval(MAX_EVALUATIONS),
                new UnivariateObjectiveFunction(x -> Math.abs(score.applyAsDouble(x) - minScore)),
                GoalType.MINIMIZE,
                new SearchInterval(lower, initialGuess));
        double threshold = best.getPoint();
        return isClose(threshold, initialGuess) ? lower : threshold;
    }

    static boolean isClose(double a, double b) {
        return Math.abs(a - b) <= 1e-8 + 1e-5 * Math.abs(b);
    }
}
