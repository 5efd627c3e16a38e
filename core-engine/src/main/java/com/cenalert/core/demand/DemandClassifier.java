package com.cenalert.core.demand;

import com.cenalert.core.model.DemandPattern;
import com.cenalert.core.window.Window;

/**
 * Syntetos-Boylan classification of demand from CV² and ADI.
 *
 * <table>
 * <caption>Classification table</caption>
 * <tr><th></th><th>ADI &lt;= 1.32</th><th>ADI &gt; 1.32</th></tr>
 * <tr><td>CV² &gt; 0.49</td><td>erratic</td><td>lumpy</td></tr>
 * <tr><td>CV² &lt;= 0.49</td><td>smooth</td><td>intermittent</td></tr>
 * </table>
 *
 * <p>
 * If either statistic is NaN no row matches and the result is
 * {@link DemandPattern#NONE}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DemandClassifier {

    public static final double ADI_CUTOFF = 1.32;
    public static final double CV2_CUTOFF = 0.49;

    private DemandClassifier() {
        // utility class, not instantiable
    }

    /**
     * @param cov2 squared coefficient of variation
     * @param adi  average inter-demand interval
     * @return the demand pattern
     */
    public static DemandPattern classify(double cov2, double adi) {
        if (adi <= ADI_CUTOFF && cov2 > CV2_CUTOFF) {
            return DemandPattern.ERRATIC;
        } else if (adi > ADI_CUTOFF && cov2 > CV2_CUTOFF) {
            return DemandPattern.LUMPY;
        } else if (adi <= ADI_CUTOFF && cov2 <= CV2_CUTOFF) {
            return DemandPattern.SMOOTH;
        } else if (adi > ADI_CUTOFF && cov2 <= CV2_CUTOFF) {
            return DemandPattern.INTERMITTENT;
        }
        return DemandPattern.NONE;
    }

    /**
     * Classify the window's current contents as of {@code now}.
     *
     * @param window the detector window
     * @param now    current timestamp
     * @return the demand pattern
     */
    public static DemandPattern classify(Window window, long now) {
        return classify(window.cv2(), window.averageInterdemandInterval(now));
    }
}
