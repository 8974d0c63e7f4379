package com.stockneuro.backend.forecasting.registry;

import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;
import org.springframework.stereotype.Component;

/**
 * A candidate replaces the serving version only when its tolerance-accuracy is strictly
 * higher under the same tolerance. Ties keep the serving version.
 */
@Component
public class SafePromotionPolicy {

    public PromotionDecision decide(MetricSnapshot candidate, MetricSnapshot incumbent) {
        Double candidateAccuracy = candidate.toleranceAccuracy();
        if (!MetricSnapshot.isValid(candidateAccuracy)) {
            return PromotionDecision.reject("candidate has no valid tolerance-accuracy");
        }
        if (incumbent == null) {
            return PromotionDecision.promote("no version currently promoted");
        }
        if (Double.compare(candidate.tolerance(), incumbent.tolerance()) != 0) {
            return PromotionDecision.reject(String.format("tolerance %.4f is not comparable with serving tolerance %.4f",
                    candidate.tolerance(), incumbent.tolerance()));
        }
        Double incumbentAccuracy = incumbent.toleranceAccuracy();
        if (!MetricSnapshot.isValid(incumbentAccuracy) || candidateAccuracy > incumbentAccuracy) {
            return PromotionDecision.promote(String.format("tolerance-accuracy %.2f beats serving %s",
                    candidateAccuracy, incumbentAccuracy == null ? "n/a" : String.format("%.2f", incumbentAccuracy)));
        }
        return PromotionDecision.reject(String.format("tolerance-accuracy %.2f does not beat serving %.2f",
                candidateAccuracy, incumbentAccuracy));
    }
}
