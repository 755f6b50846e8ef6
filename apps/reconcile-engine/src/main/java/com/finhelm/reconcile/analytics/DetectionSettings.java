package com.finhelm.reconcile.analytics;

import com.finhelm.reconcile.config.InvalidConfigurationException;

/**
 * Statistical knobs for outlier detection, passed per call.
 *
 * @param minSampleSize            smallest group that is scored at all; at least 3 so the
 *                                 leave-one-out baseline keeps two points
 * @param sigmaThreshold           zScore above which a transaction is anomalous
 * @param confidenceTarget         confidence an anomaly must reach for a run to count as conclusive
 * @param minimumStandardDeviation floor applied to the baseline deviation before dividing
 */
public record DetectionSettings(
        int minSampleSize,
        double sigmaThreshold,
        double confidenceTarget,
        double minimumStandardDeviation
) {
    public static final DetectionSettings DEFAULT = new DetectionSettings(3, 3.0d, 0.927d, 1.0d);

    public DetectionSettings {
        if (minSampleSize < 3) {
            throw new InvalidConfigurationException("minSampleSize must be at least 3 but was " + minSampleSize);
        }
        if (!(sigmaThreshold > 0d) || Double.isInfinite(sigmaThreshold)) {
            throw new InvalidConfigurationException("sigmaThreshold must be positive but was " + sigmaThreshold);
        }
        if (Double.isNaN(confidenceTarget) || confidenceTarget < 0d || confidenceTarget > 1d) {
            throw new InvalidConfigurationException("confidenceTarget must be within [0,1] but was " + confidenceTarget);
        }
        if (!(minimumStandardDeviation > 0d) || Double.isInfinite(minimumStandardDeviation)) {
            throw new InvalidConfigurationException(
                    "minimumStandardDeviation must be positive but was " + minimumStandardDeviation);
        }
    }
}
