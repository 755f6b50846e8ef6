package com.finhelm.reconcile.matching;

import com.finhelm.reconcile.config.InvalidConfigurationException;

/**
 * Weighting policy for the composite account match score.
 *
 * @param codeWeight        weight of the normalized code similarity
 * @param nameWeight        weight of the display name similarity
 * @param hierarchyWeight   weight of the parent path similarity
 * @param typeWeight        weight of the account type agreement
 * @param relatedTypeCredit type score granted to related (same family) account types
 * @param exactCodeFloor    minimum composite score when normalized codes are identical
 */
public record MatchWeights(
        double codeWeight,
        double nameWeight,
        double hierarchyWeight,
        double typeWeight,
        double relatedTypeCredit,
        double exactCodeFloor
) {
    private static final double SUM_TOLERANCE = 0.001d;

    public static final MatchWeights DEFAULT = new MatchWeights(0.40d, 0.40d, 0.10d, 0.10d, 0.5d, 0.95d);

    public MatchWeights {
        requireUnit("codeWeight", codeWeight);
        requireUnit("nameWeight", nameWeight);
        requireUnit("hierarchyWeight", hierarchyWeight);
        requireUnit("typeWeight", typeWeight);
        requireUnit("relatedTypeCredit", relatedTypeCredit);
        requireUnit("exactCodeFloor", exactCodeFloor);
        double sum = codeWeight + nameWeight + hierarchyWeight + typeWeight;
        if (Math.abs(sum - 1.0d) > SUM_TOLERANCE) {
            throw new InvalidConfigurationException("match weights must sum to 1.0 but sum to " + sum);
        }
    }

    public static void requireThreshold(double threshold) {
        requireUnit("threshold", threshold);
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0d || value > 1d) {
            throw new InvalidConfigurationException(name + " must be within [0,1] but was " + value);
        }
    }
}
