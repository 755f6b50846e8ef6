package com.finhelm.reconcile.config;

import com.finhelm.reconcile.analytics.DetectionSettings;
import com.finhelm.reconcile.matching.MatchWeights;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "finhelm")
public record ReconcileProperties(
        Matching matching,
        Detection detection,
        Ai ai
) {

    @ConstructorBinding
    public ReconcileProperties {
        // every section is optional; missing ones fall back to the library defaults
        if (matching == null) {
            matching = new Matching(null, null, null, null, null, null, null);
        }
        if (detection == null) {
            detection = new Detection(null, null, null, null);
        }
        if (ai == null) {
            ai = new Ai(null, null, null, null);
        }
    }

    public record Matching(
            Double codeWeight,
            Double nameWeight,
            Double hierarchyWeight,
            Double typeWeight,
            Double relatedTypeCredit,
            Double exactCodeFloor,
            Double threshold
    ) {
        public Matching {
            MatchWeights defaults = MatchWeights.DEFAULT;
            codeWeight = codeWeight != null ? codeWeight : defaults.codeWeight();
            nameWeight = nameWeight != null ? nameWeight : defaults.nameWeight();
            hierarchyWeight = hierarchyWeight != null ? hierarchyWeight : defaults.hierarchyWeight();
            typeWeight = typeWeight != null ? typeWeight : defaults.typeWeight();
            relatedTypeCredit = relatedTypeCredit != null ? relatedTypeCredit : defaults.relatedTypeCredit();
            exactCodeFloor = exactCodeFloor != null ? exactCodeFloor : defaults.exactCodeFloor();
            threshold = threshold != null ? threshold : 0.9d;
            // fail at startup rather than on the first reconciliation
            MatchWeights.requireThreshold(threshold);
            new MatchWeights(codeWeight, nameWeight, hierarchyWeight, typeWeight, relatedTypeCredit, exactCodeFloor);
        }

        public MatchWeights toWeights() {
            return new MatchWeights(codeWeight, nameWeight, hierarchyWeight, typeWeight, relatedTypeCredit, exactCodeFloor);
        }
    }

    public record Detection(
            Integer minSampleSize,
            Double sigmaThreshold,
            Double confidenceTarget,
            Double minimumStandardDeviation
    ) {
        public Detection {
            DetectionSettings defaults = DetectionSettings.DEFAULT;
            minSampleSize = minSampleSize != null ? minSampleSize : defaults.minSampleSize();
            sigmaThreshold = sigmaThreshold != null ? sigmaThreshold : defaults.sigmaThreshold();
            confidenceTarget = confidenceTarget != null ? confidenceTarget : defaults.confidenceTarget();
            minimumStandardDeviation = minimumStandardDeviation != null
                    ? minimumStandardDeviation
                    : defaults.minimumStandardDeviation();
            new DetectionSettings(minSampleSize, sigmaThreshold, confidenceTarget, minimumStandardDeviation);
        }

        public DetectionSettings toSettings() {
            return new DetectionSettings(minSampleSize, sigmaThreshold, confidenceTarget, minimumStandardDeviation);
        }
    }

    public record Ai(String model, String endpoint, String apiKey, Integer timeoutMs) {
        public Ai {
            // apiKey may be null/blank; explanations then come from the deterministic template
            model = model != null && !model.isBlank() ? model : "gpt-4o-mini";
            endpoint = endpoint != null && !endpoint.isBlank() ? endpoint : "https://api.openai.com/v1/responses";
            timeoutMs = timeoutMs != null ? timeoutMs : 1500;
            if (timeoutMs <= 0) {
                throw new InvalidConfigurationException("timeoutMs must be positive but was " + timeoutMs);
            }
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
