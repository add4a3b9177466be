package io.github.drompincen.shopbench.runtime.scoring;

import io.github.drompincen.shopbench.protocol.api.PlatformConfig;

import java.util.Map;

/**
 * Read-only inputs shared by every platform task when scoring. A context
 * without a platform or config is disabled.
 */
public record ScoringContext(
        String platformId,
        PlatformConfig config,
        ScoringPromptTemplate template,
        Map<String, String> groundTruth
) {
    public ScoringContext {
        template = template != null ? template : new ScoringPromptTemplate("");
        groundTruth = groundTruth != null ? Map.copyOf(groundTruth) : Map.of();
    }

    public static ScoringContext disabled() {
        return new ScoringContext(null, null, null, Map.of());
    }

    public boolean enabled() {
        return platformId != null && !platformId.isBlank() && config != null;
    }

    public String groundTruthFor(String skuId) {
        if (skuId == null) return "";
        return groundTruth.getOrDefault(skuId.strip(), "");
    }
}
