package io.github.drompincen.shopbench.runtime.scoring;

import io.github.drompincen.shopbench.protocol.api.PlatformConfig;
import io.github.drompincen.shopbench.runtime.config.PlatformConfigResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Loads the optional scoring inputs once per run. A missing judge config,
 * prompt file or ground-truth file disables scoring for the whole run.
 */
@Component
public class ScoringSetup {

    private static final Logger log = LoggerFactory.getLogger(ScoringSetup.class);

    private final PlatformConfigResolver configResolver;
    private final GroundTruthLoader groundTruthLoader;

    public ScoringSetup(PlatformConfigResolver configResolver, GroundTruthLoader groundTruthLoader) {
        this.configResolver = configResolver;
        this.groundTruthLoader = groundTruthLoader;
    }

    public ScoringContext prepare(String scoringPlatformId, Map<String, String> env,
                                  Path scoringPromptPath, Path groundTruthPath) {
        if (scoringPlatformId == null || scoringPlatformId.isBlank()) {
            log.info("[Scoring] No scoring platform; skipping scoring.");
            return ScoringContext.disabled();
        }
        Optional<PlatformConfig> config = configResolver.resolve(scoringPlatformId, env);
        if (config.isEmpty()) {
            log.warn("[Scoring] Missing scoring config for platform_id={}; skipping scoring.", scoringPlatformId);
            return ScoringContext.disabled();
        }
        if (scoringPromptPath == null || !Files.exists(scoringPromptPath)) {
            log.warn("[Scoring] Scoring prompt missing; skipping scoring.");
            return ScoringContext.disabled();
        }
        if (groundTruthPath == null || !Files.exists(groundTruthPath)) {
            log.warn("[Scoring] Ground truth missing; skipping scoring.");
            return ScoringContext.disabled();
        }

        ScoringPromptTemplate template = readTemplate(scoringPromptPath);
        Map<String, String> groundTruth;
        try {
            groundTruth = groundTruthLoader.load(groundTruthPath);
        } catch (RuntimeException e) {
            log.warn("[Scoring] Failed to load ground truth from {}; skipping scoring: {}",
                    groundTruthPath, e.getMessage());
            return ScoringContext.disabled();
        }
        log.info("[Scoring] Scoring with platform_id={} {}", scoringPlatformId, config.get());
        return new ScoringContext(scoringPlatformId.strip().toUpperCase(Locale.ROOT),
                config.get(), template, groundTruth);
    }

    // An unreadable prompt leaves scoring on; each step then reports the missing prompt.
    private ScoringPromptTemplate readTemplate(Path path) {
        try {
            return new ScoringPromptTemplate(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("[Scoring] Failed to read scoring prompt {}: {}", path, e.getMessage());
            return new ScoringPromptTemplate("");
        }
    }
}
