package io.github.drompincen.shopbench.gateway.cli;

import io.github.drompincen.shopbench.gateway.config.BenchmarkProperties;
import io.github.drompincen.shopbench.gateway.config.DatasetCatalog;
import io.github.drompincen.shopbench.runtime.config.EnvFileLoader;
import io.github.drompincen.shopbench.runtime.orchestrator.BenchmarkOrchestrator;
import io.github.drompincen.shopbench.runtime.orchestrator.RunRequest;
import io.github.drompincen.shopbench.runtime.orchestrator.RunSummary;
import io.github.drompincen.shopbench.runtime.plan.PlatformFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

/**
 * Runs one benchmark from the command line and exits.
 */
@Component
@ConditionalOnProperty(name = "shopbench.runner.enabled", havingValue = "true", matchIfMissing = true)
public class BenchmarkRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkRunner.class);

    private final BenchmarkOrchestrator orchestrator;
    private final DatasetCatalog datasetCatalog;
    private final EnvFileLoader envFileLoader;
    private final BenchmarkProperties properties;

    public BenchmarkRunner(BenchmarkOrchestrator orchestrator, DatasetCatalog datasetCatalog,
                           EnvFileLoader envFileLoader, BenchmarkProperties properties) {
        this.orchestrator = orchestrator;
        this.datasetCatalog = datasetCatalog;
        this.envFileLoader = envFileLoader;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        RunSummary summary = orchestrator.run(buildRequest(CommandOptions.from(args)));
        log.info("[Runner] Finished: {} steps across {} platforms, {} failed. Report: {}",
                summary.results().size(), summary.platformCount(), summary.failedSteps(), summary.reportPath());
    }

    RunRequest buildRequest(CommandOptions options) {
        BenchmarkProperties.Dataset dataset = datasetCatalog.resolve(options.setting());
        Map<String, String> env = envFileLoader.load(Path.of(options.envFile()));
        String scoringPlatform = scoringPlatform(env);
        log.info("[Runner] Dataset tests={} scoring platform={}", dataset.tests(), scoringPlatform);
        return new RunRequest(
                Path.of(dataset.tests()),
                env,
                new PlatformFilter(options.platforms(), options.excludedPlatforms()),
                options.scenarioStart(),
                options.scenarioEnd(),
                scoringPlatform,
                dataset.scoringPrompt() != null ? Path.of(dataset.scoringPrompt()) : null,
                dataset.groundTruth() != null ? Path.of(dataset.groundTruth()) : null);
    }

    String scoringPlatform(Map<String, String> env) {
        String value = env.get(properties.scoring().envKey());
        if (value == null || value.isBlank()) return properties.scoring().defaultPlatform();
        return value.strip();
    }
}
