package io.github.drompincen.shopbench.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * {@code shopbench.*} settings. Every field has a default so an empty
 * configuration still runs the bundled dataset.
 */
@ConfigurationProperties(prefix = "shopbench")
public record BenchmarkProperties(
        String reportsDir,
        String defaultDataset,
        Retry retry,
        Http http,
        Map<String, Duration> throttle,
        Scoring scoring,
        Map<String, Dataset> datasets
) {
    public static final String DEFAULT_DATASET = "retailing-benchmark";

    public BenchmarkProperties {
        reportsDir = reportsDir != null ? reportsDir : "reports";
        defaultDataset = defaultDataset != null ? defaultDataset : DEFAULT_DATASET;
        retry = retry != null ? retry : new Retry(null, null);
        http = http != null ? http : new Http(null, null);
        throttle = throttle != null ? Map.copyOf(throttle) : Map.of("CLAUDE", Duration.ofSeconds(10));
        scoring = scoring != null ? scoring : new Scoring(null, null);
        datasets = datasets != null && !datasets.isEmpty() ? Map.copyOf(datasets) : Map.of(DEFAULT_DATASET,
                new Dataset(DEFAULT_DATASET + "/shopping_paper_tests.xlsx",
                        DEFAULT_DATASET + "/product_ground_truth.xlsx",
                        DEFAULT_DATASET + "/scoring_prompt.txt"));
    }

    public record Retry(Integer count, Duration backoff) {
        public Retry {
            count = count != null ? count : 2;
            backoff = backoff != null ? backoff : Duration.ofSeconds(5);
        }
    }

    public record Http(Duration timeout, Duration connectTimeout) {
        public Http {
            timeout = timeout != null ? timeout : Duration.ofSeconds(60);
            connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(30);
        }
    }

    public record Scoring(String defaultPlatform, String envKey) {
        public Scoring {
            defaultPlatform = defaultPlatform != null ? defaultPlatform : "CHATGPT";
            envKey = envKey != null ? envKey : "SCORING_PLATFORM_ID";
        }
    }

    /** Input locations of one dataset; relative paths resolve against the working directory. */
    public record Dataset(String tests, String groundTruth, String scoringPrompt) {
    }
}
