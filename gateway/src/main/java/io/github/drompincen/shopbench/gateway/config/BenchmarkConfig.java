package io.github.drompincen.shopbench.gateway.config;

import io.github.drompincen.shopbench.runtime.exec.RetryPolicy;
import io.github.drompincen.shopbench.runtime.exec.Sleeper;
import io.github.drompincen.shopbench.runtime.exec.ThrottlePolicy;
import io.github.drompincen.shopbench.runtime.llm.HttpSettings;
import io.github.drompincen.shopbench.runtime.orchestrator.Slf4jStepObserver;
import io.github.drompincen.shopbench.runtime.orchestrator.StepObserver;
import io.github.drompincen.shopbench.runtime.report.ReportPaths;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class BenchmarkConfig {

    @Bean
    HttpSettings httpSettings(BenchmarkProperties properties) {
        return new HttpSettings(properties.http().connectTimeout(), properties.http().timeout());
    }

    @Bean
    HttpClient httpClient(HttpSettings settings) {
        return HttpClient.newBuilder()
                .connectTimeout(settings.connectTimeout())
                .build();
    }

    @Bean
    RetryPolicy retryPolicy(BenchmarkProperties properties) {
        return new RetryPolicy(properties.retry().count(), properties.retry().backoff());
    }

    @Bean
    ThrottlePolicy throttlePolicy(BenchmarkProperties properties) {
        return new ThrottlePolicy(properties.throttle());
    }

    @Bean
    Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    ReportPaths reportPaths(BenchmarkProperties properties, Clock clock) {
        return new ReportPaths(Path.of(properties.reportsDir()), clock);
    }

    @Bean
    StepObserver stepObserver() {
        return new Slf4jStepObserver();
    }
}
