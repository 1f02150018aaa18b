package eu.virtualparadox.paperrank.application.config;

import eu.virtualparadox.paperrank.review.exception.UpstreamUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry and timeout policies for the upstream boundaries (text generation
 * and corpus fetch). Only {@link UpstreamUnavailableException} is retried.
 */
@Configuration
@RequiredArgsConstructor
public class ResilienceConfig {

    public static final String GENERATION = "generation";
    public static final String CORPUS = "corpus";

    private final PipelineConfig pipelineConfig;

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.of(upstreamRetryConfig(pipelineConfig));
    }

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        return TimeLimiterRegistry.of(TimeLimiterConfig.custom()
                .timeoutDuration(pipelineConfig.getGenerationTimeout())
                .cancelRunningFuture(true)
                .build());
    }

    public static RetryConfig upstreamRetryConfig(final PipelineConfig config) {
        return RetryConfig.custom()
                .maxAttempts(config.getUpstreamMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(config.getUpstreamInitialBackoff(), 2.0))
                .retryExceptions(UpstreamUnavailableException.class)
                .build();
    }
}
