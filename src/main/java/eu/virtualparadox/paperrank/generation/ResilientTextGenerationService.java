package eu.virtualparadox.paperrank.generation;

import eu.virtualparadox.paperrank.application.config.ResilienceConfig;
import eu.virtualparadox.paperrank.application.executor.GenerationExecutor;
import eu.virtualparadox.paperrank.review.exception.GenerationTimeoutException;
import eu.virtualparadox.paperrank.review.exception.ReviewPipelineException;
import eu.virtualparadox.paperrank.review.exception.UpstreamUnavailableException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Wraps the real generator with a timeout and a retry policy.
 * <p>
 * Each attempt runs on the {@link GenerationExecutor} and is bounded by the
 * time limiter; a timed out attempt surfaces as
 * {@link GenerationTimeoutException} and is not retried here, because the
 * callers count it against their own validation budget. Unreachable
 * upstreams are retried with exponential backoff.
 */
@Service
@Primary
@Slf4j
public class ResilientTextGenerationService implements TextGenerationService {

    private final TextGenerationService delegate;
    private final GenerationExecutor generationExecutor;
    private final Retry retry;
    private final TimeLimiter timeLimiter;

    public ResilientTextGenerationService(@Qualifier("chatModelTextGenerationService") final TextGenerationService delegate,
                                          final GenerationExecutor generationExecutor,
                                          final RetryRegistry retryRegistry,
                                          final TimeLimiterRegistry timeLimiterRegistry) {
        this.delegate = delegate;
        this.generationExecutor = generationExecutor;
        this.retry = retryRegistry.retry(ResilienceConfig.GENERATION);
        this.timeLimiter = timeLimiterRegistry.timeLimiter(ResilienceConfig.GENERATION);
    }

    @Override
    public String generate(final GenerationRequest request) {
        final Callable<String> timed = TimeLimiter.decorateFutureSupplier(timeLimiter,
                () -> CompletableFuture.supplyAsync(() -> delegate.generate(request), generationExecutor));
        final Callable<String> retried = Retry.decorateCallable(retry, () -> attempt(timed));
        try {
            return retried.call();
        } catch (ReviewPipelineException e) {
            throw e;
        } catch (Exception e) {
            throw new UpstreamUnavailableException("Text generation failed: " + e.getMessage(), e);
        }
    }

    private String attempt(final Callable<String> timed) {
        try {
            return timed.call();
        } catch (TimeoutException e) {
            log.warn("Text generation timed out after {}", timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw new GenerationTimeoutException("Text generation timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationTimeoutException("Text generation interrupted", e);
        } catch (Exception e) {
            throw translate(e);
        }
    }

    private static ReviewPipelineException translate(final Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ReviewPipelineException pipelineException) {
            return pipelineException;
        }
        return new UpstreamUnavailableException("Text generation failed: " + cause.getMessage(), cause);
    }
}
