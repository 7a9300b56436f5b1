package com.connector.config;

import com.connector.exception.ConnectorException;
import com.connector.exception.RateLimitException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * A Spring configuration class responsible for creating the HTTP client and the shared infrastructure beans
 * of the runtime: the retry policy, the clock and the worker pools.
 */
@Configuration
public class HttpClientFactory {

    /**
     * Creates the singleton WebClient used for every provider exchange. Retries are not applied here: error
     * classification happens after the response is interpreted, so retrying is the job of
     * {@link #connectorRetry(RuntimeProperties)}.
     *
     * @param properties The runtime properties supplying the in-memory buffer size.
     * @return A fully configured {@link WebClient} instance.
     */
    @Bean
    public WebClient webClient(RuntimeProperties properties) {
        return WebClient.builder()
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(properties.getHttp().getMaxInMemorySize()))
                        .build())
                .build();
    }

    /**
     * Creates the retry policy applied to module invocations.
     * <p>
     * Only rate-limit and provider failures are retried. A rate limit waits for the provider's retry-after
     * hint (capped), everything else backs off exponentially starting at the configured initial delay.
     *
     * @param properties The runtime properties supplying the attempt count and delays.
     * @return The shared {@link Retry} instance.
     */
    @Bean
    public Retry connectorRetry(RuntimeProperties properties) {
        RuntimeProperties.Retry settings = properties.getRetry();
        IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(settings.getInitialBackoff(), settings.getMultiplier());
        Duration maxRetryAfter = settings.getMaxRetryAfter();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, settings.getMaxAttempts()))
                .intervalBiFunction((attempt, outcome) -> {
                    if (outcome.isLeft() && outcome.getLeft() instanceof RateLimitException rateLimit
                            && rateLimit.getRetryAfter() != null) {
                        Duration wait = rateLimit.getRetryAfter();
                        return (wait.compareTo(maxRetryAfter) > 0 ? maxRetryAfter : wait).toMillis();
                    }
                    return backoff.apply(attempt);
                })
                .retryOnException(e -> e instanceof ConnectorException connectorException && connectorException.isRetryable())
                .build();

        return RetryRegistry.of(config).retry("connector-runtime");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Pool running poll cycles; bounded so one slow endpoint cannot starve the others.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pollExecutor(RuntimeProperties properties) {
        return Executors.newFixedThreadPool(properties.getPoll().getPoolSize(), daemonThreads("poll"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService functionExecutor(RuntimeProperties properties) {
        return Executors.newFixedThreadPool(properties.getFunctions().getPoolSize(), daemonThreads("function"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
