package me.golemcore.coder.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.coder.domain.exception.ProviderFailureException;
import me.golemcore.coder.domain.model.RetryConfig;
import me.golemcore.coder.domain.model.RetryStats;
import me.golemcore.coder.domain.system.ProviderErrorClassifier;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Re-drives a single provider call with exponential backoff.
 *
 * <p>
 * The operation is opaque: each attempt calls the supplier for a fresh future
 * and waits for it. Failures matching a retryable signature are retried after
 * {@code min(initialDelay * multiplier^(attempt-1), maxDelay)}; anything else,
 * or the last failed attempt, ends in {@link ProviderFailureException}.
 * Cancellation is never retried and propagates as
 * {@link CancellationException}.
 */
@Slf4j
public class RetryManager {

    /**
     * Waits between attempts.
     */
    @FunctionalInterface
    public interface BackoffSleeper {
        void sleep(Duration delay) throws InterruptedException;
    }

    private final BackoffSleeper sleeper;
    private final DoubleSupplier jitterSource;

    public RetryManager() {
        this(delay -> Thread.sleep(delay.toMillis()), () -> ThreadLocalRandom.current().nextDouble());
    }

    // Visible for testing
    public RetryManager(BackoffSleeper sleeper, DoubleSupplier jitterSource) {
        this.sleeper = sleeper;
        this.jitterSource = jitterSource;
    }

    public <T> T call(RetryConfig config, Supplier<CompletableFuture<T>> operation) {
        return call(config, operation, new RetryStats());
    }

    public <T> T call(RetryConfig config, Supplier<CompletableFuture<T>> operation, RetryStats stats) {
        int maxAttempts = Math.max(1, config.getMaxAttempts());
        Throwable lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            stats.recordAttempt();
            try {
                T result = operation.get().join();
                if (attempt > 1) {
                    stats.recordSuccessfulRetry();
                    log.info("[Retry] Succeeded on attempt {}/{}", attempt, maxAttempts);
                }
                return result;
            } catch (RuntimeException e) {
                Throwable error = ProviderErrorClassifier.unwrap(e);
                if (ProviderErrorClassifier.isCancellation(error)) {
                    throw new CancellationException("Provider call cancelled");
                }
                lastError = error;
                if (!ProviderErrorClassifier.isRetryable(error, config.getRetryableSignatures())) {
                    log.warn("[Retry] Non-retryable provider error on attempt {}/{}: {}", attempt, maxAttempts,
                            ProviderErrorClassifier.describe(error));
                    throw new ProviderFailureException("Provider call failed: "
                            + ProviderErrorClassifier.describe(error), attempt, error);
                }
                if (attempt < maxAttempts) {
                    Duration delay = backoff(config, attempt);
                    log.warn("[Retry] Attempt {}/{} failed: {}. Retrying in {}ms", attempt, maxAttempts,
                            ProviderErrorClassifier.describe(error), delay.toMillis());
                    stats.recordBackoff(delay);
                    pause(delay, attempt);
                }
            }
        }

        stats.recordFailedRetry();
        log.error("[Retry] Provider call failed after {} attempts", maxAttempts);
        throw new ProviderFailureException("Provider call failed after " + maxAttempts + " attempts: "
                + ProviderErrorClassifier.describe(lastError), maxAttempts, lastError);
    }

    /**
     * Call with retries on the primary model, then once on the configured
     * fallback model when the primary is exhausted.
     *
     * @param operation
     *            builds the provider call for a model id
     */
    public <T> T callWithFallback(RetryConfig config, Function<String, CompletableFuture<T>> operation, String model,
            RetryStats stats) {
        try {
            return call(config, () -> operation.apply(model), stats);
        } catch (ProviderFailureException e) {
            String fallback = config.getFallbackModel();
            boolean exhausted = ProviderErrorClassifier.isRetryable(e.getCause(), config.getRetryableSignatures());
            if (fallback == null || fallback.isBlank() || fallback.equals(model) || !exhausted) {
                throw e;
            }
            stats.recordFallback();
            stats.recordAttempt();
            log.warn("[Retry] Switching to fallback model {} after: {}", fallback, e.getMessage());
            try {
                return operation.apply(fallback).join();
            } catch (RuntimeException fallbackError) {
                Throwable error = ProviderErrorClassifier.unwrap(fallbackError);
                if (ProviderErrorClassifier.isCancellation(error)) {
                    throw new CancellationException("Provider call cancelled");
                }
                throw new ProviderFailureException("Fallback model " + fallback + " failed: "
                        + ProviderErrorClassifier.describe(error), e.getAttempts() + 1, error);
            }
        }
    }

    /**
     * Delay before the retry that follows failed attempt {@code attempt}.
     */
    Duration backoff(RetryConfig config, int attempt) {
        Duration base = config.delayForAttempt(attempt);
        if (config.getJitterRatio() <= 0) {
            return base;
        }
        long jitter = (long) (base.toMillis() * config.getJitterRatio() * jitterSource.getAsDouble());
        return Duration.ofMillis(Math.min(base.toMillis() + jitter, config.getMaxDelay().toMillis()));
    }

    private void pause(Duration delay, int attempt) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderFailureException("Provider call interrupted during retry backoff", attempt, e);
        }
    }
}
