package me.golemcore.coder.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Backoff policy for provider calls.
 */
@Value
@Builder
public class RetryConfig {

    public static final Set<String> DEFAULT_RETRYABLE_SIGNATURES = Set.of(
            "timeout", "timed out", "connection", "rate_limit", "rate limit", "429",
            "server_error", "500", "502", "503", "network", "temporary", "overloaded");

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration initialDelay = Duration.ofMillis(500);

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(30);

    @Builder.Default
    double backoffMultiplier = 2.0;

    /**
     * Fraction of the computed delay added as random jitter. The result never
     * exceeds {@link #maxDelay}.
     */
    @Builder.Default
    double jitterRatio = 0.0;

    @Builder.Default
    Set<String> retryableSignatures = DEFAULT_RETRYABLE_SIGNATURES;

    /**
     * Model tried once after all attempts on the primary model failed.
     */
    String fallbackModel;

    public static RetryConfig defaults() {
        return RetryConfig.builder().build();
    }

    /**
     * Delay before retry number {@code attempt} (1-based), without jitter.
     */
    public Duration delayForAttempt(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(backoffMultiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(millis, maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
