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

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters of one session's provider retries.
 */
public class RetryStats {

    private final AtomicLong totalAttempts = new AtomicLong();
    private final AtomicLong successfulRetries = new AtomicLong();
    private final AtomicLong failedRetries = new AtomicLong();
    private final AtomicLong fallbackActivations = new AtomicLong();
    private final AtomicLong totalBackoffMillis = new AtomicLong();

    public void recordAttempt() {
        totalAttempts.incrementAndGet();
    }

    public void recordSuccessfulRetry() {
        successfulRetries.incrementAndGet();
    }

    public void recordFailedRetry() {
        failedRetries.incrementAndGet();
    }

    public void recordFallback() {
        fallbackActivations.incrementAndGet();
    }

    public void recordBackoff(Duration delay) {
        totalBackoffMillis.addAndGet(delay.toMillis());
    }

    public long getTotalAttempts() {
        return totalAttempts.get();
    }

    public long getSuccessfulRetries() {
        return successfulRetries.get();
    }

    public long getFailedRetries() {
        return failedRetries.get();
    }

    public long getFallbackActivations() {
        return fallbackActivations.get();
    }

    public Duration getTotalBackoff() {
        return Duration.ofMillis(totalBackoffMillis.get());
    }
}
