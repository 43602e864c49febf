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

/**
 * Compaction thresholds of a session. Loaded once, never changed by the engine.
 */
@Value
@Builder
public class CompactionConfig {

    @Builder.Default
    int maxUncompressedMessages = 50;

    @Builder.Default
    Duration maxMessageAge = Duration.ofHours(1);

    @Builder.Default
    long maxMemoryBytes = 100L * 1024 * 1024;

    @Builder.Default
    Duration compactionInterval = Duration.ofMinutes(5);

    @Builder.Default
    double minContextConfidence = 0.3;

    @Builder.Default
    Duration maxContextAge = Duration.ofHours(2);

    @Builder.Default
    boolean autoCompactionEnabled = true;

    /**
     * Most recent messages kept through a compaction unless nothing older is
     * left to evict.
     */
    @Builder.Default
    int preserveRecentMessages = 5;

    @Builder.Default
    int summaryPreviewLength = 80;

    public static CompactionConfig defaults() {
        return CompactionConfig.builder().build();
    }
}
