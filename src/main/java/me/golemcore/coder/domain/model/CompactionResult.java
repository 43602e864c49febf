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

import java.time.Duration;

/**
 * Outcome of a compaction pass. Sizes are in bytes and include the summary
 * entry.
 *
 * <p>
 * {@code compressionRatio} is always {@code compactedSize / originalSize}
 * (1.0 for an empty history). It is below 1 whenever the evicted messages
 * outweigh the summary and may exceed 1 when only a few tiny messages were
 * evicted.
 */
@Builder
public record CompactionResult(
        int messagesProcessed,
        int messagesCompacted,
        long originalSize,
        long compactedSize,
        double compressionRatio,
        Duration processingTime) {

    public static CompactionResult noop(int messagesProcessed, long size, Duration processingTime) {
        return new CompactionResult(messagesProcessed, 0, size, size, 1.0, processingTime);
    }
}
