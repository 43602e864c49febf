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

/**
 * Summary of a completed turn.
 *
 * @param finalAnswer
 *            last assistant text, null when the turn ended without one
 * @param stopReason
 *            why the tool loop ended early, null when the model finished
 */
@Builder
public record TurnResult(
        int turnNumber,
        String model,
        TaskClass taskClass,
        String finalAnswer,
        int llmCalls,
        int toolExecutions,
        boolean compacted,
        Snapshot snapshot,
        String stopReason) {
}
