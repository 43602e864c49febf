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

import java.util.Map;

/**
 * Model routing table of a session.
 */
@Value
@Builder
public class RouterConfig {

    @Builder.Default
    boolean enabled = true;

    /**
     * When false every request is treated as {@link TaskClass#STANDARD}.
     */
    @Builder.Default
    boolean heuristicClassification = true;

    /**
     * Model used when no class-specific model is configured.
     */
    String defaultModel;

    @Builder.Default
    Map<TaskClass, String> models = Map.of();

    @Builder.Default
    Budgets budgets = Budgets.builder().build();

    /**
     * Per-turn resource limits.
     */
    @Value
    @Builder
    public static class Budgets {

        Integer maxTokens;

        @Builder.Default
        int maxParallelTools = 4;
    }
}
