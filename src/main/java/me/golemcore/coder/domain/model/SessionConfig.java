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
import java.util.List;

/**
 * Everything a session needs from configuration, captured once at session
 * start and read-only afterwards.
 */
@Value
@Builder
public class SessionConfig {

    @Builder.Default
    CompactionConfig compaction = CompactionConfig.defaults();

    @Builder.Default
    ToolPolicy toolPolicy = ToolPolicy.defaults();

    @Builder.Default
    PermissionMode permissionMode = PermissionMode.STANDARD;

    @Builder.Default
    RouterConfig router = RouterConfig.builder().build();

    @Builder.Default
    RetryConfig retry = RetryConfig.defaults();

    @Builder.Default
    SnapshotConfig snapshot = SnapshotConfig.builder().build();

    @Builder.Default
    List<ToolRegistration> tools = List.of();

    @Builder.Default
    int maxConcurrentSessionTools = 3;

    @Builder.Default
    int maxToolLoops = 20;

    @Builder.Default
    Duration toolTimeout = Duration.ofSeconds(30);

    String systemPrompt;
}
