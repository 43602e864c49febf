package me.golemcore.coder.domain.loop;

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

import me.golemcore.coder.domain.service.CompactionEngine;
import me.golemcore.coder.domain.service.RetryManager;
import me.golemcore.coder.domain.service.SnapshotManager;
import me.golemcore.coder.domain.service.TaskRouter;
import me.golemcore.coder.domain.service.ToolActionDescriber;
import me.golemcore.coder.port.outbound.ConfirmationPort;
import me.golemcore.coder.port.outbound.LlmPort;
import me.golemcore.coder.port.outbound.ToolExecutorPort;
import me.golemcore.coder.port.outbound.TrajectoryPort;
import lombok.Builder;

import java.time.Clock;

/**
 * Stateless collaborators shared by every session's orchestrator. A null
 * {@code trajectory} turns the audit trail off.
 */
@Builder
public record TurnServices(
        CompactionEngine compactionEngine,
        TaskRouter taskRouter,
        RetryManager retryManager,
        SnapshotManager snapshotManager,
        ToolActionDescriber actionDescriber,
        LlmPort llmPort,
        ToolExecutorPort toolExecutor,
        ConfirmationPort confirmationPort,
        TrajectoryPort trajectory,
        Clock clock) {
}
