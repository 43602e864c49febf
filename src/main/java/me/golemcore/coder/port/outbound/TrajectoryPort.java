package me.golemcore.coder.port.outbound;

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

import me.golemcore.coder.domain.model.TrajectoryRecord;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Append-only audit trail of routing decisions and tool calls.
 */
public interface TrajectoryPort {

    /**
     * Append a record to the trail of its session. Records of one session keep
     * their append order.
     */
    CompletableFuture<Void> append(TrajectoryRecord record);

    /**
     * Records of a session in append order, empty when none were written.
     */
    CompletableFuture<List<TrajectoryRecord>> read(String sessionId);
}
