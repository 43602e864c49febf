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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Key-value store for snapshot payloads, keyed by session and turn number.
 */
public interface SnapshotStoragePort {

    /**
     * Atomically write a snapshot payload, replacing any previous one for the
     * same turn.
     *
     * @return file name the payload was stored under
     */
    CompletableFuture<String> write(String sessionId, int turnNumber, String payload);

    /**
     * Read a snapshot payload.
     *
     * @return the payload, or null when no snapshot exists for the turn
     */
    CompletableFuture<String> read(String sessionId, int turnNumber);

    /**
     * Turn numbers with a stored snapshot, ascending.
     */
    CompletableFuture<List<Integer>> listTurns(String sessionId);

    CompletableFuture<Void> delete(String sessionId, int turnNumber);
}
