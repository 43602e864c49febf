package me.golemcore.coder.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.coder.domain.exception.SnapshotException;
import me.golemcore.coder.domain.exception.SnapshotNotFoundException;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.Snapshot;
import me.golemcore.coder.port.outbound.SnapshotStoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Persists end-of-turn agent state and restores it for rollback.
 *
 * <p>
 * Each snapshot is one JSON envelope holding the {@link Snapshot} metadata and
 * the serialized {@link AgentState}. The metadata carries a SHA-256 checksum of
 * the state text, verified on every load. Storage is keyed by session and turn
 * number; listing always reads the store, so it survives restarts.
 */
@Service
@Slf4j
public class SnapshotManager {

    private final SnapshotStoragePort storage;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SnapshotManager(SnapshotStoragePort storage, ObjectMapper objectMapper, Clock clock) {
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Save the state of a turn, replacing an earlier snapshot of the same turn.
     */
    public Snapshot save(int turnNumber, AgentState state) {
        return save(turnNumber, state, Map.of());
    }

    public Snapshot save(int turnNumber, AgentState state, Map<String, Object> metadata) {
        String sessionId = requireSession(state.getSessionId());
        try {
            String stateJson = objectMapper.writeValueAsString(state);
            Map<String, Object> meta = new LinkedHashMap<>(metadata);
            meta.putIfAbsent("messageCount", state.getMessages() != null ? state.getMessages().size() : 0);
            if (state.getLastModel() != null) {
                meta.putIfAbsent("model", state.getLastModel());
            }
            Snapshot snapshot = Snapshot.builder()
                    .turnNumber(turnNumber)
                    .createdAt(clock.instant())
                    .sizeBytes(stateJson.getBytes(StandardCharsets.UTF_8).length)
                    .filename(fileName(turnNumber))
                    .checksum(sha256(stateJson))
                    .metadata(meta)
                    .build();
            String envelope = objectMapper.writeValueAsString(new SnapshotEnvelope(snapshot, stateJson));
            String stored = join(storage.write(sessionId, turnNumber, envelope));
            log.debug("[Snapshot] Saved turn {} for session {} ({} bytes)", turnNumber, sessionId,
                    snapshot.getSizeBytes());
            return stored != null && !stored.equals(snapshot.getFilename())
                    ? snapshot.toBuilder().filename(stored).build()
                    : snapshot;
        } catch (JsonProcessingException e) {
            throw new SnapshotException("Failed to serialize snapshot for turn " + turnNumber, e);
        }
    }

    /**
     * Snapshots of a session, ascending by turn number. Unreadable entries are
     * skipped.
     */
    public List<Snapshot> list(String sessionId) {
        List<Integer> turns = join(storage.listTurns(requireSession(sessionId)));
        List<Snapshot> snapshots = new ArrayList<>();
        for (Integer turn : turns.stream().sorted().toList()) {
            try {
                String payload = join(storage.read(sessionId, turn));
                if (payload != null) {
                    snapshots.add(parse(payload, turn).metadata());
                }
            } catch (SnapshotException e) {
                log.warn("[Snapshot] Skipping unreadable snapshot for turn {}: {}", turn, e.getMessage());
            }
        }
        return snapshots;
    }

    /**
     * Delete the oldest snapshots so that at most {@code maxSnapshots} remain.
     *
     * @return number of deleted snapshots
     */
    public int cleanup(String sessionId, int maxSnapshots) {
        if (maxSnapshots < 0) {
            throw new IllegalArgumentException("maxSnapshots must be >= 0: " + maxSnapshots);
        }
        List<Integer> turns = join(storage.listTurns(requireSession(sessionId))).stream().sorted().toList();
        int excess = turns.size() - maxSnapshots;
        for (int i = 0; i < excess; i++) {
            join(storage.delete(sessionId, turns.get(i)));
        }
        if (excess > 0) {
            log.debug("[Snapshot] Removed {} old snapshots of session {}", excess, sessionId);
        }
        return Math.max(0, excess);
    }

    /**
     * Delete every snapshot taken after {@code turnNumber}. Used after a
     * rollback so the abandoned branch no longer shows up in {@link #list},
     * {@link #load} or {@link #cleanup}.
     *
     * @return number of deleted snapshots
     */
    public int discardAfter(String sessionId, int turnNumber) {
        List<Integer> turns = join(storage.listTurns(requireSession(sessionId)));
        int removed = 0;
        for (Integer turn : turns) {
            if (turn > turnNumber) {
                join(storage.delete(sessionId, turn));
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("[Snapshot] Discarded {} snapshots after turn {} of session {}", removed, turnNumber,
                    sessionId);
        }
        return removed;
    }

    /**
     * Load the state saved for a turn.
     *
     * @throws SnapshotNotFoundException
     *             when no snapshot exists for the turn
     * @throws SnapshotException
     *             when the snapshot is unreadable or fails its checksum
     */
    public AgentState load(String sessionId, int turnNumber) {
        String payload = join(storage.read(requireSession(sessionId), turnNumber));
        if (payload == null) {
            throw new SnapshotNotFoundException(turnNumber);
        }
        SnapshotEnvelope envelope = parse(payload, turnNumber);
        String expected = envelope.metadata().getChecksum();
        if (expected != null && !expected.equals(sha256(envelope.state()))) {
            throw new SnapshotException("Checksum mismatch for snapshot of turn " + turnNumber);
        }
        try {
            return objectMapper.readValue(envelope.state(), AgentState.class);
        } catch (JsonProcessingException e) {
            throw new SnapshotException("Failed to read snapshot state for turn " + turnNumber, e);
        }
    }

    static String fileName(int turnNumber) {
        return "turn_" + turnNumber + ".json";
    }

    private SnapshotEnvelope parse(String payload, int turnNumber) {
        try {
            SnapshotEnvelope envelope = objectMapper.readValue(payload, SnapshotEnvelope.class);
            if (envelope.metadata() == null || envelope.state() == null) {
                throw new SnapshotException("Incomplete snapshot for turn " + turnNumber);
            }
            return envelope;
        } catch (JsonProcessingException e) {
            throw new SnapshotException("Failed to parse snapshot for turn " + turnNumber, e);
        }
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String requireSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new SnapshotException("Snapshot requires a session id");
        }
        return sessionId;
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof SnapshotException snapshotException) {
                throw snapshotException;
            }
            throw new SnapshotException("Snapshot storage failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * On-disk layout of a snapshot.
     */
    record SnapshotEnvelope(Snapshot metadata, String state) {
    }
}
