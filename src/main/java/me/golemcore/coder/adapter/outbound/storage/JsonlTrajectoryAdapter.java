package me.golemcore.coder.adapter.outbound.storage;

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
import me.golemcore.coder.domain.model.TrajectoryRecord;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.TrajectoryPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Trajectory trail stored as one JSON Lines file per session under
 * {@code coder.trajectory.base-path}.
 *
 * <p>
 * Appends are serialized through a single lock so lines of concurrent tool
 * results never interleave. With {@code coder.trajectory.enabled=false} every
 * append is dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonlTrajectoryAdapter implements TrajectoryPort {

    private static final String FILE_SUFFIX = ".jsonl";

    private final CoderProperties properties;
    private final ObjectMapper objectMapper;
    private final Object appendLock = new Object();

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getTrajectory().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        if (!properties.getTrajectory().isEnabled()) {
            log.info("Trajectory logging disabled");
            return;
        }
        try {
            Files.createDirectories(basePath);
            log.info("Trajectory storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("Failed to create trajectory directory", e);
        }
    }

    @Override
    public CompletableFuture<Void> append(TrajectoryRecord record) {
        if (!properties.getTrajectory().isEnabled()) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            String line = objectMapper.writeValueAsString(record);
            Path path = resolve(record.getSessionId());
            synchronized (appendLock) {
                Files.createDirectories(path.getParent());
                Files.writeString(path, line + "\n", StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
            return CompletableFuture.completedFuture(null);
        } catch (IOException | RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Trajectory append failed: " + record.getSessionId(), e));
        }
    }

    @Override
    public CompletableFuture<List<TrajectoryRecord>> read(String sessionId) {
        return CompletableFuture.supplyAsync(() -> {
            Path path = resolve(sessionId);
            if (!Files.exists(path)) {
                return List.of();
            }
            List<String> lines;
            try {
                lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new IllegalStateException("Trajectory read failed: " + sessionId, e);
            }
            List<TrajectoryRecord> records = new ArrayList<>(lines.size());
            for (String line : lines) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    records.add(objectMapper.readValue(line, TrajectoryRecord.class));
                } catch (JsonProcessingException e) {
                    log.warn("[Trajectory] Skipping malformed line in {}: {}", path.getFileName(), e.getMessage());
                }
            }
            return records;
        });
    }

    private Path resolve(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Trajectory record requires a session id");
        }
        Path resolved = basePath.resolve(sessionId + FILE_SUFFIX).normalize();
        if (!resolved.startsWith(basePath) || !resolved.getParent().equals(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + sessionId);
        }
        return resolved;
    }
}
