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

import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.SnapshotStoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of SnapshotStoragePort.
 *
 * <p>
 * Layout: {@code <base-path>/<session-id>/turn_<n>.json}. Writes go to a
 * temporary file first and are moved into place, so a crash never leaves a
 * half-written snapshot under the final name.
 *
 * <p>
 * Base path configured via {@code coder.snapshots.base-path}, defaults to
 * {@code ${user.home}/.golemcore/coder/snapshots}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalSnapshotStorageAdapter implements SnapshotStoragePort {

    private static final Pattern SNAPSHOT_FILE = Pattern.compile("turn_(\\d+)\\.json");

    private final CoderProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getSnapshots().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            Files.createDirectories(basePath);
            log.info("Snapshot storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("Failed to create snapshot directory", e);
        }
    }

    @Override
    public CompletableFuture<String> write(String sessionId, int turnNumber, String payload) {
        return CompletableFuture.supplyAsync(() -> {
            Path targetPath = resolve(sessionId, turnNumber);
            Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
            try {
                Files.createDirectories(targetPath.getParent());

                byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
                try (OutputStream os = Files.newOutputStream(tempPath,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.SYNC);
                        FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                    os.write(bytes);
                    os.flush();
                    channel.force(true);
                }

                try {
                    Files.move(tempPath, targetPath,
                            StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[Snapshot] Atomic move not supported, using regular move");
                    Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
                }
                return targetPath.getFileName().toString();
            } catch (IOException e) {
                try {
                    Files.deleteIfExists(tempPath);
                } catch (IOException cleanupEx) {
                    log.warn("[Snapshot] Failed to cleanup temp file: {}", tempPath);
                }
                throw new IllegalStateException("Snapshot write failed: " + sessionId + "/" + turnNumber, e);
            }
        });
    }

    @Override
    public CompletableFuture<String> read(String sessionId, int turnNumber) {
        return CompletableFuture.supplyAsync(() -> {
            Path path = resolve(sessionId, turnNumber);
            if (!Files.exists(path)) {
                return null;
            }
            try {
                return Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new IllegalStateException("Snapshot read failed: " + sessionId + "/" + turnNumber, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<Integer>> listTurns(String sessionId) {
        return CompletableFuture.supplyAsync(() -> {
            Path dir = sessionDirectory(sessionId);
            if (!Files.isDirectory(dir)) {
                return Collections.emptyList();
            }
            try (Stream<Path> files = Files.list(dir)) {
                List<Integer> turns = new ArrayList<>();
                files.filter(Files::isRegularFile).forEach(file -> {
                    Matcher matcher = SNAPSHOT_FILE.matcher(file.getFileName().toString());
                    if (matcher.matches()) {
                        turns.add(Integer.parseInt(matcher.group(1)));
                    }
                });
                Collections.sort(turns);
                return turns;
            } catch (IOException e) {
                throw new IllegalStateException("Snapshot listing failed: " + sessionId, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> delete(String sessionId, int turnNumber) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.deleteIfExists(resolve(sessionId, turnNumber));
            } catch (IOException e) {
                throw new IllegalStateException("Snapshot delete failed: " + sessionId + "/" + turnNumber, e);
            }
        });
    }

    private Path resolve(String sessionId, int turnNumber) {
        return sessionDirectory(sessionId).resolve("turn_" + turnNumber + ".json");
    }

    private Path sessionDirectory(String sessionId) {
        Path resolved = basePath.resolve(sessionId).normalize();
        if (!resolved.startsWith(basePath) || resolved.equals(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + sessionId);
        }
        return resolved;
    }
}
