package me.golemcore.coder.adapter.outbound.storage;

import me.golemcore.coder.domain.model.TrajectoryRecord;
import me.golemcore.coder.infrastructure.config.AutoConfiguration;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlTrajectoryAdapterTest {

    private static final String SESSION_ID = "session-1";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private CoderProperties properties;
    private JsonlTrajectoryAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new CoderProperties();
        properties.getTrajectory().setBasePath(tempDir.toString());
        adapter = new JsonlTrajectoryAdapter(properties, AutoConfiguration.objectMapper());
        adapter.init();
    }

    private static TrajectoryRecord route(String sessionId, int turn) {
        return TrajectoryRecord.builder()
                .kind(TrajectoryRecord.KIND_ROUTE)
                .sessionId(sessionId)
                .turn(turn)
                .timestamp(NOW)
                .selectedModel("heavy-model")
                .taskClass("codegen_heavy")
                .inputPreview("apply this patch")
                .build();
    }

    private static TrajectoryRecord tool(int turn, String name, boolean success) {
        return TrajectoryRecord.builder()
                .kind(TrajectoryRecord.KIND_TOOL)
                .sessionId(SESSION_ID)
                .turn(turn)
                .timestamp(NOW)
                .toolName(name)
                .arguments(Map.of("path", "src/Main.java"))
                .success(success)
                .failureKind(success ? null : "POLICY_DENIED")
                .build();
    }

    @Test
    void shouldAppendOneJsonLinePerRecord() throws Exception {
        adapter.append(route(SESSION_ID, 1)).join();
        adapter.append(tool(1, "read_file", true)).join();
        adapter.append(tool(1, "delete_file", false)).join();

        List<String> lines = Files.readAllLines(tempDir.resolve(SESSION_ID + ".jsonl"), StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertTrue(lines.get(0).contains("\"kind\":\"route\""));
        assertTrue(lines.get(0).contains("\"selectedModel\":\"heavy-model\""));
        assertTrue(lines.get(0).contains("\"timestamp\":\"2026-03-01T12:00:00Z\""));
        assertFalse(lines.get(0).contains("toolName"));
        assertTrue(lines.get(1).contains("\"kind\":\"tool\""));
        assertFalse(lines.get(1).contains("failureKind"));
    }

    @Test
    void shouldReadRecordsInAppendOrder() {
        adapter.append(route(SESSION_ID, 1)).join();
        adapter.append(tool(1, "read_file", true)).join();
        adapter.append(tool(1, "delete_file", false)).join();

        List<TrajectoryRecord> records = adapter.read(SESSION_ID).join();

        assertEquals(List.of(route(SESSION_ID, 1), tool(1, "read_file", true), tool(1, "delete_file", false)),
                records);
    }

    @Test
    void shouldKeepSessionsInSeparateFiles() {
        adapter.append(route(SESSION_ID, 1)).join();
        adapter.append(route("session-2", 1)).join();

        assertEquals(1, adapter.read(SESSION_ID).join().size());
        assertEquals(1, adapter.read("session-2").join().size());
        assertTrue(adapter.read("unknown").join().isEmpty());
    }

    @Test
    void shouldNotInterleaveConcurrentAppends() {
        CompletableFuture<?>[] appends = IntStream.range(0, 50)
                .mapToObj(i -> CompletableFuture.runAsync(() -> adapter.append(tool(i, "read_file", true)).join()))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(appends).join();

        List<TrajectoryRecord> records = adapter.read(SESSION_ID).join();

        assertEquals(50, records.size());
        assertEquals(50, records.stream().mapToInt(TrajectoryRecord::getTurn).distinct().count());
    }

    @Test
    void shouldSkipMalformedLines() throws Exception {
        adapter.append(route(SESSION_ID, 1)).join();
        Files.writeString(tempDir.resolve(SESSION_ID + ".jsonl"), "{not json\n", StandardCharsets.UTF_8,
                StandardOpenOption.APPEND);
        adapter.append(route(SESSION_ID, 2)).join();

        List<TrajectoryRecord> records = adapter.read(SESSION_ID).join();

        assertEquals(List.of(1, 2), records.stream().map(TrajectoryRecord::getTurn).toList());
    }

    @Test
    void shouldDropRecordsWhenDisabled() {
        properties.getTrajectory().setEnabled(false);

        adapter.append(route(SESSION_ID, 1)).join();

        assertFalse(Files.exists(tempDir.resolve(SESSION_ID + ".jsonl")));
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletableFuture<Void> append = adapter.append(route("../escape", 1));

        assertThrows(CompletionException.class, append::join);
        assertFalse(Files.exists(tempDir.resolveSibling("escape.jsonl")));
    }
}
