package me.golemcore.coder.domain.loop;

import me.golemcore.coder.adapter.outbound.storage.LocalSnapshotStorageAdapter;
import me.golemcore.coder.domain.exception.ProviderException;
import me.golemcore.coder.domain.exception.ProviderFailureException;
import me.golemcore.coder.domain.exception.SnapshotException;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.LlmResponse;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.PermissionMode;
import me.golemcore.coder.domain.model.RouterConfig;
import me.golemcore.coder.domain.model.SessionConfig;
import me.golemcore.coder.domain.model.Snapshot;
import me.golemcore.coder.domain.model.SnapshotConfig;
import me.golemcore.coder.domain.model.TaskClass;
import me.golemcore.coder.domain.model.ToolDecision;
import me.golemcore.coder.domain.model.ToolFailureKind;
import me.golemcore.coder.domain.model.ToolPolicy;
import me.golemcore.coder.domain.model.ToolRegistration;
import me.golemcore.coder.domain.model.ToolResult;
import me.golemcore.coder.domain.model.TrajectoryRecord;
import me.golemcore.coder.domain.model.TurnResult;
import me.golemcore.coder.domain.model.TurnState;
import me.golemcore.coder.domain.service.CompactionEngine;
import me.golemcore.coder.domain.service.MessagePriorityAnalyzer;
import me.golemcore.coder.domain.service.RetryManager;
import me.golemcore.coder.domain.service.SnapshotManager;
import me.golemcore.coder.domain.service.TaskRouter;
import me.golemcore.coder.domain.service.ToolActionDescriber;
import me.golemcore.coder.infrastructure.config.AutoConfiguration;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.ConfirmationPort;
import me.golemcore.coder.port.outbound.LlmPort;
import me.golemcore.coder.port.outbound.ToolExecutorPort;
import me.golemcore.coder.port.outbound.TrajectoryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TurnOrchestratorTest {

    private static final String SESSION_ID = "session-1";
    private static final String DEFAULT_MODEL = "default-model";
    private static final String READ_FILE = "read_file";
    private static final String DELETE_FILE = "delete_file";
    private static final String PTY = "run_pty_cmd";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private LlmPort llmPort;

    @Mock
    private ToolExecutorPort toolExecutor;

    @Mock
    private ConfirmationPort confirmationPort;

    @Mock
    private SnapshotManager snapshotManager;

    @Mock
    private TrajectoryPort trajectory;

    @TempDir
    Path tempDir;

    private Clock clock;
    private TurnServices services;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        services = services(snapshotManager);
        when(snapshotManager.save(anyInt(), any(AgentState.class)))
                .thenAnswer(invocation -> Snapshot.builder().turnNumber(invocation.getArgument(0)).build());
        when(trajectory.append(any(TrajectoryRecord.class))).thenReturn(CompletableFuture.completedFuture(null));
    }

    private TurnServices services(SnapshotManager manager) {
        return TurnServices.builder()
                .compactionEngine(new CompactionEngine(new MessagePriorityAnalyzer(), clock))
                .taskRouter(new TaskRouter())
                .retryManager(new RetryManager(delay -> {
                }, () -> 0.0))
                .snapshotManager(manager)
                .actionDescriber(new ToolActionDescriber())
                .llmPort(llmPort)
                .toolExecutor(toolExecutor)
                .confirmationPort(confirmationPort)
                .trajectory(trajectory)
                .clock(clock)
                .build();
    }

    private static SessionConfig.SessionConfigBuilder configBuilder() {
        ToolPolicy policy = new ToolPolicy(Map.of(READ_FILE, ToolDecision.ALLOW, DELETE_FILE, ToolDecision.DENY,
                PTY, ToolDecision.ALLOW), ToolDecision.PROMPT);
        return SessionConfig.builder()
                .toolPolicy(policy)
                .router(RouterConfig.builder().defaultModel(DEFAULT_MODEL).build())
                .tools(List.of(ToolRegistration.of(READ_FILE, null), ToolRegistration.of(DELETE_FILE, null),
                        ToolRegistration.sessionBased(PTY, null)));
    }

    private TurnOrchestrator orchestrator() {
        return orchestrator(configBuilder().build());
    }

    private TurnOrchestrator orchestrator(SessionConfig config) {
        return new TurnOrchestrator(SESSION_ID, config, services);
    }

    private static CompletableFuture<LlmResponse> answer(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
    }

    private static CompletableFuture<LlmResponse> toolCalls(Message.ToolCall... calls) {
        return CompletableFuture.completedFuture(LlmResponse.builder().toolCalls(List.of(calls)).build());
    }

    private static Message.ToolCall call(String id, String name) {
        return Message.ToolCall.builder().id(id).name(name).arguments(Map.of("path", "src/Main.java")).build();
    }

    private static List<Message> toolMessages(TurnOrchestrator orchestrator) {
        return orchestrator.getHistory().messages().stream().filter(Message::isToolMessage).toList();
    }

    @Test
    void shouldAnswerWithoutTools() {
        when(llmPort.generate(any(LlmRequest.class))).thenReturn(answer("Hello!"));
        TurnOrchestrator orchestrator = orchestrator();

        TurnResult result = orchestrator.runTurn("hi");

        assertEquals("Hello!", result.finalAnswer());
        assertEquals(1, result.turnNumber());
        assertEquals(1, result.llmCalls());
        assertEquals(0, result.toolExecutions());
        assertEquals(TaskClass.SIMPLE, result.taskClass());
        assertEquals(DEFAULT_MODEL, result.model());
        assertNull(result.stopReason());
        assertEquals(1, result.snapshot().getTurnNumber());
        assertEquals(TurnState.IDLE, orchestrator.getState());
        List<Message> messages = orchestrator.getHistory().messages();
        assertEquals(2, messages.size());
        assertTrue(messages.get(0).isUserMessage());
        assertTrue(messages.get(1).isAssistantMessage());
    }

    @Test
    void shouldRouteToConfiguredModel() {
        when(llmPort.generate(any(LlmRequest.class))).thenReturn(answer("ok"));
        SessionConfig config = configBuilder()
                .router(RouterConfig.builder()
                        .defaultModel(DEFAULT_MODEL)
                        .models(Map.of(TaskClass.SIMPLE, "fast-model"))
                        .build())
                .build();

        TurnResult result = orchestrator(config).runTurn("list files");

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).generate(captor.capture());
        assertEquals("fast-model", captor.getValue().getModel());
        assertEquals("fast-model", result.model());
        assertEquals(SESSION_ID, captor.getValue().getSessionId());
    }

    @Test
    void shouldRouteEachTurnFromDefaultModel() {
        when(llmPort.generate(any(LlmRequest.class))).thenAnswer(invocation -> answer("ok"));
        SessionConfig config = configBuilder()
                .router(RouterConfig.builder()
                        .defaultModel(DEFAULT_MODEL)
                        .models(Map.of(TaskClass.CODEGEN_HEAVY, "heavy-model"))
                        .build())
                .build();
        TurnOrchestrator orchestrator = orchestrator(config);

        TurnResult first = orchestrator.runTurn("```\nclass A {}\n```");
        TurnResult second = orchestrator.runTurn("list files");

        assertEquals("heavy-model", first.model());
        assertEquals(TaskClass.SIMPLE, second.taskClass());
        assertEquals(DEFAULT_MODEL, second.model());
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).generate(captor.capture());
        assertEquals(List.of("heavy-model", DEFAULT_MODEL),
                captor.getAllValues().stream().map(LlmRequest::getModel).toList());
    }

    @Test
    void shouldNotExecuteDeniedTool() {
        when(llmPort.generate(any(LlmRequest.class)))
                .thenReturn(toolCalls(call("tc-1", DELETE_FILE)))
                .thenReturn(answer("I could not delete it."));
        TurnOrchestrator orchestrator = orchestrator();

        TurnResult result = orchestrator.runTurn("delete src/Main.java");

        verify(toolExecutor, never()).execute(anyString(), anyMap());
        List<Message> tools = toolMessages(orchestrator);
        assertEquals(1, tools.size());
        assertEquals("tc-1", tools.get(0).getToolCallId());
        assertEquals(ToolFailureKind.POLICY_DENIED.name(), tools.get(0).getMetadata().get("failureKind"));
        assertTrue(tools.get(0).getContent().contains("denied"));
        assertEquals(2, result.llmCalls());
        assertEquals(1, result.toolExecutions());
    }

    @Test
    void shouldExecuteConfirmedTool() {
        when(llmPort.generate(any(LlmRequest.class)))
                .thenReturn(toolCalls(call("tc-1", "write_file")))
                .thenReturn(answer("Written."));
        when(confirmationPort.isAvailable()).thenReturn(true);
        when(confirmationPort.requestConfirmation(eq(SESSION_ID), eq("write_file"), anyString()))
                .thenReturn(CompletableFuture.completedFuture(true));
        when(toolExecutor.execute(eq("write_file"), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("wrote 12 bytes")));
        TurnOrchestrator orchestrator = orchestrator();

        orchestrator.runTurn("write the file");

        verify(confirmationPort).requestConfirmation(SESSION_ID, "write_file", "Write file: src/Main.java");
        assertEquals("wrote 12 bytes", toolMessages(orchestrator).get(0).getContent());
        assertEquals(Map.of("write_file", 1), orchestrator.getToolUsage());
    }

    @Test
    void shouldNotExecuteDeclinedTool() {
        when(llmPort.generate(any(LlmRequest.class)))
                .thenReturn(toolCalls(call("tc-1", "write_file")))
                .thenReturn(answer("Skipped."));
        when(confirmationPort.isAvailable()).thenReturn(true);
        when(confirmationPort.requestConfirmation(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(false));
        TurnOrchestrator orchestrator = orchestrator();

        orchestrator.runTurn("write the file");

        verify(toolExecutor, never()).execute(anyString(), anyMap());
        assertEquals(ToolFailureKind.CONFIRMATION_DENIED.name(),
                toolMessages(orchestrator).get(0).getMetadata().get("failureKind"));
    }

    @Test
    void shouldTreatUnavailableConfirmationAsDeclined() {
        when(llmPort.generate(any(LlmRequest.class)))
                .thenReturn(toolCalls(call("tc-1", "write_file")))
                .thenReturn(answer("Skipped."));
        TurnOrchestrator orchestrator = orchestrator();

        orchestrator.runTurn("write the file");

        verify(confirmationPort, never()).requestConfirmation(anyString(), anyString(), anyString());
        verify(toolExecutor, never()).execute(anyString(), anyMap());
    }

    @Test
    void shouldRunEveryToolWhenUnrestricted() {
        when(llmPort.generate(any(LlmRequest.class)))
                .thenReturn(toolCalls(call("tc-1", DELETE_FILE)))
                .thenReturn(answer("Deleted."));
        when(toolExecutor.execute(eq(DELETE_FILE), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("deleted")));
        TurnOrchestrator orchestrator = orchestrator(configBuilder()
                .permissionMode(PermissionMode.UNRESTRICTED)
                .build());

        orchestrator.runTurn("delete it");

        verify(toolExecutor).execute(eq(DELETE_FILE), anyMap());
        verify(confirmationPort, never()).requestConfirmation(anyString(), anyString(), anyString());
    }

    @Test
    void shouldAppendResultsInRequestOrder() {
        when(llmPort.generate(any(LlmRequest.class)))
                .thenReturn(toolCalls(call("tc-1", READ_FILE), call("tc-2", READ_FILE), call(null, READ_FILE)))
                .thenReturn(answer("Done."));
        when(toolExecutor.execute(eq(READ_FILE), anyMap()))
                .thenAnswer(invocation -> CompletableFuture.supplyAsync(() -> ToolResult.success("first"),
                        CompletableFuture.delayedExecutor(150, TimeUnit.MILLISECONDS)))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("second")))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("third")));
        TurnOrchestrator orchestrator = orchestrator();

        TurnResult result = orchestrator.runTurn("read the files");

        List<Message> messages = orchestrator.getHistory().messages();
        assertTrue(messages.get(1).hasToolCalls());
        List<Message> tools = toolMessages(orchestrator);
        assertEquals(List.of("first", "second", "third"), tools.stream().map(Message::getContent).toList());
        assertEquals("tc-1", tools.get(0).getToolCallId());
        assertEquals("tc-2", tools.get(1).getToolCallId());
        assertTrue(tools.get(2).getToolCallId().startsWith("call_"));
        assertEquals(messages.get(1).getToolCalls().get(2).getId(), tools.get(2).getToolCallId());
        assertEquals(3, result.toolExecutions());
        assertEquals(Map.of(READ_FILE, 3), orchestrator.getToolUsage());
    }

    @Test
    void shouldRejectSessionToolsOverCap() {
        when(llmPort.generate(any(LlmRequest.class)))
                .thenReturn(toolCalls(call("tc-1", PTY), call("tc-2", PTY)))
                .thenReturn(answer("One terminal only."));
        when(toolExecutor.execute(eq(PTY), anyMap()))
                .thenAnswer(invocation -> CompletableFuture.supplyAsync(() -> ToolResult.success("started"),
                        CompletableFuture.delayedExecutor(200, TimeUnit.MILLISECONDS)));
        TurnOrchestrator orchestrator = orchestrator(configBuilder().maxConcurrentSessionTools(1).build());

        orchestrator.runTurn("open two terminals");

        verify(toolExecutor, times(1)).execute(eq(PTY), anyMap());
        List<Message> tools = toolMessages(orchestrator);
        assertEquals("started", tools.get(0).getContent());
        assertEquals(ToolFailureKind.RESOURCE_EXHAUSTED.name(), tools.get(1).getMetadata().get("failureKind"));
        assertEquals(0, orchestrator.getToolRegistry().getSessionGuard().current());
    }

    @Test
    void shouldReportTimedOutTool() {
        when(llmPort.generate(any(LlmRequest.class)))
                .thenReturn(toolCalls(call("tc-1", READ_FILE)))
                .thenReturn(answer("Too slow."));
        when(toolExecutor.execute(eq(READ_FILE), anyMap())).thenReturn(new CompletableFuture<>());
        TurnOrchestrator orchestrator = orchestrator(configBuilder().toolTimeout(Duration.ofMillis(50)).build());

        orchestrator.runTurn("read it");

        assertEquals(ToolFailureKind.TIMEOUT.name(),
                toolMessages(orchestrator).get(0).getMetadata().get("failureKind"));
    }

    @Test
    void shouldRecordExecutorFailure() {
        when(llmPort.generate(any(LlmRequest.class)))
                .thenReturn(toolCalls(call("tc-1", READ_FILE)))
                .thenReturn(answer("Failed."));
        when(toolExecutor.execute(eq(READ_FILE), anyMap()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk error")));
        TurnOrchestrator orchestrator = orchestrator();

        orchestrator.runTurn("read it");

        Message tool = toolMessages(orchestrator).get(0);
        assertEquals(ToolFailureKind.EXECUTION_FAILED.name(), tool.getMetadata().get("failureKind"));
        assertTrue(tool.getContent().contains("disk error"));
    }

    @Test
    void shouldStopAtToolLoopLimit() {
        when(llmPort.generate(any(LlmRequest.class))).thenAnswer(invocation -> toolCalls(call(null, READ_FILE)));
        when(toolExecutor.execute(eq(READ_FILE), anyMap()))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(ToolResult.success("content")));
        TurnOrchestrator orchestrator = orchestrator(configBuilder().maxToolLoops(2).build());

        TurnResult result = orchestrator.runTurn("keep reading");

        assertEquals(TurnOrchestrator.STOP_MAX_TOOL_LOOPS, result.stopReason());
        assertEquals(2, result.llmCalls());
        assertEquals(TurnState.IDLE, orchestrator.getState());
        List<Message> messages = orchestrator.getHistory().messages();
        assertTrue(messages.get(messages.size() - 1).isSystemMessage());
    }

    @Test
    void shouldBecomeFatalAfterRetriesExhausted() {
        when(llmPort.generate(any(LlmRequest.class)))
                .thenAnswer(invocation -> CompletableFuture.failedFuture(
                        ProviderException.transientError("connection reset")));
        TurnOrchestrator orchestrator = orchestrator();

        assertThrows(ProviderFailureException.class, () -> orchestrator.runTurn("hi"));

        verify(llmPort, times(3)).generate(any(LlmRequest.class));
        assertEquals(TurnState.FATAL, orchestrator.getState());
        assertThrows(IllegalStateException.class, () -> orchestrator.runTurn("again"));
        assertEquals(3, orchestrator.getRetryStats().getTotalAttempts());
    }

    @Test
    void shouldRecoverFromContextOverflowOnce() {
        when(llmPort.generate(any(LlmRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(
                        ProviderException.transientError("This model's maximum context length is 8192 tokens")))
                .thenReturn(answer("Recovered."));
        TurnOrchestrator orchestrator = orchestrator();

        TurnResult result = orchestrator.runTurn("summarize everything");

        assertEquals("Recovered.", result.finalAnswer());
        assertEquals(1, orchestrator.getHistory().getCompactionCount());
        assertTrue(orchestrator.getHistory().getSummary().isPresent());
        assertEquals(TurnState.IDLE, orchestrator.getState());
    }

    @Test
    void shouldFailWhenOverflowPersists() {
        when(llmPort.generate(any(LlmRequest.class)))
                .thenAnswer(invocation -> CompletableFuture.failedFuture(
                        ProviderException.transientError("context window exceeded")));
        TurnOrchestrator orchestrator = orchestrator();

        assertThrows(ProviderFailureException.class, () -> orchestrator.runTurn("summarize everything"));

        verify(llmPort, times(2)).generate(any(LlmRequest.class));
        assertEquals(TurnState.FATAL, orchestrator.getState());
    }

    @Test
    void shouldKeepGoingWhenSnapshotFails() {
        when(llmPort.generate(any(LlmRequest.class))).thenReturn(answer("ok"));
        when(snapshotManager.save(anyInt(), any(AgentState.class))).thenThrow(new SnapshotException("disk full"));
        TurnOrchestrator orchestrator = orchestrator();

        TurnResult result = orchestrator.runTurn("hi");

        assertNull(result.snapshot());
        assertEquals(TurnState.IDLE, orchestrator.getState());
    }

    @Test
    void shouldSkipSnapshotsWhenDisabled() {
        when(llmPort.generate(any(LlmRequest.class))).thenReturn(answer("ok"));
        SessionConfig config = configBuilder()
                .snapshot(SnapshotConfig.builder().enabled(false).build())
                .build();

        orchestrator(config).runTurn("hi");

        verify(snapshotManager, never()).save(anyInt(), any(AgentState.class));
    }

    @Test
    void shouldCleanUpOldSnapshotsAfterSave() {
        when(llmPort.generate(any(LlmRequest.class))).thenReturn(answer("ok"));

        orchestrator().runTurn("hi");

        verify(snapshotManager).cleanup(SESSION_ID, 50);
    }

    @Test
    void shouldCancelPendingToolsOnInterrupt() throws Exception {
        CountDownLatch toolStarted = new CountDownLatch(1);
        when(llmPort.generate(any(LlmRequest.class))).thenReturn(toolCalls(call("tc-1", READ_FILE)));
        when(toolExecutor.execute(eq(READ_FILE), anyMap())).thenAnswer(invocation -> {
            toolStarted.countDown();
            return new CompletableFuture<ToolResult>();
        });
        TurnOrchestrator orchestrator = orchestrator();

        CompletableFuture<TurnResult> turn = CompletableFuture.supplyAsync(() -> orchestrator.runTurn("read it"));
        assertTrue(toolStarted.await(5, TimeUnit.SECONDS));
        orchestrator.interrupt();
        TurnResult result = turn.get(5, TimeUnit.SECONDS);

        assertEquals(TurnOrchestrator.STOP_INTERRUPTED, result.stopReason());
        assertEquals(ToolFailureKind.CANCELLED.name(),
                toolMessages(orchestrator).get(0).getMetadata().get("failureKind"));
        assertEquals(TurnState.IDLE, orchestrator.getState());
        verify(llmPort, times(1)).generate(any(LlmRequest.class));
    }

    @Test
    void shouldKeepCommittedResultOnInterrupt() throws Exception {
        CountDownLatch secondStarted = new CountDownLatch(1);
        when(llmPort.generate(any(LlmRequest.class)))
                .thenReturn(toolCalls(call("tc-1", READ_FILE), call("tc-2", READ_FILE)));
        when(toolExecutor.execute(eq(READ_FILE), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.builder()
                        .success(true)
                        .output("written")
                        .sideEffectCommitted(true)
                        .build()))
                .thenAnswer(invocation -> {
                    secondStarted.countDown();
                    return new CompletableFuture<ToolResult>();
                });
        TurnOrchestrator orchestrator = orchestrator();

        CompletableFuture<TurnResult> turn = CompletableFuture.supplyAsync(() -> orchestrator.runTurn("write both"));
        assertTrue(secondStarted.await(5, TimeUnit.SECONDS));
        orchestrator.interrupt();
        TurnResult result = turn.get(5, TimeUnit.SECONDS);

        assertEquals(TurnOrchestrator.STOP_INTERRUPTED, result.stopReason());
        List<Message> tools = toolMessages(orchestrator);
        assertEquals(2, tools.size());
        assertEquals("tc-1", tools.get(0).getToolCallId());
        assertEquals("written", tools.get(0).getContent());
        assertEquals(Boolean.TRUE, tools.get(0).getMetadata().get("success"));
        assertEquals(Boolean.TRUE, tools.get(0).getMetadata().get("sideEffectCommitted"));
        assertFalse(tools.get(0).getMetadata().containsKey("failureKind"));
        assertEquals("tc-2", tools.get(1).getToolCallId());
        assertEquals(ToolFailureKind.CANCELLED.name(), tools.get(1).getMetadata().get("failureKind"));
        assertEquals(TurnState.IDLE, orchestrator.getState());
    }

    @Test
    void shouldStopWaitingForProviderOnInterrupt() throws Exception {
        CountDownLatch providerCalled = new CountDownLatch(1);
        when(llmPort.generate(any(LlmRequest.class))).thenAnswer(invocation -> {
            providerCalled.countDown();
            return new CompletableFuture<LlmResponse>();
        });
        TurnOrchestrator orchestrator = orchestrator();

        CompletableFuture<TurnResult> turn = CompletableFuture.supplyAsync(() -> orchestrator.runTurn("hi"));
        assertTrue(providerCalled.await(5, TimeUnit.SECONDS));
        orchestrator.interrupt();
        TurnResult result = turn.get(5, TimeUnit.SECONDS);

        assertEquals(TurnOrchestrator.STOP_INTERRUPTED, result.stopReason());
        assertNull(result.finalAnswer());
        List<Message> messages = orchestrator.getHistory().messages();
        assertTrue(messages.get(messages.size() - 1).isSystemMessage());
        assertEquals(TurnState.IDLE, orchestrator.getState());
    }

    @Test
    void shouldRejectTurnsAfterTerminate() {
        TurnOrchestrator orchestrator = orchestrator();

        orchestrator.terminate();
        orchestrator.terminate();

        assertEquals(TurnState.TERMINATED, orchestrator.getState());
        assertThrows(IllegalStateException.class, () -> orchestrator.runTurn("hi"));
        verify(llmPort, never()).generate(any(LlmRequest.class));
    }

    @Test
    void shouldRestoreHistoryOnRollback() {
        when(llmPort.generate(any(LlmRequest.class))).thenReturn(answer("ok"));
        TurnOrchestrator orchestrator = orchestrator();
        orchestrator.runTurn("first");
        orchestrator.runTurn("second");
        Message restoredMessage = Message.builder().id("m-1").role("user").content("first").timestamp(NOW).build();
        AgentState saved = AgentState.builder()
                .sessionId(SESSION_ID)
                .turnNumber(1)
                .lastModel("restored-model")
                .messages(List.of(restoredMessage))
                .toolUsage(Map.of(READ_FILE, 2))
                .build();
        when(snapshotManager.load(SESSION_ID, 1)).thenReturn(saved);

        AgentState restored = orchestrator.rollbackTo(1);

        assertSame(saved, restored);
        assertEquals(1, orchestrator.getTurnNumber());
        assertEquals(List.of(restoredMessage), orchestrator.getHistory().messages());
        assertEquals(Map.of(READ_FILE, 2), orchestrator.getToolUsage());
        verify(snapshotManager).discardAfter(SESSION_ID, 1);
        assertEquals(2, orchestrator.runTurn("again").turnNumber());
    }

    @Test
    void shouldDropAbandonedSnapshotsOnRollback() {
        when(llmPort.generate(any(LlmRequest.class))).thenAnswer(invocation -> answer("ok"));
        CoderProperties properties = new CoderProperties();
        properties.getSnapshots().setBasePath(tempDir.toString());
        LocalSnapshotStorageAdapter storage = new LocalSnapshotStorageAdapter(properties);
        storage.init();
        SnapshotManager manager = new SnapshotManager(storage, AutoConfiguration.objectMapper(), clock);
        TurnOrchestrator orchestrator = new TurnOrchestrator(SESSION_ID, configBuilder().build(), services(manager));
        for (String request : List.of("one", "two", "three", "four")) {
            orchestrator.runTurn(request);
        }

        orchestrator.rollbackTo(2);

        assertEquals(List.of(1, 2), manager.list(SESSION_ID).stream().map(Snapshot::getTurnNumber).toList());
        assertEquals(3, orchestrator.runTurn("five").turnNumber());
        assertEquals(List.of(1, 2, 3), manager.list(SESSION_ID).stream().map(Snapshot::getTurnNumber).toList());
        assertEquals(List.of("one", "ok", "two", "ok", "five", "ok"),
                manager.load(SESSION_ID, 3).getMessages().stream().map(Message::getContent).toList());
    }

    @Test
    void shouldRecordRouteAndToolCallsInTrajectory() {
        when(llmPort.generate(any(LlmRequest.class)))
                .thenReturn(toolCalls(call("tc-1", READ_FILE), call("tc-2", DELETE_FILE)))
                .thenReturn(answer("Done."));
        when(toolExecutor.execute(eq(READ_FILE), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("content")));
        TurnOrchestrator orchestrator = orchestrator();

        orchestrator.runTurn("read then delete");

        ArgumentCaptor<TrajectoryRecord> captor = ArgumentCaptor.forClass(TrajectoryRecord.class);
        verify(trajectory, times(3)).append(captor.capture());
        List<TrajectoryRecord> records = captor.getAllValues();
        TrajectoryRecord route = records.get(0);
        assertEquals(TrajectoryRecord.KIND_ROUTE, route.getKind());
        assertEquals(SESSION_ID, route.getSessionId());
        assertEquals(1, route.getTurn());
        assertEquals(DEFAULT_MODEL, route.getSelectedModel());
        assertEquals("simple", route.getTaskClass());
        assertEquals("read then delete", route.getInputPreview());
        assertEquals(NOW, route.getTimestamp());
        TrajectoryRecord read = records.get(1);
        assertEquals(TrajectoryRecord.KIND_TOOL, read.getKind());
        assertEquals(READ_FILE, read.getToolName());
        assertEquals(Map.of("path", "src/Main.java"), read.getArguments());
        assertEquals(Boolean.TRUE, read.getSuccess());
        assertNull(read.getFailureKind());
        TrajectoryRecord delete = records.get(2);
        assertEquals(DELETE_FILE, delete.getToolName());
        assertEquals(Boolean.FALSE, delete.getSuccess());
        assertEquals(ToolFailureKind.POLICY_DENIED.name(), delete.getFailureKind());
    }

    @Test
    void shouldTruncateTrajectoryInputPreview() {
        when(llmPort.generate(any(LlmRequest.class))).thenReturn(answer("ok"));

        orchestrator().runTurn("a".repeat(500));

        ArgumentCaptor<TrajectoryRecord> captor = ArgumentCaptor.forClass(TrajectoryRecord.class);
        verify(trajectory).append(captor.capture());
        assertEquals(TurnOrchestrator.TRAJECTORY_PREVIEW_CHARS, captor.getValue().getInputPreview().length());
    }

    @Test
    void shouldFinishTurnWhenTrajectoryFails() {
        when(llmPort.generate(any(LlmRequest.class))).thenReturn(answer("Hello!"));
        when(trajectory.append(any(TrajectoryRecord.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));

        TurnResult result = orchestrator().runTurn("hi");

        assertEquals("Hello!", result.finalAnswer());
        assertNull(result.stopReason());
    }
}
