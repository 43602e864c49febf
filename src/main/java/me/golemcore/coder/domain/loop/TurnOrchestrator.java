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

import me.golemcore.coder.domain.exception.ProviderFailureException;
import me.golemcore.coder.domain.exception.ResourceExhaustedException;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.CompactionStatistics;
import me.golemcore.coder.domain.model.ConversationHistory;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.LlmResponse;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.MessageType;
import me.golemcore.coder.domain.model.RetryStats;
import me.golemcore.coder.domain.model.RouteDecision;
import me.golemcore.coder.domain.model.SessionConfig;
import me.golemcore.coder.domain.model.Snapshot;
import me.golemcore.coder.domain.model.ToolDecision;
import me.golemcore.coder.domain.model.ToolFailureKind;
import me.golemcore.coder.domain.model.ToolResult;
import me.golemcore.coder.domain.model.TrajectoryRecord;
import me.golemcore.coder.domain.model.TurnResult;
import me.golemcore.coder.domain.model.TurnState;
import me.golemcore.coder.domain.service.ToolPolicyGuard;
import me.golemcore.coder.domain.service.ToolRegistry;
import me.golemcore.coder.domain.system.ProviderErrorClassifier;
import me.golemcore.coder.port.outbound.TrajectoryPort;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-session turn state machine.
 *
 * <p>
 * A turn moves through {@code IDLE -> ROUTING -> AWAITING_PROVIDER ->
 * INTERPRETING_RESPONSE -> EXECUTING_TOOLS -> COMPACTING -> SNAPSHOTTING ->
 * IDLE}, looping back to {@code AWAITING_PROVIDER} while the model keeps
 * requesting tools. {@code TERMINATED} and {@code FATAL} are final.
 *
 * <p>
 * The orchestrator owns the session's {@link ConversationHistory} and
 * {@link ToolRegistry}; the services in {@link TurnServices} only receive them
 * for the duration of a call. Only one turn runs at a time per session.
 *
 * <p>
 * Every tool call requested by the model gets exactly one tool result, and the
 * assistant message with its results is appended as one block in request
 * order, whatever order the tools complete in.
 */
@Slf4j
public class TurnOrchestrator {

    static final String STOP_MAX_TOOL_LOOPS = "max_tool_loops";
    static final String STOP_INTERRUPTED = "interrupted";
    static final int TRAJECTORY_PREVIEW_CHARS = 120;

    private final String sessionId;
    private final SessionConfig config;
    private final TurnServices services;
    private final ConversationHistory history;
    private final ToolRegistry registry;
    private final ToolPolicyGuard policyGuard;
    private final RetryStats retryStats = new RetryStats();
    private final Map<String, Integer> toolUsage = new ConcurrentHashMap<>();

    private final ReentrantLock turnLock = new ReentrantLock();
    private final AtomicReference<TurnState> state = new AtomicReference<>(TurnState.IDLE);
    private final AtomicReference<CompletableFuture<?>> inFlightProvider = new AtomicReference<>();
    private final List<CompletableFuture<ToolResult>> inFlightTools = new CopyOnWriteArrayList<>();
    private volatile boolean interruptRequested;

    private int turnNumber;
    private String lastModel;

    public TurnOrchestrator(String sessionId, SessionConfig config, TurnServices services) {
        this.sessionId = sessionId;
        this.config = config;
        this.services = services;
        this.history = new ConversationHistory(services.clock().instant());
        this.registry = new ToolRegistry(config.getTools(), config.getMaxConcurrentSessionTools());
        this.policyGuard = new ToolPolicyGuard(config.getToolPolicy(), config.getPermissionMode(), registry);
        this.lastModel = config.getRouter().getDefaultModel();
    }

    /**
     * Run one turn for a user request.
     *
     * @throws ProviderFailureException
     *             when the provider keeps failing after retries and context
     *             recovery; the orchestrator is FATAL afterwards
     * @throws IllegalStateException
     *             when the session is terminal or another turn is running
     */
    public TurnResult runTurn(String userText) {
        if (!turnLock.tryLock()) {
            throw new IllegalStateException("A turn is already running for session " + sessionId);
        }
        try {
            if (state.get().isTerminal()) {
                throw new IllegalStateException("Session " + sessionId + " is " + state.get());
            }
            interruptRequested = false;
            turnNumber++;
            return executeTurn(userText);
        } finally {
            inFlightProvider.set(null);
            inFlightTools.clear();
            turnLock.unlock();
        }
    }

    private TurnResult executeTurn(String userText) {
        services.compactionEngine().addMessage(history, userText, MessageType.USER_MESSAGE);

        transition(TurnState.ROUTING);
        RouteDecision route = services.taskRouter().route(config.getRouter(), userText,
                config.getRouter().getDefaultModel());
        lastModel = route.model();
        log.debug("[Turn] Session {} turn {} routed as {} to {}", sessionId, turnNumber, route.taskClass(),
                route.model());
        recordRoute(route, userText);

        int llmCalls = 0;
        int toolExecutions = 0;
        boolean compacted = false;
        String finalAnswer = null;
        String stopReason = null;

        try {
            for (int loop = 0;; loop++) {
                if (loop >= config.getMaxToolLoops()) {
                    stopReason = STOP_MAX_TOOL_LOOPS;
                    appendNote("Tool loop limit reached (" + config.getMaxToolLoops()
                            + " model calls with tools). Stopping this turn.");
                    log.warn("[Turn] Session {} hit the tool loop limit ({})", sessionId, config.getMaxToolLoops());
                    break;
                }

                transition(TurnState.AWAITING_PROVIDER);
                LlmResponse response = callProvider(route.model());
                llmCalls++;

                transition(TurnState.INTERPRETING_RESPONSE);
                if (response == null || !response.hasToolCalls()) {
                    finalAnswer = response != null ? response.getContent() : null;
                    services.compactionEngine().addMessage(history, Message.builder()
                            .content(finalAnswer != null ? finalAnswer : "")
                            .metadata(modelMetadata(route.model()))
                            .build(), MessageType.ASSISTANT_MESSAGE);
                    break;
                }

                transition(TurnState.EXECUTING_TOOLS);
                List<Message.ToolCall> toolCalls = normalizeToolCalls(response.getToolCalls());
                List<Message> block = new ArrayList<>(toolCalls.size() + 1);
                block.add(Message.builder()
                        .role(MessageType.ASSISTANT_MESSAGE.getRole())
                        .type(MessageType.ASSISTANT_MESSAGE)
                        .content(response.getContent())
                        .toolCalls(toolCalls)
                        .metadata(modelMetadata(route.model()))
                        .build());
                List<ToolResult> results = executeTools(toolCalls);
                for (int i = 0; i < toolCalls.size(); i++) {
                    block.add(toToolMessage(toolCalls.get(i), results.get(i)));
                    recordToolCall(toolCalls.get(i), results.get(i));
                }
                services.compactionEngine().addMessages(history, block);
                toolExecutions += toolCalls.size();

                if (compactIfDue()) {
                    compacted = true;
                }
                if (interruptRequested) {
                    stopReason = STOP_INTERRUPTED;
                    break;
                }
            }
        } catch (CancellationException e) {
            stopReason = STOP_INTERRUPTED;
            appendNote("Turn interrupted by user.");
            log.info("[Turn] Session {} turn {} interrupted", sessionId, turnNumber);
        } catch (ProviderFailureException e) {
            transition(TurnState.FATAL);
            log.error("[Turn] Session {} failed: {}", sessionId, e.getMessage());
            throw e;
        }

        if (compactIfDue()) {
            compacted = true;
        }
        Snapshot snapshot = snapshotIfEnabled();
        transition(TurnState.IDLE);

        return TurnResult.builder()
                .turnNumber(turnNumber)
                .model(route.model())
                .taskClass(route.taskClass())
                .finalAnswer(finalAnswer)
                .llmCalls(llmCalls)
                .toolExecutions(toolExecutions)
                .compacted(compacted)
                .snapshot(snapshot)
                .stopReason(stopReason)
                .build();
    }

    /**
     * Provider call through the retry manager. A context overflow triggers one
     * forced compaction and one more call.
     */
    private LlmResponse callProvider(String model) {
        try {
            return requestCompletion(model);
        } catch (ProviderFailureException e) {
            if (ProviderErrorClassifier.isCancellation(e.getCause())) {
                throw new CancellationException("Provider call cancelled");
            }
            if (!ProviderErrorClassifier.isContextOverflow(e.getCause())) {
                throw e;
            }
            log.warn("[Turn] Context overflow in session {}, forcing compaction and retrying once", sessionId);
            transition(TurnState.COMPACTING);
            services.compactionEngine().forceCompaction(history, config.getCompaction());
            transition(TurnState.AWAITING_PROVIDER);
            try {
                return requestCompletion(model);
            } catch (ProviderFailureException second) {
                throw new ProviderFailureException("Provider call failed after context overflow recovery: "
                        + second.getMessage(), e.getAttempts() + second.getAttempts(), second.getCause());
            }
        }
    }

    private LlmResponse requestCompletion(String model) {
        return services.retryManager().callWithFallback(config.getRetry(), selectedModel -> {
            if (interruptRequested) {
                throw new CancellationException("Turn interrupted");
            }
            CompletableFuture<LlmResponse> future = services.llmPort().generate(buildRequest(selectedModel));
            inFlightProvider.set(future);
            if (interruptRequested) {
                future.cancel(true);
            }
            return future;
        }, model, retryStats);
    }

    private LlmRequest buildRequest(String model) {
        return LlmRequest.builder()
                .model(model)
                .systemPrompt(config.getSystemPrompt())
                .messages(history.messages())
                .tools(registry.all())
                .maxTokens(config.getRouter().getBudgets().getMaxTokens())
                .sessionId(sessionId)
                .build();
    }

    /**
     * Authorize and run the tool calls of one model response. Authorization and
     * confirmation happen in request order; authorized calls run concurrently,
     * at most {@code maxParallelTools} at a time.
     */
    private List<ToolResult> executeTools(List<Message.ToolCall> toolCalls) {
        int count = toolCalls.size();
        List<CompletableFuture<ToolResult>> outcomes = new ArrayList<>(count);
        Semaphore parallelism = new Semaphore(config.getRouter().getBudgets().getMaxParallelTools());

        for (Message.ToolCall toolCall : toolCalls) {
            ToolResult rejection = interruptRequested ? cancelled(toolCall) : authorize(toolCall);
            if (rejection != null) {
                outcomes.add(CompletableFuture.completedFuture(rejection));
                continue;
            }
            try {
                parallelism.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                policyGuard.releaseSlot(toolCall.getName());
                interruptRequested = true;
                outcomes.add(CompletableFuture.completedFuture(cancelled(toolCall)));
                continue;
            }
            outcomes.add(dispatch(toolCall, parallelism));
        }

        List<ToolResult> results = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ToolResult result = outcomes.get(i).join();
            if (interruptRequested && !result.isSideEffectCommitted()) {
                result = cancelled(toolCalls.get(i));
            }
            results.add(result);
        }
        return results;
    }

    /**
     * @return a failed result when the call may not run, null when it may
     */
    private ToolResult authorize(Message.ToolCall toolCall) {
        String toolName = toolCall.getName();
        ToolDecision decision = policyGuard.authorize(toolName);
        switch (decision) {
        case DENY -> {
            log.info("[ToolPolicy] Denied {} in session {}", toolName, sessionId);
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                    "Tool '" + toolName + "' is denied by the tool policy and was not executed");
        }
        case PROMPT -> {
            if (!confirm(toolCall)) {
                log.info("[ToolPolicy] Confirmation declined for {} in session {}", toolName, sessionId);
                return ToolResult.failure(ToolFailureKind.CONFIRMATION_DENIED,
                        "User declined tool '" + toolName + "'; it was not executed");
            }
        }
        case ALLOW -> {
            // runs below
        }
        }
        try {
            policyGuard.acquireSlot(toolName);
            return null;
        } catch (ResourceExhaustedException e) {
            log.warn("[ToolPolicy] {} rejected in session {}: {}", toolName, sessionId, e.getMessage());
            return ToolResult.failure(ToolFailureKind.RESOURCE_EXHAUSTED, e.getMessage());
        }
    }

    private boolean confirm(Message.ToolCall toolCall) {
        if (!services.confirmationPort().isAvailable()) {
            log.debug("[ToolPolicy] No confirmation available for {}, treating as declined", toolCall.getName());
            return false;
        }
        String description = services.actionDescriber().describeAction(toolCall);
        try {
            Boolean approved = services.confirmationPort()
                    .requestConfirmation(sessionId, toolCall.getName(), description)
                    .join();
            return Boolean.TRUE.equals(approved);
        } catch (RuntimeException e) {
            log.error("[ToolPolicy] Confirmation request failed for {}: {}", toolCall.getName(),
                    ProviderErrorClassifier.describe(e));
            return false;
        }
    }

    private CompletableFuture<ToolResult> dispatch(Message.ToolCall toolCall, Semaphore parallelism) {
        String toolName = toolCall.getName();
        toolUsage.merge(toolName, 1, Integer::sum);
        CompletableFuture<ToolResult> execution;
        try {
            Map<String, Object> arguments = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
            execution = services.toolExecutor().execute(toolName, arguments);
            if (execution == null) {
                execution = CompletableFuture.failedFuture(
                        new IllegalStateException("Tool executor returned no result"));
            }
        } catch (RuntimeException e) {
            execution = CompletableFuture.failedFuture(e);
        }
        inFlightTools.add(execution);
        if (interruptRequested) {
            execution.cancel(true);
        }

        long timeoutMillis = config.getToolTimeout().toMillis();
        return execution
                .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .handle((result, error) -> toOutcome(toolCall, result, error))
                .whenComplete((result, error) -> {
                    policyGuard.releaseSlot(toolName);
                    parallelism.release();
                });
    }

    private ToolResult toOutcome(Message.ToolCall toolCall, ToolResult result, Throwable error) {
        if (error == null) {
            return result != null
                    ? result
                    : ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
        }
        Throwable cause = ProviderErrorClassifier.unwrap(error);
        if (cause instanceof TimeoutException) {
            log.warn("[Turn] Tool {} timed out after {}ms", toolCall.getName(), config.getToolTimeout().toMillis());
            return ToolResult.failure(ToolFailureKind.TIMEOUT,
                    "Tool '" + toolCall.getName() + "' timed out after " + config.getToolTimeout().toSeconds() + "s");
        }
        if (cause instanceof CancellationException) {
            return cancelled(toolCall);
        }
        log.warn("[Turn] Tool {} failed: {}", toolCall.getName(), ProviderErrorClassifier.describe(cause));
        return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                "Tool execution failed: " + ProviderErrorClassifier.describe(cause));
    }

    private static ToolResult cancelled(Message.ToolCall toolCall) {
        return ToolResult.failure(ToolFailureKind.CANCELLED,
                "Tool '" + toolCall.getName() + "' was cancelled by an interrupt");
    }

    private Message toToolMessage(Message.ToolCall toolCall, ToolResult result) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("success", result.isSuccess());
        if (result.getFailureKind() != null) {
            metadata.put("failureKind", result.getFailureKind().name());
        }
        if (result.isSideEffectCommitted()) {
            metadata.put("sideEffectCommitted", true);
        }
        return Message.builder()
                .role(MessageType.TOOL_RESULT.getRole())
                .type(MessageType.TOOL_RESULT)
                .toolCallId(toolCall.getId())
                .toolName(toolCall.getName())
                .content(result.toMessageContent())
                .metadata(metadata)
                .build();
    }

    private List<Message.ToolCall> normalizeToolCalls(List<Message.ToolCall> toolCalls) {
        List<Message.ToolCall> normalized = new ArrayList<>(toolCalls.size());
        for (Message.ToolCall toolCall : toolCalls) {
            normalized.add(toolCall.getId() != null && !toolCall.getId().isBlank()
                    ? toolCall
                    : Message.ToolCall.builder()
                            .id("call_" + UUID.randomUUID())
                            .name(toolCall.getName())
                            .arguments(toolCall.getArguments())
                            .build());
        }
        return normalized;
    }

    private boolean compactIfDue() {
        if (!services.compactionEngine().shouldCompact(history, config.getCompaction())) {
            return false;
        }
        transition(TurnState.COMPACTING);
        return services.compactionEngine().compactMessagesIntelligently(history, config.getCompaction())
                .messagesCompacted() > 0;
    }

    private Snapshot snapshotIfEnabled() {
        if (!config.getSnapshot().isEnabled()) {
            return null;
        }
        transition(TurnState.SNAPSHOTTING);
        try {
            Snapshot snapshot = services.snapshotManager().save(turnNumber, captureState());
            services.snapshotManager().cleanup(sessionId, config.getSnapshot().getMaxSnapshots());
            return snapshot;
        } catch (RuntimeException e) {
            log.warn("[Snapshot] Failed to snapshot turn {} of session {}: {}", turnNumber, sessionId,
                    e.getMessage());
            return null;
        }
    }

    private void recordRoute(RouteDecision route, String userText) {
        String preview = userText != null && userText.length() > TRAJECTORY_PREVIEW_CHARS
                ? userText.substring(0, TRAJECTORY_PREVIEW_CHARS)
                : userText;
        record(TrajectoryRecord.builder()
                .kind(TrajectoryRecord.KIND_ROUTE)
                .sessionId(sessionId)
                .turn(turnNumber)
                .timestamp(services.clock().instant())
                .selectedModel(route.model())
                .taskClass(route.taskClass().name().toLowerCase(Locale.ROOT))
                .inputPreview(preview)
                .build());
    }

    private void recordToolCall(Message.ToolCall toolCall, ToolResult result) {
        record(TrajectoryRecord.builder()
                .kind(TrajectoryRecord.KIND_TOOL)
                .sessionId(sessionId)
                .turn(turnNumber)
                .timestamp(services.clock().instant())
                .toolName(toolCall.getName())
                .arguments(toolCall.getArguments() != null ? toolCall.getArguments() : Map.of())
                .success(result.isSuccess())
                .failureKind(result.getFailureKind() != null ? result.getFailureKind().name() : null)
                .build());
    }

    // Audit failures never fail the turn.
    private void record(TrajectoryRecord record) {
        TrajectoryPort trajectory = services.trajectory();
        if (trajectory == null) {
            return;
        }
        try {
            trajectory.append(record).exceptionally(e -> {
                log.warn("[Trajectory] Failed to record {} for session {}: {}", record.getKind(), sessionId,
                        ProviderErrorClassifier.describe(e));
                return null;
            });
        } catch (RuntimeException e) {
            log.warn("[Trajectory] Failed to record {} for session {}: {}", record.getKind(), sessionId,
                    ProviderErrorClassifier.describe(e));
        }
    }

    private AgentState captureState() {
        return history.exclusively(() -> AgentState.builder()
                .sessionId(sessionId)
                .turnNumber(turnNumber)
                .lastModel(lastModel)
                .messages(history.retainedMessages())
                .summary(history.getSummary().orElse(null))
                .toolUsage(Map.copyOf(toolUsage))
                .compactionCount(history.getCompactionCount())
                .lastCompactionTime(history.getLastCompactionTime())
                .build());
    }

    /**
     * Restore history and turn counter from the snapshot of an earlier turn.
     *
     * @throws me.golemcore.coder.domain.exception.SnapshotNotFoundException
     *             when the turn has no snapshot
     */
    public AgentState rollbackTo(int turn) {
        if (!turnLock.tryLock()) {
            throw new IllegalStateException("Cannot roll back while a turn is running in session " + sessionId);
        }
        try {
            if (state.get().isTerminal()) {
                throw new IllegalStateException("Session " + sessionId + " is " + state.get());
            }
            AgentState restored = services.snapshotManager().load(sessionId, turn);
            history.restore(restored.getMessages() != null ? restored.getMessages() : List.of(),
                    restored.getSummary(), restored.getCompactionCount(), restored.getLastCompactionTime());
            turnNumber = restored.getTurnNumber();
            lastModel = restored.getLastModel() != null ? restored.getLastModel() : lastModel;
            toolUsage.clear();
            if (restored.getToolUsage() != null) {
                toolUsage.putAll(restored.getToolUsage());
            }
            try {
                services.snapshotManager().discardAfter(sessionId, turn);
            } catch (RuntimeException e) {
                log.warn("[Snapshot] Failed to discard snapshots after turn {} of session {}: {}", turn, sessionId,
                        e.getMessage());
            }
            log.info("[Turn] Session {} rolled back to turn {}", sessionId, turn);
            return restored;
        } finally {
            turnLock.unlock();
        }
    }

    /**
     * Abort the in-flight provider call and tool executions of the current turn.
     * Tool results that already committed a side effect are kept; every other
     * pending call is recorded as cancelled. The session stays usable.
     */
    public void interrupt() {
        interruptRequested = true;
        CompletableFuture<?> provider = inFlightProvider.get();
        if (provider != null) {
            provider.cancel(true);
        }
        for (CompletableFuture<ToolResult> tool : inFlightTools) {
            tool.cancel(true);
        }
        log.info("[Turn] Interrupt requested for session {}", sessionId);
    }

    /**
     * End the session. Further turns are rejected.
     */
    public void terminate() {
        TurnState previous = state.getAndUpdate(current -> current.isTerminal() ? current : TurnState.TERMINATED);
        if (!previous.isTerminal()) {
            interrupt();
            log.info("[Turn] Session {} terminated", sessionId);
        }
    }

    private void transition(TurnState next) {
        state.getAndUpdate(current -> current.isTerminal() ? current : next);
    }

    private void appendNote(String text) {
        services.compactionEngine().addMessage(history, text, MessageType.SYSTEM_NOTE);
    }

    private static Map<String, Object> modelMetadata(String model) {
        return model != null ? Map.of("model", model) : Map.of();
    }

    public TurnState getState() {
        return state.get();
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionConfig getConfig() {
        return config;
    }

    public ConversationHistory getHistory() {
        return history;
    }

    public ToolRegistry getToolRegistry() {
        return registry;
    }

    public CompactionStatistics getStatistics() {
        return services.compactionEngine().getStatistics(history);
    }

    public RetryStats getRetryStats() {
        return retryStats;
    }

    public int getTurnNumber() {
        return turnNumber;
    }

    public Map<String, Integer> getToolUsage() {
        return Map.copyOf(toolUsage);
    }
}
