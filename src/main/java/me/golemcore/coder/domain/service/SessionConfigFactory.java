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

import me.golemcore.coder.domain.exception.ConfigurationException;
import me.golemcore.coder.domain.model.CompactionConfig;
import me.golemcore.coder.domain.model.PermissionMode;
import me.golemcore.coder.domain.model.RetryConfig;
import me.golemcore.coder.domain.model.RouterConfig;
import me.golemcore.coder.domain.model.SessionConfig;
import me.golemcore.coder.domain.model.SnapshotConfig;
import me.golemcore.coder.domain.model.TaskClass;
import me.golemcore.coder.domain.model.ToolDecision;
import me.golemcore.coder.domain.model.ToolPolicy;
import me.golemcore.coder.domain.model.ToolRegistration;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns the bound {@code coder.*} properties into a validated, immutable
 * {@link SessionConfig}. Invalid values fail session creation with
 * {@link ConfigurationException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionConfigFactory {

    private static final long BYTES_PER_MB = 1024L * 1024;

    private final CoderProperties properties;

    public SessionConfig create() {
        CoderProperties.ToolPolicyProperties tools = properties.getTools();
        SessionConfig config = SessionConfig.builder()
                .compaction(compaction(properties.getCompaction()))
                .toolPolicy(toolPolicy(tools))
                .permissionMode(permissionMode(tools.getPermissionMode()))
                .router(router(properties.getRouter()))
                .retry(retry(properties.getRetry()))
                .snapshot(snapshot(properties.getSnapshots()))
                .tools(registrations(tools))
                .maxConcurrentSessionTools(require(tools.getMaxConcurrentSessions(), 0,
                        "tools.max-concurrent-sessions"))
                .maxToolLoops(require(properties.getTurn().getMaxToolLoops(), 1, "turn.max-tool-loops"))
                .toolTimeout(positive(tools.getTimeout(), "tools.timeout"))
                .systemPrompt(properties.getTurn().getSystemPrompt())
                .build();
        if (config.getPermissionMode() == PermissionMode.UNRESTRICTED) {
            log.warn("[Config] Permission mode is UNRESTRICTED: every tool call is allowed");
        }
        return config;
    }

    private CompactionConfig compaction(CoderProperties.CompactionProperties props) {
        double confidence = props.getMinContextConfidence();
        if (confidence < 0.0 || confidence > 1.0) {
            throw new ConfigurationException(
                    "compaction.min-context-confidence must be within [0, 1]: " + confidence);
        }
        return CompactionConfig.builder()
                .maxUncompressedMessages(require(props.getMaxUncompressedMessages(), 1,
                        "compaction.max-uncompressed-messages"))
                .maxMessageAge(positive(props.getMaxMessageAge(), "compaction.max-message-age"))
                .maxMemoryBytes(require(props.getMaxMemoryMb(), 1, "compaction.max-memory-mb") * BYTES_PER_MB)
                .compactionInterval(positive(props.getCompactionInterval(), "compaction.compaction-interval"))
                .minContextConfidence(confidence)
                .maxContextAge(positive(props.getMaxContextAge(), "compaction.max-context-age"))
                .autoCompactionEnabled(props.isAutoCompactionEnabled())
                .preserveRecentMessages(require(props.getPreserveRecentMessages(), 0,
                        "compaction.preserve-recent-messages"))
                .build();
    }

    private ToolPolicy toolPolicy(CoderProperties.ToolPolicyProperties props) {
        Map<String, ToolDecision> decisions = new LinkedHashMap<>();
        props.getPolicies().forEach((tool, value) -> decisions.put(tool, decision(value, "tools.policies." + tool)));
        return new ToolPolicy(decisions, decision(props.getDefaultPolicy(), "tools.default-policy"));
    }

    private List<ToolRegistration> registrations(CoderProperties.ToolPolicyProperties props) {
        Set<String> sessionTools = new LinkedHashSet<>(props.getSessionTools());
        List<ToolRegistration> registrations = new ArrayList<>();
        for (String tool : sessionTools) {
            registrations.add(ToolRegistration.sessionBased(tool, null));
        }
        for (String tool : props.getPolicies().keySet()) {
            if (!sessionTools.contains(tool)) {
                registrations.add(ToolRegistration.of(tool, null));
            }
        }
        return registrations;
    }

    private RouterConfig router(CoderProperties.RouterProperties props) {
        Map<TaskClass, String> models = new EnumMap<>(TaskClass.class);
        props.getModels().forEach((key, model) -> models.put(taskClass(key), model));
        Integer maxTokens = props.getMaxTokens();
        if (maxTokens != null && maxTokens < 1) {
            throw new ConfigurationException("router.max-tokens must be >= 1: " + maxTokens);
        }
        return RouterConfig.builder()
                .enabled(props.isEnabled())
                .heuristicClassification(props.isHeuristicClassification())
                .defaultModel(props.getDefaultModel())
                .models(Map.copyOf(models))
                .budgets(RouterConfig.Budgets.builder()
                        .maxTokens(maxTokens)
                        .maxParallelTools(require(props.getMaxParallelTools(), 1, "router.max-parallel-tools"))
                        .build())
                .build();
    }

    private RetryConfig retry(CoderProperties.RetryProperties props) {
        if (props.getBackoffMultiplier() < 1.0) {
            throw new ConfigurationException(
                    "retry.backoff-multiplier must be >= 1.0: " + props.getBackoffMultiplier());
        }
        if (props.getJitterRatio() < 0.0 || props.getJitterRatio() > 1.0) {
            throw new ConfigurationException("retry.jitter-ratio must be within [0, 1]: " + props.getJitterRatio());
        }
        positive(props.getInitialDelay(), "retry.initial-delay");
        positive(props.getMaxDelay(), "retry.max-delay");
        if (props.getMaxDelay().compareTo(props.getInitialDelay()) < 0) {
            throw new ConfigurationException("retry.max-delay must not be shorter than retry.initial-delay");
        }
        Set<String> signatures = props.getRetryableSignatures().isEmpty()
                ? RetryConfig.DEFAULT_RETRYABLE_SIGNATURES
                : Set.copyOf(props.getRetryableSignatures());
        return RetryConfig.builder()
                .maxAttempts(require(props.getMaxAttempts(), 1, "retry.max-attempts"))
                .initialDelay(props.getInitialDelay())
                .maxDelay(props.getMaxDelay())
                .backoffMultiplier(props.getBackoffMultiplier())
                .jitterRatio(props.getJitterRatio())
                .retryableSignatures(signatures)
                .fallbackModel(props.getFallbackModel())
                .build();
    }

    private SnapshotConfig snapshot(CoderProperties.SnapshotProperties props) {
        return SnapshotConfig.builder()
                .enabled(props.isEnabled())
                .maxSnapshots(require(props.getMaxSnapshots(), 1, "snapshots.max-snapshots"))
                .build();
    }

    private static ToolDecision decision(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(key + " is required");
        }
        try {
            return ToolDecision.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(key + " must be one of allow, prompt, deny: " + value);
        }
    }

    private static PermissionMode permissionMode(String value) {
        if (value == null || value.isBlank()) {
            return PermissionMode.STANDARD;
        }
        try {
            return PermissionMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("tools.permission-mode must be standard or unrestricted: " + value);
        }
    }

    /**
     * Accepts {@code codegen-heavy}, {@code codegen_heavy} and
     * {@code codegenheavy}.
     */
    static TaskClass taskClass(String key) {
        String normalized = key.replaceAll("[^A-Za-z]", "").toUpperCase(Locale.ROOT);
        for (TaskClass taskClass : TaskClass.values()) {
            if (taskClass.name().replace("_", "").equals(normalized)) {
                return taskClass;
            }
        }
        throw new ConfigurationException("Unknown task class in router.models: " + key);
    }

    private static int require(int value, int min, String key) {
        if (value < min) {
            throw new ConfigurationException(key + " must be >= " + min + ": " + value);
        }
        return value;
    }

    private static Duration positive(Duration value, String key) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new ConfigurationException(key + " must be a positive duration: " + value);
        }
        return value;
    }
}
