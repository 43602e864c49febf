package me.golemcore.coder.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties of the agent runtime, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code coder.*} prefix:
 * <ul>
 * <li>{@link CompactionProperties} - history size, age and memory limits</li>
 * <li>{@link ToolPolicyProperties} - per-tool decisions and permission mode</li>
 * <li>{@link RouterProperties} - task class to model mapping</li>
 * <li>{@link RetryProperties} - provider backoff policy</li>
 * <li>{@link SnapshotProperties} - end-of-turn checkpoints</li>
 * <li>{@link TurnProperties} - per-turn loop limits</li>
 * <li>{@link TrajectoryProperties} - routing and tool call audit trail</li>
 * </ul>
 *
 * <p>
 * Values are read once per session by
 * {@link me.golemcore.coder.domain.service.SessionConfigFactory}; changing
 * them does not affect running sessions.
 */
@Component
@ConfigurationProperties(prefix = "coder")
@Data
public class CoderProperties {

    private CompactionProperties compaction = new CompactionProperties();
    private ToolPolicyProperties tools = new ToolPolicyProperties();
    private RouterProperties router = new RouterProperties();
    private RetryProperties retry = new RetryProperties();
    private SnapshotProperties snapshots = new SnapshotProperties();
    private TurnProperties turn = new TurnProperties();
    private TrajectoryProperties trajectory = new TrajectoryProperties();

    // ==================== COMPACTION ====================

    @Data
    public static class CompactionProperties {
        private int maxUncompressedMessages = 50;
        private Duration maxMessageAge = Duration.ofHours(1);
        private int maxMemoryMb = 100;
        private Duration compactionInterval = Duration.ofMinutes(5);
        private double minContextConfidence = 0.3;
        private Duration maxContextAge = Duration.ofHours(2);
        private boolean autoCompactionEnabled = true;
        private int preserveRecentMessages = 5;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolPolicyProperties {
        /** Decision for tools without an explicit entry: allow, prompt or deny. */
        private String defaultPolicy = "prompt";

        /** Tool name to decision. */
        private Map<String, String> policies = new LinkedHashMap<>();

        /** standard or unrestricted. */
        private String permissionMode = "standard";

        /** Tools that hold an interactive terminal and count against the cap. */
        private List<String> sessionTools = new ArrayList<>(List.of("run_pty_cmd", "create_pty_session"));

        private int maxConcurrentSessions = 3;

        private Duration timeout = Duration.ofSeconds(30);
    }

    // ==================== ROUTER ====================

    @Data
    public static class RouterProperties {
        private boolean enabled = true;
        private boolean heuristicClassification = true;
        private String defaultModel = "default";

        /** Task class (simple, standard, complex, codegen-heavy, retrieval-heavy) to model. */
        private Map<String, String> models = new LinkedHashMap<>();

        private Integer maxTokens;
        private int maxParallelTools = 4;
    }

    // ==================== RETRY ====================

    @Data
    public static class RetryProperties {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private double jitterRatio = 0.0;

        /** Overrides the built-in retryable signatures when not empty. */
        private List<String> retryableSignatures = new ArrayList<>();

        private String fallbackModel;
    }

    // ==================== SNAPSHOTS ====================

    @Data
    public static class SnapshotProperties {
        private boolean enabled = true;
        private int maxSnapshots = 50;
        private String basePath = "${user.home}/.golemcore/coder/snapshots";
    }

    // ==================== TURN ====================

    @Data
    public static class TurnProperties {
        /** Max model round trips with tool calls inside one turn. */
        private int maxToolLoops = 20;
        private String systemPrompt;
    }

    // ==================== TRAJECTORY ====================

    @Data
    public static class TrajectoryProperties {
        private boolean enabled = true;
        private String basePath = "${user.home}/.golemcore/coder/trajectory";
    }
}
