package me.golemcore.coder;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore coding agent runtime.
 *
 * <p>
 * The runtime drives a multi-turn conversation with a language model and keeps
 * it safe and bounded:
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Turn Orchestration</b> - per-session state machine that routes,
 * calls the provider, gates and runs tools, compacts and checkpoints</li>
 * <li><b>Tool Policy</b> - allow/prompt/deny per tool plus a cap on open
 * interactive terminal sessions</li>
 * <li><b>Compaction</b> - priority-aware eviction into a cumulative
 * summary</li>
 * <li><b>Task Routing</b> - heuristic task classes mapped to model tiers</li>
 * <li><b>Retry/Backoff</b> - exponential backoff for transient provider
 * failures with an optional fallback model</li>
 * <li><b>Snapshots</b> - end-of-turn checkpoints with rollback</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Domain Layer       → TurnOrchestrator, Services
 * Ports              → LlmPort, ToolExecutorPort, ConfirmationPort, SnapshotStoragePort
 * Infrastructure     → Snapshot storage, default adapters, configuration
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code coder.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CoderApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoderApplication.class, args);
    }

}
