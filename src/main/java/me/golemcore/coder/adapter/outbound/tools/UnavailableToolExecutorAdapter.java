package me.golemcore.coder.adapter.outbound.tools;

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

import me.golemcore.coder.domain.model.ToolFailureKind;
import me.golemcore.coder.domain.model.ToolResult;
import me.golemcore.coder.port.outbound.ToolExecutorPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool executor used when no sandbox is wired in. Every call fails without
 * side effects.
 */
@Component
@Slf4j
public class UnavailableToolExecutorAdapter implements ToolExecutorPort {

    @Override
    public CompletableFuture<ToolResult> execute(String toolName, Map<String, Object> arguments) {
        log.warn("[Tools] No tool executor configured, cannot run {}", toolName);
        return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                "No tool executor configured for: " + toolName));
    }
}
