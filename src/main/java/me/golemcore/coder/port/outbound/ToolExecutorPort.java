package me.golemcore.coder.port.outbound;

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

import me.golemcore.coder.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the sandboxed tool execution layer. Invoked only after the tool
 * call passed the policy guard.
 */
public interface ToolExecutorPort {

    /**
     * Execute a tool.
     *
     * @param toolName
     *            registered tool name
     * @param arguments
     *            JSON-like arguments from the model
     * @return future with the tool result; the executor may also complete it
     *         exceptionally, which is recorded as an execution failure
     */
    CompletableFuture<ToolResult> execute(String toolName, Map<String, Object> arguments);
}
