package me.golemcore.coder.domain.model;

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

/**
 * Classification of tool call failures recorded in the conversation.
 */
public enum ToolFailureKind {

    /**
     * Tool is denied by the session tool policy.
     */
    POLICY_DENIED,

    /**
     * User rejected a prompt-gated tool call, or no one was available to ask.
     */
    CONFIRMATION_DENIED,

    /**
     * Session-based tool cap reached. The tool was not started.
     */
    RESOURCE_EXHAUSTED,

    /**
     * Tool execution failed during runtime (exceptions, non-zero exit, unknown
     * tool).
     */
    EXECUTION_FAILED,

    /**
     * Tool did not complete within the configured timeout.
     */
    TIMEOUT,

    /**
     * Turn was interrupted before the tool completed.
     */
    CANCELLED
}
