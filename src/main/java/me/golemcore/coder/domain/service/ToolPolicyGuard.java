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

import me.golemcore.coder.domain.model.PermissionMode;
import me.golemcore.coder.domain.model.ToolDecision;
import me.golemcore.coder.domain.model.ToolPolicy;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether a requested tool call may run and enforces the cap on
 * session-based tools.
 *
 * <p>
 * {@link #authorize(String)} is a pure lookup: unrestricted mode allows
 * everything, otherwise the explicit per-tool entry wins over the default.
 * Slot handling is separate so the decision can be evaluated any number of
 * times without side effects.
 */
@Slf4j
public class ToolPolicyGuard {

    private final ToolPolicy policy;
    private final PermissionMode permissionMode;
    private final ToolRegistry registry;

    public ToolPolicyGuard(ToolPolicy policy, PermissionMode permissionMode, ToolRegistry registry) {
        this.policy = policy;
        this.permissionMode = permissionMode;
        this.registry = registry;
    }

    public ToolDecision authorize(String toolName) {
        if (permissionMode == PermissionMode.UNRESTRICTED) {
            return ToolDecision.ALLOW;
        }
        return policy.decisionFor(toolName);
    }

    public boolean requiresSessionSlot(String toolName) {
        return registry.isSessionBased(toolName);
    }

    /**
     * Reserve a slot for a session-based tool. Non-session tools pass through.
     *
     * @throws me.golemcore.coder.domain.exception.ResourceExhaustedException
     *             when the cap is reached
     */
    public void acquireSlot(String toolName) {
        if (!requiresSessionSlot(toolName)) {
            return;
        }
        registry.getSessionGuard().acquire();
        log.debug("[ToolPolicy] Session slot acquired for {} ({}/{})", toolName,
                registry.getSessionGuard().current(), registry.getSessionGuard().getMaxAllowed());
    }

    public void releaseSlot(String toolName) {
        if (!requiresSessionSlot(toolName)) {
            return;
        }
        registry.getSessionGuard().release();
        log.debug("[ToolPolicy] Session slot released for {}", toolName);
    }

    public PermissionMode getPermissionMode() {
        return permissionMode;
    }

    public ToolPolicy getPolicy() {
        return policy;
    }
}
