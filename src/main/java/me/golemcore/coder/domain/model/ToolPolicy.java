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

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-tool decisions plus a default for unlisted tools. Instances are
 * immutable; administrative changes return a new policy.
 */
@Value
public class ToolPolicy {

    Map<String, ToolDecision> decisions;
    ToolDecision defaultDecision;

    public ToolPolicy(Map<String, ToolDecision> decisions, ToolDecision defaultDecision) {
        this.decisions = decisions != null ? Map.copyOf(decisions) : Map.of();
        this.defaultDecision = defaultDecision != null ? defaultDecision : ToolDecision.PROMPT;
    }

    public static ToolPolicy defaults() {
        return new ToolPolicy(Map.of(), ToolDecision.PROMPT);
    }

    /**
     * Explicit entry for the tool, else the default decision.
     */
    public ToolDecision decisionFor(String toolName) {
        ToolDecision explicit = toolName != null ? decisions.get(toolName) : null;
        return explicit != null ? explicit : defaultDecision;
    }

    public ToolPolicy withDecision(String toolName, ToolDecision decision) {
        Map<String, ToolDecision> updated = new LinkedHashMap<>(decisions);
        updated.put(toolName, decision);
        return new ToolPolicy(updated, defaultDecision);
    }

    public ToolPolicy allowAll() {
        return uniform(ToolDecision.ALLOW);
    }

    public ToolPolicy denyAll() {
        return uniform(ToolDecision.DENY);
    }

    public ToolPolicy resetToPrompt() {
        return uniform(ToolDecision.PROMPT);
    }

    private ToolPolicy uniform(ToolDecision decision) {
        Map<String, ToolDecision> updated = new LinkedHashMap<>();
        decisions.keySet().forEach(name -> updated.put(name, decision));
        return new ToolPolicy(updated, decision);
    }
}
