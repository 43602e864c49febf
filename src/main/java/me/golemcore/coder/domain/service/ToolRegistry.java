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

import me.golemcore.coder.domain.model.ToolRegistration;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tools available to one session. Owns the concurrency guard for its
 * session-based tools; guards are never shared between registries.
 */
public class ToolRegistry {

    private final Map<String, ToolRegistration> tools = new LinkedHashMap<>();
    private final SessionConcurrencyGuard sessionGuard;

    public ToolRegistry(Collection<ToolRegistration> registrations, int maxConcurrentSessions) {
        for (ToolRegistration registration : registrations) {
            tools.put(registration.getName(), registration);
        }
        this.sessionGuard = new SessionConcurrencyGuard(maxConcurrentSessions);
    }

    public Optional<ToolRegistration> find(String toolName) {
        return Optional.ofNullable(tools.get(toolName));
    }

    public boolean isSessionBased(String toolName) {
        ToolRegistration registration = tools.get(toolName);
        return registration != null && registration.isSessionBased();
    }

    public List<ToolRegistration> all() {
        return List.copyOf(tools.values());
    }

    public SessionConcurrencyGuard getSessionGuard() {
        return sessionGuard;
    }
}
