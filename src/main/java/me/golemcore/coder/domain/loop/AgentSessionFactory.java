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

import me.golemcore.coder.domain.model.SessionConfig;
import me.golemcore.coder.domain.service.SessionConfigFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * Creates one {@link TurnOrchestrator} per session. Configuration is read and
 * validated here, so a bad setting fails the session before its first turn.
 */
@Slf4j
public class AgentSessionFactory {

    private final SessionConfigFactory configFactory;
    private final TurnServices services;

    public AgentSessionFactory(SessionConfigFactory configFactory, TurnServices services) {
        this.configFactory = configFactory;
        this.services = services;
    }

    /**
     * Start a session with a generated id.
     *
     * @throws me.golemcore.coder.domain.exception.ConfigurationException
     *             when the configuration is invalid
     */
    public TurnOrchestrator createSession() {
        return createSession(UUID.randomUUID().toString());
    }

    public TurnOrchestrator createSession(String sessionId) {
        return createSession(sessionId, configFactory.create());
    }

    public TurnOrchestrator createSession(String sessionId, SessionConfig config) {
        TurnOrchestrator orchestrator = new TurnOrchestrator(sessionId, config, services);
        log.info("[Session] Created session {} (permission mode {}, {} tools)", sessionId,
                config.getPermissionMode(), config.getTools().size());
        return orchestrator;
    }
}
