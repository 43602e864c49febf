package me.golemcore.coder.adapter.outbound.confirmation;

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

import me.golemcore.coder.port.outbound.ConfirmationPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Confirmation adapter for runs without a user at the terminal. Reports itself
 * unavailable and declines every request, so prompt-gated tools never run.
 */
@Component
@Slf4j
public class NonInteractiveConfirmationAdapter implements ConfirmationPort {

    @Override
    public CompletableFuture<Boolean> requestConfirmation(String sessionId, String toolName, String description) {
        log.debug("[Confirm] Declining {} in session {}: no interactive user", toolName, sessionId);
        return CompletableFuture.completedFuture(false);
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
