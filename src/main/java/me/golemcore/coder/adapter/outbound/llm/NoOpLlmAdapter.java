package me.golemcore.coder.adapter.outbound.llm;

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

import me.golemcore.coder.domain.exception.ProviderException;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.LlmResponse;
import me.golemcore.coder.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter used when no provider is wired in.
 *
 * <p>
 * Every call fails with a terminal {@link ProviderException}, so a session
 * without a provider fails its first turn instead of retrying.
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmPort {

    @Override
    public CompletableFuture<LlmResponse> generate(LlmRequest request) {
        log.warn("NoOpLlmAdapter: generate() called - no LLM configured");
        return CompletableFuture.failedFuture(ProviderException.terminalError("No LLM provider configured"));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
