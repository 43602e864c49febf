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

import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Port for model provider calls. Provider adapters map the request to their
 * own wire format.
 *
 * <p>
 * A failed call completes the future exceptionally. Adapters should use
 * {@link me.golemcore.coder.domain.exception.ProviderException} so the retry
 * logic can tell terminal failures from transient ones; any other exception is
 * classified by its message.
 */
public interface LlmPort {

    CompletableFuture<LlmResponse> generate(LlmRequest request);

    boolean isAvailable();
}
