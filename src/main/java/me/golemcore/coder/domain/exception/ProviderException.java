package me.golemcore.coder.domain.exception;

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
 * Failure reported by a model provider adapter. Terminal failures (invalid
 * credentials, unknown model) are never retried.
 */
public class ProviderException extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private final boolean terminal;

    public ProviderException(String message, boolean terminal) {
        super(message);
        this.terminal = terminal;
    }

    public ProviderException(String message, boolean terminal, Throwable cause) {
        super(message, cause);
        this.terminal = terminal;
    }

    public static ProviderException transientError(String message) {
        return new ProviderException(message, false);
    }

    public static ProviderException terminalError(String message) {
        return new ProviderException(message, true);
    }

    public boolean isTerminal() {
        return terminal;
    }
}
