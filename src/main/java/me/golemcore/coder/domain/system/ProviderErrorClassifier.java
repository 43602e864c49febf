package me.golemcore.coder.domain.system;

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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Classifies provider failures from their exception chain and messages.
 *
 * <p>
 * Matching is a case-insensitive substring search over every message in the
 * cause chain. Context overflow detection relies on a phrase list and is
 * best-effort: providers word these errors differently and a miss only means
 * the error is surfaced instead of recovered.
 */
public final class ProviderErrorClassifier {

    public static final List<String> CONTEXT_OVERFLOW_PHRASES = List.of(
            "context length", "context window", "maximum context", "model is overloaded",
            "reduce the amount", "token limit", "503");

    private ProviderErrorClassifier() {
    }

    /**
     * Check whether a failure is worth retrying.
     *
     * @param throwable
     *            the failure, possibly wrapped in completion exceptions
     * @param signatures
     *            retryable-error signatures
     */
    public static boolean isRetryable(Throwable throwable, Collection<String> signatures) {
        if (throwable == null || isTerminal(throwable) || isCancellation(throwable)) {
            return false;
        }
        return matchesAny(throwable, signatures);
    }

    /**
     * A {@link ProviderException} marked terminal anywhere in the chain.
     */
    public static boolean isTerminal(Throwable throwable) {
        for (Throwable current : chain(throwable)) {
            if (current instanceof ProviderException providerException && providerException.isTerminal()) {
                return true;
            }
        }
        return false;
    }

    public static boolean isCancellation(Throwable throwable) {
        for (Throwable current : chain(throwable)) {
            if (current instanceof CancellationException || current instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    public static boolean isContextOverflow(Throwable throwable) {
        return throwable != null && matchesAny(throwable, CONTEXT_OVERFLOW_PHRASES);
    }

    public static boolean isContextOverflow(String message) {
        return containsAny(message, CONTEXT_OVERFLOW_PHRASES);
    }

    /**
     * Strip {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Most specific non-blank message of the chain, or the exception type when
     * no message exists.
     */
    public static String describe(Throwable throwable) {
        Throwable root = unwrap(throwable);
        if (root == null) {
            return "unknown error";
        }
        String message = root.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }
        Throwable cause = root.getCause();
        if (cause != null && cause != root && cause.getMessage() != null && !cause.getMessage().isBlank()) {
            return cause.getMessage();
        }
        return root.getClass().getSimpleName();
    }

    private static boolean matchesAny(Throwable throwable, Collection<String> needles) {
        for (Throwable current : chain(throwable)) {
            if (containsAny(current.getMessage(), needles)
                    || containsAny(current.getClass().getSimpleName(), needles)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(String text, Collection<String> needles) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String needle : needles) {
            if (needle != null && !needle.isBlank() && lower.contains(needle.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static List<Throwable> chain(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        List<Throwable> result = new ArrayList<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            result.add(current);
            current = current.getCause();
        }
        return result;
    }
}
