package me.golemcore.coder.domain.system;

import me.golemcore.coder.domain.exception.ProviderException;
import me.golemcore.coder.domain.model.RetryConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderErrorClassifierTest {

    @ParameterizedTest
    @ValueSource(strings = { "Request timed out", "HTTP 429 Too Many Requests", "Rate limit reached",
            "502 Bad Gateway", "Connection refused", "Model OVERLOADED" })
    void shouldRetryKnownTransientErrors(String message) {
        assertTrue(ProviderErrorClassifier.isRetryable(new IllegalStateException(message),
                RetryConfig.DEFAULT_RETRYABLE_SIGNATURES));
    }

    @Test
    void shouldMatchExceptionTypeAndWrappedCause() {
        Throwable wrapped = new CompletionException(new IOException("io", new SocketTimeoutException()));

        assertTrue(ProviderErrorClassifier.isRetryable(wrapped, RetryConfig.DEFAULT_RETRYABLE_SIGNATURES));
    }

    @Test
    void shouldNotRetryUnknownTerminalOrCancelled() {
        assertFalse(ProviderErrorClassifier.isRetryable(new IllegalArgumentException("invalid api key"),
                RetryConfig.DEFAULT_RETRYABLE_SIGNATURES));
        assertFalse(ProviderErrorClassifier.isRetryable(ProviderException.terminalError("503 but terminal"),
                RetryConfig.DEFAULT_RETRYABLE_SIGNATURES));
        assertFalse(ProviderErrorClassifier.isRetryable(new CancellationException("timeout"),
                RetryConfig.DEFAULT_RETRYABLE_SIGNATURES));
        assertFalse(ProviderErrorClassifier.isRetryable(null, RetryConfig.DEFAULT_RETRYABLE_SIGNATURES));
    }

    @Test
    void shouldDetectContextOverflow() {
        assertTrue(ProviderErrorClassifier.isContextOverflow(
                new IllegalStateException("This model's maximum context length is 8192 tokens")));
        assertTrue(ProviderErrorClassifier.isContextOverflow("Please reduce the amount of input"));
        assertFalse(ProviderErrorClassifier.isContextOverflow("unauthorized"));
        assertFalse(ProviderErrorClassifier.isContextOverflow((String) null));
    }

    @Test
    void shouldUnwrapAndDescribe() {
        IllegalStateException root = new IllegalStateException("boom");

        assertSame(root, ProviderErrorClassifier.unwrap(new CompletionException(root)));
        assertEquals("boom", ProviderErrorClassifier.describe(new CompletionException(root)));
        assertEquals("IllegalStateException", ProviderErrorClassifier.describe(new IllegalStateException()));
    }
}
