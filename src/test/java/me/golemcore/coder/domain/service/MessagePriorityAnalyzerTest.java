package me.golemcore.coder.domain.service;

import me.golemcore.coder.domain.model.MessagePriority;
import me.golemcore.coder.domain.model.MessageType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MessagePriorityAnalyzerTest {

    private final MessagePriorityAnalyzer analyzer = new MessagePriorityAnalyzer();

    @ParameterizedTest
    @CsvSource({
            "'Rotate the API token please', USER_MESSAGE, CRITICAL",
            "'stored the password in the vault', TOOL_RESULT, CRITICAL",
            "'Which option do you recommend?', USER_MESSAGE, HIGH",
            "'Add a method to the parser class', USER_MESSAGE, HIGH",
            "'hello there', USER_MESSAGE, NORMAL",
            "'I would choose the second approach', ASSISTANT_MESSAGE, HIGH",
            "'Add a method to the parser class', ASSISTANT_MESSAGE, NORMAL",
            "'build failed with 3 errors', TOOL_RESULT, HIGH",
            "'42 files listed', TOOL_RESULT, LOW",
            "'anything at all', SYSTEM_NOTE, CRITICAL"
    })
    void shouldClassifyByTypeAndKeywords(String content, MessageType type, MessagePriority expected) {
        assertEquals(expected, analyzer.analyze(content, type));
    }

    @Test
    void shouldMatchWholeWordsOnly() {
        assertEquals(MessagePriority.NORMAL, analyzer.analyze("the monkey is keyless", MessageType.USER_MESSAGE));
        assertEquals(MessagePriority.NORMAL, analyzer.analyze("the author was absent", MessageType.USER_MESSAGE));
    }

    @Test
    void shouldIgnoreCase() {
        assertEquals(MessagePriority.CRITICAL, analyzer.analyze("SECRET rotation", MessageType.ASSISTANT_MESSAGE));
    }

    @Test
    void shouldTreatNullContentAsEmpty() {
        assertEquals(MessagePriority.LOW, analyzer.analyze(null, MessageType.TOOL_RESULT));
        assertEquals(MessagePriority.NORMAL, analyzer.analyze(null, MessageType.USER_MESSAGE));
    }
}
