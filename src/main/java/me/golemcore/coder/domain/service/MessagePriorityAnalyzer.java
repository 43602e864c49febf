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

import me.golemcore.coder.domain.model.MessagePriority;
import me.golemcore.coder.domain.model.MessageType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Assigns a retention priority to a message from its type and content.
 *
 * <p>
 * Rules, first match wins:
 * <ul>
 * <li>security vocabulary (password, token, secret...) - CRITICAL</li>
 * <li>system notes - CRITICAL</li>
 * <li>user messages with decision or code vocabulary - HIGH</li>
 * <li>assistant messages with decision vocabulary - HIGH</li>
 * <li>tool results mentioning an error or failure - HIGH, otherwise LOW</li>
 * <li>everything else - NORMAL</li>
 * </ul>
 * Keywords match whole words only, case-insensitive.
 */
@Component
public class MessagePriorityAnalyzer {

    private static final Pattern SECURITY = words(List.of(
            "password", "passwords", "token", "tokens", "key", "keys", "api_key", "secret", "secrets",
            "auth", "login", "permission", "permissions", "credential", "credentials"));

    private static final Pattern CODE = words(List.of(
            "function", "class", "struct", "enum", "impl", "trait", "mod", "interface", "method"));

    private static final Pattern DECISION = words(List.of(
            "decision", "decide", "choose", "select", "option", "options", "alternative", "recommend"));

    private static final Pattern FAILURE = Pattern.compile("error|fail");

    public MessagePriority analyze(String content, MessageType type) {
        String text = content != null ? content.toLowerCase(Locale.ROOT) : "";
        if (SECURITY.matcher(text).find()) {
            return MessagePriority.CRITICAL;
        }

        return switch (type) {
        case SYSTEM_NOTE -> MessagePriority.CRITICAL;
        case USER_MESSAGE -> DECISION.matcher(text).find() || CODE.matcher(text).find()
                ? MessagePriority.HIGH
                : MessagePriority.NORMAL;
        case ASSISTANT_MESSAGE -> DECISION.matcher(text).find()
                ? MessagePriority.HIGH
                : MessagePriority.NORMAL;
        case TOOL_RESULT -> FAILURE.matcher(text).find()
                ? MessagePriority.HIGH
                : MessagePriority.LOW;
        };
    }

    private static Pattern words(List<String> keywords) {
        return Pattern.compile("\\b(" + String.join("|", keywords) + ")\\b");
    }
}
