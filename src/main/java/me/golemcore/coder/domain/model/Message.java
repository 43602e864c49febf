package me.golemcore.coder.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A single entry of the conversation history. Messages are immutable once
 * built; compaction replaces them, it never edits them.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Message {

    String id;
    String role; // user, assistant, system, tool
    String content;
    MessageType type;

    @Builder.Default
    MessagePriority priority = MessagePriority.NORMAL;

    /**
     * How much the agent still relies on this message, in [0, 1]. Messages below
     * the configured minimum are evicted first.
     */
    @Builder.Default
    double confidence = 1.0;

    Instant timestamp;

    List<ToolCall> toolCalls;
    String toolCallId; // For tool result messages
    String toolName; // Tool name for tool result messages

    Map<String, Object> metadata;

    /**
     * Marks the synthesized compaction summary entry.
     */
    boolean summary;

    @JsonIgnore
    public boolean isUserMessage() {
        return "user".equals(role);
    }

    @JsonIgnore
    public boolean isAssistantMessage() {
        return "assistant".equals(role);
    }

    @JsonIgnore
    public boolean isSystemMessage() {
        return "system".equals(role);
    }

    @JsonIgnore
    public boolean isToolMessage() {
        return "tool".equals(role);
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Estimated memory footprint: UTF-8 length of the content plus the tool call
     * names and arguments.
     */
    @JsonIgnore
    public long getSizeBytes() {
        long size = content != null ? content.getBytes(StandardCharsets.UTF_8).length : 0;
        if (toolCalls != null) {
            for (ToolCall toolCall : toolCalls) {
                size += utf8Length(toolCall.getName());
                size += toolCall.getArguments() != null ? utf8Length(toolCall.getArguments().toString()) : 0;
            }
        }
        return size;
    }

    private static int utf8Length(String value) {
        return value != null ? value.getBytes(StandardCharsets.UTF_8).length : 0;
    }

    /**
     * A tool invocation requested by the model.
     */
    @Value
    @Builder
    @Jacksonized
    public static class ToolCall {
        String id;
        String name;
        Map<String, Object> arguments;
    }
}
