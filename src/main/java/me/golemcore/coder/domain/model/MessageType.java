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

/**
 * Kind of entry in the conversation history.
 */
public enum MessageType {

    USER_MESSAGE("user"),

    ASSISTANT_MESSAGE("assistant"),

    TOOL_RESULT("tool"),

    SYSTEM_NOTE("system");

    private final String role;

    MessageType(String role) {
        this.role = role;
    }

    /**
     * Conversation role this type is sent to the provider with.
     */
    public String getRole() {
        return role;
    }

    public static MessageType fromRole(String role) {
        if (role == null) {
            throw new IllegalArgumentException("Message role is required");
        }
        for (MessageType type : values()) {
            if (type.role.equals(role)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message role: " + role);
    }
}
