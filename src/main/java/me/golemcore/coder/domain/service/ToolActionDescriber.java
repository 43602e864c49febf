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

import me.golemcore.coder.domain.model.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the human-readable description shown when a prompt-gated tool call
 * waits for confirmation.
 */
@Component
public class ToolActionDescriber {

    private static final String UNKNOWN = "unknown";
    private static final String PATH = "path";
    private static final String COMMAND = "command";
    private static final int COMMAND_LENGTH_THRESHOLD = 80;

    public String describeAction(Message.ToolCall toolCall) {
        String toolName = toolCall.getName();
        Map<String, Object> args = toolCall.getArguments();

        return switch (toolName) {
        case "write_file", "create_file" -> "Write file: " + stringArg(args, PATH);
        case "edit_file" -> "Edit file: " + stringArg(args, PATH);
        case "delete_file" -> "Delete file: " + stringArg(args, PATH);
        case "apply_patch" -> "Apply patch";
        case "run_terminal_cmd", "run_pty_cmd", "create_pty_session" -> "Run command: "
                + truncate(commandArg(args));
        default -> toolName + ": " + (args != null ? args : Map.of());
        };
    }

    private String commandArg(Map<String, Object> args) {
        Object command = args != null ? args.get(COMMAND) : null;
        if (command instanceof Iterable<?> parts) {
            return String.join(" ", toStrings(parts));
        }
        return command != null ? command.toString() : UNKNOWN;
    }

    private static Iterable<String> toStrings(Iterable<?> parts) {
        List<String> result = new ArrayList<>();
        for (Object part : parts) {
            result.add(String.valueOf(part));
        }
        return result;
    }

    private String stringArg(Map<String, Object> args, String key) {
        Object value = args != null ? args.get(key) : null;
        return value != null ? value.toString() : UNKNOWN;
    }

    private String truncate(String command) {
        if (command.length() > COMMAND_LENGTH_THRESHOLD) {
            return command.substring(0, COMMAND_LENGTH_THRESHOLD) + "...";
        }
        return command;
    }
}
