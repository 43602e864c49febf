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

import lombok.Builder;
import lombok.Value;

/**
 * A tool known to the session.
 */
@Value
@Builder
public class ToolRegistration {

    String name;
    String description;

    /**
     * Tool holds an interactive execution channel (pseudo-terminal) and counts
     * against the session concurrency cap.
     */
    boolean sessionBased;

    public static ToolRegistration of(String name, String description) {
        return ToolRegistration.builder().name(name).description(description).build();
    }

    public static ToolRegistration sessionBased(String name, String description) {
        return ToolRegistration.builder().name(name).description(description).sessionBased(true).build();
    }
}
