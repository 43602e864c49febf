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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * One line of a session's trajectory audit trail: either the routing decision
 * of a turn or the outcome of one tool call.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrajectoryRecord {

    public static final String KIND_ROUTE = "route";
    public static final String KIND_TOOL = "tool";

    String kind;
    String sessionId;
    int turn;
    Instant timestamp;

    // route
    String selectedModel;
    String taskClass;
    String inputPreview;

    // tool
    String toolName;
    Map<String, Object> arguments;
    Boolean success;
    String failureKind;
}
