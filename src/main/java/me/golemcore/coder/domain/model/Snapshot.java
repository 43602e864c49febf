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
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Metadata of a persisted end-of-turn checkpoint.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Snapshot {

    public static final String FORMAT_VERSION = "1.0";

    int turnNumber;
    Instant createdAt;
    long sizeBytes;
    String filename;
    String checksum;

    @Builder.Default
    String version = FORMAT_VERSION;

    Map<String, Object> metadata;
}
