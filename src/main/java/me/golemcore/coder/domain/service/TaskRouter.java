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

import me.golemcore.coder.domain.model.RouteDecision;
import me.golemcore.coder.domain.model.RouterConfig;
import me.golemcore.coder.domain.model.TaskClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Picks the model tier for an outgoing request.
 *
 * <p>
 * Classification is a keyword heuristic evaluated in order:
 * <ol>
 * <li>code fence, {@code diff --git} or patch vocabulary - CODEGEN_HEAVY</li>
 * <li>search and documentation vocabulary - RETRIEVAL_HEAVY</li>
 * <li>planning and architecture vocabulary, or more than 1200 characters -
 * COMPLEX</li>
 * <li>fewer than 120 characters - SIMPLE</li>
 * <li>otherwise STANDARD</li>
 * </ol>
 * Both classification and routing are pure functions of their arguments.
 */
@Service
@Slf4j
public class TaskRouter {

    private static final int LONG_REQUEST_LENGTH = 1200;
    private static final int SHORT_REQUEST_LENGTH = 120;

    private static final List<String> CODE_MARKERS = List.of("```", "diff --git", "apply_patch", "unified diff",
            "edit_file", "create_file", "*** begin patch");
    private static final Pattern PATCH_WORD = words(List.of("patch"));
    private static final Pattern RETRIEVAL = words(List.of("search", "web", "google", "docs", "documentation",
            "cite", "source", "sources", "up-to-date"));
    private static final Pattern COMPLEX = words(List.of("plan", "multi-step", "decompose", "orchestrate",
            "architecture", "benchmark", "implement end-to-end", "design api", "refactor module", "evaluate",
            "tests suite", "test suite"));

    public TaskClass classify(String text) {
        String lower = text != null ? text.toLowerCase(Locale.ROOT) : "";
        if (CODE_MARKERS.stream().anyMatch(lower::contains) || PATCH_WORD.matcher(lower).find()) {
            return TaskClass.CODEGEN_HEAVY;
        }
        if (RETRIEVAL.matcher(lower).find()) {
            return TaskClass.RETRIEVAL_HEAVY;
        }
        if (COMPLEX.matcher(lower).find() || lower.length() > LONG_REQUEST_LENGTH) {
            return TaskClass.COMPLEX;
        }
        if (lower.length() < SHORT_REQUEST_LENGTH) {
            return TaskClass.SIMPLE;
        }
        return TaskClass.STANDARD;
    }

    /**
     * Resolve the model for a task class.
     *
     * @param callerModel
     *            model the caller would use without routing; returned unchanged
     *            when routing is disabled and used when the class has no model
     */
    public RouteDecision route(RouterConfig config, TaskClass taskClass, String callerModel) {
        if (!config.isEnabled()) {
            return new RouteDecision(taskClass, callerModel, false);
        }
        String configured = config.getModels() != null ? config.getModels().get(taskClass) : null;
        if (configured == null || configured.isBlank()) {
            return new RouteDecision(taskClass, callerModel, false);
        }
        return new RouteDecision(taskClass, configured, true);
    }

    /**
     * Classify the request text and resolve its model.
     */
    public RouteDecision route(RouterConfig config, String text, String callerModel) {
        TaskClass taskClass = config.isHeuristicClassification() ? classify(text) : TaskClass.STANDARD;
        RouteDecision decision = route(config, taskClass, callerModel);
        log.debug("[Router] {} -> {}", taskClass, decision.model());
        return decision;
    }

    private static Pattern words(List<String> keywords) {
        return Pattern.compile("(?<![\\w-])(" + String.join("|", keywords.stream().map(Pattern::quote).toList())
                + ")(?![\\w-])");
    }
}
