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

import me.golemcore.coder.domain.model.CompactionConfig;
import me.golemcore.coder.domain.model.CompactionResult;
import me.golemcore.coder.domain.model.CompactionStatistics;
import me.golemcore.coder.domain.model.ConversationHistory;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.MessagePriority;
import me.golemcore.coder.domain.model.MessageType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Keeps a conversation history within its size, age and memory limits.
 *
 * <p>
 * The engine holds no session state: every operation receives the history
 * handle and the session's {@link CompactionConfig}. A compaction pass runs
 * entirely under the history's write lock.
 *
 * <p>
 * Eviction order:
 * <ol>
 * <li>messages older than {@code maxMessageAge}</li>
 * <li>eligible messages (confidence below {@code minContextConfidence} or
 * older than {@code maxContextAge}), oldest first</li>
 * <li>remaining messages by priority, LOW to CRITICAL, oldest first</li>
 * <li>the most recent {@code preserveRecentMessages}, only when nothing else is
 * left</li>
 * </ol>
 * Steps 2 to 4 stop as soon as the count and memory limits hold. An assistant
 * message with tool calls and its tool results are evicted together. Evicted
 * messages are folded into a single cumulative summary entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompactionEngine {

    static final String SUMMARY_PREFIX = "[Conversation summary]";
    static final String META_EVICTED_TOTAL = "evictedTotal";
    static final String META_EVICTED_BY_TYPE = "evictedByType";
    static final String META_PREVIEWS = "previews";
    private static final int MAX_PREVIEWS = 10;
    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private final MessagePriorityAnalyzer priorityAnalyzer;
    private final Clock clock;

    /**
     * Build a message of the given type, assign its priority and append it.
     */
    public Message addMessage(ConversationHistory history, String content, MessageType type) {
        return addMessage(history, Message.builder().content(content).build(), type);
    }

    /**
     * Append a message as the given type. Missing id and timestamp are filled in
     * and the priority is derived from the content.
     */
    public Message addMessage(ConversationHistory history, Message message, MessageType type) {
        Message prepared = prepare(message, type);
        history.append(prepared);
        return prepared;
    }

    /**
     * Append messages as one block, in order.
     */
    public List<Message> addMessages(ConversationHistory history, List<Message> messages) {
        List<Message> prepared = new ArrayList<>(messages.size());
        for (Message message : messages) {
            MessageType type = message.getType() != null ? message.getType() : MessageType.fromRole(message.getRole());
            prepared.add(prepare(message, type));
        }
        history.appendAll(prepared);
        return prepared;
    }

    public boolean shouldCompact(ConversationHistory history, CompactionConfig config) {
        if (history.size() > config.getMaxUncompressedMessages()) {
            return true;
        }
        if (history.memoryUsage() > config.getMaxMemoryBytes()) {
            return true;
        }
        Instant now = clock.instant();
        List<Message> retained = history.retainedMessages();
        int tailStart = Math.max(0, retained.size() - config.getPreserveRecentMessages());
        for (int i = 0; i < tailStart; i++) {
            if (isOlderThan(retained.get(i), now, config.getMaxMessageAge())) {
                return true;
            }
        }
        Instant lastCheck = history.getLastCompactionCheck();
        return config.isAutoCompactionEnabled() && lastCheck != null
                && !now.isBefore(lastCheck.plus(config.getCompactionInterval()));
    }

    /**
     * Compact until the configured limits hold.
     */
    public CompactionResult compactMessagesIntelligently(ConversationHistory history, CompactionConfig config) {
        return history.exclusively(() -> compact(history, config, config.getMaxUncompressedMessages(), false));
    }

    /**
     * Compact harder than the limits require: at most half of the visible
     * entries survive. Used when the provider rejected the conversation as too
     * large.
     */
    public CompactionResult forceCompaction(ConversationHistory history, CompactionConfig config) {
        return history.exclusively(() -> {
            int half = Math.max(1, history.size() / 2);
            int target = Math.min(config.getMaxUncompressedMessages(), half);
            return compact(history, config, target, true);
        });
    }

    public CompactionStatistics getStatistics(ConversationHistory history) {
        List<Message> visible = history.messages();
        Map<MessagePriority, Integer> byPriority = new EnumMap<>(MessagePriority.class);
        for (MessagePriority priority : MessagePriority.values()) {
            byPriority.put(priority, 0);
        }
        long memory = 0;
        for (Message message : visible) {
            byPriority.merge(message.getPriority(), 1, Integer::sum);
            memory += message.getSizeBytes();
        }

        Instant last = history.getLastCompactionTime();
        int count = history.getCompactionCount();
        return CompactionStatistics.builder()
                .totalMessages(visible.size())
                .messagesByPriority(Collections.unmodifiableMap(byPriority))
                .totalMemoryUsage(memory)
                .averageMessageSize(visible.isEmpty() ? 0 : memory / visible.size())
                .lastCompactionTime(last)
                .compactionCount(count)
                .compactionFrequency(frequency(history.getCreatedAt(), last, count))
                .build();
    }

    private CompactionResult compact(ConversationHistory history, CompactionConfig config, int targetCount,
            boolean forced) {
        long started = System.nanoTime();
        Instant now = clock.instant();
        List<Message> retained = history.retainedMessages();
        Message previousSummary = history.getSummary().orElse(null);
        long originalSize = history.memoryUsage();
        int processed = history.size();

        List<Group> groups = groupToolExchanges(retained);
        int tailStart = tailStart(retained, groups, config.getPreserveRecentMessages());
        EvictionPlan plan = new EvictionPlan(retained, targetCount, config.getMaxMemoryBytes());

        for (Group group : groups) {
            if (group.start < tailStart && isOlderThan(retained.get(group.start), now, config.getMaxMessageAge())) {
                plan.evict(group);
            }
        }
        for (Group group : groups) {
            if (plan.satisfied()) {
                break;
            }
            if (group.start < tailStart && isEligible(retained, group, now, config)) {
                plan.evict(group);
            }
        }
        evictByPriority(plan, groups, group -> group.start < tailStart);
        evictByPriority(plan, groups, group -> group.start >= tailStart);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        if (plan.evictedCount() == 0) {
            history.markCompactionCheck(now);
            log.debug("[Compaction] Nothing to evict ({} messages, {} bytes)", processed, originalSize);
            return CompactionResult.noop(processed, originalSize, elapsed);
        }

        List<Message> keep = new ArrayList<>();
        List<Message> evicted = new ArrayList<>();
        for (int i = 0; i < retained.size(); i++) {
            (plan.isEvicted(i) ? evicted : keep).add(retained.get(i));
        }
        long keptBytes = keep.stream().mapToLong(Message::getSizeBytes).sum();
        long summaryBudget = Math.max(0, originalSize - keptBytes);
        Message summary = buildSummary(previousSummary, evicted, summaryBudget, config.getSummaryPreviewLength(),
                now);
        history.applyCompaction(keep, summary, now);

        long compactedSize = keptBytes + summary.getSizeBytes();
        // Not clamped: a summary header can outweigh a few tiny evicted messages.
        double ratio = originalSize == 0 ? 1.0 : (double) compactedSize / originalSize;
        if (compactedSize > originalSize) {
            log.debug("[Compaction] Summary outweighs evicted content ({} -> {} bytes)", originalSize,
                    compactedSize);
        }
        CompactionResult result = CompactionResult.builder()
                .messagesProcessed(processed)
                .messagesCompacted(evicted.size())
                .originalSize(originalSize)
                .compactedSize(compactedSize)
                .compressionRatio(ratio)
                .processingTime(Duration.ofNanos(System.nanoTime() - started))
                .build();
        log.info("[Compaction] {}Compacted {} of {} messages ({} -> {} bytes, ratio {})",
                forced ? "Forced: " : "", evicted.size(), processed, originalSize, compactedSize,
                String.format("%.2f", ratio));
        return result;
    }

    private void evictByPriority(EvictionPlan plan, List<Group> groups, Predicate<Group> scope) {
        List<Group> candidates = new ArrayList<>();
        for (Group group : groups) {
            if (scope.test(group)) {
                candidates.add(group);
            }
        }
        // LOW first, then oldest first within a priority
        candidates.sort(Comparator.comparing((Group group) -> group.priority).reversed()
                .thenComparingInt(group -> group.start));
        for (Group group : candidates) {
            if (plan.satisfied()) {
                return;
            }
            plan.evict(group);
        }
    }

    private boolean isEligible(List<Message> retained, Group group, Instant now, CompactionConfig config) {
        for (int index : group.indexes) {
            Message message = retained.get(index);
            if (message.getConfidence() < config.getMinContextConfidence()
                    || isOlderThan(message, now, config.getMaxContextAge())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isOlderThan(Message message, Instant now, Duration maxAge) {
        Instant timestamp = message.getTimestamp();
        return timestamp != null && Duration.between(timestamp, now).compareTo(maxAge) > 0;
    }

    /**
     * Groups each assistant tool-call message with the tool results answering it.
     * Every other message forms a group of its own.
     */
    private List<Group> groupToolExchanges(List<Message> retained) {
        Map<String, Group> byToolCallId = new HashMap<>();
        List<Group> groups = new ArrayList<>();
        for (int i = 0; i < retained.size(); i++) {
            Message message = retained.get(i);
            Group owner = message.isToolMessage() && message.getToolCallId() != null
                    ? byToolCallId.get(message.getToolCallId())
                    : null;
            if (owner != null) {
                owner.add(i, message.getPriority());
                continue;
            }
            Group group = new Group(i, message.getPriority());
            groups.add(group);
            if (message.hasToolCalls()) {
                for (Message.ToolCall toolCall : message.getToolCalls()) {
                    byToolCallId.put(toolCall.getId(), group);
                }
            }
        }
        return groups;
    }

    /**
     * Index where the preserved tail starts, moved back so that no tool exchange
     * straddles it.
     */
    private int tailStart(List<Message> retained, List<Group> groups, int preserveRecent) {
        int tailStart = Math.max(0, retained.size() - preserveRecent);
        for (Group group : groups) {
            if (group.start < tailStart && group.end() >= tailStart) {
                return group.start;
            }
        }
        return tailStart;
    }

    private Message buildSummary(Message previous, List<Message> evicted, long budgetBytes, int previewLength,
            Instant now) {
        Map<String, Integer> byType = new LinkedHashMap<>();
        for (MessageType type : MessageType.values()) {
            byType.put(type.getRole(), 0);
        }
        int total = 0;
        List<String> previews = new ArrayList<>();
        if (previous != null && previous.getMetadata() != null) {
            Map<String, Object> metadata = previous.getMetadata();
            total = intValue(metadata.get(META_EVICTED_TOTAL));
            if (metadata.get(META_EVICTED_BY_TYPE) instanceof Map<?, ?> counts) {
                counts.forEach((role, count) -> byType.merge(String.valueOf(role), intValue(count), Integer::sum));
            }
            if (metadata.get(META_PREVIEWS) instanceof List<?> previousPreviews) {
                previousPreviews.forEach(preview -> previews.add(String.valueOf(preview)));
            }
        }

        total += evicted.size();
        for (Message message : evicted) {
            byType.merge(message.getType().getRole(), 1, Integer::sum);
        }
        evicted.stream()
                .filter(message -> message.getContent() != null && !message.getContent().isBlank())
                .sorted(Comparator.comparing(Message::getPriority))
                .limit(MAX_PREVIEWS)
                .sorted(Comparator.comparing(Message::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder())))
                .forEach(message -> previews.add(message.getType().getRole() + ": "
                        + truncate(message.getContent(), previewLength)));
        while (previews.size() > MAX_PREVIEWS) {
            previews.remove(0);
        }

        String header = SUMMARY_PREFIX + " " + total + " earlier messages compacted " + describeCounts(byType);
        long previousSize = previous != null ? previous.getSizeBytes() : 0;
        long budget = Math.max(budgetBytes, previousSize);
        List<String> shown = new ArrayList<>(previews);
        String content = render(header, shown);
        while (!shown.isEmpty() && utf8Length(content) > budget) {
            shown.remove(0);
            content = render(header, shown);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(META_EVICTED_TOTAL, total);
        metadata.put(META_EVICTED_BY_TYPE, byType);
        metadata.put(META_PREVIEWS, List.copyOf(shown));
        return Message.builder()
                .id(previous != null ? previous.getId() : UUID.randomUUID().toString())
                .role(MessageType.SYSTEM_NOTE.getRole())
                .type(MessageType.SYSTEM_NOTE)
                .priority(MessagePriority.CRITICAL)
                .content(content)
                .timestamp(now)
                .metadata(Collections.unmodifiableMap(metadata))
                .summary(true)
                .build();
    }

    private static String describeCounts(Map<String, Integer> byType) {
        List<String> parts = new ArrayList<>();
        byType.forEach((role, count) -> {
            if (count > 0) {
                parts.add(role + ": " + count);
            }
        });
        return "(" + String.join(", ", parts) + ")";
    }

    private static String render(String header, List<String> previews) {
        if (previews.isEmpty()) {
            return header;
        }
        StringBuilder sb = new StringBuilder(header).append("\nRemoved:");
        for (String preview : previews) {
            sb.append("\n- ").append(preview);
        }
        return sb.toString();
    }

    private Message prepare(Message message, MessageType type) {
        String content = message.getContent();
        return message.toBuilder()
                .id(message.getId() != null ? message.getId() : UUID.randomUUID().toString())
                .type(type)
                .role(type.getRole())
                .priority(priorityAnalyzer.analyze(content, type))
                .timestamp(message.getTimestamp() != null ? message.getTimestamp() : clock.instant())
                .build();
    }

    private static double frequency(Instant createdAt, Instant last, int count) {
        if (last == null || count == 0) {
            return 0.0;
        }
        long millis = Duration.between(createdAt, last).toMillis();
        if (millis <= 0) {
            return count;
        }
        return count / (millis / MILLIS_PER_HOUR);
    }

    private static int intValue(Object value) {
        return value instanceof Number number ? number.intValue() : 0;
    }

    private static int utf8Length(String value) {
        return value.getBytes(StandardCharsets.UTF_8).length;
    }

    private static String truncate(String text, int maxLength) {
        String singleLine = text.replace('\n', ' ').strip();
        if (singleLine.length() <= maxLength) {
            return singleLine;
        }
        return singleLine.substring(0, maxLength) + "...";
    }

    private static final class Group {
        private final int start;
        private final List<Integer> indexes = new ArrayList<>();
        private MessagePriority priority;

        Group(int start, MessagePriority priority) {
            this.start = start;
            this.priority = priority;
            indexes.add(start);
        }

        void add(int index, MessagePriority memberPriority) {
            indexes.add(index);
            if (memberPriority.compareTo(priority) < 0) {
                priority = memberPriority;
            }
        }

        int end() {
            return indexes.get(indexes.size() - 1);
        }
    }

    private static final class EvictionPlan {
        private final List<Message> retained;
        private final boolean[] evicted;
        private final int targetCount;
        private final long maxMemoryBytes;
        private int remaining;
        private long remainingBytes;

        EvictionPlan(List<Message> retained, int targetCount, long maxMemoryBytes) {
            this.retained = retained;
            this.evicted = new boolean[retained.size()];
            this.targetCount = targetCount;
            this.maxMemoryBytes = maxMemoryBytes;
            this.remaining = retained.size();
            this.remainingBytes = retained.stream().mapToLong(Message::getSizeBytes).sum();
        }

        void evict(Group group) {
            for (int index : group.indexes) {
                if (!evicted[index]) {
                    evicted[index] = true;
                    remaining--;
                    remainingBytes -= retained.get(index).getSizeBytes();
                }
            }
        }

        boolean isEvicted(int index) {
            return evicted[index];
        }

        int evictedCount() {
            return retained.size() - remaining;
        }

        /**
         * Count includes the summary entry every compaction leaves behind.
         */
        boolean satisfied() {
            return remaining + 1 <= targetCount && remainingBytes <= maxMemoryBytes;
        }
    }
}
