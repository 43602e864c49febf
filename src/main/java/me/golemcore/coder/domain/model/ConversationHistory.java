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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Canonical, insertion-ordered conversation of one session.
 *
 * <p>
 * The history holds the retained messages plus at most one cumulative summary
 * entry that stands for everything compaction has evicted so far. The summary
 * is always presented first and is never expanded back into messages.
 *
 * <p>
 * All access goes through a read/write lock. Readers receive copies, so a
 * compaction running under {@link #exclusively(Supplier)} is never observed
 * half-done.
 */
public class ConversationHistory {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Message> retained = new ArrayList<>();
    private final Instant createdAt;
    private Message summary;
    private int compactionCount;
    private Instant lastCompactionTime;
    private Instant lastCompactionCheck;

    public ConversationHistory(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public void append(Message message) {
        lock.writeLock().lock();
        try {
            retained.add(message);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Appends the messages as one block. No reader sees a prefix of the block.
     */
    public void appendAll(List<Message> messages) {
        lock.writeLock().lock();
        try {
            retained.addAll(messages);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Visible conversation: the summary (when present) followed by the retained
     * messages in insertion order.
     */
    public List<Message> messages() {
        lock.readLock().lock();
        try {
            List<Message> view = new ArrayList<>(retained.size() + 1);
            if (summary != null) {
                view.add(summary);
            }
            view.addAll(retained);
            return Collections.unmodifiableList(view);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Message> retainedMessages() {
        lock.readLock().lock();
        try {
            return List.copyOf(retained);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Message> getSummary() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(summary);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of visible entries, summary included.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return retained.size() + (summary != null ? 1 : 0);
        } finally {
            lock.readLock().unlock();
        }
    }

    public long memoryUsage() {
        lock.readLock().lock();
        try {
            long total = summary != null ? summary.getSizeBytes() : 0;
            for (Message message : retained) {
                total += message.getSizeBytes();
            }
            return total;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs the action while holding the write lock. Appends from other threads
     * wait until the action returns.
     */
    public <T> T exclusively(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the retained messages and the summary entry after a compaction
     * pass and records the pass.
     */
    public void applyCompaction(List<Message> keep, Message newSummary, Instant compactedAt) {
        if (newSummary == null || !newSummary.isSummary()) {
            throw new IllegalArgumentException("Compaction must leave a summary entry");
        }
        lock.writeLock().lock();
        try {
            retained.clear();
            retained.addAll(keep);
            summary = newSummary;
            compactionCount++;
            lastCompactionTime = compactedAt;
            lastCompactionCheck = compactedAt;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records a compaction pass that found nothing to evict. Only the auto
     * compaction interval uses this time.
     */
    public void markCompactionCheck(Instant checkedAt) {
        lock.writeLock().lock();
        try {
            lastCompactionCheck = checkedAt;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Resets the history to a previously captured state (rollback).
     */
    public void restore(List<Message> messages, Message restoredSummary, int restoredCompactionCount,
            Instant restoredLastCompaction) {
        lock.writeLock().lock();
        try {
            retained.clear();
            retained.addAll(messages);
            summary = restoredSummary;
            compactionCount = restoredCompactionCount;
            lastCompactionTime = restoredLastCompaction;
            lastCompactionCheck = restoredLastCompaction;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public int getCompactionCount() {
        lock.readLock().lock();
        try {
            return compactionCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Instant getLastCompactionTime() {
        lock.readLock().lock();
        try {
            return lastCompactionTime;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Instant getLastCompactionCheck() {
        lock.readLock().lock();
        try {
            return lastCompactionCheck;
        } finally {
            lock.readLock().unlock();
        }
    }
}
