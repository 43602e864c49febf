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

import me.golemcore.coder.domain.exception.ResourceExhaustedException;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded counter of open session-based tools. Lock-free: every transition is
 * a compare-and-set, so the count never exceeds the cap and never drops below
 * zero.
 */
public class SessionConcurrencyGuard {

    private final AtomicInteger active = new AtomicInteger();
    private final int maxAllowed;

    public SessionConcurrencyGuard(int maxAllowed) {
        if (maxAllowed < 0) {
            throw new IllegalArgumentException("maxAllowed must be >= 0: " + maxAllowed);
        }
        this.maxAllowed = maxAllowed;
    }

    /**
     * Take a slot.
     *
     * @throws ResourceExhaustedException
     *             when all slots are taken
     */
    public void acquire() {
        if (!tryAcquire()) {
            throw new ResourceExhaustedException(maxAllowed);
        }
    }

    public boolean tryAcquire() {
        while (true) {
            int current = active.get();
            if (current >= maxAllowed) {
                return false;
            }
            if (active.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Give a slot back. Releasing at zero is a no-op so cleanup paths may release
     * twice.
     */
    public void release() {
        while (true) {
            int current = active.get();
            if (current == 0) {
                return;
            }
            if (active.compareAndSet(current, current - 1)) {
                return;
            }
        }
    }

    public int current() {
        return active.get();
    }

    public int getMaxAllowed() {
        return maxAllowed;
    }
}
