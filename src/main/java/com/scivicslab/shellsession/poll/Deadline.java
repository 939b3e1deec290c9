/*
 * Copyright 2025 devteam@scivicslab.com
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package com.scivicslab.shellsession.poll;

import java.io.InterruptedIOException;
import java.time.Duration;

/**
 * A point in time after which a polling loop gives up.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class Deadline {

    private final PollClock clock;
    private final long endNanos;

    private Deadline(PollClock clock, Duration timeout) {
        this.clock = clock;
        this.endNanos = clock.nanoTime() + timeout.toNanos();
    }

    /**
     * Starts a deadline that expires after the timeout.
     *
     * @param clock the clock to measure against
     * @param timeout the time budget
     * @return the deadline
     */
    public static Deadline after(PollClock clock, Duration timeout) {
        return new Deadline(clock, timeout);
    }

    public boolean isExpired() {
        return clock.nanoTime() >= endNanos;
    }

    /**
     * Sleeps on the deadline's clock, converting interruption into an I/O failure.
     *
     * @param duration how long to sleep
     * @throws InterruptedIOException if the thread is interrupted; the interrupt flag is restored
     */
    public void sleep(Duration duration) throws InterruptedIOException {
        sleep(clock, duration);
    }

    /**
     * Sleeps on the given clock, converting interruption into an I/O failure.
     *
     * @param clock the clock
     * @param duration how long to sleep
     * @throws InterruptedIOException if the thread is interrupted; the interrupt flag is restored
     */
    public static void sleep(PollClock clock, Duration duration) throws InterruptedIOException {
        try {
            clock.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException ioe = new InterruptedIOException("Interrupted while polling shell");
            ioe.initCause(e);
            throw ioe;
        }
    }
}
