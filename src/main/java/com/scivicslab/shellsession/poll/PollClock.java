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

import java.time.Duration;

/**
 * Time source and sleep used by the polling loops.
 *
 * <p>Tests substitute an implementation whose {@link #sleep(Duration)}
 * advances a virtual clock instead of blocking.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public interface PollClock {

    /**
     * Returns a monotonic time in nanoseconds.
     *
     * @return current time
     */
    long nanoTime();

    /**
     * Suspends the calling thread.
     *
     * @param duration how long to sleep
     * @throws InterruptedException if the thread is interrupted
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * Returns the clock backed by {@link System#nanoTime()} and {@link Thread#sleep(long)}.
     *
     * @return the system clock
     */
    static PollClock system() {
        return SystemPollClock.INSTANCE;
    }
}
