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

package com.scivicslab.shellsession.support;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.scivicslab.shellsession.poll.PollClock;

/**
 * Virtual clock: {@link #sleep(Duration)} advances time instantly and fires
 * actions scheduled for the new time.
 */
public class FakePollClock implements PollClock {

    private long now;
    private int sleeps;
    private final List<Scheduled> scheduled = new ArrayList<>();

    @Override
    public long nanoTime() {
        return now;
    }

    @Override
    public void sleep(Duration duration) {
        sleeps++;
        now += duration.toNanos();
        Iterator<Scheduled> it = scheduled.iterator();
        List<Runnable> due = new ArrayList<>();
        while (it.hasNext()) {
            Scheduled s = it.next();
            if (s.at <= now) {
                due.add(s.action);
                it.remove();
            }
        }
        due.forEach(Runnable::run);
    }

    /**
     * Runs an action once virtual time reaches {@code after} from now.
     */
    public void schedule(Duration after, Runnable action) {
        scheduled.add(new Scheduled(now + after.toNanos(), action));
    }

    public Duration elapsed() {
        return Duration.ofNanos(now);
    }

    public int getSleeps() {
        return sleeps;
    }

    private static final class Scheduled {
        final long at;
        final Runnable action;

        Scheduled(long at, Runnable action) {
            this.at = at;
            this.action = action;
        }
    }
}
