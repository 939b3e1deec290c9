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

package com.scivicslab.shellsession.completion;

import java.io.IOException;
import java.time.Duration;

import com.scivicslab.shellsession.poll.Deadline;
import com.scivicslab.shellsession.poll.PollClock;
import com.scivicslab.shellsession.remote.RemoteCommandRunner;

/**
 * Remote completion heuristic: lists the remote processes through a side
 * channel and looks for a command line ending with the clause.
 *
 * <p>Clauses whose program is allowlisted, or that have no arguments at all,
 * are assumed finished after a fixed delay.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class RemoteProcessCompletionDetector implements CompletionDetector {

    static final String LIST_PROCESSES = "ps -eo command";

    private final RemoteCommandRunner runner;
    private final FastCommandPolicy fastCommands;
    private final Duration fastCommandDelay;
    private final PollClock clock;

    public RemoteProcessCompletionDetector(RemoteCommandRunner runner, FastCommandPolicy fastCommands,
                                           Duration fastCommandDelay, PollClock clock) {
        this.runner = runner;
        this.fastCommands = fastCommands;
        this.fastCommandDelay = fastCommandDelay;
        this.clock = clock;
    }

    @Override
    public boolean hasExited(String clause) throws IOException {
        String command = clause.trim();
        if (fastCommands.isFastClause(command)) {
            Deadline.sleep(clock, fastCommandDelay);
            return true;
        }
        for (String line : runner.run(LIST_PROCESSES).split("\\R")) {
            if (line.strip().endsWith(command)) {
                return false;
            }
        }
        return true;
    }
}
