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
import java.util.List;
import java.util.logging.Logger;

import com.scivicslab.shellsession.guard.CommandSplitter;
import com.scivicslab.shellsession.poll.Deadline;
import com.scivicslab.shellsession.poll.PollClock;

/**
 * Local completion heuristic based on the OS process table.
 *
 * <p>A command is considered running while any of its {@code &&} clauses
 * appears as a process command line, either verbatim or followed by a space
 * and further arguments. Commands made only of allowlisted programs are
 * assumed finished after a fixed delay.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class ProcessTableCompletionDetector implements CompletionDetector {

    private static final Logger LOG = Logger.getLogger(ProcessTableCompletionDetector.class.getName());

    private final ProcessLister lister;
    private final FastCommandPolicy fastCommands;
    private final Duration fastCommandDelay;
    private final PollClock clock;

    public ProcessTableCompletionDetector(ProcessLister lister, FastCommandPolicy fastCommands,
                                          Duration fastCommandDelay, PollClock clock) {
        this.lister = lister;
        this.fastCommands = fastCommands;
        this.fastCommandDelay = fastCommandDelay;
        this.clock = clock;
    }

    @Override
    public boolean hasExited(String command) throws IOException {
        if (fastCommands.isFast(command)) {
            Deadline.sleep(clock, fastCommandDelay);
            return true;
        }

        List<String> clauses = CommandSplitter.splitAnd(command);
        for (String process : lister.listCommandLines()) {
            for (String clause : clauses) {
                if (process.equals(clause) || process.startsWith(clause + " ")) {
                    LOG.finest("Still running: " + process);
                    return false;
                }
            }
        }
        return true;
    }
}
