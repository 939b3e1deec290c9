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

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.scivicslab.shellsession.support.FakePollClock;

/**
 * Tests for RemoteProcessCompletionDetector.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@DisplayName("RemoteProcessCompletionDetector")
public class RemoteProcessCompletionDetectorTest {

    private FakePollClock clock;
    private List<String> commandsRun;
    private String psOutput;
    private RemoteProcessCompletionDetector detector;

    @BeforeEach
    void setUp() {
        clock = new FakePollClock();
        commandsRun = new ArrayList<>();
        psOutput = "COMMAND\n";
        detector = new RemoteProcessCompletionDetector(command -> {
            commandsRun.add(command);
            return psOutput;
        }, new FastCommandPolicy(Set.of("cd", "ls", "pwd")), Duration.ofMillis(300), clock);
    }

    @Test
    @DisplayName("Should return after the fixed delay for an allowlisted clause")
    void shouldReturnForAllowlistedClause() throws Exception {
        assertTrue(detector.hasExited("cd /var/log"));
        assertEquals(Duration.ofMillis(300), clock.elapsed());
        assertTrue(commandsRun.isEmpty());
    }

    @Test
    @DisplayName("Should return after the fixed delay for a clause without arguments")
    void shouldReturnForArgumentlessClause() throws Exception {
        assertTrue(detector.hasExited("  make  "));
        assertTrue(commandsRun.isEmpty());
    }

    @Test
    @DisplayName("Should list remote processes with ps")
    void shouldListRemoteProcesses() throws Exception {
        psOutput = "COMMAND\n  /usr/bin/python3 train.py --fast  \nsshd: user@pts/0\n";

        assertFalse(detector.hasExited("train.py --fast"));
        assertEquals(List.of(RemoteProcessCompletionDetector.LIST_PROCESSES), commandsRun);
    }

    @Test
    @DisplayName("Should report exit when no line ends with the clause")
    void shouldReportExit() throws Exception {
        psOutput = "COMMAND\r\n-bash\r\nps -eo command\r\n";

        assertTrue(detector.hasExited("sleep 30"));
    }
}
