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

/**
 * Decides whether a command submitted to a shell has finished.
 *
 * <p>Shell transports offer no native "command finished" signal. The
 * implementations shipped here are heuristics that match the command text
 * against a process table. They can report completion too early for
 * commands whose processes carry unusual names, and too late when an
 * unrelated process happens to have the same command line. Alternative
 * strategies can be plugged in without touching the sessions.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public interface CompletionDetector {

    /**
     * Checks whether the command is no longer running.
     *
     * @param command the command as submitted, possibly composite
     * @return true if the command is considered finished
     * @throws IOException if the process table cannot be inspected
     */
    boolean hasExited(String command) throws IOException;
}
