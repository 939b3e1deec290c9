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

package com.scivicslab.shellsession.remote;

import java.io.IOException;

/**
 * Runs a one-off command on the remote host, outside the interactive shell.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@FunctionalInterface
public interface RemoteCommandRunner {

    /**
     * Runs the command and returns its stdout.
     *
     * @param command the command
     * @return captured stdout
     * @throws IOException if the command cannot be run
     */
    String run(String command) throws IOException;
}
