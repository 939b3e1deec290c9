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

package com.scivicslab.shellsession.local;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Spawns the shell process behind a {@link LocalSession}.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@FunctionalInterface
public interface ShellProcessLauncher {

    /**
     * Starts a shell.
     *
     * @param command program and arguments, e.g. {@code [/bin/bash, -l, -m]}
     * @param environment variables added to the inherited environment
     * @return the running shell
     * @throws IOException if the process cannot be started
     */
    ShellProcess launch(List<String> command, Map<String, String> environment) throws IOException;
}
