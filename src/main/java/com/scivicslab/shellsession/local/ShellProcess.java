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

import java.io.InputStream;
import java.io.OutputStream;

/**
 * The three standard streams and the liveness of a locally spawned shell.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public interface ShellProcess {

    OutputStream getStdin();

    InputStream getStdout();

    InputStream getStderr();

    boolean isAlive();

    /**
     * Kills the shell and releases its streams. Must tolerate repeated calls.
     */
    void destroyForcibly();
}
