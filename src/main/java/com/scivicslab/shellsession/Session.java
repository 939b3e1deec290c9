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

package com.scivicslab.shellsession;

import java.io.IOException;

/**
 * A persistent shell against which commands are executed one after another.
 *
 * <p>Two independent implementations exist:</p>
 * <ul>
 *   <li>{@link com.scivicslab.shellsession.local.LocalSession} - a locally spawned shell process</li>
 *   <li>{@link com.scivicslab.shellsession.remote.RemoteSession} - an interactive shell channel on a remote host</li>
 * </ul>
 *
 * <p>A session runs at most one command at a time. Callers that need
 * concurrency must use separate sessions.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public interface Session extends AutoCloseable {

    /**
     * Gets the unique identifier of this session.
     *
     * @return the session id
     */
    String getId();

    /**
     * Gets the current lifecycle state.
     *
     * @return the state
     */
    SessionState getState();

    /**
     * Opens the underlying transport and prepares the shell environment.
     *
     * @throws IOException if the transport cannot be opened or initialized
     * @throws IllegalStateException if the session was already set up or closed
     */
    void setup() throws IOException;

    /**
     * Executes a command and waits for it to complete.
     *
     * @param command the command to execute
     * @return the result of command execution
     * @throws IOException if command execution fails
     */
    default CommandResult execute(String command) throws IOException {
        return execute(command, true);
    }

    /**
     * Executes a command.
     *
     * @param command the command to execute
     * @param wait whether to wait for the command's process to disappear
     *             before collecting output
     * @return the result of command execution
     * @throws InteractiveCommandRejectedException if the command looks interactive
     * @throws TransportWriteFailedException if the command cannot be written
     * @throws ProcessExitedException if the shell dies while output is read
     * @throws ReadTimeoutException if the command does not finish in time
     * @throws IOException for any other transport failure
     * @throws IllegalStateException if the session is not ready
     */
    CommandResult execute(String command, boolean wait) throws IOException;

    /**
     * Destroys the underlying transport. Calling this more than once is harmless.
     */
    void teardown();

    @Override
    default void close() {
        teardown();
    }
}
