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

import java.io.Closeable;
import java.io.IOException;

/**
 * An authenticated interactive shell channel on a remote host.
 *
 * <p>Reads are expected to be driven by the readiness queries so that a
 * caller never blocks on an empty channel.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public interface ShellChannel extends Closeable {

    /**
     * Sends all bytes to the remote shell.
     *
     * @param data bytes to send
     * @throws IOException if the channel is broken
     */
    void send(byte[] data) throws IOException;

    /**
     * Tells whether output can be received without blocking.
     *
     * @return true if {@link #recv(byte[])} has data
     * @throws IOException if the channel is broken
     */
    boolean recvReady() throws IOException;

    /**
     * Receives available output.
     *
     * @param buffer destination
     * @return number of bytes read, or -1 at end of stream
     * @throws IOException if the channel is broken
     */
    int recv(byte[] buffer) throws IOException;

    /**
     * Tells whether extended (stderr) data can be received without blocking.
     *
     * @return true if {@link #recvStderr(byte[])} has data
     * @throws IOException if the channel is broken
     */
    boolean recvStderrReady() throws IOException;

    /**
     * Receives available extended (stderr) data.
     *
     * @param buffer destination
     * @return number of bytes read, or -1 at end of stream
     * @throws IOException if the channel is broken
     */
    int recvStderr(byte[] buffer) throws IOException;

    boolean isClosed();
}
