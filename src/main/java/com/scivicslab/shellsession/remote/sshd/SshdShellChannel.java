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

package com.scivicslab.shellsession.remote.sshd;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import org.apache.sshd.client.channel.ChannelShell;

import com.scivicslab.shellsession.remote.ShellChannel;

/**
 * {@link ShellChannel} over an Apache MINA sshd {@link ChannelShell} using
 * its inverted streams.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class SshdShellChannel implements ShellChannel {

    private final ChannelShell channel;
    private final OutputStream in;
    private final InputStream out;
    private final InputStream err;

    /**
     * Wraps an opened shell channel.
     *
     * @param channel the channel, already opened
     */
    public SshdShellChannel(ChannelShell channel) {
        this.channel = channel;
        this.in = channel.getInvertedIn();
        this.out = channel.getInvertedOut();
        this.err = channel.getInvertedErr();
    }

    @Override
    public void send(byte[] data) throws IOException {
        in.write(data);
        in.flush();
    }

    @Override
    public boolean recvReady() throws IOException {
        return out.available() > 0;
    }

    @Override
    public int recv(byte[] buffer) throws IOException {
        return out.read(buffer, 0, Math.min(buffer.length, Math.max(1, out.available())));
    }

    @Override
    public boolean recvStderrReady() throws IOException {
        return err != null && err.available() > 0;
    }

    @Override
    public int recvStderr(byte[] buffer) throws IOException {
        return err.read(buffer, 0, Math.min(buffer.length, Math.max(1, err.available())));
    }

    @Override
    public boolean isClosed() {
        return channel.isClosed() || channel.isClosing();
    }

    @Override
    public void close() throws IOException {
        if (!channel.isClosed()) {
            channel.close();
        }
    }
}
