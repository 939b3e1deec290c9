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
import java.time.Duration;
import java.util.Map;

import org.apache.sshd.client.channel.ChannelShell;
import org.apache.sshd.client.session.ClientSession;

import com.scivicslab.shellsession.remote.ShellChannel;
import com.scivicslab.shellsession.remote.ShellChannelFactory;

/**
 * Opens PTY-backed shell channels on a MINA sshd {@link ClientSession}.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class SshdShellChannelFactory implements ShellChannelFactory {

    private final ClientSession session;
    private final Duration openTimeout;

    public SshdShellChannelFactory(ClientSession session, Duration openTimeout) {
        this.session = session;
        this.openTimeout = openTimeout;
    }

    @Override
    public ShellChannel open(Map<String, String> environment) throws IOException {
        ChannelShell channel = session.createShellChannel();
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            channel.setEnv(entry.getKey(), entry.getValue());
        }
        try {
            channel.open().verify(openTimeout.toMillis());
        } catch (IOException e) {
            channel.close(true);
            throw e;
        }
        return new SshdShellChannel(channel);
    }
}
