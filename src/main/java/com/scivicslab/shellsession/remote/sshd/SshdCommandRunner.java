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

import org.apache.sshd.client.session.ClientSession;

import com.scivicslab.shellsession.remote.RemoteCommandRunner;

/**
 * Runs one-off commands on separate exec channels of a MINA sshd session.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class SshdCommandRunner implements RemoteCommandRunner {

    private final ClientSession session;

    public SshdCommandRunner(ClientSession session) {
        this.session = session;
    }

    @Override
    public String run(String command) throws IOException {
        return session.executeRemoteCommand(command);
    }
}
