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

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.keyverifier.AcceptAllServerKeyVerifier;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.keyprovider.FileKeyPairProvider;

import com.scivicslab.shellsession.SessionConfig;
import com.scivicslab.shellsession.remote.RemoteSession;

/**
 * An authenticated SSH connection from which remote sessions are created.
 *
 * <p>Host keys are not verified, the same trade-off as running {@code ssh}
 * with {@code StrictHostKeyChecking=no}.</p>
 *
 * <pre>{@code
 * try (SshConnection connection = SshConnection.connect("node1", 22, "admin",
 *         Path.of("/home/admin/.ssh/id_ed25519"), null, Duration.ofSeconds(10));
 *      RemoteSession session = connection.openSession(SessionConfig.defaults())) {
 *     session.setup();
 *     session.execute("uname -a");
 * }
 * }</pre>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class SshConnection implements Closeable {

    private static final Logger LOG = Logger.getLogger(SshConnection.class.getName());

    private final SshClient client;
    private final ClientSession session;
    private final Duration timeout;

    private SshConnection(SshClient client, ClientSession session, Duration timeout) {
        this.client = client;
        this.session = session;
        this.timeout = timeout;
    }

    /**
     * Connects and authenticates.
     *
     * @param host the hostname or IP address
     * @param port the SSH port (typically 22)
     * @param user the SSH username
     * @param identityFile private key file (can be null)
     * @param password password (can be null)
     * @param timeout connect and authentication timeout
     * @return the authenticated connection
     * @throws IOException if connecting or authenticating fails
     */
    public static SshConnection connect(String host, int port, String user, Path identityFile,
                                        String password, Duration timeout) throws IOException {
        SshClient client = SshClient.setUpDefaultClient();
        client.setServerKeyVerifier(AcceptAllServerKeyVerifier.INSTANCE);
        client.start();
        try {
            ClientSession session = client.connect(user, host, port)
                .verify(timeout.toMillis())
                .getSession();
            if (identityFile != null) {
                session.setKeyIdentityProvider(new FileKeyPairProvider(identityFile));
            }
            if (password != null) {
                session.addPasswordIdentity(password);
            }
            session.auth().verify(timeout.toMillis());
            LOG.fine(String.format("Connected to %s@%s:%d", user, host, port));
            return new SshConnection(client, session, timeout);
        } catch (IOException | RuntimeException e) {
            client.stop();
            throw e;
        }
    }

    /**
     * Creates a remote session on this connection. The session is not set up yet.
     *
     * @param config session configuration
     * @return the new session
     */
    public RemoteSession openSession(SessionConfig config) {
        return new RemoteSession(config, new SshdShellChannelFactory(session, timeout),
            new SshdCommandRunner(session));
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to close SSH session", e);
        } finally {
            client.stop();
        }
    }
}
