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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.scivicslab.shellsession.CommandResult;
import com.scivicslab.shellsession.InteractiveCommandRejectedException;
import com.scivicslab.shellsession.ProcessExitedException;
import com.scivicslab.shellsession.ReadTimeoutException;
import com.scivicslab.shellsession.Session;
import com.scivicslab.shellsession.SessionConfig;
import com.scivicslab.shellsession.SessionIds;
import com.scivicslab.shellsession.SessionState;
import com.scivicslab.shellsession.TransportWriteFailedException;
import com.scivicslab.shellsession.completion.CompletionDetector;
import com.scivicslab.shellsession.completion.FastCommandPolicy;
import com.scivicslab.shellsession.completion.RemoteProcessCompletionDetector;
import com.scivicslab.shellsession.guard.CommandSplitter;
import com.scivicslab.shellsession.guard.InteractivityGuard;
import com.scivicslab.shellsession.marker.ExitCodeExtractor;
import com.scivicslab.shellsession.poll.Deadline;
import com.scivicslab.shellsession.poll.PollClock;

/**
 * Session backed by an interactive shell channel on a remote host.
 *
 * <p>Unlike {@link com.scivicslab.shellsession.local.LocalSession} no markers
 * are injected. Each {@code &&} clause is sent on its own, waited on through
 * the remote process table, and its response is drained from the channel.
 * The exit status is queried afterwards with {@code echo $?}. The channel
 * mixes both streams, so {@link CommandResult#getStderr()} is always empty.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class RemoteSession implements Session {

    private static final Logger LOG = Logger.getLogger(RemoteSession.class.getName());

    static final String STATUS_QUERY = "echo $?";
    static final String PROMPT_RESET = "cd ~/ && export PS1=''";

    private static final int RECV_CHUNK = 512;
    private static final int STATUS_POLLS = 10;

    private final String id;
    private final SessionConfig config;
    private final ShellChannelFactory channelFactory;
    private final RemoteCommandRunner commandRunner;
    private final CompletionDetector completionDetector;
    private final PollClock clock;
    private final InteractivityGuard guard;

    private SessionState state = SessionState.UNINITIALIZED;
    private ShellChannel channel;

    /**
     * Constructs a remote session with the default polling heuristics.
     *
     * @param config session configuration
     * @param channelFactory opens the interactive channel in {@link #setup()}
     * @param commandRunner side channel for process listing
     */
    public RemoteSession(SessionConfig config, ShellChannelFactory channelFactory,
                         RemoteCommandRunner commandRunner) {
        this(SessionIds.generate(), config, channelFactory, commandRunner,
            new RemoteProcessCompletionDetector(commandRunner,
                new FastCommandPolicy(config.getFastCommands()),
                config.getFastCommandDelay(), PollClock.system()),
            PollClock.system());
    }

    /**
     * Constructs a remote session with explicit collaborators.
     *
     * @param id session id
     * @param config session configuration
     * @param channelFactory opens the interactive channel in {@link #setup()}
     * @param commandRunner side channel for one-off commands
     * @param completionDetector decides when a clause has finished
     * @param clock clock used by all polling loops
     */
    public RemoteSession(String id, SessionConfig config, ShellChannelFactory channelFactory,
                         RemoteCommandRunner commandRunner, CompletionDetector completionDetector,
                         PollClock clock) {
        this.id = id;
        this.config = config;
        this.channelFactory = channelFactory;
        this.commandRunner = commandRunner;
        this.completionDetector = completionDetector;
        this.clock = clock;
        this.guard = new InteractivityGuard(config.getInteractiveCommands());
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public synchronized SessionState getState() {
        return state;
    }

    public SessionConfig getConfig() {
        return config;
    }

    @Override
    public void setup() throws IOException {
        synchronized (this) {
            if (state != SessionState.UNINITIALIZED) {
                throw new IllegalStateException("Session " + id + " cannot be set up in state " + state);
            }
            LOG.fine("Setting up remote shell: " + id);
            channel = channelFactory.open(config.getEnvironment());
            state = SessionState.READY;
        }

        try {
            Path activation = config.getActivationFile();
            if (activation != null && remoteFileExists(activation)) {
                LOG.fine("Loading development environment: " + activation);
                execute("source " + activation);
            }

            for (Map.Entry<String, String> entry : config.getEnvironment().entrySet()) {
                send("export " + entry.getKey() + "=" + quote(entry.getValue()));
                Deadline.sleep(clock, config.getSettleDelay());
                receive();
            }

            execute(PROMPT_RESET);
        } catch (IOException | RuntimeException e) {
            teardown();
            throw e;
        }
    }

    @Override
    public CommandResult execute(String command, boolean wait) throws IOException {
        requireReady();
        if (guard.isInteractive(command)) {
            throw new InteractiveCommandRejectedException(command);
        }

        beginExecute();
        try {
            Deadline deadline = Deadline.after(clock, config.getCommandTimeout());
            List<String> clauses = CommandSplitter.splitAnd(command);
            if (clauses.isEmpty()) {
                clauses = List.of("");
            }

            StringBuilder output = new StringBuilder();
            for (String clause : clauses) {
                send(clause);
                if (wait) {
                    awaitCompletion(clause, deadline, output);
                }
                output.append(OutputSanitizer.sanitize(receive()));
                if (channel.isClosed()) {
                    throw new ProcessExitedException(output.toString(), "");
                }
            }

            int exitCode = exitStatus();
            LOG.fine(String.format("Executed on %s: %s (exit %d)", id, command, exitCode));
            return new CommandResult(output.toString(), "", exitCode);
        } finally {
            endExecute();
        }
    }

    @Override
    public synchronized void teardown() {
        if (state == SessionState.CLOSED) {
            return;
        }
        state = SessionState.CLOSED;
        if (channel == null) {
            return;
        }
        LOG.fine("Closing remote shell: " + id);
        try {
            channel.close();
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.WARNING, "Failed to close channel of session " + id, e);
        }
    }

    private void awaitCompletion(String clause, Deadline deadline, StringBuilder output) throws IOException {
        while (!completionDetector.hasExited(clause)) {
            if (deadline.isExpired()) {
                throw new ReadTimeoutException(config.getCommandTimeout(), output.toString(), "");
            }
            deadline.sleep(config.getCompletionPollInterval());
        }
    }

    private int exitStatus() throws IOException {
        send(STATUS_QUERY);
        StringBuilder response = new StringBuilder();
        for (int i = 0; i < STATUS_POLLS; i++) {
            response.append(receive());
            String status = OutputSanitizer.statusLine(response.toString(), STATUS_QUERY);
            if (!status.isEmpty()) {
                return ExitCodeExtractor.parseStatus(status);
            }
            Deadline.sleep(clock, config.getStreamPollInterval());
        }
        LOG.fine("No exit status received for session " + id);
        return CommandResult.UNKNOWN_EXIT_CODE;
    }

    private boolean remoteFileExists(Path file) throws IOException {
        String answer = commandRunner.run("test -e " + quote(file.toString()) + " && echo yes || echo no");
        return answer.trim().equals("yes");
    }

    private void send(String line) throws IOException {
        try {
            channel.send((line + "\n").getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransportWriteFailedException("Failed to send to remote shell of session " + id + ": "
                + e.getMessage(), e);
        }
        Deadline.sleep(clock, config.getSettleDelay());
    }

    /**
     * Drains everything the channel can deliver right now, stdout first.
     */
    private String receive() throws IOException {
        ByteArrayOutputStream received = new ByteArrayOutputStream();
        byte[] chunk = new byte[RECV_CHUNK];
        while (channel.recvReady()) {
            int n = channel.recv(chunk);
            if (n < 0) {
                break;
            }
            received.write(chunk, 0, n);
        }
        while (channel.recvStderrReady()) {
            int n = channel.recvStderr(chunk);
            if (n < 0) {
                break;
            }
            received.write(chunk, 0, n);
        }
        return OutputSanitizer.stripAnsi(received.toString(StandardCharsets.UTF_8));
    }

    private synchronized void requireReady() {
        if (state != SessionState.READY) {
            throw new IllegalStateException("Session " + id + " is not ready: " + state);
        }
    }

    private synchronized void beginExecute() {
        requireReady();
        state = SessionState.EXECUTING;
    }

    private synchronized void endExecute() {
        if (state == SessionState.EXECUTING) {
            state = SessionState.READY;
        }
    }

    static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }
}
