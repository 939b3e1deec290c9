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
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.scivicslab.shellsession.CommandResult;
import com.scivicslab.shellsession.InteractiveCommandRejectedException;
import com.scivicslab.shellsession.Session;
import com.scivicslab.shellsession.SessionConfig;
import com.scivicslab.shellsession.SessionIds;
import com.scivicslab.shellsession.SessionState;
import com.scivicslab.shellsession.TransportWriteFailedException;
import com.scivicslab.shellsession.completion.CompletionDetector;
import com.scivicslab.shellsession.completion.FastCommandPolicy;
import com.scivicslab.shellsession.completion.ProcessTableCompletionDetector;
import com.scivicslab.shellsession.completion.PsProcessLister;
import com.scivicslab.shellsession.guard.InteractivityGuard;
import com.scivicslab.shellsession.marker.ExitCodeExtractor;
import com.scivicslab.shellsession.marker.MarkerFactory;
import com.scivicslab.shellsession.marker.MarkerSet;
import com.scivicslab.shellsession.poll.Deadline;
import com.scivicslab.shellsession.poll.PollClock;

/**
 * Session backed by a shell process on the local machine.
 *
 * <p>Every command is wrapped so that the shell echoes its exit status and
 * two end markers, one on stdout and one on stderr. The
 * {@link LocalOutputReader} collects both streams until the markers show up.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (LocalSession session = new LocalSession()) {
 *     session.setup();
 *     CommandResult result = session.execute("echo hello");
 *     // result.getStdout() == "hello\n", result.getExitCode() == 0
 * }
 * }</pre>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class LocalSession implements Session {

    private static final Logger LOG = Logger.getLogger(LocalSession.class.getName());

    private final String id;
    private final SessionConfig config;
    private final ShellProcessLauncher launcher;
    private final CompletionDetector completionDetector;
    private final PollClock clock;
    private final InteractivityGuard guard;
    private final MarkerFactory markers;

    private SessionState state = SessionState.UNINITIALIZED;
    private ShellProcess process;
    private LocalOutputReader reader;

    /**
     * Constructs a local session with the default configuration.
     */
    public LocalSession() {
        this(SessionConfig.defaults());
    }

    /**
     * Constructs a local session running {@code bash} through {@link ProcessBuilder}.
     *
     * @param config session configuration
     */
    public LocalSession(SessionConfig config) {
        this(SessionIds.generate(), config, JavaShellProcess.launcher(),
            new ProcessTableCompletionDetector(new PsProcessLister(),
                new FastCommandPolicy(config.getFastCommands()),
                config.getFastCommandDelay(), PollClock.system()),
            PollClock.system());
    }

    /**
     * Constructs a local session with explicit collaborators.
     *
     * @param id session id embedded in every marker
     * @param config session configuration
     * @param launcher spawns the shell in {@link #setup()}
     * @param completionDetector decides when a command has finished
     * @param clock clock used by all polling loops
     */
    public LocalSession(String id, SessionConfig config, ShellProcessLauncher launcher,
                        CompletionDetector completionDetector, PollClock clock) {
        this.id = id;
        this.config = config;
        this.launcher = launcher;
        this.completionDetector = completionDetector;
        this.clock = clock;
        this.guard = new InteractivityGuard(config.getInteractiveCommands());
        this.markers = new MarkerFactory(id);
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
            LOG.fine("Setting up shell: " + id);
            process = launcher.launch(config.getShellCommand(), config.getEnvironment());
            reader = new LocalOutputReader(process, completionDetector, clock,
                config.getCompletionPollInterval(), config.getStreamPollInterval());
            state = SessionState.READY;
        }

        try {
            LocalOutputReader.StreamOutput initial = reader.drain();
            LOG.fine(String.format("Initial data from session: %s - stdout='%s', stderr='%s'",
                id, initial.getStdout(), initial.getStderr()));

            Path activation = config.getActivationFile();
            if (activation != null && Files.exists(activation)) {
                LOG.fine("Loading development environment: " + activation);
                execute("source " + activation);
            }

            for (Map.Entry<String, String> entry : config.getEnvironment().entrySet()) {
                execute("export " + entry.getKey() + "=" + quote(entry.getValue()));
                Deadline.sleep(clock, config.getSettleDelay());
            }
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

        MarkerSet markerSet = markers.next();
        beginExecute();
        try {
            write(markerSet.wrapLocal(command));
            LocalOutputReader.StreamOutput output = reader.read(MarkerSet.safeCommand(command),
                markerSet.getCommandEnd(), markerSet.getStderrEnd(), wait, config.getCommandTimeout());

            ExitCodeExtractor.Extraction extraction = ExitCodeExtractor.extract(output.getStdout(), markerSet);
            String stderr = markerSet.dropStale(output.getStderr(), MarkerSet.STDERR_END_PREFIX);
            LOG.fine(String.format("Executed on %s: %s (exit %d)", id, command, extraction.getExitCode()));
            return new CommandResult(extraction.getStdout(), stderr, extraction.getExitCode());
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
        if (process == null) {
            return;
        }
        LOG.fine("Tearing down shell: " + id);
        try {
            process.destroyForcibly();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Failed to kill shell of session " + id, e);
        }
    }

    private void write(String command) throws IOException {
        byte[] line = (command.stripTrailing() + "\n").getBytes(StandardCharsets.UTF_8);
        try {
            OutputStream stdin = process.getStdin();
            stdin.write(line);
            stdin.flush();
        } catch (IOException e) {
            throw new TransportWriteFailedException("Failed to write to shell of session " + id + ": "
                + e.getMessage(), e);
        }
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

    /**
     * Quotes a value for use in a shell command.
     *
     * @param value the raw value
     * @return the value in single quotes
     */
    static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }
}
