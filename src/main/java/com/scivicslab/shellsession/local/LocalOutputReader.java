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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.logging.Logger;

import com.scivicslab.shellsession.ProcessExitedException;
import com.scivicslab.shellsession.ReadTimeoutException;
import com.scivicslab.shellsession.completion.CompletionDetector;
import com.scivicslab.shellsession.poll.Deadline;
import com.scivicslab.shellsession.poll.PollClock;

/**
 * Timeout-bounded polling loop that collects a command's stdout and stderr
 * from a local shell until both end markers have been seen.
 *
 * <p>Each stream stops accumulating as soon as its marker is present. Bytes
 * arriving later on that stream stay in the pipe for the next call, whose
 * reader is responsible for discarding them.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class LocalOutputReader {

    private static final Logger LOG = Logger.getLogger(LocalOutputReader.class.getName());

    static final int CHUNK_SIZE = 4096;

    private static final int DRAIN_POLLS = 5;

    private final ShellProcess process;
    private final CompletionDetector completionDetector;
    private final PollClock clock;
    private final Duration completionPollInterval;
    private final Duration streamPollInterval;

    public LocalOutputReader(ShellProcess process, CompletionDetector completionDetector, PollClock clock,
                             Duration completionPollInterval, Duration streamPollInterval) {
        this.process = process;
        this.completionDetector = completionDetector;
        this.clock = clock;
        this.completionPollInterval = completionPollInterval;
        this.streamPollInterval = streamPollInterval;
    }

    /**
     * Reads until the requested markers appear.
     *
     * @param command the command being waited on; null or empty only collects
     *                what arrives until the streams go quiet
     * @param commandEndMarker marker expected on stdout, or null to not require one
     * @param stderrEndMarker marker expected on stderr, or null to not require one
     * @param wait whether to wait for {@code command} to leave the process table first
     * @param timeout overall time budget
     * @return output truncated at the markers
     * @throws ProcessExitedException if the shell dies before the markers arrive
     * @throws ReadTimeoutException if the markers do not arrive in time
     * @throws IOException if the streams cannot be read
     */
    public StreamOutput read(String command, String commandEndMarker, String stderrEndMarker,
                             boolean wait, Duration timeout) throws IOException {
        if (wait && command == null) {
            throw new IllegalArgumentException("command cannot be null when wait is set");
        }

        Deadline deadline = Deadline.after(clock, timeout);
        StreamBuffer stdout = new StreamBuffer(process.getStdout(), commandEndMarker);
        StreamBuffer stderr = new StreamBuffer(process.getStderr(), stderrEndMarker);
        if (command == null || command.isEmpty()) {
            return readAvailable(deadline, stdout, stderr);
        }

        boolean exited = !wait;
        while (!deadline.isExpired()) {
            if (!exited) {
                if (!completionDetector.hasExited(command)) {
                    deadline.sleep(completionPollInterval);
                    continue;
                }
                exited = true;
                LOG.finer("Command left the process table: " + command);
            }

            boolean received = stdout.poll() | stderr.poll();
            if (stdout.isSatisfied() && stderr.isSatisfied()) {
                return new StreamOutput(stdout.truncated(), stderr.truncated());
            }
            if (!received) {
                if (stdout.isClosed() || stderr.isClosed() || !process.isAlive()) {
                    throw new ProcessExitedException(stdout.text(), stderr.text());
                }
                deadline.sleep(streamPollInterval);
            }
        }

        if (!process.isAlive()) {
            throw new ProcessExitedException(stdout.text(), stderr.text());
        }
        throw new ReadTimeoutException(timeout, stdout.text(), stderr.text());
    }

    /**
     * Collects whatever the shell has written so far without waiting for markers.
     *
     * @return available output
     * @throws IOException if the streams cannot be read
     */
    public StreamOutput drain() throws IOException {
        return read(null, null, null, false, streamPollInterval.multipliedBy(DRAIN_POLLS));
    }

    /**
     * Reads until both streams stay quiet for one poll interval or the deadline passes.
     */
    private StreamOutput readAvailable(Deadline deadline, StreamBuffer stdout, StreamBuffer stderr)
            throws IOException {
        boolean quiet = false;
        while (!deadline.isExpired()) {
            boolean received = stdout.poll() | stderr.poll();
            if (received) {
                quiet = false;
                continue;
            }
            if (quiet) {
                break;
            }
            if (!process.isAlive()) {
                throw new ProcessExitedException(stdout.text(), stderr.text());
            }
            quiet = true;
            deadline.sleep(streamPollInterval);
        }
        return new StreamOutput(stdout.truncated(), stderr.truncated());
    }

    /**
     * Accumulates one stream until its marker shows up.
     */
    private static final class StreamBuffer {
        private final InputStream in;
        private final String marker;
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        private final byte[] chunk = new byte[CHUNK_SIZE];
        private boolean satisfied;
        private boolean closed;

        StreamBuffer(InputStream in, String marker) {
            this.in = in;
            this.marker = marker;
        }

        boolean poll() throws IOException {
            if (satisfied || closed) {
                return false;
            }
            int available = in.available();
            if (available <= 0) {
                return false;
            }
            int n = in.read(chunk, 0, Math.min(available, chunk.length));
            if (n < 0) {
                closed = true;
                return false;
            }
            bytes.write(chunk, 0, n);
            if (marker != null && text().contains(marker)) {
                satisfied = true;
            }
            return n > 0;
        }

        boolean isSatisfied() {
            return satisfied || marker == null;
        }

        boolean isClosed() {
            return closed;
        }

        String text() {
            return bytes.toString(StandardCharsets.UTF_8);
        }

        String truncated() {
            String text = text();
            int end = marker == null ? -1 : text.indexOf(marker);
            return end < 0 ? text : text.substring(0, end);
        }
    }

    /**
     * stdout and stderr text of one read.
     */
    public static final class StreamOutput {
        private final String stdout;
        private final String stderr;

        public StreamOutput(String stdout, String stderr) {
            this.stdout = stdout;
            this.stderr = stderr;
        }

        public String getStdout() {
            return stdout;
        }

        public String getStderr() {
            return stderr;
        }
    }
}
