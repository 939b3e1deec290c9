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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ShellProcess} backed by {@link java.lang.Process}.
 *
 * <p>stdout and stderr are kept as separate pipes.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class JavaShellProcess implements ShellProcess {

    private static final Logger LOG = Logger.getLogger(JavaShellProcess.class.getName());

    private final Process process;

    public JavaShellProcess(Process process) {
        this.process = process;
    }

    /**
     * Returns a launcher that starts processes with {@link ProcessBuilder}.
     *
     * @return the default launcher
     */
    public static ShellProcessLauncher launcher() {
        return JavaShellProcess::start;
    }

    /**
     * Starts a process with the inherited environment plus the given variables.
     *
     * @param command program and arguments
     * @param environment additional variables
     * @return the running process
     * @throws IOException if the process cannot be started
     */
    public static JavaShellProcess start(List<String> command, Map<String, String> environment)
            throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(false);
        pb.environment().putAll(environment);
        return new JavaShellProcess(pb.start());
    }

    @Override
    public OutputStream getStdin() {
        return process.getOutputStream();
    }

    @Override
    public InputStream getStdout() {
        return process.getInputStream();
    }

    @Override
    public InputStream getStderr() {
        return process.getErrorStream();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void destroyForcibly() {
        process.destroyForcibly();
        closeQuietly(process.getOutputStream());
        closeQuietly(process.getInputStream());
        closeQuietly(process.getErrorStream());
    }

    private static void closeQuietly(Closeable stream) {
        try {
            stream.close();
        } catch (IOException e) {
            LOG.log(Level.FINE, "Failed to close shell stream", e);
        }
    }
}
