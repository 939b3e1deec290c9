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

import org.json.JSONObject;

/**
 * Represents the result of one command executed on a {@link Session}.
 *
 * <p>Instances are created fresh for every {@code execute} call and never
 * change afterwards.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class CommandResult {

    /** Exit code reported when the real one could not be recovered. */
    public static final int UNKNOWN_EXIT_CODE = 1;

    private final String stdout;
    private final String stderr;
    private final int exitCode;

    public CommandResult(String stdout, String stderr, int exitCode) {
        this.stdout = stdout == null ? "" : stdout;
        this.stderr = stderr == null ? "" : stderr;
        this.exitCode = exitCode;
    }

    public String getStdout() {
        return stdout;
    }

    public String getStderr() {
        return stderr;
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * Converts this result to a JSON object with the keys
     * {@code stdout}, {@code stderr} and {@code exit_code}.
     *
     * @return JSON representation of the result
     */
    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("stdout", stdout);
        json.put("stderr", stderr);
        json.put("exit_code", exitCode);
        return json;
    }

    @Override
    public String toString() {
        return String.format("CommandResult{exitCode=%d, stdout='%s', stderr='%s'}",
            exitCode, stdout, stderr);
    }
}
