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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans text received from an interactive remote shell.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class OutputSanitizer {

    /** 7-bit C1 escapes and CSI sequences. */
    private static final Pattern ANSI_ESCAPE =
        Pattern.compile("\\x1B(?:[@-Z\\\\-_]|\\[[0-?]*[ -/]*[@-~])");

    /** Banner printed by an activated development environment. */
    static final String ACTIVATION_BANNER = "(.dev)\n";

    private OutputSanitizer() {
        // Utility class
    }

    /**
     * Removes terminal escape sequences.
     *
     * @param text raw text
     * @return text without escape sequences
     */
    public static String stripAnsi(String text) {
        return ANSI_ESCAPE.matcher(text).replaceAll("");
    }

    /**
     * Turns the raw response to one sent line into plain command output.
     *
     * <p>Lines are split on CRLF and right-trimmed, the first line (the
     * shell's echo of the sent command) is dropped, and the activation
     * banner is removed.</p>
     *
     * @param output escape-free response text
     * @return the command's output
     */
    public static String sanitize(String output) {
        String[] lines = output.split("\r\n", -1);
        List<String> kept = new ArrayList<>();
        for (int i = 1; i < lines.length; i++) {
            kept.add(lines[i].stripTrailing());
        }
        String clean = String.join("\n", kept);
        if (clean.startsWith("\r")) {
            clean = clean.substring(1);
        }
        return clean.replace(ACTIVATION_BANNER, "");
    }

    /**
     * Finds the exit status in the response to a status query.
     *
     * @param response escape-free response text
     * @param query the query that was sent; its echo is skipped
     * @return the last non-empty line that is not the echo, or an empty string
     */
    public static String statusLine(String response, String query) {
        String status = "";
        for (String line : response.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.equals(query)) {
                status = trimmed;
            }
        }
        return status;
    }
}
