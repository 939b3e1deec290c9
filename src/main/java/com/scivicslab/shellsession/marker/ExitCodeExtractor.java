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

package com.scivicslab.shellsession.marker;

import java.util.logging.Logger;

import com.scivicslab.shellsession.CommandResult;

/**
 * Recovers the exit code from raw local output and removes all protocol text.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class ExitCodeExtractor {

    private static final Logger LOG = Logger.getLogger(ExitCodeExtractor.class.getName());

    private ExitCodeExtractor() {
        // Utility class
    }

    /**
     * Extracts the exit code from stdout that was already cut at the command-end marker.
     *
     * <p>The first occurrence of the exit marker is followed by the numeric
     * status; the marker and the rest of its line are removed, while text the
     * command printed on the same line without a trailing newline is kept.
     * A missing marker or an unparsable status yields
     * {@link CommandResult#UNKNOWN_EXIT_CODE}.</p>
     *
     * <p>Leftovers of earlier calls are removed: everything up to a stale
     * command-end marker is dropped, and the output is truncated at any
     * remaining exit-marker prefix.</p>
     *
     * @param stdout raw stdout of the call
     * @param markers markers of the call
     * @return cleaned stdout with the exit code
     */
    public static Extraction extract(String stdout, MarkerSet markers) {
        String text = stdout;
        int exitCode = CommandResult.UNKNOWN_EXIT_CODE;

        int markerIndex = text.indexOf(markers.getExit());
        if (markerIndex >= 0) {
            int statusStart = markerIndex + markers.getExit().length();
            int lineEnd = text.indexOf('\n', statusStart);
            String status = text.substring(statusStart, lineEnd < 0 ? text.length() : lineEnd).trim();
            exitCode = parseStatus(status);
            String rest = lineEnd < 0 ? "" : text.substring(lineEnd + 1);
            text = text.substring(0, markerIndex) + rest;
        }

        String cleaned = markers.dropStale(text, MarkerSet.COMMAND_END_PREFIX);
        if (cleaned.length() != text.length()) {
            LOG.warning("Dropped late output of an earlier call: " + (text.length() - cleaned.length()) + " chars");
            text = cleaned;
        }

        int stray = text.indexOf(MarkerSet.EXIT_PREFIX);
        if (stray >= 0) {
            LOG.fine("Truncating stdout at stray exit marker prefix");
            text = text.substring(0, stray);
        }
        return new Extraction(text, exitCode);
    }

    /**
     * Parses an exit status token.
     *
     * @param status trimmed status text
     * @return the status, or {@link CommandResult#UNKNOWN_EXIT_CODE} if not an integer
     */
    public static int parseStatus(String status) {
        try {
            return Integer.parseInt(status.trim());
        } catch (NumberFormatException e) {
            return CommandResult.UNKNOWN_EXIT_CODE;
        }
    }

    /**
     * Cleaned stdout together with the exit code found in it.
     */
    public static final class Extraction {
        private final String stdout;
        private final int exitCode;

        Extraction(String stdout, int exitCode) {
            this.stdout = stdout;
            this.exitCode = exitCode;
        }

        public String getStdout() {
            return stdout;
        }

        public int getExitCode() {
            return exitCode;
        }
    }
}
