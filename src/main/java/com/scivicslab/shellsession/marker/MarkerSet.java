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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The sentinel strings injected around one command.
 *
 * <p>Each marker is built from a fixed prefix, the session id and the call
 * sequence number, e.g. {@code __CMD_END_3f2a..._7__}. Markers of the same
 * session that carry a different sequence number are <em>stale</em>: they
 * belong to an earlier call whose output arrived late.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class MarkerSet {

    public static final String COMMAND_END_PREFIX = "__CMD_END";
    public static final String STDERR_END_PREFIX = "__STDERR_END";
    public static final String EXIT_PREFIX = "__EXIT";

    private final String sessionId;
    private final long sequence;
    private final String commandEnd;
    private final String stderrEnd;
    private final String exit;

    MarkerSet(String sessionId, long sequence) {
        this.sessionId = sessionId;
        this.sequence = sequence;
        this.commandEnd = build(COMMAND_END_PREFIX, sessionId, sequence);
        this.stderrEnd = build(STDERR_END_PREFIX, sessionId, sequence);
        this.exit = build(EXIT_PREFIX, sessionId, sequence);
    }

    private static String build(String prefix, String sessionId, long sequence) {
        return prefix + "_" + sessionId + "_" + sequence + "__";
    }

    /**
     * Rewrites a command so that it reports its exit status and end markers.
     *
     * <p>The marker commands go on their own line so that a trailing
     * {@code ;}, {@code &} or comment in the user command cannot swallow them.
     * The exit status is echoed first, before anything else can overwrite
     * {@code $?}. A blank command is replaced by {@code true}.</p>
     *
     * @param command the user command
     * @return the two lines to write to the shell, without the final newline
     */
    public String wrapLocal(String command) {
        String safe = safeCommand(command);
        return safe + "\n"
            + "echo '" + exit + " '$?; "
            + "echo '" + commandEnd + "'; "
            + "printf '" + stderrEnd + "' > /dev/stderr";
    }

    /**
     * Returns the command actually run for the given user command.
     *
     * @param command the user command
     * @return the command without trailing whitespace, or {@code true} when it is blank
     */
    public static String safeCommand(String command) {
        return command == null || command.isBlank() ? "true" : command.stripTrailing();
    }

    /**
     * Removes everything up to and including the last stale marker of the given kind.
     *
     * @param text buffered output
     * @param prefix {@link #COMMAND_END_PREFIX} or {@link #STDERR_END_PREFIX}
     * @return text with earlier calls' leftovers removed
     */
    public String dropStale(String text, String prefix) {
        Pattern stale = Pattern.compile(Pattern.quote(prefix + "_" + sessionId + "_") + "(\\d+)__\\n?");
        Matcher m = stale.matcher(text);
        int cut = -1;
        while (m.find()) {
            if (Long.parseLong(m.group(1)) != sequence) {
                cut = m.end();
            }
        }
        return cut < 0 ? text : text.substring(cut);
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getSequence() {
        return sequence;
    }

    public String getCommandEnd() {
        return commandEnd;
    }

    public String getStderrEnd() {
        return stderrEnd;
    }

    public String getExit() {
        return exit;
    }

    @Override
    public String toString() {
        return "MarkerSet{session=" + sessionId + ", sequence=" + sequence + "}";
    }
}
