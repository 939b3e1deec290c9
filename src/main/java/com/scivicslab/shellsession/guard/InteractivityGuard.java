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

package com.scivicslab.shellsession.guard;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.scivicslab.shellsession.SessionConfig;

/**
 * Pre-execution filter for commands that need a live terminal.
 *
 * <p>Each {@code &&}/{@code ;} clause of a command is lowercased and compared
 * with a catalog of interactive invocations. A clause matches an entry when
 * both start with the same program name and the clause starts with the whole
 * entry, so {@code "tail -f"} rejects {@code tail -f app.log} but not
 * {@code tail -n 5 app.log}.</p>
 *
 * <p>This is a best-effort safety net, not a sandbox. A command that passes
 * is not guaranteed to run unattended.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class InteractivityGuard {

    private final List<String> catalog;

    /**
     * Creates a guard with the default catalog.
     */
    public InteractivityGuard() {
        this(SessionConfig.DEFAULT_INTERACTIVE_COMMANDS);
    }

    /**
     * Creates a guard with the given catalog.
     *
     * @param catalog interactive invocations, e.g. {@code "less"} or {@code "tail -f"}
     */
    public InteractivityGuard(List<String> catalog) {
        List<String> entries = new ArrayList<>();
        for (String entry : catalog) {
            String normalized = entry.trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty()) {
                entries.add(normalized);
            }
        }
        this.catalog = List.copyOf(entries);
    }

    /**
     * Checks whether any clause of the command is a known interactive invocation.
     *
     * @param command the command to inspect
     * @return true on the first matching clause
     */
    public boolean isInteractive(String command) {
        for (String clause : CommandSplitter.splitClauses(command)) {
            String lowered = clause.toLowerCase(Locale.ROOT);
            String program = CommandSplitter.firstToken(lowered);
            for (String entry : catalog) {
                if (program.equals(CommandSplitter.firstToken(entry)) && lowered.startsWith(entry)) {
                    return true;
                }
            }
        }
        return false;
    }

    public List<String> getCatalog() {
        return catalog;
    }
}
