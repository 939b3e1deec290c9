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

package com.scivicslab.shellsession.completion;

import java.util.List;
import java.util.Set;

import com.scivicslab.shellsession.guard.CommandSplitter;

/**
 * Allowlist of programs that always return almost instantly.
 *
 * <p>Commands made only of such programs are assumed finished after a
 * fixed short delay instead of polling the process table.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class FastCommandPolicy {

    private final Set<String> programs;

    public FastCommandPolicy(Set<String> programs) {
        this.programs = Set.copyOf(programs);
    }

    /**
     * Checks whether every {@code &&} clause starts with an allowlisted program.
     *
     * @param command the command
     * @return true if the command needs no process table polling
     */
    public boolean isFast(String command) {
        List<String> clauses = CommandSplitter.splitAnd(command);
        if (clauses.isEmpty()) {
            return false;
        }
        for (String clause : clauses) {
            if (!programs.contains(CommandSplitter.firstToken(clause))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks a single clause as the remote wait does: an allowlisted program,
     * or a program invoked without arguments.
     *
     * @param clause one clause
     * @return true if the clause needs no process table polling
     */
    public boolean isFastClause(String clause) {
        return programs.contains(CommandSplitter.firstToken(clause))
            || !CommandSplitter.hasArguments(clause);
    }

    public Set<String> getPrograms() {
        return programs;
    }
}
