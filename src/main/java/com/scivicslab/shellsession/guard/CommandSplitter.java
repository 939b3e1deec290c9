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
import java.util.regex.Pattern;

/**
 * Splits composite shell commands into clauses.
 *
 * <p>Splitting is purely textual: quoting and escaping are not interpreted,
 * so a {@code ;} inside a quoted argument also splits.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class CommandSplitter {

    private static final Pattern AND = Pattern.compile("&&");
    private static final Pattern AND_OR_SEMICOLON = Pattern.compile("&&|;");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private CommandSplitter() {
        // Utility class
    }

    /**
     * Splits on {@code &&} and {@code ;}. Clauses are trimmed; blank clauses are dropped.
     *
     * @param command the composite command
     * @return the clauses in order
     */
    public static List<String> splitClauses(String command) {
        return split(AND_OR_SEMICOLON, command);
    }

    /**
     * Splits on {@code &&} only. Clauses are trimmed; blank clauses are dropped.
     *
     * @param command the composite command
     * @return the clauses in order
     */
    public static List<String> splitAnd(String command) {
        return split(AND, command);
    }

    /**
     * Returns the first whitespace-delimited token of a clause.
     *
     * @param clause the clause
     * @return the program name, or an empty string for a blank clause
     */
    public static String firstToken(String clause) {
        String trimmed = clause == null ? "" : clause.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        return WHITESPACE.split(trimmed, 2)[0];
    }

    /**
     * Tells whether a clause has anything after its program name.
     *
     * @param clause the clause
     * @return true if the clause has arguments
     */
    public static boolean hasArguments(String clause) {
        String trimmed = clause == null ? "" : clause.trim();
        return WHITESPACE.split(trimmed, 2).length > 1;
    }

    private static List<String> split(Pattern separator, String command) {
        List<String> clauses = new ArrayList<>();
        if (command == null) {
            return clauses;
        }
        for (String part : separator.split(command, -1)) {
            String clause = part.trim();
            if (!clause.isEmpty()) {
                clauses.add(clause);
            }
        }
        return clauses;
    }
}
