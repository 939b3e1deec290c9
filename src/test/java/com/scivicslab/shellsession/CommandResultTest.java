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

import static org.junit.jupiter.api.Assertions.*;

import org.json.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for CommandResult.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@DisplayName("CommandResult")
public class CommandResultTest {

    @Test
    @DisplayName("Should expose its values")
    void shouldExposeValues() {
        CommandResult result = new CommandResult("out\n", "err\n", 2);

        assertEquals("out\n", result.getStdout());
        assertEquals("err\n", result.getStderr());
        assertEquals(2, result.getExitCode());
        assertFalse(result.isSuccess());
    }

    @Test
    @DisplayName("Should replace null streams with empty text")
    void shouldReplaceNulls() {
        CommandResult result = new CommandResult(null, null, 0);

        assertEquals("", result.getStdout());
        assertEquals("", result.getStderr());
        assertTrue(result.isSuccess());
    }

    @Test
    @DisplayName("Should convert to JSON")
    void shouldConvertToJson() {
        JSONObject json = new CommandResult("hello\n", "", 0).toJson();

        assertEquals("hello\n", json.getString("stdout"));
        assertEquals("", json.getString("stderr"));
        assertEquals(0, json.getInt("exit_code"));
    }
}
