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

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for SessionConfigParser and SessionConfig.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@DisplayName("SessionConfig")
public class SessionConfigParserTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Should use the documented defaults")
        void shouldUseDefaults() {
            SessionConfig config = SessionConfig.defaults();

            assertEquals(List.of("/bin/bash", "-l", "-m"), config.getShellCommand());
            assertEquals(Duration.ofSeconds(120), config.getCommandTimeout());
            assertEquals(Duration.ofMillis(500), config.getCompletionPollInterval());
            assertEquals(Duration.ofMillis(100), config.getStreamPollInterval());
            assertEquals(Duration.ofMillis(300), config.getFastCommandDelay());
            assertEquals(Duration.ofMillis(50), config.getSettleDelay());
            assertEquals(Path.of("/home/user/.dev/bin/activate"), config.getActivationFile());
            assertEquals(Set.of("cd", "ls", "pwd"), config.getFastCommands());
            assertTrue(config.getInteractiveCommands().contains("tail -f"));
            assertTrue(config.getEnvironment().isEmpty());
        }

        @Test
        @DisplayName("Should reject invalid builder values")
        void shouldRejectInvalidValues() {
            assertThrows(IllegalArgumentException.class, () -> SessionConfig.builder().commandTimeout(Duration.ZERO));
            assertThrows(IllegalArgumentException.class,
                () -> SessionConfig.builder().streamPollInterval(Duration.ofMillis(-1)));
            assertThrows(IllegalArgumentException.class, () -> SessionConfig.builder().shellCommand(List.of()));
            assertDoesNotThrow(() -> SessionConfig.builder().settleDelay(Duration.ZERO));
        }

        @Test
        @DisplayName("Should keep environment order and copy on build")
        void shouldKeepEnvironmentOrder() {
            SessionConfig.Builder builder = SessionConfig.builder()
                .putEnvironment("Z", "1")
                .putEnvironment("A", "2");
            SessionConfig config = builder.build();
            builder.putEnvironment("M", "3");

            assertEquals(List.of("Z", "A"), List.copyOf(config.getEnvironment().keySet()));
            assertThrows(UnsupportedOperationException.class, () -> config.getEnvironment().put("X", "y"));
        }

        @Test
        @DisplayName("Should derive a modified copy")
        void shouldDeriveCopy() {
            SessionConfig base = SessionConfig.defaults();
            SessionConfig derived = base.toBuilder().commandTimeout(Duration.ofSeconds(5)).build();

            assertEquals(Duration.ofSeconds(5), derived.getCommandTimeout());
            assertEquals(Duration.ofSeconds(120), base.getCommandTimeout());
        }
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Should parse every key")
        void shouldParseEveryKey() throws Exception {
            SessionConfig config = SessionConfigParser.parse(yaml(String.join("\n",
                "shell: [/bin/sh]",
                "commandTimeoutMillis: 5000",
                "completionPollMillis: 250",
                "streamPollMillis: 20",
                "fastCommandDelayMillis: 0",
                "settleDelayMillis: 10",
                "activationFile: /opt/env/activate",
                "interactiveCommands: [less, \"tail -f\"]",
                "fastCommands: [cd, echo]",
                "environment:",
                "  LANG: C.UTF-8",
                "  RETRIES: 3",
                "")));

            assertEquals(List.of("/bin/sh"), config.getShellCommand());
            assertEquals(Duration.ofSeconds(5), config.getCommandTimeout());
            assertEquals(Duration.ofMillis(250), config.getCompletionPollInterval());
            assertEquals(Duration.ofMillis(20), config.getStreamPollInterval());
            assertEquals(Duration.ZERO, config.getFastCommandDelay());
            assertEquals(Duration.ofMillis(10), config.getSettleDelay());
            assertEquals(Path.of("/opt/env/activate"), config.getActivationFile());
            assertEquals(List.of("less", "tail -f"), config.getInteractiveCommands());
            assertEquals(Set.of("cd", "echo"), config.getFastCommands());
            assertEquals(Map.of("LANG", "C.UTF-8", "RETRIES", "3"), config.getEnvironment());
        }

        @Test
        @DisplayName("Should return defaults for an empty document")
        void shouldReturnDefaultsForEmpty() throws Exception {
            SessionConfig config = SessionConfigParser.parse(yaml(""));

            assertEquals(SessionConfig.defaults().getCommandTimeout(), config.getCommandTimeout());
        }

        @Test
        @DisplayName("Should disable activation with an empty value")
        void shouldDisableActivation() throws Exception {
            assertNull(SessionConfigParser.parse(yaml("activationFile: \"\"\n")).getActivationFile());
        }

        @Test
        @DisplayName("Should reject unknown keys")
        void shouldRejectUnknownKeys() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SessionConfigParser.parse(yaml("timeout: 5\n")));

            assertTrue(e.getMessage().contains("timeout"));
        }

        @Test
        @DisplayName("Should reject wrong types")
        void shouldRejectWrongTypes() {
            assertThrows(IllegalArgumentException.class,
                () -> SessionConfigParser.parse(yaml("commandTimeoutMillis: soon\n")));
            assertThrows(IllegalArgumentException.class,
                () -> SessionConfigParser.parse(yaml("shell: /bin/bash\n")));
            assertThrows(IllegalArgumentException.class,
                () -> SessionConfigParser.parse(yaml("- a\n- b\n")));
        }

        @Test
        @DisplayName("Should reject malformed YAML")
        void shouldRejectMalformedYaml() {
            assertThrows(IllegalArgumentException.class,
                () -> SessionConfigParser.parse(yaml("environment: {A: 1\n")));
        }

        @Test
        @DisplayName("Should read a configuration file")
        void shouldReadFile(@TempDir Path dir) throws Exception {
            Path file = Files.writeString(dir.resolve("session.yaml"), "commandTimeoutMillis: 1500\n");

            assertEquals(Duration.ofMillis(1500), SessionConfigParser.parse(file).getCommandTimeout());
        }
    }
}
