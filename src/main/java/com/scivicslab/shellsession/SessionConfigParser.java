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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Parser for session configuration files in YAML format.
 *
 * <p>All keys are optional. Durations are given in milliseconds. Example:</p>
 *
 * <pre>
 * shell: ["/bin/bash", "-l", "-m"]
 * commandTimeoutMillis: 60000
 * completionPollMillis: 500
 * streamPollMillis: 100
 * fastCommandDelayMillis: 300
 * settleDelayMillis: 50
 * activationFile: /home/user/.dev/bin/activate
 * interactiveCommands: ["tail -f", "watch", "top", "less", "vim"]
 * fastCommands: ["cd", "ls", "pwd"]
 * environment:
 *   LANG: C.UTF-8
 *   PATH_EXTRA: /opt/tools/bin
 * </pre>
 *
 * <p>Set {@code activationFile} to an empty string to disable sourcing.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class SessionConfigParser {

    private static final Set<String> KNOWN_KEYS = Set.of(
        "shell", "commandTimeoutMillis", "completionPollMillis", "streamPollMillis",
        "fastCommandDelayMillis", "settleDelayMillis", "activationFile",
        "interactiveCommands", "fastCommands", "environment");

    /**
     * Parses a configuration file.
     *
     * @param path path of the YAML file
     * @return the parsed configuration
     * @throws IOException if the file cannot be read
     */
    public static SessionConfig parse(Path path) throws IOException {
        try (InputStream input = Files.newInputStream(path)) {
            return parse(input);
        }
    }

    /**
     * Parses a configuration document.
     *
     * @param input InputStream of the YAML document
     * @return the parsed configuration
     * @throws IOException if reading fails
     * @throws IllegalArgumentException if the document is malformed or has unknown keys
     */
    public static SessionConfig parse(InputStream input) throws IOException {
        Object document;
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
            document = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid session configuration: " + e.getMessage(), e);
        }

        SessionConfig.Builder builder = SessionConfig.builder();
        if (document == null) {
            return builder.build();
        }
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("Session configuration must be a YAML mapping");
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> root = (Map<String, Object>) document;
        for (String key : root.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown configuration key: " + key);
            }
        }

        if (root.containsKey("shell")) {
            builder.shellCommand(stringList(root.get("shell"), "shell"));
        }
        if (root.containsKey("commandTimeoutMillis")) {
            builder.commandTimeout(millis(root.get("commandTimeoutMillis"), "commandTimeoutMillis"));
        }
        if (root.containsKey("completionPollMillis")) {
            builder.completionPollInterval(millis(root.get("completionPollMillis"), "completionPollMillis"));
        }
        if (root.containsKey("streamPollMillis")) {
            builder.streamPollInterval(millis(root.get("streamPollMillis"), "streamPollMillis"));
        }
        if (root.containsKey("fastCommandDelayMillis")) {
            builder.fastCommandDelay(millis(root.get("fastCommandDelayMillis"), "fastCommandDelayMillis"));
        }
        if (root.containsKey("settleDelayMillis")) {
            builder.settleDelay(millis(root.get("settleDelayMillis"), "settleDelayMillis"));
        }
        if (root.containsKey("activationFile")) {
            Object value = root.get("activationFile");
            String file = value == null ? "" : value.toString().trim();
            builder.activationFile(file.isEmpty() ? null : Path.of(file));
        }
        if (root.containsKey("interactiveCommands")) {
            builder.interactiveCommands(stringList(root.get("interactiveCommands"), "interactiveCommands"));
        }
        if (root.containsKey("fastCommands")) {
            builder.fastCommands(new LinkedHashSet<>(stringList(root.get("fastCommands"), "fastCommands")));
        }
        if (root.containsKey("environment")) {
            builder.environment(stringMap(root.get("environment"), "environment"));
        }
        return builder.build();
    }

    private static Duration millis(Object value, String key) {
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException(key + " must be a number of milliseconds: " + value);
        }
        return Duration.ofMillis(((Number) value).longValue());
    }

    private static List<String> stringList(Object value, String key) {
        if (!(value instanceof List)) {
            throw new IllegalArgumentException(key + " must be a list: " + value);
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item == null) {
                throw new IllegalArgumentException(key + " cannot contain null entries");
            }
            result.add(item.toString());
        }
        return result;
    }

    private static Map<String, String> stringMap(Object value, String key) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException(key + " must be a mapping: " + value);
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            result.put(String.valueOf(entry.getKey()),
                entry.getValue() == null ? "" : entry.getValue().toString());
        }
        return result;
    }
}
