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

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tunable parameters shared by local and remote sessions.
 *
 * <p>Instances are immutable; use {@link #builder()} to create one and
 * {@link #toBuilder()} to derive a modified copy.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class SessionConfig {

    /** Interactive program invocations rejected by default. */
    public static final List<String> DEFAULT_INTERACTIVE_COMMANDS = List.of(
        "tail -f", "watch", "top", "htop", "less", "more", "vim", "nano", "vi");

    /** Commands assumed to finish almost instantly. */
    public static final Set<String> DEFAULT_FAST_COMMANDS =
        Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList("cd", "ls", "pwd")));

    /** Well-known development environment activation script. */
    public static final Path DEFAULT_ACTIVATION_FILE = Path.of("/home/user/.dev/bin/activate");

    private final List<String> shellCommand;
    private final Duration commandTimeout;
    private final Duration completionPollInterval;
    private final Duration streamPollInterval;
    private final Duration fastCommandDelay;
    private final Duration settleDelay;
    private final Path activationFile;
    private final List<String> interactiveCommands;
    private final Set<String> fastCommands;
    private final Map<String, String> environment;

    private SessionConfig(Builder b) {
        this.shellCommand = List.copyOf(b.shellCommand);
        this.commandTimeout = b.commandTimeout;
        this.completionPollInterval = b.completionPollInterval;
        this.streamPollInterval = b.streamPollInterval;
        this.fastCommandDelay = b.fastCommandDelay;
        this.settleDelay = b.settleDelay;
        this.activationFile = b.activationFile;
        this.interactiveCommands = List.copyOf(b.interactiveCommands);
        this.fastCommands = Collections.unmodifiableSet(new LinkedHashSet<>(b.fastCommands));
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(b.environment));
    }

    /**
     * Returns the configuration with all defaults.
     *
     * @return default configuration
     */
    public static SessionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder pre-populated with this configuration's values.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.shellCommand = shellCommand;
        b.commandTimeout = commandTimeout;
        b.completionPollInterval = completionPollInterval;
        b.streamPollInterval = streamPollInterval;
        b.fastCommandDelay = fastCommandDelay;
        b.settleDelay = settleDelay;
        b.activationFile = activationFile;
        b.interactiveCommands = interactiveCommands;
        b.fastCommands = fastCommands;
        b.environment = new LinkedHashMap<>(environment);
        return b;
    }

    /** Program and arguments used to spawn a local shell. */
    public List<String> getShellCommand() {
        return shellCommand;
    }

    /** Upper bound for one command, from write to the last marker. */
    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    /** Delay between two process table snapshots. */
    public Duration getCompletionPollInterval() {
        return completionPollInterval;
    }

    /** Delay between two stream polls that yielded no data. */
    public Duration getStreamPollInterval() {
        return streamPollInterval;
    }

    /** Fixed delay after which an allowlisted command is assumed finished. */
    public Duration getFastCommandDelay() {
        return fastCommandDelay;
    }

    /** Pause after each environment export and remote send. */
    public Duration getSettleDelay() {
        return settleDelay;
    }

    /** Activation script sourced at setup when it exists; may be null. */
    public Path getActivationFile() {
        return activationFile;
    }

    public List<String> getInteractiveCommands() {
        return interactiveCommands;
    }

    public Set<String> getFastCommands() {
        return fastCommands;
    }

    /** Environment variables in the order they are exported. */
    public Map<String, String> getEnvironment() {
        return environment;
    }

    @Override
    public String toString() {
        return "SessionConfig{shell=" + shellCommand
            + ", timeout=" + commandTimeout.toMillis() + "ms"
            + ", environment=" + environment.keySet() + "}";
    }

    /**
     * Builder for {@link SessionConfig}.
     */
    public static final class Builder {
        private List<String> shellCommand = List.of("/bin/bash", "-l", "-m");
        private Duration commandTimeout = Duration.ofSeconds(120);
        private Duration completionPollInterval = Duration.ofMillis(500);
        private Duration streamPollInterval = Duration.ofMillis(100);
        private Duration fastCommandDelay = Duration.ofMillis(300);
        private Duration settleDelay = Duration.ofMillis(50);
        private Path activationFile = DEFAULT_ACTIVATION_FILE;
        private List<String> interactiveCommands = DEFAULT_INTERACTIVE_COMMANDS;
        private Set<String> fastCommands = DEFAULT_FAST_COMMANDS;
        private Map<String, String> environment = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder shellCommand(List<String> shellCommand) {
            if (shellCommand == null || shellCommand.isEmpty()) {
                throw new IllegalArgumentException("Shell command cannot be null or empty");
            }
            this.shellCommand = shellCommand;
            return this;
        }

        public Builder commandTimeout(Duration commandTimeout) {
            this.commandTimeout = positive(commandTimeout, "commandTimeout");
            return this;
        }

        public Builder completionPollInterval(Duration interval) {
            this.completionPollInterval = positive(interval, "completionPollInterval");
            return this;
        }

        public Builder streamPollInterval(Duration interval) {
            this.streamPollInterval = positive(interval, "streamPollInterval");
            return this;
        }

        public Builder fastCommandDelay(Duration delay) {
            this.fastCommandDelay = notNegative(delay, "fastCommandDelay");
            return this;
        }

        public Builder settleDelay(Duration delay) {
            this.settleDelay = notNegative(delay, "settleDelay");
            return this;
        }

        /**
         * Sets the activation script; {@code null} disables sourcing.
         *
         * @param activationFile script path or null
         * @return this builder
         */
        public Builder activationFile(Path activationFile) {
            this.activationFile = activationFile;
            return this;
        }

        public Builder interactiveCommands(List<String> interactiveCommands) {
            this.interactiveCommands = requireNonNull(interactiveCommands, "interactiveCommands");
            return this;
        }

        public Builder fastCommands(Set<String> fastCommands) {
            this.fastCommands = requireNonNull(fastCommands, "fastCommands");
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = new LinkedHashMap<>(requireNonNull(environment, "environment"));
            return this;
        }

        public Builder putEnvironment(String key, String value) {
            if (key == null || key.isEmpty()) {
                throw new IllegalArgumentException("Environment variable name cannot be null or empty");
            }
            this.environment.put(key, value == null ? "" : value);
            return this;
        }

        public SessionConfig build() {
            return new SessionConfig(this);
        }

        private static Duration positive(Duration d, String name) {
            if (d == null || d.isNegative() || d.isZero()) {
                throw new IllegalArgumentException(name + " must be a positive duration");
            }
            return d;
        }

        private static Duration notNegative(Duration d, String name) {
            if (d == null || d.isNegative()) {
                throw new IllegalArgumentException(name + " cannot be negative");
            }
            return d;
        }

        private static <T> T requireNonNull(T value, String name) {
            if (value == null) {
                throw new IllegalArgumentException(name + " cannot be null");
            }
            return value;
        }
    }
}
