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

package com.scivicslab.shellsession.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.json.JSONArray;

import com.scivicslab.shellsession.CommandResult;
import com.scivicslab.shellsession.Session;
import com.scivicslab.shellsession.SessionConfig;
import com.scivicslab.shellsession.SessionConfigParser;
import com.scivicslab.shellsession.local.LocalSession;
import com.scivicslab.shellsession.remote.sshd.SshConnection;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command-line interface that runs a sequence of commands in one persistent shell.
 *
 * <h2>Usage</h2>
 * <pre>
 * java -jar shell-session.jar "cd /tmp" "pwd" "ls -la"
 * java -jar shell-session.jar -H node1 -u admin -i ~/.ssh/id_ed25519 "uname -a"
 * printf 'export A=1\necho $A\n' | java -jar shell-session.jar --json
 * </pre>
 *
 * <p>Commands run sequentially in the same shell, so working directory and
 * exported variables carry over. The process exit code is the exit code of
 * the last command, or 1 when the session itself fails.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@Command(
    name = "shell-session",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    description = "Run commands one after another in a persistent local or SSH shell."
)
public class ShellSessionCLI implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(ShellSessionCLI.class.getName());

    @Option(
        names = {"-c", "--config"},
        description = "Session configuration file (YAML)"
    )
    private Path configFile;

    @Option(
        names = {"-H", "--host"},
        description = "Remote host; without it commands run in a local shell"
    )
    private String host;

    @Option(
        names = {"-u", "--user"},
        description = "SSH username (default: ${DEFAULT-VALUE})",
        defaultValue = "${sys:user.name}"
    )
    private String user;

    @Option(
        names = {"-p", "--port"},
        description = "SSH port (default: ${DEFAULT-VALUE})",
        defaultValue = "22"
    )
    private int port;

    @Option(
        names = {"-i", "--identity"},
        description = "SSH private key file"
    )
    private Path identityFile;

    @Option(
        names = {"--password-env"},
        description = "Name of the environment variable holding the SSH password"
    )
    private String passwordEnv;

    @Option(
        names = {"--connect-timeout"},
        description = "SSH connect timeout in seconds (default: ${DEFAULT-VALUE})",
        defaultValue = "10"
    )
    private int connectTimeoutSeconds;

    @Option(
        names = {"-e", "--env"},
        description = "Environment variable exported in the shell (KEY=VALUE, repeatable)"
    )
    private Map<String, String> environment = new LinkedHashMap<>();

    @Option(
        names = {"--no-wait"},
        description = "Do not wait for commands to leave the process table"
    )
    private boolean noWait;

    @Option(
        names = {"--json"},
        description = "Print results as a JSON array"
    )
    private boolean json;

    @Parameters(
        description = "Commands to run; read one per line from stdin when omitted"
    )
    private List<String> commands = new ArrayList<>();

    private InputStream stdin = System.in;
    private PrintStream out = System.out;
    private PrintStream err = System.err;

    /**
     * Main entry point.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new ShellSessionCLI()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Redirects the streams used by this command.
     *
     * @param stdin source of commands when none are given as parameters
     * @param out destination of results
     * @param err destination of error messages
     * @return this command
     */
    ShellSessionCLI withStreams(InputStream stdin, PrintStream out, PrintStream err) {
        this.stdin = stdin;
        this.out = out;
        this.err = err;
        return this;
    }

    @Override
    public Integer call() {
        SessionConfig config;
        List<String> toRun;
        try {
            config = loadConfig();
            toRun = commands.isEmpty() ? readCommands(stdin) : commands;
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (host == null) {
            try (Session session = new LocalSession(config)) {
                return run(session, toRun);
            }
        }

        String password = passwordEnv == null ? null : System.getenv(passwordEnv);
        if (passwordEnv != null && password == null) {
            err.println("Error: environment variable " + passwordEnv + " is not set");
            return 1;
        }
        try (SshConnection connection = SshConnection.connect(host, port, user, identityFile, password,
                Duration.ofSeconds(connectTimeoutSeconds));
             Session session = connection.openSession(config)) {
            return run(session, toRun);
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "SSH connection to " + host + " failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Sets up the session and runs the commands in order, stopping at the first session failure.
     *
     * @param session an unopened session
     * @param toRun commands to execute
     * @return exit code of the last command, or 1 on session failure
     */
    int run(Session session, List<String> toRun) {
        JSONArray results = new JSONArray();
        int lastExitCode = 0;
        try {
            session.setup();
            LOG.info("Session " + session.getId() + " ready, running " + toRun.size() + " command(s)");
            for (String command : toRun) {
                CommandResult result = session.execute(command, !noWait);
                lastExitCode = result.getExitCode();
                if (json) {
                    results.put(result.toJson().put("command", command));
                } else {
                    print(result);
                }
            }
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Session " + session.getId() + " failed", e);
            err.println("Error: " + e.getMessage());
            lastExitCode = 1;
        } finally {
            if (json) {
                out.println(results.toString(2));
            }
        }
        return lastExitCode;
    }

    private void print(CommandResult result) {
        out.print(result.getStdout());
        if (!result.getStdout().isEmpty() && !result.getStdout().endsWith("\n")) {
            out.println();
        }
        if (!result.getStderr().isEmpty()) {
            err.print(result.getStderr());
        }
    }

    private SessionConfig loadConfig() throws IOException {
        SessionConfig base = configFile == null ? SessionConfig.defaults() : SessionConfigParser.parse(configFile);
        if (environment.isEmpty()) {
            return base;
        }
        SessionConfig.Builder builder = base.toBuilder();
        environment.forEach(builder::putEnvironment);
        return builder.build();
    }

    static List<String> readCommands(InputStream input) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    lines.add(line);
                }
            }
        }
        return lines;
    }
}
