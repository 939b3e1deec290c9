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

package com.scivicslab.shellsession.local;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.scivicslab.shellsession.CommandResult;
import com.scivicslab.shellsession.InteractiveCommandRejectedException;
import com.scivicslab.shellsession.ProcessExitedException;
import com.scivicslab.shellsession.ReadTimeoutException;
import com.scivicslab.shellsession.SessionConfig;
import com.scivicslab.shellsession.SessionState;
import com.scivicslab.shellsession.TransportWriteFailedException;
import com.scivicslab.shellsession.local.FakeShellProcess.Reply;
import com.scivicslab.shellsession.support.FakePollClock;

/**
 * Tests for LocalSession against a scripted shell.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@DisplayName("LocalSession")
public class LocalSessionTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private FakePollClock clock;
    private FakeShellProcess shell;
    private List<String> detectorCalls;
    private LocalSession session;

    @BeforeEach
    void setUp() {
        clock = new FakePollClock();
        detectorCalls = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (session != null) {
            session.teardown();
        }
    }

    private SessionConfig.Builder config() {
        return SessionConfig.builder()
            .commandTimeout(TIMEOUT)
            .activationFile(null);
    }

    private LocalSession create(SessionConfig config, Function<String, Reply> responder) {
        shell = new FakeShellProcess(responder);
        session = new LocalSession("test01", config, shell.launcher(), command -> {
            detectorCalls.add(command);
            return true;
        }, clock);
        return session;
    }

    private LocalSession started(Function<String, Reply> responder) throws IOException {
        create(config().build(), responder).setup();
        return session;
    }

    private static Reply echo(String command) {
        if (command.startsWith("echo ")) {
            return Reply.ok(command.substring(5) + "\n");
        }
        if (command.equals("false")) {
            return Reply.of("", "", 1);
        }
        return Reply.ok("");
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should launch the configured shell on setup")
        void shouldLaunchConfiguredShell() throws Exception {
            SessionConfig cfg = config().putEnvironment("A", "1").build();
            create(cfg, LocalSessionTest::echo);

            assertEquals(SessionState.UNINITIALIZED, session.getState());
            session.setup();

            assertEquals(SessionState.READY, session.getState());
            assertEquals(List.of("/bin/bash", "-l", "-m"), shell.getLaunchCommand());
            assertEquals("1", shell.getLaunchEnvironment().get("A"));
            assertEquals("test01", session.getId());
        }

        @Test
        @DisplayName("Should reject a second setup")
        void shouldRejectSecondSetup() throws Exception {
            started(LocalSessionTest::echo);

            assertThrows(IllegalStateException.class, () -> session.setup());
        }

        @Test
        @DisplayName("Should reject execute before setup")
        void shouldRejectExecuteBeforeSetup() {
            create(config().build(), LocalSessionTest::echo);

            assertThrows(IllegalStateException.class, () -> session.execute("echo hi"));
        }

        @Test
        @DisplayName("Should tolerate teardown twice and kill the shell once")
        void shouldTolerateDoubleTeardown() throws Exception {
            started(LocalSessionTest::echo);

            session.teardown();
            session.teardown();

            assertEquals(SessionState.CLOSED, session.getState());
            assertEquals(1, shell.getDestroyCount());
            assertThrows(IllegalStateException.class, () -> session.execute("echo hi"));
        }

        @Test
        @DisplayName("Should close a session that was never set up")
        void shouldCloseUnstartedSession() {
            create(config().build(), LocalSessionTest::echo);

            session.close();

            assertEquals(SessionState.CLOSED, session.getState());
            assertEquals(0, shell.getDestroyCount());
        }

        @Test
        @DisplayName("Should not leak the shell banner into the first command")
        void shouldNotLeakBanner() throws Exception {
            create(config().build(), LocalSessionTest::echo);
            shell.banner("Last login: Mon Oct 19 09:00:00\n");
            session.setup();

            assertEquals("hello\n", session.execute("echo hello").getStdout());
        }

        @Test
        @DisplayName("Should export environment variables in order with quoting")
        void shouldExportEnvironment() throws Exception {
            SessionConfig cfg = config()
                .putEnvironment("GREETING", "it's me")
                .putEnvironment("PATH_EXTRA", "/opt/bin")
                .build();
            create(cfg, LocalSessionTest::echo).setup();

            assertEquals(List.of("export GREETING='it'\\''s me'", "export PATH_EXTRA='/opt/bin'"),
                shell.getCommands());
            // one quiet poll while draining, then one settle delay per export
            assertEquals(cfg.getStreamPollInterval().plus(cfg.getSettleDelay().multipliedBy(2)), clock.elapsed());
        }

        @Test
        @DisplayName("Should source an existing activation file first")
        void shouldSourceActivationFile(@TempDir Path dir) throws Exception {
            Path activate = Files.writeString(dir.resolve("activate"), "export VIRTUAL_ENV=/x\n");
            SessionConfig cfg = config().activationFile(activate).putEnvironment("K", "v").build();
            create(cfg, LocalSessionTest::echo).setup();

            assertEquals(List.of("source " + activate, "export K='v'"), shell.getCommands());
        }

        @Test
        @DisplayName("Should skip a missing activation file")
        void shouldSkipMissingActivationFile(@TempDir Path dir) throws Exception {
            SessionConfig cfg = config().activationFile(dir.resolve("missing")).build();
            create(cfg, LocalSessionTest::echo).setup();

            assertTrue(shell.getCommands().isEmpty());
        }

        @Test
        @DisplayName("Should tear down when setup fails")
        void shouldTearDownWhenSetupFails() {
            SessionConfig cfg = config().putEnvironment("K", "v").build();
            create(cfg, command -> Reply.dies("", "bash: broken\n"));

            assertThrows(ProcessExitedException.class, () -> session.setup());
            assertEquals(SessionState.CLOSED, session.getState());
            assertEquals(1, shell.getDestroyCount());
        }
    }

    @Nested
    @DisplayName("Execute")
    class Execute {

        @Test
        @DisplayName("Should return stdout and a zero exit code")
        void shouldReturnStdout() throws Exception {
            started(LocalSessionTest::echo);

            CommandResult result = session.execute("echo hello");

            assertEquals("hello\n", result.getStdout());
            assertEquals("", result.getStderr());
            assertEquals(0, result.getExitCode());
            assertTrue(result.isSuccess());
            assertEquals(SessionState.READY, session.getState());
        }

        @Test
        @DisplayName("Should report a failing command")
        void shouldReportFailure() throws Exception {
            started(LocalSessionTest::echo);

            CommandResult result = session.execute("false");

            assertEquals("", result.getStdout());
            assertEquals(1, result.getExitCode());
        }

        @Test
        @DisplayName("Should separate stderr from stdout")
        void shouldSeparateStderr() throws Exception {
            started(command -> Reply.of("out\n", "oops\n", 2));

            CommandResult result = session.execute("make build");

            assertEquals("out\n", result.getStdout());
            assertEquals("oops\n", result.getStderr());
            assertEquals(2, result.getExitCode());
        }

        @Test
        @DisplayName("Should never return marker text")
        void shouldNotLeakMarkers() throws Exception {
            started(command -> Reply.of("a\nb\n", "c\n", 0));

            for (int i = 0; i < 5; i++) {
                CommandResult result = session.execute("cmd " + i);
                assertFalse(result.getStdout().contains("__"), result.getStdout());
                assertFalse(result.getStderr().contains("__"), result.getStderr());
            }
        }

        @Test
        @DisplayName("Should default the exit code to 1 when the status is unreadable")
        void shouldDefaultUnreadableStatus() throws Exception {
            started(command -> Reply.withStatus("text\n", "garbage"));

            CommandResult result = session.execute("weird");

            assertEquals(1, result.getExitCode());
            assertEquals("text\n", result.getStdout());
        }

        @Test
        @DisplayName("Should run true for a blank command")
        void shouldRunTrueForBlank() throws Exception {
            started(LocalSessionTest::echo);

            CommandResult result = session.execute("   ");

            assertEquals(0, result.getExitCode());
            assertEquals(List.of("true"), shell.getCommands());
        }

        @Test
        @DisplayName("Should strip trailing whitespace and newlines from the command")
        void shouldStripTrailingWhitespace() throws Exception {
            started(LocalSessionTest::echo);

            assertEquals("hi\n", session.execute("echo hi  \n").getStdout());
            assertEquals(2, shell.getRawLines().size());
            assertEquals("echo hi", shell.getRawLines().get(0));
        }

        @Test
        @DisplayName("Should write the markers on a line of their own")
        void shouldWriteMarkersOnOwnLine() throws Exception {
            started(LocalSessionTest::echo);

            session.execute("echo hi # note");
            session.execute("sleep 0 &");

            assertEquals(List.of("echo hi # note", "sleep 0 &"), shell.getCommands());
            assertEquals("echo hi # note", shell.getRawLines().get(0));
            assertTrue(shell.getRawLines().get(1).startsWith("echo '__EXIT_test01_1__ '$?"),
                shell.getRawLines().get(1));
        }

        @Test
        @DisplayName("Should consult the completion detector only when waiting")
        void shouldConsultDetectorWhenWaiting() throws Exception {
            started(LocalSessionTest::echo);

            session.execute("echo one", false);
            assertTrue(detectorCalls.isEmpty());

            session.execute("echo two");
            assertEquals(List.of("echo two"), detectorCalls);
        }

        @Test
        @DisplayName("Should reject a concurrent execute")
        void shouldRejectConcurrentExecute() throws Exception {
            AtomicReference<Throwable> nested = new AtomicReference<>();
            AtomicReference<SessionState> observed = new AtomicReference<>();
            started(command -> {
                if (command.equals("outer")) {
                    observed.set(session.getState());
                    nested.set(assertThrows(IllegalStateException.class, () -> session.execute("inner")));
                }
                return Reply.ok("");
            });

            session.execute("outer");

            assertEquals(SessionState.EXECUTING, observed.get());
            assertNotNull(nested.get());
            assertEquals(List.of("outer"), shell.getCommands());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should reject interactive commands without writing")
        void shouldRejectInteractive() throws Exception {
            started(LocalSessionTest::echo);

            InteractiveCommandRejectedException e = assertThrows(InteractiveCommandRejectedException.class,
                () -> session.execute("cd /etc && vim hosts"));

            assertEquals("cd /etc && vim hosts", e.getCommand());
            assertTrue(shell.getRawLines().isEmpty());
            assertEquals(SessionState.READY, session.getState());
        }

        @Test
        @DisplayName("Should report a write failure and stay usable")
        void shouldReportWriteFailure() throws Exception {
            started(LocalSessionTest::echo);
            shell.breakStdin();

            TransportWriteFailedException e = assertThrows(TransportWriteFailedException.class,
                () -> session.execute("echo hi"));

            assertTrue(e.getCause() instanceof IOException);
            assertEquals(SessionState.READY, session.getState());
        }

        @Test
        @DisplayName("Should report a shell that exits during a command")
        void shouldReportExitedShell() throws Exception {
            started(command -> command.equals("exit 3") ? Reply.dies("bye\n", "") : Reply.ok(""));

            ProcessExitedException e = assertThrows(ProcessExitedException.class,
                () -> session.execute("exit 3"));

            assertEquals("bye\n", e.getPartialStdout());
        }

        @Test
        @DisplayName("Should time out and discard the late output in the next call")
        void shouldDiscardLateOutput() throws Exception {
            started(command -> command.startsWith("sleep")
                ? Reply.hang("slow\n", "slow-err\n", 0)
                : echo(command));

            ReadTimeoutException e = assertThrows(ReadTimeoutException.class,
                () -> session.execute("sleep 5"));
            assertEquals(TIMEOUT, e.getTimeout());
            assertEquals(SessionState.READY, session.getState());

            CommandResult result = session.execute("echo fresh");

            assertEquals("fresh\n", result.getStdout());
            assertEquals("", result.getStderr());
            assertEquals(0, result.getExitCode());
        }
    }

    @Test
    @DisplayName("Should single-quote values for the shell")
    void shouldQuoteValues() {
        assertEquals("'plain'", LocalSession.quote("plain"));
        assertEquals("'a'\\''b'", LocalSession.quote("a'b"));
        assertEquals("'$HOME'", LocalSession.quote("$HOME"));
    }
}
