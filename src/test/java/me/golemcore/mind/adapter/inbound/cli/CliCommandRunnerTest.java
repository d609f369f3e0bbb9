package me.golemcore.mind.adapter.inbound.cli;

import me.golemcore.mind.adapter.inbound.command.CommandRouter;
import me.golemcore.mind.port.inbound.CommandPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CliCommandRunnerTest {

    private CommandPort commandPort;
    private CliCommandRunner runner;
    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private PrintStream out;
    private PrintStream err;

    @BeforeEach
    void setUp() {
        commandPort = mock(CommandPort.class);
        runner = new CliCommandRunner(commandPort);
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
    }

    @Test
    void shouldPassProjectAndArgumentsToCommand() {
        when(commandPort.execute(eq("log"), eq(List.of("--kind=decision", "use", "Postgres")),
                eq(Map.of(CommandRouter.CONTEXT_PROJECT, "/work/demo"))))
                .thenReturn(CommandPort.CommandResult.success("Logged decision to MEMORY.md"));

        int code = runner.dispatch(List.of("--project=/work/demo", "log", "--kind=decision", "use", "Postgres"),
                out, err);

        assertEquals(0, code);
        assertEquals("Logged decision to MEMORY.md", outBytes.toString(StandardCharsets.UTF_8).trim());
        assertEquals("", errBytes.toString(StandardCharsets.UTF_8));
    }

    @Test
    void shouldDefaultToWorkingDirectoryProject() {
        when(commandPort.execute(anyString(), anyList(), anyMap()))
                .thenReturn(CommandPort.CommandResult.success("ok"));

        runner.dispatch(List.of("status"), out, err);

        verify(commandPort).execute("status", List.of(), Map.of(CommandRouter.CONTEXT_PROJECT, ""));
    }

    @Test
    void shouldSkipSpringAndConfigurationOptions() {
        when(commandPort.execute(anyString(), anyList(), anyMap()))
                .thenReturn(CommandPort.CommandResult.success("ok"));

        runner.dispatch(List.of("--spring.main.banner-mode=off", "--mind.session.gap-threshold=10m",
                "--logging.level.root=WARN", "recall", "--force"), out, err);

        verify(commandPort).execute("recall", List.of("--force"), Map.of(CommandRouter.CONTEXT_PROJECT, ""));
    }

    @Test
    void shouldPrintFailuresToErrorStream() {
        when(commandPort.execute(anyString(), anyList(), anyMap()))
                .thenReturn(CommandPort.CommandResult.failure("Unknown command: forget. Try 'help'."));

        int code = runner.dispatch(List.of("forget"), out, err);

        assertEquals(1, code);
        assertEquals("", outBytes.toString(StandardCharsets.UTF_8));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("Unknown command: forget"));
    }

    @Test
    void shouldDoNothingWithoutCommand() {
        int code = runner.dispatch(List.of("--project=/work/demo"), out, err);

        assertEquals(0, code);
        verify(commandPort, never()).execute(anyString(), anyList(), any());
    }

    @Test
    void shouldExposeExitCodeAfterRun() {
        when(commandPort.execute(anyString(), anyList(), anyMap()))
                .thenReturn(CommandPort.CommandResult.failure("Reminder not found: 9"));

        runner.run(new DefaultApplicationArguments("done", "9"));

        assertEquals(1, runner.getExitCode());
    }
}
