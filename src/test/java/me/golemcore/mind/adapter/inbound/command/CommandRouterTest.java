package me.golemcore.mind.adapter.inbound.command;

import me.golemcore.mind.domain.exception.MalformedTriggerException;
import me.golemcore.mind.domain.exception.StorageException;
import me.golemcore.mind.domain.model.BlockerResult;
import me.golemcore.mind.domain.model.HealthReport;
import me.golemcore.mind.domain.model.LogKind;
import me.golemcore.mind.domain.model.LogResult;
import me.golemcore.mind.domain.model.LoopWarning;
import me.golemcore.mind.domain.model.PromotionResult;
import me.golemcore.mind.domain.model.RecallResult;
import me.golemcore.mind.domain.model.Reminder;
import me.golemcore.mind.domain.model.ReminderList;
import me.golemcore.mind.domain.model.ReminderTrigger;
import me.golemcore.mind.domain.model.SearchHit;
import me.golemcore.mind.domain.model.SessionCheck;
import me.golemcore.mind.domain.model.SessionInfo;
import me.golemcore.mind.domain.service.MindService;
import me.golemcore.mind.port.inbound.CommandPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CommandRouterTest {

    private static final String PROJECT = "/work/demo";
    private static final Map<String, Object> CTX = Map.of(CommandRouter.CONTEXT_PROJECT, PROJECT);

    private static final String CMD_RECALL = "recall";
    private static final String CMD_LOG = "log";
    private static final String CMD_SEARCH = "search";
    private static final String CMD_REMIND = "remind";
    private static final String CMD_DONE = "done";

    private MindService mindService;
    private CommandRouter router;

    @BeforeEach
    void setUp() {
        mindService = mock(MindService.class);
        router = new CommandRouter(mindService);
    }

    @Test
    void shouldListAllCommands() {
        List<CommandPort.CommandDefinition> commands = router.listCommands();

        assertEquals(10, commands.size());
        assertTrue(commands.stream().allMatch(command -> router.hasCommand(command.name())));
    }

    @Test
    void shouldRejectUnknownCommand() {
        CommandPort.CommandResult result = router.execute("forget", List.of(), CTX);

        assertFalse(result.success());
        assertEquals("Unknown command: forget. Try 'help'.", result.output());
    }

    @Test
    void shouldRenderHelp() {
        CommandPort.CommandResult result = router.execute("help", List.of(), CTX);

        assertTrue(result.success());
        assertTrue(result.output().startsWith("Available commands:"));
        assertTrue(result.output().contains("remind <when> | <message> - Create a reminder"));
    }

    @Test
    void shouldRecallWithForceAndTurnText() {
        when(mindService.recall(eq(PROJECT), eq(true), eq("auth flow"))).thenReturn(recallResult(
                true, SessionCheck.Reason.FORCED));

        CommandPort.CommandResult result = router.execute(CMD_RECALL, List.of("--force", "auth", "flow"), CTX);

        assertTrue(result.success());
        assertTrue(result.output().startsWith("# Memory Context: demo"));
        assertTrue(result.output().contains("New session (forced): promoted 0, skipped 0 buffer line(s)."));
    }

    @Test
    void shouldRecallWithoutTurnText() {
        when(mindService.recall(eq(PROJECT), eq(false), isNull())).thenReturn(recallResult(
                false, SessionCheck.Reason.NONE));

        CommandPort.CommandResult result = router.execute(CMD_RECALL, List.of(), CTX);

        assertTrue(result.success());
        assertFalse(result.output().contains("New session"));
    }

    @Test
    void shouldLogWithExplicitKind() {
        when(mindService.log(PROJECT, "use Postgres", LogKind.DECISION)).thenReturn(LogResult.builder()
                .storedAs(LogKind.DECISION)
                .file("MEMORY.md")
                .confidence(0.9)
                .build());

        CommandPort.CommandResult result = router.execute(CMD_LOG, List.of("--kind=decision", "use", "Postgres"),
                CTX);

        assertTrue(result.success());
        assertEquals("Logged decision to MEMORY.md", result.output());
    }

    @Test
    void shouldReportFlagsAndLoopWarningsWhenLogging() {
        when(mindService.log(eq(PROJECT), anyString(), isNull())).thenReturn(LogResult.builder()
                .storedAs(LogKind.REJECTED)
                .file("SESSION.md")
                .confidence(0.4)
                .flagged(true)
                .loopWarning(LoopWarning.builder()
                        .severity(LoopWarning.Severity.CRITICAL)
                        .message("STOP: you already rejected this approach (100% similar): tried Redis")
                        .build())
                .build());

        CommandPort.CommandResult result = router.execute(CMD_LOG, List.of("tried", "Redis"), CTX);

        assertTrue(result.output().startsWith("Logged rejected to SESSION.md (low confidence 0.40)"));
        assertTrue(result.output().contains("STOP: you already rejected this approach"));
    }

    @Test
    void shouldFailOnUnknownLogKind() {
        CommandPort.CommandResult result = router.execute(CMD_LOG, List.of("--kind=musing", "text"), CTX);

        assertFalse(result.success());
        assertEquals("Unknown log kind: musing", result.output());
        verify(mindService, never()).log(anyString(), anyString(), any());
    }

    @Test
    void shouldRequireLogText() {
        CommandPort.CommandResult result = router.execute(CMD_LOG, List.of(), CTX);

        assertFalse(result.success());
        assertEquals("Usage: log [--kind=<kind>] <text>", result.output());
    }

    @Test
    void shouldSearchMemoryOnly() {
        when(mindService.search(PROJECT, "postgres", false)).thenReturn(List.of(SearchHit.builder()
                .text("use Postgres")
                .score(0.42)
                .source(SearchHit.Source.MEMORY)
                .kind("decision")
                .location("MEMORY.md:12")
                .build()));

        CommandPort.CommandResult result = router.execute(CMD_SEARCH, List.of("--memory-only", "postgres"), CTX);

        assertTrue(result.success());
        assertEquals("1 match(es) for 'postgres':\n- [decision, 0.42] use Postgres (MEMORY.md:12)",
                result.output());
    }

    @Test
    void shouldReportNoSearchMatches() {
        when(mindService.search(PROJECT, "kafka", true)).thenReturn(List.of());

        CommandPort.CommandResult result = router.execute(CMD_SEARCH, List.of("kafka"), CTX);

        assertEquals("No matches for 'kafka'.", result.output());
    }

    @Test
    void shouldShowRelatedMemoriesForBlocker() {
        when(mindService.blocker(PROJECT, "stuck on deadlock")).thenReturn(BlockerResult.builder()
                .logged(LogResult.builder().storedAs(LogKind.BLOCKER).file("SESSION.md").confidence(0.4).build())
                .keywords(new ArrayList<>(List.of("stuck", "deadlock")))
                .build());

        CommandPort.CommandResult result = router.execute("blocker", List.of("stuck", "on", "deadlock"), CTX);

        assertTrue(result.success());
        assertTrue(result.output().contains("Logged blocker to SESSION.md"));
        assertTrue(result.output().endsWith("No related memories found."));
    }

    @Test
    void shouldSplitReminderOnFirstPipe() {
        when(mindService.remind(PROJECT, "renew cert | again", "tomorrow")).thenReturn(Reminder.builder()
                .id(3)
                .message("renew cert / again")
                .trigger(ReminderTrigger.nextSessionTrigger())
                .build());

        CommandPort.CommandResult result = router.execute(CMD_REMIND,
                List.of("tomorrow", "|", "renew", "cert", "|", "again"), CTX);

        assertTrue(result.success());
        assertEquals("Reminder #3 created: renew cert / again (next session)", result.output());
    }

    @Test
    void shouldExplainMalformedTrigger() {
        when(mindService.remind(PROJECT, "renew cert", "whenever"))
                .thenThrow(new MalformedTriggerException("whenever"));

        CommandPort.CommandResult result = router.execute(CMD_REMIND, List.of("whenever", "|", "renew", "cert"),
                CTX);

        assertFalse(result.success());
        assertTrue(result.output().startsWith("Could not understand when to remind: 'whenever'."));
    }

    @Test
    void shouldRequireReminderSeparator() {
        CommandPort.CommandResult result = router.execute(CMD_REMIND, List.of("tomorrow", "renew"), CTX);

        assertFalse(result.success());
        assertEquals("Usage: remind <when> | <message>", result.output());
    }

    @Test
    void shouldListReminders() {
        ReminderList list = new ReminderList();
        list.getDue().add(Reminder.builder().id(1).message("renew cert")
                .trigger(ReminderTrigger.nextSessionTrigger()).build());
        list.getPending().add(Reminder.builder().id(2).message("check tokens")
                .trigger(ReminderTrigger.context(List.of("auth"))).build());
        when(mindService.reminders(PROJECT)).thenReturn(list);

        CommandPort.CommandResult result = router.execute("reminders", List.of(), CTX);

        assertEquals("Due:\n- #1 renew cert (next session)\n\nPending:\n- #2 check tokens (when: auth)",
                result.output());
    }

    @Test
    void shouldReportNoOpenReminders() {
        when(mindService.reminders(PROJECT)).thenReturn(new ReminderList());

        assertEquals("No open reminders.", router.execute("reminders", List.of(), CTX).output());
    }

    @Test
    void shouldAcknowledgeReminderWithHashPrefix() {
        when(mindService.reminderDone(PROJECT, 2)).thenReturn(Reminder.builder().id(2).message("check tokens")
                .build());

        CommandPort.CommandResult result = router.execute(CMD_DONE, List.of("#2"), CTX);

        assertTrue(result.success());
        assertEquals("Reminder #2 done: check tokens", result.output());
    }

    @Test
    void shouldRejectInvalidReminderId() {
        CommandPort.CommandResult result = router.execute(CMD_DONE, List.of("two"), CTX);

        assertFalse(result.success());
        assertEquals("Invalid reminder id: two", result.output());
        verify(mindService, never()).reminderDone(anyString(), anyInt());
    }

    @Test
    void shouldReportUnknownReminderId() {
        when(mindService.reminderDone(PROJECT, 9)).thenThrow(new IllegalArgumentException("Reminder not found: 9"));

        CommandPort.CommandResult result = router.execute(CMD_DONE, List.of("9"), CTX);

        assertFalse(result.success());
        assertEquals("Reminder not found: 9", result.output());
    }

    @Test
    void shouldReportStorageErrors() {
        when(mindService.recall(anyString(), anyBoolean(), any()))
                .thenThrow(new StorageException("MEMORY.md", "Failed to write MEMORY.md"));

        CommandPort.CommandResult result = router.execute(CMD_RECALL, List.of(), CTX);

        assertFalse(result.success());
        assertEquals("Storage error: Failed to write MEMORY.md", result.output());
    }

    @Test
    void shouldRenderStatus() {
        HealthReport report = new HealthReport();
        report.getFileSizes().put("MEMORY.md", 120L);
        report.getWarnings().add("MEMORY.md changed since the last recall");
        when(mindService.status(PROJECT)).thenReturn(report);

        CommandPort.CommandResult result = router.execute("status", List.of(), CTX);

        assertTrue(result.output().startsWith("**Memory status**"));
        assertTrue(result.output().contains("MEMORY.md: 120 bytes"));
        assertTrue(result.output().contains("Last activity: never"));
        assertTrue(result.output().contains("Warning: MEMORY.md changed since the last recall"));
    }

    private RecallResult recallResult(boolean boundary, SessionCheck.Reason reason) {
        return RecallResult.builder()
                .contextText("# Memory Context: demo\n\nNo memories yet.\n")
                .sessionInfo(SessionInfo.builder().boundaryDetected(boundary).reason(reason).build())
                .health(new HealthReport())
                .promotion(PromotionResult.empty())
                .build();
    }
}
