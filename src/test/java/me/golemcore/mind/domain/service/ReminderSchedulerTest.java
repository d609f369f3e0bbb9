package me.golemcore.mind.domain.service;

import me.golemcore.mind.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.mind.domain.exception.MalformedTriggerException;
import me.golemcore.mind.domain.model.Reminder;
import me.golemcore.mind.domain.model.ReminderList;
import me.golemcore.mind.infrastructure.config.MindProperties;
import me.golemcore.mind.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReminderSchedulerTest {

    private static final Instant START = Instant.parse("2026-03-02T10:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private LocalStorageAdapter storage;
    private ReminderScheduler scheduler;
    private String project;

    @BeforeEach
    void setUp() {
        MindProperties properties = new MindProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        clock = new MutableClock(START, ZoneOffset.UTC);
        storage = new LocalStorageAdapter(properties);
        scheduler = new ReminderScheduler(storage, new ReminderExpressionParser(clock), clock);
        project = tempDir.resolve("demo").toString();
    }

    @Test
    void shouldCreateRemindersWithSequentialIds() {
        Reminder first = scheduler.create(project, "renew the certificate", "tomorrow");
        Reminder second = scheduler.create(project, "check token expiry", "when I mention auth");

        assertEquals(1, first.getId());
        assertEquals(2, second.getId());
        String content = storage.getText(project, ReminderScheduler.REMINDERS_FILE);
        assertTrue(content.contains("- [ ] 2026-03-03T00:00:00Z | time | renew the certificate"));
        assertTrue(content.contains("- [ ] auth | context | check token expiry"));
    }

    @Test
    void shouldWriteNothingForMalformedTrigger() {
        assertThrows(MalformedTriggerException.class,
                () -> scheduler.create(project, "renew the certificate", "whenever"));

        assertFalse(scheduler.exists(project));
    }

    @Test
    void shouldRequireMessage() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.create(project, " ", "tomorrow"));
    }

    @Test
    void shouldBecomeDueOnceInstantPasses() {
        scheduler.create(project, "renew the certificate", "tomorrow");

        ReminderList before = scheduler.list(project, null);
        assertTrue(before.getDue().isEmpty());
        assertEquals(1, before.getPending().size());

        clock.advance(Duration.ofDays(1));

        ReminderList after = scheduler.list(project, null);
        assertEquals(1, after.getDue().size());
        assertEquals(Reminder.Status.DUE, after.getDue().get(0).getStatus());
    }

    @Test
    void shouldSurfaceNextSessionReminderOnlyOnce() {
        scheduler.create(project, "re-run the migration", "next session");

        List<Reminder> first = scheduler.surfaceForRecall(project, null, true);
        List<Reminder> second = scheduler.surfaceForRecall(project, null, true);

        assertEquals(1, first.size());
        assertEquals("re-run the migration", first.get(0).getMessage());
        assertTrue(second.isEmpty());
        assertEquals(Reminder.Status.DONE, scheduler.load(project).get(0).getStatus());
    }

    @Test
    void shouldKeepNextSessionReminderWithinCurrentSession() {
        scheduler.create(project, "re-run the migration", "next session");

        assertTrue(scheduler.surfaceForRecall(project, null, false).isEmpty());
        assertEquals(Reminder.Status.PENDING, scheduler.load(project).get(0).getStatus());
        assertEquals(1, scheduler.surfaceForRecall(project, null, true).size());
    }

    @Test
    void shouldNotTreatNextSessionReminderAsDueOutsideRecall() {
        scheduler.create(project, "re-run the migration", "next session");

        ReminderList list = scheduler.list(project, null);

        assertTrue(list.getDue().isEmpty());
        assertEquals(1, list.getPending().size());
    }

    @Test
    void shouldMatchContextKeywordsAsSubstrings() {
        scheduler.create(project, "check token expiry", "when I mention auth");

        List<Reminder> triggered = scheduler.triggeredBy(project, "Working on the Authentication flow");

        assertEquals(1, triggered.size());
        assertTrue(scheduler.triggeredBy(project, "billing export").isEmpty());
        assertTrue(scheduler.triggeredBy(project, null).isEmpty());
    }

    @Test
    void shouldKeepContextReminderPendingUntilAcknowledged() {
        scheduler.create(project, "check token expiry", "when I mention auth");

        assertEquals(1, scheduler.surfaceForRecall(project, "auth is broken", false).size());
        assertEquals(1, scheduler.surfaceForRecall(project, "auth again", false).size());
        assertEquals(1, scheduler.watched(project).size());

        scheduler.markDone(project, 1);

        assertTrue(scheduler.surfaceForRecall(project, "auth again", false).isEmpty());
        assertTrue(scheduler.watched(project).isEmpty());
    }

    @Test
    void shouldMarkDoneIdempotently() {
        scheduler.create(project, "renew the certificate", "tomorrow");

        Reminder done = scheduler.markDone(project, 1);
        String afterFirst = storage.getText(project, ReminderScheduler.REMINDERS_FILE);
        scheduler.markDone(project, 1);

        assertEquals(Reminder.Status.DONE, done.getStatus());
        assertTrue(afterFirst.contains("- [x] 2026-03-03T00:00:00Z | time | renew the certificate"));
        assertEquals(afterFirst, storage.getText(project, ReminderScheduler.REMINDERS_FILE));
    }

    @Test
    void shouldRejectUnknownReminderId() {
        scheduler.create(project, "renew the certificate", "tomorrow");

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> scheduler.markDone(project, 7));
        assertEquals("Reminder not found: 7", exception.getMessage());
    }

    @Test
    void shouldSkipUnparseableLinesWithoutFailing() {
        storage.putTextAtomic(project, ReminderScheduler.REMINDERS_FILE, "# Reminders\n"
                + "- [ ] garbage without separators\n"
                + "- [ ] 2026-03-01T00:00:00Z | time | overdue task\n");

        ReminderList list = scheduler.list(project, null);

        assertEquals(1, list.getSkippedLines().size());
        assertEquals(1, list.getDue().size());
        assertEquals(2, list.getDue().get(0).getId());
    }

    @Test
    void shouldReplacePipesInMessage() {
        Reminder reminder = scheduler.create(project, "compare a | b", "tomorrow");

        assertEquals("compare a / b", reminder.getMessage());
        assertEquals("compare a / b", scheduler.load(project).get(0).getMessage());
    }

    @Test
    void shouldReplacePipesInContextKeywords() {
        Reminder reminder = scheduler.create(project, "check the pipeline", "keyword: ci|cd, deploy");

        assertEquals(List.of("ci/cd", "deploy"), reminder.getTrigger().keywords());
        assertTrue(storage.getText(project, ReminderScheduler.REMINDERS_FILE)
                .contains("- [ ] ci/cd, deploy | context | check the pipeline"));
        ReminderList list = scheduler.list(project, null);
        assertTrue(list.getSkippedLines().isEmpty());
        assertEquals(List.of("ci/cd", "deploy"), list.getPending().get(0).getTrigger().keywords());
        assertEquals(1, scheduler.triggeredBy(project, "the CI/CD job is red").size());
    }
}
