package me.golemcore.mind.domain.service;

import me.golemcore.mind.domain.model.ContextRequest;
import me.golemcore.mind.domain.model.MemoryEntry;
import me.golemcore.mind.domain.model.MemoryKind;
import me.golemcore.mind.domain.model.ParseResult;
import me.golemcore.mind.domain.model.ProjectState;
import me.golemcore.mind.domain.model.Reminder;
import me.golemcore.mind.domain.model.ReminderTrigger;
import me.golemcore.mind.domain.model.ScoredEntry;
import me.golemcore.mind.domain.model.SessionSummary;
import me.golemcore.mind.infrastructure.config.MindProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextAssemblerTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 2);
    private static final double DELTA = 1e-9;

    private MindProperties properties;
    private ContextAssembler assembler;

    @BeforeEach
    void setUp() {
        properties = new MindProperties();
        assembler = new ContextAssembler(properties, new SimilarityEngine(),
                Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldRenderEmptyStateHint() {
        String context = assembler.assemble(ContextRequest.builder().projectName("demo").build());

        assertTrue(context.startsWith("# Memory Context: demo\n"));
        assertTrue(context.contains("No memories yet."));
    }

    @Test
    void shouldRenderSectionsInOrder() {
        ParseResult parse = ParseResult.builder()
                .projectState(ProjectState.builder()
                        .goal("ship the memory engine")
                        .stack(List.of("Java", "Spring Boot"))
                        .build())
                .sessionSummaries(new ArrayList<>(List.of(SessionSummary.builder()
                        .date(LocalDate.of(2026, 3, 1))
                        .summary("wired the extractor")
                        .mood("focused")
                        .nextStep("promotion engine")
                        .build())))
                .entries(new ArrayList<>(List.of(
                        entry(MemoryKind.DECISION, "use TF-IDF for similarity", TODAY, 1),
                        entry(MemoryKind.ISSUE, "flaky clock in tests", TODAY, 2),
                        entry(MemoryKind.GOTCHA, "Files.move fails on Windows", TODAY, 3),
                        entry(MemoryKind.PROGRESS, "extractor finished", TODAY, 4))))
                .build();

        String context = assembler.assemble(ContextRequest.builder().projectName("demo").parse(parse).build());

        assertTrue(context.contains("Goal: ship the memory engine\n"));
        assertTrue(context.contains("Stack: Java, Spring Boot\n"));
        assertTrue(context.contains("Last session (2026-03-01): wired the extractor [focused]\n"));
        assertTrue(context.contains("Next step: promotion engine\n"));
        assertTrue(context.contains("- use TF-IDF for similarity (2026-03-02)\n"));
        int state = context.indexOf("## Project State");
        int decisions = context.indexOf("## Recent Decisions");
        int open = context.indexOf("## Open Items");
        int gotchas = context.indexOf("## Gotchas");
        int progress = context.indexOf("## Recent Progress");
        assertTrue(state < decisions && decisions < open && open < gotchas && gotchas < progress);
        assertFalse(context.contains("No memories yet."));
    }

    @Test
    void shouldRenderRejectedApproachesApartFromDecisions() {
        MemoryEntry rejected = entry(MemoryKind.DECISION, "Redis for sessions because it was too complex", TODAY, 2);
        rejected.setRejectedApproach(true);
        ParseResult parse = ParseResult.builder()
                .entries(new ArrayList<>(List.of(
                        entry(MemoryKind.DECISION, "use Postgres for the job queue", TODAY, 1),
                        rejected)))
                .build();

        String context = assembler.assemble(ContextRequest.builder().projectName("demo").parse(parse).build());

        assertTrue(context.contains("## Recent Decisions\n- use Postgres for the job queue (2026-03-02)\n"));
        assertTrue(context.contains("## Rejected Approaches (do not retry)\n"
                + "- Redis for sessions because it was too complex (2026-03-02)\n"));
        assertTrue(context.indexOf("## Recent Decisions") < context.indexOf("## Rejected Approaches"));
    }

    @Test
    void shouldExcludeSupersededAndLowConfidenceEntries() {
        MemoryEntry superseded = entry(MemoryKind.DECISION, "use Redis for sessions", TODAY, 1);
        superseded.setSupersededBy("abcd1234");
        MemoryEntry vague = entry(MemoryKind.DECISION, "maybe switch to Kafka", TODAY, 2);
        vague.setConfidence(0.4);
        ParseResult parse = ParseResult.builder().entries(new ArrayList<>(List.of(superseded, vague))).build();

        String context = assembler.assemble(ContextRequest.builder().projectName("demo").parse(parse).build());

        assertFalse(context.contains("Redis"));
        assertFalse(context.contains("Kafka"));
        assertTrue(context.contains("No memories yet."));
    }

    @Test
    void shouldRenderDueAndWatchedRemindersBeforeEntries() {
        Reminder due = Reminder.builder().id(1).message("renew the certificate")
                .trigger(ReminderTrigger.nextSessionTrigger()).status(Reminder.Status.DUE).build();
        Reminder watched = Reminder.builder().id(2).message("check token expiry")
                .trigger(ReminderTrigger.context(List.of("auth", "login"))).build();

        String context = assembler.assemble(ContextRequest.builder()
                .projectName("demo")
                .dueReminders(List.of(due))
                .watchedReminders(List.of(watched))
                .build());

        assertTrue(context.contains("## Reminders Due\n- [#1] renew the certificate\n"));
        assertTrue(context.contains("## Watching For\n- [#2] auth, login: check token expiry\n"));
        assertFalse(context.contains("No memories yet."));
    }

    @Test
    void shouldKeepOnlyBudgetedEntriesPerSection() {
        properties.getContext().setItemsPerCategory(2);
        ParseResult parse = ParseResult.builder().entries(new ArrayList<>(List.of(
                entry(MemoryKind.DECISION, "oldest decision", TODAY.minusDays(30), 1),
                entry(MemoryKind.DECISION, "middle decision", TODAY.minusDays(3), 2),
                entry(MemoryKind.DECISION, "newest decision", TODAY, 3)))).build();

        String context = assembler.assemble(ContextRequest.builder().projectName("demo").parse(parse).build());

        assertTrue(context.contains("newest decision"));
        assertTrue(context.contains("middle decision"));
        assertFalse(context.contains("oldest decision"));
        assertTrue(context.indexOf("newest decision") < context.indexOf("middle decision"));
    }

    @Test
    void shouldRenderKeyEntriesWithMarker() {
        MemoryEntry key = entry(MemoryKind.LEARNING, "always run migrations first", TODAY.minusDays(90), 1);
        key.setKey(true);
        ParseResult parse = ParseResult.builder().entries(new ArrayList<>(List.of(key))).build();

        String context = assembler.assemble(ContextRequest.builder().projectName("demo").parse(parse).build());

        assertTrue(context.contains("- KEY: always run migrations first (2025-12-02)\n"));
    }

    @Test
    void shouldDecayRecencyByHalfLife() {
        assertEquals(0.3, assembler.recencyBoost(entry(MemoryKind.DECISION, "x", TODAY, 1), TODAY), DELTA);
        assertEquals(0.15,
                assembler.recencyBoost(entry(MemoryKind.DECISION, "x", TODAY.minusDays(7), 1), TODAY), DELTA);
        assertEquals(0.0, assembler.recencyBoost(entry(MemoryKind.DECISION, "x", null, 1), TODAY), DELTA);

        MemoryEntry key = entry(MemoryKind.DECISION, "x", TODAY.minusDays(365), 1);
        key.setKey(true);
        assertEquals(0.3, assembler.recencyBoost(key, TODAY), DELTA);
    }

    @Test
    void shouldSaturateFrequencyBoost() {
        assertEquals(0.0, assembler.frequencyBoost(0), DELTA);
        assertEquals(0.1, assembler.frequencyBoost(1), DELTA);
        assertEquals(0.2, assembler.frequencyBoost(3), DELTA);
        assertEquals(0.2, assembler.frequencyBoost(50), DELTA);
    }

    @Test
    void shouldRankTriggeredEntryFirst() {
        MemoryEntry plain = entry(MemoryKind.DECISION, "use Postgres for the queue", TODAY, 1);
        MemoryEntry triggered = entry(MemoryKind.DECISION, "tune Kafka consumer lag", TODAY, 2);

        List<ScoredEntry> ranked = assembler.rank(List.of(plain, triggered), entry -> true,
                Set.of("kafka"), Set.of(), Map.of(), TODAY);

        assertEquals(triggered, ranked.get(0).getEntry());
        assertEquals(0.9 * (1.0 + 0.3 + 0.2), ranked.get(0).getScore(), DELTA);
    }

    @Test
    void shouldBoostFrequentlyAccessedAndContinuingEntries() {
        MemoryEntry entry = entry(MemoryKind.DECISION, "build the promotion engine", TODAY, 1);

        double base = assembler.score(entry, Set.of(), Set.of(), 0, TODAY);
        double boosted = assembler.score(entry, Set.of(), Set.of("promotion"), 3, TODAY);

        assertEquals(0.9 * 1.3, base, DELTA);
        assertEquals(0.9 * (1.3 + 0.2 + 0.2), boosted, DELTA);
    }

    private static MemoryEntry entry(MemoryKind kind, String text, LocalDate createdAt, int line) {
        return MemoryEntry.builder()
                .id(MemoryTextSupport.entryId(kind.name(), text))
                .kind(kind)
                .text(text)
                .confidence(0.9)
                .createdAt(createdAt)
                .line(line)
                .sourceLocation("MEMORY.md:" + line)
                .build();
    }
}
