package me.golemcore.mind.domain.service;

import me.golemcore.mind.domain.model.MemoryEntry;
import me.golemcore.mind.domain.model.MemoryKind;
import me.golemcore.mind.domain.model.ParseResult;
import me.golemcore.mind.domain.model.SessionSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryExtractorTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final double DELTA = 1e-9;

    private static final String STORE = String.join("\n",
            "# demo",
            "",
            "## Project State",
            "- Goal: ship the memory engine",
            "- Stack: Java, Spring Boot",
            "- Blocked: None",
            "",
            "## Gotchas",
            "- Files.move on Windows -> fall back to direct write",
            "",
            "## 2026-02-20 | wired the extractor | mood: focused | next: promotion engine",
            "",
            "## 2026-02-21",
            "- **Decided:** use TF-IDF because it is deterministic",
            "- [superseded by abcd1234] **Learned:** snapshot keyed by fingerprint",
            "- random chatter line",
            "```",
            "- **Decided:** inside code",
            "```",
            "- **Issue:** flaky test fixed",
            "");

    private MemoryExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new MemoryExtractor(Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldGiveLabeledDecisionHighConfidence() {
        List<MemoryEntry> entries = extractor.extract("**Decided:** use X because Y");

        assertEquals(1, entries.size());
        assertEquals(MemoryKind.DECISION, entries.get(0).getKind());
        assertTrue(entries.get(0).getConfidence() >= 0.9);
        assertEquals("use X because Y", entries.get(0).getText());
    }

    @Test
    void shouldGiveBareKeywordMediumConfidence() {
        List<MemoryEntry> entries = extractor.extract("decided to use X");

        assertEquals(1, entries.size());
        assertEquals(MemoryKind.DECISION, entries.get(0).getKind());
        double confidence = entries.get(0).getConfidence();
        assertTrue(confidence >= 0.6 && confidence < 0.8, "confidence was " + confidence);
    }

    @Test
    void shouldGiveVagueHintLowConfidence() {
        List<MemoryEntry> entries = extractor.extract("thinking about X");

        assertEquals(1, entries.size());
        assertTrue(entries.get(0).getConfidence() < 0.5);
    }

    @Test
    void shouldAddCausalBonusAndCapConfidence() {
        assertEquals(0.8, extractor.extract("decided to use X because Y").get(0).getConfidence(), DELTA);
        assertEquals(0.99, extractor.extract("**Decided:** use X since Y").get(0).getConfidence(), DELTA);
    }

    @Test
    void shouldExtractNothingFromSessionSummaryLine() {
        List<MemoryEntry> entries = extractor.extract("## 2025-01-01 | shipped feature | mood: good");

        assertTrue(entries.isEmpty());
    }

    @Test
    void shouldParseSessionSummaryInsteadOfEntries() {
        ParseResult result = extractor.parse("## 2025-01-01 | shipped feature | mood: good", "MEMORY.md");

        assertTrue(result.getEntries().isEmpty());
        assertEquals(1, result.getSessionSummaries().size());
        SessionSummary summary = result.getSessionSummaries().get(0);
        assertEquals(LocalDate.of(2025, 1, 1), summary.getDate());
        assertEquals("shipped feature", summary.getSummary());
        assertEquals("good", summary.getMood());
    }

    @Test
    void shouldDowngradeUndecidedPhrasingToHint() {
        List<MemoryEntry> entries = extractor.extract("haven't decided whether to use Kafka");

        assertEquals(1, entries.size());
        assertEquals(MemoryKind.DECISION, entries.get(0).getKind());
        assertEquals(ExtractionRules.Strength.HINT.getConfidence(), entries.get(0).getConfidence(), DELTA);
    }

    @Test
    void shouldMarkKeyEntries() {
        List<MemoryEntry> entries = extractor.extract("KEY: always run migrations before deploy");

        assertEquals(1, entries.size());
        MemoryEntry entry = entries.get(0);
        assertTrue(entry.isKey());
        assertEquals(MemoryKind.LEARNING, entry.getKind());
        assertEquals("always run migrations before deploy", entry.getText());
    }

    @Test
    void shouldDateFreeTextWithToday() {
        MemoryEntry entry = extractor.extract("learned that the cache is per request").get(0);

        assertEquals(LocalDate.of(2026, 3, 2), entry.getCreatedAt());
        assertEquals(MemoryKind.LEARNING, entry.getKind());
    }

    @Test
    void shouldReadProjectStateFromStore() {
        ParseResult result = extractor.parse(STORE, "MEMORY.md");

        assertEquals("ship the memory engine", result.getProjectState().getGoal());
        assertEquals(List.of("Java", "Spring Boot"), result.getProjectState().getStack());
        assertNull(result.getProjectState().getBlocked());
    }

    @Test
    void shouldParseEntriesWithDatesAndLocations() {
        ParseResult result = extractor.parse(STORE, "MEMORY.md");

        assertEquals(4, result.getEntries().size());

        MemoryEntry gotcha = result.getEntries().get(0);
        assertEquals(MemoryKind.GOTCHA, gotcha.getKind());
        assertEquals("Files.move on Windows -> fall back to direct write", gotcha.getText());
        assertEquals(9, gotcha.getLine());

        MemoryEntry decision = result.getEntries().get(1);
        assertEquals(MemoryKind.DECISION, decision.getKind());
        assertEquals(LocalDate.of(2026, 2, 21), decision.getCreatedAt());
        assertEquals("MEMORY.md:14", decision.getSourceLocation());
        assertEquals("it is deterministic", decision.getReasoning());
        assertEquals(MemoryTextSupport.entryId("DECISION", decision.getText()), decision.getId());
    }

    @Test
    void shouldRecognizeSupersedeMarker() {
        ParseResult result = extractor.parse(STORE, "MEMORY.md");

        MemoryEntry learned = result.getEntries().get(2);
        assertEquals(MemoryKind.LEARNING, learned.getKind());
        assertEquals("abcd1234", learned.getSupersededBy());
        assertEquals("snapshot keyed by fingerprint", learned.getText());
    }

    @Test
    void shouldDetectResolvedIssues() {
        ParseResult result = extractor.parse(STORE, "MEMORY.md");

        MemoryEntry issue = result.getEntries().get(3);
        assertEquals(MemoryKind.ISSUE, issue.getKind());
        assertEquals(MemoryEntry.Status.RESOLVED, issue.getStatus());
        assertFalse(issue.isOpenItem());
    }

    @Test
    void shouldSkipCodeBlocksAndReportUnmatchedLines() {
        ParseResult result = extractor.parse(STORE, "MEMORY.md");

        assertEquals(List.of("MEMORY.md:16"), result.getSkippedLines());
        assertTrue(result.getEntries().stream().noneMatch(entry -> entry.getText().contains("inside code")));
    }

    @Test
    void shouldReadSessionSummaryNextStep() {
        ParseResult result = extractor.parse(STORE, "MEMORY.md");

        assertEquals(1, result.getSessionSummaries().size());
        assertEquals("promotion engine", result.getSessionSummaries().get(0).getNextStep());
        assertEquals("focused", result.getSessionSummaries().get(0).getMood());
    }

    @Test
    void shouldReturnEmptyResultForBlankContent() {
        ParseResult result = extractor.parse("  \n", "MEMORY.md");

        assertTrue(result.getEntries().isEmpty());
        assertTrue(result.getSkippedLines().isEmpty());
    }
}
