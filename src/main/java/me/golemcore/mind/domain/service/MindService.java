/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.mind.domain.service;

import me.golemcore.mind.domain.model.BlockerResult;
import me.golemcore.mind.domain.model.ContextRequest;
import me.golemcore.mind.domain.model.HealthReport;
import me.golemcore.mind.domain.model.LogKind;
import me.golemcore.mind.domain.model.LogResult;
import me.golemcore.mind.domain.model.LoopWarning;
import me.golemcore.mind.domain.model.MemoryEntry;
import me.golemcore.mind.domain.model.MemoryKind;
import me.golemcore.mind.domain.model.ParseResult;
import me.golemcore.mind.domain.model.PromotionResult;
import me.golemcore.mind.domain.model.RecallResult;
import me.golemcore.mind.domain.model.Reminder;
import me.golemcore.mind.domain.model.ReminderList;
import me.golemcore.mind.domain.model.SearchHit;
import me.golemcore.mind.domain.model.SessionBuffer;
import me.golemcore.mind.domain.model.SessionCategory;
import me.golemcore.mind.domain.model.SessionCheck;
import me.golemcore.mind.domain.model.SessionInfo;
import me.golemcore.mind.domain.model.StateRecord;
import me.golemcore.mind.infrastructure.config.MindProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Entry point for every memory operation: recall, log, search, blocker,
 * reminders, checkpoint and status.
 *
 * <p>
 * Each call re-derives its view of the project from the files and the
 * persisted state record; nothing is cached between calls.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MindService {

    private final HealthService healthService;
    private final StateRecordService stateRecordService;
    private final SessionLifecycleService lifecycleService;
    private final MemoryStoreService memoryStoreService;
    private final SessionBufferService sessionBufferService;
    private final MemoryIndexService memoryIndexService;
    private final MemoryPromotionService promotionService;
    private final MemoryExtractor extractor;
    private final SimilarityEngine similarityEngine;
    private final ReminderScheduler reminderScheduler;
    private final ContextAssembler contextAssembler;
    private final LogCategorizer logCategorizer;
    private final MindProperties properties;
    private final Clock clock;

    /**
     * Starts or resumes a session and returns the assembled context.
     *
     * <p>
     * On a session boundary (inactivity gap, external edit of the store, or
     * {@code forceRefresh}) the buffer is promoted and the store re-parsed
     * before the state record is advanced.
     *
     * @param turnText
     *            text of the current turn, matched against context reminders;
     *            may be {@code null}
     * @throws me.golemcore.mind.domain.exception.StorageException
     *             when a file cannot be read or written
     */
    public RecallResult recall(String project, boolean forceRefresh, String turnText) {
        HealthReport health = healthService.repair(project);
        StateRecord state = stateRecordService.loadState(project);

        String content = memoryStoreService.read(project);
        String fingerprint = memoryStoreService.fingerprint(content);
        SessionCheck check = lifecycleService.evaluate(state, fingerprint, forceRefresh);
        int bufferSize = sessionBufferService.read(project).size();

        PromotionResult promotion = PromotionResult.empty();
        ParseResult parse;
        boolean reparsed;
        if (check.isBoundaryDetected()) {
            promotion = promotionService.promote(project);
            content = memoryStoreService.read(project);
            fingerprint = memoryStoreService.fingerprint(content);
            parse = memoryIndexService.reindex(project, content, fingerprint);
            reparsed = true;
        } else {
            long before = memoryIndexService.getReparseCount();
            parse = memoryIndexService.current(project, content, fingerprint);
            reparsed = memoryIndexService.getReparseCount() != before;
        }

        stateRecordService.saveState(project, lifecycleService.advance(state, fingerprint));

        List<Reminder> due = reminderScheduler.surfaceForRecall(project, turnText,
                check.isBoundaryDetected() || check.isFirstRun());
        Set<Integer> dueIds = new LinkedHashSet<>();
        due.forEach(reminder -> dueIds.add(reminder.getId()));
        List<Reminder> watched = reminderScheduler.watched(project).stream()
                .filter(reminder -> !dueIds.contains(reminder.getId()))
                .toList();

        String contextText = contextAssembler.assemble(ContextRequest.builder()
                .projectName(healthService.projectName(project))
                .parse(parse)
                .accessCounts(stateRecordService.loadAccessCounts(project))
                .dueReminders(due)
                .watchedReminders(watched)
                .turnText(turnText)
                .build());

        SessionInfo sessionInfo = SessionInfo.builder()
                .boundaryDetected(check.isBoundaryDetected())
                .reason(check.getReason())
                .minutesSinceLastActivity(check.getElapsed() != null ? check.getElapsed().toMinutes() : null)
                .previousActivity(state.getLastActivity())
                .firstRun(check.isFirstRun())
                .reparsed(reparsed)
                .bufferSize(bufferSize)
                .build();

        log.info("[Mind] Recall: boundary={} ({}), promoted={}, due reminders={}",
                check.isBoundaryDetected(), check.getReason(), promotion.promotedCount(), due.size());
        return RecallResult.builder()
                .contextText(contextText)
                .sessionInfo(sessionInfo)
                .health(health)
                .promotion(promotion)
                .dueReminders(due)
                .watchedReminders(watched)
                .build();
    }

    /**
     * Forces the boundary branch of {@link #recall}.
     */
    public RecallResult checkpoint(String project) {
        return recall(project, true, null);
    }

    /**
     * Stores text in the permanent store or the session buffer.
     *
     * <p>
     * An explicit permanent kind is written as a labeled entry. Without a kind,
     * text that already carries a bold label goes to the permanent store as
     * that kind; anything else is categorized into a buffer section. Entries
     * below the low-confidence threshold are stored and flagged.
     *
     * @param kind
     *            requested kind, or {@code null} to categorize automatically
     */
    public LogResult log(String project, String text, LogKind kind) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Nothing to log");
        }
        String normalized = MemoryTextSupport.normalizeText(text);
        healthService.repair(project);

        List<MemoryEntry> extracted = extractor.extract(normalized);
        Optional<MemoryEntry> best = extracted.stream().findFirst();
        boolean autoCategorized = kind == null;

        LogKind target = kind;
        double confidence;
        if (target == null) {
            if (best.isPresent() && best.get().getConfidence() >= ExtractionRules.Strength.LABELED.getConfidence()) {
                target = toLogKind(best.get());
            } else {
                target = categoryKind(logCategorizer.categorize(normalized));
            }
            confidence = best.map(MemoryEntry::getConfidence)
                    .orElse(ExtractionRules.Strength.HINT.getConfidence());
        } else if (target.isPermanent()) {
            boolean causal = ExtractionRules.CAUSAL.matcher(normalized).find();
            confidence = ExtractionRules.confidence(ExtractionRules.Strength.LABELED, causal);
        } else {
            confidence = best.map(MemoryEntry::getConfidence)
                    .orElse(ExtractionRules.Strength.HINT.getConfidence());
        }

        LoopWarning loopWarning = null;
        String file;
        String category;
        if (target.isPermanent()) {
            writePermanent(project, target.getMemoryKind(), normalized);
            file = MemoryStoreService.MEMORY_FILE;
            category = target.getMemoryKind().displayName();
        } else {
            SessionCategory section = target.getSessionCategory();
            if (section == SessionCategory.REJECTED) {
                loopWarning = similarityEngine.detectLoop(normalized, priorRejections(project)).orElse(null);
            }
            sessionBufferService.append(project, section, normalized);
            touchState(project);
            file = SessionBufferService.SESSION_FILE;
            category = section.displayName();
        }

        boolean flagged = confidence < properties.getExtraction().getLowConfidenceThreshold();
        if (flagged) {
            log.debug("[Mind] Low-confidence entry stored and flagged ({}): {}", confidence,
                    MemoryTextSupport.truncate(normalized, 80));
        }
        if (loopWarning != null) {
            log.warn("[Mind] {}", loopWarning.getMessage());
        }
        log.info("[Mind] Logged {} to {}", target.displayName(), file);

        return LogResult.builder()
                .storedAs(target)
                .category(category)
                .file(file)
                .text(normalized)
                .confidence(confidence)
                .flagged(flagged)
                .autoCategorized(autoCategorized)
                .loopWarning(loopWarning)
                .triggeredReminders(reminderScheduler.triggeredBy(project, normalized))
                .build();
    }

    /**
     * Ranks permanent entries, and optionally the raw session buffer, against
     * the query. Permanent hits count as accesses for ranking.
     */
    public List<SearchHit> search(String project, String query, boolean includeUnpromoted) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Search query is required");
        }
        String content = memoryStoreService.read(project);
        ParseResult parse = memoryIndexService.current(project, content, memoryStoreService.fingerprint(content));

        List<MemoryEntry> entries = parse.getEntries().stream()
                .filter(entry -> !entry.isSuperseded())
                .toList();
        List<SearchHit> candidates = new ArrayList<>();
        List<String> corpus = new ArrayList<>();
        for (MemoryEntry entry : entries) {
            corpus.add(entry.getText());
            candidates.add(SearchHit.builder()
                    .text(entry.getText())
                    .source(SearchHit.Source.MEMORY)
                    .kind(entry.getKind().displayName())
                    .location(entry.getSourceLocation())
                    .build());
        }
        if (includeUnpromoted) {
            SessionBuffer buffer = sessionBufferService.read(project);
            for (SessionCategory category : SessionCategory.values()) {
                for (String line : buffer.get(category)) {
                    corpus.add(line);
                    candidates.add(SearchHit.builder()
                            .text(line)
                            .source(SearchHit.Source.SESSION)
                            .kind(category.displayName())
                            .location(SessionBufferService.SESSION_FILE + "#" + category.getHeading())
                            .build());
                }
            }
        }

        List<SearchHit> hits = new ArrayList<>();
        List<String> accessedIds = new ArrayList<>();
        for (TfIdfIndex.Match match : similarityEngine.rank(query, corpus, properties.getSearch().getLimit())) {
            if (match.similarity() < properties.getSearch().getMinScore()) {
                continue;
            }
            SearchHit hit = candidates.get(match.index());
            hit.setScore(match.similarity());
            hits.add(hit);
            if (match.index() < entries.size()) {
                accessedIds.add(entries.get(match.index()).getId());
            }
        }
        if (!accessedIds.isEmpty()) {
            stateRecordService.recordAccess(project, accessedIds);
        }
        log.debug("[Mind] Search '{}': {} hit(s)", query, hits.size());
        return hits;
    }

    /**
     * Logs a blocker and looks for permanent memories related to it.
     */
    public BlockerResult blocker(String project, String description) {
        LogResult logged = log(project, description, LogKind.BLOCKER);
        List<String> keywords = similarityEngine.keywords(description);
        List<SearchHit> related = keywords.isEmpty()
                ? List.of()
                : search(project, String.join(" ", keywords), false);
        return BlockerResult.builder()
                .logged(logged)
                .keywords(new ArrayList<>(keywords))
                .relatedMemories(new ArrayList<>(related))
                .build();
    }

    /**
     * @throws me.golemcore.mind.domain.exception.MalformedTriggerException
     *             when {@code when} cannot be parsed
     */
    public Reminder remind(String project, String message, String when) {
        healthService.repair(project);
        return reminderScheduler.create(project, message, when);
    }

    public ReminderList reminders(String project) {
        return reminderScheduler.list(project, null);
    }

    public Reminder reminderDone(String project, int id) {
        return reminderScheduler.markDone(project, id);
    }

    public HealthReport status(String project) {
        return healthService.status(project);
    }

    private void writePermanent(String project, MemoryKind kind, String text) {
        String body = text;
        String keyPrefix = "";
        Matcher key = ExtractionRules.KEY_PREFIX.matcher(body);
        if (key.find()) {
            keyPrefix = "KEY: ";
            body = key.replaceFirst("").trim();
        }
        body = ExtractionRules.LABEL.matcher(body).replaceFirst("").trim();
        String line = "- " + keyPrefix + "**" + kind.getLabel() + ":** " + body;

        StateRecord state = stateRecordService.loadState(project);
        String before = memoryStoreService.read(project);
        String priorFingerprint = memoryStoreService.fingerprint(before);
        String updated = memoryStoreService.appendUnderDate(before, LocalDate.now(clock), List.of(line));
        memoryStoreService.write(project, updated);

        if (state.getContentFingerprint() == null || state.getContentFingerprint().equals(priorFingerprint)) {
            String fingerprint = memoryStoreService.fingerprint(updated);
            memoryIndexService.reindex(project, updated, fingerprint);
            stateRecordService.saveState(project, lifecycleService.advance(state, fingerprint));
        } else {
            // an external edit is pending; recall will treat it as drift
            stateRecordService.saveState(project, lifecycleService.touch(state));
        }
    }

    private void touchState(String project) {
        StateRecord state = stateRecordService.loadState(project);
        stateRecordService.saveState(project, lifecycleService.touch(state));
    }

    private List<String> priorRejections(String project) {
        List<String> prior = new ArrayList<>(sessionBufferService.read(project).get(SessionCategory.REJECTED));
        String content = memoryStoreService.read(project);
        ParseResult parse = memoryIndexService.current(project, content, memoryStoreService.fingerprint(content));
        for (MemoryEntry entry : parse.getEntries()) {
            if (entry.isRejectedApproach() && !entry.isSuperseded()) {
                prior.add(entry.getText());
            }
        }
        return prior;
    }

    private LogKind toLogKind(MemoryEntry entry) {
        if (entry.isRejectedApproach()) {
            return LogKind.REJECTED;
        }
        return LogKind.valueOf(entry.getKind().name());
    }

    private LogKind categoryKind(SessionCategory category) {
        return switch (category) {
        case EXPERIENCE -> LogKind.EXPERIENCE;
        case BLOCKER -> LogKind.BLOCKER;
        case REJECTED -> LogKind.REJECTED;
        case ASSUMPTION -> LogKind.ASSUMPTION;
        };
    }
}
