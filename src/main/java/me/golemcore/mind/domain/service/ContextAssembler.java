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

import me.golemcore.mind.domain.model.ContextRequest;
import me.golemcore.mind.domain.model.MemoryEntry;
import me.golemcore.mind.domain.model.MemoryKind;
import me.golemcore.mind.domain.model.ProjectState;
import me.golemcore.mind.domain.model.Reminder;
import me.golemcore.mind.domain.model.ScoredEntry;
import me.golemcore.mind.domain.model.SessionSummary;
import me.golemcore.mind.infrastructure.config.MindProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Ranks memory entries and renders the bounded context returned by recall.
 *
 * <p>
 * score = confidence × (1 + recency + frequency + trigger + continuity), where
 * <ul>
 * <li>recency decays exponentially with the configured half-life; key entries
 * never decay</li>
 * <li>frequency grows with the logarithm of search hits</li>
 * <li>trigger applies when the entry mentions the project stack or the current
 * turn</li>
 * <li>continuity applies when the entry relates to the last declared next
 * step</li>
 * </ul>
 * Rejected approaches get their own section so they are never read as
 * decisions. Each section keeps at most {@code mind.context.items-per-category} entries.
 * Due reminders are always rendered first, outside the budget.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextAssembler {

    public static final double MAX_RECENCY_BOOST = 0.3;
    public static final double MAX_FREQUENCY_BOOST = 0.2;
    public static final double TRIGGER_BOOST = 0.2;
    public static final double CONTINUITY_BOOST = 0.2;

    private static final double FREQUENCY_SATURATION = 3.0;
    private static final int MAX_LINE_LENGTH = 240;

    private final MindProperties properties;
    private final SimilarityEngine similarityEngine;
    private final Clock clock;

    public String assemble(ContextRequest request) {
        LocalDate today = LocalDate.now(clock);
        ProjectState state = request.getParse().getProjectState() != null
                ? request.getParse().getProjectState()
                : new ProjectState();
        SessionSummary lastSession = lastSession(request.getParse().getSessionSummaries());

        Set<String> triggerTerms = new HashSet<>();
        for (String item : state.getStack()) {
            triggerTerms.addAll(similarityEngine.keywords(item));
        }
        triggerTerms.addAll(similarityEngine.keywords(request.getTurnText()));
        Set<String> continuityTerms = new HashSet<>(similarityEngine.keywords(nextStep(state, lastSession)));

        List<MemoryEntry> candidates = request.getParse().getEntries().stream()
                .filter(entry -> !entry.isSuperseded())
                .filter(entry -> entry.getConfidence() >= properties.getContext().getMinConfidence())
                .toList();

        StringBuilder sb = new StringBuilder();
        sb.append("# Memory Context: ").append(request.getProjectName()).append('\n');

        appendProjectState(sb, state, lastSession);
        appendDueReminders(sb, request.getDueReminders());
        appendWatchedReminders(sb, request.getWatchedReminders());

        int rendered = 0;
        rendered += appendSection(sb, "Recent Decisions",
                rank(candidates, entry -> entry.getKind() == MemoryKind.DECISION && !entry.isRejectedApproach(),
                        triggerTerms, continuityTerms, request.getAccessCounts(), today));
        rendered += appendSection(sb, "Rejected Approaches (do not retry)",
                rank(candidates, MemoryEntry::isRejectedApproach,
                        triggerTerms, continuityTerms, request.getAccessCounts(), today));
        rendered += appendSection(sb, "Open Items",
                rank(candidates, MemoryEntry::isOpenItem,
                        triggerTerms, continuityTerms, request.getAccessCounts(), today));
        rendered += appendSection(sb, "Gotchas",
                rank(candidates, entry -> entry.getKind() == MemoryKind.GOTCHA
                        || entry.getKind() == MemoryKind.LEARNING,
                        triggerTerms, continuityTerms, request.getAccessCounts(), today));
        rendered += appendSection(sb, "Recent Progress",
                rank(candidates, entry -> entry.getKind() == MemoryKind.PROGRESS,
                        triggerTerms, continuityTerms, request.getAccessCounts(), today));

        if (rendered == 0 && request.getDueReminders().isEmpty()) {
            sb.append("\nNo memories yet. Log decisions, learnings and issues as you work.\n");
        }
        log.debug("[Context] Rendered {} entries, {} due reminders", rendered, request.getDueReminders().size());
        return sb.toString();
    }

    /**
     * Entries matching the filter, best first, truncated to the per-category
     * budget.
     */
    public List<ScoredEntry> rank(Collection<MemoryEntry> entries, Predicate<MemoryEntry> filter,
            Set<String> triggerTerms, Set<String> continuityTerms, Map<String, Integer> accessCounts,
            LocalDate today) {
        List<ScoredEntry> scored = new ArrayList<>();
        for (MemoryEntry entry : entries) {
            if (!filter.test(entry)) {
                continue;
            }
            int accesses = accessCounts.getOrDefault(entry.getId(), 0);
            scored.add(ScoredEntry.builder()
                    .entry(entry)
                    .score(score(entry, triggerTerms, continuityTerms, accesses, today))
                    .build());
        }
        scored.sort(Comparator.comparingDouble(ScoredEntry::getScore).reversed()
                .thenComparingInt(scoredEntry -> scoredEntry.getEntry().getLine()));
        int budget = Math.max(0, properties.getContext().getItemsPerCategory());
        return scored.size() > budget ? new ArrayList<>(scored.subList(0, budget)) : scored;
    }

    public double score(MemoryEntry entry, Set<String> triggerTerms, Set<String> continuityTerms,
            int accessCount, LocalDate today) {
        Set<String> terms = SimilarityEngine.termCounts(entry.getText()).keySet();
        double trigger = intersects(terms, triggerTerms) ? TRIGGER_BOOST : 0.0;
        double continuity = intersects(terms, continuityTerms) ? CONTINUITY_BOOST : 0.0;
        double multiplier = 1.0 + recencyBoost(entry, today) + frequencyBoost(accessCount) + trigger + continuity;
        return entry.getConfidence() * multiplier;
    }

    /**
     * {@code 0.3 × 0.5^(age / half-life)}. Key entries always get the full
     * boost; undated entries get none.
     */
    public double recencyBoost(MemoryEntry entry, LocalDate today) {
        if (entry.isKey()) {
            return MAX_RECENCY_BOOST;
        }
        if (entry.getCreatedAt() == null) {
            return 0.0;
        }
        long ageDays = Math.max(0, ChronoUnit.DAYS.between(entry.getCreatedAt(), today));
        double halfLife = properties.getContext().getRecencyHalfLifeDays();
        return MAX_RECENCY_BOOST * Math.pow(0.5, ageDays / halfLife);
    }

    /**
     * Logarithmic in the access count: 0 for none, 0.1 for one, saturating at
     * 0.2 from three on.
     */
    public double frequencyBoost(int accessCount) {
        if (accessCount <= 0) {
            return 0.0;
        }
        double boost = MAX_FREQUENCY_BOOST * Math.log(1 + accessCount) / Math.log(1 + FREQUENCY_SATURATION);
        return Math.min(MAX_FREQUENCY_BOOST, boost);
    }

    private void appendProjectState(StringBuilder sb, ProjectState state, SessionSummary lastSession) {
        List<String> lines = new ArrayList<>();
        if (state.getGoal() != null) {
            lines.add("Goal: " + state.getGoal());
        }
        if (!state.getStack().isEmpty()) {
            lines.add("Stack: " + String.join(", ", state.getStack()));
        }
        if (state.getBlocked() != null) {
            lines.add("Blocked: " + state.getBlocked());
        }
        if (lastSession != null) {
            StringBuilder line = new StringBuilder("Last session (").append(lastSession.getDate()).append(")");
            if (lastSession.getSummary() != null) {
                line.append(": ").append(lastSession.getSummary());
            }
            if (lastSession.getMood() != null) {
                line.append(" [").append(lastSession.getMood()).append(']');
            }
            lines.add(line.toString());
        }
        String next = nextStep(state, lastSession);
        if (next != null) {
            lines.add("Next step: " + next);
        }
        if (lines.isEmpty()) {
            return;
        }
        sb.append("\n## Project State\n");
        lines.forEach(line -> sb.append(line).append('\n'));
    }

    private void appendDueReminders(StringBuilder sb, List<Reminder> due) {
        if (due.isEmpty()) {
            return;
        }
        sb.append("\n## Reminders Due\n");
        for (Reminder reminder : due) {
            sb.append("- [#").append(reminder.getId()).append("] ").append(reminder.getMessage()).append('\n');
        }
    }

    private void appendWatchedReminders(StringBuilder sb, List<Reminder> watched) {
        if (watched.isEmpty()) {
            return;
        }
        sb.append("\n## Watching For\n");
        for (Reminder reminder : watched) {
            sb.append("- [#").append(reminder.getId()).append("] ")
                    .append(String.join(", ", reminder.getTrigger().keywords()))
                    .append(": ").append(reminder.getMessage()).append('\n');
        }
    }

    private int appendSection(StringBuilder sb, String title, List<ScoredEntry> entries) {
        if (entries.isEmpty()) {
            return 0;
        }
        sb.append("\n## ").append(title).append('\n');
        for (ScoredEntry scored : entries) {
            MemoryEntry entry = scored.getEntry();
            sb.append("- ");
            if (entry.isKey()) {
                sb.append("KEY: ");
            }
            sb.append(MemoryTextSupport.truncate(entry.getText(), MAX_LINE_LENGTH));
            if (entry.getCreatedAt() != null) {
                sb.append(" (").append(entry.getCreatedAt()).append(')');
            }
            sb.append('\n');
        }
        return entries.size();
    }

    private SessionSummary lastSession(List<SessionSummary> summaries) {
        SessionSummary last = null;
        for (SessionSummary summary : summaries) {
            if (last == null || !summary.getDate().isBefore(last.getDate())) {
                last = summary;
            }
        }
        return last;
    }

    private String nextStep(ProjectState state, SessionSummary lastSession) {
        if (lastSession != null && lastSession.getNextStep() != null) {
            return lastSession.getNextStep();
        }
        return state.getNextStep();
    }

    private boolean intersects(Set<String> first, Set<String> second) {
        if (first.isEmpty() || second.isEmpty()) {
            return false;
        }
        for (String term : first) {
            if (second.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
