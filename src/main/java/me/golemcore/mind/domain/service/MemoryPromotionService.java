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

import me.golemcore.mind.domain.model.MemoryEntry;
import me.golemcore.mind.domain.model.MemoryKind;
import me.golemcore.mind.domain.model.ParseResult;
import me.golemcore.mind.domain.model.PromotionOutcome;
import me.golemcore.mind.domain.model.PromotionResult;
import me.golemcore.mind.domain.model.SessionBuffer;
import me.golemcore.mind.domain.model.SessionCategory;
import me.golemcore.mind.domain.model.SimilarityTier;
import me.golemcore.mind.infrastructure.config.MindProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Drains the session buffer into permanent memory at a session boundary.
 *
 * <p>
 * Policy:
 * <ul>
 * <li>rejected approaches are kept only when they state a reason</li>
 * <li>experience is kept only when it names a file or a technology</li>
 * <li>blockers are kept only when {@code mind.promotion.promote-blockers} is
 * on, under the same signal rule as experience</li>
 * <li>assumptions are never kept</li>
 * </ul>
 * Every kept line is checked against existing entries: duplicates are
 * skipped, near-duplicates supersede the old entry, similar entries are linked.
 *
 * <p>
 * Draining is all-or-nothing. All new lines and supersede markers go out in a
 * single atomic write of {@code MEMORY.md}; the buffer is cleared only after
 * that write succeeds.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryPromotionService {

    private static final Set<String> TECHNOLOGY_TERMS = Set.of(
            "java", "kotlin", "spring", "python", "typescript", "javascript", "react", "vue", "angular",
            "node", "npm", "yarn", "maven", "gradle", "docker", "kubernetes", "k8s", "helm", "redis",
            "postgres", "postgresql", "mysql", "sqlite", "mongodb", "kafka", "rabbitmq", "graphql", "rest",
            "api", "http", "https", "grpc", "protobuf", "json", "yaml", "xml", "sql", "regex", "cache",
            "caching", "jwt", "oauth", "auth", "git", "ci", "lambda", "aws", "gcp", "azure", "terraform",
            "webpack", "vite", "jest", "junit", "mockito", "pytest", "hibernate", "jpa", "orm", "cors",
            "websocket", "nginx", "linux", "bash", "cli", "async", "thread", "threads", "mutex", "index",
            "query", "schema", "migration", "endpoint", "middleware", "dependency", "config", "jvm", "gc",
            "heap", "latency", "timeout", "retry", "pagination", "serialization", "deadlock", "race");

    private static final Pattern CODE_SIGNAL = Pattern.compile(
            "`[^`]+`|\\b\\w+\\(\\)|\\b[a-z]+[A-Z]\\w*\\b|\\b[A-Z][a-z]+[A-Z]\\w*\\b|--[a-z][\\w-]+"
                    + "|\\bv\\d+\\.\\d+(?:\\.\\d+)?\\b");

    private static final String SEE_ALSO_FORMAT = " (see also: [[MEMORY#L%d]])";

    private final MemoryStoreService memoryStoreService;
    private final SessionBufferService sessionBufferService;
    private final MemoryExtractor extractor;
    private final SimilarityEngine similarityEngine;
    private final MindProperties properties;
    private final Clock clock;

    /**
     * Promotes the project's buffer and clears it.
     *
     * @throws me.golemcore.mind.domain.exception.StorageException
     *             when the memory write fails; the buffer is left untouched
     */
    public PromotionResult promote(String project) {
        SessionBuffer buffer = sessionBufferService.read(project);
        if (buffer.isEmpty()) {
            log.debug("[Promotion] Buffer empty, nothing to promote");
            return PromotionResult.empty();
        }

        String content = memoryStoreService.read(project);
        ParseResult parse = extractor.parse(content, MemoryStoreService.MEMORY_FILE);
        Plan plan = plan(buffer, parse.getEntries());

        if (!plan.newLines.isEmpty() || !plan.supersede.isEmpty()) {
            String updated = content;
            for (Map.Entry<Integer, String> marker : plan.supersede.entrySet()) {
                updated = memoryStoreService.markSuperseded(updated, marker.getKey(), marker.getValue());
            }
            updated = memoryStoreService.appendUnderDate(updated, LocalDate.now(clock), plan.newLines);
            memoryStoreService.write(project, updated);
        }

        sessionBufferService.clear(project);

        PromotionResult result = plan.result;
        log.info("[Promotion] Promoted {} of {} buffer line(s): {} inserted, {} linked, {} superseded, {} skipped",
                result.promotedCount(), buffer.size(), result.getInserted().size(), result.getLinked().size(),
                result.getSuperseded().size(), result.getSkipped().size());
        return result;
    }

    /**
     * Reason a buffer line is not eligible for promotion, or empty when it is.
     */
    public Optional<String> rejectionReason(SessionCategory category, String text) {
        return switch (category) {
        case REJECTED -> extractor.extractReasoning(text) != null
                ? Optional.empty()
                : Optional.of("rejected approach states no reason");
        case EXPERIENCE -> hasTechnicalSignal(text)
                ? Optional.empty()
                : Optional.of("no technical signal");
        case BLOCKER -> {
            if (!properties.getPromotion().isPromoteBlockers()) {
                yield Optional.of("blockers are not promoted");
            }
            yield hasTechnicalSignal(text) ? Optional.empty() : Optional.of("no technical signal");
        }
        case ASSUMPTION -> Optional.of("assumptions are not promoted");
        };
    }

    /**
     * {@code true} when the text names a file path or a known technology, or
     * contains code-like tokens.
     */
    public boolean hasTechnicalSignal(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        if (!MemoryTextSupport.extractFileReferences(text).isEmpty()) {
            return true;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (TECHNOLOGY_TERMS.contains(token)) {
                return true;
            }
        }
        return CODE_SIGNAL.matcher(text).find();
    }

    private Plan plan(SessionBuffer buffer, List<MemoryEntry> existing) {
        List<MemoryEntry> live = existing.stream().filter(entry -> !entry.isSuperseded()).toList();
        TfIdfIndex index = similarityEngine.index(live.stream().map(MemoryEntry::getText).toList());
        int existingCount = index.size();

        Plan plan = new Plan();
        for (SessionCategory category : SessionCategory.values()) {
            for (String text : buffer.get(category)) {
                Optional<String> ineligible = rejectionReason(category, text);
                if (ineligible.isPresent()) {
                    plan.result.getSkipped().add(outcome(category, text, PromotionOutcome.Action.DISCARDED)
                            .reason(ineligible.get())
                            .build());
                    continue;
                }
                planCandidate(plan, index, existingCount, live, category, text);
            }
        }
        return plan;
    }

    private void planCandidate(Plan plan, TfIdfIndex index, int existingCount, List<MemoryEntry> live,
            SessionCategory category, String text) {
        MemoryKind kind = promotedKind(category);
        Optional<TfIdfIndex.Match> best = index.bestMatch(text);
        double score = best.map(TfIdfIndex.Match::similarity).orElse(0.0);
        SimilarityTier tier = similarityEngine.classify(score);
        MemoryEntry related = best.isPresent() && best.get().index() < existingCount
                ? live.get(best.get().index())
                : null;

        if (tier == SimilarityTier.DUPLICATE || (tier == SimilarityTier.NEAR_DUPLICATE && related == null)) {
            plan.result.getSkipped().add(outcome(category, text, PromotionOutcome.Action.SKIPPED_DUPLICATE)
                    .similarity(score)
                    .relatedTo(best.get().text())
                    .reason("duplicate of existing memory")
                    .build());
            return;
        }

        String storedText = text;
        if (tier == SimilarityTier.SIMILAR && related != null) {
            storedText = text + String.format(Locale.ROOT, SEE_ALSO_FORMAT, related.getLine());
        }
        String newId = MemoryTextSupport.entryId(kind.name(), storedText);
        plan.newLines.add("- **" + label(category) + ":** " + storedText);
        index.add(text);

        if (tier == SimilarityTier.NEAR_DUPLICATE) {
            plan.supersede.put(related.getLine(), newId);
            PromotionOutcome outcome = outcome(category, text, PromotionOutcome.Action.SUPERSEDED)
                    .entryId(newId)
                    .similarity(score)
                    .relatedTo(related.getId())
                    .build();
            plan.result.getInserted().add(outcome);
            plan.result.getSuperseded().add(outcome);
        } else if (tier == SimilarityTier.SIMILAR && related != null) {
            plan.result.getLinked().add(outcome(category, text, PromotionOutcome.Action.LINKED)
                    .entryId(newId)
                    .similarity(score)
                    .relatedTo(related.getId())
                    .build());
        } else {
            plan.result.getInserted().add(outcome(category, text, PromotionOutcome.Action.INSERTED)
                    .entryId(newId)
                    .similarity(score)
                    .build());
        }
        log.debug("[Promotion] {} -> {} ({}, {})", category, kind, tier, score);
    }

    private MemoryKind promotedKind(SessionCategory category) {
        return switch (category) {
        case EXPERIENCE -> MemoryKind.LEARNING;
        case REJECTED -> MemoryKind.DECISION;
        case BLOCKER -> MemoryKind.PROBLEM;
        case ASSUMPTION -> throw new IllegalStateException("Assumptions are never promoted");
        };
    }

    private String label(SessionCategory category) {
        return category == SessionCategory.REJECTED ? "Rejected" : promotedKind(category).getLabel();
    }

    private PromotionOutcome.PromotionOutcomeBuilder outcome(SessionCategory category, String text,
            PromotionOutcome.Action action) {
        return PromotionOutcome.builder()
                .category(category)
                .text(text)
                .action(action);
    }

    private static final class Plan {
        private final List<String> newLines = new ArrayList<>();
        private final Map<Integer, String> supersede = new HashMap<>();
        private final PromotionResult result = PromotionResult.empty();
    }
}
