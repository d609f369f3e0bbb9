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
import me.golemcore.mind.domain.model.ProjectState;
import me.golemcore.mind.domain.model.SessionSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts loosely written markdown prose into typed, confidence-scored memory
 * entries.
 *
 * <p>
 * Classification is table driven, see {@link ExtractionRules}. Lines that
 * match nothing are reported as skipped, never treated as errors. Ambiguous
 * matches are kept at hint confidence so readers can filter by threshold.
 *
 * <p>
 * Structural lines are not entries:
 * <ul>
 * <li>{@code ## YYYY-MM-DD} headings set the date context of following
 * lines</li>
 * <li>{@code ## YYYY-MM-DD | summary | mood | next} lines are session
 * summaries</li>
 * <li>bullets in {@code ## Project State} describe the project</li>
 * </ul>
 * Bullets under {@code ## Gotchas} are always gotcha entries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryExtractor {

    public static final String DEFAULT_SOURCE = "MEMORY.md";

    private static final Pattern SESSION_SUMMARY = Pattern.compile(
            "^(?:#{1,6}\\s*)?(\\d{4}-\\d{2}-\\d{2})\\s*\\|(.*)$");
    private static final Pattern DATE_HEADING = Pattern.compile("^#{1,6}\\s*(\\d{4}-\\d{2}-\\d{2})\\b.*$");
    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+?)\\s*#*$");
    private static final Pattern BULLET = Pattern.compile("^(?:[-*+]|\\d+[.)])\\s+(?:\\[[ xX]]\\s+)?");
    private static final Pattern STATE_FIELD = Pattern.compile("^([A-Za-z ]+?)\\s*:\\s*(.*)$");

    private static final String PROJECT_STATE_SECTION = "project state";
    private static final String GOTCHAS_SECTION = "gotchas";

    private final Clock clock;

    /**
     * Extracts candidates from free text, dated today unless the text carries
     * its own date headings.
     */
    public List<MemoryEntry> extract(String text) {
        return extract(text, LocalDate.now(clock));
    }

    /**
     * Extracts candidates from free text with the given date context.
     */
    public List<MemoryEntry> extract(String text, LocalDate dateContext) {
        return parse(text, DEFAULT_SOURCE, dateContext).getEntries();
    }

    /**
     * Parses a whole permanent store.
     */
    public ParseResult parse(String content, String source) {
        return parse(content, source, null);
    }

    private ParseResult parse(String content, String source, LocalDate initialDate) {
        ParseResult result = new ParseResult();
        if (content == null || content.isBlank()) {
            return result;
        }

        List<String> lines = Arrays.asList(content.split("\\r?\\n", -1));
        LocalDate dateContext = initialDate;
        String section = null;
        boolean inCodeBlock = false;

        for (int i = 0; i < lines.size(); i++) {
            int lineNumber = i + 1;
            String trimmed = lines.get(i).trim();

            if (trimmed.startsWith("```")) {
                inCodeBlock = !inCodeBlock;
                continue;
            }
            if (inCodeBlock || trimmed.isEmpty() || isStructuralNoise(trimmed)) {
                continue;
            }

            Matcher summary = SESSION_SUMMARY.matcher(trimmed);
            if (summary.matches()) {
                SessionSummary parsed = parseSessionSummary(summary.group(1), summary.group(2));
                if (parsed != null) {
                    result.getSessionSummaries().add(parsed);
                    dateContext = parsed.getDate();
                }
                section = null;
                continue;
            }

            Matcher dateHeading = DATE_HEADING.matcher(trimmed);
            if (dateHeading.matches()) {
                LocalDate date = parseDate(dateHeading.group(1));
                if (date != null) {
                    dateContext = date;
                }
                section = null;
                continue;
            }

            Matcher heading = HEADING.matcher(trimmed);
            if (heading.matches()) {
                section = heading.group(2).trim().toLowerCase(Locale.ROOT);
                continue;
            }

            String body = BULLET.matcher(trimmed).replaceFirst("").trim();
            if (body.isEmpty()) {
                continue;
            }

            if (PROJECT_STATE_SECTION.equals(section)) {
                applyProjectState(result.getProjectState(), body);
                continue;
            }

            MemoryEntry entry = GOTCHAS_SECTION.equals(section)
                    ? gotcha(body, source, lineNumber, dateContext)
                    : extractLine(body, source, lineNumber, dateContext);
            if (entry != null) {
                result.getEntries().add(entry);
            } else {
                result.getSkippedLines().add(source + ":" + lineNumber);
            }
        }

        log.debug("[Extractor] Parsed {}: {} entries, {} summaries, {} skipped lines",
                source, result.getEntries().size(), result.getSessionSummaries().size(),
                result.getSkippedLines().size());
        return result;
    }

    private MemoryEntry extractLine(String body, String source, int lineNumber, LocalDate date) {
        String text = body;

        String supersededBy = null;
        Matcher superseded = ExtractionRules.SUPERSEDED_MARKER.matcher(text);
        if (superseded.find()) {
            supersededBy = superseded.group(1) != null ? superseded.group(1) : "unknown";
            text = superseded.replaceFirst("").trim();
        }

        boolean key = false;
        Matcher keyPrefix = ExtractionRules.KEY_PREFIX.matcher(text);
        if (keyPrefix.find()) {
            key = true;
            text = keyPrefix.replaceFirst("").trim();
        }

        ExtractionRules.Rule matched = null;
        for (ExtractionRules.Rule rule : ExtractionRules.rules()) {
            if (rule.pattern().matcher(text).find()) {
                matched = rule;
                break;
            }
        }

        MemoryKind kind;
        ExtractionRules.Strength strength;
        boolean rejected = false;
        if (matched != null) {
            kind = matched.kind();
            strength = matched.strength();
            rejected = matched.rejectedApproach();
            if (kind == MemoryKind.DECISION && strength == ExtractionRules.Strength.KEYWORD
                    && ExtractionRules.DECISION_GUARD.matcher(text).find()) {
                strength = ExtractionRules.Strength.HINT;
            }
        } else if (key) {
            kind = MemoryKind.LEARNING;
            strength = ExtractionRules.Strength.KEYWORD;
        } else {
            return null;
        }

        if (strength == ExtractionRules.Strength.LABELED) {
            text = ExtractionRules.LABEL.matcher(text).replaceFirst("").trim();
        }
        if (text.isEmpty()) {
            return null;
        }

        boolean causal = ExtractionRules.CAUSAL.matcher(text).find();
        return MemoryEntry.builder()
                .id(MemoryTextSupport.entryId(kind.name(), text))
                .kind(kind)
                .text(text)
                .confidence(ExtractionRules.confidence(strength, causal))
                .createdAt(date)
                .sourceLocation(source + ":" + lineNumber)
                .line(lineNumber)
                .supersededBy(supersededBy)
                .key(key)
                .rejectedApproach(rejected)
                .status(detectStatus(kind, text))
                .reasoning(extractReasoning(text))
                .build();
    }

    private MemoryEntry gotcha(String body, String source, int lineNumber, LocalDate date) {
        String text = ExtractionRules.LABEL.matcher(body).replaceFirst("").trim();
        if (text.isEmpty()) {
            return null;
        }
        boolean causal = ExtractionRules.CAUSAL.matcher(text).find();
        return MemoryEntry.builder()
                .id(MemoryTextSupport.entryId(MemoryKind.GOTCHA.name(), text))
                .kind(MemoryKind.GOTCHA)
                .text(text)
                .confidence(ExtractionRules.confidence(ExtractionRules.Strength.LABELED, causal))
                .createdAt(date)
                .sourceLocation(source + ":" + lineNumber)
                .line(lineNumber)
                .reasoning(extractReasoning(text))
                .build();
    }

    /**
     * Returns the reasoning clause of a line, or {@code null} when it states
     * none.
     */
    public String extractReasoning(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = ExtractionRules.REASONING.matcher(text);
        if (matcher.find()) {
            String reason = matcher.group(1).trim();
            return reason.isEmpty() ? null : reason;
        }
        return null;
    }

    private MemoryEntry.Status detectStatus(MemoryKind kind, String text) {
        if (kind != MemoryKind.ISSUE && kind != MemoryKind.PROBLEM) {
            return MemoryEntry.Status.OPEN;
        }
        if (ExtractionRules.RESOLVED.matcher(text).find()) {
            return MemoryEntry.Status.RESOLVED;
        }
        if (ExtractionRules.BLOCKED.matcher(text).find()) {
            return MemoryEntry.Status.BLOCKED;
        }
        return MemoryEntry.Status.OPEN;
    }

    private SessionSummary parseSessionSummary(String dateText, String rest) {
        LocalDate date = parseDate(dateText);
        if (date == null) {
            return null;
        }
        SessionSummary summary = SessionSummary.builder().date(date).build();
        String[] parts = rest.split("\\|");
        int position = 0;
        for (String rawPart : parts) {
            String part = rawPart.trim();
            if (part.isEmpty()) {
                continue;
            }
            String lower = part.toLowerCase(Locale.ROOT);
            if (lower.startsWith("mood:")) {
                summary.setMood(part.substring(5).trim());
            } else if (lower.startsWith("next:")) {
                summary.setNextStep(part.substring(5).trim());
            } else if (position == 0) {
                summary.setSummary(part);
            } else if (summary.getMood() == null) {
                summary.setMood(part);
            }
            position++;
        }
        return summary;
    }

    private void applyProjectState(ProjectState state, String body) {
        Matcher matcher = STATE_FIELD.matcher(body.replace("**", ""));
        if (!matcher.matches()) {
            return;
        }
        String field = matcher.group(1).trim().toLowerCase(Locale.ROOT);
        String value = matcher.group(2).trim();
        if (value.isEmpty() || "-".equals(value) || "none".equalsIgnoreCase(value)
                || "(none)".equalsIgnoreCase(value)) {
            return;
        }
        switch (field) {
        case "goal" -> state.setGoal(value);
        case "stack" -> {
            List<String> stack = new ArrayList<>();
            for (String item : value.split(",")) {
                if (!item.isBlank()) {
                    stack.add(item.trim());
                }
            }
            state.setStack(stack);
        }
        case "blocked", "blocked by", "blocker" -> state.setBlocked(value);
        case "next", "next step" -> state.setNextStep(value);
        default -> log.trace("[Extractor] Ignoring project state field: {}", field);
        }
    }

    private boolean isStructuralNoise(String trimmed) {
        return trimmed.startsWith("<!--")
                || trimmed.startsWith("---")
                || trimmed.startsWith(">")
                || trimmed.toLowerCase(Locale.ROOT).startsWith("keywords:");
    }

    private LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("[Extractor] Invalid date heading '{}'", value);
            return null;
        }
    }
}
