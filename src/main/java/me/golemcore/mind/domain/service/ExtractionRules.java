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

import me.golemcore.mind.domain.model.MemoryKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Classification table for the extractor. Rules are ordered: every labeled
 * rule is tried before any keyword rule, and every keyword rule before any
 * hint. The first matching rule decides kind and base confidence.
 */
public final class ExtractionRules {

    public static final double CAUSAL_BONUS = 0.1;
    public static final double MAX_CONFIDENCE = 0.99;

    /**
     * Base confidence of a match.
     */
    public enum Strength {
        LABELED(0.9), KEYWORD(0.7), HINT(0.4);

        private final double confidence;

        Strength(double confidence) {
            this.confidence = confidence;
        }

        public double getConfidence() {
            return confidence;
        }
    }

    public record Rule(MemoryKind kind, Strength strength, Pattern pattern, boolean rejectedApproach) {
    }

    public static final Pattern CAUSAL = Pattern.compile(
            "\\b(because|since|due to|so that|as a result)\\b|\\breason:", Pattern.CASE_INSENSITIVE);

    public static final Pattern REASONING = Pattern.compile(
            "(?:\\bbecause\\b|\\bsince\\b|\\bdue to\\b|\\breason:|\\bas it\\b|\\bgiven that\\b)\\s*(.+)$",
            Pattern.CASE_INSENSITIVE);

    /**
     * Phrasing that mentions a decision without making one.
     */
    public static final Pattern DECISION_GUARD = Pattern.compile(
            "\\b(haven'?t decided|have not decided|need to decide|not decided|undecided|still deciding"
                    + "|not sure|to be decided|tbd|should we|deciding between)\\b|\\?\\s*$",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern KEY_PREFIX = Pattern.compile("^(?:KEY|important)\\s*:\\s*",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern SUPERSEDED_MARKER = Pattern.compile(
            "\\[superseded(?: by ([0-9a-f]+))?]\\s*", Pattern.CASE_INSENSITIVE);

    public static final Pattern LABEL = Pattern.compile("^\\*\\*([A-Za-z ]+?)\\s*:?\\s*\\*\\*\\s*:?\\s*");

    public static final Pattern RESOLVED = Pattern.compile(
            "\\b(resolved|fixed|closed|solved)\\b|✅", Pattern.CASE_INSENSITIVE);

    public static final Pattern BLOCKED = Pattern.compile("\\bblocked\\b", Pattern.CASE_INSENSITIVE);

    private static final List<Rule> RULES;

    static {
        List<Rule> rules = new ArrayList<>();

        labeled(rules, MemoryKind.DECISION, "decided|decision|chose|chosen|going with", false);
        labeled(rules, MemoryKind.DECISION, "rejected|rejected approach|tried", true);
        labeled(rules, MemoryKind.GOTCHA, "gotcha|caveat|pitfall|warning", false);
        labeled(rules, MemoryKind.LEARNING, "learned|learning|til|insight|discovered|note", false);
        labeled(rules, MemoryKind.PROGRESS, "done|progress|fixed|shipped|completed|implemented", false);
        labeled(rules, MemoryKind.PROBLEM, "problem|blocker|blocked", false);
        labeled(rules, MemoryKind.ISSUE, "issue|bug|broken", false);

        keyword(rules, MemoryKind.DECISION,
                "\\b(decided|chose|went with|going with|settled on|opted for|picked)\\b|^decision:");
        keyword(rules, MemoryKind.LEARNING,
                "\\b(learned|discovered|realized|realised|turns out|til|found out)\\b|^learning:");
        keyword(rules, MemoryKind.GOTCHA, "\\b(gotcha|watch out|careful|pitfall)\\b");
        keyword(rules, MemoryKind.PROGRESS,
                "\\b(finished|completed|shipped|implemented|fixed|done with|merged)\\b|^done:");
        keyword(rules, MemoryKind.PROBLEM, "\\b(problem|stuck on|blocked by|blocker)\\b");
        keyword(rules, MemoryKind.ISSUE, "\\b(bug|broken|crash(?:es|ed)?|regression)\\b|^issue:");

        hint(rules, MemoryKind.DECISION,
                "\\b(thinking about|considering|leaning towards|might (?:use|go with|switch)|planning to"
                        + "|maybe (?:use|we should)|should we|deciding between)\\b");
        hint(rules, MemoryKind.ISSUE, "\\b(seems (?:off|wrong|broken)|weird|strange|flaky|not sure why)\\b");
        hint(rules, MemoryKind.LEARNING, "\\b(interesting|apparently|note to self)\\b");
        hint(rules, MemoryKind.PROGRESS, "\\b(working on|started|in progress|wip)\\b");

        RULES = Collections.unmodifiableList(rules);
    }

    private ExtractionRules() {
    }

    public static List<Rule> rules() {
        return RULES;
    }

    /**
     * Confidence of a match: base strength, plus the causal bonus, capped.
     */
    public static double confidence(Strength strength, boolean causal) {
        double value = strength.getConfidence() + (causal ? CAUSAL_BONUS : 0.0);
        return Math.min(MAX_CONFIDENCE, value);
    }

    private static void labeled(List<Rule> rules, MemoryKind kind, String labels, boolean rejected) {
        Pattern pattern = Pattern.compile("^\\*\\*(?:" + labels + ")\\s*:?\\s*\\*\\*", Pattern.CASE_INSENSITIVE);
        rules.add(new Rule(kind, Strength.LABELED, pattern, rejected));
    }

    private static void keyword(List<Rule> rules, MemoryKind kind, String regex) {
        rules.add(new Rule(kind, Strength.KEYWORD, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), false));
    }

    private static void hint(List<Rule> rules, MemoryKind kind, String regex) {
        rules.add(new Rule(kind, Strength.HINT, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), false));
    }
}
