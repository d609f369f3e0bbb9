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

import me.golemcore.mind.domain.model.LoopWarning;
import me.golemcore.mind.domain.model.SimilarityTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lexical similarity over memory text: tokenization, TF-IDF indexes, novelty
 * tiers and loop detection for rejected approaches.
 *
 * <p>
 * Deterministic by construction. No embeddings, no model downloads.
 */
@Service
@Slf4j
public class SimilarityEngine {

    private static final int MIN_TOKEN_LENGTH = 2;

    private static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "if", "then", "of", "to", "in", "on", "at", "by",
            "for", "with", "from", "as", "is", "are", "was", "were", "be", "been", "being", "it",
            "its", "this", "that", "these", "those", "we", "i", "you", "he", "she", "they", "me",
            "my", "our", "your", "their", "so", "do", "did", "does", "has", "have", "had", "not",
            "no", "can", "will", "would", "should", "could", "into", "about", "than", "too", "very",
            "just", "also", "there", "here", "what", "which", "when", "where", "who", "how", "all",
            "any", "some", "more", "most", "such", "only", "own", "same", "up", "out");

    /**
     * Term counts of a text after lowercasing, splitting on non-alphanumerics
     * and dropping stopwords and one-letter tokens.
     */
    public static Map<String, Integer> termCounts(String text) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return counts;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{Nd}]+")) {
            if (token.length() < MIN_TOKEN_LENGTH || STOPWORDS.contains(token)) {
                continue;
            }
            counts.merge(token, 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Significant terms of a text in first-occurrence order.
     */
    public List<String> keywords(String text) {
        return List.copyOf(termCounts(text).keySet());
    }

    /**
     * Pairwise cosine similarity with no corpus weighting.
     */
    public double similarity(String a, String b) {
        return new TfIdfIndex().similarity(a, b);
    }

    public TfIdfIndex index(Collection<String> corpus) {
        return new TfIdfIndex(corpus);
    }

    /**
     * Corpus texts ordered by similarity to the query. Empty for an empty
     * corpus.
     */
    public List<TfIdfIndex.Match> rank(String query, Collection<String> corpus, int limit) {
        return index(corpus).rank(query, limit);
    }

    public SimilarityTier classify(double similarity) {
        return SimilarityTier.classify(similarity);
    }

    /**
     * Compares a newly rejected approach with earlier rejections and returns a
     * warning when the best match reaches the loop threshold.
     */
    public Optional<LoopWarning> detectLoop(String rejection, Collection<String> priorRejections) {
        if (rejection == null || rejection.isBlank() || priorRejections.isEmpty()) {
            return Optional.empty();
        }
        TfIdfIndex index = index(priorRejections);
        Optional<TfIdfIndex.Match> best = index.bestMatch(rejection);
        if (best.isEmpty()) {
            return Optional.empty();
        }
        double score = best.get().similarity();
        LoopWarning.Severity severity = LoopWarning.Severity.of(score);
        if (severity == null) {
            return Optional.empty();
        }
        log.debug("[Similarity] Loop detected ({}, {}): {}", severity, score, best.get().text());
        return Optional.of(LoopWarning.builder()
                .severity(severity)
                .similarity(score)
                .similarTo(best.get().text())
                .message(loopMessage(severity, score, best.get().text()))
                .build());
    }

    private String loopMessage(LoopWarning.Severity severity, double score, String similarTo) {
        String percent = String.format(Locale.ROOT, "%.0f%%", score * 100);
        return switch (severity) {
        case CRITICAL -> "STOP: you already rejected this approach (" + percent + " similar): " + similarTo;
        case HIGH -> "WARNING: this closely matches a rejected approach (" + percent + " similar): "
                + similarTo;
        case MODERATE -> "CAUTION: this resembles a rejected approach (" + percent + " similar): "
                + similarTo;
        };
    }
}
