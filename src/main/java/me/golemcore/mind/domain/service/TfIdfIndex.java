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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Growing TF-IDF vector space over a corpus of snippets.
 *
 * <p>
 * IDF is smoothed as {@code ln((1 + N) / (1 + df)) + 1}. Document vectors are
 * rebuilt lazily after the corpus grows. An empty index ranks nothing and
 * scores every pair by plain term-frequency cosine.
 */
public class TfIdfIndex {

    /**
     * A corpus document scored against a query.
     */
    public record Match(int index, String text, double similarity) {
    }

    private final List<String> documents = new ArrayList<>();
    private final List<Map<String, Integer>> termCounts = new ArrayList<>();
    private final Map<String, Integer> documentFrequency = new HashMap<>();
    private List<Map<String, Double>> vectors;

    public TfIdfIndex() {
    }

    public TfIdfIndex(Collection<String> corpus) {
        corpus.forEach(this::add);
    }

    /**
     * Adds a document and returns its position in the corpus.
     */
    public int add(String document) {
        String text = document != null ? document : "";
        Map<String, Integer> counts = SimilarityEngine.termCounts(text);
        documents.add(text);
        termCounts.add(counts);
        for (String term : counts.keySet()) {
            documentFrequency.merge(term, 1, Integer::sum);
        }
        vectors = null;
        return documents.size() - 1;
    }

    public int size() {
        return documents.size();
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }

    public String get(int index) {
        return documents.get(index);
    }

    /**
     * Cosine similarity of two texts under this corpus' IDF weights.
     */
    public double similarity(String a, String b) {
        Map<String, Double> first = vectorize(SimilarityEngine.termCounts(a));
        Map<String, Double> second = vectorize(SimilarityEngine.termCounts(b));
        return cosine(first, second);
    }

    /**
     * Corpus documents ordered by similarity to the query, best first. Ties
     * keep corpus order. Documents with zero similarity are omitted.
     */
    public List<Match> rank(String query, int limit) {
        if (isEmpty() || limit <= 0) {
            return List.of();
        }
        Map<String, Double> queryVector = vectorize(SimilarityEngine.termCounts(query));
        if (queryVector.isEmpty()) {
            return List.of();
        }
        List<Map<String, Double>> docVectors = documentVectors();
        List<Match> matches = new ArrayList<>();
        for (int i = 0; i < docVectors.size(); i++) {
            double score = cosine(queryVector, docVectors.get(i));
            if (score > 0.0) {
                matches.add(new Match(i, documents.get(i), score));
            }
        }
        matches.sort(Comparator.comparingDouble(Match::similarity).reversed()
                .thenComparingInt(Match::index));
        return matches.size() > limit ? new ArrayList<>(matches.subList(0, limit)) : matches;
    }

    /**
     * Most similar corpus document, empty when the corpus is empty or shares
     * no terms with the text.
     */
    public Optional<Match> bestMatch(String text) {
        List<Match> ranked = rank(text, 1);
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    private List<Map<String, Double>> documentVectors() {
        if (vectors == null) {
            List<Map<String, Double>> rebuilt = new ArrayList<>(termCounts.size());
            for (Map<String, Integer> counts : termCounts) {
                rebuilt.add(vectorize(counts));
            }
            vectors = rebuilt;
        }
        return vectors;
    }

    private Map<String, Double> vectorize(Map<String, Integer> counts) {
        Map<String, Double> vector = new HashMap<>();
        double norm = 0.0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            double weight = entry.getValue() * idf(entry.getKey());
            vector.put(entry.getKey(), weight);
            norm += weight * weight;
        }
        if (norm == 0.0) {
            return Map.of();
        }
        double length = Math.sqrt(norm);
        vector.replaceAll((term, weight) -> weight / length);
        return vector;
    }

    private double idf(String term) {
        int n = documents.size();
        int df = documentFrequency.getOrDefault(term, 0);
        return Math.log((1.0 + n) / (1.0 + df)) + 1.0;
    }

    private static double cosine(Map<String, Double> first, Map<String, Double> second) {
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        if (first.equals(second)) {
            return 1.0;
        }
        Map<String, Double> smaller = first.size() <= second.size() ? first : second;
        Map<String, Double> larger = smaller == first ? second : first;
        double dot = 0.0;
        for (Map.Entry<String, Double> entry : smaller.entrySet()) {
            Double other = larger.get(entry.getKey());
            if (other != null) {
                dot += entry.getValue() * other;
            }
        }
        return Math.max(0.0, Math.min(1.0, dot));
    }
}
