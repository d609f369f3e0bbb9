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

package me.golemcore.mind.domain.model;

/**
 * Novelty tiers shared by promotion and logging.
 */
public enum SimilarityTier {

    DUPLICATE(0.95),
    NEAR_DUPLICATE(0.90),
    SIMILAR(0.70),
    NOVEL(0.0);

    private final double lowerBound;

    SimilarityTier(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public static SimilarityTier classify(double similarity) {
        for (SimilarityTier tier : values()) {
            if (similarity >= tier.lowerBound) {
                return tier;
            }
        }
        return NOVEL;
    }
}
