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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raised when a newly rejected approach resembles one rejected before.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LoopWarning {

    public static final double THRESHOLD = 0.60;

    public enum Severity {
        CRITICAL, HIGH, MODERATE;

        /**
         * Severity band for a similarity score, or {@code null} below the
         * loop threshold.
         */
        public static Severity of(double similarity) {
            if (similarity > 0.95) {
                return CRITICAL;
            }
            if (similarity > 0.80) {
                return HIGH;
            }
            if (similarity >= THRESHOLD) {
                return MODERATE;
            }
            return null;
        }
    }

    private Severity severity;
    private double similarity;
    private String similarTo;
    private String message;
}
