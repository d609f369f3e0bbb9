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

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health and status summary of one project's memory directory.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HealthReport {

    @Builder.Default
    private List<HealthIssue> issues = new ArrayList<>();

    @Builder.Default
    private List<String> repaired = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    @Builder.Default
    private Map<String, Long> fileSizes = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Integer> entryCounts = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Integer> bufferCounts = new LinkedHashMap<>();

    private int pendingReminders;
    private int dueReminders;
    private Instant lastActivity;

    public boolean isHealthy() {
        return issues.isEmpty();
    }
}
