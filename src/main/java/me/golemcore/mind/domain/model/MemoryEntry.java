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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Typed, confidence-scored fact extracted from the permanent store.
 *
 * <p>
 * Entries are never edited in place. The only mutation ever written back to
 * the store is the {@code supersededBy} marker.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryEntry {

    public enum Status {
        OPEN, RESOLVED, BLOCKED
    }

    private String id;
    private MemoryKind kind;
    private String text;
    private double confidence;
    private LocalDate createdAt;
    private String sourceLocation;
    private int line;
    private String supersededBy;
    private boolean key;
    private boolean rejectedApproach;

    @Builder.Default
    private Status status = Status.OPEN;

    private String reasoning;

    @JsonIgnore
    public boolean isSuperseded() {
        return supersededBy != null;
    }

    /**
     * Issues and problems that are still open.
     */
    @JsonIgnore
    public boolean isOpenItem() {
        return (kind == MemoryKind.ISSUE || kind == MemoryKind.PROBLEM) && status != Status.RESOLVED;
    }
}
