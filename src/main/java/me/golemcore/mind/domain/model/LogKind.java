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

import java.util.Locale;

/**
 * Kinds accepted by the log operation. Permanent kinds append to
 * {@code MEMORY.md}; session kinds append to a {@code SESSION.md} section.
 */
public enum LogKind {

    DECISION(MemoryKind.DECISION, null),
    ISSUE(MemoryKind.ISSUE, null),
    LEARNING(MemoryKind.LEARNING, null),
    PROBLEM(MemoryKind.PROBLEM, null),
    PROGRESS(MemoryKind.PROGRESS, null),
    GOTCHA(MemoryKind.GOTCHA, null),
    EXPERIENCE(null, SessionCategory.EXPERIENCE),
    BLOCKER(null, SessionCategory.BLOCKER),
    REJECTED(null, SessionCategory.REJECTED),
    ASSUMPTION(null, SessionCategory.ASSUMPTION);

    private final MemoryKind memoryKind;
    private final SessionCategory sessionCategory;

    LogKind(MemoryKind memoryKind, SessionCategory sessionCategory) {
        this.memoryKind = memoryKind;
        this.sessionCategory = sessionCategory;
    }

    public MemoryKind getMemoryKind() {
        return memoryKind;
    }

    public SessionCategory getSessionCategory() {
        return sessionCategory;
    }

    public boolean isPermanent() {
        return memoryKind != null;
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a user-supplied kind. Accepts singular or plural names in any
     * case.
     *
     * @throws IllegalArgumentException
     *             for unknown kinds
     */
    public static LogKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Log kind is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (LogKind kind : values()) {
            if (kind.name().equals(normalized) || (kind.name() + "S").equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown log kind: " + value);
    }
}
