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
 * Closed set of permanent memory entry kinds. The label is the bolded marker
 * written in front of promoted or logged entries.
 */
public enum MemoryKind {

    DECISION("Decided"),
    ISSUE("Issue"),
    LEARNING("Learned"),
    PROBLEM("Problem"),
    PROGRESS("Done"),
    GOTCHA("Gotcha");

    private final String label;

    MemoryKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
