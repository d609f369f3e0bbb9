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
 * Sections of the ephemeral session buffer. Each maps to a fixed heading in
 * {@code SESSION.md}.
 */
public enum SessionCategory {

    EXPERIENCE("Experience"),
    BLOCKER("Blockers"),
    REJECTED("Rejected"),
    ASSUMPTION("Assumptions");

    private final String heading;

    SessionCategory(String heading) {
        this.heading = heading;
    }

    public String getHeading() {
        return heading;
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SessionCategory fromHeading(String heading) {
        for (SessionCategory category : values()) {
            if (category.heading.equalsIgnoreCase(heading.trim())) {
                return category;
            }
        }
        return null;
    }
}
