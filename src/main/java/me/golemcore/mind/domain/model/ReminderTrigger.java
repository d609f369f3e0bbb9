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

import java.time.Instant;
import java.util.List;

/**
 * Resolved trigger of a reminder. Time triggers carry an absolute instant or
 * the symbolic "next session" value; context triggers carry keywords.
 */
public record ReminderTrigger(
        Kind kind,
        Instant dueAt,
        boolean nextSession,
        List<String> keywords
) {

    public enum Kind {
        TIME, CONTEXT
    }

    public static ReminderTrigger at(Instant dueAt) {
        return new ReminderTrigger(Kind.TIME, dueAt, false, List.of());
    }

    public static ReminderTrigger nextSessionTrigger() {
        return new ReminderTrigger(Kind.TIME, null, true, List.of());
    }

    public static ReminderTrigger context(List<String> keywords) {
        return new ReminderTrigger(Kind.CONTEXT, null, false, List.copyOf(keywords));
    }
}
