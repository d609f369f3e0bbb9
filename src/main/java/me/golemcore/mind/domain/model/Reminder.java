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
 * A reminder stored as one line of {@code REMINDERS.md}. The id is the
 * 1-based position of that line among reminder lines.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Reminder {

    public enum Status {
        PENDING, DUE, DONE
    }

    private int id;
    private String message;
    private ReminderTrigger trigger;

    @Builder.Default
    private Status status = Status.PENDING;

    public boolean isContextTriggered() {
        return trigger != null && trigger.kind() == ReminderTrigger.Kind.CONTEXT;
    }

    public boolean isNextSession() {
        return trigger != null && trigger.nextSession();
    }
}
