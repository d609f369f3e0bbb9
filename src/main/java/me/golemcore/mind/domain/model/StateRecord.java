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

import java.time.Instant;

/**
 * Machine-local lifecycle state of one project, persisted as
 * {@code state.json}. Passed explicitly into and out of every lifecycle call.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class StateRecord {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    private Instant lastActivity;
    private String contentFingerprint;

    @Builder.Default
    private int schemaVersion = CURRENT_SCHEMA_VERSION;

    public static StateRecord empty() {
        return StateRecord.builder().build();
    }

    @JsonIgnore
    public boolean isFirstRun() {
        return lastActivity == null && contentFingerprint == null;
    }
}
