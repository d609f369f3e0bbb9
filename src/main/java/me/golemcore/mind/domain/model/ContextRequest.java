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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Inputs of one context rendering.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContextRequest {

    private String projectName;

    @Builder.Default
    private ParseResult parse = new ParseResult();

    @Builder.Default
    private Map<String, Integer> accessCounts = new HashMap<>();

    @Builder.Default
    private List<Reminder> dueReminders = new ArrayList<>();

    @Builder.Default
    private List<Reminder> watchedReminders = new ArrayList<>();

    private String turnText;
}
