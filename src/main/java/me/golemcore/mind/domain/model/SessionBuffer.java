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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory view of {@code SESSION.md}: one list of plain-text lines per
 * category.
 */
public class SessionBuffer {

    private final Map<SessionCategory, List<String>> sections = new EnumMap<>(SessionCategory.class);

    public SessionBuffer() {
        for (SessionCategory category : SessionCategory.values()) {
            sections.put(category, new ArrayList<>());
        }
    }

    public void add(SessionCategory category, String text) {
        sections.get(category).add(text);
    }

    public List<String> get(SessionCategory category) {
        return Collections.unmodifiableList(sections.get(category));
    }

    public int size() {
        return sections.values().stream().mapToInt(List::size).sum();
    }

    public int size(SessionCategory category) {
        return sections.get(category).size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
