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

package me.golemcore.mind.domain.service;

import me.golemcore.mind.domain.model.SessionBuffer;
import me.golemcore.mind.domain.model.SessionCategory;
import me.golemcore.mind.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the ephemeral session buffer, {@code SESSION.md}, which
 * has exactly four sections: Experience, Blockers, Rejected, Assumptions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionBufferService {

    public static final String SESSION_FILE = "SESSION.md";

    private static final Pattern SECTION_HEADING = Pattern.compile("^##\\s+(.+?)\\s*$");
    private static final Pattern BULLET = Pattern.compile("^(?:[-*+]|\\d+[.)])\\s+");

    private final StoragePort storagePort;

    public SessionBuffer read(String project) {
        return parse(storagePort.getText(project, SESSION_FILE));
    }

    public boolean exists(String project) {
        return storagePort.exists(project, SESSION_FILE);
    }

    public long size(String project) {
        return storagePort.size(project, SESSION_FILE);
    }

    public String readRaw(String project) {
        return storagePort.getText(project, SESSION_FILE);
    }

    /**
     * Parses buffer content. Lines outside the four sections, comments and
     * blank lines are ignored.
     */
    public SessionBuffer parse(String content) {
        SessionBuffer buffer = new SessionBuffer();
        if (content == null || content.isBlank()) {
            return buffer;
        }
        SessionCategory current = null;
        for (String line : content.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("#")) {
                Matcher heading = SECTION_HEADING.matcher(trimmed);
                current = heading.matches() ? SessionCategory.fromHeading(heading.group(1)) : null;
                continue;
            }
            if (current == null || trimmed.isEmpty() || trimmed.startsWith("<!--")) {
                continue;
            }
            String text = BULLET.matcher(trimmed).replaceFirst("").trim();
            if (!text.isEmpty()) {
                buffer.add(current, text);
            }
        }
        return buffer;
    }

    /**
     * Appends a line to a section, creating the file or the section when
     * missing.
     */
    public void append(String project, SessionCategory category, String text) {
        String content = storagePort.getText(project, SESSION_FILE);
        if (content == null || content.isBlank()) {
            content = template();
        }
        String updated = insertIntoSection(content, category, MemoryTextSupport.normalizeText(text));
        storagePort.putTextAtomic(project, SESSION_FILE, updated);
        log.debug("[SessionBuffer] Appended to {}: {}", category.getHeading(),
                MemoryTextSupport.truncate(text, 80));
    }

    /**
     * Resets the buffer to its empty template.
     */
    public void clear(String project) {
        storagePort.putTextAtomic(project, SESSION_FILE, template());
        log.debug("[SessionBuffer] Cleared {}", SESSION_FILE);
    }

    /**
     * Returns the names of sections the content is missing.
     */
    public List<SessionCategory> missingSections(String content) {
        List<SessionCategory> missing = new ArrayList<>();
        for (SessionCategory category : SessionCategory.values()) {
            if (findSection(lines(content), category) < 0) {
                missing.add(category);
            }
        }
        return missing;
    }

    /**
     * Adds missing section headings at the end of the content.
     */
    public String addMissingSections(String content) {
        StringBuilder sb = new StringBuilder(content != null ? content.stripTrailing() : "");
        for (SessionCategory category : missingSections(content)) {
            sb.append("\n\n## ").append(category.getHeading());
        }
        sb.append('\n');
        return sb.toString();
    }

    public String template() {
        StringBuilder sb = new StringBuilder();
        sb.append("# SESSION.md\n");
        sb.append("<!-- Working memory for the current session. Cleared when a new session starts. -->\n");
        for (SessionCategory category : SessionCategory.values()) {
            sb.append("\n## ").append(category.getHeading()).append('\n');
        }
        return sb.toString();
    }

    private String insertIntoSection(String content, SessionCategory category, String text) {
        List<String> lines = lines(content);
        int headingIndex = findSection(lines, category);
        if (headingIndex < 0) {
            return insertIntoSection(addMissingSections(content), category, text);
        }
        int end = lines.size();
        for (int i = headingIndex + 1; i < lines.size(); i++) {
            if (lines.get(i).trim().startsWith("#")) {
                end = i;
                break;
            }
        }
        int insertAt = end;
        while (insertAt > headingIndex + 1 && lines.get(insertAt - 1).trim().isEmpty()) {
            insertAt--;
        }
        lines.add(insertAt, "- " + text);
        if (insertAt + 1 < lines.size() && !lines.get(insertAt + 1).trim().isEmpty()) {
            lines.add(insertAt + 1, "");
        }
        String joined = String.join("\n", lines);
        return joined.endsWith("\n") ? joined : joined + "\n";
    }

    private int findSection(List<String> lines, SessionCategory category) {
        for (int i = 0; i < lines.size(); i++) {
            Matcher heading = SECTION_HEADING.matcher(lines.get(i).trim());
            if (heading.matches() && SessionCategory.fromHeading(heading.group(1)) == category) {
                return i;
            }
        }
        return -1;
    }

    private List<String> lines(String content) {
        if (content == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(content.split("\\r?\\n", -1)));
    }
}
