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

import me.golemcore.mind.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the permanent store, {@code MEMORY.md}.
 *
 * <p>
 * New entries are appended under a {@code ## YYYY-MM-DD} heading. Existing
 * lines are never rewritten except to add a supersede marker. Every write
 * replaces the whole file atomically.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryStoreService {

    public static final String MEMORY_FILE = "MEMORY.md";
    public static final String PROJECT_STATE_HEADING = "## Project State";

    private static final Pattern DATE_HEADING = Pattern.compile("^#{1,6}\\s*(\\d{4}-\\d{2}-\\d{2})\\b.*$");
    private static final Pattern BULLET_PREFIX = Pattern.compile("^(\\s*(?:[-*+]|\\d+[.)])\\s+)");

    private final StoragePort storagePort;

    /**
     * Current store content, empty when the file does not exist.
     */
    public String read(String project) {
        String content = storagePort.getText(project, MEMORY_FILE);
        return content != null ? content : "";
    }

    public boolean exists(String project) {
        return storagePort.exists(project, MEMORY_FILE);
    }

    public void write(String project, String content) {
        storagePort.putTextAtomic(project, MEMORY_FILE, content);
    }

    public long size(String project) {
        return storagePort.size(project, MEMORY_FILE);
    }

    public String fingerprint(String content) {
        return MemoryTextSupport.fingerprint(content != null ? content : "");
    }

    /**
     * Appends lines to the store, under today's heading.
     */
    public String append(String project, LocalDate today, List<String> lines) {
        String updated = appendUnderDate(read(project), today, lines);
        write(project, updated);
        log.debug("[MemoryStore] Appended {} line(s) to {}", lines.size(), MEMORY_FILE);
        return updated;
    }

    /**
     * Returns {@code content} with the lines appended under a heading for
     * {@code today}. A new heading is added unless the last date heading of
     * the document already is today.
     */
    public String appendUnderDate(String content, LocalDate today, List<String> lines) {
        if (lines.isEmpty()) {
            return content;
        }
        StringBuilder sb = new StringBuilder(content != null ? content : "");
        trimTrailingNewlines(sb);

        LocalDate lastHeading = lastDateHeading(sb.toString());
        if (!today.equals(lastHeading)) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append("## ").append(today).append('\n');
        } else {
            sb.append('\n');
        }
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    /**
     * Returns {@code content} with a supersede marker added to the given
     * 1-based line. Lines that already carry a marker are left alone.
     */
    public String markSuperseded(String content, int lineNumber, String newId) {
        List<String> lines = new ArrayList<>(Arrays.asList(content.split("\n", -1)));
        if (lineNumber < 1 || lineNumber > lines.size()) {
            log.warn("[MemoryStore] Cannot mark line {} superseded: out of range", lineNumber);
            return content;
        }
        String line = lines.get(lineNumber - 1);
        if (ExtractionRules.SUPERSEDED_MARKER.matcher(line).find()) {
            return content;
        }
        String marker = "[superseded by " + newId + "] ";
        Matcher bullet = BULLET_PREFIX.matcher(line);
        String marked = bullet.find()
                ? bullet.group(1) + marker + line.substring(bullet.end())
                : marker + line;
        lines.set(lineNumber - 1, marked);
        return String.join("\n", lines);
    }

    public String template(String projectName) {
        return "# " + projectName + "\n"
                + "\n"
                + PROJECT_STATE_HEADING + "\n"
                + "- Goal:\n"
                + "- Stack:\n"
                + "- Blocked: None\n"
                + "\n"
                + "## Gotchas\n"
                + "<!-- - thing -> workaround -->\n"
                + "\n"
                + "## Log\n"
                + "<!-- Entries are appended below under dated headings. "
                + "Use **Decided:**, **Learned:**, **Issue:**, **Problem:**, **Done:**, **Gotcha:**. "
                + "Prefix with KEY: to keep an entry from decaying. -->\n";
    }

    private LocalDate lastDateHeading(String content) {
        LocalDate last = null;
        for (String line : content.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.startsWith("#")) {
                continue;
            }
            last = null;
            Matcher matcher = DATE_HEADING.matcher(trimmed);
            if (matcher.matches()) {
                try {
                    last = LocalDate.parse(matcher.group(1));
                } catch (DateTimeParseException e) {
                    log.debug("[MemoryStore] Ignoring invalid date heading: {}", line);
                }
            }
        }
        return last;
    }

    private void trimTrailingNewlines(StringBuilder sb) {
        while (sb.length() > 0 && (sb.charAt(sb.length() - 1) == '\n' || sb.charAt(sb.length() - 1) == '\r'
                || sb.charAt(sb.length() - 1) == ' ')) {
            sb.setLength(sb.length() - 1);
        }
    }
}
