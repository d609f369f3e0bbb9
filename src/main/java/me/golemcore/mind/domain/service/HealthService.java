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

import me.golemcore.mind.domain.model.HealthIssue;
import me.golemcore.mind.domain.model.HealthReport;
import me.golemcore.mind.domain.model.MemoryEntry;
import me.golemcore.mind.domain.model.MemoryKind;
import me.golemcore.mind.domain.model.ParseResult;
import me.golemcore.mind.domain.model.ReminderList;
import me.golemcore.mind.domain.model.SessionBuffer;
import me.golemcore.mind.domain.model.SessionCategory;
import me.golemcore.mind.domain.model.StateRecord;
import me.golemcore.mind.infrastructure.config.MindProperties;
import me.golemcore.mind.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Checks and repairs the layout of a project's memory directory and builds
 * the status summary.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthService {

    private final StoragePort storagePort;
    private final MemoryStoreService memoryStoreService;
    private final SessionBufferService sessionBufferService;
    private final StateRecordService stateRecordService;
    private final ReminderScheduler reminderScheduler;
    private final MemoryExtractor extractor;
    private final MindProperties properties;

    public HealthReport check(String project) {
        HealthReport report = new HealthReport();
        if (!storagePort.directoryExists(project)) {
            report.getIssues().add(issue(HealthIssue.Type.MISSING_DIRECTORY, "Memory directory does not exist"));
            // everything below lives in the directory
            report.getIssues().add(issue(HealthIssue.Type.MISSING_MEMORY, MemoryStoreService.MEMORY_FILE
                    + " is missing"));
            report.getIssues().add(issue(HealthIssue.Type.MISSING_SESSION, SessionBufferService.SESSION_FILE
                    + " is missing"));
            report.getIssues().add(issue(HealthIssue.Type.MISSING_REMINDERS, ReminderScheduler.REMINDERS_FILE
                    + " is missing"));
            report.getIssues().add(issue(HealthIssue.Type.MISSING_GITIGNORE, StateRecordService.GITIGNORE_FILE
                    + " is missing"));
            return report;
        }

        if (!memoryStoreService.exists(project)) {
            report.getIssues().add(issue(HealthIssue.Type.MISSING_MEMORY, MemoryStoreService.MEMORY_FILE
                    + " is missing"));
        } else if (!hasProjectState(memoryStoreService.read(project))) {
            report.getIssues().add(issue(HealthIssue.Type.MISSING_PROJECT_STATE, MemoryStoreService.MEMORY_FILE
                    + " has no " + MemoryStoreService.PROJECT_STATE_HEADING + " section"));
        }

        if (!sessionBufferService.exists(project)) {
            report.getIssues().add(issue(HealthIssue.Type.MISSING_SESSION, SessionBufferService.SESSION_FILE
                    + " is missing"));
        } else {
            for (SessionCategory category : sessionBufferService.missingSections(
                    sessionBufferService.readRaw(project))) {
                report.getIssues().add(issue(HealthIssue.Type.MISSING_SESSION_SECTION,
                        SessionBufferService.SESSION_FILE + " has no ## " + category.getHeading() + " section"));
            }
        }

        if (!reminderScheduler.exists(project)) {
            report.getIssues().add(issue(HealthIssue.Type.MISSING_REMINDERS, ReminderScheduler.REMINDERS_FILE
                    + " is missing"));
        }
        if (!stateRecordService.hasGitignore(project)) {
            report.getIssues().add(issue(HealthIssue.Type.MISSING_GITIGNORE, StateRecordService.GITIGNORE_FILE
                    + " is missing"));
        }
        return report;
    }

    /**
     * Fixes every issue {@link #check} reports. Existing content is never
     * discarded: missing sections are added, missing files are created from
     * templates.
     */
    public HealthReport repair(String project) {
        HealthReport report = check(project);
        if (report.isHealthy()) {
            return report;
        }

        storagePort.ensureDirectory(project);
        for (HealthIssue issue : report.getIssues()) {
            switch (issue.getType()) {
            case MISSING_DIRECTORY -> {
                // created above
            }
            case MISSING_MEMORY -> memoryStoreService.write(project, memoryStoreService.template(projectName(project)));
            case MISSING_PROJECT_STATE -> memoryStoreService.write(project,
                    insertProjectState(memoryStoreService.read(project)));
            case MISSING_SESSION -> sessionBufferService.clear(project);
            case MISSING_SESSION_SECTION -> {
                String raw = sessionBufferService.readRaw(project);
                if (!sessionBufferService.missingSections(raw).isEmpty()) {
                    storagePort.putTextAtomic(project, SessionBufferService.SESSION_FILE,
                            sessionBufferService.addMissingSections(raw));
                }
            }
            case MISSING_REMINDERS -> storagePort.putTextAtomic(project, ReminderScheduler.REMINDERS_FILE,
                    reminderScheduler.template());
            case MISSING_GITIGNORE -> stateRecordService.writeGitignore(project);
            }
            report.getRepaired().add(issue.getMessage());
        }
        log.info("[Health] Repaired {} issue(s) in {}", report.getRepaired().size(), storagePort.resolveRoot(project));
        return report;
    }

    /**
     * Sizes, counts and warnings for the project's memory directory.
     */
    public HealthReport status(String project) {
        HealthReport report = check(project);

        report.getFileSizes().put(MemoryStoreService.MEMORY_FILE, memoryStoreService.size(project));
        report.getFileSizes().put(SessionBufferService.SESSION_FILE, sessionBufferService.size(project));
        report.getFileSizes().put(ReminderScheduler.REMINDERS_FILE,
                storagePort.size(project, ReminderScheduler.REMINDERS_FILE));

        String content = memoryStoreService.read(project);
        ParseResult parse = extractor.parse(content, MemoryStoreService.MEMORY_FILE);
        for (MemoryKind kind : MemoryKind.values()) {
            report.getEntryCounts().put(kind.displayName(), 0);
        }
        for (MemoryEntry entry : parse.getEntries()) {
            if (!entry.isSuperseded()) {
                report.getEntryCounts().merge(entry.getKind().displayName(), 1, Integer::sum);
            }
        }

        SessionBuffer buffer = sessionBufferService.read(project);
        for (SessionCategory category : SessionCategory.values()) {
            report.getBufferCounts().put(category.displayName(), buffer.size(category));
        }

        ReminderList reminders = reminderScheduler.list(project, null);
        report.setPendingReminders(reminders.getPending().size());
        report.setDueReminders(reminders.getDue().size());
        if (!reminders.getSkippedLines().isEmpty()) {
            report.getWarnings().add(reminders.getSkippedLines().size() + " reminder line(s) could not be parsed");
        }

        StateRecord state = stateRecordService.loadState(project);
        report.setLastActivity(state.getLastActivity());
        if (state.getContentFingerprint() != null
                && !state.getContentFingerprint().equals(memoryStoreService.fingerprint(content))) {
            report.getWarnings().add(MemoryStoreService.MEMORY_FILE
                    + " changed since the last recall; the next recall starts a new session");
        }

        long memorySize = report.getFileSizes().get(MemoryStoreService.MEMORY_FILE);
        long limit = properties.getHealth().getMemorySizeWarningBytes();
        if (memorySize > limit) {
            report.getWarnings().add(String.format(Locale.ROOT,
                    "%s is %.1f KB (over %.1f KB); consider archiving old entries",
                    MemoryStoreService.MEMORY_FILE, memorySize / 1024.0, limit / 1024.0));
        }
        return report;
    }

    public String projectName(String project) {
        Path root = storagePort.resolveRoot(project).toAbsolutePath().normalize();
        Path projectDir = root.getParent();
        if (projectDir == null || projectDir.getFileName() == null) {
            return "Project";
        }
        return projectDir.getFileName().toString();
    }

    private boolean hasProjectState(String content) {
        for (String line : content.split("\\r?\\n")) {
            if (line.trim().equalsIgnoreCase(MemoryStoreService.PROJECT_STATE_HEADING)) {
                return true;
            }
        }
        return false;
    }

    private String insertProjectState(String content) {
        String section = MemoryStoreService.PROJECT_STATE_HEADING + "\n- Goal:\n- Stack:\n- Blocked: None\n";
        List<String> lines = List.of(content.split("\n", -1));
        if (!lines.isEmpty() && lines.get(0).startsWith("# ")) {
            StringBuilder sb = new StringBuilder(lines.get(0)).append("\n\n").append(section);
            String rest = String.join("\n", lines.subList(1, lines.size())).stripLeading();
            if (!rest.isEmpty()) {
                sb.append('\n').append(rest);
            }
            return sb.toString();
        }
        return section + "\n" + content;
    }

    private HealthIssue issue(HealthIssue.Type type, String message) {
        return HealthIssue.builder()
                .type(type)
                .message(message)
                .fixable(true)
                .build();
    }
}
