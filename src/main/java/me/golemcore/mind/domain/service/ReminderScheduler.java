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

import me.golemcore.mind.domain.model.Reminder;
import me.golemcore.mind.domain.model.ReminderList;
import me.golemcore.mind.domain.model.ReminderTrigger;
import me.golemcore.mind.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Creates, evaluates and acknowledges reminders kept in
 * {@code REMINDERS.md}, one checklist line each:
 *
 * <pre>
 * - [ ] 2026-12-25T00:00:00Z | time | renew the certificate
 * - [ ] next session | time | re-run the migration
 * - [x] auth, login | context | check the token expiry
 * </pre>
 *
 * <p>
 * A time reminder is due once its instant has passed. A "next session"
 * reminder is due at any recall and is marked done as soon as it is
 * surfaced. A context reminder is due while any of its keywords appears as a
 * case-insensitive substring of the current text; it stays pending until
 * acknowledged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReminderScheduler {

    public static final String REMINDERS_FILE = "REMINDERS.md";

    private static final String KIND_TIME = "time";
    private static final String KIND_CONTEXT = "context";

    private static final Pattern REMINDER_LINE = Pattern.compile(
            "^- \\[([ xX])]\\s*(.+?)\\s*\\|\\s*([a-z_]+)\\s*\\|\\s*(.+)$");
    private static final Pattern CHECKBOX = Pattern.compile("^- \\[[ xX]]");

    private final StoragePort storagePort;
    private final ReminderExpressionParser expressionParser;
    private final Clock clock;

    /**
     * Parses the trigger and appends a pending reminder.
     *
     * @throws me.golemcore.mind.domain.exception.MalformedTriggerException
     *             when the trigger cannot be parsed; nothing is written
     */
    public Reminder create(String project, String message, String when) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Reminder message is required");
        }
        ReminderTrigger trigger = storable(expressionParser.parse(when));
        String cleanMessage = storable(MemoryTextSupport.normalizeText(message));

        String content = storagePort.getText(project, REMINDERS_FILE);
        if (content == null || content.isBlank()) {
            content = template();
        }
        int id = reminderLines(content).size() + 1;
        StringBuilder sb = new StringBuilder(content.stripTrailing());
        sb.append('\n').append(render(trigger, cleanMessage, false)).append('\n');
        storagePort.putTextAtomic(project, REMINDERS_FILE, sb.toString());

        log.info("[Reminders] Created reminder {} ({}): {}", id, describe(trigger), cleanMessage);
        return Reminder.builder()
                .id(id)
                .message(cleanMessage)
                .trigger(trigger)
                .status(Reminder.Status.PENDING)
                .build();
    }

    /**
     * All reminders in store order, including done ones.
     */
    public List<Reminder> load(String project) {
        return parse(storagePort.getText(project, REMINDERS_FILE), new ArrayList<>());
    }

    /**
     * Open reminders split into due and pending. Context reminders are
     * evaluated against {@code text}, which may be {@code null}.
     */
    public ReminderList list(String project, String text) {
        ReminderList result = new ReminderList();
        List<Reminder> reminders = parse(storagePort.getText(project, REMINDERS_FILE), result.getSkippedLines());
        Instant now = clock.instant();
        for (Reminder reminder : reminders) {
            if (reminder.getStatus() == Reminder.Status.DONE) {
                continue;
            }
            if (isDue(reminder, now, text, false)) {
                reminder.setStatus(Reminder.Status.DUE);
                result.getDue().add(reminder);
            } else {
                result.getPending().add(reminder);
            }
        }
        return result;
    }

    /**
     * Reminders to surface on recall. "Next session" reminders are due only
     * when {@code newSession} is set, and are then marked done in the store.
     */
    public List<Reminder> surfaceForRecall(String project, String turnText, boolean newSession) {
        String content = storagePort.getText(project, REMINDERS_FILE);
        List<Reminder> reminders = parse(content, new ArrayList<>());
        Instant now = clock.instant();

        List<Reminder> due = new ArrayList<>();
        List<Integer> consumed = new ArrayList<>();
        for (Reminder reminder : reminders) {
            if (reminder.getStatus() == Reminder.Status.DONE || !isDue(reminder, now, turnText, newSession)) {
                continue;
            }
            reminder.setStatus(Reminder.Status.DUE);
            due.add(reminder);
            if (reminder.isNextSession()) {
                consumed.add(reminder.getId());
            }
        }

        if (!consumed.isEmpty()) {
            String updated = content;
            for (Integer id : consumed) {
                updated = markDoneInContent(updated, id);
            }
            storagePort.putTextAtomic(project, REMINDERS_FILE, updated);
            log.debug("[Reminders] Auto-acknowledged {} next-session reminder(s)", consumed.size());
        }
        return due;
    }

    /**
     * Open context reminders whose keywords appear in the text.
     */
    public List<Reminder> triggeredBy(String project, String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Reminder> triggered = new ArrayList<>();
        for (Reminder reminder : load(project)) {
            if (reminder.getStatus() != Reminder.Status.DONE && reminder.isContextTriggered()
                    && matchesKeywords(reminder, text)) {
                reminder.setStatus(Reminder.Status.DUE);
                triggered.add(reminder);
            }
        }
        return triggered;
    }

    /**
     * Open context reminders, whatever the current text.
     */
    public List<Reminder> watched(String project) {
        return load(project).stream()
                .filter(reminder -> reminder.getStatus() != Reminder.Status.DONE)
                .filter(Reminder::isContextTriggered)
                .toList();
    }

    /**
     * Marks a reminder done. Acknowledging a done reminder again is a no-op.
     *
     * @throws IllegalArgumentException
     *             when no reminder has the id
     */
    public Reminder markDone(String project, int id) {
        String content = storagePort.getText(project, REMINDERS_FILE);
        List<Reminder> reminders = parse(content, new ArrayList<>());
        Reminder target = reminders.stream()
                .filter(reminder -> reminder.getId() == id)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Reminder not found: " + id));
        if (target.getStatus() != Reminder.Status.DONE) {
            storagePort.putTextAtomic(project, REMINDERS_FILE, markDoneInContent(content, id));
            target.setStatus(Reminder.Status.DONE);
            log.info("[Reminders] Reminder {} done: {}", id, target.getMessage());
        }
        return target;
    }

    public boolean isDue(Reminder reminder, Instant now, String turnText, boolean newSession) {
        ReminderTrigger trigger = reminder.getTrigger();
        if (trigger == null || reminder.getStatus() == Reminder.Status.DONE) {
            return false;
        }
        if (trigger.kind() == ReminderTrigger.Kind.CONTEXT) {
            return turnText != null && matchesKeywords(reminder, turnText);
        }
        if (trigger.nextSession()) {
            return newSession;
        }
        return trigger.dueAt() != null && !now.isBefore(trigger.dueAt());
    }

    public boolean exists(String project) {
        return storagePort.exists(project, REMINDERS_FILE);
    }

    public String template() {
        return "# Reminders\n"
                + "<!-- - [ ] <due> | <kind> | <message>    ([x] marks done) -->\n";
    }

    private boolean matchesKeywords(Reminder reminder, String text) {
        String haystack = text.toLowerCase(Locale.ROOT);
        for (String keyword : reminder.getTrigger().keywords()) {
            if (!keyword.isBlank() && haystack.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private List<Reminder> parse(String content, List<String> skipped) {
        List<Reminder> reminders = new ArrayList<>();
        List<String> lines = reminderLines(content);
        for (int i = 0; i < lines.size(); i++) {
            int id = i + 1;
            String line = lines.get(i);
            Reminder reminder = parseLine(id, line);
            if (reminder == null) {
                log.warn("[Reminders] Skipping unparseable reminder line {}: {}", id, line);
                skipped.add(line);
                continue;
            }
            reminders.add(reminder);
        }
        return reminders;
    }

    private Reminder parseLine(int id, String line) {
        Matcher matcher = REMINDER_LINE.matcher(line);
        if (!matcher.matches()) {
            return null;
        }
        boolean done = !" ".equals(matcher.group(1));
        String due = matcher.group(2).trim();
        String kind = matcher.group(3);
        String message = matcher.group(4).trim();

        ReminderTrigger trigger;
        if (KIND_CONTEXT.equals(kind)) {
            List<String> keywords = Arrays.stream(due.split(","))
                    .map(String::trim)
                    .filter(keyword -> !keyword.isEmpty())
                    .toList();
            if (keywords.isEmpty()) {
                return null;
            }
            trigger = ReminderTrigger.context(keywords);
        } else if (KIND_TIME.equals(kind) || "next_session".equals(kind)) {
            if (ReminderExpressionParser.NEXT_SESSION.equalsIgnoreCase(due)) {
                trigger = ReminderTrigger.nextSessionTrigger();
            } else {
                try {
                    trigger = ReminderTrigger.at(Instant.parse(due));
                } catch (DateTimeParseException e) {
                    return null;
                }
            }
        } else {
            return null;
        }

        return Reminder.builder()
                .id(id)
                .message(message)
                .trigger(trigger)
                .status(done ? Reminder.Status.DONE : Reminder.Status.PENDING)
                .build();
    }

    private String render(ReminderTrigger trigger, String message, boolean done) {
        String box = done ? "- [x] " : "- [ ] ";
        if (trigger.kind() == ReminderTrigger.Kind.CONTEXT) {
            return box + String.join(", ", trigger.keywords()) + " | " + KIND_CONTEXT + " | " + message;
        }
        String due = trigger.nextSession() ? ReminderExpressionParser.NEXT_SESSION : trigger.dueAt().toString();
        return box + due + " | " + KIND_TIME + " | " + message;
    }

    // '|' separates the fields of a stored line
    private String storable(String value) {
        return value.replace('|', '/');
    }

    private ReminderTrigger storable(ReminderTrigger trigger) {
        if (trigger.kind() != ReminderTrigger.Kind.CONTEXT) {
            return trigger;
        }
        return ReminderTrigger.context(trigger.keywords().stream()
                .map(this::storable)
                .distinct()
                .toList());
    }

    private String describe(ReminderTrigger trigger) {
        if (trigger.kind() == ReminderTrigger.Kind.CONTEXT) {
            return "when " + String.join(", ", trigger.keywords());
        }
        return trigger.nextSession() ? ReminderExpressionParser.NEXT_SESSION : "at " + trigger.dueAt();
    }

    private String markDoneInContent(String content, int id) {
        String[] lines = content.split("\n", -1);
        int ordinal = 0;
        for (int i = 0; i < lines.length; i++) {
            if (CHECKBOX.matcher(lines[i].trim()).find()) {
                ordinal++;
                if (ordinal == id) {
                    lines[i] = lines[i].replaceFirst("- \\[ ]", "- [x]");
                    break;
                }
            }
        }
        return String.join("\n", lines);
    }

    private List<String> reminderLines(String content) {
        List<String> lines = new ArrayList<>();
        if (content == null) {
            return lines;
        }
        for (String line : content.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (CHECKBOX.matcher(trimmed).find()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }
}
