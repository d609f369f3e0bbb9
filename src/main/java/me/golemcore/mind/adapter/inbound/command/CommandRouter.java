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

package me.golemcore.mind.adapter.inbound.command;

import me.golemcore.mind.domain.exception.MalformedTriggerException;
import me.golemcore.mind.domain.exception.StorageException;
import me.golemcore.mind.domain.model.BlockerResult;
import me.golemcore.mind.domain.model.HealthIssue;
import me.golemcore.mind.domain.model.HealthReport;
import me.golemcore.mind.domain.model.LogKind;
import me.golemcore.mind.domain.model.LogResult;
import me.golemcore.mind.domain.model.PromotionResult;
import me.golemcore.mind.domain.model.RecallResult;
import me.golemcore.mind.domain.model.Reminder;
import me.golemcore.mind.domain.model.ReminderList;
import me.golemcore.mind.domain.model.SearchHit;
import me.golemcore.mind.domain.service.MindService;
import me.golemcore.mind.port.inbound.CommandPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Routes memory commands to {@link MindService}.
 *
 * <ul>
 * <li>recall [--force] [turn text] - Start or resume a session
 * <li>log [--kind=&lt;kind&gt;] &lt;text&gt; - Store a note
 * <li>search [--memory-only] &lt;query&gt; - Search memory and the session
 * buffer
 * <li>blocker &lt;text&gt; - Log a blocker and show related memories
 * <li>remind &lt;when&gt; | &lt;message&gt; - Create a reminder
 * <li>reminders - List due and pending reminders
 * <li>done &lt;id&gt; - Acknowledge a reminder
 * <li>checkpoint - Force a session boundary
 * <li>status - Show memory health
 * <li>help - Show available commands
 * </ul>
 *
 * <p>
 * Every failure is reported as {@link CommandResult#failure(String)}.
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    public static final String CONTEXT_PROJECT = "project";

    private static final String CMD_RECALL = "recall";
    private static final String CMD_LOG = "log";
    private static final String CMD_SEARCH = "search";
    private static final String CMD_BLOCKER = "blocker";
    private static final String CMD_REMIND = "remind";
    private static final String CMD_REMINDERS = "reminders";
    private static final String CMD_DONE = "done";
    private static final String CMD_CHECKPOINT = "checkpoint";
    private static final String CMD_STATUS = "status";
    private static final String CMD_HELP = "help";

    private static final String FLAG_FORCE = "--force";
    private static final String FLAG_KIND = "--kind=";
    private static final String FLAG_MEMORY_ONLY = "--memory-only";
    private static final String DOUBLE_NEWLINE = "\n\n";

    private static final List<String> KNOWN_COMMANDS = List.of(
            CMD_RECALL, CMD_LOG, CMD_SEARCH, CMD_BLOCKER, CMD_REMIND, CMD_REMINDERS, CMD_DONE,
            CMD_CHECKPOINT, CMD_STATUS, CMD_HELP);

    private static final Set<String> KNOWN_COMMAND_SET = Set.copyOf(KNOWN_COMMANDS);

    private final MindService mindService;

    public CommandRouter(MindService mindService) {
        this.mindService = mindService;
        log.info("CommandRouter initialized with commands: {}", KNOWN_COMMANDS);
    }

    @Override
    public CommandResult execute(String command, List<String> args, Map<String, Object> context) {
        String project = resolveProject(context);
        log.debug("Executing command: {} (project={})", command, project);
        if (!hasCommand(command)) {
            return CommandResult.failure("Unknown command: " + command + ". Try 'help'.");
        }
        try {
            return switch (command) {
            case CMD_RECALL -> handleRecall(project, args);
            case CMD_LOG -> handleLog(project, args);
            case CMD_SEARCH -> handleSearch(project, args);
            case CMD_BLOCKER -> handleBlocker(project, args);
            case CMD_REMIND -> handleRemind(project, args);
            case CMD_REMINDERS -> handleReminders(project);
            case CMD_DONE -> handleDone(project, args);
            case CMD_CHECKPOINT -> handleCheckpoint(project);
            case CMD_STATUS -> handleStatus(project);
            case CMD_HELP -> handleHelp();
            default -> CommandResult.failure("Unknown command: " + command);
            };
        } catch (MalformedTriggerException e) {
            return CommandResult.failure("Could not understand when to remind: '" + e.getExpression()
                    + "'. Try 'tomorrow', 'in 3 days', 'next session', 'December 25' or 'when I mention X'.");
        } catch (StorageException e) {
            log.warn("[Command] {} failed: {}", command, e.getMessage());
            return CommandResult.failure("Storage error: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            return CommandResult.failure(e.getMessage());
        }
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMAND_SET.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(
                new CommandDefinition(CMD_RECALL, "Start or resume a session and show context",
                        "recall [--force] [turn text]"),
                new CommandDefinition(CMD_LOG, "Store a decision, learning, issue or session note",
                        "log [--kind=<kind>] <text>"),
                new CommandDefinition(CMD_SEARCH, "Search memory and the session buffer",
                        "search [--memory-only] <query>"),
                new CommandDefinition(CMD_BLOCKER, "Log a blocker and show related memories", "blocker <text>"),
                new CommandDefinition(CMD_REMIND, "Create a reminder", "remind <when> | <message>"),
                new CommandDefinition(CMD_REMINDERS, "List due and pending reminders", "reminders"),
                new CommandDefinition(CMD_DONE, "Acknowledge a reminder", "done <id>"),
                new CommandDefinition(CMD_CHECKPOINT, "Promote the session buffer now", "checkpoint"),
                new CommandDefinition(CMD_STATUS, "Show memory health", "status"),
                new CommandDefinition(CMD_HELP, "Show available commands", "help"));
    }

    private CommandResult handleRecall(String project, List<String> args) {
        boolean force = args.contains(FLAG_FORCE);
        String turnText = joinWithout(args, FLAG_FORCE);
        RecallResult result = mindService.recall(project, force, turnText.isEmpty() ? null : turnText);
        return CommandResult.success(formatRecall(result), result);
    }

    private CommandResult handleCheckpoint(String project) {
        RecallResult result = mindService.checkpoint(project);
        return CommandResult.success(formatRecall(result), result);
    }

    private CommandResult handleLog(String project, List<String> args) {
        LogKind kind = null;
        List<String> rest = new ArrayList<>();
        for (String arg : args) {
            if (arg.startsWith(FLAG_KIND)) {
                kind = LogKind.parse(arg.substring(FLAG_KIND.length()));
            } else {
                rest.add(arg);
            }
        }
        String text = String.join(" ", rest).trim();
        if (text.isEmpty()) {
            return CommandResult.failure("Usage: log [--kind=<kind>] <text>");
        }
        LogResult result = mindService.log(project, text, kind);
        return CommandResult.success(formatLog(result), result);
    }

    private CommandResult handleSearch(String project, List<String> args) {
        boolean memoryOnly = args.contains(FLAG_MEMORY_ONLY);
        String query = joinWithout(args, FLAG_MEMORY_ONLY);
        if (query.isEmpty()) {
            return CommandResult.failure("Usage: search [--memory-only] <query>");
        }
        List<SearchHit> hits = mindService.search(project, query, !memoryOnly);
        if (hits.isEmpty()) {
            return CommandResult.success("No matches for '" + query + "'.", hits);
        }
        StringBuilder sb = new StringBuilder();
        sb.append(hits.size()).append(" match(es) for '").append(query).append("':\n");
        hits.forEach(hit -> appendHit(sb, hit));
        return CommandResult.success(sb.toString().trim(), hits);
    }

    private CommandResult handleBlocker(String project, List<String> args) {
        String text = String.join(" ", args).trim();
        if (text.isEmpty()) {
            return CommandResult.failure("Usage: blocker <text>");
        }
        BlockerResult result = mindService.blocker(project, text);
        StringBuilder sb = new StringBuilder(formatLog(result.getLogged()));
        if (result.getRelatedMemories().isEmpty()) {
            sb.append(DOUBLE_NEWLINE).append("No related memories found.");
        } else {
            sb.append(DOUBLE_NEWLINE).append("Related memories:\n");
            result.getRelatedMemories().forEach(hit -> appendHit(sb, hit));
        }
        return CommandResult.success(sb.toString().trim(), result);
    }

    private CommandResult handleRemind(String project, List<String> args) {
        String joined = String.join(" ", args);
        int separator = joined.indexOf('|');
        if (separator < 0) {
            return CommandResult.failure("Usage: remind <when> | <message>");
        }
        String when = joined.substring(0, separator).trim();
        String message = joined.substring(separator + 1).trim();
        Reminder reminder = mindService.remind(project, message, when);
        return CommandResult.success("Reminder #" + reminder.getId() + " created: " + reminder.getMessage()
                + " (" + describe(reminder) + ")", reminder);
    }

    private CommandResult handleReminders(String project) {
        ReminderList list = mindService.reminders(project);
        if (list.getDue().isEmpty() && list.getPending().isEmpty()) {
            return CommandResult.success("No open reminders.", list);
        }
        StringBuilder sb = new StringBuilder();
        if (!list.getDue().isEmpty()) {
            sb.append("Due:\n");
            list.getDue().forEach(reminder -> appendReminder(sb, reminder));
        }
        if (!list.getPending().isEmpty()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("Pending:\n");
            list.getPending().forEach(reminder -> appendReminder(sb, reminder));
        }
        return CommandResult.success(sb.toString().trim(), list);
    }

    private CommandResult handleDone(String project, List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.failure("Usage: done <id>");
        }
        int id;
        try {
            id = Integer.parseInt(args.get(0).replace("#", "").trim());
        } catch (NumberFormatException e) {
            return CommandResult.failure("Invalid reminder id: " + args.get(0));
        }
        Reminder reminder = mindService.reminderDone(project, id);
        return CommandResult.success("Reminder #" + id + " done: " + reminder.getMessage(), reminder);
    }

    private CommandResult handleStatus(String project) {
        HealthReport report = mindService.status(project);
        StringBuilder sb = new StringBuilder();
        sb.append("**Memory status**").append(DOUBLE_NEWLINE);
        report.getFileSizes().forEach((file, size) -> sb.append(file).append(": ").append(size).append(" bytes\n"));
        sb.append("Entries: ").append(report.getEntryCounts()).append('\n');
        sb.append("Session buffer: ").append(report.getBufferCounts()).append('\n');
        sb.append("Reminders: ").append(report.getDueReminders()).append(" due, ")
                .append(report.getPendingReminders()).append(" pending\n");
        sb.append("Last activity: ").append(report.getLastActivity() != null ? report.getLastActivity() : "never")
                .append('\n');
        for (HealthIssue issue : report.getIssues()) {
            sb.append("Issue: ").append(issue.getMessage()).append('\n');
        }
        for (String warning : report.getWarnings()) {
            sb.append("Warning: ").append(warning).append('\n');
        }
        return CommandResult.success(sb.toString().trim(), report);
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder();
        sb.append("Available commands:").append("\n");
        for (CommandDefinition command : listCommands()) {
            sb.append(command.usage()).append(" - ").append(command.description()).append("\n");
        }
        return CommandResult.success(sb.toString().trim());
    }

    private String formatRecall(RecallResult result) {
        StringBuilder sb = new StringBuilder(result.getContextText().trim());
        PromotionResult promotion = result.getPromotion();
        if (result.getSessionInfo().isBoundaryDetected()) {
            sb.append(DOUBLE_NEWLINE).append("New session (").append(result.getSessionInfo().getReason()
                    .name().toLowerCase(Locale.ROOT)).append("): promoted ").append(promotion.promotedCount())
                    .append(", skipped ").append(promotion.getSkipped().size()).append(" buffer line(s).");
        }
        if (!result.getHealth().getRepaired().isEmpty()) {
            sb.append(DOUBLE_NEWLINE).append("Repaired: ")
                    .append(String.join("; ", result.getHealth().getRepaired()));
        }
        return sb.toString();
    }

    private String formatLog(LogResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Logged ").append(result.getStoredAs().displayName()).append(" to ").append(result.getFile());
        if (result.isFlagged()) {
            sb.append(String.format(Locale.ROOT, " (low confidence %.2f)", result.getConfidence()));
        }
        if (result.getLoopWarning() != null) {
            sb.append(DOUBLE_NEWLINE).append(result.getLoopWarning().getMessage());
        }
        if (!result.getTriggeredReminders().isEmpty()) {
            sb.append(DOUBLE_NEWLINE).append("Reminders:\n");
            result.getTriggeredReminders().forEach(reminder -> appendReminder(sb, reminder));
        }
        return sb.toString().trim();
    }

    private void appendHit(StringBuilder sb, SearchHit hit) {
        sb.append(String.format(Locale.ROOT, "- [%s, %.2f] %s (%s)\n",
                hit.getKind(), hit.getScore(), hit.getText(), hit.getLocation()));
    }

    private void appendReminder(StringBuilder sb, Reminder reminder) {
        sb.append("- #").append(reminder.getId()).append(' ').append(reminder.getMessage())
                .append(" (").append(describe(reminder)).append(")\n");
    }

    private String describe(Reminder reminder) {
        if (reminder.isContextTriggered()) {
            return "when: " + String.join(", ", reminder.getTrigger().keywords());
        }
        if (reminder.isNextSession()) {
            return "next session";
        }
        return "at " + reminder.getTrigger().dueAt();
    }

    private String joinWithout(List<String> args, String flag) {
        List<String> rest = new ArrayList<>(args);
        rest.removeIf(flag::equals);
        return String.join(" ", rest).trim();
    }

    private String resolveProject(Map<String, Object> context) {
        Object value = context != null ? context.get(CONTEXT_PROJECT) : null;
        if (value instanceof String && !((String) value).isBlank()) {
            return (String) value;
        }
        return "";
    }
}
