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

import me.golemcore.mind.domain.exception.MalformedTriggerException;
import me.golemcore.mind.domain.model.ReminderTrigger;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves natural-language reminder triggers at creation time.
 *
 * <p>
 * Time forms: {@code today}, {@code tomorrow}, {@code next week},
 * {@code in N minutes|hours|days|weeks|months}, weekday names,
 * {@code next session}, ISO dates and date-times, and verbal dates such as
 * {@code December 25}. Date-level forms resolve to the start of that day in
 * the clock's zone.
 *
 * <p>
 * Context forms: {@code when I mention X, Y}, {@code when we work on X},
 * {@code when X comes up}, {@code keywords: X, Y}.
 */
@Component
@RequiredArgsConstructor
public class ReminderExpressionParser {

    public static final String NEXT_SESSION = "next session";

    private static final Pattern RELATIVE = Pattern.compile(
            "^in\\s+(\\d+|a|an|one|two|three|four|five|six|seven|eight|nine|ten)\\s+"
                    + "(minute|hour|day|week|month)s?$");
    private static final Pattern WEEKDAY = Pattern.compile(
            "^(?:(next|this|on)\\s+)?(monday|tuesday|wednesday|thursday|friday|saturday|sunday)$");
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[t ]\\d{2}:\\d{2}(?::\\d{2})?$");
    private static final Pattern ISO_INSTANT = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}t\\d{2}:\\d{2}(?::\\d{2})?(?:\\.\\d+)?z$");
    private static final Pattern MONTH_DAY = Pattern.compile(
            "^(?:on\\s+)?([a-z]+)\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?(?:,?\\s+(\\d{4}))?$");
    private static final Pattern DAY_MONTH = Pattern.compile(
            "^(?:on\\s+)?(\\d{1,2})(?:st|nd|rd|th)?\\s+(?:of\\s+)?([a-z]+)\\.?(?:,?\\s+(\\d{4}))?$");

    private static final List<Pattern> CONTEXT_FORMS = List.of(
            Pattern.compile("^when\\s+(?:i|we|you)\\s+(?:mention|say|talk about|discuss|touch)\\s+(.+)$"),
            Pattern.compile("^when\\s+(?:i|we|you)\\s+(?:work|are working|start working|get)\\s+(?:on|to)\\s+(.+)$"),
            Pattern.compile("^when\\s+(.+?)\\s+(?:comes up|come up|is mentioned|are mentioned)$"),
            Pattern.compile("^(?:keyword|keywords|context)\\s*:\\s*(.+)$"));

    private static final Pattern KEYWORD_SEPARATOR = Pattern.compile("\\s*(?:,|;|/|\\bor\\b|\\band\\b)\\s*");

    private static final Map<String, Integer> NUMBER_WORDS = Map.ofEntries(
            Map.entry("a", 1), Map.entry("an", 1), Map.entry("one", 1), Map.entry("two", 2),
            Map.entry("three", 3), Map.entry("four", 4), Map.entry("five", 5), Map.entry("six", 6),
            Map.entry("seven", 7), Map.entry("eight", 8), Map.entry("nine", 9), Map.entry("ten", 10));

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("january", 1), Map.entry("jan", 1), Map.entry("february", 2), Map.entry("feb", 2),
            Map.entry("march", 3), Map.entry("mar", 3), Map.entry("april", 4), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("june", 6), Map.entry("jun", 6), Map.entry("july", 7),
            Map.entry("jul", 7), Map.entry("august", 8), Map.entry("aug", 8), Map.entry("september", 9),
            Map.entry("sep", 9), Map.entry("sept", 9), Map.entry("october", 10), Map.entry("oct", 10),
            Map.entry("november", 11), Map.entry("nov", 11), Map.entry("december", 12), Map.entry("dec", 12));

    private final Clock clock;

    /**
     * @throws MalformedTriggerException
     *             when the expression matches no known form
     */
    public ReminderTrigger parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new MalformedTriggerException(String.valueOf(expression));
        }
        String normalized = expression.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");

        ReminderTrigger context = parseContext(normalized);
        if (context != null) {
            return context;
        }
        if (NEXT_SESSION.equals(normalized) || "next time".equals(normalized)) {
            return ReminderTrigger.nextSessionTrigger();
        }

        try {
            Instant instant = parseInstant(normalized);
            if (instant != null) {
                return ReminderTrigger.at(instant);
            }
        } catch (DateTimeException | NumberFormatException | ArithmeticException e) {
            throw new MalformedTriggerException(expression);
        }
        throw new MalformedTriggerException(expression);
    }

    private ReminderTrigger parseContext(String normalized) {
        for (Pattern form : CONTEXT_FORMS) {
            Matcher matcher = form.matcher(normalized);
            if (matcher.matches()) {
                List<String> keywords = splitKeywords(matcher.group(1));
                if (keywords.isEmpty()) {
                    return null;
                }
                return ReminderTrigger.context(keywords);
            }
        }
        return null;
    }

    private List<String> splitKeywords(String raw) {
        List<String> keywords = new ArrayList<>();
        for (String part : KEYWORD_SEPARATOR.split(raw)) {
            String keyword = part.replaceAll("^[\"'`]+|[\"'`.!]+$", "").trim();
            if (!keyword.isEmpty() && !keywords.contains(keyword)) {
                keywords.add(keyword);
            }
        }
        return keywords;
    }

    private Instant parseInstant(String normalized) {
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);

        switch (normalized) {
        case "now", "today" -> {
            return clock.instant();
        }
        case "tomorrow" -> {
            return startOfDay(today.plusDays(1), zone);
        }
        case "next week" -> {
            return startOfDay(today.plusWeeks(1), zone);
        }
        case "next month" -> {
            return startOfDay(today.plusMonths(1), zone);
        }
        default -> {
            // fall through to patterns
        }
        }

        Matcher relative = RELATIVE.matcher(normalized);
        if (relative.matches()) {
            int amount = parseAmount(relative.group(1));
            return switch (relative.group(2)) {
            case "minute" -> clock.instant().plus(Duration.ofMinutes(amount));
            case "hour" -> clock.instant().plus(Duration.ofHours(amount));
            case "day" -> startOfDay(today.plusDays(amount), zone);
            case "week" -> startOfDay(today.plusWeeks(amount), zone);
            default -> startOfDay(today.plusMonths(amount), zone);
            };
        }

        Matcher weekday = WEEKDAY.matcher(normalized);
        if (weekday.matches()) {
            DayOfWeek target = DayOfWeek.valueOf(weekday.group(2).toUpperCase(Locale.ROOT));
            int days = (target.getValue() - today.getDayOfWeek().getValue() + 7) % 7;
            if (days == 0) {
                days = 7;
            }
            return startOfDay(today.plusDays(days), zone);
        }

        if (ISO_INSTANT.matcher(normalized).matches()) {
            return Instant.parse(normalized.toUpperCase(Locale.ROOT));
        }
        if (ISO_DATE_TIME.matcher(normalized).matches()) {
            return LocalDateTime.parse(normalized.replace(' ', 't').toUpperCase(Locale.ROOT))
                    .atZone(zone).toInstant();
        }
        if (ISO_DATE.matcher(normalized).matches()) {
            return startOfDay(LocalDate.parse(normalized), zone);
        }

        Matcher monthDay = MONTH_DAY.matcher(normalized);
        if (monthDay.matches() && MONTHS.containsKey(monthDay.group(1))) {
            return verbalDate(MONTHS.get(monthDay.group(1)), Integer.parseInt(monthDay.group(2)),
                    monthDay.group(3), today, zone);
        }
        Matcher dayMonth = DAY_MONTH.matcher(normalized);
        if (dayMonth.matches() && MONTHS.containsKey(dayMonth.group(2))) {
            return verbalDate(MONTHS.get(dayMonth.group(2)), Integer.parseInt(dayMonth.group(1)),
                    dayMonth.group(3), today, zone);
        }
        return null;
    }

    private Instant verbalDate(int month, int day, String year, LocalDate today, ZoneId zone) {
        if (year != null) {
            return startOfDay(LocalDate.of(Integer.parseInt(year), month, day), zone);
        }
        LocalDate candidate = LocalDate.of(today.getYear(), month, day);
        if (candidate.isBefore(today)) {
            candidate = candidate.plusYears(1);
        }
        return startOfDay(candidate, zone);
    }

    private int parseAmount(String value) {
        Integer word = NUMBER_WORDS.get(value);
        return word != null ? word : Integer.parseInt(value);
    }

    private Instant startOfDay(LocalDate date, ZoneId zone) {
        return date.atStartOfDay(zone).toInstant();
    }
}
