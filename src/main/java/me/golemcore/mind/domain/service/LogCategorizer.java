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

import me.golemcore.mind.domain.model.SessionCategory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Picks a session buffer section for text logged without an explicit kind.
 * Rejections win over blockers, blockers over assumptions; anything else is
 * experience.
 */
@Component
public class LogCategorizer {

    private static final String APOSTROPHE = "['’]?";

    private static final Pattern REJECTED = Pattern.compile(
            "\\btried\\b|\\bdidn" + APOSTROPHE + "t work|\\bdoesn" + APOSTROPHE + "t work|\\bfailed\\b"
                    + "|\\boverkill\\b|\\btoo complex\\b|\\btoo slow\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern BLOCKER = Pattern.compile(
            "\\bstuck\\b|\\bblocked\\b|\\bcan" + APOSTROPHE + "t figure|\\bdon" + APOSTROPHE + "t know"
                    + "|\\bno idea\\b|\\bstruggling\\b|\\bhitting a wall\\b|\\bdead end\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern ASSUMPTION = Pattern.compile(
            "\\bassum(?:e|es|ed|ing)\\b|\\bi think\\b|\\bprobably\\b|\\bshould be\\b|\\bhypothesis\\b"
                    + "|\\bguessing\\b|\\bexpecting\\b",
            Pattern.CASE_INSENSITIVE);

    private static final List<Rule> RULES = List.of(
            new Rule(SessionCategory.REJECTED, REJECTED),
            new Rule(SessionCategory.BLOCKER, BLOCKER),
            new Rule(SessionCategory.ASSUMPTION, ASSUMPTION));

    public SessionCategory categorize(String text) {
        if (text == null || text.isBlank()) {
            return SessionCategory.EXPERIENCE;
        }
        for (Rule rule : RULES) {
            if (rule.pattern().matcher(text).find()) {
                return rule.category();
            }
        }
        return SessionCategory.EXPERIENCE;
    }

    private record Rule(SessionCategory category, Pattern pattern) {
    }
}
