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

package me.golemcore.mind.domain.exception;

/** Thrown when a reminder due-expression cannot be parsed. */
public class MalformedTriggerException extends IllegalArgumentException {

    private final String expression;

    public MalformedTriggerException(String expression) {
        super("Cannot parse reminder trigger: '" + expression + "'. Try 'tomorrow', 'in 3 days', "
                + "'next session', 'December 25', '2026-12-25' or 'when I mention <keyword>'");
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
