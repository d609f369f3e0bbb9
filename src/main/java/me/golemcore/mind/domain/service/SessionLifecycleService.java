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

import me.golemcore.mind.domain.model.SessionCheck;
import me.golemcore.mind.domain.model.StateRecord;
import me.golemcore.mind.infrastructure.config.MindProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a working session has ended.
 *
 * <p>
 * A boundary is detected when the time since the last activity exceeds
 * {@code mind.session.gap-threshold} or when the permanent store no longer
 * matches the fingerprint recorded at the last full parse. A missing state
 * record is a first run and counts as fresh.
 *
 * <p>
 * This service holds no state. The caller passes the current
 * {@link StateRecord} in and persists the one returned by
 * {@link #advance(StateRecord, String)}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionLifecycleService {

    private final MindProperties properties;
    private final Clock clock;

    public SessionCheck evaluate(StateRecord state, String currentFingerprint, boolean force) {
        StateRecord current = state != null ? state : StateRecord.empty();
        Instant now = clock.instant();
        Duration elapsed = current.getLastActivity() != null
                ? Duration.between(current.getLastActivity(), now)
                : null;

        SessionCheck.Reason reason = SessionCheck.Reason.NONE;
        if (force) {
            reason = SessionCheck.Reason.FORCED;
        } else if (elapsed != null && elapsed.compareTo(properties.getSession().getGapThreshold()) > 0) {
            reason = SessionCheck.Reason.GAP;
        } else if (current.getContentFingerprint() != null
                && !current.getContentFingerprint().equals(currentFingerprint)) {
            reason = SessionCheck.Reason.DRIFT;
        }

        boolean boundary = reason != SessionCheck.Reason.NONE;
        if (boundary) {
            log.info("[Lifecycle] Session boundary detected: {} (elapsed: {})", reason, elapsed);
        } else {
            log.debug("[Lifecycle] Session fresh (elapsed: {}, firstRun: {})", elapsed, current.isFirstRun());
        }

        return SessionCheck.builder()
                .boundaryDetected(boundary)
                .reason(reason)
                .elapsed(elapsed)
                .currentFingerprint(currentFingerprint)
                .firstRun(current.isFirstRun())
                .build();
    }

    /**
     * State after a recall: activity now, fingerprint of the store as just
     * read.
     */
    public StateRecord advance(StateRecord state, String fingerprint) {
        StateRecord current = state != null ? state : StateRecord.empty();
        return current.toBuilder()
                .lastActivity(clock.instant())
                .contentFingerprint(fingerprint)
                .schemaVersion(StateRecord.CURRENT_SCHEMA_VERSION)
                .build();
    }

    /**
     * State after activity that did not re-read the store.
     */
    public StateRecord touch(StateRecord state) {
        StateRecord current = state != null ? state : StateRecord.empty();
        return current.toBuilder()
                .lastActivity(clock.instant())
                .schemaVersion(StateRecord.CURRENT_SCHEMA_VERSION)
                .build();
    }
}
