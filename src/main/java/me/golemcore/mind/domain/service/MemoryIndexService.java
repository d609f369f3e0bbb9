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

import me.golemcore.mind.domain.model.MemorySnapshot;
import me.golemcore.mind.domain.model.ParseResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps the parsed form of the permanent store. A persisted snapshot is reused
 * only while its fingerprint matches the store; otherwise the store is parsed
 * again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryIndexService {

    private final MemoryExtractor extractor;
    private final StateRecordService stateRecordService;
    private final Clock clock;

    private final AtomicLong reparseCount = new AtomicLong();

    /**
     * Parsed store for the given content, from the snapshot when it is still
     * valid.
     */
    public ParseResult current(String project, String content, String fingerprint) {
        Optional<MemorySnapshot> snapshot = stateRecordService.loadSnapshot(project);
        if (snapshot.isPresent() && fingerprint.equals(snapshot.get().getFingerprint())
                && snapshot.get().getParse() != null) {
            return snapshot.get().getParse();
        }
        log.debug("[Index] Snapshot missing or stale, re-parsing");
        return reindex(project, content, fingerprint);
    }

    /**
     * Parses the full store and replaces the snapshot.
     */
    public ParseResult reindex(String project, String content, String fingerprint) {
        ParseResult parse = extractor.parse(content, MemoryStoreService.MEMORY_FILE);
        reparseCount.incrementAndGet();
        stateRecordService.saveSnapshot(project, MemorySnapshot.builder()
                .fingerprint(fingerprint)
                .parsedAt(clock.instant())
                .parse(parse)
                .build());
        if (!parse.getSkippedLines().isEmpty()) {
            log.debug("[Index] {} line(s) matched no extraction rule", parse.getSkippedLines().size());
        }
        log.info("[Index] Re-parsed {}: {} entries", MemoryStoreService.MEMORY_FILE, parse.getEntries().size());
        return parse;
    }

    /**
     * Number of full parses performed by this instance.
     */
    public long getReparseCount() {
        return reparseCount.get();
    }
}
