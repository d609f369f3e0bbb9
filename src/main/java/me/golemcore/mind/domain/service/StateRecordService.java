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

import me.golemcore.mind.domain.exception.StorageException;
import me.golemcore.mind.domain.model.MemorySnapshot;
import me.golemcore.mind.domain.model.StateRecord;
import me.golemcore.mind.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Persists the machine-local JSON records of a project: lifecycle state,
 * parsed snapshot and entry access counts. None of them is tracked by version
 * control.
 *
 * <p>
 * A missing or unreadable record is never fatal. State falls back to
 * {@link StateRecord#empty()}, which the lifecycle treats as a first run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StateRecordService {

    public static final String STATE_FILE = "state.json";
    public static final String SNAPSHOT_FILE = "index.json";
    public static final String ACCESS_FILE = "access.json";
    public static final String GITIGNORE_FILE = ".gitignore";

    static final String GITIGNORE_CONTENT = "# Machine-local state, do not commit\n"
            + STATE_FILE + "\n"
            + SNAPSHOT_FILE + "\n"
            + ACCESS_FILE + "\n"
            + "*.tmp\n";

    private static final TypeReference<TreeMap<String, Integer>> ACCESS_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    public StateRecord loadState(String project) {
        String json = readQuietly(project, STATE_FILE);
        if (json == null || json.isBlank()) {
            return StateRecord.empty();
        }
        try {
            StateRecord state = objectMapper.readValue(json, StateRecord.class);
            if (state.getSchemaVersion() > StateRecord.CURRENT_SCHEMA_VERSION) {
                log.warn("[State] {} has schema version {}, newer than supported {}; treating as first run",
                        STATE_FILE, state.getSchemaVersion(), StateRecord.CURRENT_SCHEMA_VERSION);
                return StateRecord.empty();
            }
            return state;
        } catch (JsonProcessingException e) {
            log.warn("[State] Corrupt {}, treating as first run: {}", STATE_FILE, e.getOriginalMessage());
            return StateRecord.empty();
        }
    }

    public void saveState(String project, StateRecord state) {
        writeJson(project, STATE_FILE, state);
    }

    public Optional<MemorySnapshot> loadSnapshot(String project) {
        String json = readQuietly(project, SNAPSHOT_FILE);
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, MemorySnapshot.class));
        } catch (JsonProcessingException e) {
            log.warn("[State] Corrupt {}, will re-parse: {}", SNAPSHOT_FILE, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public void saveSnapshot(String project, MemorySnapshot snapshot) {
        writeJson(project, SNAPSHOT_FILE, snapshot);
    }

    public Map<String, Integer> loadAccessCounts(String project) {
        String json = readQuietly(project, ACCESS_FILE);
        if (json == null || json.isBlank()) {
            return new TreeMap<>();
        }
        try {
            return objectMapper.readValue(json, ACCESS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[State] Corrupt {}, resetting access counts: {}", ACCESS_FILE, e.getOriginalMessage());
            return new TreeMap<>();
        }
    }

    /**
     * Increments the access count of each entry id.
     */
    public void recordAccess(String project, Collection<String> entryIds) {
        if (entryIds.isEmpty()) {
            return;
        }
        Map<String, Integer> counts = loadAccessCounts(project);
        for (String id : entryIds) {
            counts.merge(id, 1, Integer::sum);
        }
        writeJson(project, ACCESS_FILE, counts);
    }

    public boolean hasGitignore(String project) {
        return storagePort.exists(project, GITIGNORE_FILE);
    }

    public void writeGitignore(String project) {
        storagePort.putTextAtomic(project, GITIGNORE_FILE, GITIGNORE_CONTENT);
    }

    private String readQuietly(String project, String path) {
        try {
            return storagePort.getText(project, path);
        } catch (StorageException e) {
            log.warn("[State] Unreadable {}: {}", path, e.getMessage());
            return null;
        }
    }

    private void writeJson(String project, String path, Object value) {
        try {
            storagePort.putTextAtomic(project, path, objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new StorageException(path, "Failed to serialize " + path, e);
        }
    }
}
