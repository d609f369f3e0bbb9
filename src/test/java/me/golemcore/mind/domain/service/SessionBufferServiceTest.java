package me.golemcore.mind.domain.service;

import me.golemcore.mind.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.mind.domain.model.SessionBuffer;
import me.golemcore.mind.domain.model.SessionCategory;
import me.golemcore.mind.infrastructure.config.MindProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionBufferServiceTest {

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private SessionBufferService service;
    private String project;

    @BeforeEach
    void setUp() {
        MindProperties properties = new MindProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        service = new SessionBufferService(storage);
        project = tempDir.resolve("demo").toString();
    }

    @Test
    void shouldCreateBufferOnFirstAppend() {
        service.append(project, SessionCategory.BLOCKER, "CI runner out of disk");

        SessionBuffer buffer = service.read(project);
        assertEquals(List.of("CI runner out of disk"), buffer.get(SessionCategory.BLOCKER));
        assertTrue(service.missingSections(service.readRaw(project)).isEmpty());
    }

    @Test
    void shouldKeepAppendOrderWithinSection() {
        service.append(project, SessionCategory.EXPERIENCE, "first");
        service.append(project, SessionCategory.REJECTED, "tried GraphQL because of schema size");
        service.append(project, SessionCategory.EXPERIENCE, "second\nline");

        SessionBuffer buffer = service.read(project);
        assertEquals(List.of("first", "second line"), buffer.get(SessionCategory.EXPERIENCE));
        assertEquals(1, buffer.size(SessionCategory.REJECTED));
        assertEquals(3, buffer.size());
    }

    @Test
    void shouldIgnoreLinesOutsideKnownSections() {
        SessionBuffer buffer = service.parse("# SESSION.md\nstray line\n\n## Notes\n- not a section\n"
                + "## Assumptions\n<!-- comment -->\n* the API returns UTC\n1. numbered item\n");

        assertEquals(List.of("the API returns UTC", "numbered item"), buffer.get(SessionCategory.ASSUMPTION));
        assertEquals(2, buffer.size());
    }

    @Test
    void shouldClearToTemplate() {
        service.append(project, SessionCategory.EXPERIENCE, "first");

        service.clear(project);

        assertTrue(service.read(project).isEmpty());
        assertEquals(service.template(), service.readRaw(project));
    }

    @Test
    void shouldAppendIntoSectionAddedByRepair() {
        String partial = "# SESSION.md\n\n## Experience\n- kept\n";

        String repaired = service.addMissingSections(partial);

        assertEquals(List.of(SessionCategory.BLOCKER, SessionCategory.REJECTED, SessionCategory.ASSUMPTION),
                service.missingSections(partial));
        assertTrue(service.missingSections(repaired).isEmpty());
        assertEquals(List.of("kept"), service.parse(repaired).get(SessionCategory.EXPERIENCE));
    }

    @Test
    void shouldAppendUnderRequestedSectionWhenSeveralAreMissing() {
        storage.putTextAtomic(project, SessionBufferService.SESSION_FILE, "# SESSION.md\n\n## Experience\n- kept\n");

        service.append(project, SessionCategory.BLOCKER, "CI runner out of disk");

        SessionBuffer buffer = service.read(project);
        assertEquals(List.of("CI runner out of disk"), buffer.get(SessionCategory.BLOCKER));
        assertEquals(List.of("kept"), buffer.get(SessionCategory.EXPERIENCE));
        assertTrue(buffer.get(SessionCategory.REJECTED).isEmpty());
        assertTrue(buffer.get(SessionCategory.ASSUMPTION).isEmpty());
        assertTrue(service.missingSections(service.readRaw(project)).isEmpty());
    }
}
