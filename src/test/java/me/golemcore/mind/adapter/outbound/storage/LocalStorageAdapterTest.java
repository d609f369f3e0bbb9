package me.golemcore.mind.adapter.outbound.storage;

import me.golemcore.mind.infrastructure.config.MindProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String MEMORY_FILE = "MEMORY.md";
    private static final String CONTENT_DEFAULT = "content";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;
    private String project;

    @BeforeEach
    void setUp() {
        MindProperties properties = new MindProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storageAdapter = new LocalStorageAdapter(properties);
        project = tempDir.resolve("demo").toString();
    }

    @Test
    void putAndGetText() {
        storageAdapter.putTextAtomic(project, MEMORY_FILE, "Hello, World!");

        assertEquals("Hello, World!", storageAdapter.getText(project, MEMORY_FILE));
    }

    @Test
    void shouldReturnNullForMissingFile() {
        assertNull(storageAdapter.getText(project, "missing.md"));
        assertFalse(storageAdapter.exists(project, "missing.md"));
        assertEquals(0, storageAdapter.size(project, "missing.md"));
    }

    @Test
    void shouldWriteIntoMemoryDirectoryOfProject() {
        storageAdapter.putTextAtomic(project, MEMORY_FILE, CONTENT_DEFAULT);

        assertTrue(Files.exists(tempDir.resolve("demo").resolve(".mind").resolve(MEMORY_FILE)));
        assertEquals(tempDir.resolve("demo").resolve(".mind").toAbsolutePath().normalize(),
                storageAdapter.resolveRoot(project));
    }

    @Test
    void shouldResolveBareProjectNamesUnderBasePath() {
        assertEquals(tempDir.resolve("other").resolve(".mind").toAbsolutePath().normalize(),
                storageAdapter.resolveRoot("other"));
    }

    @Test
    void shouldReplaceExistingContentWithoutLeavingTempFile() throws IOException {
        storageAdapter.putTextAtomic(project, MEMORY_FILE, "first version");
        storageAdapter.putTextAtomic(project, MEMORY_FILE, "second");

        Path root = storageAdapter.resolveRoot(project);
        assertEquals("second", Files.readString(root.resolve(MEMORY_FILE), StandardCharsets.UTF_8));
        assertFalse(Files.exists(root.resolve(MEMORY_FILE + ".tmp")));
        assertEquals(6, storageAdapter.size(project, MEMORY_FILE));
    }

    @Test
    void shouldCreateDirectoryOnDemand() {
        assertFalse(storageAdapter.directoryExists(project));

        storageAdapter.ensureDirectory(project);

        assertTrue(storageAdapter.directoryExists(project));
    }

    @Test
    void shouldBlockPathTraversal() {
        assertThrows(IllegalArgumentException.class,
                () -> storageAdapter.putTextAtomic(project, "../escape.md", CONTENT_DEFAULT));
        assertThrows(IllegalArgumentException.class,
                () -> storageAdapter.getText(project, "../../etc/passwd"));
    }

    @Test
    void shouldPreserveUtf8Content() {
        String content = "- **Decided:** naïve approach → cached ✅";
        storageAdapter.putTextAtomic(project, MEMORY_FILE, content);

        assertEquals(content, storageAdapter.getText(project, MEMORY_FILE));
    }
}
