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

package me.golemcore.mind.adapter.outbound.storage;

import me.golemcore.mind.domain.exception.StorageException;
import me.golemcore.mind.infrastructure.config.MindProperties;
import me.golemcore.mind.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * A project identifier that looks like a path (absolute, or starting with
 * {@code .} or {@code ~}) is used as the project directory directly. Bare
 * names resolve under {@code mind.storage.base-path}. Memory files live in the
 * {@code mind.storage.directory} subdirectory of the project directory
 * ({@code .mind} by default).
 *
 * @see me.golemcore.mind.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private final MindProperties properties;

    @Override
    public String getText(String project, String path) {
        Path filePath = resolvePath(project, path);
        if (!Files.exists(filePath)) {
            return null;
        }
        try {
            return Files.readString(filePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException(path, "Failed to read file: " + filePath, e);
        }
    }

    @Override
    public boolean exists(String project, String path) {
        return Files.exists(resolvePath(project, path));
    }

    @Override
    public long size(String project, String path) {
        Path filePath = resolvePath(project, path);
        if (!Files.exists(filePath)) {
            return 0;
        }
        try {
            return Files.size(filePath);
        } catch (IOException e) {
            throw new StorageException(path, "Failed to stat file: " + filePath, e);
        }
    }

    @Override
    public void ensureDirectory(String project) {
        Path root = resolveRoot(project);
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StorageException(root.toString(), "Failed to create directory: " + root, e);
        }
    }

    @Override
    public boolean directoryExists(String project) {
        return Files.isDirectory(resolveRoot(project));
    }

    @Override
    public void putTextAtomic(String project, String path, String content) {
        Path targetPath = resolvePath(project, path);
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);

        try {
            Path parent = targetPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            // 1. Write to temp file with fsync
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            // 2. Verify written content is readable
            if (Files.size(tempPath) != bytes.length) {
                throw new IOException("Verification failed: size mismatch");
            }

            // 3. Rename into place
            moveIntoPlace(tempPath, targetPath, bytes);
            log.debug("[Storage] Atomic write completed: {}", targetPath);

        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
            }
            throw new StorageException(path, "Atomic write failed: " + targetPath, e);
        }
    }

    private void moveIntoPlace(Path tempPath, Path targetPath, byte[] bytes) throws IOException {
        try {
            Files.move(tempPath, targetPath,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            return;
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move not supported, using regular move");
        } catch (FileSystemException e) {
            directWrite(tempPath, targetPath, bytes, e);
            return;
        }

        try {
            Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
        } catch (FileSystemException e) {
            directWrite(tempPath, targetPath, bytes, e);
        }
    }

    /**
     * Replace failed on a locked target (seen on Windows when another process
     * holds the file open). Overwrite in place instead.
     */
    private void directWrite(Path tempPath, Path targetPath, byte[] bytes, FileSystemException cause)
            throws IOException {
        if (!properties.getStorage().isDirectWriteFallback()) {
            throw cause;
        }
        log.warn("[Storage] Replace of {} failed ({}), falling back to direct write",
                targetPath, cause.getMessage());
        Files.write(targetPath, bytes,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.SYNC);
        Files.deleteIfExists(tempPath);
    }

    @Override
    public Path resolveRoot(String project) {
        return resolveProjectDirectory(project)
                .resolve(properties.getStorage().getDirectory())
                .normalize();
    }

    private Path resolveProjectDirectory(String project) {
        String home = System.getProperty("user.home");
        if (project == null || project.isBlank()) {
            return Paths.get("").toAbsolutePath().normalize();
        }
        String trimmed = project.trim();
        if (trimmed.startsWith("~")) {
            return Paths.get(home + trimmed.substring(1)).toAbsolutePath().normalize();
        }
        Path candidate = Paths.get(trimmed);
        if (candidate.isAbsolute() || trimmed.startsWith(".")) {
            return candidate.toAbsolutePath().normalize();
        }
        String basePath = properties.getStorage().getBasePath().replace("${user.home}", home);
        return Paths.get(basePath).toAbsolutePath().resolve(trimmed).normalize();
    }

    private Path resolvePath(String project, String path) {
        Path root = resolveRoot(project);
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path traversal blocked: " + path);
        }
        return resolved;
    }
}
