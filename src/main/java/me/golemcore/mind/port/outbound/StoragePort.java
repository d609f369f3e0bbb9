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

package me.golemcore.mind.port.outbound;

import java.nio.file.Path;

/**
 * Port for per-project file storage. Every project owns one memory directory;
 * paths passed here are relative to it.
 *
 * <p>
 * All operations are synchronous and complete before returning. Failures are
 * reported as {@link me.golemcore.mind.domain.exception.StorageException}.
 */
public interface StoragePort {

    /**
     * Reads a text file.
     *
     * @return file contents, or {@code null} when the file does not exist
     */
    String getText(String project, String path);

    /**
     * Replaces a text file so that readers observe either the old or the new
     * content, never a partial write.
     */
    void putTextAtomic(String project, String path, String content);

    boolean exists(String project, String path);

    /**
     * Size of a file in bytes, {@code 0} when missing.
     */
    long size(String project, String path);

    /**
     * Creates the project's memory directory if absent.
     */
    void ensureDirectory(String project);

    /**
     * Returns {@code true} when the project's memory directory exists.
     */
    boolean directoryExists(String project);

    /**
     * Absolute memory directory for a project.
     */
    Path resolveRoot(String project);
}
