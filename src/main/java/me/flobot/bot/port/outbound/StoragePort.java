package me.flobot.bot.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for the bot's file workspace. Paths are relative to a named
 * subdirectory of the workspace.
 */
public interface StoragePort {

    /**
     * Read text content from file.
     *
     * @return the content, or {@code null} when the file does not exist
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Delete a file.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * Atomically write text content to file.
     *
     * <p>
     * The content goes to a temporary file ({@code .tmp} suffix) which is
     * synced and then renamed over the target, so readers see either the old
     * or the new content.
     *
     * @param directory
     *            subdirectory (e.g., "triggers")
     * @param path
     *            relative path within directory
     * @param content
     *            text content to write
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);
}
