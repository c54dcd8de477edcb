/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.stepwise.core.persistence;

import dev.mars.stepwise.core.exceptions.StateSerializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores each conversation as {@code <conversationId>.json} in one directory.
 * Files are written to a temporary file first and moved into place.
 */
public class FileConversationStore implements ConversationStore {
    private static final Logger logger = LoggerFactory.getLogger(FileConversationStore.class);

    private static final String EXTENSION = ".json";

    private final Path directory;

    public FileConversationStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "Directory cannot be null");
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void save(String conversationId, String serializedState) throws StateSerializationException {
        Objects.requireNonNull(serializedState, "Serialized state cannot be null");
        Path target = fileOf(conversationId);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, conversationId + "_", ".tmp");
            Files.writeString(temp, serializedState, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported in {}, replacing {}", directory, target.getFileName());
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Saved conversation {} to {}", conversationId, target);
        } catch (IOException e) {
            throw new StateSerializationException("Failed to save conversation " + conversationId
                    + " to " + target + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> load(String conversationId) throws StateSerializationException {
        Path file = fileOf(conversationId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StateSerializationException("Failed to read conversation " + conversationId
                    + " from " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean delete(String conversationId) throws StateSerializationException {
        Path file = fileOf(conversationId);
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) {
                logger.debug("Deleted conversation file: {}", file);
            }
            return deleted;
        } catch (IOException e) {
            throw new StateSerializationException("Failed to delete conversation " + conversationId
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> listConversationIds() throws StateSerializationException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                    .forEach(ids::add);
        } catch (IOException e) {
            throw new StateSerializationException("Failed to list conversations in " + directory
                    + ": " + e.getMessage(), e);
        }
        Collections.sort(ids);
        return ids;
    }

    private Path fileOf(String conversationId) {
        Objects.requireNonNull(conversationId, "Conversation id cannot be null");
        if (conversationId.isBlank() || conversationId.contains("/") || conversationId.contains("\\")
                || conversationId.contains("..")) {
            throw new IllegalArgumentException("Invalid conversation id: " + conversationId);
        }
        return directory.resolve(conversationId + EXTENSION);
    }
}
