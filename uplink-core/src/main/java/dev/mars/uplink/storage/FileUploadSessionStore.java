package dev.mars.uplink.storage;

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


import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.uplink.core.exceptions.SessionStoreException;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Stores one JSON document per upload session in a directory, so that resumable sessions
 * survive a process restart.
 *
 * <p>Writes go to a temporary file which is then moved over the record. A record that cannot
 * be parsed is skipped when listing and logged.</p>
 */
public class FileUploadSessionStore implements UploadSessionStore {
    private static final Logger logger = Logger.getLogger(FileUploadSessionStore.class.getName());

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileUploadSessionStore(Path directory) throws SessionStoreException {
        this.directory = directory;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new SessionStoreException(null, "Cannot create session store directory " + directory, e);
        }
        logger.info("File session store initialized at " + directory);
    }

    @Override
    public synchronized void save(StoredSession session) throws SessionStoreException {
        Path target = pathFor(session.getSessionId());
        Path temp = directory.resolve(target.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), session);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new SessionStoreException(session.getSessionId(), "Failed to write session record " + target, e);
        }
        logger.fine("Saved upload session state: " + session.getSessionId());
    }

    @Override
    public synchronized Optional<StoredSession> find(String sessionId) throws SessionStoreException {
        Path path = pathFor(sessionId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), StoredSession.class));
        } catch (IOException e) {
            throw new SessionStoreException(sessionId, "Failed to read session record " + path, e);
        }
    }

    @Override
    public synchronized List<StoredSession> findAll() throws SessionStoreException {
        List<StoredSession> sessions = new ArrayList<>();
        try (DirectoryStream<Path> records = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path record : records) {
                try {
                    sessions.add(objectMapper.readValue(record.toFile(), StoredSession.class));
                } catch (IOException e) {
                    logger.log(Level.WARNING, "Skipping unreadable session record " + record, e);
                }
            }
        } catch (IOException e) {
            throw new SessionStoreException(null, "Failed to list session records in " + directory, e);
        }
        return sessions;
    }

    @Override
    public List<StoredSession> findResumable() throws SessionStoreException {
        return findAll().stream()
                .filter(StoredSession::isResumable)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean remove(String sessionId) throws SessionStoreException {
        try {
            boolean removed = Files.deleteIfExists(pathFor(sessionId));
            if (removed) {
                logger.fine("Removed upload session state: " + sessionId);
            }
            return removed;
        } catch (IOException e) {
            throw new SessionStoreException(sessionId, "Failed to delete session record", e);
        }
    }

    @Override
    public synchronized int cleanupTerminal(long maxAgeMs) throws SessionStoreException {
        Instant cutoff = Instant.now().minusMillis(maxAgeMs);
        int removed = 0;
        for (StoredSession session : findAll()) {
            if (session.getStatus().isTerminal() && session.getLastUpdateTime().isBefore(cutoff)) {
                if (remove(session.getSessionId())) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            logger.info("Cleaned up " + removed + " terminal session records");
        }
        return removed;
    }

    public Path getDirectory() {
        return directory;
    }

    Path pathFor(String sessionId) {
        return directory.resolve(sessionId.replaceAll("[^A-Za-z0-9._-]", "_") + SUFFIX);
    }
}
