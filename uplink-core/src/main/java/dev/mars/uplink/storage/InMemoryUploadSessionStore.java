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


import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public class InMemoryUploadSessionStore implements UploadSessionStore {
    private static final Logger logger = Logger.getLogger(InMemoryUploadSessionStore.class.getName());

    private final Map<String, StoredSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void save(StoredSession session) {
        sessions.put(session.getSessionId(), session);
        logger.fine("Saved upload session state: " + session.getSessionId());
    }

    @Override
    public Optional<StoredSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public List<StoredSession> findAll() {
        return List.copyOf(sessions.values());
    }

    @Override
    public List<StoredSession> findResumable() {
        return sessions.values().stream()
                .filter(StoredSession::isResumable)
                .collect(Collectors.toList());
    }

    @Override
    public boolean remove(String sessionId) {
        StoredSession removed = sessions.remove(sessionId);
        if (removed != null) {
            logger.fine("Removed upload session state: " + sessionId);
        }
        return removed != null;
    }

    @Override
    public int cleanupTerminal(long maxAgeMs) {
        Instant cutoff = Instant.now().minusMillis(maxAgeMs);
        int before = sessions.size();
        sessions.entrySet().removeIf(entry -> {
            StoredSession state = entry.getValue();
            if (state.getStatus().isTerminal() && state.getLastUpdateTime().isBefore(cutoff)) {
                logger.fine("Cleaned up old upload session state: " + entry.getKey());
                return true;
            }
            return false;
        });
        return before - sessions.size();
    }

    public int size() {
        return sessions.size();
    }
}
