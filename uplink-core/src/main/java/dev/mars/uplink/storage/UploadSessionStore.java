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


import dev.mars.uplink.config.UplinkConfiguration;
import dev.mars.uplink.core.exceptions.SessionStoreException;

import java.util.List;
import java.util.Optional;

/**
 * Keeps upload session descriptors so that a caller can find resumable uploads later.
 * Records are keyed by the server-issued session id.
 */
public interface UploadSessionStore {

    void save(StoredSession session) throws SessionStoreException;

    Optional<StoredSession> find(String sessionId) throws SessionStoreException;

    List<StoredSession> findAll() throws SessionStoreException;

    /**
     * @return sessions that are neither COMPLETED nor FAILED
     */
    List<StoredSession> findResumable() throws SessionStoreException;

    /**
     * @return {@code true} if a record was removed
     */
    boolean remove(String sessionId) throws SessionStoreException;

    /**
     * Remove terminal sessions last updated more than {@code maxAgeMs} ago.
     *
     * @return number of records removed
     */
    int cleanupTerminal(long maxAgeMs) throws SessionStoreException;

    /**
     * Create the store selected by {@code uplink.store.type}.
     */
    static UploadSessionStore fromConfiguration(UplinkConfiguration configuration) throws SessionStoreException {
        String type = configuration.getStoreType();
        if ("file".equalsIgnoreCase(type)) {
            return new FileUploadSessionStore(configuration.getStoreDirectory());
        }
        if ("memory".equalsIgnoreCase(type)) {
            return new InMemoryUploadSessionStore();
        }
        throw new IllegalArgumentException("Unknown session store type: " + type);
    }
}
