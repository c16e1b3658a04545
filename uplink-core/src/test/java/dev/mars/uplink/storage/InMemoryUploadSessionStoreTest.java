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

package dev.mars.uplink.storage;

import dev.mars.uplink.core.UploadStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static dev.mars.uplink.storage.StoredSessions.paused;
import static dev.mars.uplink.storage.StoredSessions.record;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryUploadSessionStoreTest {

    private InMemoryUploadSessionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryUploadSessionStore();
    }

    @Test
    void testSaveReplacesRecordForSameSession() {
        store.save(paused("s-1", 1000));
        store.save(paused("s-1", 3000));

        assertEquals(1, store.size());
        assertEquals(3000, store.find("s-1").orElseThrow().getOffset());
    }

    @Test
    void testFindResumableSkipsTerminal() {
        store.save(paused("s-1", 1000));
        store.save(record("s-2", UploadStatus.UPLOADING, 2000, Instant.now()));
        store.save(record("s-3", UploadStatus.COMPLETED, 10_000, Instant.now()));
        store.save(record("s-4", UploadStatus.FAILED, 500, Instant.now()));

        assertEquals(4, store.findAll().size());
        assertEquals(2, store.findResumable().size());
        assertTrue(store.findResumable().stream().allMatch(StoredSession::isResumable));
    }

    @Test
    void testRemove() {
        store.save(paused("s-1", 1000));

        assertTrue(store.remove("s-1"));
        assertFalse(store.remove("s-1"));
        assertTrue(store.find("s-1").isEmpty());
    }

    @Test
    void testCleanupRemovesOnlyOldTerminalRecords() {
        Instant old = Instant.now().minus(2, ChronoUnit.DAYS);
        store.save(record("old-done", UploadStatus.COMPLETED, 10_000, old));
        store.save(record("old-failed", UploadStatus.FAILED, 0, old));
        store.save(record("old-paused", UploadStatus.PAUSED, 4000, old));
        store.save(record("new-done", UploadStatus.COMPLETED, 10_000, Instant.now()));

        int removed = store.cleanupTerminal(ChronoUnit.DAYS.getDuration().toMillis());

        assertEquals(2, removed);
        assertTrue(store.find("old-paused").isPresent());
        assertTrue(store.find("new-done").isPresent());
    }

    @Test
    void testPercent() {
        assertEquals(40, paused("s-1", 4000).getPercent());
        assertEquals(0, new StoredSession("s-2", null, null, 0, 0, 0, null, null, null, null, null, null).getPercent());
    }
}
