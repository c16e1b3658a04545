package dev.mars.uplink.transfer;

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


import dev.mars.uplink.core.UploadStatus;
import dev.mars.uplink.core.exceptions.InvalidTransitionException;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The unit of work of a resumable upload: server session identity, file metadata,
 * the server-confirmed offset and the lifecycle status.
 *
 * <p>Only the owning {@link UploadController} mutates a session; every mutator is
 * package-private. Other components and listeners see the read-only getters.</p>
 *
 * <h3>Invariants:</h3>
 * <ul>
 *   <li>{@code 0 <= offset <= totalSize}</li>
 *   <li>{@code offset} never decreases and only ever takes values reported by the server</li>
 *   <li>COMPLETED implies {@code offset == totalSize}</li>
 *   <li>COMPLETED and FAILED are terminal</li>
 * </ul>
 *
 * <h3>Thread Safety:</h3>
 * <p>Single writer (the controller's loop thread). Fields read by other threads are volatile.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class UploadSession {

    private final String uploadId;
    private final String fileName;
    private final long totalSize;
    private final int chunkSize;
    private final String title;
    private final String description;
    private final Instant createdAt;
    private final AtomicInteger chunksSent = new AtomicInteger();

    private volatile String sessionId;
    private volatile long offset;
    private volatile UploadStatus status;
    private volatile Instant lastUpdateTime;
    private volatile String errorMessage;

    UploadSession(String uploadId, String fileName, long totalSize, int chunkSize,
                  String title, String description) {
        if (totalSize < 0) {
            throw new IllegalArgumentException("Total size cannot be negative: " + totalSize);
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        this.uploadId = Objects.requireNonNull(uploadId, "Upload ID cannot be null");
        this.fileName = fileName;
        this.totalSize = totalSize;
        this.chunkSize = chunkSize;
        this.title = title;
        this.description = description;
        this.createdAt = Instant.now();
        this.lastUpdateTime = createdAt;
        this.status = UploadStatus.IDLE;
        this.offset = 0;
    }

    /**
     * Creates a session bound to an existing server session at the offset the server reported.
     * The session is still IDLE; the negotiator moves it to PAUSED.
     */
    static UploadSession attach(String uploadId, String sessionId, String fileName, long totalSize,
                                long offset, int chunkSize, String title, String description) {
        if (offset < 0 || offset > totalSize) {
            throw new IllegalArgumentException(
                    "Offset " + offset + " outside [0, " + totalSize + "] for session " + sessionId);
        }
        UploadSession session = new UploadSession(uploadId, fileName, totalSize, chunkSize, title, description);
        session.sessionId = sessionId;
        session.offset = offset;
        return session;
    }

    // ========== MUTATORS (controller only) ==========

    void assignSessionId(String sessionId) {
        if (this.sessionId != null) {
            throw new IllegalStateException("Session id already assigned: " + this.sessionId);
        }
        this.sessionId = sessionId;
        touch();
    }

    /**
     * Adopt the offset confirmed by the server.
     *
     * @throws IllegalStateException if the value would move the offset backwards or past the end
     */
    void advanceOffset(long confirmedOffset) {
        if (confirmedOffset < offset || confirmedOffset > totalSize) {
            throw new IllegalStateException(String.format(
                    "Offset %d violates [%d, %d] for session %s", confirmedOffset, offset, totalSize, sessionId));
        }
        this.offset = confirmedOffset;
        chunksSent.incrementAndGet();
        touch();
    }

    /**
     * @return the previous status
     * @throws InvalidTransitionException if the state machine does not allow the move
     */
    UploadStatus transitionTo(UploadStatus target) throws InvalidTransitionException {
        UploadStatus current = this.status;
        if (!current.canTransitionTo(target)) {
            throw new InvalidTransitionException(sessionId != null ? sessionId : uploadId,
                    current, target, current.getValidTransitions());
        }
        if (target == UploadStatus.COMPLETED && offset != totalSize) {
            throw new IllegalStateException(String.format(
                    "Session %s cannot complete at offset %d of %d", sessionId, offset, totalSize));
        }
        this.status = target;
        touch();
        return current;
    }

    void recordError(String errorMessage) {
        this.errorMessage = errorMessage;
        touch();
    }

    private void touch() {
        this.lastUpdateTime = Instant.now();
    }

    // ========== ACCESSORS ==========

    public String getUploadId() { return uploadId; }

    /**
     * @return the server-issued session id, or null before the session was created
     */
    public String getSessionId() { return sessionId; }

    public String getFileName() { return fileName; }

    public long getTotalSize() { return totalSize; }

    public int getChunkSize() { return chunkSize; }

    public String getTitle() { return title; }

    public String getDescription() { return description; }

    public Instant getCreatedAt() { return createdAt; }

    public Instant getLastUpdateTime() { return lastUpdateTime; }

    public String getErrorMessage() { return errorMessage; }

    public long getOffset() { return offset; }

    public UploadStatus getStatus() { return status; }

    /**
     * @return chunks acknowledged through this session object
     */
    public int getChunksSent() { return chunksSent.get(); }

    public long getRemainingBytes() {
        return totalSize - offset;
    }

    public boolean isFullyTransferred() {
        return offset == totalSize;
    }

    @Override
    public String toString() {
        return "UploadSession{" +
                "sessionId='" + sessionId + '\'' +
                ", fileName='" + fileName + '\'' +
                ", offset=" + offset +
                ", totalSize=" + totalSize +
                ", status=" + status +
                '}';
    }
}
