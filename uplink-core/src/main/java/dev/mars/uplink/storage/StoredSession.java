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


import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.uplink.core.UploadStatus;
import dev.mars.uplink.transfer.UploadSession;

import java.time.Instant;
import java.util.Objects;

/**
 * Persistable snapshot of an upload session descriptor.
 *
 * <p>The offset recorded here is the last one the client saw confirmed. It is a hint for
 * listing resumable uploads; a resume always asks the server for the committed offset.</p>
 */
public final class StoredSession {

    private final String sessionId;
    private final String uploadId;
    private final String fileName;
    private final long totalSize;
    private final long offset;
    private final int chunkSize;
    private final UploadStatus status;
    private final String title;
    private final String description;
    private final Instant createdAt;
    private final Instant lastUpdateTime;
    private final String errorMessage;

    @JsonCreator
    public StoredSession(
            @JsonProperty("sessionId") String sessionId,
            @JsonProperty("uploadId") String uploadId,
            @JsonProperty("fileName") String fileName,
            @JsonProperty("totalSize") long totalSize,
            @JsonProperty("offset") long offset,
            @JsonProperty("chunkSize") int chunkSize,
            @JsonProperty("status") UploadStatus status,
            @JsonProperty("title") String title,
            @JsonProperty("description") String description,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("lastUpdateTime") Instant lastUpdateTime,
            @JsonProperty("errorMessage") String errorMessage) {
        this.sessionId = Objects.requireNonNull(sessionId, "Session ID cannot be null");
        this.uploadId = uploadId;
        this.fileName = fileName;
        this.totalSize = totalSize;
        this.offset = offset;
        this.chunkSize = chunkSize;
        this.status = status != null ? status : UploadStatus.PAUSED;
        this.title = title;
        this.description = description;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.lastUpdateTime = lastUpdateTime != null ? lastUpdateTime : this.createdAt;
        this.errorMessage = errorMessage;
    }

    /**
     * Snapshot a live session. The session must already have a server session id.
     */
    public static StoredSession from(UploadSession session) {
        if (session.getSessionId() == null) {
            throw new IllegalArgumentException("Upload " + session.getUploadId() + " has no server session yet");
        }
        return new StoredSession(session.getSessionId(), session.getUploadId(), session.getFileName(),
                session.getTotalSize(), session.getOffset(), session.getChunkSize(), session.getStatus(),
                session.getTitle(), session.getDescription(), session.getCreatedAt(),
                session.getLastUpdateTime(), session.getErrorMessage());
    }

    public String getSessionId() { return sessionId; }
    public String getUploadId() { return uploadId; }
    public String getFileName() { return fileName; }
    public long getTotalSize() { return totalSize; }
    public long getOffset() { return offset; }
    public int getChunkSize() { return chunkSize; }
    public UploadStatus getStatus() { return status; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastUpdateTime() { return lastUpdateTime; }
    public String getErrorMessage() { return errorMessage; }

    /**
     * A session interrupted while UPLOADING (the process died mid-loop) is resumable as well as a PAUSED one.
     */
    @JsonIgnore
    public boolean isResumable() {
        return !status.isTerminal();
    }

    @JsonIgnore
    public int getPercent() {
        if (totalSize <= 0) {
            return 0;
        }
        return (int) Math.min(100, Math.round(offset * 100.0 / totalSize));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StoredSession that = (StoredSession) o;
        return totalSize == that.totalSize &&
                offset == that.offset &&
                chunkSize == that.chunkSize &&
                Objects.equals(sessionId, that.sessionId) &&
                Objects.equals(uploadId, that.uploadId) &&
                Objects.equals(fileName, that.fileName) &&
                status == that.status &&
                Objects.equals(title, that.title) &&
                Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, uploadId, fileName, totalSize, offset, chunkSize, status, title, description);
    }

    @Override
    public String toString() {
        return "StoredSession{" +
                "sessionId='" + sessionId + '\'' +
                ", fileName='" + fileName + '\'' +
                ", status=" + status +
                ", offset=" + offset +
                ", totalSize=" + totalSize +
                '}';
    }
}
