package dev.mars.uplink.core;

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
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable value object describing one resumable upload requested by a caller.
 *
 * <p>The request carries the source file and the opaque post metadata ({@code title},
 * {@code description}) that is forwarded verbatim to the finish call. The metadata is
 * never interpreted by the upload client.</p>
 *
 * <h3>Identity:</h3>
 * <p>{@code uploadId} is a local identifier generated when the request is built. It exists
 * before the server has issued a session id and is the key the upload engine uses to
 * address the upload for pause, resume and cancel.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * UploadRequest request = UploadRequest.builder()
 *     .mediaFile(new PathMediaFile(Paths.get("/videos/launch.mp4")))
 *     .title("Launch day")
 *     .description("Behind the scenes")
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @see UploadResult
 */
public final class UploadRequest {

    private final String uploadId;
    private final MediaFile mediaFile;
    private final String title;
    private final String description;

    /**
     * Chunk size override in bytes, or 0 to use the configured chunk size.
     */
    private final int chunkSize;
    private final Instant createdAt;

    private UploadRequest(Builder builder) {
        this.uploadId = builder.uploadId != null ? builder.uploadId : UUID.randomUUID().toString();
        this.mediaFile = Objects.requireNonNull(builder.mediaFile, "Media file cannot be null");
        this.title = builder.title;
        this.description = builder.description;
        this.chunkSize = builder.chunkSize;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        if (chunkSize < 0) {
            throw new IllegalArgumentException("Chunk size cannot be negative: " + chunkSize);
        }
    }

    public String getUploadId() { return uploadId; }
    public MediaFile getMediaFile() { return mediaFile; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public int getChunkSize() { return chunkSize; }
    public Instant getCreatedAt() { return createdAt; }

    public boolean hasChunkSizeOverride() {
        return chunkSize > 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String uploadId;
        private MediaFile mediaFile;
        private String title;
        private String description;
        private int chunkSize;
        private Instant createdAt;

        public Builder uploadId(String uploadId) {
            this.uploadId = uploadId;
            return this;
        }

        public Builder mediaFile(MediaFile mediaFile) {
            this.mediaFile = mediaFile;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public UploadRequest build() {
            return new UploadRequest(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UploadRequest that = (UploadRequest) o;
        return Objects.equals(uploadId, that.uploadId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uploadId);
    }

    @Override
    public String toString() {
        return "UploadRequest{" +
                "uploadId='" + uploadId + '\'' +
                ", fileName='" + mediaFile.getFileName() + '\'' +
                ", size=" + mediaFile.getSize() +
                ", title='" + title + '\'' +
                '}';
    }
}
