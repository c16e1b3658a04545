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


import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable outcome of one run of the upload loop.
 *
 * <p>A run ends in one of three ways: the session is COMPLETED, the loop stopped at a
 * chunk boundary because a pause was requested (PAUSED), or the caller cancelled the
 * upload (FAILED with an error message). Failures caused by the server or the transport
 * are reported as exceptions rather than results.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * UploadResult result = controller.start();
 * if (result.isSuccessful()) {
 *     log("uploaded " + result.getOffset() + " bytes in " + result.getDuration().orElse(null));
 * } else if (result.getFinalStatus() == UploadStatus.PAUSED) {
 *     result = controller.resume();
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @see UploadRequest
 * @see UploadStatus
 */
public final class UploadResult {

    private final String uploadId;
    private final String sessionId;
    private final UploadStatus finalStatus;

    /**
     * Server-confirmed offset when the run ended.
     */
    private final long offset;
    private final long totalSize;

    /**
     * Bytes acknowledged during this run only.
     */
    private final long bytesTransferred;
    private final Instant startTime;
    private final Instant endTime;
    private final String errorMessage;
    private final Throwable cause;

    private UploadResult(Builder builder) {
        this.uploadId = builder.uploadId;
        this.sessionId = builder.sessionId;
        this.finalStatus = Objects.requireNonNull(builder.finalStatus, "Final status cannot be null");
        this.offset = builder.offset;
        this.totalSize = builder.totalSize;
        this.bytesTransferred = builder.bytesTransferred;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.errorMessage = builder.errorMessage;
        this.cause = builder.cause;
    }

    public String getUploadId() { return uploadId; }

    public String getSessionId() { return sessionId; }

    public UploadStatus getFinalStatus() { return finalStatus; }

    public long getOffset() { return offset; }

    public long getTotalSize() { return totalSize; }

    public long getBytesTransferred() { return bytesTransferred; }

    public Optional<Instant> getStartTime() { return Optional.ofNullable(startTime); }

    public Optional<Instant> getEndTime() { return Optional.ofNullable(endTime); }

    public Optional<String> getErrorMessage() { return Optional.ofNullable(errorMessage); }

    public Optional<Throwable> getCause() { return Optional.ofNullable(cause); }

    public Optional<Duration> getDuration() {
        if (startTime != null && endTime != null) {
            return Optional.of(Duration.between(startTime, endTime));
        }
        return Optional.empty();
    }

    /**
     * Average rate of this run in bytes per second, or empty when the run took no measurable time.
     */
    public Optional<Double> getAverageRateBytesPerSecond() {
        return getDuration()
                .filter(duration -> duration.toMillis() > 0)
                .map(duration -> (double) bytesTransferred / duration.toMillis() * 1000);
    }

    public boolean isSuccessful() {
        return finalStatus == UploadStatus.COMPLETED;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String uploadId;
        private String sessionId;
        private UploadStatus finalStatus;
        private long offset;
        private long totalSize;
        private long bytesTransferred;
        private Instant startTime;
        private Instant endTime;
        private String errorMessage;
        private Throwable cause;

        public Builder uploadId(String uploadId) {
            this.uploadId = uploadId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder finalStatus(UploadStatus finalStatus) {
            this.finalStatus = finalStatus;
            return this;
        }

        public Builder offset(long offset) {
            this.offset = offset;
            return this;
        }

        public Builder totalSize(long totalSize) {
            this.totalSize = totalSize;
            return this;
        }

        public Builder bytesTransferred(long bytesTransferred) {
            this.bytesTransferred = bytesTransferred;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public UploadResult build() {
            return new UploadResult(this);
        }
    }

    @Override
    public String toString() {
        return "UploadResult{" +
                "sessionId='" + sessionId + '\'' +
                ", finalStatus=" + finalStatus +
                ", offset=" + offset +
                ", totalSize=" + totalSize +
                ", duration=" + getDuration().map(Duration::toString).orElse("unknown") +
                '}';
    }
}
