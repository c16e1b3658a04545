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


/**
 * Progress snapshot published after every acknowledged chunk and after resume negotiation.
 * The percentage is derived from the server-confirmed offset only.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class UploadProgress {

    private final String sessionId;
    private final long offset;
    private final long totalSize;
    private final int percent;
    private final double bytesPerSecond;
    private final long estimatedRemainingSeconds;

    public UploadProgress(String sessionId, long offset, long totalSize, int percent,
                          double bytesPerSecond, long estimatedRemainingSeconds) {
        this.sessionId = sessionId;
        this.offset = offset;
        this.totalSize = totalSize;
        this.percent = percent;
        this.bytesPerSecond = bytesPerSecond;
        this.estimatedRemainingSeconds = estimatedRemainingSeconds;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getOffset() {
        return offset;
    }

    public long getTotalSize() {
        return totalSize;
    }

    /**
     * @return completion in whole percent, always within [0, 100]
     */
    public int getPercent() {
        return percent;
    }

    /**
     * @return smoothed transfer rate, 0 until enough samples exist
     */
    public double getBytesPerSecond() {
        return bytesPerSecond;
    }

    /**
     * @return estimated seconds until the last byte is acknowledged, or -1 if unknown
     */
    public long getEstimatedRemainingSeconds() {
        return estimatedRemainingSeconds;
    }

    public boolean isComplete() {
        return totalSize > 0 && offset == totalSize;
    }

    @Override
    public String toString() {
        return String.format("UploadProgress{sessionId='%s', offset=%d/%d, percent=%d%%, rate=%.2f MB/s}",
                sessionId, offset, totalSize, percent, bytesPerSecond / (1024.0 * 1024.0));
    }
}
