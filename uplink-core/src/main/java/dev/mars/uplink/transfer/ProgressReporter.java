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


import dev.mars.uplink.core.UploadProgress;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Derives completion from the server-confirmed offset and publishes it.
 *
 * <p>The percentage has no state of its own: {@code round(offset / totalSize * 100)} clamped
 * to [0, 100]. The reporter additionally keeps a smoothed transfer rate so each event can
 * carry an ETA.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ProgressReporter {
    private final UploadEventPublisher publisher;
    private final AtomicReference<Instant> lastSampleTime;
    private final AtomicLong lastSampleOffset;
    private final AtomicReference<Double> currentRate; // bytes per second
    private final AtomicReference<UploadProgress> lastProgress;

    // Samples closer together than this do not update the rate
    private static final long RATE_SAMPLE_MIN_INTERVAL_MS = 250;

    public ProgressReporter(UploadEventPublisher publisher) {
        this.publisher = publisher;
        this.lastSampleTime = new AtomicReference<>();
        this.lastSampleOffset = new AtomicLong(-1);
        this.currentRate = new AtomicReference<>(0.0);
        this.lastProgress = new AtomicReference<>();
    }

    /**
     * Completion in whole percent.
     *
     * @return {@code round(offset / totalSize * 100)} clamped to [0, 100]; 0 when the size is unknown
     */
    public static int percentOf(long offset, long totalSize) {
        if (totalSize <= 0) {
            return 0;
        }
        long percent = Math.round((double) offset / totalSize * 100.0);
        return (int) Math.max(0, Math.min(100, percent));
    }

    /**
     * Compute progress for the session's current offset and publish it to listeners.
     */
    public UploadProgress report(UploadSession session) {
        Instant now = Instant.now();
        long offset = session.getOffset();
        updateRate(offset, now);

        UploadProgress progress = new UploadProgress(
                session.getSessionId(),
                offset,
                session.getTotalSize(),
                percentOf(offset, session.getTotalSize()),
                currentRate.get(),
                estimateRemainingSeconds(session.getTotalSize() - offset));
        lastProgress.set(progress);
        publisher.publishProgress(progress);
        return progress;
    }

    /**
     * @return the last published progress, or null if nothing was reported yet
     */
    public UploadProgress getLastProgress() {
        return lastProgress.get();
    }

    public double getCurrentRateBytesPerSecond() {
        return currentRate.get();
    }

    private long estimateRemainingSeconds(long remainingBytes) {
        double rate = currentRate.get();
        if (remainingBytes <= 0) {
            return 0;
        }
        if (rate <= 0) {
            return -1;
        }
        return (long) (remainingBytes / rate);
    }

    private void updateRate(long offset, Instant now) {
        Instant previousTime = lastSampleTime.get();
        long previousOffset = lastSampleOffset.get();
        if (previousTime == null || previousOffset < 0 || offset < previousOffset) {
            // First sample, e.g. right after resume negotiation: nothing to compare against
            lastSampleTime.set(now);
            lastSampleOffset.set(offset);
            return;
        }

        long elapsedMs = Duration.between(previousTime, now).toMillis();
        if (elapsedMs < RATE_SAMPLE_MIN_INTERVAL_MS) {
            return;
        }

        long bytes = offset - previousOffset;
        double instantRate = (double) bytes / elapsedMs * 1000.0;
        double current = currentRate.get();
        double smoothed = current == 0.0 ? instantRate : (current * 0.7 + instantRate * 0.3);
        currentRate.set(smoothed);
        lastSampleTime.set(now);
        lastSampleOffset.set(offset);
    }

    /**
     * Restart rate sampling, used when a paused loop continues after an arbitrary gap.
     */
    void resetRate() {
        lastSampleTime.set(null);
        lastSampleOffset.set(-1);
        currentRate.set(0.0);
    }
}
