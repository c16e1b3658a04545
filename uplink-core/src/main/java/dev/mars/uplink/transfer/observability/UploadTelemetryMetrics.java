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

package dev.mars.uplink.transfer.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for resumable uploads.
 *
 * Provides:
 * - uplink.upload.started (counter) - Sessions opened
 * - uplink.upload.resumed (counter) - Transfer loops re-entered after a pause or negotiation
 * - uplink.upload.paused (counter) - Loops stopped by a pause request
 * - uplink.upload.completed (counter) - Sessions finalized successfully
 * - uplink.upload.failed (counter) - Sessions that ended FAILED, by error type
 * - uplink.upload.chunks (counter) - Acknowledged chunks
 * - uplink.upload.bytes (counter) - Server-confirmed bytes
 * - uplink.upload.chunk.duration.seconds (histogram) - Round trip time per chunk
 * - uplink.upload.active (gauge) - Loops currently transferring
 *
 * All instruments are no-ops until an OpenTelemetry SDK is registered globally.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class UploadTelemetryMetrics {

    private static final Logger logger = LoggerFactory.getLogger(UploadTelemetryMetrics.class);
    private static final String METER_NAME = "uplink-core";

    private static UploadTelemetryMetrics instance;

    private final LongCounter uploadsStarted;
    private final LongCounter uploadsResumed;
    private final LongCounter uploadsPaused;
    private final LongCounter uploadsCompleted;
    private final LongCounter uploadsFailed;
    private final LongCounter chunksSent;
    private final LongCounter bytesConfirmed;
    private final DoubleHistogram chunkDuration;

    private final AtomicLong activeUploads = new AtomicLong(0);

    private static final AttributeKey<String> PROTOCOL_KEY = AttributeKey.stringKey("protocol");
    private static final AttributeKey<String> ERROR_TYPE_KEY = AttributeKey.stringKey("error.type");

    UploadTelemetryMetrics(Meter meter) {
        uploadsStarted = meter.counterBuilder("uplink.upload.started")
                .setDescription("Number of upload sessions opened")
                .setUnit("1")
                .build();

        uploadsResumed = meter.counterBuilder("uplink.upload.resumed")
                .setDescription("Number of transfer loops resumed")
                .setUnit("1")
                .build();

        uploadsPaused = meter.counterBuilder("uplink.upload.paused")
                .setDescription("Number of transfer loops paused")
                .setUnit("1")
                .build();

        uploadsCompleted = meter.counterBuilder("uplink.upload.completed")
                .setDescription("Number of uploads finalized successfully")
                .setUnit("1")
                .build();

        uploadsFailed = meter.counterBuilder("uplink.upload.failed")
                .setDescription("Number of uploads that ended in FAILED")
                .setUnit("1")
                .build();

        chunksSent = meter.counterBuilder("uplink.upload.chunks")
                .setDescription("Number of chunks acknowledged by the server")
                .setUnit("1")
                .build();

        bytesConfirmed = meter.counterBuilder("uplink.upload.bytes")
                .setDescription("Bytes confirmed by the server")
                .setUnit("By")
                .build();

        chunkDuration = meter.histogramBuilder("uplink.upload.chunk.duration.seconds")
                .setDescription("Chunk round trip time in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("uplink.upload.active")
                .setDescription("Number of transfer loops currently running")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeUploads.get()));

        logger.debug("UploadTelemetryMetrics initialized");
    }

    /**
     * Get the singleton instance bound to the global OpenTelemetry meter provider.
     */
    public static synchronized UploadTelemetryMetrics getInstance() {
        if (instance == null) {
            instance = new UploadTelemetryMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
        }
        return instance;
    }

    /**
     * Metrics that record nothing, used when telemetry is disabled in configuration.
     */
    public static UploadTelemetryMetrics noop() {
        return new UploadTelemetryMetrics(OpenTelemetry.noop().getMeter(METER_NAME));
    }

    public void recordUploadStarted(String protocol) {
        uploadsStarted.add(1, protocolAttributes(protocol));
        activeUploads.incrementAndGet();
    }

    public void recordUploadResumed(String protocol) {
        uploadsResumed.add(1, protocolAttributes(protocol));
        activeUploads.incrementAndGet();
    }

    public void recordUploadPaused(String protocol) {
        uploadsPaused.add(1, protocolAttributes(protocol));
        activeUploads.decrementAndGet();
    }

    public void recordUploadCompleted(String protocol) {
        uploadsCompleted.add(1, protocolAttributes(protocol));
        activeUploads.decrementAndGet();
    }

    /**
     * Record an upload that ended FAILED.
     *
     * @param wasTransferring whether the loop was running, i.e. whether it counted as active
     */
    public void recordUploadFailed(String protocol, String errorType, boolean wasTransferring) {
        if (wasTransferring) {
            activeUploads.decrementAndGet();
        }
        Attributes attrs = Attributes.builder()
                .put(PROTOCOL_KEY, protocol)
                .put(ERROR_TYPE_KEY, errorType != null ? errorType : "unknown")
                .build();
        uploadsFailed.add(1, attrs);
    }

    public void recordChunk(String protocol, long bytes, double durationSeconds) {
        Attributes attrs = protocolAttributes(protocol);
        chunksSent.add(1, attrs);
        bytesConfirmed.add(bytes, attrs);
        chunkDuration.record(durationSeconds, attrs);
    }

    /**
     * Get the current number of running transfer loops.
     */
    public long getActiveUploads() {
        return activeUploads.get();
    }

    private static Attributes protocolAttributes(String protocol) {
        return Attributes.builder()
                .put(PROTOCOL_KEY, protocol)
                .build();
    }
}
