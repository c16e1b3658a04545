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


import dev.mars.uplink.config.UplinkConfiguration;
import dev.mars.uplink.core.MediaFile;
import dev.mars.uplink.core.UploadProgress;
import dev.mars.uplink.core.UploadRequest;
import dev.mars.uplink.core.UploadResult;
import dev.mars.uplink.core.UploadStatus;
import dev.mars.uplink.core.exceptions.ChunkTransferException;
import dev.mars.uplink.core.exceptions.FinalizationException;
import dev.mars.uplink.core.exceptions.InvalidTransitionException;
import dev.mars.uplink.core.exceptions.SessionCreationException;
import dev.mars.uplink.core.exceptions.UploadApiException;
import dev.mars.uplink.core.exceptions.UploadException;
import dev.mars.uplink.core.exceptions.UploadValidationException;
import dev.mars.uplink.protocol.ResumableUploadApi;
import dev.mars.uplink.transfer.observability.UploadTelemetryMetrics;

import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives one upload session through its lifecycle.
 *
 * <p>The controller owns the {@link UploadSession} and is its only writer. It requests the
 * server session, runs the sequential chunk loop on the calling thread, finalizes once every
 * byte is confirmed and publishes every status change, progress update and terminal event
 * through the {@link UploadEventPublisher}.</p>
 *
 * <h3>Blocking model:</h3>
 * <p>{@link #start()} and {@link #resume()} block until the session is PAUSED, COMPLETED or
 * FAILED. {@link #pause()} and {@link #cancel()} may be called from any thread; the loop
 * observes them at the next chunk boundary, so the chunk in flight always completes first.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * UploadController controller = UploadController.builder()
 *     .api(api)
 *     .request(request)
 *     .listener(listener)
 *     .build();
 * UploadResult result = controller.start();
 * if (result.getFinalStatus() == UploadStatus.PAUSED) {
 *     result = controller.resume();
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class UploadController {
    private static final Logger logger = Logger.getLogger(UploadController.class.getName());

    public static final int DEFAULT_CHUNK_SIZE = 4 * 1024 * 1024;
    public static final long DEFAULT_RESUMABLE_THRESHOLD = 1024L * 1024L * 1024L;

    static final String CANCELLED_MESSAGE = "Upload cancelled by caller";

    private final ResumableUploadApi api;
    private final MediaFile file;
    private final UploadSession session;
    private final long resumableThreshold;
    private final ChunkTransmitter transmitter;
    private final ProgressReporter progressReporter;
    private final UploadEventPublisher publisher;
    private final UploadTelemetryMetrics metrics;
    private final UploadContext context = new UploadContext();
    private final Object lifecycleLock = new Object();

    UploadController(ResumableUploadApi api, MediaFile file, UploadSession session, long resumableThreshold,
                     UploadEventPublisher publisher, UploadTelemetryMetrics metrics) {
        this.api = Objects.requireNonNull(api, "Upload API cannot be null");
        this.file = Objects.requireNonNull(file, "Media file cannot be null");
        this.session = Objects.requireNonNull(session, "Session cannot be null");
        this.resumableThreshold = resumableThreshold;
        this.publisher = publisher != null ? publisher : new UploadEventPublisher();
        this.metrics = metrics != null ? metrics : UploadTelemetryMetrics.noop();
        this.transmitter = new ChunkTransmitter(api);
        this.progressReporter = new ProgressReporter(this.publisher);
    }

    /**
     * Validate the file, create the server session and upload until paused, completed or failed.
     *
     * @return result with status PAUSED, COMPLETED or FAILED (FAILED only for a cancellation)
     * @throws UploadValidationException if the file does not exceed the resumable threshold;
     *         nothing is sent and the session stays IDLE
     * @throws SessionCreationException if the server rejects the session
     * @throws ChunkTransferException if a chunk fails
     * @throws FinalizationException if finishing the session fails
     * @throws IllegalStateException if the controller was already started
     */
    public UploadResult start() throws UploadValidationException, UploadException {
        return start(false);
    }

    /**
     * @param queued {@code true} when the run was scheduled before it could start; a session
     *               cancelled in the meantime then yields the cancelled result instead of an error
     */
    UploadResult start(boolean queued) throws UploadValidationException, UploadException {
        validate();
        if (!enterLoop("start", queued)) {
            return cancelledResult();
        }
        boolean released = false;
        try {
            if (session.getStatus() != UploadStatus.IDLE) {
                throw new IllegalStateException(
                        "Upload " + session.getUploadId() + " cannot start from " + session.getStatus());
            }
            Instant runStart = Instant.now();
            logger.info(String.format("Requesting upload session for %s (%d bytes, chunk size %d)",
                    file.getFileName(), file.getSize(), session.getChunkSize()));

            String sessionId;
            try {
                sessionId = api.startSession(file.getFileName(), file.getSize(),
                        session.getTitle(), session.getDescription());
            } catch (UploadApiException | RuntimeException e) {
                throw failSessionCreation("Server rejected the upload session: " + e.getMessage(), e);
            }
            if (sessionId == null || sessionId.isBlank()) {
                throw failSessionCreation("Server did not return an upload session id", null);
            }

            session.assignSessionId(sessionId);
            changeStatus(UploadStatus.UPLOADING);
            metrics.recordUploadStarted(api.getProtocolName());
            logger.info("Upload session " + sessionId + " created for " + file.getFileName());
            UploadResult result = runTransferLoop(runStart);
            released = true;
            return releaseLoop(result);
        } finally {
            if (!released) {
                releaseLoop(null);
            }
        }
    }

    /**
     * Continue a PAUSED session from its confirmed offset.
     *
     * @throws IllegalStateException if the session is not PAUSED or its loop is running
     */
    public UploadResult resume() throws UploadException {
        return resume(false);
    }

    UploadResult resume(boolean queued) throws UploadException {
        if (!enterLoop("resume", queued)) {
            return cancelledResult();
        }
        boolean released = false;
        try {
            if (!session.getStatus().canResume()) {
                throw new IllegalStateException("Upload session " + session.getSessionId()
                        + " cannot resume from " + session.getStatus());
            }
            progressReporter.resetRate();
            changeStatus(UploadStatus.UPLOADING);
            metrics.recordUploadResumed(api.getProtocolName());
            logger.info(String.format("Resuming upload session %s at offset %d of %d",
                    session.getSessionId(), session.getOffset(), session.getTotalSize()));
            UploadResult result = runTransferLoop(Instant.now());
            released = true;
            return releaseLoop(result);
        } finally {
            if (!released) {
                releaseLoop(null);
            }
        }
    }

    /**
     * Ask the running loop to stop before the next chunk.
     *
     * <p>The chunk in flight completes first. A request that arrives after the last chunk was
     * acknowledged has nothing to withhold and the session still finalizes.</p>
     *
     * @return {@code true} if the request was registered, {@code false} if no loop is running
     */
    public boolean pause() {
        synchronized (lifecycleLock) {
            if (!context.isRunning() || session.getStatus().isTerminal()) {
                return false;
            }
            context.requestPause();
            logger.fine("Pause requested for upload " + describe());
            return true;
        }
    }

    /**
     * Register a pause for a run that is scheduled but has not entered its loop yet. The loop
     * then stops at its first chunk boundary.
     *
     * @return {@code false} if the session is already terminal
     */
    boolean pauseBeforeRun() {
        synchronized (lifecycleLock) {
            if (session.getStatus().isTerminal()) {
                return false;
            }
            context.requestPause();
            logger.fine("Pause registered for scheduled upload " + describe());
            return true;
        }
    }

    /**
     * Abandon the upload. A running loop stops at the next boundary; an idle or paused session
     * becomes FAILED immediately. No abort call is sent to the server.
     *
     * @return {@code false} if the session was already terminal
     */
    public boolean cancel() {
        synchronized (lifecycleLock) {
            if (session.getStatus().isTerminal()) {
                return false;
            }
            context.cancel();
            if (context.isRunning()) {
                logger.info("Cancellation requested for upload " + describe());
                return true;
            }
            markCancelled(false);
            return true;
        }
    }

    void validate() throws UploadValidationException {
        if (file.getSize() <= resumableThreshold) {
            throw new UploadValidationException(file.getFileName(), String.format(
                    "File is %d bytes; resumable upload requires more than %d bytes",
                    file.getSize(), resumableThreshold));
        }
    }

    /**
     * @return {@code false} if a scheduled run finds its session already cancelled
     */
    private boolean enterLoop(String operation, boolean queued) {
        synchronized (lifecycleLock) {
            if (session.getStatus().isTerminal()) {
                if (queued && context.isCancelled()) {
                    return false;
                }
                throw new IllegalStateException("Cannot " + operation + " upload " + describe()
                        + " in terminal status " + session.getStatus());
            }
            if (!context.enterLoop()) {
                throw new IllegalStateException("Upload " + describe() + " is already running");
            }
            return true;
        }
    }

    /**
     * Leave the loop under the lifecycle lock. A cancel accepted while the loop was running
     * but not observed by it turns a PAUSED outcome into the cancelled one.
     */
    private UploadResult releaseLoop(UploadResult result) {
        synchronized (lifecycleLock) {
            context.exitLoop();
            context.clearPause();
            if (result == null || result.getFinalStatus() != UploadStatus.PAUSED || !context.isCancelled()) {
                return result;
            }
            markCancelled(false);
            return UploadResult.builder()
                    .uploadId(session.getUploadId())
                    .sessionId(session.getSessionId())
                    .finalStatus(UploadStatus.FAILED)
                    .offset(session.getOffset())
                    .totalSize(session.getTotalSize())
                    .bytesTransferred(result.getBytesTransferred())
                    .startTime(result.getStartTime().orElse(null))
                    .endTime(Instant.now())
                    .errorMessage(CANCELLED_MESSAGE)
                    .build();
        }
    }

    private UploadResult cancelledResult() {
        Instant now = Instant.now();
        return buildResult(UploadStatus.FAILED, now, session.getOffset(), CANCELLED_MESSAGE, null);
    }

    private UploadResult runTransferLoop(Instant runStart) throws UploadException {
        long runStartOffset = session.getOffset();

        while (!session.isFullyTransferred()) {
            if (context.isCancelled()) {
                markCancelled(true);
                return buildResult(UploadStatus.FAILED, runStart, runStartOffset, CANCELLED_MESSAGE, null);
            }
            if (context.isPauseRequested()) {
                changeStatus(UploadStatus.PAUSED);
                metrics.recordUploadPaused(api.getProtocolName());
                logger.info(String.format("Upload session %s paused at offset %d of %d",
                        session.getSessionId(), session.getOffset(), session.getTotalSize()));
                return buildResult(UploadStatus.PAUSED, runStart, runStartOffset, null, null);
            }

            long offset = session.getOffset();
            long chunkStart = System.nanoTime();
            long nextOffset;
            try {
                nextOffset = transmitter.send(session.getSessionId(), offset, session.getTotalSize(),
                        session.getChunkSize(), file);
            } catch (ChunkTransferException e) {
                fail(e, "chunk");
                throw e;
            }
            session.advanceOffset(nextOffset);
            metrics.recordChunk(api.getProtocolName(), nextOffset - offset,
                    (System.nanoTime() - chunkStart) / 1_000_000_000.0);
            logger.fine(String.format("Session %s: chunk %d confirmed, offset %d of %d",
                    session.getSessionId(), session.getChunksSent(), nextOffset, session.getTotalSize()));
            progressReporter.report(session);
        }

        if (context.isCancelled()) {
            markCancelled(true);
            return buildResult(UploadStatus.FAILED, runStart, runStartOffset, CANCELLED_MESSAGE, null);
        }
        return finalizeUpload(runStart, runStartOffset);
    }

    private UploadResult finalizeUpload(Instant runStart, long runStartOffset) throws FinalizationException {
        String sessionId = session.getSessionId();
        boolean finished;
        try {
            finished = api.finishSession(sessionId, session.getTitle(), session.getDescription());
        } catch (UploadApiException | RuntimeException e) {
            FinalizationException failure = new FinalizationException(sessionId, session.getOffset(),
                    "Finish call failed: " + e.getMessage(), e);
            fail(failure, "finalize");
            throw failure;
        }
        if (!finished) {
            FinalizationException failure = new FinalizationException(sessionId, session.getOffset(),
                    "Server did not confirm the finished upload");
            fail(failure, "finalize");
            throw failure;
        }

        changeStatus(UploadStatus.COMPLETED);
        metrics.recordUploadCompleted(api.getProtocolName());
        UploadResult result = buildResult(UploadStatus.COMPLETED, runStart, runStartOffset, null, null);
        logger.info(String.format("Upload session %s completed: %d bytes in %d chunks",
                sessionId, session.getTotalSize(), session.getChunksSent()));
        publisher.publishCompleted(result);
        return result;
    }

    private SessionCreationException failSessionCreation(String message, Throwable cause) {
        SessionCreationException failure = new SessionCreationException(message, cause);
        fail(failure, "session_creation");
        return failure;
    }

    private void fail(UploadException failure, String errorType) {
        boolean wasTransferring = session.getStatus() == UploadStatus.UPLOADING;
        session.recordError(failure.getMessage());
        changeStatus(UploadStatus.FAILED);
        metrics.recordUploadFailed(api.getProtocolName(), errorType, wasTransferring);
        logger.log(Level.SEVERE, failure.getMessage(), failure.getCause());
        publisher.publishFailed(failure);
    }

    private void markCancelled(boolean wasTransferring) {
        session.recordError(CANCELLED_MESSAGE);
        changeStatus(UploadStatus.FAILED);
        metrics.recordUploadFailed(api.getProtocolName(), "cancelled", wasTransferring);
        logger.info(String.format("Upload %s cancelled at offset %d of %d",
                describe(), session.getOffset(), session.getTotalSize()));
    }

    private void changeStatus(UploadStatus target) {
        UploadStatus from;
        try {
            from = session.transitionTo(target);
        } catch (InvalidTransitionException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
        publisher.publishStatusChanged(session, from, target);
    }

    private UploadResult buildResult(UploadStatus status, Instant runStart, long runStartOffset,
                                     String errorMessage, Throwable cause) {
        return UploadResult.builder()
                .uploadId(session.getUploadId())
                .sessionId(session.getSessionId())
                .finalStatus(status)
                .offset(session.getOffset())
                .totalSize(session.getTotalSize())
                .bytesTransferred(session.getOffset() - runStartOffset)
                .startTime(runStart)
                .endTime(Instant.now())
                .errorMessage(errorMessage)
                .cause(cause)
                .build();
    }

    private String describe() {
        return session.getSessionId() != null ? session.getSessionId() : session.getUploadId();
    }

    /**
     * Move a freshly attached session from IDLE to PAUSED.
     */
    void markAttached() {
        changeStatus(UploadStatus.PAUSED);
    }

    /**
     * Publish the current position without sending anything. Used after resume negotiation.
     */
    UploadProgress reportProgress() {
        return progressReporter.report(session);
    }

    // ========== ACCESSORS ==========

    public UploadSession getSession() {
        return session;
    }

    public String getUploadId() {
        return session.getUploadId();
    }

    public String getSessionId() {
        return session.getSessionId();
    }

    public UploadStatus getStatus() {
        return session.getStatus();
    }

    public MediaFile getMediaFile() {
        return file;
    }

    /**
     * @return the most recent progress event, or null before the first one
     */
    public UploadProgress getLastProgress() {
        return progressReporter.getLastProgress();
    }

    public boolean isRunning() {
        return context.isRunning();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ResumableUploadApi api;
        private UploadRequest request;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private long resumableThreshold = DEFAULT_RESUMABLE_THRESHOLD;
        private UploadEventPublisher publisher;
        private UploadListener listener;
        private UploadTelemetryMetrics metrics;

        public Builder api(ResumableUploadApi api) {
            this.api = api;
            return this;
        }

        public Builder request(UploadRequest request) {
            this.request = request;
            return this;
        }

        /**
         * Chunk size used when the request carries no override.
         */
        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder resumableThreshold(long resumableThreshold) {
            this.resumableThreshold = resumableThreshold;
            return this;
        }

        public Builder configuration(UplinkConfiguration configuration) {
            this.chunkSize = configuration.getChunkSize();
            this.resumableThreshold = configuration.getResumableThreshold();
            return this;
        }

        public Builder listener(UploadListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder metrics(UploadTelemetryMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        Builder publisher(UploadEventPublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        public UploadController build() {
            Objects.requireNonNull(request, "Upload request cannot be null");
            MediaFile file = request.getMediaFile();
            int effectiveChunkSize = request.hasChunkSizeOverride() ? request.getChunkSize() : chunkSize;
            UploadSession session = new UploadSession(request.getUploadId(), file.getFileName(),
                    file.getSize(), effectiveChunkSize, request.getTitle(), request.getDescription());
            UploadEventPublisher events = publisher != null ? publisher : new UploadEventPublisher();
            if (listener != null) {
                events.addListener(listener);
            }
            return new UploadController(api, file, session, resumableThreshold, events, metrics);
        }
    }
}
