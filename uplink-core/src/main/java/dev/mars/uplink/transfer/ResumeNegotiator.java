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


import dev.mars.uplink.core.MediaFile;
import dev.mars.uplink.core.UploadProgress;
import dev.mars.uplink.core.UploadStatus;
import dev.mars.uplink.core.exceptions.ResumeNegotiationException;
import dev.mars.uplink.core.exceptions.UploadApiException;
import dev.mars.uplink.protocol.ResumableUploadApi;
import dev.mars.uplink.protocol.SessionStatus;
import dev.mars.uplink.transfer.observability.UploadTelemetryMetrics;

import java.util.Objects;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Re-attaches to an existing server session after an interruption.
 *
 * <p>The server is asked how many bytes it has committed. A new {@link UploadController} is
 * returned in PAUSED state at that offset; calling {@link UploadController#resume()} continues
 * the chunk loop from there. The server's file name and size are authoritative.</p>
 *
 * <p>The re-supplied file is trusted to be the same bytes as the original. A differing name or
 * size is logged but not rejected, and no content check is made.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ResumeNegotiator {
    private static final Logger logger = Logger.getLogger(ResumeNegotiator.class.getName());

    private final ResumableUploadApi api;
    private final int chunkSize;
    private final UploadEventPublisher publisher;
    private final UploadTelemetryMetrics metrics;

    public ResumeNegotiator(ResumableUploadApi api) {
        this(api, UploadController.DEFAULT_CHUNK_SIZE, new UploadEventPublisher(), null);
    }

    public ResumeNegotiator(ResumableUploadApi api, int chunkSize, UploadEventPublisher publisher,
                            UploadTelemetryMetrics metrics) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        this.api = Objects.requireNonNull(api, "Upload API cannot be null");
        this.chunkSize = chunkSize;
        this.publisher = publisher != null ? publisher : new UploadEventPublisher();
        this.metrics = metrics;
    }

    public UploadController resume(String sessionId, MediaFile file) throws ResumeNegotiationException {
        return resume(sessionId, file, null, null);
    }

    /**
     * Query the server for the session and build a PAUSED controller at the committed offset.
     *
     * @param title       post title forwarded to the finish call, may be null
     * @param description post description forwarded to the finish call, may be null
     * @throws ResumeNegotiationException if the query fails or the server reports an unusable status
     */
    public UploadController resume(String sessionId, MediaFile file, String title, String description)
            throws ResumeNegotiationException {
        return resume(UUID.randomUUID().toString(), sessionId, file, title, description);
    }

    UploadController resume(String uploadId, String sessionId, MediaFile file, String title, String description)
            throws ResumeNegotiationException {
        Objects.requireNonNull(file, "Media file cannot be null");
        if (sessionId == null || sessionId.isBlank()) {
            throw new ResumeNegotiationException(sessionId, "Session id is required to resume an upload");
        }

        SessionStatus status;
        try {
            status = api.querySession(sessionId);
        } catch (UploadApiException | RuntimeException e) {
            throw new ResumeNegotiationException(sessionId, "Session status query failed: " + e.getMessage(), e);
        }
        validateStatus(sessionId, status);
        warnOnMismatch(sessionId, status, file);

        String fileName = status.getFileName() != null ? status.getFileName() : file.getFileName();
        UploadSession session = UploadSession.attach(uploadId, sessionId, fileName, status.getFileSize(),
                status.getStartOffset(), chunkSize, title, description);

        UploadController controller = new UploadController(api, file, session, 0L, publisher, metrics);
        controller.markAttached();
        UploadProgress progress = controller.reportProgress();

        logger.info(String.format("Negotiated resume of session %s: %d of %d bytes committed (%d%%)",
                sessionId, status.getStartOffset(), status.getFileSize(), progress.getPercent()));
        return controller;
    }

    private static void validateStatus(String sessionId, SessionStatus status) throws ResumeNegotiationException {
        if (status == null) {
            throw new ResumeNegotiationException(sessionId, "Server returned no session status");
        }
        if (status.getFileSize() <= 0) {
            throw new ResumeNegotiationException(sessionId,
                    "Server reported invalid file size " + status.getFileSize());
        }
        if (status.getStartOffset() < 0 || status.getStartOffset() > status.getFileSize()) {
            throw new ResumeNegotiationException(sessionId, String.format(
                    "Server reported offset %d outside [0, %d]", status.getStartOffset(), status.getFileSize()));
        }
    }

    private static void warnOnMismatch(String sessionId, SessionStatus status, MediaFile file) {
        if (file.getSize() != status.getFileSize()) {
            logger.warning(String.format("Session %s: local file %s is %d bytes but the server expects %d",
                    sessionId, file.getFileName(), file.getSize(), status.getFileSize()));
        }
        if (status.getFileName() != null && !status.getFileName().equals(file.getFileName())) {
            logger.warning(String.format("Session %s: local file name %s differs from server file name %s",
                    sessionId, file.getFileName(), status.getFileName()));
        }
    }
}
