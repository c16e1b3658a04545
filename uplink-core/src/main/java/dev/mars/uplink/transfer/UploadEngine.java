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
import dev.mars.uplink.core.UploadRequest;
import dev.mars.uplink.core.UploadResult;
import dev.mars.uplink.core.exceptions.ResumeNegotiationException;
import dev.mars.uplink.core.exceptions.UploadValidationException;

import java.util.concurrent.CompletableFuture;

/**
 * Caller-facing interface for running resumable uploads in the background.
 *
 * <p>Uploads are addressed by id. Either the local upload id from the {@link UploadRequest}
 * or the server-issued session id is accepted once the server has issued one.</p>
 */
public interface UploadEngine {

    /**
     * Validate the request and start the upload asynchronously.
     *
     * @return a future that completes with a COMPLETED or PAUSED result (FAILED for a
     *         cancellation), or exceptionally with the {@code UploadException} that ended the upload
     * @throws UploadValidationException if the file does not qualify for resumable upload
     * @throws IllegalStateException if the engine is shut down or at capacity
     */
    CompletableFuture<UploadResult> startUpload(UploadRequest request) throws UploadValidationException;

    /**
     * Continue a PAUSED upload tracked by this engine.
     *
     * @throws IllegalArgumentException if no such upload is tracked
     * @throws IllegalStateException if the upload is not PAUSED, or the engine is shut down or at capacity
     */
    CompletableFuture<UploadResult> resumeUpload(String id);

    /**
     * Negotiate with the server and continue an upload session created earlier, possibly by
     * another process.
     *
     * @throws ResumeNegotiationException if the server cannot report the session
     */
    CompletableFuture<UploadResult> resumeSession(String sessionId, MediaFile file, String title, String description)
            throws ResumeNegotiationException;

    /**
     * @return {@code true} if a running or scheduled upload will pause at its next chunk boundary
     */
    boolean pauseUpload(String id);

    /**
     * A scheduled run cancelled before its loop starts completes with the cancelled FAILED result.
     *
     * @return {@code true} if the upload was cancelled or will stop at its next chunk boundary
     */
    boolean cancelUpload(String id);

    /**
     * @return the tracked session, or null if unknown or already finished
     */
    UploadSession getSession(String id);

    int getActiveUploadCount();

    void addListener(UploadListener listener);

    void removeListener(UploadListener listener);

    /**
     * Pause running uploads and stop accepting new ones.
     *
     * @return {@code true} if every loop stopped within the timeout
     */
    boolean shutdown(long timeoutSeconds);
}
