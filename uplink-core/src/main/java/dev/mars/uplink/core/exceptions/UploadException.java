package dev.mars.uplink.core.exceptions;

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

/**
 * Exception thrown when a resumable upload fails after validation passed.
 *
 * <p>Carries the context a caller needs to decide between a fresh upload and a
 * negotiated resume: the server session id (null if the session was never created),
 * the last server-confirmed offset and the status the session was in when the
 * failure happened. The session itself is FAILED once this exception is raised.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class UploadException extends UplinkException {
    
    private final String sessionId;
    private final long offset;
    private final UploadStatus statusAtFailure;
    
    public UploadException(String sessionId, long offset, UploadStatus statusAtFailure, String message) {
        super(message);
        this.sessionId = sessionId;
        this.offset = offset;
        this.statusAtFailure = statusAtFailure;
    }
    
    public UploadException(String sessionId, long offset, UploadStatus statusAtFailure,
                           String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
        this.offset = offset;
        this.statusAtFailure = statusAtFailure;
    }
    
    public String getSessionId() {
        return sessionId;
    }

    /**
     * @return last offset confirmed by the server before the failure
     */
    public long getOffset() {
        return offset;
    }

    public UploadStatus getStatusAtFailure() {
        return statusAtFailure;
    }
    
    @Override
    public String getMessage() {
        if (sessionId == null) {
            return "Upload failed before a session was created: " + super.getMessage();
        }
        return String.format("Upload session %s failed at offset %d (%s): %s",
                sessionId, offset, statusAtFailure, super.getMessage());
    }
}
