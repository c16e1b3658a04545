package dev.mars.uplink.protocol;

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


import dev.mars.uplink.core.exceptions.UploadApiException;

/**
 * Server-side contract of the resumable upload protocol.
 * Implementations handle the wire format; the upload client only relies on the
 * semantics below.
 *
 * <p>Every call is a blocking round trip. Callers invoke it from a worker thread,
 * never from an event loop.</p>
 */
public interface ResumableUploadApi {

    /**
     * Open a new upload session.
     *
     * @param fileName    name of the file being uploaded
     * @param totalSize   total size in bytes
     * @param title       optional post title, may be null
     * @param description optional post description, may be null
     * @return the server-issued session id
     * @throws UploadApiException if the server refuses the session or cannot be reached
     */
    String startSession(String fileName, long totalSize, String title, String description)
            throws UploadApiException;

    /**
     * Send one contiguous byte range starting at {@code startOffset}.
     *
     * @return the next offset the server expects. This is authoritative and may differ from
     *         {@code startOffset + bytes.length} when the server accepted only part of the
     *         range or already held more of it.
     * @throws UploadApiException on any transport or server error
     */
    long transferChunk(String sessionId, long startOffset, byte[] bytes) throws UploadApiException;

    /**
     * Turn the committed bytes into a publishable object.
     *
     * @return {@code true} if the server reported success
     * @throws UploadApiException on any transport or server error
     */
    boolean finishSession(String sessionId, String title, String description) throws UploadApiException;

    /**
     * Report the committed offset and file identity of an existing session.
     *
     * @throws UploadApiException if the session is unknown or the server cannot be reached
     */
    SessionStatus querySession(String sessionId) throws UploadApiException;

    /**
     * Get the protocol name/identifier
     */
    String getProtocolName();
}
