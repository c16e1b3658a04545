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
 * The server could not report the state of an existing session, or reported a state
 * that cannot be resumed. No controller is attached.
 */
public class ResumeNegotiationException extends UploadException {

    public ResumeNegotiationException(String sessionId, String message) {
        super(sessionId, -1, UploadStatus.IDLE, message);
    }

    public ResumeNegotiationException(String sessionId, String message, Throwable cause) {
        super(sessionId, -1, UploadStatus.IDLE, message, cause);
    }
}
