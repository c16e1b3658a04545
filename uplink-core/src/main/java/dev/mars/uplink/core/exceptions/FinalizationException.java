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
 * All bytes were committed but the finish call failed, so no publishable object exists.
 * Terminal: the bytes stay on the server until its session timeout removes them.
 */
public class FinalizationException extends UploadException {

    public FinalizationException(String sessionId, long offset, String message) {
        super(sessionId, offset, UploadStatus.UPLOADING, message);
    }

    public FinalizationException(String sessionId, long offset, String message, Throwable cause) {
        super(sessionId, offset, UploadStatus.UPLOADING, message, cause);
    }
}
