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
import dev.mars.uplink.core.UploadResult;
import dev.mars.uplink.core.UploadStatus;
import dev.mars.uplink.core.exceptions.UploadException;

/**
 * Subscription for upload events. All methods default to no-ops so callers
 * implement only what they display.
 *
 * <p>Callbacks run on the thread driving the upload loop. A callback that throws is
 * logged and does not affect the upload.</p>
 */
public interface UploadListener {

    /**
     * Called after every acknowledged chunk and after a resume was negotiated.
     */
    default void onProgress(UploadProgress progress) {
    }

    default void onStatusChanged(UploadSession session, UploadStatus from, UploadStatus to) {
    }

    default void onCompleted(UploadResult result) {
    }

    /**
     * Called once when an upload fails. Not called for caller-initiated cancellation.
     */
    default void onFailed(UploadException error) {
    }
}
