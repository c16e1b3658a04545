package dev.mars.uplink.core;

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


/**
 * Lifecycle states of a resumable upload session.
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * IDLE → UPLOADING → {COMPLETED | FAILED}
 *   ↓        ↓ ↑          ↑
 *   ↓     PAUSED ─────────┘
 *   └──→ PAUSED (attached by resume negotiation)
 * </pre>
 *
 * <h3>State Transition Rules:</h3>
 * <ul>
 *   <li>Every new session starts in IDLE</li>
 *   <li>IDLE can transition to UPLOADING, to PAUSED (re-attached to an existing server session)
 *       or to FAILED (the server refused to create the session, or the caller cancelled)</li>
 *   <li>UPLOADING can transition to PAUSED, COMPLETED or FAILED</li>
 *   <li>PAUSED can transition back to UPLOADING or be abandoned to FAILED</li>
 *   <li>COMPLETED and FAILED are terminal states</li>
 * </ul>
 *
 * <p>A FAILED session is never retried in place. The caller either starts a fresh upload or,
 * when the server-side session survived, negotiates a resume which attaches a new controller.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum UploadStatus {

    /**
     * Session descriptor exists locally but no server session has been requested yet.
     */
    IDLE,

    /**
     * The transfer loop is running. At most one chunk is in flight.
     */
    UPLOADING,

    /**
     * The transfer loop stopped at a chunk boundary and can be continued from the
     * server-confirmed offset.
     */
    PAUSED,

    /**
     * Every byte was acknowledged and the server turned the session into a publishable object.
     */
    COMPLETED,

    /**
     * The upload was abandoned: start rejected, chunk failure, finalization failure or cancellation.
     */
    FAILED;

    /**
     * @return {@code true} for COMPLETED and FAILED
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * @return {@code true} if a transfer loop is running or can be continued
     */
    public boolean isActive() {
        return this == UPLOADING || this == PAUSED;
    }

    /**
     * Only a paused session can continue within the same controller.
     *
     * @return {@code true} if the transfer loop may be re-entered
     */
    public boolean canResume() {
        return this == PAUSED;
    }

    /**
     * Checks whether a transition from this status to the given target status is valid.
     *
     * <p><strong>Valid transitions:</strong></p>
     * <pre>
     *   IDLE      → UPLOADING, PAUSED, FAILED
     *   UPLOADING → PAUSED, COMPLETED, FAILED
     *   PAUSED    → UPLOADING, FAILED
     *   COMPLETED → (terminal)
     *   FAILED    → (terminal)
     * </pre>
     *
     * @param target the target status
     * @return {@code true} if the transition is valid
     */
    public boolean canTransitionTo(UploadStatus target) {
        return switch (this) {
            case IDLE -> target == UPLOADING || target == PAUSED || target == FAILED;
            case UPLOADING -> target == PAUSED || target == COMPLETED || target == FAILED;
            case PAUSED -> target == UPLOADING || target == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    /**
     * Returns all valid target statuses that this status can transition to.
     *
     * @return array of valid target statuses (empty for terminal states)
     */
    public UploadStatus[] getValidTransitions() {
        return switch (this) {
            case IDLE -> new UploadStatus[]{UPLOADING, PAUSED, FAILED};
            case UPLOADING -> new UploadStatus[]{PAUSED, COMPLETED, FAILED};
            case PAUSED -> new UploadStatus[]{UPLOADING, FAILED};
            case COMPLETED, FAILED -> new UploadStatus[0];
        };
    }
}
