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


import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Control flags shared between the thread running an upload loop and the threads
 * asking it to pause or cancel. The loop reads the flags only at chunk boundaries.
 */
class UploadContext {
    private final AtomicBoolean pauseRequested = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);

    boolean isPauseRequested() {
        return pauseRequested.get();
    }

    void requestPause() {
        pauseRequested.set(true);
    }

    void clearPause() {
        pauseRequested.set(false);
    }

    boolean isCancelled() {
        return cancelled.get();
    }

    void cancel() {
        cancelled.set(true);
    }

    boolean isRunning() {
        return running.get();
    }

    /**
     * @return {@code false} if a loop is already running for this upload
     */
    boolean enterLoop() {
        return running.compareAndSet(false, true);
    }

    void exitLoop() {
        running.set(false);
    }
}
