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


import dev.mars.uplink.core.UploadResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Engine-side bookkeeping for one tracked upload.
 */
class UploadHandle {
    private final UploadController controller;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile CompletableFuture<UploadResult> currentRun;

    UploadHandle(UploadController controller) {
        this.controller = controller;
    }

    UploadController getController() {
        return controller;
    }

    String getUploadId() {
        return controller.getUploadId();
    }

    boolean matches(String id) {
        return id.equals(controller.getUploadId()) || id.equals(controller.getSessionId());
    }

    /**
     * @return {@code false} if a run is already scheduled for this upload
     */
    boolean beginRun(CompletableFuture<UploadResult> future) {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        this.currentRun = future;
        return true;
    }

    void endRun() {
        running.set(false);
    }

    boolean isRunning() {
        return running.get();
    }

    CompletableFuture<UploadResult> getCurrentRun() {
        return currentRun;
    }
}
