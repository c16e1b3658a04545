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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans upload events out to registered {@link UploadListener}s.
 * A failing listener is logged and skipped.
 */
public class UploadEventPublisher {
    private static final Logger logger = Logger.getLogger(UploadEventPublisher.class.getName());

    private final List<UploadListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(UploadListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(UploadListener listener) {
        listeners.remove(listener);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    void publishProgress(UploadProgress progress) {
        dispatch("onProgress", listener -> listener.onProgress(progress));
    }

    void publishStatusChanged(UploadSession session, UploadStatus from, UploadStatus to) {
        dispatch("onStatusChanged", listener -> listener.onStatusChanged(session, from, to));
    }

    void publishCompleted(UploadResult result) {
        dispatch("onCompleted", listener -> listener.onCompleted(result));
    }

    void publishFailed(UploadException error) {
        dispatch("onFailed", listener -> listener.onFailed(error));
    }

    private void dispatch(String event, Consumer<UploadListener> call) {
        for (UploadListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Upload listener " + listener + " failed in " + event, e);
            }
        }
    }
}
