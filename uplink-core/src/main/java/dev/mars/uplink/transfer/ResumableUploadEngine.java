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


import dev.mars.uplink.config.UplinkConfiguration;
import dev.mars.uplink.core.MediaFile;
import dev.mars.uplink.core.UploadProgress;
import dev.mars.uplink.core.UploadRequest;
import dev.mars.uplink.core.UploadResult;
import dev.mars.uplink.core.UploadStatus;
import dev.mars.uplink.core.exceptions.ResumeNegotiationException;
import dev.mars.uplink.core.exceptions.SessionStoreException;
import dev.mars.uplink.core.exceptions.UplinkException;
import dev.mars.uplink.core.exceptions.UploadValidationException;
import dev.mars.uplink.protocol.ResumableUploadApi;
import dev.mars.uplink.storage.InMemoryUploadSessionStore;
import dev.mars.uplink.storage.StoredSession;
import dev.mars.uplink.storage.UploadSessionStore;
import dev.mars.uplink.transfer.observability.UploadTelemetryMetrics;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs upload controllers on a worker pool and tracks them until they finish.
 *
 * <p>Each start or resume occupies one worker thread for as long as the chunk loop runs.
 * Paused uploads stay tracked without holding a thread, so they can be resumed by id.
 * Uploads that reach COMPLETED or FAILED are dropped from tracking. Every status change and
 * progress event is mirrored into the {@link UploadSessionStore}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ResumableUploadEngine implements UploadEngine {
    private static final Logger logger = Logger.getLogger(ResumableUploadEngine.class.getName());

    private final ResumableUploadApi api;
    private final UploadSessionStore sessionStore;
    private final UploadTelemetryMetrics metrics;
    private final UploadEventPublisher publisher;
    private final ResumeNegotiator negotiator;
    private final ExecutorService executorService;
    private final ConcurrentHashMap<String, UploadHandle> handles;
    private final AtomicBoolean shutdown;

    private final int chunkSize;
    private final long resumableThreshold;
    private final int maxConcurrentUploads;

    public ResumableUploadEngine(ResumableUploadApi api) {
        this(api, new UplinkConfiguration(new Properties()));
    }

    public ResumableUploadEngine(ResumableUploadApi api, UplinkConfiguration configuration) {
        this(api, configuration, new InMemoryUploadSessionStore(),
                configuration.isTelemetryEnabled() ? UploadTelemetryMetrics.getInstance() : UploadTelemetryMetrics.noop());
    }

    public ResumableUploadEngine(ResumableUploadApi api, UplinkConfiguration configuration,
                                 UploadSessionStore sessionStore, UploadTelemetryMetrics metrics) {
        this.api = Objects.requireNonNull(api, "Upload API cannot be null");
        this.sessionStore = Objects.requireNonNull(sessionStore, "Session store cannot be null");
        this.metrics = metrics != null ? metrics : UploadTelemetryMetrics.noop();
        this.chunkSize = configuration.getChunkSize();
        this.resumableThreshold = configuration.getResumableThreshold();
        this.maxConcurrentUploads = configuration.getMaxConcurrentUploads();

        this.publisher = new UploadEventPublisher();
        this.publisher.addListener(new SessionStoreSync());
        this.negotiator = new ResumeNegotiator(api, chunkSize, publisher, this.metrics);

        AtomicInteger threadCount = new AtomicInteger();
        this.executorService = new ThreadPoolExecutor(
                maxConcurrentUploads,
                maxConcurrentUploads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r, "uplink-upload-" + threadCount.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }
        );
        this.handles = new ConcurrentHashMap<>();
        this.shutdown = new AtomicBoolean(false);

        purgeOldSessions(configuration.getStoreMaxAgeMs());
        logger.info("ResumableUploadEngine initialized with " + maxConcurrentUploads
                + " max concurrent uploads, chunk size " + chunkSize);
    }

    @Override
    public CompletableFuture<UploadResult> startUpload(UploadRequest request) throws UploadValidationException {
        checkAccepting();
        UploadController controller = UploadController.builder()
                .api(api)
                .request(request)
                .chunkSize(chunkSize)
                .resumableThreshold(resumableThreshold)
                .metrics(metrics)
                .publisher(publisher)
                .build();
        controller.validate();

        UploadHandle handle = new UploadHandle(controller);
        if (handles.putIfAbsent(handle.getUploadId(), handle) != null) {
            throw new IllegalStateException("Upload " + handle.getUploadId() + " is already tracked");
        }
        logger.info("Upload submitted: " + handle.getUploadId() + " (" + request.getMediaFile().getFileName() + ")");
        return submit(handle, () -> controller.start(true));
    }

    @Override
    public CompletableFuture<UploadResult> resumeUpload(String id) {
        checkAccepting();
        UploadHandle handle = resolve(id)
                .orElseThrow(() -> new IllegalArgumentException("No tracked upload with id " + id));
        UploadController controller = handle.getController();
        if (!controller.getStatus().canResume() || handle.isRunning()) {
            throw new IllegalStateException("Upload " + id + " cannot resume from " + controller.getStatus());
        }
        return submit(handle, () -> controller.resume(true));
    }

    @Override
    public CompletableFuture<UploadResult> resumeSession(String sessionId, MediaFile file,
                                                        String title, String description)
            throws ResumeNegotiationException {
        checkAccepting();
        if (sessionId != null && resolve(sessionId).isPresent()) {
            throw new IllegalStateException("Session " + sessionId + " is already tracked; use resumeUpload");
        }

        Optional<StoredSession> stored = findStored(sessionId);
        String uploadId = stored.map(StoredSession::getUploadId).orElse(UUID.randomUUID().toString());
        String effectiveTitle = title != null ? title : stored.map(StoredSession::getTitle).orElse(null);
        String effectiveDescription = description != null
                ? description : stored.map(StoredSession::getDescription).orElse(null);

        UploadController controller = negotiator.resume(uploadId, sessionId, file, effectiveTitle, effectiveDescription);
        UploadHandle handle = new UploadHandle(controller);
        handles.put(handle.getUploadId(), handle);
        return submit(handle, () -> controller.resume(true));
    }

    /**
     * Pause a running upload at its next chunk boundary. An upload whose run is still waiting
     * for a worker is paused as soon as its loop starts.
     */
    @Override
    public boolean pauseUpload(String id) {
        return resolve(id).map(this::pause).orElse(false);
    }

    @Override
    public boolean cancelUpload(String id) {
        Optional<UploadHandle> handle = resolve(id);
        if (handle.isEmpty()) {
            return false;
        }
        boolean cancelled = handle.get().getController().cancel();
        if (cancelled && !handle.get().isRunning()) {
            handles.remove(handle.get().getUploadId());
        }
        return cancelled;
    }

    @Override
    public UploadSession getSession(String id) {
        return resolve(id).map(handle -> handle.getController().getSession()).orElse(null);
    }

    /**
     * @return the progress last reported for the upload, if any
     */
    public Optional<UploadProgress> getLastProgress(String id) {
        return resolve(id).map(handle -> handle.getController().getLastProgress());
    }

    /**
     * Sessions that the store still lists as resumable, for example after a restart.
     */
    public List<StoredSession> listResumableSessions() throws SessionStoreException {
        return sessionStore.findResumable();
    }

    @Override
    public int getActiveUploadCount() {
        return (int) handles.values().stream().filter(UploadHandle::isRunning).count();
    }

    /**
     * @return number of uploads tracked, including paused ones
     */
    public int getTrackedUploadCount() {
        return handles.size();
    }

    @Override
    public void addListener(UploadListener listener) {
        publisher.addListener(listener);
    }

    @Override
    public void removeListener(UploadListener listener) {
        publisher.removeListener(listener);
    }

    public UploadSessionStore getSessionStore() {
        return sessionStore;
    }

    @Override
    public boolean shutdown(long timeoutSeconds) {
        if (shutdown.getAndSet(true)) {
            return true;
        }

        logger.info("Shutting down upload engine...");

        // Running uploads stop at a chunk boundary and stay resumable on the server.
        handles.values().stream()
                .filter(UploadHandle::isRunning)
                .forEach(this::pause);

        executorService.shutdown();

        try {
            boolean terminated = executorService.awaitTermination(timeoutSeconds, TimeUnit.SECONDS);
            if (!terminated) {
                logger.warning("Upload engine shutdown timed out, forcing shutdown");
                executorService.shutdownNow();
                return false;
            }
            logger.info("Upload engine shutdown completed");
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
            return false;
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    private CompletableFuture<UploadResult> submit(UploadHandle handle, UploadRun run) {
        if (getActiveUploadCount() >= maxConcurrentUploads) {
            dropIfIdle(handle);
            throw new IllegalStateException("Maximum concurrent uploads reached (" + maxConcurrentUploads + ")");
        }
        CompletableFuture<UploadResult> future = new CompletableFuture<>();
        if (!handle.beginRun(future)) {
            throw new IllegalStateException("Upload " + handle.getUploadId() + " is already running");
        }

        executorService.execute(() -> {
            UploadResult result = null;
            Throwable failure = null;
            try {
                result = run.execute();
            } catch (UplinkException e) {
                failure = e;
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Upload execution failed for " + handle.getUploadId(), e);
                failure = e;
            } finally {
                handle.endRun();
                if (handle.getController().getStatus().isTerminal()) {
                    handles.remove(handle.getUploadId());
                }
            }
            if (failure != null) {
                future.completeExceptionally(failure);
            } else {
                future.complete(result);
            }
        });
        return future;
    }

    private boolean pause(UploadHandle handle) {
        UploadController controller = handle.getController();
        if (controller.pause()) {
            return true;
        }
        return handle.isRunning() && controller.pauseBeforeRun();
    }

    private void dropIfIdle(UploadHandle handle) {
        if (handle.getController().getStatus() == UploadStatus.IDLE) {
            handles.remove(handle.getUploadId());
        }
    }

    private void checkAccepting() {
        if (shutdown.get()) {
            throw new IllegalStateException("Upload engine is shut down");
        }
    }

    private Optional<UploadHandle> resolve(String id) {
        if (id == null) {
            return Optional.empty();
        }
        UploadHandle direct = handles.get(id);
        if (direct != null) {
            return Optional.of(direct);
        }
        return handles.values().stream().filter(handle -> handle.matches(id)).findFirst();
    }

    private Optional<StoredSession> findStored(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        try {
            return sessionStore.find(sessionId);
        } catch (SessionStoreException e) {
            logger.log(Level.WARNING, "Could not read stored session " + sessionId, e);
            return Optional.empty();
        }
    }

    private void purgeOldSessions(long maxAgeMs) {
        try {
            int removed = sessionStore.cleanupTerminal(maxAgeMs);
            if (removed > 0) {
                logger.info("Purged " + removed + " old terminal upload sessions");
            }
        } catch (SessionStoreException e) {
            logger.log(Level.WARNING, "Failed to purge old upload sessions", e);
        }
    }

    @FunctionalInterface
    private interface UploadRun {
        UploadResult execute() throws UplinkException;
    }

    /**
     * Mirrors status changes and confirmed offsets into the session store.
     */
    private class SessionStoreSync implements UploadListener {

        @Override
        public void onStatusChanged(UploadSession session, UploadStatus from, UploadStatus to) {
            save(session);
        }

        @Override
        public void onProgress(UploadProgress progress) {
            resolve(progress.getSessionId()).ifPresent(handle -> save(handle.getController().getSession()));
        }

        private void save(UploadSession session) {
            if (session.getSessionId() == null) {
                return;
            }
            try {
                sessionStore.save(StoredSession.from(session));
            } catch (SessionStoreException e) {
                logger.log(Level.WARNING, "Failed to persist upload session " + session.getSessionId(), e);
            }
        }
    }
}
