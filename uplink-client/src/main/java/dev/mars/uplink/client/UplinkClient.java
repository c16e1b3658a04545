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

package dev.mars.uplink.client;

import dev.mars.uplink.config.UplinkConfiguration;
import dev.mars.uplink.core.PathMediaFile;
import dev.mars.uplink.core.UploadRequest;
import dev.mars.uplink.core.UploadResult;
import dev.mars.uplink.core.exceptions.ResumeNegotiationException;
import dev.mars.uplink.core.exceptions.SessionStoreException;
import dev.mars.uplink.core.exceptions.UploadValidationException;
import dev.mars.uplink.storage.UploadSessionStore;
import dev.mars.uplink.transfer.ResumableUploadEngine;
import dev.mars.uplink.transfer.UploadEngine;
import dev.mars.uplink.transfer.UploadListener;
import dev.mars.uplink.transfer.observability.UploadTelemetryMetrics;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point that wires configuration, the HTTP binding and the upload engine together.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * try (UplinkClient client = UplinkClient.create(vertx, new UplinkConfiguration())) {
 *     client.addListener(listener);
 *     UploadResult result = client.upload(Paths.get("/videos/keynote.mp4"), "Keynote", null).get();
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class UplinkClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(UplinkClient.class);

    private final Vertx vertx;
    private final boolean ownsVertx;
    private final UplinkConfiguration config;
    private final GraphUploadApi api;
    private final ResumableUploadEngine engine;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private UplinkClient(Vertx vertx, boolean ownsVertx, UplinkConfiguration config) throws SessionStoreException {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.config = Objects.requireNonNull(config, "UplinkConfiguration cannot be null");
        this.ownsVertx = ownsVertx;
        config.validate();

        this.api = new GraphUploadApi(vertx, config);
        UploadTelemetryMetrics metrics = config.isTelemetryEnabled()
            ? UploadTelemetryMetrics.getInstance() : UploadTelemetryMetrics.noop();
        this.engine = new ResumableUploadEngine(api, config, UploadSessionStore.fromConfiguration(config), metrics);

        logger.info("Uplink client created for {} (store={}, chunkSize={})",
            config.getApiBaseUrl(), config.getStoreType(), config.getChunkSize());
    }

    /**
     * Creates a client on a shared Vert.x instance. Closing the client leaves the instance running.
     *
     * @throws SessionStoreException if the configured session store cannot be opened
     * @throws IllegalStateException if the configuration is invalid
     */
    public static UplinkClient create(Vertx vertx, UplinkConfiguration config) throws SessionStoreException {
        return new UplinkClient(vertx, false, config);
    }

    /**
     * Creates a client with its own Vert.x instance, closed together with the client.
     */
    public static UplinkClient create(UplinkConfiguration config) throws SessionStoreException {
        return new UplinkClient(Vertx.vertx(), true, config);
    }

    /**
     * Upload a local file.
     *
     * @throws IOException if the file cannot be opened
     * @throws UploadValidationException if the file is not larger than the resumable threshold
     */
    public CompletableFuture<UploadResult> upload(Path file, String title, String description)
            throws IOException, UploadValidationException {
        UploadRequest request = UploadRequest.builder()
            .mediaFile(new PathMediaFile(file))
            .title(title)
            .description(description)
            .build();
        return engine.startUpload(request);
    }

    /**
     * Continue a session opened earlier, possibly by a previous process.
     *
     * @throws IOException if the file cannot be opened
     * @throws ResumeNegotiationException if the server cannot report the session
     */
    public CompletableFuture<UploadResult> resume(String sessionId, Path file)
            throws IOException, ResumeNegotiationException {
        return engine.resumeSession(sessionId, new PathMediaFile(file), null, null);
    }

    public boolean pause(String id) {
        return engine.pauseUpload(id);
    }

    public boolean cancel(String id) {
        return engine.cancelUpload(id);
    }

    public void addListener(UploadListener listener) {
        engine.addListener(listener);
    }

    public UploadEngine getEngine() {
        return engine;
    }

    public GraphUploadApi getApi() {
        return api;
    }

    public UplinkConfiguration getConfiguration() {
        return config;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Closing Uplink client");
        if (!engine.shutdown(config.getShutdownTimeoutSeconds())) {
            logger.warn("Upload engine did not stop within {}s", config.getShutdownTimeoutSeconds());
        }
        api.close();
        if (ownsVertx) {
            vertx.close();
        }
    }
}
