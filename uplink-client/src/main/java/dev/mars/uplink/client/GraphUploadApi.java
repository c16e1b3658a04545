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
import dev.mars.uplink.core.exceptions.UploadApiException;
import dev.mars.uplink.protocol.ResumableUploadApi;
import dev.mars.uplink.protocol.SessionStatus;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP binding of the resumable upload protocol of the publishing API.
 * Uses Vert.x WebClient for non-blocking HTTP communication.
 *
 * <p>Every operation exists in two forms. The {@code *Async} methods return a Vert.x
 * {@link Future} and may be composed on an event loop. The {@link ResumableUploadApi}
 * methods block the calling thread until the response arrives; the upload engine calls them
 * from its worker threads and they refuse to run on an event loop thread.</p>
 *
 * <h3>Wire format:</h3>
 * <pre>
 * POST {base}/videos                     {"upload_phase":"start", "file_size", "file_name", ...}
 * POST {base}/videos?upload_phase=transfer&amp;upload_session_id=X&amp;start_offset=N   (octet-stream body)
 * POST {base}/videos                     {"upload_phase":"finish", "upload_session_id", ...}
 * GET  {base}/upload_sessions/X
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class GraphUploadApi implements ResumableUploadApi {

    private static final Logger logger = LoggerFactory.getLogger(GraphUploadApi.class);

    public static final String PROTOCOL_NAME = "graph-http";

    private final WebClient webClient;
    private final String baseUrl;
    private final long requestTimeoutMs;
    private final Map<String, String> headers;

    public GraphUploadApi(Vertx vertx, UplinkConfiguration config) {
        this.baseUrl = config.getApiBaseUrl();
        this.requestTimeoutMs = config.getRequestTimeoutMs();
        this.headers = config.getApiHeaders();
        this.webClient = WebClient.create(vertx, new WebClientOptions()
            .setConnectTimeout(config.getConnectTimeoutMs())
            .setIdleTimeout(config.getIdleTimeoutSeconds())
            .setUserAgent(config.getUserAgent()));
        logger.debug("GraphUploadApi initialized for {} (connectTimeout={}ms, requestTimeout={}ms, {} extra headers)",
            baseUrl, config.getConnectTimeoutMs(), requestTimeoutMs, headers.size());
    }

    // ========== ASYNC API ==========

    /**
     * Open an upload session.
     *
     * @return Future with the server-issued session id
     */
    public Future<String> startSessionAsync(String fileName, long totalSize, String title, String description) {
        JsonObject body = new JsonObject()
            .put("upload_phase", "start")
            .put("file_size", totalSize)
            .put("file_name", fileName);
        putIfPresent(body, "title", title);
        putIfPresent(body, "description", description);

        return send("start", prepare(webClient.postAbs(baseUrl + "/videos")).sendJsonObject(body))
            .compose(json -> {
                Object sessionId = json.getValue("upload_session_id");
                if (sessionId == null || sessionId.toString().isBlank()) {
                    return Future.failedFuture(new UploadApiException("Start response carries no upload_session_id"));
                }
                logger.info("Upload session {} opened for {} ({} bytes)", sessionId, fileName, totalSize);
                return Future.succeededFuture(sessionId.toString());
            });
    }

    /**
     * Send the bytes starting at {@code startOffset}.
     *
     * @return Future with the next offset the server expects
     */
    public Future<Long> transferChunkAsync(String sessionId, long startOffset, byte[] bytes) {
        HttpRequest<Buffer> request = prepare(webClient.postAbs(baseUrl + "/videos"))
            .addQueryParam("upload_phase", "transfer")
            .addQueryParam("upload_session_id", sessionId)
            .addQueryParam("start_offset", String.valueOf(startOffset))
            .putHeader("Content-Type", "application/octet-stream");

        return send("transfer", request.sendBuffer(Buffer.buffer(bytes)))
            .compose(json -> {
                try {
                    long next = readOffset(json, "start_offset");
                    logger.debug("Session {}: sent {} bytes at {}, server expects {}",
                        sessionId, bytes.length, startOffset, next);
                    return Future.succeededFuture(next);
                } catch (UploadApiException e) {
                    return Future.failedFuture(e);
                }
            });
    }

    /**
     * Ask the server to turn the committed bytes into a post.
     *
     * @return Future with the server's success flag
     */
    public Future<Boolean> finishSessionAsync(String sessionId, String title, String description) {
        JsonObject body = new JsonObject()
            .put("upload_phase", "finish")
            .put("upload_session_id", sessionId);
        putIfPresent(body, "title", title);
        putIfPresent(body, "description", description);

        return send("finish", prepare(webClient.postAbs(baseUrl + "/videos")).sendJsonObject(body))
            .map(json -> {
                boolean success = Boolean.TRUE.equals(json.getValue("success"));
                if (success) {
                    logger.info("Upload session {} finished", sessionId);
                } else {
                    logger.warn("Upload session {} finish returned {}", sessionId, json.encode());
                }
                return success;
            });
    }

    /**
     * Query the committed offset and file identity of a session.
     */
    public Future<SessionStatus> querySessionAsync(String sessionId) {
        String url = baseUrl + "/upload_sessions/" + URLEncoder.encode(sessionId, StandardCharsets.UTF_8);
        return send("status", prepare(webClient.getAbs(url)).send())
            .compose(json -> {
                try {
                    SessionStatus status = new SessionStatus(sessionId,
                        readOffset(json, "start_offset"),
                        readOffset(json, "file_size"),
                        json.getString("file_name"));
                    logger.debug("Session {} status: {}", sessionId, status);
                    return Future.succeededFuture(status);
                } catch (UploadApiException | ClassCastException e) {
                    return Future.failedFuture(e instanceof UploadApiException ? e
                        : new UploadApiException("Malformed status response: " + json.encode(), e));
                }
            });
    }

    // ========== BLOCKING API ==========

    @Override
    public String startSession(String fileName, long totalSize, String title, String description)
            throws UploadApiException {
        return await("start", startSessionAsync(fileName, totalSize, title, description));
    }

    @Override
    public long transferChunk(String sessionId, long startOffset, byte[] bytes) throws UploadApiException {
        return await("transfer", transferChunkAsync(sessionId, startOffset, bytes));
    }

    @Override
    public boolean finishSession(String sessionId, String title, String description) throws UploadApiException {
        return await("finish", finishSessionAsync(sessionId, title, description));
    }

    @Override
    public SessionStatus querySession(String sessionId) throws UploadApiException {
        return await("status", querySessionAsync(sessionId));
    }

    @Override
    public String getProtocolName() {
        return PROTOCOL_NAME;
    }

    /**
     * Shuts down the WebClient.
     */
    public void close() {
        logger.debug("Shutting down GraphUploadApi WebClient");
        webClient.close();
    }

    // ========== HELPERS ==========

    private HttpRequest<Buffer> prepare(HttpRequest<Buffer> request) {
        headers.forEach(request::putHeader);
        return request.timeout(requestTimeoutMs);
    }

    /**
     * Turn a response into its JSON body, or into an {@link UploadApiException} for non-2xx
     * statuses, unreadable bodies and transport failures.
     */
    private Future<JsonObject> send(String phase, Future<HttpResponse<Buffer>> response) {
        return response
            .recover(err -> Future.failedFuture(
                new UploadApiException(phase + " request failed: " + err.getMessage(), err)))
            .compose(resp -> {
                int statusCode = resp.statusCode();
                if (statusCode < 200 || statusCode >= 300) {
                    String message = errorMessage(resp);
                    logger.warn("{} request rejected (HTTP {}): {}", phase, statusCode, message);
                    return Future.failedFuture(new UploadApiException(statusCode,
                        phase + " request rejected (HTTP " + statusCode + "): " + message));
                }
                try {
                    JsonObject json = resp.bodyAsJsonObject();
                    return Future.succeededFuture(json != null ? json : new JsonObject());
                } catch (DecodeException e) {
                    return Future.failedFuture(new UploadApiException(
                        phase + " response is not JSON: " + resp.bodyAsString(), e));
                }
            });
    }

    private static String errorMessage(HttpResponse<Buffer> response) {
        try {
            JsonObject body = response.bodyAsJsonObject();
            if (body != null) {
                JsonObject error = body.getJsonObject("error");
                if (error != null && error.getString("message") != null) {
                    return error.getString("message");
                }
            }
        } catch (DecodeException | ClassCastException e) {
            logger.debug("Error response body is not the expected JSON: {}", e.getMessage());
        }
        return response.statusMessage();
    }

    /**
     * Offsets arrive as JSON strings or numbers.
     */
    static long readOffset(JsonObject json, String field) throws UploadApiException {
        Object value = json.getValue(field);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new UploadApiException("Field " + field + " is not a number: " + value, e);
            }
        }
        throw new UploadApiException("Response carries no " + field + ": " + json.encode());
    }

    private static void putIfPresent(JsonObject body, String key, String value) {
        if (value != null) {
            body.put(key, value);
        }
    }

    private <T> T await(String phase, Future<T> future) throws UploadApiException {
        if (Context.isOnEventLoopThread()) {
            throw new IllegalStateException("Blocking " + phase + " call issued on an event loop thread");
        }
        try {
            return future.toCompletionStage().toCompletableFuture()
                .get(requestTimeoutMs + 1000, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UploadApiException) {
                throw (UploadApiException) cause;
            }
            throw new UploadApiException(phase + " request failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new UploadApiException(phase + " request timed out after " + requestTimeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UploadApiException(phase + " request interrupted", e);
        }
    }
}
