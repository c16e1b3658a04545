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

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Real HTTP server speaking the publishing API's resumable upload wire format,
 * backed by in-memory sessions. Used instead of mocks by the client tests.
 */
class GraphApiTestServer {

    static final class Session {
        final String id;
        final String fileName;
        final long fileSize;
        final Buffer content = Buffer.buffer();
        volatile boolean finished;
        volatile String title;
        volatile String description;

        Session(String id, String fileName, long fileSize) {
            this.id = id;
            this.fileName = fileName;
            this.fileSize = fileSize;
        }
    }

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final AtomicInteger sessionCounter = new AtomicInteger();
    private final AtomicInteger chunkRequests = new AtomicInteger();
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    private final AtomicReference<String> lastUserAgent = new AtomicReference<>();
    private final AtomicReference<JsonObject> lastStartBody = new AtomicReference<>();

    private volatile int failNextStatus;
    private volatile String failNextMessage;
    private volatile boolean numericOffsets;
    private volatile Consumer<String> chunkHook;

    private HttpServer server;

    Future<Integer> start(Vertx vertx) {
        Router router = Router.router(vertx);
        router.route().handler(BodyHandler.create());
        router.route().handler(ctx -> {
            lastAuthorization.set(ctx.request().getHeader("Authorization"));
            lastUserAgent.set(ctx.request().getHeader("User-Agent"));
            if (failNextStatus > 0) {
                int status = failNextStatus;
                failNextStatus = 0;
                error(ctx, status, failNextMessage);
                return;
            }
            ctx.next();
        });
        router.post("/videos").handler(this::handleVideos);
        router.get("/upload_sessions/:id").handler(this::handleStatus);

        return vertx.createHttpServer()
            .requestHandler(router)
            .listen(0)
            .map(httpServer -> {
                server = httpServer;
                return httpServer.actualPort();
            });
    }

    Future<Void> stop() {
        return server != null ? server.close() : Future.succeededFuture();
    }

    void reset() {
        sessions.clear();
        sessionCounter.set(0);
        chunkRequests.set(0);
        lastAuthorization.set(null);
        lastUserAgent.set(null);
        lastStartBody.set(null);
        failNextStatus = 0;
        numericOffsets = false;
        chunkHook = null;
    }

    // ==================== Handlers ====================

    private void handleVideos(RoutingContext ctx) {
        String phase = ctx.request().getParam("upload_phase");
        if ("transfer".equals(phase)) {
            handleTransfer(ctx);
            return;
        }
        JsonObject body = ctx.body().asJsonObject();
        if (body == null) {
            error(ctx, 400, "Missing request body");
            return;
        }
        switch (body.getString("upload_phase", "")) {
            case "start" -> handleStart(ctx, body);
            case "finish" -> handleFinish(ctx, body);
            default -> error(ctx, 400, "Unknown upload_phase");
        }
    }

    private void handleStart(RoutingContext ctx, JsonObject body) {
        lastStartBody.set(body);
        String id = "graph-" + sessionCounter.incrementAndGet();
        sessions.put(id, new Session(id, body.getString("file_name"), body.getLong("file_size")));
        json(ctx, new JsonObject()
            .put("upload_session_id", id)
            .put("video_id", "video-" + id)
            .put("start_offset", offset(0)));
    }

    private void handleTransfer(RoutingContext ctx) {
        chunkRequests.incrementAndGet();
        Session session = sessions.get(ctx.request().getParam("upload_session_id"));
        if (session == null) {
            error(ctx, 404, "Unknown upload session");
            return;
        }
        long startOffset = Long.parseLong(ctx.request().getParam("start_offset"));
        if (startOffset != session.content.length()) {
            error(ctx, 400, "Expected start offset " + session.content.length());
            return;
        }
        session.content.appendBuffer(ctx.body().buffer());
        Consumer<String> hook = chunkHook;
        if (hook != null) {
            hook.accept(session.id);
        }
        json(ctx, new JsonObject()
            .put("start_offset", offset(session.content.length()))
            .put("end_offset", offset(session.fileSize)));
    }

    private void handleFinish(RoutingContext ctx, JsonObject body) {
        Session session = sessions.get(body.getString("upload_session_id"));
        if (session == null) {
            error(ctx, 404, "Unknown upload session");
            return;
        }
        boolean complete = session.content.length() == session.fileSize;
        if (complete) {
            session.finished = true;
            session.title = body.getString("title");
            session.description = body.getString("description");
        }
        json(ctx, new JsonObject().put("success", complete));
    }

    private void handleStatus(RoutingContext ctx) {
        Session session = sessions.get(ctx.pathParam("id"));
        if (session == null) {
            error(ctx, 404, "Unknown upload session " + ctx.pathParam("id"));
            return;
        }
        json(ctx, new JsonObject()
            .put("start_offset", offset(session.content.length()))
            .put("file_size", offset(session.fileSize))
            .put("file_name", session.fileName));
    }

    private Object offset(long value) {
        return numericOffsets ? (Object) value : String.valueOf(value);
    }

    private static void json(RoutingContext ctx, JsonObject body) {
        ctx.response()
            .setStatusCode(200)
            .putHeader("content-type", "application/json")
            .end(body.encode());
    }

    private static void error(RoutingContext ctx, int status, String message) {
        ctx.response()
            .setStatusCode(status)
            .putHeader("content-type", "application/json")
            .end(new JsonObject().put("error", new JsonObject().put("message", message)).encode());
    }

    // ==================== Controls ====================

    /**
     * Answer the next request, whatever it is, with this status and error message.
     */
    void failNextWith(int status, String message) {
        this.failNextMessage = message;
        this.failNextStatus = status;
    }

    void numericOffsets(boolean numeric) {
        this.numericOffsets = numeric;
    }

    /**
     * Run on the event loop after a chunk is committed, before the response is written.
     */
    void onChunk(Consumer<String> hook) {
        this.chunkHook = hook;
    }

    /**
     * Register a session holding the first {@code committed} bytes of {@code content}.
     */
    void presetSession(String id, String fileName, byte[] content, int committed) {
        Session session = new Session(id, fileName, content.length);
        session.content.appendBytes(content, 0, committed);
        sessions.put(id, session);
    }

    Session session(String id) {
        return sessions.get(id);
    }

    int getChunkRequests() {
        return chunkRequests.get();
    }

    String getLastAuthorization() {
        return lastAuthorization.get();
    }

    String getLastUserAgent() {
        return lastUserAgent.get();
    }

    JsonObject getLastStartBody() {
        return lastStartBody.get();
    }
}
