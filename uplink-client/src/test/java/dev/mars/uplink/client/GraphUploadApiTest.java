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
import dev.mars.uplink.protocol.SessionStatus;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GraphUploadApi against a real HTTP server implementing the upload wire format.
 */
@ExtendWith(VertxExtension.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class GraphUploadApiTest {

    private static final byte[] CONTENT = "0123456789abcdefghij".getBytes(StandardCharsets.US_ASCII);

    private final GraphApiTestServer server = new GraphApiTestServer();
    private UplinkConfiguration config;
    private GraphUploadApi api;

    @BeforeAll
    void setUp(Vertx vertx, VertxTestContext testContext) {
        server.start(vertx)
            .onSuccess(port -> {
                Properties properties = new Properties();
                properties.setProperty(UplinkConfiguration.API_BASE_URL, "http://localhost:" + port + "/");
                properties.setProperty(UplinkConfiguration.API_REQUEST_TIMEOUT_MS, "5000");
                properties.setProperty(UplinkConfiguration.API_USER_AGENT, "UplinkTest/1.0");
                properties.setProperty("uplink.api.header.Authorization", "Bearer test-token");
                config = new UplinkConfiguration(properties);
                api = new GraphUploadApi(vertx, config);
                testContext.completeNow();
            })
            .onFailure(testContext::failNow);
    }

    @BeforeEach
    void resetServer() {
        server.reset();
    }

    @AfterAll
    void tearDown(VertxTestContext testContext) {
        if (api != null) {
            api.close();
        }
        server.stop().onComplete(ar -> testContext.completeNow());
    }

    @Test
    @DisplayName("Should open a session and forward optional metadata")
    void testStartSessionAsync(VertxTestContext testContext) {
        api.startSessionAsync("clip.mp4", CONTENT.length, "Launch", null)
            .onComplete(testContext.succeeding(sessionId -> testContext.verify(() -> {
                assertEquals("graph-1", sessionId);
                JsonObject body = server.getLastStartBody();
                assertEquals("start", body.getString("upload_phase"));
                assertEquals(CONTENT.length, body.getLong("file_size"));
                assertEquals("clip.mp4", body.getString("file_name"));
                assertEquals("Launch", body.getString("title"));
                assertFalse(body.containsKey("description"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Should run a full session through the blocking API")
    void testBlockingRoundTrip() throws Exception {
        String sessionId = api.startSession("clip.mp4", CONTENT.length, "Launch", "Day one");

        assertEquals(8, api.transferChunk(sessionId, 0, slice(0, 8)));
        assertEquals(16, api.transferChunk(sessionId, 8, slice(8, 8)));

        SessionStatus status = api.querySession(sessionId);
        assertEquals(16, status.getStartOffset());
        assertEquals(CONTENT.length, status.getFileSize());
        assertEquals("clip.mp4", status.getFileName());

        assertFalse(api.finishSession(sessionId, "Launch", "Day one"));
        assertEquals(20, api.transferChunk(sessionId, 16, slice(16, 4)));
        assertTrue(api.finishSession(sessionId, "Launch", "Day one"));

        GraphApiTestServer.Session session = server.session(sessionId);
        assertArrayEquals(CONTENT, session.content.getBytes());
        assertTrue(session.finished);
        assertEquals("Day one", session.description);
    }

    @Test
    @DisplayName("Should accept offsets sent as JSON numbers")
    void testNumericOffsets() throws Exception {
        server.numericOffsets(true);
        String sessionId = api.startSession("clip.mp4", CONTENT.length, null, null);

        assertEquals(8, api.transferChunk(sessionId, 0, slice(0, 8)));
        assertEquals(CONTENT.length, api.querySession(sessionId).getFileSize());
    }

    @Test
    @DisplayName("Should carry HTTP status and API error message")
    void testRejectedRequest(VertxTestContext testContext) {
        server.failNextWith(400, "Invalid start offset");

        api.transferChunkAsync("graph-x", 0, slice(0, 4))
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                UploadApiException e = assertInstanceOf(UploadApiException.class, err);
                assertEquals(400, e.getStatusCode());
                assertTrue(e.getMessage().contains("Invalid start offset"), e.getMessage());
                assertTrue(e.getMessage().startsWith("transfer"), e.getMessage());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Should report unknown sessions as 404")
    void testUnknownSession() {
        UploadApiException e = assertThrows(UploadApiException.class, () -> api.querySession("missing"));

        assertEquals(404, e.getStatusCode());
        assertTrue(e.getMessage().contains("missing"));
    }

    @Test
    @DisplayName("Should send configured headers and user agent")
    void testConfiguredHeaders() throws Exception {
        api.startSession("clip.mp4", CONTENT.length, null, null);

        assertEquals("Bearer test-token", server.getLastAuthorization());
        assertEquals("UplinkTest/1.0", server.getLastUserAgent());
    }

    @Test
    @DisplayName("Should refuse blocking calls on an event loop thread")
    void testBlockingCallOnEventLoop(Vertx vertx, VertxTestContext testContext) {
        vertx.runOnContext(v -> testContext.verify(() -> {
            assertThrows(IllegalStateException.class, () -> api.querySession("graph-1"));
            testContext.completeNow();
        }));
    }

    @Test
    @DisplayName("Should turn connection failures into API exceptions without status")
    void testConnectionFailure(Vertx vertx) {
        Properties properties = new Properties();
        properties.setProperty(UplinkConfiguration.API_BASE_URL, "http://localhost:1");
        properties.setProperty(UplinkConfiguration.API_CONNECT_TIMEOUT_MS, "2000");
        properties.setProperty(UplinkConfiguration.API_REQUEST_TIMEOUT_MS, "3000");
        GraphUploadApi unreachable = new GraphUploadApi(vertx, new UplinkConfiguration(properties));
        try {
            UploadApiException e = assertThrows(UploadApiException.class,
                () -> unreachable.startSession("clip.mp4", 10, null, null));
            assertFalse(e.hasStatusCode());
        } finally {
            unreachable.close();
        }
    }

    @Test
    void testReadOffset() throws Exception {
        assertEquals(42, GraphUploadApi.readOffset(new JsonObject().put("start_offset", "42"), "start_offset"));
        assertEquals(42, GraphUploadApi.readOffset(new JsonObject().put("start_offset", 42), "start_offset"));
        assertThrows(UploadApiException.class,
            () -> GraphUploadApi.readOffset(new JsonObject().put("start_offset", "forty"), "start_offset"));
        assertThrows(UploadApiException.class,
            () -> GraphUploadApi.readOffset(new JsonObject(), "start_offset"));
    }

    private static byte[] slice(int offset, int length) {
        byte[] bytes = new byte[length];
        System.arraycopy(CONTENT, offset, bytes, 0, length);
        return bytes;
    }
}
