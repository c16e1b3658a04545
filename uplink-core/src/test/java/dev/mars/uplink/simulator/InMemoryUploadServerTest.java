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

package dev.mars.uplink.simulator;

import dev.mars.uplink.core.exceptions.UploadApiException;
import dev.mars.uplink.protocol.SessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link InMemoryUploadServer}.
 */
@ExtendWith(SimulatorTestLoggingExtension.class)
@DisplayName("InMemoryUploadServer Tests")
class InMemoryUploadServerTest {

    private InMemoryUploadServer server;
    private PatternMediaFile file;

    @BeforeEach
    void setUp() {
        server = new InMemoryUploadServer();
        file = new PatternMediaFile("clip.mp4", 2500);
    }

    // ==================== Protocol ====================

    @Nested
    @DisplayName("Protocol")
    class ProtocolTests {

        @Test
        @DisplayName("Should issue distinct session ids")
        void testStartSession() throws Exception {
            String first = server.startSession("a.mp4", 10, null, null);
            String second = server.startSession("b.mp4", 10, null, null);

            assertThat(first).isNotEqualTo(second);
            assertThat(server.hasSession(first)).isTrue();
            assertThat(server.getStartCalls()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should commit contiguous chunks and finish")
        void testFullSession() throws Exception {
            String id = server.startSession(file.getFileName(), file.getSize(), null, null);

            assertThat(server.transferChunk(id, 0, file.read(0, 1000))).isEqualTo(1000);
            assertThat(server.transferChunk(id, 1000, file.read(1000, 1500))).isEqualTo(2500);
            assertThat(server.finishSession(id, "t", "d")).isTrue();

            assertThat(server.getReceivedBytes(id)).isEqualTo(file.expectedBytes(0, 2500));
            assertThat(server.isFinished(id)).isTrue();
            assertThat(server.getFinishedTitle(id)).isEqualTo("t");
            assertThat(server.getFinishedDescription(id)).isEqualTo("d");
        }

        @Test
        @DisplayName("Should refuse to finish an incomplete session")
        void testFinishIncomplete() throws Exception {
            String id = server.startSession(file.getFileName(), file.getSize(), null, null);
            server.transferChunk(id, 0, file.read(0, 1000));

            assertThat(server.finishSession(id, null, null)).isFalse();
            assertThat(server.isFinished(id)).isFalse();
        }

        @Test
        @DisplayName("Should reject a chunk that does not start at the committed offset")
        void testOffsetMismatch() throws Exception {
            String id = server.startSession(file.getFileName(), file.getSize(), null, null);

            assertThatThrownBy(() -> server.transferChunk(id, 1000, file.read(1000, 1000)))
                    .isInstanceOfSatisfying(UploadApiException.class,
                            e -> assertThat(e.getStatusCode()).isEqualTo(400));
            assertThat(server.getCommittedOffset(id)).isZero();
        }

        @Test
        @DisplayName("Should report 404 for unknown sessions")
        void testUnknownSession() {
            assertThatThrownBy(() -> server.querySession("nope"))
                    .isInstanceOf(UploadApiException.class)
                    .hasMessageContaining("nope");
            assertThat(server.getCommittedOffset("nope")).isEqualTo(-1);
            assertThat(server.getReceivedBytes("nope")).isEmpty();
        }

        @Test
        @DisplayName("Should report preset session status")
        void testPresetSession() throws Exception {
            server.presetSession("s-1", "clip.mp4", file.expectedBytes(0, 2500), 1000);

            SessionStatus status = server.querySession("s-1");

            assertThat(status.getSessionId()).isEqualTo("s-1");
            assertThat(status.getStartOffset()).isEqualTo(1000);
            assertThat(status.getFileSize()).isEqualTo(2500);
            assertThat(status.getFileName()).isEqualTo("clip.mp4");
            assertThat(server.getReceivedBytes("s-1")).isEqualTo(file.expectedBytes(0, 1000));
        }
    }

    // ==================== Failure Injection ====================

    @Nested
    @DisplayName("Failure Injection")
    class FailureInjectionTests {

        @Test
        @DisplayName("Should fail only the configured chunk number")
        void testFailChunk() throws Exception {
            server.failChunk(2);
            String id = server.startSession(file.getFileName(), file.getSize(), null, null);

            server.transferChunk(id, 0, file.read(0, 1000));
            assertThatThrownBy(() -> server.transferChunk(id, 1000, file.read(1000, 1000)))
                    .isInstanceOf(UploadApiException.class);
            assertThat(server.transferChunk(id, 1000, file.read(1000, 1000))).isEqualTo(2000);
            assertThat(server.getChunkLog()).extracting(InMemoryUploadServer.ChunkCall::getReturnedOffset)
                    .containsExactly(1000L, -1L, 2000L);
        }

        @Test
        @DisplayName("Should accept only part of a chunk when limited")
        void testPartialAcceptance() throws Exception {
            server.maxAcceptedBytesPerChunk(600);
            String id = server.startSession(file.getFileName(), file.getSize(), null, null);

            assertThat(server.transferChunk(id, 0, file.read(0, 1000))).isEqualTo(600);
            assertThat(server.getReceivedBytes(id)).isEqualTo(file.expectedBytes(0, 600));
        }

        @Test
        @DisplayName("Should return the start offset for a stale chunk")
        void testStaleOffset() throws Exception {
            server.staleOffsetOnChunk(1);
            String id = server.startSession(file.getFileName(), file.getSize(), null, null);

            assertThat(server.transferChunk(id, 0, file.read(0, 1000))).isZero();
        }

        @Test
        @DisplayName("Should reject or override session creation")
        void testStartInjection() throws Exception {
            server.startSessionIdOverride("");
            assertThat(server.startSession("a.mp4", 10, null, null)).isNull();

            server.startSessionIdOverride(null).rejectStart(true);
            assertThatThrownBy(() -> server.startSession("a.mp4", 10, null, null))
                    .isInstanceOf(UploadApiException.class);
        }

        @Test
        @DisplayName("Should fail finish and query on demand")
        void testFinishAndQueryInjection() throws Exception {
            server.presetSession("s-1", "clip.mp4", 10, 10);

            server.finishReturnsFalse(true);
            assertThat(server.finishSession("s-1", null, null)).isFalse();

            server.failFinish(true);
            assertThatThrownBy(() -> server.finishSession("s-1", null, null)).isInstanceOf(UploadApiException.class);

            server.failQuery(true);
            assertThatThrownBy(() -> server.querySession("s-1")).isInstanceOf(UploadApiException.class);
            assertThat(server.getQueryCalls()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should call the chunk hook after the chunk is committed")
        void testChunkHook() throws Exception {
            List<Long> committedAtHook = new ArrayList<>();
            String id = server.startSession(file.getFileName(), file.getSize(), null, null);
            server.onChunk(call -> committedAtHook.add(server.getCommittedOffset(call.getSessionId())));

            server.transferChunk(id, 0, file.read(0, 1000));
            server.transferChunk(id, 1000, file.read(1000, 1000));

            assertThat(committedAtHook).containsExactly(1000L, 2000L);
        }
    }
}
