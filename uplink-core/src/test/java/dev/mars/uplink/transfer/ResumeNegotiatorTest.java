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

package dev.mars.uplink.transfer;

import dev.mars.uplink.core.UploadRequest;
import dev.mars.uplink.core.UploadResult;
import dev.mars.uplink.core.UploadStatus;
import dev.mars.uplink.core.exceptions.ChunkTransferException;
import dev.mars.uplink.core.exceptions.ResumeNegotiationException;
import dev.mars.uplink.protocol.SessionStatus;
import dev.mars.uplink.simulator.InMemoryUploadServer;
import dev.mars.uplink.simulator.InMemoryUploadServer.ChunkCall;
import dev.mars.uplink.simulator.PatternMediaFile;
import dev.mars.uplink.transfer.observability.UploadTelemetryMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static dev.mars.uplink.simulator.PatternMediaFile.MIB;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ResumeNegotiator}: re-attaching to a server session after an interruption.
 */
class ResumeNegotiatorTest {

    private static final int CHUNK = 4 * MIB;

    private InMemoryUploadServer server;
    private RecordingUploadListener listener;
    private ResumeNegotiator negotiator;

    @BeforeEach
    void setUp() {
        server = new InMemoryUploadServer();
        listener = new RecordingUploadListener();
        UploadEventPublisher publisher = new UploadEventPublisher();
        publisher.addListener(listener);
        negotiator = new ResumeNegotiator(server, CHUNK, publisher, UploadTelemetryMetrics.noop());
    }

    @Test
    @DisplayName("Server at 6 of 10 MiB: one more 4 MiB chunk, then finalize")
    void testResumeFromServerOffset() throws Exception {
        PatternMediaFile file = PatternMediaFile.ofMib("launch.mp4", 10);
        server.presetSession("X", "launch.mp4", file.expectedBytes(0, 10 * MIB), 6L * MIB);

        UploadController controller = negotiator.resume("X", file, "Launch day", null);

        assertEquals(UploadStatus.PAUSED, controller.getStatus());
        assertEquals(6L * MIB, controller.getSession().getOffset());
        assertEquals("X", controller.getSessionId());
        assertEquals(List.of(60), listener.percents());
        assertEquals(0, server.getChunkCalls());

        UploadResult result = controller.resume();

        assertEquals(UploadStatus.COMPLETED, result.getFinalStatus());
        List<ChunkCall> calls = server.getChunkLog();
        assertEquals(1, calls.size());
        assertEquals(6L * MIB, calls.get(0).getStartOffset());
        assertEquals(4 * MIB, calls.get(0).getLength());
        assertEquals(1, server.getFinishCalls());
        assertEquals("Launch day", server.getFinishedTitle("X"));
        assertArrayEquals(file.expectedBytes(0, 10 * MIB), server.getReceivedBytes("X"));
    }

    @Test
    @DisplayName("Interrupted after one 6 MiB chunk, a new process finishes with one 4 MiB chunk")
    void testResumeAcrossControllers() throws Exception {
        PatternMediaFile file = PatternMediaFile.ofMib("launch.mp4", 10);
        UploadController first = UploadController.builder()
                .api(server)
                .request(UploadRequest.builder().mediaFile(file).build())
                .chunkSize(6 * MIB)
                .resumableThreshold(MIB)
                .build();
        server.onChunk(call -> first.pause());
        assertEquals(UploadStatus.PAUSED, first.start().getFinalStatus());
        server.onChunk(null);

        UploadController second = negotiator.resume(first.getSessionId(), file);
        UploadResult result = second.resume();

        assertEquals(UploadStatus.COMPLETED, result.getFinalStatus());
        assertEquals(2, server.getChunkCalls());
        assertEquals(1, server.getFinishCalls());
        assertEquals(4L * MIB, result.getBytesTransferred());
        assertArrayEquals(file.expectedBytes(0, 10 * MIB), server.getReceivedBytes(first.getSessionId()));
    }

    @Test
    @DisplayName("A session already fully committed finalizes without sending a chunk")
    void testResumeAtEnd() throws Exception {
        PatternMediaFile file = PatternMediaFile.ofMib("launch.mp4", 10);
        server.presetSession("done", "launch.mp4", file.expectedBytes(0, 10 * MIB), 10L * MIB);

        UploadController controller = negotiator.resume("done", file);
        assertEquals(List.of(100), listener.percents());

        UploadResult result = controller.resume();

        assertEquals(UploadStatus.COMPLETED, result.getFinalStatus());
        assertEquals(0, server.getChunkCalls());
        assertEquals(1, server.getFinishCalls());
    }

    @Test
    @DisplayName("Query failure raises ResumeNegotiationException and sends nothing")
    void testQueryFailure() {
        server.presetSession("X", "launch.mp4", 10L * MIB, 6L * MIB).failQuery(true);

        ResumeNegotiationException e = assertThrows(ResumeNegotiationException.class,
                () -> negotiator.resume("X", PatternMediaFile.ofMib("launch.mp4", 10)));

        assertEquals("X", e.getSessionId());
        assertNotNull(e.getCause());
        assertEquals(0, server.getChunkCalls());
        assertTrue(listener.progress.isEmpty());
    }

    @Test
    @DisplayName("An unchecked error from the status query is a negotiation failure")
    void testUncheckedQueryError() {
        InMemoryUploadServer broken = new InMemoryUploadServer() {
            @Override
            public SessionStatus querySession(String sessionId) {
                throw new IllegalStateException("client closed");
            }
        };
        ResumeNegotiator brokenNegotiator = new ResumeNegotiator(broken, CHUNK, null, UploadTelemetryMetrics.noop());

        ResumeNegotiationException e = assertThrows(ResumeNegotiationException.class,
                () -> brokenNegotiator.resume("X", PatternMediaFile.ofMib("launch.mp4", 10)));

        assertEquals("X", e.getSessionId());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    @DisplayName("Unknown session id is a negotiation failure")
    void testUnknownSession() {
        assertThrows(ResumeNegotiationException.class,
                () -> negotiator.resume("missing", PatternMediaFile.ofMib("launch.mp4", 10)));
    }

    @Test
    @DisplayName("Blank session id is rejected before querying")
    void testBlankSessionId() {
        assertThrows(ResumeNegotiationException.class,
                () -> negotiator.resume(" ", PatternMediaFile.ofMib("launch.mp4", 10)));
        assertEquals(0, server.getQueryCalls());
    }

    @Test
    @DisplayName("A different local name and size are accepted; the server's identity wins")
    void testMismatchIsNotRejected() throws Exception {
        server.presetSession("X", "launch.mp4", 10L * MIB, 6L * MIB);
        PatternMediaFile other = PatternMediaFile.ofMib("renamed.mp4", 12);

        UploadController controller = negotiator.resume("X", other);

        assertEquals(UploadStatus.PAUSED, controller.getStatus());
        assertEquals("launch.mp4", controller.getSession().getFileName());
        assertEquals(10L * MIB, controller.getSession().getTotalSize());
    }

    @Test
    @DisplayName("Different bytes under the same identity are uploaded unchecked")
    void testContentIsTrusted() throws Exception {
        PatternMediaFile original = new PatternMediaFile("launch.mp4", 10L * MIB, 1);
        PatternMediaFile edited = new PatternMediaFile("launch.mp4", 10L * MIB, 2);
        server.presetSession("X", "launch.mp4", original.expectedBytes(0, 10 * MIB), 6L * MIB);

        UploadResult result = negotiator.resume("X", edited).resume();

        assertEquals(UploadStatus.COMPLETED, result.getFinalStatus());
        byte[] received = server.getReceivedBytes("X");
        assertArrayEquals(original.expectedBytes(0, 6 * MIB), Arrays.copyOfRange(received, 0, 6 * MIB));
        assertArrayEquals(edited.expectedBytes(6L * MIB, 4 * MIB), Arrays.copyOfRange(received, 6 * MIB, 10 * MIB));
    }

    @Test
    @DisplayName("A shorter local file fails at the first unreadable chunk")
    void testShorterLocalFile() throws Exception {
        server.presetSession("X", "launch.mp4", 10L * MIB, 6L * MIB);
        UploadController controller = negotiator.resume("X", PatternMediaFile.ofMib("launch.mp4", 8));

        ChunkTransferException e = assertThrows(ChunkTransferException.class, controller::resume);

        assertEquals(6L * MIB, e.getOffset());
        assertEquals(UploadStatus.FAILED, controller.getStatus());
        assertEquals(0, server.getChunkCalls());
    }
}
