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

import dev.mars.uplink.core.UploadProgress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ProgressReporterTest {

    private RecordingUploadListener listener;
    private ProgressReporter reporter;

    @BeforeEach
    void setUp() {
        UploadEventPublisher publisher = new UploadEventPublisher();
        listener = new RecordingUploadListener();
        publisher.addListener(listener);
        reporter = new ProgressReporter(publisher);
    }

    @ParameterizedTest(name = "{0} of {1} → {2}%")
    @CsvSource({
            "0, 100, 0",
            "4, 10, 40",
            "6, 10, 60",
            "1, 3, 33",
            "2, 3, 67",
            "5, 1000, 1",
            "4, 1000, 0",
            "10, 10, 100",
            "0, 0, 0"
    })
    void testPercentOf(long offset, long total, int expected) {
        assertEquals(expected, ProgressReporter.percentOf(offset, total));
    }

    @Test
    void testReportPublishesDerivedProgress() {
        UploadSession session = UploadSession.attach("u-1", "s-1", "clip.mp4", 10, 6, 4, null, null);

        UploadProgress progress = reporter.report(session);

        assertEquals("s-1", progress.getSessionId());
        assertEquals(6, progress.getOffset());
        assertEquals(10, progress.getTotalSize());
        assertEquals(60, progress.getPercent());
        assertFalse(progress.isComplete());
        assertSame(progress, reporter.getLastProgress());
        assertEquals(1, listener.progress.size());
    }

    @Test
    void testFirstSampleHasNoRate() {
        UploadSession session = UploadSession.attach("u-1", "s-1", "clip.mp4", 10, 0, 4, null, null);

        UploadProgress progress = reporter.report(session);

        assertEquals(0.0, progress.getBytesPerSecond());
        assertEquals(-1, progress.getEstimatedRemainingSeconds());
    }

    @Test
    void testCompleteProgressHasNoRemainingTime() {
        UploadSession session = UploadSession.attach("u-1", "s-1", "clip.mp4", 10, 10, 4, null, null);

        UploadProgress progress = reporter.report(session);

        assertEquals(100, progress.getPercent());
        assertTrue(progress.isComplete());
        assertEquals(0, progress.getEstimatedRemainingSeconds());
    }

    @Test
    void testNothingReportedYet() {
        assertNull(reporter.getLastProgress());
        assertEquals(0.0, reporter.getCurrentRateBytesPerSecond());
    }
}
