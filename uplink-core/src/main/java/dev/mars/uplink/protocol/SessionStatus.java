package dev.mars.uplink.protocol;

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


/**
 * Server view of an upload session, as returned by the session status query.
 */
public final class SessionStatus {

    private final String sessionId;
    private final long startOffset;
    private final long fileSize;
    private final String fileName;

    public SessionStatus(String sessionId, long startOffset, long fileSize, String fileName) {
        this.sessionId = sessionId;
        this.startOffset = startOffset;
        this.fileSize = fileSize;
        this.fileName = fileName;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * @return next offset the server expects, i.e. the number of committed bytes
     */
    public long getStartOffset() {
        return startOffset;
    }

    public long getFileSize() {
        return fileSize;
    }

    public String getFileName() {
        return fileName;
    }

    @Override
    public String toString() {
        return "SessionStatus{" +
                "sessionId='" + sessionId + '\'' +
                ", startOffset=" + startOffset +
                ", fileSize=" + fileSize +
                ", fileName='" + fileName + '\'' +
                '}';
    }
}
