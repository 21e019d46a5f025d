package com.ryuqq.downstream.core.response;

import java.time.Instant;

/**
 * 로그 엔트리 한 줄.
 *
 * @param timestamp 타임스탬프
 * @param line 로그 라인
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record LogEntry(Instant timestamp, String line) {

    public LogEntry {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (line == null) {
            throw new IllegalArgumentException("line cannot be null");
        }
    }
}
