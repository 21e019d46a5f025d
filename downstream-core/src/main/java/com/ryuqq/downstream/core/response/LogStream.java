package com.ryuqq.downstream.core.response;

import java.util.List;

/**
 * 라벨 스트림과 그 엔트리.
 *
 * @param labels 라벨 셀렉터 문자열 (예: {@code {app="api"}})
 * @param entries 순서가 유지되는 엔트리 목록
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record LogStream(String labels, List<LogEntry> entries) {

    public LogStream {
        if (labels == null) {
            throw new IllegalArgumentException("labels cannot be null");
        }
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
