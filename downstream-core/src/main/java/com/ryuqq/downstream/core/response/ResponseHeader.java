package com.ryuqq.downstream.core.response;

import java.util.List;

/**
 * 응답 헤더 (이름 + 다중 값).
 *
 * @param name 헤더 이름
 * @param values 헤더 값 목록
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record ResponseHeader(String name, List<String> values) {

    public ResponseHeader {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("header name cannot be null or blank");
        }
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static ResponseHeader of(String name, String... values) {
        return new ResponseHeader(name, List.of(values));
    }
}
