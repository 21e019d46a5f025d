package com.ryuqq.downstream.core.response;

import com.ryuqq.downstream.core.model.Label;

import java.util.List;

/**
 * 라벨 집합과 순서 있는 샘플 목록.
 *
 * @param labels 라벨 목록 (순서 유지)
 * @param samples 샘플 목록 (시간 순)
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record SampleStream(List<Label> labels, List<Sample> samples) {

    public SampleStream {
        labels = labels == null ? List.of() : List.copyOf(labels);
        samples = samples == null ? List.of() : List.copyOf(samples);
    }
}
