package com.ryuqq.downstream.core.result;

import com.ryuqq.downstream.core.model.Label;
import com.ryuqq.downstream.core.response.LogStream;

import java.util.List;

/**
 * 결과 데이터 페이로드.
 *
 * <p>세 가지 형태 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Streams}: 로그 스트림</li>
 *   <li>{@link Vector}: instant vector (시계열당 포인트 하나)</li>
 *   <li>{@link Matrix}: range matrix (시계열당 포인트 목록)</li>
 * </ul>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public sealed interface ResultValue permits ResultValue.Streams, ResultValue.Vector, ResultValue.Matrix {

    /**
     * 형태 이름.
     *
     * @return "streams", "vector", "matrix" 중 하나
     */
    String type();

    /**
     * 로그 스트림 페이로드.
     */
    record Streams(List<LogStream> streams) implements ResultValue {

        public Streams {
            streams = List.copyOf(streams);
        }

        @Override
        public String type() {
            return "streams";
        }
    }

    /**
     * instant vector 페이로드.
     */
    record Vector(List<VectorSample> samples) implements ResultValue {

        public Vector {
            samples = List.copyOf(samples);
        }

        @Override
        public String type() {
            return "vector";
        }
    }

    /**
     * range matrix 페이로드.
     */
    record Matrix(List<Series> series) implements ResultValue {

        public Matrix {
            series = List.copyOf(series);
        }

        @Override
        public String type() {
            return "matrix";
        }
    }

    /**
     * (t, v) 포인트.
     *
     * @param t 밀리초 타임스탬프
     * @param v 값
     */
    record Point(long t, double v) {
    }

    /**
     * vector 원소: 라벨 집합 + 포인트 하나.
     */
    record VectorSample(List<Label> metric, Point point) {

        public VectorSample {
            metric = List.copyOf(metric);
        }
    }

    /**
     * matrix 원소: 라벨 집합 + 순서 있는 포인트 목록.
     */
    record Series(List<Label> metric, List<Point> points) {

        public Series {
            metric = List.copyOf(metric);
            points = List.copyOf(points);
        }
    }
}
