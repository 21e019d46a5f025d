package com.ryuqq.downstream.core.translate;

import com.ryuqq.downstream.core.exception.DownstreamErrorException;
import com.ryuqq.downstream.core.exception.TranslationException;
import com.ryuqq.downstream.core.response.DownstreamResponse;
import com.ryuqq.downstream.core.response.LogStreamResponse;
import com.ryuqq.downstream.core.response.Sample;
import com.ryuqq.downstream.core.response.SampleStream;
import com.ryuqq.downstream.core.response.SampleStreamResponse;
import com.ryuqq.downstream.core.result.QueryResult;
import com.ryuqq.downstream.core.result.ResultValue;
import com.ryuqq.downstream.core.result.ResultValue.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * downstream 응답 → 균일한 QueryResult 변환.
 *
 * <p><strong>변환 규칙:</strong></p>
 * <ul>
 *   <li>{@link LogStreamResponse}: 스트림을 그대로 {@link ResultValue.Streams}로</li>
 *   <li>{@link SampleStreamResponse} (vector): 스트림마다 첫 샘플로 {@link ResultValue.VectorSample} 하나</li>
 *   <li>{@link SampleStreamResponse} (그 외): 스트림마다 모든 샘플로 {@link ResultValue.Series} 하나</li>
 *   <li>응답에 오류 메시지가 있으면 {@link DownstreamErrorException} ("type: message")</li>
 *   <li>그 외 형태: {@link TranslationException} ("cannot decode (Shape)")</li>
 * </ul>
 *
 * <p>스트림 순서와 스트림 내 샘플 순서는 항상 보존됩니다.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public final class ResponseTranslator {

    private ResponseTranslator() {
    }

    /**
     * 응답 변환.
     *
     * @param response downstream 응답 (null이면 TranslationException)
     * @return QueryResult
     * @throws DownstreamErrorException 응답이 오류를 담고 있는 경우
     * @throws TranslationException 변환할 수 없는 형태인 경우
     */
    public static QueryResult toResult(DownstreamResponse response) {
        if (response instanceof LogStreamResponse logs) {
            if (logs.hasError()) {
                throw new DownstreamErrorException(logs.errorType(), logs.error());
            }
            return new QueryResult(logs.statistics(), new ResultValue.Streams(logs.streams()), logs.headers());
        }

        if (response instanceof SampleStreamResponse samples) {
            if (samples.hasError()) {
                throw new DownstreamErrorException(samples.errorType(), samples.error());
            }
            ResultValue data = samples.isVector()
                ? toVector(samples.result())
                : toMatrix(samples.result());
            return new QueryResult(samples.statistics(), data, samples.headers());
        }

        throw TranslationException.cannotDecode(response);
    }

    /**
     * instant 쿼리 규약: 시계열당 샘플 하나.
     */
    static ResultValue.Vector toVector(List<SampleStream> streams) {
        List<ResultValue.VectorSample> vector = new ArrayList<>(streams.size());
        for (SampleStream stream : streams) {
            if (stream.samples().isEmpty()) {
                throw new TranslationException("vector series " + stream.labels() + " has no samples");
            }
            Sample first = stream.samples().get(0);
            vector.add(new ResultValue.VectorSample(stream.labels(), new Point(first.timestampMs(), first.value())));
        }
        return new ResultValue.Vector(vector);
    }

    static ResultValue.Matrix toMatrix(List<SampleStream> streams) {
        List<ResultValue.Series> matrix = new ArrayList<>(streams.size());
        for (SampleStream stream : streams) {
            List<Point> points = new ArrayList<>(stream.samples().size());
            for (Sample sample : stream.samples()) {
                points.add(new Point(sample.timestampMs(), sample.value()));
            }
            matrix.add(new ResultValue.Series(stream.labels(), points));
        }
        return new ResultValue.Matrix(matrix);
    }
}
