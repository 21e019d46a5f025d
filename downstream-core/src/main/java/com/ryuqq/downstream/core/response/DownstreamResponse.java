package com.ryuqq.downstream.core.response;

import java.util.List;

/**
 * downstream handler가 반환하는 응답.
 *
 * <p>Sealed interface로 정의되어 가능한 형태가 컴파일 타임에 고정됩니다:</p>
 * <ul>
 *   <li>{@link LogStreamResponse}: 로그 스트림 (라벨 스트림 + 엔트리)</li>
 *   <li>{@link SampleStreamResponse}: Prometheus 스타일 vector/matrix</li>
 *   <li>{@link SeriesResponse}: series 메타데이터 조회 응답</li>
 *   <li>{@link LabelNamesResponse}: label 이름 조회 응답</li>
 * </ul>
 *
 * <p>쿼리 결과로 변환 가능한 형태는 앞의 두 가지뿐이며, 나머지는
 * {@link com.ryuqq.downstream.core.translate.ResponseTranslator}에서 TranslationException이 됩니다.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public sealed interface DownstreamResponse
    permits LogStreamResponse, SampleStreamResponse, SeriesResponse, LabelNamesResponse {

    /**
     * 응답 헤더.
     *
     * @return 헤더 목록 (빈 목록 허용)
     */
    List<ResponseHeader> headers();
}
