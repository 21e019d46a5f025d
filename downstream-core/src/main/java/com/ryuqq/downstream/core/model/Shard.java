package com.ryuqq.downstream.core.model;

/**
 * 하나의 shard 파티션 기술자.
 *
 * <p>{@code of}개로 나눈 데이터 범위 중 {@code index}번째를 나타내며,
 * downstream 요청에는 {@code "<index>_of_<of>"} 형식의 토큰으로 실립니다.</p>
 *
 * @param index shard 번호 (0 이상, of 미만)
 * @param of 전체 shard 수 (1 이상)
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record Shard(int index, int of) {

    private static final String SEPARATOR = "_of_";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 범위를 벗어난 경우
     */
    public Shard {
        if (of < 1) {
            throw new IllegalArgumentException("of must be positive (current: " + of + ")");
        }
        if (index < 0 || index >= of) {
            throw new IllegalArgumentException(
                String.format("index must be between 0 and %d (current: %d)", of - 1, index));
        }
    }

    /**
     * 토큰 인코딩.
     *
     * @return 예: "3_of_16"
     */
    public String encode() {
        return index + SEPARATOR + of;
    }

    /**
     * 토큰 디코딩.
     *
     * @param token "index_of_of" 형식 문자열
     * @return Shard 인스턴스
     * @throws IllegalArgumentException 형식이 잘못된 경우
     */
    public static Shard parse(String token) {
        if (token == null) {
            throw new IllegalArgumentException("shard token cannot be null");
        }
        int separator = token.indexOf(SEPARATOR);
        if (separator <= 0) {
            throw new IllegalArgumentException("invalid shard token: " + token);
        }
        try {
            int index = Integer.parseInt(token.substring(0, separator));
            int of = Integer.parseInt(token.substring(separator + SEPARATOR.length()));
            return new Shard(index, of);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid shard token: " + token, e);
        }
    }

    @Override
    public String toString() {
        return encode();
    }
}
