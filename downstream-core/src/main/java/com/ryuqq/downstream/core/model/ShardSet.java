package com.ryuqq.downstream.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 순서가 있는 shard 기술자 집합.
 *
 * <p>빈 집합은 샤딩하지 않은 실행을 의미합니다.
 * {@link #encode()}와 {@link #decode(List)}는 서로 손실 없는 역함수입니다.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public final class ShardSet {

    private static final ShardSet NONE = new ShardSet(List.of());

    private final List<Shard> shards;

    private ShardSet(List<Shard> shards) {
        this.shards = shards;
    }

    /**
     * 빈 ShardSet (샤딩 없음).
     *
     * @return 빈 ShardSet
     */
    public static ShardSet none() {
        return NONE;
    }

    /**
     * ShardSet 생성.
     *
     * @param shards shard 목록 (순서 유지)
     * @return ShardSet 인스턴스
     * @throws IllegalArgumentException shards가 null이거나 null 원소를 포함한 경우
     */
    public static ShardSet of(List<Shard> shards) {
        if (shards == null) {
            throw new IllegalArgumentException("shards cannot be null");
        }
        if (shards.isEmpty()) {
            return NONE;
        }
        if (shards.contains(null)) {
            throw new IllegalArgumentException("shards cannot contain null");
        }
        return new ShardSet(List.copyOf(shards));
    }

    public static ShardSet of(Shard... shards) {
        return of(List.of(shards));
    }

    /**
     * 인코딩된 토큰 목록으로부터 복원.
     *
     * @param encoded {@link #encode()} 결과
     * @return ShardSet 인스턴스
     * @throws IllegalArgumentException 토큰 형식이 잘못된 경우
     */
    public static ShardSet decode(List<String> encoded) {
        if (encoded == null) {
            throw new IllegalArgumentException("encoded shards cannot be null");
        }
        List<Shard> decoded = new ArrayList<>(encoded.size());
        for (String token : encoded) {
            decoded.add(Shard.parse(token));
        }
        return of(decoded);
    }

    /**
     * 요청에 싣기 위한 인코딩 (shard 하나당 토큰 하나, 순서 유지).
     *
     * @return 불변 토큰 목록
     */
    public List<String> encode() {
        List<String> encoded = new ArrayList<>(shards.size());
        for (Shard shard : shards) {
            encoded.add(shard.encode());
        }
        return List.copyOf(encoded);
    }

    public List<Shard> shards() {
        return shards;
    }

    public boolean isEmpty() {
        return shards.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ShardSet shardSet = (ShardSet) o;
        return shards.equals(shardSet.shards);
    }

    @Override
    public int hashCode() {
        return shards.hashCode();
    }

    @Override
    public String toString() {
        return shards.toString();
    }
}
