package com.ryuqq.downstream.core.translate;

import com.ryuqq.downstream.core.model.Direction;
import com.ryuqq.downstream.core.model.QueryParams;
import com.ryuqq.downstream.core.model.Shard;
import com.ryuqq.downstream.core.model.ShardSet;
import com.ryuqq.downstream.core.request.DownstreamRequest;
import com.ryuqq.downstream.core.request.InstantRequest;
import com.ryuqq.downstream.core.request.RangeRequest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RequestTranslator 테스트.
 *
 * @author Downstream Team
 * @since 1.0.0
 */
class RequestTranslatorTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = START.plus(Duration.ofHours(1));

    @Test
    void toRequest_range_파라미터는_RangeRequest로_변환() {
        // given
        QueryParams params = QueryParams.range("{app=\"api\"}", START, END,
            Duration.ofSeconds(30), Duration.ofMillis(1500), Direction.BACKWARD, 500);
        ShardSet shards = ShardSet.of(new Shard(1, 4), new Shard(3, 4));

        // when
        DownstreamRequest request = RequestTranslator.toRequest(params, shards);

        // then
        assertThat(request).isInstanceOf(RangeRequest.class);
        RangeRequest range = (RangeRequest) request;
        assertThat(range.query()).isEqualTo("{app=\"api\"}");
        assertThat(range.start()).isEqualTo(START);
        assertThat(range.end()).isEqualTo(END);
        assertThat(range.stepMs()).isEqualTo(30_000L);
        assertThat(range.intervalMs()).isEqualTo(1_500L);
        assertThat(range.direction()).isEqualTo(Direction.BACKWARD);
        assertThat(range.limit()).isEqualTo(500);
        assertThat(range.path()).isEqualTo("/loki/api/v1/query_range");
        assertThat(range.shards()).containsExactly("1_of_4", "3_of_4");
        assertThat(ShardSet.decode(range.shards())).isEqualTo(shards);
    }

    @Test
    void toRequest_instant_파라미터는_단일_시각의_InstantRequest로_변환() {
        // given
        QueryParams params = QueryParams.instant("count_over_time({app=\"api\"}[5m])", START, Direction.FORWARD, 10);

        // when
        DownstreamRequest request = RequestTranslator.toRequest(params, ShardSet.none());

        // then
        assertThat(request).isInstanceOf(InstantRequest.class);
        InstantRequest instant = (InstantRequest) request;
        assertThat(instant.time()).isEqualTo(START);
        assertThat(instant.path()).isEqualTo("/loki/api/v1/query");
        assertThat(instant.stepMs()).isZero();
        assertThat(instant.shards()).isEmpty();
    }

    @Test
    void withQuery_최종_표현식으로_교체하고_나머지_필드는_유지() {
        // given
        QueryParams params = QueryParams.range("{app=\"api\"}", START, END,
            Duration.ofSeconds(15), Duration.ZERO, Direction.FORWARD, 100);
        DownstreamRequest request = RequestTranslator.toRequest(params, ShardSet.of(new Shard(0, 2)));

        // when
        DownstreamRequest rewritten = request.withQuery("sum by (app) (rate({app=\"api\"}[1m]))");

        // then
        assertThat(rewritten.query()).isEqualTo("sum by (app) (rate({app=\"api\"}[1m]))");
        assertThat(rewritten.shards()).isEqualTo(request.shards());
        assertThat(rewritten.stepMs()).isEqualTo(request.stepMs());
        assertThat(request.query()).isEqualTo("{app=\"api\"}");
    }

    @Test
    void toRequest_null_인자는_예외() {
        QueryParams params = QueryParams.instant("q", START, Direction.FORWARD, 1);

        assertThatThrownBy(() -> RequestTranslator.toRequest(null, ShardSet.none()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("params cannot be null");
        assertThatThrownBy(() -> RequestTranslator.toRequest(params, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("shards cannot be null");
    }
}
