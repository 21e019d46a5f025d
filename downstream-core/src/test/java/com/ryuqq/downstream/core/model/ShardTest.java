package com.ryuqq.downstream.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Shard / ShardSet Value Object 테스트.
 *
 * @author Downstream Team
 * @since 1.0.0
 */
class ShardTest {

    @Test
    void encode_ValidShard_ReturnsIndexOfToken() {
        assertEquals("3_of_16", new Shard(3, 16).encode());
        assertEquals("3_of_16", new Shard(3, 16).toString());
    }

    @Test
    void parse_ValidToken_ReturnsShard() {
        // When
        Shard shard = Shard.parse("0_of_4");

        // Then
        assertEquals(0, shard.index());
        assertEquals(4, shard.of());
    }

    @Test
    void constructor_IndexOutOfRange_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Shard(4, 4)
        );
        assertTrue(exception.getMessage().contains("index must be between 0 and 3"));
    }

    @Test
    void constructor_NonPositiveOf_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Shard(0, 0));
    }

    @Test
    void parse_MalformedToken_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Shard.parse("3-of-16"));
        assertThrows(IllegalArgumentException.class, () -> Shard.parse("_of_16"));
        assertThrows(IllegalArgumentException.class, () -> Shard.parse("a_of_16"));
        assertThrows(IllegalArgumentException.class, () -> Shard.parse(null));
    }

    @Test
    void shardSet_DecodeEncode_PreservesOrder() {
        // Given
        List<String> tokens = List.of("2_of_4", "0_of_4", "3_of_4");

        // When
        ShardSet shards = ShardSet.decode(tokens);

        // Then
        assertEquals(tokens, shards.encode());
        assertEquals(new Shard(2, 4), shards.shards().get(0));
    }

    @Test
    void shardSet_Empty_IsNone() {
        assertTrue(ShardSet.of(List.of()).isEmpty());
        assertEquals(ShardSet.none(), ShardSet.decode(List.of()));
        assertTrue(ShardSet.none().encode().isEmpty());
    }

    @Test
    void shardSet_NullElement_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ShardSet.of(java.util.Arrays.asList(new Shard(0, 2), null)));
    }
}
