/**
 * Concurrency protection.
 *
 * <p>{@link com.ryuqq.downstream.core.protection.TokenPool} bounds the number of sub-queries in
 * flight within one dispatcher instance. It is enforced at the dispatcher boundary no matter how many
 * sub-queries the upstream sharding produced, so a query such as {@code a / a / a / ...} whose legs are
 * each sharded cannot spawn unbounded work.</p>
 *
 * @since 1.0.0
 * @author Downstream Team
 */
package com.ryuqq.downstream.core.protection;
