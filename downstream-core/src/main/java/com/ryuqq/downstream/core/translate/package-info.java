/**
 * Pure translators between the logical query model and the downstream wire shapes.
 *
 * <ul>
 *   <li>{@link com.ryuqq.downstream.core.translate.RequestTranslator} - params + shards to request</li>
 *   <li>{@link com.ryuqq.downstream.core.translate.ResponseTranslator} - response to uniform result</li>
 * </ul>
 *
 * <p>Both are usable on their own, e.g. for single-query execution without fan-out.</p>
 *
 * @since 1.0.0
 * @author Downstream Team
 */
package com.ryuqq.downstream.core.translate;
