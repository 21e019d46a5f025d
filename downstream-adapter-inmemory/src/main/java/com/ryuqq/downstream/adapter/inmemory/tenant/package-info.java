/**
 * Context-carried tenant resolution.
 *
 * @author Downstream Team
 * @since 1.0.0
 */
package com.ryuqq.downstream.adapter.inmemory.tenant;
