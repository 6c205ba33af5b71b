/**
 * In-memory {@link com.ryuqq.dataset.core.spi.SetStore} implementation.
 *
 * <p>Default storage of the named registry and the reference implementation
 * exercised by the testkit contract tests.</p>
 *
 * @since 1.0.0
 * @author DataSet Team
 */
package com.ryuqq.dataset.adapter.inmemory.store;
