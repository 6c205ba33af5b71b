/**
 * Named set registry.
 *
 * <p>{@link com.ryuqq.dataset.application.registry.SetRegistry} lets callers address
 * sets by label. {@link com.ryuqq.dataset.application.registry.DefaultSetRegistry}
 * resolves names through a {@link com.ryuqq.dataset.core.spi.SetStore} and forwards
 * operation requests to the set algebra engine.</p>
 *
 * @since 1.0.0
 * @author DataSet Team
 */
package com.ryuqq.dataset.application.registry;
