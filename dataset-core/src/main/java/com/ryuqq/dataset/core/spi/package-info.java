/**
 * Service Provider Interfaces of the DataSet SDK.
 *
 * <ul>
 *   <li>{@link com.ryuqq.dataset.core.spi.SetStore} - Name-indexed storage of sets</li>
 * </ul>
 *
 * <p>An in-memory implementation is provided by the {@code dataset-adapter-inmemory} module.</p>
 *
 * @since 1.0.0
 * @author DataSet Team
 */
package com.ryuqq.dataset.core.spi;
