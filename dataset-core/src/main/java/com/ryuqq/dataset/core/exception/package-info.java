/**
 * Registry failure taxonomy.
 *
 * <p>All failures extend the sealed {@link com.ryuqq.dataset.core.exception.DataSetException}.
 * The set container itself never throws these; they are raised when names or
 * operation tokens are resolved.</p>
 *
 * @since 1.0.0
 * @author DataSet Team
 */
package com.ryuqq.dataset.core.exception;
