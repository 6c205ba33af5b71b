/**
 * Named set operations.
 *
 * <p>{@link com.ryuqq.dataset.core.algebra.SetOperation} and
 * {@link com.ryuqq.dataset.core.algebra.UnaryOperation} map operation tokens such as
 * {@code "union"} or {@code "powerset"} onto {@link com.ryuqq.dataset.core.model.SetAlgebra}.</p>
 *
 * @since 1.0.0
 * @author DataSet Team
 */
package com.ryuqq.dataset.core.algebra;
