/**
 * Core set model.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dataset.core.model.DataSet} - Named, insertion-ordered set of unique elements</li>
 *   <li>{@link com.ryuqq.dataset.core.model.Equivalence} - Element equality capability used for uniqueness checks</li>
 *   <li>{@link com.ryuqq.dataset.core.model.OrderedPair} - Element of a Cartesian product</li>
 *   <li>{@link com.ryuqq.dataset.core.model.SetAlgebra} - Pure set operations (union, intersection, difference,
 *       symmetric difference, subset and equality tests, power set, Cartesian product)</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Value semantics:</strong> Set equality is mutual inclusion; names and order are ignored</li>
 *   <li><strong>Minimal element contract:</strong> Only an equality relation is required of elements</li>
 *   <li><strong>Pure operations:</strong> Algebra never mutates operands</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author DataSet Team
 */
package com.ryuqq.dataset.core.model;
