package com.ryuqq.dataset.testkit.contract;

import com.ryuqq.dataset.core.model.DataSet;

/**
 * Test fixtures shared by contract tests.
 *
 * <p>Canonical operands used across the test suites:</p>
 * <pre>
 * A = {1, 2, 3}
 * B = {2, 3, 4}
 * E = {}
 * </pre>
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public final class SetFixtures {

    private SetFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Creates A = {1, 2, 3}.
     *
     * @return a new set named "A"
     */
    public static DataSet<Integer> setA() {
        return DataSet.of("A", 1, 2, 3);
    }

    /**
     * Creates B = {2, 3, 4}.
     *
     * @return a new set named "B"
     */
    public static DataSet<Integer> setB() {
        return DataSet.of("B", 2, 3, 4);
    }

    /**
     * Creates an empty set.
     *
     * @param name the set name
     * @return a new empty set
     */
    public static DataSet<Integer> empty(String name) {
        return DataSet.named(name);
    }

    /**
     * Creates a set {0, 1, ..., n - 1}.
     *
     * @param name the set name
     * @param n element count
     * @return a new set with n elements
     */
    public static DataSet<Integer> range(String name, int n) {
        DataSet<Integer> set = DataSet.named(name);
        for (int i = 0; i < n; i++) {
            set.insert(i);
        }
        return set;
    }
}
