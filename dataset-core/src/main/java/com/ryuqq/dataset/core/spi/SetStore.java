package com.ryuqq.dataset.core.spi;

import com.ryuqq.dataset.core.model.DataSet;

import java.util.List;
import java.util.Optional;

/**
 * Storage SPI for named sets.
 *
 * <p>This interface abstracts where the registry keeps its sets. The registry
 * resolves names and dispatches algebra; the store only holds values.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Keep at most one set per name</li>
 *   <li>Overwrite on duplicate name (replace content, never merge)</li>
 *   <li>Preserve registration order of names</li>
 *   <li>Isolate stored state from callers (copy in, copy out)</li>
 * </ul>
 *
 * <p><strong>Ownership:</strong></p>
 * <pre>
 * store.save(set);          // stores a copy of set
 * set.insert(99);           // does not affect stored state
 * store.findByName("A")     // returns a detached copy
 *      .ifPresent(s -&gt; s.insert(42)); // does not affect stored state
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>No deletion of individual entries</li>
 *   <li>Overwriting a name keeps its original position in {@link #names()}</li>
 *   <li>Thread-safety is not required</li>
 * </ul>
 *
 * @param <T> element type of stored sets
 * @author DataSet Team
 * @since 1.0.0
 */
public interface SetStore<T> {

    /**
     * Stores a copy of the set under its name.
     *
     * <p>If a set with the same name exists, its content is replaced.</p>
     *
     * @param set the set to store
     * @throws IllegalArgumentException if set is null
     */
    void save(DataSet<T> set);

    /**
     * Looks up a set by name.
     *
     * @param name the set name
     * @return a detached copy, or empty if no set has that name
     * @throws IllegalArgumentException if name is null
     */
    Optional<DataSet<T>> findByName(String name);

    /**
     * Checks whether a set with the given name is stored.
     *
     * @param name the set name
     * @return true if stored
     * @throws IllegalArgumentException if name is null
     */
    boolean exists(String name);

    /**
     * Returns all stored names in registration order.
     *
     * @return snapshot list of names
     */
    List<String> names();

    /**
     * Returns the number of stored sets.
     *
     * @return stored set count
     */
    int count();

    /**
     * Removes every stored set.
     *
     * <p>Used for test cleanup; the registry never calls this.</p>
     */
    void clear();
}
