package com.ryuqq.dataset.adapter.inmemory.store;

import com.ryuqq.dataset.core.model.DataSet;
import com.ryuqq.dataset.core.spi.SetStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of {@link SetStore} SPI.
 *
 * <p>Sets are kept in a direct name → set mapping, so lookups do not scan the
 * registered names. A {@link LinkedHashMap} keeps names in registration order;
 * re-saving an existing name replaces the value without moving the key.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>sets:</strong> LinkedHashMap&lt;String, DataSet&lt;T&gt;&gt; - Stored copies keyed by name (O(1) access)</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>save:</strong> O(n) - copies the n elements of the set</li>
 *   <li><strong>findByName:</strong> O(1) lookup + O(n) copy</li>
 *   <li><strong>exists:</strong> O(1)</li>
 *   <li><strong>names:</strong> O(k) for k stored sets</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Not thread-safe</li>
 *   <li>Data lost on process exit</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * SetStore&lt;Integer&gt; store = new InMemorySetStore&lt;&gt;();
 * store.save(DataSet.of("A", 1, 2, 3));
 *
 * // detached copy
 * DataSet&lt;Integer&gt; a = store.findByName("A").orElseThrow();
 * </pre>
 *
 * @param <T> element type of stored sets
 * @author DataSet Team
 * @since 1.0.0
 */
public class InMemorySetStore<T> implements SetStore<T> {

    /**
     * Stored sets.
     * Key: set name, Value: private copy of the set
     */
    private final Map<String, DataSet<T>> sets;

    /**
     * Creates a new InMemorySetStore with empty storage.
     */
    public InMemorySetStore() {
        this.sets = new LinkedHashMap<>();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Stores {@code set.copy()}, never the caller's instance</li>
     *   <li>Existing key keeps its insertion position in the LinkedHashMap</li>
     * </ul>
     */
    @Override
    public void save(DataSet<T> set) {
        if (set == null) {
            throw new IllegalArgumentException("set cannot be null");
        }
        sets.put(set.getName(), set.copy());
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<DataSet<T>> findByName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        DataSet<T> stored = sets.get(name);
        return stored != null ? Optional.of(stored.copy()) : Optional.empty();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean exists(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        return sets.containsKey(name);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<String> names() {
        return List.copyOf(sets.keySet());
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int count() {
        return sets.size();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void clear() {
        sets.clear();
    }
}
