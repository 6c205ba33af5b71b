package com.ryuqq.dataset.application.registry;

import com.ryuqq.dataset.core.algebra.SetOperation;
import com.ryuqq.dataset.core.algebra.UnaryOperation;
import com.ryuqq.dataset.core.exception.SetNotFoundException;
import com.ryuqq.dataset.core.model.DataSet;
import com.ryuqq.dataset.core.model.OrderedPair;
import com.ryuqq.dataset.core.spi.SetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link SetRegistry} 기본 구현.
 *
 * <p>저장은 {@link SetStore} SPI에 위임하고, 이 클래스는 이름 해석과 연산 분기만 담당합니다.</p>
 *
 * <p><strong>처리 흐름 (operate):</strong></p>
 * <pre>
 * 1. nameA 해석 → 없으면 SetNotFoundException
 * 2. nameB 해석 → 없으면 SetNotFoundException
 * 3. opKind 검증 → 알 수 없으면 InvalidOperationException
 * 4. SetOperation.apply(A, B)
 * 5. 결과 이름을 "(nameA opKind nameB)"로 변경
 * </pre>
 *
 * <p><strong>스레드 안전성:</strong> 동기화하지 않습니다.</p>
 *
 * @param <T> 원소 타입
 * @author DataSet Team
 * @since 1.0.0
 */
public final class DefaultSetRegistry<T> implements SetRegistry<T> {

    private static final Logger log = LoggerFactory.getLogger(DefaultSetRegistry.class);
    private final SetStore<T> store;

    /**
     * 생성자.
     *
     * @param store 저장소
     * @throws IllegalArgumentException store가 null인 경우
     */
    public DefaultSetRegistry(SetStore<T> store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public void addSet(DataSet<T> set) {
        if (set == null) {
            throw new IllegalArgumentException("set cannot be null");
        }
        boolean overwrite = store.exists(set.getName());
        store.save(set);
        log.debug("{} set '{}' ({} element(s))", overwrite ? "Overwrote" : "Registered", set.getName(), set.size());
    }

    @Override
    public boolean hasSet(String name) {
        requireName(name);
        return store.exists(name);
    }

    @Override
    public DataSet<T> getSet(String name) {
        return resolve(name);
    }

    @Override
    public void insertInto(String name, T value) {
        DataSet<T> set = resolve(name);
        if (set.insert(value)) {
            store.save(set);
            log.debug("Inserted {} into set '{}'", value, name);
        }
    }

    @Override
    public List<String> setNames() {
        return store.names();
    }

    @Override
    public DataSet<T> operate(String nameA, String opKind, String nameB) {
        if (opKind == null) {
            throw new IllegalArgumentException("opKind cannot be null");
        }
        DataSet<T> a = resolve(nameA);
        DataSet<T> b = resolve(nameB);
        SetOperation operation = SetOperation.fromToken(opKind);
        return apply(a, operation, b);
    }

    @Override
    public DataSet<T> operate(String nameA, SetOperation operation, String nameB) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        DataSet<T> a = resolve(nameA);
        DataSet<T> b = resolve(nameB);
        return apply(a, operation, b);
    }

    @Override
    public DataSet<DataSet<T>> operateUnary(String name, String opKind) {
        if (opKind == null) {
            throw new IllegalArgumentException("opKind cannot be null");
        }
        DataSet<T> set = resolve(name);
        UnaryOperation operation = UnaryOperation.fromToken(opKind);
        DataSet<DataSet<T>> result = operation.apply(set);
        log.debug("{} of '{}' produced {} subset(s)", operation, name, result.size());
        return result;
    }

    @Override
    public DataSet<OrderedPair<T, T>> cartesianProduct(String nameA, String nameB) {
        DataSet<T> a = resolve(nameA);
        DataSet<T> b = resolve(nameB);
        DataSet<OrderedPair<T, T>> result = a.cartesianProductWith(b);
        log.debug("Cartesian product '{}' × '{}' produced {} pair(s)", nameA, nameB, result.size());
        return result;
    }

    @Override
    public boolean isSubset(String nameA, String nameB) {
        DataSet<T> a = resolve(nameA);
        DataSet<T> b = resolve(nameB);
        return a.isSubsetOf(b);
    }

    @Override
    public boolean isEqual(String nameA, String nameB) {
        DataSet<T> a = resolve(nameA);
        DataSet<T> b = resolve(nameB);
        return a.isEqualTo(b);
    }

    @Override
    public int sizeOf(String name) {
        return resolve(name).size();
    }

    /**
     * 이항 연산 실행 후 결과 이름을 "(A op B)"로 변경.
     */
    private DataSet<T> apply(DataSet<T> a, SetOperation operation, DataSet<T> b) {
        DataSet<T> result = operation.apply(a, b);
        result.setName("(" + a.getName() + " " + operation.token() + " " + b.getName() + ")");
        log.debug("{} → {} element(s)", result.getName(), result.size());
        return result;
    }

    private DataSet<T> resolve(String name) {
        requireName(name);
        return store.findByName(name).orElseThrow(() -> new SetNotFoundException(name));
    }

    private static void requireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
    }
}
