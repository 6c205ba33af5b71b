package com.ryuqq.dataset.core.model;


import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * 이름이 붙은 수학적 집합.
 *
 * <p>DataSet은 원소의 유일성을 보장하는 순서 보존 컨테이너입니다.
 * 원소는 삽입 순서대로 유지되며 암묵적으로 정렬되지 않습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>저장된 두 원소가 서로 동등한 경우는 없음 ({@link Equivalence} 기준)</li>
 *   <li>삽입 순서 보존 (출력, 열거 순서 = 삽입 순서)</li>
 *   <li>이름은 진단/결과 표시용 라벨이며 동등성에 영향 없음</li>
 * </ul>
 *
 * <p><strong>동등성:</strong> 두 집합은 서로가 서로의 부분집합일 때만 같습니다
 * (순서, 이름 무관). {@link #equals(Object)}는 {@link #isEqualTo(DataSet)}에 위임하고,
 * {@link #hashCode()}는 순서와 무관한 원소 해시 합입니다.</p>
 *
 * <p><strong>집합 연산:</strong> 모든 연산은 피연산자를 변경하지 않고 새 집합을 반환합니다.
 * 구현은 {@link SetAlgebra}에 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DataSet&lt;Integer&gt; a = DataSet.of("A", 1, 2, 3);
 * DataSet&lt;Integer&gt; b = DataSet.of("B", 2, 3, 4);
 *
 * a.unionWith(b).render();        // "A ∪ B = {1, 2, 3, 4}"
 * a.intersectionWith(b).render(); // "A ∩ B = {2, 3}"
 * </pre>
 *
 * <p><strong>스레드 안전성:</strong> 동기화하지 않습니다. 단일 스레드에서 사용하세요.</p>
 *
 * @param <T> 원소 타입
 * @author DataSet Team
 * @since 1.0.0
 */
public final class DataSet<T> implements Iterable<T> {

    private String name;
    private final List<T> elements;
    private final Equivalence<? super T> equivalence;

    private DataSet(String name, Equivalence<? super T> equivalence) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (equivalence == null) {
            throw new IllegalArgumentException("equivalence cannot be null");
        }
        this.name = name;
        this.elements = new ArrayList<>();
        this.equivalence = equivalence;
    }

    /**
     * 빈 집합 생성 (equals 기반 동등성).
     *
     * @param name 집합 이름 (빈 문자열 허용)
     * @param <T> 원소 타입
     * @return 빈 DataSet
     * @throws IllegalArgumentException name이 null인 경우
     */
    public static <T> DataSet<T> named(String name) {
        return new DataSet<>(name, Equivalence.natural());
    }

    /**
     * 지정한 동등성으로 빈 집합 생성.
     *
     * @param name 집합 이름 (빈 문자열 허용)
     * @param equivalence 원소 동등성
     * @param <T> 원소 타입
     * @return 빈 DataSet
     * @throws IllegalArgumentException name 또는 equivalence가 null인 경우
     */
    public static <T> DataSet<T> named(String name, Equivalence<? super T> equivalence) {
        return new DataSet<>(name, equivalence);
    }

    /**
     * 원소를 순서대로 삽입한 집합 생성.
     *
     * <p>중복 값은 첫 번째 것만 남습니다.</p>
     *
     * @param name 집합 이름
     * @param values 삽입할 값
     * @param <T> 원소 타입
     * @return DataSet 인스턴스
     * @throws IllegalArgumentException name 또는 값 중 하나가 null인 경우
     */
    @SafeVarargs
    public static <T> DataSet<T> of(String name, T... values) {
        DataSet<T> set = named(name);
        for (T value : values) {
            set.insert(value);
        }
        return set;
    }

    /**
     * 유일성이 이미 보장된 원소 목록으로 집합 생성 (중복 검사 생략).
     *
     * <p>멱집합, 데카르트 곱처럼 구성상 중복이 생길 수 없는 결과를 만들 때만 사용합니다.</p>
     *
     * @param name 집합 이름
     * @param equivalence 원소 동등성
     * @param distinctValues 서로 동등하지 않은 값 (순서 유지)
     * @param <T> 원소 타입
     * @return DataSet 인스턴스
     */
    static <T> DataSet<T> ofDistinct(String name, Equivalence<? super T> equivalence, List<T> distinctValues) {
        DataSet<T> set = new DataSet<>(name, equivalence);
        set.elements.addAll(distinctValues);
        return set;
    }

    /**
     * 이름 조회.
     *
     * @return 집합 이름
     */
    public String getName() {
        return name;
    }

    /**
     * 이름 변경.
     *
     * <p>이름은 동등성에 영향을 주지 않습니다.</p>
     *
     * @param name 새 이름 (빈 문자열 허용)
     * @throws IllegalArgumentException name이 null인 경우
     */
    public void setName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.name = name;
    }

    /**
     * 원소 동등성 조회.
     *
     * @return 이 집합이 사용하는 Equivalence
     */
    public Equivalence<? super T> equivalence() {
        return equivalence;
    }

    /**
     * 값이 없을 때만 끝에 추가.
     *
     * <p>이미 동등한 원소가 있으면 아무것도 하지 않습니다 (멱등).</p>
     *
     * @param value 삽입할 값
     * @return 집합이 변경되었으면 true
     * @throws IllegalArgumentException value가 null인 경우
     */
    public boolean insert(T value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (contains(value)) {
            return false;
        }
        elements.add(value);
        return true;
    }

    /**
     * 여러 값을 순서대로 삽입.
     *
     * @param values 삽입할 값
     * @throws IllegalArgumentException values 또는 값 중 하나가 null인 경우
     */
    public void insertAll(Iterable<? extends T> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        for (T value : values) {
            insert(value);
        }
    }

    /**
     * 원소 포함 여부 (선형 탐색).
     *
     * <p>{@link java.util.Collection#contains(Object)}처럼 임의의 값을 받습니다.</p>
     *
     * @param value 찾을 값
     * @return 동등한 원소가 있으면 true, value가 null이면 false
     */
    public boolean contains(Object value) {
        if (value == null) {
            return false;
        }
        for (T element : elements) {
            if (equivalence.equivalent(element, value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 원소 개수.
     *
     * @return 원소 개수
     */
    public int size() {
        return elements.size();
    }

    /**
     * 빈 집합 여부.
     *
     * @return 원소가 없으면 true
     */
    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * 원소 스냅샷 (삽입 순서).
     *
     * <p>반환된 리스트는 수정할 수 없으며 이후 삽입이 반영되지 않습니다.</p>
     *
     * @return 원소 리스트 복사본
     */
    public List<T> elements() {
        return Collections.unmodifiableList(new ArrayList<>(elements));
    }

    /**
     * 삽입 순서 반복자 (remove 미지원).
     */
    @Override
    public Iterator<T> iterator() {
        return Collections.unmodifiableList(elements).iterator();
    }

    /**
     * 같은 이름과 원소를 갖는 분리된 복사본.
     *
     * @return 새 DataSet
     */
    public DataSet<T> copy() {
        return copy(name);
    }

    /**
     * 이름만 바꾼 분리된 복사본.
     *
     * @param newName 복사본 이름
     * @return 새 DataSet
     * @throws IllegalArgumentException newName이 null인 경우
     */
    public DataSet<T> copy(String newName) {
        DataSet<T> copy = new DataSet<>(newName, equivalence);
        copy.elements.addAll(elements);
        return copy;
    }

    /**
     * 합집합 A ∪ B.
     *
     * @param other 다른 집합
     * @return this 원소(원래 순서) + other 원소 중 없는 것
     */
    public DataSet<T> unionWith(DataSet<T> other) {
        return SetAlgebra.union(this, other);
    }

    /**
     * 교집합 A ∩ B.
     *
     * @param other 다른 집합
     * @return other에도 있는 this 원소 (this 순서)
     */
    public DataSet<T> intersectionWith(DataSet<T> other) {
        return SetAlgebra.intersection(this, other);
    }

    /**
     * 차집합 A − B.
     *
     * @param other 뺄 집합
     * @return other에 없는 this 원소 (this 순서)
     */
    public DataSet<T> differenceWith(DataSet<T> other) {
        return SetAlgebra.difference(this, other);
    }

    /**
     * 대칭차 A △ B.
     *
     * @param other 다른 집합
     * @return (A − B) 다음 (B − A)
     */
    public DataSet<T> symmetricDifferenceWith(DataSet<T> other) {
        return SetAlgebra.symmetricDifference(this, other);
    }

    /**
     * 부분집합 여부 A ⊆ B.
     *
     * @param other 비교 대상
     * @return 모든 원소가 other에 있으면 true (공집합은 항상 true)
     */
    public boolean isSubsetOf(DataSet<?> other) {
        return SetAlgebra.isSubset(this, other);
    }

    /**
     * 진부분집합 여부 A ⊂ B.
     *
     * @param other 비교 대상
     * @return A ⊆ B 이고 A ≠ B 이면 true
     */
    public boolean isProperSubsetOf(DataSet<?> other) {
        return SetAlgebra.isProperSubset(this, other);
    }

    /**
     * 집합 동등성 (A ⊆ B ∧ B ⊆ A).
     *
     * @param other 비교 대상
     * @return 같은 원소를 가지면 true (순서, 이름 무관)
     */
    public boolean isEqualTo(DataSet<?> other) {
        return SetAlgebra.isEqual(this, other);
    }

    /**
     * 멱집합 P(A).
     *
     * @return 2^n개의 부분집합을 원소로 갖는 집합
     * @throws IllegalStateException 원소가 너무 많아 부분집합 수가 컬렉션 한계를 넘는 경우
     */
    public DataSet<DataSet<T>> powerSet() {
        return SetAlgebra.powerSet(this);
    }

    /**
     * 데카르트 곱 A × B.
     *
     * @param other 오른쪽 집합
     * @param <U> 오른쪽 집합 원소 타입
     * @return 순서쌍 (a, b) 집합, 크기 |A|·|B|
     */
    public <U> DataSet<OrderedPair<T, U>> cartesianProductWith(DataSet<U> other) {
        return SetAlgebra.cartesianProduct(this, other);
    }

    /**
     * "name = {e1, e2, ...}" 형식 문자열.
     *
     * <p>이름이 비어 있으면 "name = " 접두어를 생략합니다.</p>
     *
     * @return 출력 문자열
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        if (!name.isEmpty()) {
            sb.append(name).append(" = ");
        }
        sb.append('{');
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(elements.get(i));
        }
        sb.append('}');
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataSet)) return false;
        return isEqualTo((DataSet<?>) o);
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (T element : elements) {
            hash += equivalence.hash(element);
        }
        return hash;
    }

    @Override
    public String toString() {
        return render();
    }
}
