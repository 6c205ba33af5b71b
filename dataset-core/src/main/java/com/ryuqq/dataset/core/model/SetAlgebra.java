package com.ryuqq.dataset.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 집합 연산 엔진.
 *
 * <p>모든 연산은 {@link DataSet}의 insert / contains / elements 기본 연산으로
 * 구현된 순수 함수입니다. 피연산자를 변경하지 않으며 항상 새 집합을 반환합니다.</p>
 *
 * <p><strong>결과 순서 규칙:</strong></p>
 * <ul>
 *   <li>union: A 원소(원래 순서) → A에 없는 B 원소(B 순서)</li>
 *   <li>intersection, difference: A 순서</li>
 *   <li>symmetric difference: (A − B) A 순서 → (B − A) B 순서</li>
 *   <li>power set: 비트 패턴 k = 0 .. 2^n − 1 순서, 각 부분집합은 원래 인덱스 오름차순</li>
 *   <li>cartesian product: A 바깥 루프, B 안쪽 루프</li>
 * </ul>
 *
 * <p><strong>비용:</strong></p>
 * <ul>
 *   <li>이항 연산, 부분집합/동등 판정: O(n·m)</li>
 *   <li>멱집합: 부분집합 2^n개, 원소 복사 포함 O(n·2^n)</li>
 *   <li>데카르트 곱: O(n·m)</li>
 * </ul>
 *
 * <p>결과 집합은 왼쪽 피연산자의 {@link Equivalence}를 사용합니다.</p>
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public final class SetAlgebra {

    /**
     * 멱집합을 만들 수 있는 최대 원소 수.
     *
     * <p>2^31개 이상의 부분집합은 Java 컬렉션 용량을 넘습니다.</p>
     */
    public static final int MAX_POWER_SET_SOURCE_SIZE = 30;

    // Utility class - prevent instantiation
    private SetAlgebra() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 합집합 A ∪ B.
     *
     * @param a 왼쪽 집합
     * @param b 오른쪽 집합
     * @param <T> 원소 타입
     * @return 이름이 "A ∪ B"인 새 집합
     * @throws IllegalArgumentException a 또는 b가 null인 경우
     */
    public static <T> DataSet<T> union(DataSet<T> a, DataSet<T> b) {
        requireOperands(a, b);
        DataSet<T> result = DataSet.named(a.getName() + " ∪ " + b.getName(), a.equivalence());
        for (T value : a.elements()) {
            result.insert(value);
        }
        for (T value : b.elements()) {
            result.insert(value);
        }
        return result;
    }

    /**
     * 교집합 A ∩ B.
     *
     * @param a 왼쪽 집합
     * @param b 오른쪽 집합
     * @param <T> 원소 타입
     * @return 이름이 "A ∩ B"인 새 집합
     * @throws IllegalArgumentException a 또는 b가 null인 경우
     */
    public static <T> DataSet<T> intersection(DataSet<T> a, DataSet<T> b) {
        requireOperands(a, b);
        DataSet<T> result = DataSet.named(a.getName() + " ∩ " + b.getName(), a.equivalence());
        for (T value : a.elements()) {
            if (b.contains(value)) {
                result.insert(value);
            }
        }
        return result;
    }

    /**
     * 차집합 A − B.
     *
     * @param a 왼쪽 집합
     * @param b 뺄 집합
     * @param <T> 원소 타입
     * @return 이름이 "A-B"인 새 집합
     * @throws IllegalArgumentException a 또는 b가 null인 경우
     */
    public static <T> DataSet<T> difference(DataSet<T> a, DataSet<T> b) {
        requireOperands(a, b);
        DataSet<T> result = DataSet.named(a.getName() + "-" + b.getName(), a.equivalence());
        appendMissing(result, a, b);
        return result;
    }

    /**
     * 대칭차 A △ B = (A − B) ∪ (B − A).
     *
     * @param a 왼쪽 집합
     * @param b 오른쪽 집합
     * @param <T> 원소 타입
     * @return 이름이 "A symmetric_difference B"인 새 집합
     * @throws IllegalArgumentException a 또는 b가 null인 경우
     */
    public static <T> DataSet<T> symmetricDifference(DataSet<T> a, DataSet<T> b) {
        requireOperands(a, b);
        DataSet<T> result = DataSet.named(
            a.getName() + " symmetric_difference " + b.getName(), a.equivalence());
        appendMissing(result, a, b);
        appendMissing(result, b, a);
        return result;
    }

    /**
     * 부분집합 판정 A ⊆ B.
     *
     * <p>공집합은 자기 자신을 포함한 모든 집합의 부분집합입니다.</p>
     *
     * @param a 왼쪽 집합
     * @param b 오른쪽 집합
     * @return A의 모든 원소가 B에 있으면 true
     * @throws IllegalArgumentException a 또는 b가 null인 경우
     */
    public static boolean isSubset(DataSet<?> a, DataSet<?> b) {
        requireOperands(a, b);
        for (Object value : a) {
            if (!b.contains(value)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 진부분집합 판정 A ⊂ B.
     *
     * @param a 왼쪽 집합
     * @param b 오른쪽 집합
     * @return A ⊆ B 이고 B ⊄ A 이면 true
     * @throws IllegalArgumentException a 또는 b가 null인 경우
     */
    public static boolean isProperSubset(DataSet<?> a, DataSet<?> b) {
        return isSubset(a, b) && !isSubset(b, a);
    }

    /**
     * 집합 동등 판정 (A ⊆ B ∧ B ⊆ A).
     *
     * <p>집합 동등성의 유일한 정의입니다. 순서와 이름은 무시합니다.</p>
     *
     * @param a 왼쪽 집합
     * @param b 오른쪽 집합
     * @return 같은 원소를 가지면 true
     * @throws IllegalArgumentException a 또는 b가 null인 경우
     */
    public static boolean isEqual(DataSet<?> a, DataSet<?> b) {
        return isSubset(a, b) && isSubset(b, a);
    }

    /**
     * 멱집합 P(A).
     *
     * <p><strong>열거 방식:</strong></p>
     * <pre>
     * 원소를 삽입 순서대로 0 .. n−1 번호 부여
     * for k in [0, 2^n):
     *   subset = { element[i] | k의 i번째 비트가 1 }  (i 오름차순)
     *   result.insert(subset)
     * </pre>
     *
     * <p>중복 없는 입력에서 서로 다른 비트 패턴의 부분집합은 절대 같지 않으므로
     * 중복 검사 없이 바로 추가하며 결과 크기는 정확히 2^n입니다.
     * 바깥 집합의 동등성은 {@link Equivalence#setEquality()}입니다.</p>
     *
     * <p>각 부분집합의 이름은 빈 문자열이므로 "{1, 2}" 형태로 출력됩니다.</p>
     *
     * @param a 원본 집합
     * @param <T> 원소 타입
     * @return 이름이 "A Power Set"인 집합의 집합
     * @throws IllegalArgumentException a가 null인 경우
     * @throws IllegalStateException 원소 수가 {@link #MAX_POWER_SET_SOURCE_SIZE}를 넘는 경우
     */
    public static <T> DataSet<DataSet<T>> powerSet(DataSet<T> a) {
        if (a == null) {
            throw new IllegalArgumentException("set cannot be null");
        }
        int n = a.size();
        if (n > MAX_POWER_SET_SOURCE_SIZE) {
            throw new IllegalStateException(
                String.format("Power set of '%s' is too large: %d elements (max %d)",
                    a.getName(), n, MAX_POWER_SET_SOURCE_SIZE)
            );
        }

        List<T> source = a.elements();
        int total = 1 << n;
        List<DataSet<T>> subsets = new ArrayList<>(total);
        for (int k = 0; k < total; k++) {
            List<T> members = new ArrayList<>(Integer.bitCount(k));
            for (int i = 0; i < n; i++) {
                if ((k & (1 << i)) != 0) {
                    members.add(source.get(i));
                }
            }
            subsets.add(DataSet.ofDistinct("", a.equivalence(), members));
        }
        return DataSet.ofDistinct(a.getName() + " Power Set", Equivalence.setEquality(), subsets);
    }

    /**
     * 데카르트 곱 A × B.
     *
     * <p>피연산자가 이미 유일성을 보장하므로 같은 순서쌍은 생기지 않습니다.
     * 중복 검사 없이 바로 추가하며 결과 크기는 정확히 |A|·|B|입니다.</p>
     *
     * @param a 왼쪽 집합 (바깥 루프)
     * @param b 오른쪽 집합 (안쪽 루프)
     * @param <T> 왼쪽 원소 타입
     * @param <U> 오른쪽 원소 타입
     * @return 이름이 "A × B"인 순서쌍 집합
     * @throws IllegalArgumentException a 또는 b가 null인 경우
     */
    public static <T, U> DataSet<OrderedPair<T, U>> cartesianProduct(DataSet<T> a, DataSet<U> b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Operands cannot be null (left: " + a + ", right: " + b + ")");
        }
        List<U> right = b.elements();
        List<OrderedPair<T, U>> pairs = new ArrayList<>(a.size() * right.size());
        for (T first : a) {
            for (U second : right) {
                pairs.add(OrderedPair.of(first, second));
            }
        }
        return DataSet.ofDistinct(a.getName() + " × " + b.getName(), Equivalence.natural(), pairs);
    }

    private static <T> void appendMissing(DataSet<T> target, DataSet<T> source, DataSet<T> excluded) {
        for (T value : source.elements()) {
            if (!excluded.contains(value)) {
                target.insert(value);
            }
        }
    }

    private static void requireOperands(DataSet<?> a, DataSet<?> b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Operands cannot be null (left: " + a + ", right: " + b + ")");
        }
    }
}
