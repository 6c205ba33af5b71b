package com.ryuqq.dataset.core.model;

/**
 * 순서쌍 (a, b).
 *
 * <p>데카르트 곱의 원소입니다. 두 성분이 각각 같을 때만 같은 순서쌍입니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * OrderedPair&lt;Integer, Integer&gt; pair = OrderedPair.of(1, 2);
 * pair.toString(); // "(1, 2)"
 * </pre>
 *
 * @param first 첫 번째 성분 (왼쪽 집합의 원소)
 * @param second 두 번째 성분 (오른쪽 집합의 원소)
 * @param <A> 첫 번째 성분 타입
 * @param <B> 두 번째 성분 타입
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public record OrderedPair<A, B>(A first, B second) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException first 또는 second가 null인 경우
     */
    public OrderedPair {
        if (first == null) {
            throw new IllegalArgumentException("first cannot be null");
        }
        if (second == null) {
            throw new IllegalArgumentException("second cannot be null");
        }
    }

    /**
     * OrderedPair 생성.
     *
     * @param first 첫 번째 성분
     * @param second 두 번째 성분
     * @param <A> 첫 번째 성분 타입
     * @param <B> 두 번째 성분 타입
     * @return OrderedPair 인스턴스
     */
    public static <A, B> OrderedPair<A, B> of(A first, B second) {
        return new OrderedPair<>(first, second);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
