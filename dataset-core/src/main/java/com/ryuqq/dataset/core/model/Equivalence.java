package com.ryuqq.dataset.core.model;

import java.util.Objects;

/**
 * 원소 동등성 판정 기능.
 *
 * <p>{@link DataSet}은 원소의 중복 여부를 이 인터페이스로만 판정합니다.
 * 원소 타입에 요구되는 것은 동등성 관계 하나뿐이며, 정렬이나 해시 인덱스는 요구하지 않습니다.</p>
 *
 * <p>비교 대상(candidate)은 {@link java.util.Collection#contains(Object)}처럼 {@code Object}로 받습니다.
 * 원소 타입이 다른 집합끼리 비교할 때는 타입이 맞지 않는 후보에 대해 false를 반환해야 합니다.</p>
 *
 * <p><strong>제공 구현:</strong></p>
 * <ul>
 *   <li>{@link #natural()}: {@link Object#equals(Object)} 기반 (기본값)</li>
 *   <li>{@link #setEquality()}: 집합 원소용, {@link DataSet#isEqualTo(DataSet)} 기반 (상호 부분집합)</li>
 * </ul>
 *
 * <p><strong>구현 규약:</strong></p>
 * <ul>
 *   <li>반사성, 대칭성, 추이성을 만족해야 함</li>
 *   <li>{@code equivalent(a, b)}가 true이면 {@code hash(a) == hash(b)}</li>
 * </ul>
 *
 * @param <T> 원소 타입
 * @author DataSet Team
 * @since 1.0.0
 */
public interface Equivalence<T> {

    /**
     * 저장된 원소와 후보 값이 같은 원소인지 판정.
     *
     * @param member 집합에 저장된 원소 (null 아님)
     * @param candidate 비교할 값 (null 아님, 타입 미확정)
     * @return 동등 여부
     */
    boolean equivalent(T member, Object candidate);

    /**
     * 동등성과 일관된 해시 값.
     *
     * @param value 값
     * @return 해시 값
     */
    default int hash(T value) {
        return Objects.hashCode(value);
    }

    /**
     * {@link Object#equals(Object)} 기반 동등성.
     *
     * @return natural equivalence
     */
    static Equivalence<Object> natural() {
        return Natural.INSTANCE;
    }

    /**
     * 집합 값 동등성 (순서, 이름 무시).
     *
     * <p>멱집합처럼 집합을 원소로 갖는 집합에서 사용합니다.
     * 참조 동등성이나 내부 순서가 아니라 {@link DataSet#isEqualTo(DataSet)}로 비교합니다.
     * 후보가 집합이 아니면 false입니다.</p>
     *
     * @return set equivalence
     */
    static Equivalence<DataSet<?>> setEquality() {
        return SetEquality.INSTANCE;
    }

    /**
     * equals 기반 구현.
     */
    enum Natural implements Equivalence<Object> {
        INSTANCE;

        @Override
        public boolean equivalent(Object member, Object candidate) {
            return Objects.equals(member, candidate);
        }
    }

    /**
     * 상호 부분집합 기반 구현.
     */
    enum SetEquality implements Equivalence<DataSet<?>> {
        INSTANCE;

        @Override
        public boolean equivalent(DataSet<?> member, Object candidate) {
            if (!(candidate instanceof DataSet)) {
                return false;
            }
            return member.isEqualTo((DataSet<?>) candidate);
        }

        @Override
        public int hash(DataSet<?> value) {
            return value.hashCode();
        }
    }
}
