package com.ryuqq.dataset.application.registry;

import com.ryuqq.dataset.core.algebra.SetOperation;
import com.ryuqq.dataset.core.exception.InvalidOperationException;
import com.ryuqq.dataset.core.exception.SetNotFoundException;
import com.ryuqq.dataset.core.exception.UnsupportedSetOperationException;
import com.ryuqq.dataset.core.model.DataSet;
import com.ryuqq.dataset.core.model.OrderedPair;

import java.util.List;

/**
 * 이름 기반 집합 레지스트리.
 *
 * <p>집합을 참조(handle) 대신 이름으로 다룰 수 있게 하고,
 * 이름으로 지정한 연산을 집합 연산 엔진에 전달합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SetRegistry&lt;Integer&gt; registry = new DefaultSetRegistry&lt;&gt;();
 * registry.addSet(DataSet.of("A", 1, 2, 3));
 * registry.addSet(DataSet.of("B", 2, 3, 4));
 *
 * DataSet&lt;Integer&gt; union = registry.operate("A", "union", "B");
 * union.render(); // "(A union B) = {1, 2, 3, 4}"
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>이름당 최대 하나의 집합</li>
 *   <li>같은 이름으로 추가하면 덮어씀 (병합 아님)</li>
 *   <li>삭제 연산 없음</li>
 *   <li>조회 결과는 분리된 복사본 (호출자 변경이 저장 상태에 영향 없음)</li>
 * </ul>
 *
 * <p><strong>실패:</strong> {@link SetNotFoundException}, {@link InvalidOperationException},
 * {@link UnsupportedSetOperationException}만 발생하며 모두 호출자에게 그대로 전달됩니다.</p>
 *
 * @param <T> 원소 타입
 * @author DataSet Team
 * @since 1.0.0
 */
public interface SetRegistry<T> {

    /**
     * 집합 저장 (같은 이름이 있으면 덮어씀).
     *
     * @param set 저장할 집합 (복사되어 저장됨)
     * @throws IllegalArgumentException set이 null인 경우
     */
    void addSet(DataSet<T> set);

    /**
     * 이름 존재 여부.
     *
     * @param name 집합 이름
     * @return 등록되어 있으면 true
     */
    boolean hasSet(String name);

    /**
     * 집합 조회.
     *
     * @param name 집합 이름
     * @return 분리된 복사본
     * @throws SetNotFoundException 이름이 없는 경우
     */
    DataSet<T> getSet(String name);

    /**
     * 이름으로 지정한 집합에 값 삽입.
     *
     * @param name 집합 이름
     * @param value 삽입할 값
     * @throws SetNotFoundException 이름이 없는 경우
     */
    void insertInto(String name, T value);

    /**
     * 등록된 모든 이름 (등록 순서).
     *
     * @return 이름 리스트 스냅샷
     */
    List<String> setNames();

    /**
     * 이항 연산 실행 (토큰 지정).
     *
     * <p>결과 이름은 "(nameA opKind nameB)"입니다.</p>
     *
     * @param nameA 왼쪽 집합 이름
     * @param opKind union / intersection / difference / symmetric_difference
     * @param nameB 오른쪽 집합 이름
     * @return 새 결과 집합
     * @throws SetNotFoundException 피연산자 이름이 없는 경우 (nameA 먼저 확인)
     * @throws InvalidOperationException opKind를 인식할 수 없는 경우
     */
    DataSet<T> operate(String nameA, String opKind, String nameB);

    /**
     * 이항 연산 실행.
     *
     * @param nameA 왼쪽 집합 이름
     * @param operation 연산
     * @param nameB 오른쪽 집합 이름
     * @return 새 결과 집합, 이름은 "(nameA token nameB)"
     * @throws SetNotFoundException 피연산자 이름이 없는 경우
     */
    DataSet<T> operate(String nameA, SetOperation operation, String nameB);

    /**
     * 단항 연산 실행.
     *
     * @param name 집합 이름
     * @param opKind "powerset"만 정의됨
     * @return 집합의 집합
     * @throws SetNotFoundException 이름이 없는 경우
     * @throws UnsupportedSetOperationException opKind가 "powerset"이 아닌 경우
     */
    DataSet<DataSet<T>> operateUnary(String name, String opKind);

    /**
     * 데카르트 곱.
     *
     * @param nameA 왼쪽 집합 이름
     * @param nameB 오른쪽 집합 이름
     * @return 순서쌍 집합
     * @throws SetNotFoundException 피연산자 이름이 없는 경우
     */
    DataSet<OrderedPair<T, T>> cartesianProduct(String nameA, String nameB);

    /**
     * 부분집합 판정 nameA ⊆ nameB.
     *
     * @param nameA 왼쪽 집합 이름
     * @param nameB 오른쪽 집합 이름
     * @return 부분집합이면 true
     * @throws SetNotFoundException 피연산자 이름이 없는 경우
     */
    boolean isSubset(String nameA, String nameB);

    /**
     * 집합 동등 판정.
     *
     * @param nameA 왼쪽 집합 이름
     * @param nameB 오른쪽 집합 이름
     * @return 같은 원소를 가지면 true
     * @throws SetNotFoundException 피연산자 이름이 없는 경우
     */
    boolean isEqual(String nameA, String nameB);

    /**
     * 원소 개수.
     *
     * @param name 집합 이름
     * @return 원소 개수
     * @throws SetNotFoundException 이름이 없는 경우
     */
    int sizeOf(String name);
}
