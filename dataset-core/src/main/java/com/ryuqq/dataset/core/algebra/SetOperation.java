package com.ryuqq.dataset.core.algebra;

import com.ryuqq.dataset.core.exception.InvalidOperationException;
import com.ryuqq.dataset.core.model.DataSet;
import com.ryuqq.dataset.core.model.SetAlgebra;

/**
 * 이름으로 호출할 수 있는 이항 집합 연산.
 *
 * <p>각 연산은 스크립트/레지스트리에서 사용하는 토큰을 가집니다.</p>
 *
 * <ul>
 *   <li>UNION: "union"</li>
 *   <li>INTERSECTION: "intersection"</li>
 *   <li>DIFFERENCE: "difference" (교환법칙 성립 안 함)</li>
 *   <li>SYMMETRIC_DIFFERENCE: "symmetric_difference"</li>
 * </ul>
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public enum SetOperation {

    /**
     * 합집합.
     */
    UNION("union"),

    /**
     * 교집합.
     */
    INTERSECTION("intersection"),

    /**
     * 차집합.
     */
    DIFFERENCE("difference"),

    /**
     * 대칭차.
     */
    SYMMETRIC_DIFFERENCE("symmetric_difference");

    private final String token;

    SetOperation(String token) {
        this.token = token;
    }

    /**
     * 연산 토큰 조회.
     *
     * @return 토큰 (예: "union")
     */
    public String token() {
        return token;
    }

    /**
     * 연산 실행.
     *
     * @param left 왼쪽 피연산자
     * @param right 오른쪽 피연산자
     * @param <T> 원소 타입
     * @return 새 결과 집합
     */
    public <T> DataSet<T> apply(DataSet<T> left, DataSet<T> right) {
        return switch (this) {
            case UNION -> SetAlgebra.union(left, right);
            case INTERSECTION -> SetAlgebra.intersection(left, right);
            case DIFFERENCE -> SetAlgebra.difference(left, right);
            case SYMMETRIC_DIFFERENCE -> SetAlgebra.symmetricDifference(left, right);
        };
    }

    /**
     * 토큰으로 연산 조회 (대소문자 구분).
     *
     * @param token 연산 토큰
     * @return 일치하는 SetOperation
     * @throws IllegalArgumentException token이 null인 경우
     * @throws InvalidOperationException 알 수 없는 토큰인 경우
     */
    public static SetOperation fromToken(String token) {
        if (token == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        for (SetOperation operation : values()) {
            if (operation.token.equals(token)) {
                return operation;
            }
        }
        throw new InvalidOperationException(token);
    }

    /**
     * 인식 가능한 토큰인지 확인.
     *
     * @param token 연산 토큰
     * @return 인식 가능하면 true
     */
    public static boolean isToken(String token) {
        for (SetOperation operation : values()) {
            if (operation.token.equals(token)) {
                return true;
            }
        }
        return false;
    }
}
