package com.ryuqq.dataset.core.algebra;

import com.ryuqq.dataset.core.exception.UnsupportedSetOperationException;
import com.ryuqq.dataset.core.model.DataSet;
import com.ryuqq.dataset.core.model.SetAlgebra;

/**
 * 단항 집합 연산.
 *
 * <p>현재 정의된 연산은 멱집합("powerset") 하나입니다.</p>
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public enum UnaryOperation {

    /**
     * 멱집합.
     */
    POWERSET("powerset");

    private final String token;

    UnaryOperation(String token) {
        this.token = token;
    }

    /**
     * 연산 토큰 조회.
     *
     * @return 토큰 (예: "powerset")
     */
    public String token() {
        return token;
    }

    /**
     * 연산 실행.
     *
     * @param operand 피연산자
     * @param <T> 원소 타입
     * @return 집합의 집합
     */
    public <T> DataSet<DataSet<T>> apply(DataSet<T> operand) {
        return SetAlgebra.powerSet(operand);
    }

    /**
     * 토큰으로 연산 조회 (대소문자 구분).
     *
     * @param token 연산 토큰
     * @return 일치하는 UnaryOperation
     * @throws IllegalArgumentException token이 null인 경우
     * @throws UnsupportedSetOperationException 정의되지 않은 토큰인 경우
     */
    public static UnaryOperation fromToken(String token) {
        if (token == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        for (UnaryOperation operation : values()) {
            if (operation.token.equals(token)) {
                return operation;
            }
        }
        throw new UnsupportedSetOperationException(token);
    }
}
