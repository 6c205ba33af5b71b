package com.ryuqq.dataset.core.exception;

/**
 * 이항 연산 토큰이 union / intersection / difference / symmetric_difference 중 하나가 아님.
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public final class InvalidOperationException extends DataSetException {

    private final String operation;

    /**
     * 생성자.
     *
     * @param operation 인식할 수 없는 연산 토큰
     */
    public InvalidOperationException(String operation) {
        super("Invalid operation: '" + operation + "'");
        this.operation = operation;
    }

    /**
     * 연산 토큰 조회.
     *
     * @return 연산 토큰
     */
    public String getOperation() {
        return operation;
    }
}
