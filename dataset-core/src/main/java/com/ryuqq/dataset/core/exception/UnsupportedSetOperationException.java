package com.ryuqq.dataset.core.exception;

/**
 * 단항 연산 토큰이 "powerset"이 아님.
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public final class UnsupportedSetOperationException extends DataSetException {

    private final String operation;

    /**
     * 생성자.
     *
     * @param operation 지원하지 않는 연산 토큰
     */
    public UnsupportedSetOperationException(String operation) {
        super("Unsupported unary operation: '" + operation + "'");
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
