package com.ryuqq.dataset.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

/**
 * 도메인 예외 메시지 테스트.
 *
 * @author DataSet Team
 * @since 1.0.0
 */
@DisplayName("DataSetException 테스트")
class DataSetExceptionTest {

    @Test
    @DisplayName("SetNotFoundException 메시지와 이름")
    void setNotFound() {
        SetNotFoundException e = new SetNotFoundException("X");

        assertEquals("Set 'X' not found.", e.getMessage());
        assertEquals("X", e.getSetName());
        assertInstanceOf(DataSetException.class, e);
    }

    @Test
    @DisplayName("InvalidOperationException 메시지와 토큰")
    void invalidOperation() {
        InvalidOperationException e = new InvalidOperationException("product");

        assertEquals("Invalid operation: 'product'", e.getMessage());
        assertEquals("product", e.getOperation());
    }

    @Test
    @DisplayName("UnsupportedSetOperationException 메시지와 토큰")
    void unsupportedOperation() {
        UnsupportedSetOperationException e = new UnsupportedSetOperationException("complement");

        assertEquals("Unsupported unary operation: 'complement'", e.getMessage());
        assertEquals("complement", e.getOperation());
        assertInstanceOf(RuntimeException.class, e);
    }
}
