package com.ryuqq.dataset.core.exception;

/**
 * 레지스트리 연산 실패의 공통 상위 타입.
 *
 * <p>세 가지 실패만 존재합니다:</p>
 * <ul>
 *   <li>{@link SetNotFoundException}: 참조한 이름의 집합이 없음</li>
 *   <li>{@link InvalidOperationException}: 인식할 수 없는 이항 연산 토큰</li>
 *   <li>{@link UnsupportedSetOperationException}: 정의되지 않은 단항 연산 토큰</li>
 * </ul>
 *
 * <p>모두 unchecked 예외이며 호출자에게 동기적으로 전달됩니다. 코어는 재시도하거나 삼키지 않습니다.</p>
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public abstract sealed class DataSetException extends RuntimeException
    permits SetNotFoundException, InvalidOperationException, UnsupportedSetOperationException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    protected DataSetException(String message) {
        super(message);
    }
}
