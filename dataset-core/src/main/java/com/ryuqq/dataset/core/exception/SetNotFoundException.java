package com.ryuqq.dataset.core.exception;

/**
 * 이름으로 참조한 집합이 레지스트리에 없음 (NotFound).
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public final class SetNotFoundException extends DataSetException {

    private final String setName;

    /**
     * 생성자.
     *
     * @param setName 찾지 못한 집합 이름
     */
    public SetNotFoundException(String setName) {
        super("Set '" + setName + "' not found.");
        this.setName = setName;
    }

    /**
     * 찾지 못한 집합 이름 조회.
     *
     * @return 집합 이름
     */
    public String getSetName() {
        return setName;
    }
}
