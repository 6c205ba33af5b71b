package com.ryuqq.dataset.adapter.script;

/**
 * 집합 정의 헤더 줄 "&lt;name&gt; &lt;count&gt;".
 *
 * @param name 집합 이름
 * @param count 선언된 원소 개수 (0 이상)
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public record SetHeader(String name, int count) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 비어 있거나 count가 음수인 경우
     */
    public SetHeader {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative (current: " + count + ")");
        }
    }
}
