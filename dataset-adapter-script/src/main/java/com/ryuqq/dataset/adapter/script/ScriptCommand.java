package com.ryuqq.dataset.adapter.script;

import java.util.List;

/**
 * 연산 블록의 한 줄.
 *
 * @param lineNumber 스크립트 줄 번호 (1부터)
 * @param token 첫 번째 토큰 (명령)
 * @param operands 나머지 토큰 (집합 이름)
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public record ScriptCommand(int lineNumber, String token, List<String> operands) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException token 또는 operands가 null인 경우
     */
    public ScriptCommand {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        if (operands == null) {
            throw new IllegalArgumentException("operands cannot be null");
        }
        operands = List.copyOf(operands);
    }

    /**
     * i번째 피연산자.
     *
     * @param index 0부터 시작하는 인덱스
     * @return 집합 이름
     */
    public String operand(int index) {
        return operands.get(index);
    }
}
