package com.ryuqq.dataset.adapter.script;

import java.util.Optional;

/**
 * 연산 블록 명령 종류.
 *
 * <p>각 명령은 토큰, 필요한 피연산자 수, 오류 메시지 접두어를 가집니다.</p>
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public enum CommandType {

    PRINT("print", 1, ""),
    UNION("union", 2, "Error"),
    INTERSECTION("intersection", 2, "Error"),
    DIFFERENCE("difference", 2, "Error"),
    SYMMETRIC_DIFFERENCE("symmetric_difference", 2, "Error"),
    IS_SUBSET("issubset", 2, "Error during issubset"),
    IS_EQUAL("isequal", 2, "Error during isequal"),
    SIZE("size", 1, "Error during size"),
    POWERSET("powerset", 1, "Error during powerset"),
    CARTESIAN("cartesian", 2, "Error during cartesian product");

    private final String token;
    private final int arity;
    private final String errorLabel;

    CommandType(String token, int arity, String errorLabel) {
        this.token = token;
        this.arity = arity;
        this.errorLabel = errorLabel;
    }

    /**
     * 명령 토큰.
     *
     * @return 토큰 (예: "issubset")
     */
    public String token() {
        return token;
    }

    /**
     * 필요한 피연산자(집합 이름) 수.
     *
     * @return 1 또는 2
     */
    public int arity() {
        return arity;
    }

    /**
     * 실패 보고 시 메시지 앞에 붙는 문구.
     *
     * <p>print는 접두어 없이 메시지만 보고합니다.</p>
     *
     * @return 오류 접두어 (예: "Error during size"), print는 빈 문자열
     */
    public String errorLabel() {
        return errorLabel;
    }

    /**
     * 토큰으로 명령 조회 (대소문자 구분).
     *
     * @param token 명령 토큰
     * @return 일치하는 명령, 없으면 empty
     */
    public static Optional<CommandType> fromToken(String token) {
        for (CommandType type : values()) {
            if (type.token.equals(token)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
