package com.ryuqq.dataset.adapter.script;

/**
 * 스크립트 줄 형식 오류.
 *
 * <p>해당 정의만 건너뛰고 실행은 계속됩니다.</p>
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public class ScriptFormatException extends RuntimeException {

    private final int lineNumber;

    /**
     * 생성자.
     *
     * @param lineNumber 오류가 있는 줄 번호
     * @param message 오류 메시지
     */
    public ScriptFormatException(int lineNumber, String message) {
        super(message + " (line " + lineNumber + ")");
        this.lineNumber = lineNumber;
    }

    /**
     * 오류 줄 번호.
     *
     * @return 줄 번호 (1부터)
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
