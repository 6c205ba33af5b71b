package com.ryuqq.dataset.adapter.script;

/**
 * 스크립트 실행 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>terminator: 블록 종료 줄 (기본 "Q")</li>
 *   <li>commentPrefix: 주석 줄 접두어 (기본 "#")</li>
 *   <li>echoDefinitions: 정의한 집합을 출력할지 여부 (기본 false)</li>
 * </ul>
 *
 * @author DataSet Team
 * @since 1.0.0
 * @param terminator 블록 종료 줄 (공백 불가)
 * @param commentPrefix 주석 접두어 (공백 불가)
 * @param echoDefinitions 정의 블록에서 등록한 집합을 출력 스트림에 렌더링할지 여부
 */
public record ScriptConfig(String terminator, String commentPrefix, boolean echoDefinitions) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: terminator="Q", commentPrefix="#", echoDefinitions=false</p>
     */
    public ScriptConfig() {
        this("Q", "#", false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ScriptConfig {
        if (terminator == null || terminator.isBlank()) {
            throw new IllegalArgumentException("terminator cannot be null or blank");
        }
        if (commentPrefix == null || commentPrefix.isBlank()) {
            throw new IllegalArgumentException("commentPrefix cannot be null or blank");
        }
    }

    /**
     * terminator만 변경한 새 인스턴스 생성.
     *
     * @param terminator 새 종료 줄
     * @return 새 ScriptConfig 인스턴스
     */
    public ScriptConfig withTerminator(String terminator) {
        return new ScriptConfig(terminator, this.commentPrefix, this.echoDefinitions);
    }

    /**
     * commentPrefix만 변경한 새 인스턴스 생성.
     *
     * @param commentPrefix 새 주석 접두어
     * @return 새 ScriptConfig 인스턴스
     */
    public ScriptConfig withCommentPrefix(String commentPrefix) {
        return new ScriptConfig(this.terminator, commentPrefix, this.echoDefinitions);
    }

    /**
     * echoDefinitions만 변경한 새 인스턴스 생성.
     *
     * @param echoDefinitions 정의 출력 여부
     * @return 새 ScriptConfig 인스턴스
     */
    public ScriptConfig withEchoDefinitions(boolean echoDefinitions) {
        return new ScriptConfig(this.terminator, this.commentPrefix, echoDefinitions);
    }
}
