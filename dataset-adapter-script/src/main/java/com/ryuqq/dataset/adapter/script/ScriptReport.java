package com.ryuqq.dataset.adapter.script;

/**
 * 스크립트 실행 결과 요약.
 *
 * @param definedSets 등록된 집합 수
 * @param skippedDefinitions 형식 오류로 건너뛴 정의 수
 * @param executedCommands 실행한 명령 수 (실패 포함)
 * @param failedCommands 실패했거나 알 수 없는 명령 수
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public record ScriptReport(int definedSets, int skippedDefinitions, int executedCommands, int failedCommands) {

    /**
     * 모든 정의와 명령이 성공했는지 확인.
     *
     * @return 실패나 건너뛴 정의가 없으면 true
     */
    public boolean isClean() {
        return skippedDefinitions == 0 && failedCommands == 0;
    }
}
