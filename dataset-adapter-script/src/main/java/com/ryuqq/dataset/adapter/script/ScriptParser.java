package com.ryuqq.dataset.adapter.script;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 스크립트 줄 파서.
 *
 * <p>상태가 없으며 한 번에 한 줄만 해석합니다. 블록 전환과 줄 읽기는 {@link ScriptRunner}가 담당합니다.</p>
 *
 * <p><strong>입력 형식:</strong></p>
 * <pre>
 * # 정의 블록
 * A 3
 * 1 2 3
 * B 0
 * Q
 * # 연산 블록
 * union A B
 * powerset A
 * Q
 * </pre>
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public final class ScriptParser {

    private final ScriptConfig config;

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ScriptParser(ScriptConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 무시할 줄인지 확인 (빈 줄, 주석).
     *
     * @param line 앞뒤 공백을 제거한 줄
     * @return 무시 대상이면 true
     */
    public boolean isSkippable(String line) {
        return line.isEmpty() || line.startsWith(config.commentPrefix());
    }

    /**
     * 블록 종료 줄인지 확인.
     *
     * @param line 앞뒤 공백을 제거한 줄
     * @return 종료 줄이면 true
     */
    public boolean isTerminator(String line) {
        return line.equals(config.terminator());
    }

    /**
     * 정의 헤더 "&lt;name&gt; &lt;count&gt;" 해석.
     *
     * @param line 앞뒤 공백을 제거한 줄
     * @param lineNumber 줄 번호
     * @return SetHeader
     * @throws ScriptFormatException 토큰 수가 2가 아니거나 count가 0 이상의 정수가 아닌 경우
     */
    public SetHeader parseHeader(String line, int lineNumber) {
        List<String> tokens = tokenize(line);
        if (tokens.size() != 2) {
            throw new ScriptFormatException(lineNumber,
                "Invalid set header '" + line + "': expected '<name> <count>'");
        }
        int count;
        try {
            count = Integer.parseInt(tokens.get(1));
        } catch (NumberFormatException e) {
            throw new ScriptFormatException(lineNumber,
                "Invalid element count '" + tokens.get(1) + "' for set '" + tokens.get(0) + "'");
        }
        if (count < 0) {
            throw new ScriptFormatException(lineNumber,
                "Negative element count " + count + " for set '" + tokens.get(0) + "'");
        }
        return new SetHeader(tokens.get(0), count);
    }

    /**
     * 원소 줄 해석 (공백 구분 정수).
     *
     * @param line 앞뒤 공백을 제거한 줄
     * @param lineNumber 줄 번호
     * @return 정수 리스트 (입력 순서, 중복 포함)
     * @throws ScriptFormatException 정수가 아닌 토큰이 있는 경우
     */
    public List<Integer> parseValues(String line, int lineNumber) {
        List<Integer> values = new ArrayList<>();
        for (String token : tokenize(line)) {
            try {
                values.add(Integer.parseInt(token));
            } catch (NumberFormatException e) {
                throw new ScriptFormatException(lineNumber, "Invalid integer element '" + token + "'");
            }
        }
        return values;
    }

    /**
     * 명령 줄 해석.
     *
     * @param line 앞뒤 공백을 제거한, 비어 있지 않은 줄
     * @param lineNumber 줄 번호
     * @return ScriptCommand (토큰 인식 여부는 확인하지 않음)
     */
    public ScriptCommand parseCommand(String line, int lineNumber) {
        List<String> tokens = tokenize(line);
        return new ScriptCommand(lineNumber, tokens.get(0), tokens.subList(1, tokens.size()));
    }

    private static List<String> tokenize(String line) {
        if (line.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(line.split("\\s+"));
    }
}
