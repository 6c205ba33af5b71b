package com.ryuqq.dataset.adapter.script;

import com.ryuqq.dataset.application.registry.SetRegistry;
import com.ryuqq.dataset.core.algebra.SetOperation;
import com.ryuqq.dataset.core.model.DataSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

/**
 * 스크립트 실행기.
 *
 * <p>줄 단위 스크립트를 읽어 {@link SetRegistry} 호출로 변환하고 결과를 출력합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 정의 블록 (종료 줄까지)
 *    a. 헤더 "&lt;name&gt; &lt;count&gt;" 해석
 *    b. count &gt; 0 이면 다음 줄을 정수 목록으로 해석
 *    c. 새 집합에 삽입 → registry.addSet()
 * 2. 연산 블록 (입력 끝 또는 종료 줄까지)
 *    a. 명령 해석 → registry 호출
 *    b. 결과 출력 (out)
 * 3. 요약 로깅, ScriptReport 반환
 * </pre>
 *
 * <p><strong>장애 격리:</strong></p>
 * <ul>
 *   <li>명령 하나가 실패해도 다음 줄을 계속 처리</li>
 *   <li>알 수 없는 명령은 보고하고 건너뜀</li>
 *   <li>형식이 잘못된 정의는 보고하고 건너뜀</li>
 *   <li>모든 실패는 err 스트림에 보고하고 WARN 로그를 남김</li>
 * </ul>
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public final class ScriptRunner {

    private static final Logger log = LoggerFactory.getLogger(ScriptRunner.class);

    private final SetRegistry<Integer> registry;
    private final ScriptConfig config;
    private final ScriptParser parser;
    private final ResultRenderer renderer;
    private final PrintStream out;
    private final PrintStream err;

    /**
     * 생성자.
     *
     * @param registry 집합 레지스트리
     * @param config 설정
     * @param out 결과 출력 스트림
     * @param err 오류 보고 스트림
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ScriptRunner(SetRegistry<Integer> registry, ScriptConfig config, PrintStream out, PrintStream err) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        if (err == null) {
            throw new IllegalArgumentException("err cannot be null");
        }
        this.registry = registry;
        this.config = config;
        this.parser = new ScriptParser(config);
        this.renderer = new ResultRenderer();
        this.out = out;
        this.err = err;
    }

    /**
     * 스크립트 전체 실행.
     *
     * @param reader 스크립트 입력
     * @return 실행 요약
     * @throws IOException 입력을 읽을 수 없는 경우
     * @throws IllegalArgumentException reader가 null인 경우
     */
    public ScriptReport run(BufferedReader reader) throws IOException {
        if (reader == null) {
            throw new IllegalArgumentException("reader cannot be null");
        }
        LineSource source = new LineSource(reader);
        log.info("Script run started");

        Tally definitions = readDefinitions(source);
        Tally commands = executeCommands(source);

        ScriptReport report = new ScriptReport(
            definitions.succeeded(), definitions.failed(),
            commands.succeeded() + commands.failed(), commands.failed());
        log.info("Script run completed: {} set(s) defined, {} definition(s) skipped, {} of {} command(s) failed",
            report.definedSets(), report.skippedDefinitions(), report.failedCommands(), report.executedCommands());
        return report;
    }

    /**
     * 정의 블록 처리.
     *
     * @return 등록 수, 건너뛴 수
     */
    private Tally readDefinitions(LineSource source) throws IOException {
        int defined = 0;
        int skipped = 0;
        String line;
        while ((line = source.next()) != null) {
            if (parser.isSkippable(line)) {
                continue;
            }
            if (parser.isTerminator(line)) {
                break;
            }
            int headerLine = source.lineNumber();
            try {
                SetHeader header = parser.parseHeader(line, headerLine);
                DataSet<Integer> set = DataSet.named(header.name());
                if (header.count() > 0) {
                    String valuesLine = source.next();
                    if (valuesLine != null) {
                        List<Integer> values = parser.parseValues(valuesLine, source.lineNumber());
                        if (values.size() != header.count()) {
                            log.warn("Set '{}' declares {} element(s) but lists {} (line {})",
                                header.name(), header.count(), values.size(), source.lineNumber());
                        }
                        set.insertAll(values);
                    }
                }
                registry.addSet(set);
                defined++;
                if (config.echoDefinitions()) {
                    out.println(set.render());
                }
            } catch (ScriptFormatException e) {
                skipped++;
                err.println("Error: " + e.getMessage());
                log.warn("Skipped set definition at line {}: {}", headerLine, e.getMessage());
            }
        }
        return new Tally(defined, skipped);
    }

    /**
     * 연산 블록 처리.
     *
     * @return 성공 수, 실패 수
     */
    private Tally executeCommands(LineSource source) throws IOException {
        int succeeded = 0;
        int failed = 0;
        String line;
        while ((line = source.next()) != null) {
            if (parser.isSkippable(line)) {
                continue;
            }
            if (parser.isTerminator(line)) {
                break;
            }
            if (tryExecute(parser.parseCommand(line, source.lineNumber()))) {
                succeeded++;
            } else {
                failed++;
            }
        }
        return new Tally(succeeded, failed);
    }

    /**
     * 명령 하나 실행.
     *
     * <p>예외 발생 시에도 다음 명령 처리를 방해하지 않습니다.</p>
     *
     * @param command 명령
     * @return 성공 여부
     */
    private boolean tryExecute(ScriptCommand command) {
        Optional<CommandType> type = CommandType.fromToken(command.token());
        if (type.isEmpty()) {
            err.println("Unknown operation: " + command.token());
            log.warn("Unknown operation '{}' at line {}", command.token(), command.lineNumber());
            return false;
        }

        CommandType commandType = type.get();
        try {
            if (command.operands().size() < commandType.arity()) {
                throw new ScriptFormatException(command.lineNumber(),
                    "'" + commandType.token() + "' expects " + commandType.arity()
                        + " set name(s) but got " + command.operands().size());
            }
            for (String resultLine : execute(commandType, command)) {
                out.println(resultLine);
            }
            return true;
        } catch (RuntimeException e) {
            String label = commandType.errorLabel();
            err.println(label.isEmpty() ? e.getMessage() : label + ": " + e.getMessage());
            log.warn("Command '{}' failed at line {}: {}", commandType.token(), command.lineNumber(), e.getMessage());
            return false;
        }
    }

    private List<String> execute(CommandType type, ScriptCommand command) {
        return switch (type) {
            case PRINT -> renderer.set(registry.getSet(command.operand(0)));
            case UNION -> binary(SetOperation.UNION, command);
            case INTERSECTION -> binary(SetOperation.INTERSECTION, command);
            case DIFFERENCE -> binary(SetOperation.DIFFERENCE, command);
            case SYMMETRIC_DIFFERENCE -> binary(SetOperation.SYMMETRIC_DIFFERENCE, command);
            case IS_SUBSET -> renderer.subset(command.operand(0), command.operand(1),
                registry.isSubset(command.operand(0), command.operand(1)));
            case IS_EQUAL -> renderer.equality(command.operand(0), command.operand(1),
                registry.isEqual(command.operand(0), command.operand(1)));
            case SIZE -> renderer.size(command.operand(0), registry.sizeOf(command.operand(0)));
            case POWERSET -> renderer.powerSet(command.operand(0),
                registry.operateUnary(command.operand(0), type.token()));
            case CARTESIAN -> renderer.cartesianProduct(command.operand(0), command.operand(1),
                registry.cartesianProduct(command.operand(0), command.operand(1)));
        };
    }

    private List<String> binary(SetOperation operation, ScriptCommand command) {
        return renderer.set(registry.operate(command.operand(0), operation.token(), command.operand(1)));
    }

    private record Tally(int succeeded, int failed) {
    }

    /**
     * 앞뒤 공백을 제거하며 줄 번호를 추적하는 입력.
     */
    private static final class LineSource {
        private final BufferedReader reader;
        private int lineNumber;

        LineSource(BufferedReader reader) {
            this.reader = reader;
        }

        String next() throws IOException {
            String line = reader.readLine();
            if (line == null) {
                return null;
            }
            lineNumber++;
            return line.strip();
        }

        int lineNumber() {
            return lineNumber;
        }
    }
}
