package com.ryuqq.dataset.adapter.script;

import com.ryuqq.dataset.adapter.inmemory.store.InMemorySetStore;
import com.ryuqq.dataset.application.registry.DefaultSetRegistry;
import com.ryuqq.dataset.application.registry.SetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 명령줄 진입점.
 *
 * <p><strong>사용법:</strong></p>
 * <pre>
 * java -jar dataset-adapter-script.jar input_file.in
 * </pre>
 *
 * <p><strong>종료 코드:</strong></p>
 * <ul>
 *   <li>0: 스크립트 실행 완료 (개별 명령 실패 포함)</li>
 *   <li>1: 인자 개수 오류, 입력 파일을 열 수 없음, 읽기 실패 또는 UTF-8이 아닌 입력</li>
 * </ul>
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public final class ScriptMain {

    private static final Logger log = LoggerFactory.getLogger(ScriptMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_INPUT_ERROR = 1;

    private ScriptMain() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 진입점.
     *
     * @param args 입력 파일 경로 하나
     */
    public static void main(String[] args) {
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(System.err, true, StandardCharsets.UTF_8);
        int exitCode = run(args, new ScriptConfig(), out, err);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * 인자 검증 후 스크립트 실행.
     *
     * @param args 명령줄 인자
     * @param config 스크립트 설정
     * @param out 결과 출력 스트림
     * @param err 오류 보고 스트림
     * @return 종료 코드
     */
    static int run(String[] args, ScriptConfig config, PrintStream out, PrintStream err) {
        if (args == null || args.length != 1) {
            err.println("Usage: dataset-script input_file.in");
            return EXIT_USAGE;
        }

        Path input = Path.of(args[0]);
        BufferedReader opened;
        try {
            opened = Files.newBufferedReader(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: Cannot open file '" + args[0] + "'");
            log.error("Failed to open script '{}'", input, e);
            return EXIT_INPUT_ERROR;
        }

        try (BufferedReader reader = opened) {
            SetRegistry<Integer> registry = new DefaultSetRegistry<>(new InMemorySetStore<>());
            ScriptReport report = new ScriptRunner(registry, config, out, err).run(reader);
            if (!report.isClean()) {
                log.info("Script '{}' finished with {} failed command(s) and {} skipped definition(s)",
                    input, report.failedCommands(), report.skippedDefinitions());
            }
            return EXIT_OK;
        } catch (CharacterCodingException e) {
            err.println("Error: File '" + args[0] + "' is not valid UTF-8 text");
            log.error("Failed to decode script '{}'", input, e);
            return EXIT_INPUT_ERROR;
        } catch (IOException e) {
            err.println("Error: Failed to read file '" + args[0] + "': " + e.getMessage());
            log.error("Failed to read script '{}'", input, e);
            return EXIT_INPUT_ERROR;
        }
    }
}
