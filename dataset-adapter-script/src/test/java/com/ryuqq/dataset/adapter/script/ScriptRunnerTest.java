package com.ryuqq.dataset.adapter.script;

import com.ryuqq.dataset.adapter.inmemory.store.InMemorySetStore;
import com.ryuqq.dataset.application.registry.DefaultSetRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * ScriptRunner 통합 테스트.
 *
 * <p>실제 DefaultSetRegistry 로 스크립트를 실행하고 out / err 출력을 검증합니다.</p>
 *
 * <p><strong>테스트 시나리오:</strong></p>
 * <ul>
 *   <li>정상 스크립트 전체 출력</li>
 *   <li>명령 실패 격리 (다음 명령 계속 실행)</li>
 *   <li>알 수 없는 명령, 피연산자 부족</li>
 *   <li>잘못된 정의 건너뛰기</li>
 *   <li>두 번째 종료 줄 이후 무시, 정의 echo</li>
 * </ul>
 *
 * @author DataSet Team
 * @since 1.0.0
 */
@DisplayName("ScriptRunner 테스트")
class ScriptRunnerTest {

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;

    @BeforeEach
    void setUp() {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
    }

    private ScriptReport run(ScriptConfig config, BufferedReader reader) throws IOException {
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return new ScriptRunner(new DefaultSetRegistry<>(new InMemorySetStore<>()), config, out, err).run(reader);
    }

    private ScriptReport run(String script) throws IOException {
        return run(new ScriptConfig(), new BufferedReader(new StringReader(script)));
    }

    private List<String> out() {
        return outBytes.toString(StandardCharsets.UTF_8).lines().collect(Collectors.toList());
    }

    private List<String> err() {
        return errBytes.toString(StandardCharsets.UTF_8).lines().collect(Collectors.toList());
    }

    @Test
    @DisplayName("예제 스크립트 전체 출력")
    void 예제_스크립트() throws IOException {
        // given
        InputStream in = getClass().getResourceAsStream("/scripts/sample.in");
        assertNotNull(in);

        // when
        ScriptReport report;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            report = run(new ScriptConfig(), reader);
        }

        // then
        assertThat(out()).containsExactly(
            "A = {1, 2, 3}",
            "E = {}",
            "(A union B) = {1, 2, 3, 4}",
            "(A intersection B) = {2, 3}",
            "(A difference B) = {1}",
            "(A symmetric_difference B) = {1, 4}",
            "Is E ⊆ A? Yes",
            "Is A ⊆ B? No",
            "Are A and A equal? Yes",
            "Size of set B: 3 element(s)",
            "Power set of E contains 1 subsets:",
            "{}",
            "Cartesian product A × B (9 pairs):",
            "{(1, 2), (1, 3), (1, 4), (2, 2), (2, 3), (2, 4), (3, 2), (3, 3), (3, 4)}"
        );
        assertThat(err()).isEmpty();
        assertEquals(new ScriptReport(3, 0, 12, 0), report);
        assertTrue(report.isClean());
    }

    @Test
    @DisplayName("실패한 명령은 보고하고 다음 명령을 계속 실행한다")
    void 실패_격리() throws IOException {
        // when
        ScriptReport report = run(String.join("\n",
            "A 2",
            "1 2",
            "Q",
            "print X",
            "union A X",
            "issubset X A",
            "size X",
            "powerset X",
            "cartesian A X",
            "print A"
        ));

        // then
        assertThat(err()).containsExactly(
            "Set 'X' not found.",
            "Error: Set 'X' not found.",
            "Error during issubset: Set 'X' not found.",
            "Error during size: Set 'X' not found.",
            "Error during powerset: Set 'X' not found.",
            "Error during cartesian product: Set 'X' not found."
        );
        assertThat(out()).containsExactly("A = {1, 2}");
        assertEquals(7, report.executedCommands());
        assertEquals(6, report.failedCommands());
    }

    @Test
    @DisplayName("알 수 없는 명령과 피연산자 부족은 보고 후 건너뛴다")
    void 알수없는_명령_피연산자_부족() throws IOException {
        // when
        ScriptReport report = run(String.join("\n",
            "A 1",
            "7",
            "Q",
            "complement A",
            "union A",
            "size A"
        ));

        // then
        assertThat(err()).containsExactly(
            "Unknown operation: complement",
            "Error: 'union' expects 2 set name(s) but got 1 (line 5)"
        );
        assertThat(out()).containsExactly("Size of set A: 1 element(s)");
        assertEquals(2, report.failedCommands());
    }

    @Test
    @DisplayName("잘못된 정의는 건너뛰고 나머지 정의는 등록한다")
    void 잘못된_정의() throws IOException {
        // when
        ScriptReport report = run(String.join("\n",
            "C 2",
            "5 z",
            "D -1",
            "A 2",
            "1 1",
            "Q",
            "print A",
            "print C"
        ));

        // then
        assertThat(err()).containsExactly(
            "Error: Invalid integer element 'z' (line 2)",
            "Error: Negative element count -1 for set 'D' (line 3)",
            "Set 'C' not found."
        );
        assertThat(out()).containsExactly("A = {1}");
        assertEquals(1, report.definedSets());
        assertEquals(2, report.skippedDefinitions());
    }

    @Test
    @DisplayName("주석, 빈 줄, 앞뒤 공백을 무시하고 두 번째 종료 줄 이후는 읽지 않는다")
    void 주석_빈줄_종료() throws IOException {
        // when
        ScriptReport report = run(String.join("\n",
            "# header",
            "",
            "  A 2  ",
            "  3 4",
            "Q",
            "   ",
            "# comment",
            "print A",
            "Q",
            "print A"
        ));

        // then
        assertThat(out()).containsExactly("A = {3, 4}");
        assertEquals(1, report.executedCommands());
    }

    @Test
    @DisplayName("같은 이름의 정의는 덮어쓴다")
    void 정의_덮어쓰기() throws IOException {
        // when
        run(String.join("\n", "A 1", "1", "A 2", "8 9", "Q", "print A"));

        // then
        assertThat(out()).containsExactly("A = {8, 9}");
    }

    @Test
    @DisplayName("echoDefinitions 설정 시 등록한 집합을 출력한다")
    void 정의_echo() throws IOException {
        // when
        run(new ScriptConfig().withEchoDefinitions(true),
            new BufferedReader(new StringReader("A 2\n1 2\nQ\n")));

        // then
        assertThat(out()).containsExactly("A = {1, 2}");
    }

    @Test
    @DisplayName("종료 줄이 없어도 입력 끝에서 정상 종료한다")
    void 종료_줄_없음() throws IOException {
        ScriptReport report = run("A 1\n5");

        assertEquals(new ScriptReport(1, 0, 0, 0), report);
        assertThat(out()).isEmpty();
    }

    @Test
    @DisplayName("null 의존성은 IllegalArgumentException")
    void null_의존성() {
        PrintStream stream = new PrintStream(outBytes, true, StandardCharsets.UTF_8);

        assertThrows(IllegalArgumentException.class,
            () -> new ScriptRunner(null, new ScriptConfig(), stream, stream));
        assertThrows(IllegalArgumentException.class,
            () -> new ScriptRunner(new DefaultSetRegistry<>(new InMemorySetStore<>()), new ScriptConfig(), stream, stream).run(null));
    }
}
