package com.ryuqq.dataset.adapter.script;

import com.ryuqq.dataset.application.registry.SetRegistry;
import com.ryuqq.dataset.core.exception.SetNotFoundException;
import com.ryuqq.dataset.core.model.DataSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ScriptRunner 단위 테스트 (SetRegistry Mock).
 *
 * @author DataSet Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ScriptRunner 단위 테스트")
class ScriptRunnerMockTest {

    @Mock
    private SetRegistry<Integer> registry;

    @Captor
    private ArgumentCaptor<DataSet<Integer>> captor;

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private ScriptRunner runner;

    @BeforeEach
    void setUp() {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        runner = new ScriptRunner(registry, new ScriptConfig(),
            new PrintStream(outBytes, true, StandardCharsets.UTF_8),
            new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("정의는 선언 순서대로 addSet 으로 전달된다")
    void 정의_등록() throws IOException {
        // when
        runner.run(new BufferedReader(new StringReader("A 2\n1 2\nB 0\nQ\n")));

        // then
        verify(registry, times(2)).addSet(captor.capture());
        assertEquals("A", captor.getAllValues().get(0).getName());
        assertThat(captor.getAllValues().get(0).elements()).containsExactly(1, 2);
        assertEquals("B", captor.getAllValues().get(1).getName());
        assertThat(captor.getAllValues().get(1).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("레지스트리 예외 후에도 다음 명령을 호출한다")
    void 예외_후_계속() throws IOException {
        // given
        when(registry.sizeOf("X")).thenThrow(new SetNotFoundException("X"));
        when(registry.sizeOf("A")).thenReturn(2);

        // when
        ScriptReport report = runner.run(new BufferedReader(new StringReader("Q\nsize X\nsize A\n")));

        // then
        var order = inOrder(registry);
        order.verify(registry).sizeOf("X");
        order.verify(registry).sizeOf("A");
        assertThat(errBytes.toString(StandardCharsets.UTF_8)).contains("Error during size: Set 'X' not found.");
        assertThat(outBytes.toString(StandardCharsets.UTF_8)).contains("Size of set A: 2 element(s)");
        assertEquals(1, report.failedCommands());
    }

    @Test
    @DisplayName("이항 연산 명령은 토큰 그대로 operate 로 전달된다")
    void 이항_연산_위임() throws IOException {
        // given
        when(registry.operate("A", "intersection", "B")).thenReturn(DataSet.of("(A intersection B)", 2));

        // when
        runner.run(new BufferedReader(new StringReader("Q\nintersection A B\n")));

        // then
        assertThat(outBytes.toString(StandardCharsets.UTF_8)).contains("(A intersection B) = {2}");
    }

    @Test
    @DisplayName("알 수 없는 명령은 레지스트리를 호출하지 않는다")
    void 알수없는_명령() throws IOException {
        // when
        runner.run(new BufferedReader(new StringReader("Q\nfrobnicate A B\n")));

        // then
        verify(registry, never()).operate(any(), any(String.class), any());
        assertThat(errBytes.toString(StandardCharsets.UTF_8)).contains("Unknown operation: frobnicate");
    }
}
