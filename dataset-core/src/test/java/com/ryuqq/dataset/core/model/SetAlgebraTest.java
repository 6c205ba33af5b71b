package com.ryuqq.dataset.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * 집합 연산 엔진 테스트.
 *
 * <p>기준 피연산자: A = {1, 2, 3}, B = {2, 3, 4}</p>
 *
 * @author DataSet Team
 * @since 1.0.0
 */
@DisplayName("SetAlgebra 테스트")
class SetAlgebraTest {

    private static DataSet<Integer> a() {
        return DataSet.of("A", 1, 2, 3);
    }

    private static DataSet<Integer> b() {
        return DataSet.of("B", 2, 3, 4);
    }

    @Test
    @DisplayName("union: A 원소 다음 A에 없는 B 원소")
    void union() {
        DataSet<Integer> result = a().unionWith(b());

        assertThat(result.elements()).containsExactly(1, 2, 3, 4);
        assertThat(result.getName()).isEqualTo("A ∪ B");
    }

    @Test
    @DisplayName("intersection: A 순서로 공통 원소")
    void intersection() {
        DataSet<Integer> result = DataSet.of("A", 3, 2, 1).intersectionWith(b());

        assertThat(result.elements()).containsExactly(3, 2);
        assertThat(result.getName()).isEqualTo("A ∩ B");
    }

    @Test
    @DisplayName("difference: B에 없는 A 원소")
    void difference() {
        DataSet<Integer> result = a().differenceWith(b());

        assertThat(result.elements()).containsExactly(1);
        assertThat(result.getName()).isEqualTo("A-B");
    }

    @Test
    @DisplayName("symmetric difference: (A − B) 다음 (B − A)")
    void symmetricDifference() {
        DataSet<Integer> left = DataSet.of("L", 5, 1, 2, 6);
        DataSet<Integer> right = DataSet.of("R", 8, 2, 7, 1);

        DataSet<Integer> result = left.symmetricDifferenceWith(right);

        assertThat(result.elements()).containsExactly(5, 6, 8, 7);
        assertThat(a().symmetricDifferenceWith(b()).elements()).containsExactly(1, 4);
        assertThat(result.getName()).isEqualTo("L symmetric_difference R");
    }

    @Test
    @DisplayName("연산은 피연산자를 변경하지 않는다")
    void 피연산자_불변() {
        DataSet<Integer> left = a();
        DataSet<Integer> right = b();

        left.unionWith(right);
        left.intersectionWith(right);
        left.differenceWith(right);
        left.symmetricDifferenceWith(right);
        left.powerSet();
        left.cartesianProductWith(right);

        assertThat(left.elements()).containsExactly(1, 2, 3);
        assertThat(right.elements()).containsExactly(2, 3, 4);
        assertThat(left.getName()).isEqualTo("A");
    }

    @Test
    @DisplayName("union, intersection, symmetric difference 는 교환법칙이 성립한다")
    void 교환법칙() {
        assertThat(a().unionWith(b()).isEqualTo(b().unionWith(a()))).isTrue();
        assertThat(a().intersectionWith(b()).isEqualTo(b().intersectionWith(a()))).isTrue();
        assertThat(a().symmetricDifferenceWith(b()).isEqualTo(b().symmetricDifferenceWith(a()))).isTrue();
    }

    @Test
    @DisplayName("difference 는 일반적으로 교환법칙이 성립하지 않는다")
    void difference_비교환() {
        assertThat(a().differenceWith(b()).isEqualTo(b().differenceWith(a()))).isFalse();
    }

    @Test
    @DisplayName("공집합과의 연산")
    void 공집합() {
        DataSet<Integer> empty = DataSet.named("E");

        assertThat(a().unionWith(empty).isEqualTo(a())).isTrue();
        assertThat(a().intersectionWith(empty).isEmpty()).isTrue();
        assertThat(a().differenceWith(empty).isEqualTo(a())).isTrue();
        assertThat(empty.differenceWith(a()).isEmpty()).isTrue();
        assertThat(empty.symmetricDifferenceWith(a()).elements()).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("null 피연산자는 IllegalArgumentException")
    void null_피연산자() {
        assertThatThrownBy(() -> SetAlgebra.union(a(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null");
        assertThatThrownBy(() -> SetAlgebra.powerSet(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A 는 A ∪ B 의 부분집합이다 (단조성)")
    void 단조성() {
        assertThat(a().isSubsetOf(a().unionWith(b()))).isTrue();
        assertThat(b().isSubsetOf(a().unionWith(b()))).isTrue();
    }

    @Test
    @DisplayName("공집합은 자기 자신을 포함한 모든 집합의 부분집합이다")
    void 공집합_부분집합() {
        DataSet<Integer> empty = DataSet.named("E");

        assertThat(empty.isSubsetOf(a())).isTrue();
        assertThat(empty.isSubsetOf(empty)).isTrue();
        assertThat(a().isSubsetOf(empty)).isFalse();
    }

    @Test
    @DisplayName("A ⊄ B")
    void 부분집합_아님() {
        assertThat(a().isSubsetOf(b())).isFalse();
    }

    @Test
    @DisplayName("동등성은 반사적이고 순서와 이름을 무시한다")
    void 동등성() {
        DataSet<Integer> set = a();

        assertThat(set.isEqualTo(set)).isTrue();
        assertThat(set.isEqualTo(DataSet.of("Other", 3, 1, 2))).isTrue();
        assertThat(set.isEqualTo(DataSet.of("A", 1, 2))).isFalse();
    }

    @Test
    @DisplayName("진부분집합은 자기 자신과 같지 않아야 한다")
    void 진부분집합() {
        DataSet<Integer> small = DataSet.of("S", 2, 3);

        assertThat(small.isProperSubsetOf(a())).isTrue();
        assertThat(a().isProperSubsetOf(a())).isFalse();
        assertThat(a().isProperSubsetOf(small)).isFalse();
    }

    @Test
    @DisplayName("{1, 2} 의 멱집합은 {}, {1}, {2}, {1, 2} 이다")
    void 두_원소() {
        DataSet<DataSet<Integer>> result = DataSet.of("A", 1, 2).powerSet();

        assertThat(result.size()).isEqualTo(4);
        List<DataSet<Integer>> subsets = result.elements();
        assertThat(subsets.get(0).elements()).isEmpty();
        assertThat(subsets.get(1).elements()).containsExactly(1);
        assertThat(subsets.get(2).elements()).containsExactly(2);
        assertThat(subsets.get(3).elements()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("부분집합은 이름 없이 출력되고 결과 이름은 'A Power Set' 이다")
    void 출력() {
        DataSet<DataSet<Integer>> result = DataSet.of("A", 1, 2).powerSet();

        assertThat(result.getName()).isEqualTo("A Power Set");
        assertThat(result.render()).isEqualTo("A Power Set = {{}, {1}, {2}, {1, 2}}");
    }

    @Test
    @DisplayName("크기는 정확히 2^n 이다")
    void 크기_2의_n승() {
        for (int n = 0; n <= 8; n++) {
            DataSet<Integer> source = DataSet.named("S");
            for (int i = 0; i < n; i++) {
                source.insert(i * 10);
            }

            assertThat(source.powerSet().size()).isEqualTo(1 << n);
        }
    }

    @Test
    @DisplayName("부분집합 원소는 원래 인덱스 오름차순이다")
    void 부분집합_순서() {
        DataSet<DataSet<Integer>> result = DataSet.of("A", 30, 10, 20).powerSet();

        // k = 0b111
        assertThat(result.elements().get(7).elements()).containsExactly(30, 10, 20);
        // k = 0b101
        assertThat(result.elements().get(5).elements()).containsExactly(30, 20);
    }

    @Test
    @DisplayName("공집합의 멱집합은 공집합 하나만 갖는다")
    void powerSet_공집합() {
        DataSet<DataSet<Integer>> result = DataSet.<Integer>named("E").powerSet();

        assertThat(result.size()).isEqualTo(1);
        assertThat(result.elements().get(0).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("원본 집합과 공집합을 포함한다")
    void 원본_포함() {
        DataSet<Integer> source = a();
        DataSet<DataSet<Integer>> result = source.powerSet();

        assertThat(result.contains(source)).isTrue();
        assertThat(result.contains(DataSet.named("any"))).isTrue();
        assertThat(result.contains(DataSet.of("x", 4))).isFalse();
    }

    @Test
    @DisplayName("너무 큰 집합은 IllegalStateException")
    void 너무_큰_집합() {
        DataSet<Integer> huge = DataSet.named("H");
        for (int i = 0; i <= SetAlgebra.MAX_POWER_SET_SOURCE_SIZE; i++) {
            huge.insert(i);
        }

        assertThatThrownBy(huge::powerSet)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("too large");
    }

    @Test
    @DisplayName("A 바깥, B 안쪽 순서의 순서쌍")
    void cartesian_순서() {
        DataSet<OrderedPair<Integer, Integer>> result =
            DataSet.of("A", 1, 2).cartesianProductWith(DataSet.of("B", 3, 4));

        assertThat(result.elements()).containsExactly(
            OrderedPair.of(1, 3), OrderedPair.of(1, 4),
            OrderedPair.of(2, 3), OrderedPair.of(2, 4)
        );
        assertThat(result.getName()).isEqualTo("A × B");
        assertThat(result.render()).isEqualTo("A × B = {(1, 3), (1, 4), (2, 3), (2, 4)}");
    }

    @Test
    @DisplayName("크기는 |A|·|B| 이다")
    void cartesian_크기() {
        assertThat(a().cartesianProductWith(b()).size()).isEqualTo(9);
        assertThat(a().cartesianProductWith(DataSet.<Integer>named("E")).size()).isZero();
    }

    @Test
    @DisplayName("원소 타입이 다른 집합끼리도 곱할 수 있다")
    void 다른_타입() {
        DataSet<OrderedPair<Integer, String>> result =
            DataSet.of("N", 1).cartesianProductWith(DataSet.of("S", "x", "y"));

        assertThat(result.elements()).containsExactly(OrderedPair.of(1, "x"), OrderedPair.of(1, "y"));
    }

    @Test
    @DisplayName("300 × 300 데카르트 곱은 결과 크기에 비례하는 시간에 만들어진다")
    void cartesian_대용량() {
        // given
        DataSet<Integer> left = range("L", 300);
        DataSet<Integer> right = range("R", 300);

        // when
        DataSet<OrderedPair<Integer, Integer>> result =
            assertTimeoutPreemptively(Duration.ofSeconds(5), () -> left.cartesianProductWith(right));

        // then
        assertThat(result.size()).isEqualTo(90_000);
        assertThat(result.elements().get(89_999)).isEqualTo(OrderedPair.of(299, 299));
    }

    @Test
    @DisplayName("16 원소 멱집합은 부분집합 수에 비례하는 시간에 만들어진다")
    void powerSet_대용량() {
        // given
        DataSet<Integer> source = range("S", 16);

        // when
        DataSet<DataSet<Integer>> result = assertTimeoutPreemptively(Duration.ofSeconds(5), source::powerSet);

        // then
        assertThat(result.size()).isEqualTo(1 << 16);
        assertThat(result.elements().get((1 << 16) - 1).isEqualTo(source)).isTrue();
    }

    private static DataSet<Integer> range(String name, int size) {
        DataSet<Integer> set = DataSet.named(name);
        for (int i = 0; i < size; i++) {
            set.insert(i);
        }
        return set;
    }
}
