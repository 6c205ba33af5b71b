package com.ryuqq.dataset.adapter.script;

import com.ryuqq.dataset.core.model.DataSet;
import com.ryuqq.dataset.core.model.OrderedPair;

import java.util.ArrayList;
import java.util.List;

/**
 * 명령 결과를 출력 줄로 변환.
 *
 * <p>집합 자체의 표현은 {@link DataSet#render()}를 그대로 사용하고,
 * 여기서는 명령별 문장 틀만 붙입니다.</p>
 *
 * @author DataSet Team
 * @since 1.0.0
 */
public final class ResultRenderer {

    private static final String YES = "Yes";
    private static final String NO = "No";

    /**
     * 집합 한 줄 출력.
     *
     * @param set 출력할 집합
     * @return "name = {..}" 또는 "{..}"
     */
    public List<String> set(DataSet<?> set) {
        return List.of(set.render());
    }

    /**
     * 부분집합 판정 결과.
     *
     * @param nameA 왼쪽 집합 이름
     * @param nameB 오른쪽 집합 이름
     * @param subset 판정 결과
     * @return "Is A ⊆ B? Yes|No"
     */
    public List<String> subset(String nameA, String nameB, boolean subset) {
        return List.of("Is " + nameA + " ⊆ " + nameB + "? " + answer(subset));
    }

    /**
     * 동등 판정 결과.
     *
     * @param nameA 왼쪽 집합 이름
     * @param nameB 오른쪽 집합 이름
     * @param equal 판정 결과
     * @return "Are A and B equal? Yes|No"
     */
    public List<String> equality(String nameA, String nameB, boolean equal) {
        return List.of("Are " + nameA + " and " + nameB + " equal? " + answer(equal));
    }

    /**
     * 원소 개수.
     *
     * @param name 집합 이름
     * @param size 원소 개수
     * @return "Size of set A: n element(s)"
     */
    public List<String> size(String name, int size) {
        return List.of("Size of set " + name + ": " + size + " element(s)");
    }

    /**
     * 멱집합: 요약 한 줄 + 부분집합마다 한 줄.
     *
     * @param name 원본 집합 이름
     * @param powerSet 멱집합
     * @return 출력 줄
     */
    public List<String> powerSet(String name, DataSet<? extends DataSet<?>> powerSet) {
        List<String> lines = new ArrayList<>();
        lines.add("Power set of " + name + " contains " + powerSet.size() + " subsets:");
        for (DataSet<?> subset : powerSet) {
            lines.add(subset.render());
        }
        return lines;
    }

    /**
     * 데카르트 곱: 요약 한 줄 + 순서쌍 목록 한 줄.
     *
     * @param nameA 왼쪽 집합 이름
     * @param nameB 오른쪽 집합 이름
     * @param product 순서쌍 집합
     * @return 출력 줄
     */
    public List<String> cartesianProduct(String nameA, String nameB, DataSet<? extends OrderedPair<?, ?>> product) {
        StringBuilder pairs = new StringBuilder("{");
        boolean first = true;
        for (OrderedPair<?, ?> pair : product) {
            if (!first) {
                pairs.append(", ");
            }
            pairs.append(pair);
            first = false;
        }
        pairs.append('}');
        return List.of(
            "Cartesian product " + nameA + " × " + nameB + " (" + product.size() + " pairs):",
            pairs.toString()
        );
    }

    private static String answer(boolean value) {
        return value ? YES : NO;
    }
}
