package io.github.yok.hamterm.core.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 因子の順序付き積（{@code f1 * f2 * ...}）を表すクラスです。
 *
 * <p>
 * 記号エンジンが返す「順序付き因子列」に相当します。 因子が空の式は乗法の単位元 {@code 1} です。
 * </p>
 */
public final class ProductExpression {

    private static final ProductExpression ONE = new ProductExpression(List.of());

    /**
     * 因子列です（記述順）。
     */
    private final List<SymbolicFactor> factors;

    private ProductExpression(List<SymbolicFactor> factors) {
        this.factors = factors;
    }

    /**
     * 乗法の単位元 {@code 1} を返します。
     *
     * @return 単位元です
     */
    public static ProductExpression one() {
        return ONE;
    }

    /**
     * 因子列から積を生成します。
     *
     * @param factors 因子列です（null の要素は不可）
     * @return 積です
     * @throws IllegalArgumentException 因子に null が含まれる場合に発生します
     */
    public static ProductExpression of(SymbolicFactor... factors) {
        return ONE.times(factors);
    }

    /**
     * 右側に因子を掛けた新しい積を返します。
     *
     * @param more 追加する因子です
     * @return 新しい積です
     * @throws IllegalArgumentException 因子に null が含まれる場合に発生します
     */
    public ProductExpression times(SymbolicFactor... more) {
        List<SymbolicFactor> list = new ArrayList<>(factors);
        for (SymbolicFactor f : more) {
            if (f == null) {
                throw new IllegalArgumentException("因子に null は指定できません");
            }
            list.add(f);
        }
        return new ProductExpression(Collections.unmodifiableList(list));
    }

    /**
     * 記述順の因子列を返します。
     *
     * @return 変更不可の因子列です
     */
    public List<SymbolicFactor> orderedFactors() {
        return factors;
    }

    /**
     * 乗法の単位元かどうかを返します。
     *
     * @return 因子が空の場合は true です
     */
    public boolean isOne() {
        return factors.isEmpty();
    }

    @Override
    public String toString() {
        if (factors.isEmpty()) {
            return "1";
        }
        return factors.stream().map(SymbolicFactor::toString).collect(Collectors.joining("*"));
    }
}
