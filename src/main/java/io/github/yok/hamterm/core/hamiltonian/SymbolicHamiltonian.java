package io.github.yok.hamterm.core.hamiltonian;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.hamterm.core.linearalgebra.ComplexTensorBackend;
import io.github.yok.hamterm.core.symbol.ProductExpression;
import io.github.yok.hamterm.core.symbol.SymbolicFactor;
import io.github.yok.hamterm.core.term.HamiltonianTerm;
import io.github.yok.hamterm.core.term.SymbolicTerm;
import io.github.yok.hamterm.core.term.TermGroup;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import lombok.Getter;
import lombok.Value;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;

/**
 * 係数付きの積の和 {@code Σ c_j · (f_j1 * f_j2 * ...)} で表したハミルトニアンです。
 *
 * <p>
 * 各項を {@link SymbolicTerm} に変換し、取り出し元として自身の {@link HamiltonianId} を記録します。
 * </p>
 */
@Getter
public final class SymbolicHamiltonian {

    /**
     * 識別子です。
     */
    private final HamiltonianId id;

    /**
     * 項の並びです（記述順）。
     */
    private final List<Entry> entries;

    /**
     * 名前だけの記号を解決する記号表です。
     */
    private final Map<String, SymbolicFactor> symbolMap;

    private SymbolicHamiltonian(HamiltonianId id, List<Entry> entries,
            Map<String, SymbolicFactor> symbolMap) {
        this.id = id;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.symbolMap = Collections.unmodifiableMap(new LinkedHashMap<>(symbolMap));
    }

    /**
     * ビルダーを生成します。
     *
     * @param name ハミルトニアンの名前です
     * @return ビルダーです
     */
    public static Builder builder(String name) {
        return new Builder(HamiltonianId.create(name));
    }

    /**
     * 全項を {@link SymbolicTerm} に変換します。
     *
     * @param backend テンソル演算のバックエンドです
     * @return 項のリストです（記述順）
     * @throws IllegalArgumentException 解釈できない因子が含まれる場合に発生します
     */
    public List<SymbolicTerm> terms(ComplexTensorBackend backend) {
        List<SymbolicTerm> terms = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            SymbolicTerm t = SymbolicTerm.fromFactors(backend, e.getCoefficient(),
                    e.getExpression(), symbolMap.isEmpty() ? null : symbolMap);
            t.setHamiltonian(id);
            terms.add(t);
        }
        return terms;
    }

    /**
     * 全項をグループ化します。
     *
     * @param backend テンソル演算のバックエンドです
     * @return グループのリストです
     */
    public List<TermGroup> groups(ComplexTensorBackend backend) {
        return TermGroup.fromTerms(terms(backend));
    }

    /**
     * n 量子ビット全体に作用する密行列（2^n×2^n）を返します。
     *
     * <p>
     * 量子ビット {@code 0..n-1} の零行列の項に全項をマージして構築します。
     * </p>
     *
     * @param backend テンソル演算のバックエンドです
     * @param nqubits 量子ビット数です（1 以上）
     * @return 密行列です
     * @throws IllegalArgumentException 項の量子ビットが範囲外の場合に発生します
     */
    public ZMatrixRMaj denseMatrix(ComplexTensorBackend backend, int nqubits) {
        checkNotNull(backend, "backend は null 不可です");
        checkArgument(nqubits > 0, "nqubits は 1 以上が必要です: %s", nqubits);

        int dim = 1 << nqubits;
        HamiltonianTerm full = new HamiltonianTerm(backend, new ZMatrixRMaj(dim, dim),
                IntStream.range(0, nqubits).toArray());
        for (SymbolicTerm t : terms(backend)) {
            full = full.merge(t);
        }
        return full.matrix();
    }

    /**
     * 項が作用する量子ビット番号の最大値 + 1 を返します。
     *
     * @param backend テンソル演算のバックエンドです
     * @return 量子ビット数です（項がすべてスカラーの場合は 0）
     */
    public int qubitCount(ComplexTensorBackend backend) {
        int max = -1;
        for (SymbolicTerm t : terms(backend)) {
            for (int q : t.getTargetQubits()) {
                max = Math.max(max, q);
            }
        }
        return max + 1;
    }

    /**
     * 1 つの項（係数と積）です。
     */
    @Value
    public static class Entry {

        /**
         * 係数です。
         */
        Complex_F64 coefficient;

        /**
         * 因子の積です。
         */
        ProductExpression expression;
    }

    /**
     * {@link SymbolicHamiltonian} のビルダーです。
     */
    public static final class Builder {

        private final HamiltonianId id;

        private final List<Entry> entries = new ArrayList<>();

        private final Map<String, SymbolicFactor> symbolMap = new LinkedHashMap<>();

        private Builder(HamiltonianId id) {
            this.id = id;
        }

        /**
         * 実数係数の項を追加します。
         *
         * @param coefficient 係数です
         * @param factors 因子です（空の場合は定数項）
         * @return このビルダーです
         */
        public Builder add(double coefficient, SymbolicFactor... factors) {
            return add(new Complex_F64(coefficient, 0.0), ProductExpression.of(factors));
        }

        /**
         * 項を追加します。
         *
         * @param coefficient 係数です（null 不可）
         * @param expression 因子の積です（null 不可）
         * @return このビルダーです
         */
        public Builder add(Complex_F64 coefficient, ProductExpression expression) {
            checkNotNull(coefficient, "coefficient は null 不可です");
            checkNotNull(expression, "expression は null 不可です");
            entries.add(new Entry(new Complex_F64(coefficient.real, coefficient.imaginary),
                    expression));
            return this;
        }

        /**
         * 名前だけの記号に、演算子記号またはスカラー記号を対応付けます。
         *
         * @param name 記号名です
         * @param factor 対応する因子です
         * @return このビルダーです
         */
        public Builder bind(String name, SymbolicFactor factor) {
            checkNotNull(name, "name は null 不可です");
            checkNotNull(factor, "factor は null 不可です");
            symbolMap.put(name, factor);
            return this;
        }

        /**
         * ハミルトニアンを生成します。
         *
         * @return ハミルトニアンです
         */
        public SymbolicHamiltonian build() {
            return new SymbolicHamiltonian(id, entries, symbolMap);
        }
    }
}
