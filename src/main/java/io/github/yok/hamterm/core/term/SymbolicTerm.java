package io.github.yok.hamterm.core.term;

import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.hamterm.core.gate.GateEngine;
import io.github.yok.hamterm.core.gate.UnitaryGate;
import io.github.yok.hamterm.core.linearalgebra.ComplexTensorBackend;
import io.github.yok.hamterm.core.symbol.ProductExpression;
import io.github.yok.hamterm.core.symbol.SymbolicFactor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;

/**
 * 係数と単一量子ビットの記号因子の積から構成される項です。
 *
 * <p>
 * 行列は初めて参照されたときに構築し、以後はキャッシュを返します。 同じ量子ビットに作用する因子は記述順に行列積をとり（可換とはみなしません）、
 * 量子ビット番号の昇順にクロネッカー積をとります。
 * </p>
 *
 * <pre>
 * ProductExpression expr = ProductExpression.of(Symbols.x(0), Symbols.x(1));
 * SymbolicTerm term = SymbolicTerm.fromFactors(backend, new Complex_F64(2, 0), expr, null);
 * term.matrix(); // 2 * kron(X, X)
 * </pre>
 */
public final class SymbolicTerm extends HamiltonianTerm {

    /**
     * 因子の積に掛かる複素係数です。
     */
    private final Complex_F64 coefficient;

    /**
     * 演算子因子の列です（記述順、べきは展開済み）。
     */
    private final List<SymbolicFactor> factors;

    /**
     * 量子ビットごとの 2×2 行列の列です（記述順）。
     */
    private final SortedMap<Integer, List<ZMatrixRMaj>> matrixMap;

    /**
     * {@link #matrix()} のキャッシュです。
     */
    private ZMatrixRMaj cachedMatrix;

    private SymbolicTerm(ComplexTensorBackend backend, Complex_F64 coefficient,
            List<SymbolicFactor> factors, SortedMap<Integer, List<ZMatrixRMaj>> matrixMap) {
        super(backend, sortedKeys(matrixMap));
        this.coefficient = new Complex_F64(coefficient.real, coefficient.imaginary);
        this.factors = factors;
        this.matrixMap = matrixMap;
    }

    /**
     * 係数だけをもつ（量子ビットに作用しない）スカラー項を生成します。
     *
     * @param backend テンソル演算のバックエンドです
     * @param coefficient 係数です
     * @return スカラー項です
     */
    public static SymbolicTerm scalar(ComplexTensorBackend backend, Complex_F64 coefficient) {
        checkNotNull(coefficient, "coefficient は null 不可です");
        return new SymbolicTerm(backend, coefficient, List.of(),
                Collections.unmodifiableSortedMap(new TreeMap<>()));
    }

    /**
     * 係数と記号式の積から項を生成します。
     *
     * @param backend テンソル演算のバックエンドです
     * @param coefficient 係数です
     * @param expression 記号式です
     * @return 項です
     * @throws IllegalArgumentException 解釈できない因子が含まれる場合に発生します
     */
    public static SymbolicTerm fromFactors(ComplexTensorBackend backend, double coefficient,
            ProductExpression expression) {
        return fromFactors(backend, new Complex_F64(coefficient, 0.0), expression, null);
    }

    /**
     * 係数と記号式の積から項を生成します。
     *
     * <p>
     * 因子は記述順に次のように解釈します（べきは回数分の繰り返しに展開します）。
     * </p>
     * <ul>
     * <li>演算子記号：量子ビットごとの行列列と因子列に追加します</li>
     * <li>スカラー記号：値を係数に掛けます</li>
     * <li>虚数単位：係数に {@code i} を掛けます</li>
     * <li>名前だけの記号：{@code symbolMap} で解決してから上記のいずれかとして扱います</li>
     * </ul>
     *
     * @param backend テンソル演算のバックエンドです
     * @param coefficient 係数です（null 不可）
     * @param expression 記号式です（null 不可）
     * @param symbolMap 記号名から演算子記号・スカラー記号への対応です（null 可）
     * @return 項です
     * @throws IllegalArgumentException 解釈できない因子が含まれる場合に発生します
     */
    public static SymbolicTerm fromFactors(ComplexTensorBackend backend, Complex_F64 coefficient,
            ProductExpression expression, Map<String, SymbolicFactor> symbolMap) {
        checkNotNull(coefficient, "coefficient は null 不可です");
        checkNotNull(expression, "expression は null 不可です");

        if (expression.isOne()) {
            return scalar(backend, coefficient);
        }

        double re = coefficient.real;
        double im = coefficient.imaginary;
        List<SymbolicFactor> factors = new ArrayList<>();
        SortedMap<Integer, List<ZMatrixRMaj>> matrixMap = new TreeMap<>();

        for (SymbolicFactor factor : expression.orderedFactors()) {
            int power = factor.getPower();
            SymbolicFactor base = factor.base();

            if (base.getKind() == SymbolicFactor.Kind.SYMBOL && symbolMap != null
                    && symbolMap.containsKey(base.getName())) {
                SymbolicFactor bound = symbolMap.get(base.getName());
                if (bound == null) {
                    throw new IllegalArgumentException("記号表の値が null です: " + base.getName());
                }
                power = Math.multiplyExact(power, bound.getPower());
                base = bound.base();
            }

            switch (base.getKind()) {
                case OPERATOR:
                    List<ZMatrixRMaj> onQubit =
                            matrixMap.computeIfAbsent(base.getQubit(), q -> new ArrayList<>());
                    for (int r = 0; r < power; r++) {
                        factors.add(base);
                        onQubit.add(base.getMatrix());
                    }
                    break;
                case SCALAR:
                    Complex_F64 v = base.getValue();
                    for (int r = 0; r < power; r++) {
                        double nextRe = re * v.real - im * v.imaginary;
                        im = re * v.imaginary + im * v.real;
                        re = nextRe;
                    }
                    break;
                case IMAGINARY_UNIT:
                    for (int r = 0; r < power; r++) {
                        double nextRe = -im;
                        im = re;
                        re = nextRe;
                    }
                    break;
                default:
                    throw new IllegalArgumentException("因子を解釈できません: " + factor);
            }
        }

        SortedMap<Integer, List<ZMatrixRMaj>> frozen = new TreeMap<>();
        matrixMap.forEach((q, list) -> frozen.put(q, Collections.unmodifiableList(list)));
        return new SymbolicTerm(backend, new Complex_F64(re, im),
                Collections.unmodifiableList(factors), Collections.unmodifiableSortedMap(frozen));
    }

    /**
     * 係数のコピーを返します。
     *
     * @return 係数です
     */
    public Complex_F64 getCoefficient() {
        return new Complex_F64(coefficient.real, coefficient.imaginary);
    }

    /**
     * 演算子因子の列（記述順）を返します。
     *
     * @return 変更不可の因子列です
     */
    public List<SymbolicFactor> getFactors() {
        return factors;
    }

    /**
     * 量子ビットごとの行列列を返します。
     *
     * @return 変更不可の対応表です（キーは昇順）
     */
    public SortedMap<Integer, List<ZMatrixRMaj>> getMatrixMap() {
        return matrixMap;
    }

    /**
     * 行列がすでに構築済みかどうかを返します。
     *
     * @return 構築済みの場合は true です
     */
    public boolean isMaterialized() {
        return cachedMatrix != null;
    }

    /**
     * 項の行列を返します。
     *
     * <p>
     * {@code coefficient ⊗ M(q0) ⊗ M(q1) ⊗ ...}（{@code q0 < q1 < ...}）で、 {@code M(q)} は量子ビット q に作用する因子の記述順の行列積です。
     * </p>
     *
     * @return 2^k×2^k の行列です
     */
    @Override
    public ZMatrixRMaj matrix() {
        if (cachedMatrix == null) {
            ZMatrixRMaj m = backend.scalar(coefficient);
            for (List<ZMatrixRMaj> onQubit : matrixMap.values()) {
                m = backend.kron(m, product(onQubit));
            }
            cachedMatrix = m;
        }
        return cachedMatrix;
    }

    /**
     * 係数をスカラー倍した新しい項を返します。
     *
     * <p>
     * 因子列と量子ビットごとの行列列は共有します。 行列が構築済みの場合はスカラー倍した行列を引き継ぎ、ゲートは引き継ぎません。
     * </p>
     *
     * @param x スカラーです（null 不可）
     * @return スカラー倍した項です
     */
    @Override
    public SymbolicTerm scale(Complex_F64 x) {
        checkNotNull(x, "x は null 不可です");
        Complex_F64 c = new Complex_F64(coefficient.real * x.real - coefficient.imaginary * x.imaginary,
                coefficient.real * x.imaginary + coefficient.imaginary * x.real);
        SymbolicTerm scaled = new SymbolicTerm(backend, c, factors, matrixMap);
        if (cachedMatrix != null) {
            scaled.cachedMatrix = backend.scale(x, cachedMatrix);
        }
        scaled.setHamiltonian(getHamiltonian());
        return scaled;
    }

    @Override
    public SymbolicTerm scale(double x) {
        return scale(new Complex_F64(x, 0.0));
    }

    /**
     * 因子ごとの 1 量子ビットゲートを記述順に状態へ作用させ、最後に係数を掛けます。
     *
     * @param engine ゲート適用エンジンです
     * @param state 状態ベクトル、または密度行列です
     * @param densityMatrix 密度行列として扱う場合は true です
     * @return 作用後の状態です
     */
    @Override
    public ZMatrixRMaj apply(GateEngine engine, ZMatrixRMaj state, boolean densityMatrix) {
        checkNotNull(engine, "engine は null 不可です");
        ZMatrixRMaj current = state;
        for (SymbolicFactor factor : factors) {
            UnitaryGate g = factor.gate();
            if (densityMatrix) {
                g.setDensityMatrix(true);
                current = engine.densityMatrixHalfApply(g, current);
            } else {
                current = engine.apply(g, current);
            }
        }
        return backend.scale(coefficient, current);
    }

    /**
     * 行列列の左から順の行列積を返します。
     *
     * @param matrices 行列列です（1 個以上）
     * @return 行列積です
     */
    private ZMatrixRMaj product(List<ZMatrixRMaj> matrices) {
        ZMatrixRMaj m = matrices.get(0).copy();
        for (int i = 1; i < matrices.size(); i++) {
            m = backend.mult(m, matrices.get(i));
        }
        return m;
    }

    private static int[] sortedKeys(SortedMap<Integer, List<ZMatrixRMaj>> matrixMap) {
        return matrixMap.keySet().stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public String toString() {
        return "SymbolicTerm(" + coefficient + ", " + factors + ")";
    }
}
