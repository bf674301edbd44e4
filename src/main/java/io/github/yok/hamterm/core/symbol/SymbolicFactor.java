package io.github.yok.hamterm.core.symbol;

import io.github.yok.hamterm.core.gate.UnitaryGate;
import lombok.AccessLevel;
import lombok.Getter;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;

/**
 * 積の形の記号式を構成する 1 つの因子を表すクラスです。
 *
 * <p>
 * 因子は {@link Kind} で区別されるタグ付きの値です。
 * </p>
 * <ul>
 * <li>{@link Kind#OPERATOR}：量子ビット {@code qubit} に作用する 2×2 行列をもつ演算子記号</li>
 * <li>{@link Kind#SCALAR}：値が数値スカラーの記号（量子ビットには作用せず係数に畳み込まれます）</li>
 * <li>{@link Kind#IMAGINARY_UNIT}：虚数単位 {@code i}</li>
 * <li>{@link Kind#SYMBOL}：名前だけをもつ記号（記号表で OPERATOR / SCALAR に解決されます）</li>
 * </ul>
 *
 * <p>
 * いずれの因子も整数のべき {@code power}（1 以上）をもちます。
 * </p>
 */
@Getter
public final class SymbolicFactor {

    /**
     * 因子の種別です。
     */
    public enum Kind {
        OPERATOR, SCALAR, IMAGINARY_UNIT, SYMBOL
    }

    /**
     * 因子の種別です。
     */
    private final Kind kind;

    /**
     * 記号名です（虚数単位の場合は {@code "I"}）。
     */
    private final String name;

    /**
     * 対象量子ビットです（OPERATOR / SCALAR 以外は -1）。
     */
    private final int qubit;

    /**
     * 2×2 の演算子行列です（OPERATOR 以外は null）。
     */
    private final ZMatrixRMaj matrix;

    /**
     * スカラー値です（SCALAR 以外は null）。
     */
    private final Complex_F64 value;

    /**
     * べき指数です（1 以上）。
     */
    private final int power;

    /**
     * 演算子を 1 量子ビットゲートとして適用するためのキャッシュです。
     */
    @Getter(AccessLevel.NONE)
    private UnitaryGate gate;

    private SymbolicFactor(Kind kind, String name, int qubit, ZMatrixRMaj matrix,
            Complex_F64 value, int power) {
        this.kind = kind;
        this.name = name;
        this.qubit = qubit;
        this.matrix = matrix;
        this.value = value;
        this.power = power;
    }

    /**
     * 演算子記号を生成します。
     *
     * @param name 記号名です（null 不可）
     * @param qubit 対象量子ビットです（0 以上）
     * @param matrix 2×2 行列です（null 不可）
     * @return 演算子因子です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public static SymbolicFactor operator(String name, int qubit, ZMatrixRMaj matrix) {
        requireName(name);
        requireQubit(qubit);
        if (matrix == null) {
            throw new IllegalArgumentException("matrix は null 不可です");
        }
        if (matrix.numRows != 2 || matrix.numCols != 2) {
            throw new IllegalArgumentException(
                    "演算子記号の行列は 2×2 が必要です: " + matrix.numRows + "x" + matrix.numCols);
        }
        return new SymbolicFactor(Kind.OPERATOR, name, qubit, matrix.copy(), null, 1);
    }

    /**
     * 値がスカラーの記号を生成します。
     *
     * @param name 記号名です（null 不可）
     * @param qubit 記号に付随する量子ビットです（0 以上）
     * @param value スカラー値です（null 不可）
     * @return スカラー因子です
     */
    public static SymbolicFactor scalar(String name, int qubit, Complex_F64 value) {
        requireName(name);
        requireQubit(qubit);
        if (value == null) {
            throw new IllegalArgumentException("value は null 不可です");
        }
        return new SymbolicFactor(Kind.SCALAR, name, qubit, null,
                new Complex_F64(value.real, value.imaginary), 1);
    }

    /**
     * 虚数単位を生成します。
     *
     * @return 虚数単位の因子です
     */
    public static SymbolicFactor imaginaryUnit() {
        return new SymbolicFactor(Kind.IMAGINARY_UNIT, "I", -1, null, null, 1);
    }

    /**
     * 名前だけをもつ記号を生成します。
     *
     * @param name 記号名です（null 不可）
     * @return 記号因子です
     */
    public static SymbolicFactor symbol(String name) {
        requireName(name);
        return new SymbolicFactor(Kind.SYMBOL, name, -1, null, null, 1);
    }

    /**
     * べき指数を掛けた因子を返します。
     *
     * @param exponent べき指数です（1 以上）
     * @return べき乗した因子です
     * @throws IllegalArgumentException exponent が 1 未満の場合に発生します
     */
    public SymbolicFactor pow(int exponent) {
        if (exponent < 1) {
            throw new IllegalArgumentException("べき指数は 1 以上の整数が必要です: " + exponent);
        }
        return new SymbolicFactor(kind, name, qubit, matrix, value,
                Math.multiplyExact(power, exponent));
    }

    /**
     * べき指数を 1 にした因子を返します。
     *
     * @return べきを外した因子です
     */
    public SymbolicFactor base() {
        if (power == 1) {
            return this;
        }
        return new SymbolicFactor(kind, name, qubit, matrix, value, 1);
    }

    /**
     * 演算子を 1 量子ビットゲートとして返します。
     *
     * <p>
     * 初回に生成したゲートをキャッシュし、以後は同じオブジェクトを返します。
     * </p>
     *
     * @return ゲートです
     * @throws IllegalStateException OPERATOR 以外の因子の場合に発生します
     */
    public UnitaryGate gate() {
        if (kind != Kind.OPERATOR) {
            throw new IllegalStateException("ゲートを生成できるのは演算子記号だけです: " + this);
        }
        if (gate == null) {
            gate = new UnitaryGate(matrix, qubit);
        }
        return gate;
    }

    private static void requireName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("記号名は必須です");
        }
    }

    private static void requireQubit(int qubit) {
        if (qubit < 0) {
            throw new IllegalArgumentException("量子ビット番号は 0 以上が必要です: " + qubit);
        }
    }

    @Override
    public String toString() {
        String base = kind == Kind.IMAGINARY_UNIT ? "I" : name;
        return power == 1 ? base : base + "**" + power;
    }
}
