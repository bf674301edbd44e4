package io.github.yok.hamterm.core.symbol;

/**
 * パウリ演算子の記号を生成するクラスです。
 *
 * <p>
 * 記号名は演算子名と量子ビット番号の連結（例: {@code X0}, {@code Z3}）です。
 * </p>
 */
public final class Symbols {

    private Symbols() {
    }

    public static SymbolicFactor x(int qubit) {
        return SymbolicFactor.operator("X" + qubit, qubit, PauliMatrices.x());
    }

    public static SymbolicFactor y(int qubit) {
        return SymbolicFactor.operator("Y" + qubit, qubit, PauliMatrices.y());
    }

    public static SymbolicFactor z(int qubit) {
        return SymbolicFactor.operator("Z" + qubit, qubit, PauliMatrices.z());
    }

    /**
     * 単位演算子の記号を返します。
     *
     * <p>
     * 量子ビットの台には含まれますが、行列としては恒等写像です。
     * </p>
     *
     * @param qubit 量子ビット番号です
     * @return 単位演算子の記号です
     */
    public static SymbolicFactor identity(int qubit) {
        return SymbolicFactor.operator("I" + qubit, qubit, PauliMatrices.identity());
    }
}
