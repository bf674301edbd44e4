package io.github.yok.hamterm.core.gate;

import java.util.Arrays;
import lombok.Getter;
import lombok.Setter;
import org.ejml.data.ZMatrixRMaj;

/**
 * 密行列と対象量子ビット列からなるゲートを表すクラスです。
 *
 * <p>
 * 行列の基底順序は {@code targetQubits} の並び（先頭が最上位ビット）で決まります。
 * 同じゲートオブジェクトを複数の呼び出し元で共有するため、密度行列モードのフラグは可変です。
 * </p>
 */
@Getter
public final class UnitaryGate {

    /**
     * 2^k×2^k のゲート行列です。
     */
    private final ZMatrixRMaj matrix;

    /**
     * 対象量子ビット列です。
     */
    private final int[] targetQubits;

    /**
     * 密度行列に対して適用するかどうかです。
     */
    @Setter
    private boolean densityMatrix;

    /**
     * ゲートを生成します。
     *
     * @param matrix 2^k×2^k のゲート行列です（null 不可）
     * @param targetQubits 対象量子ビット列です（k 個）
     * @throws IllegalArgumentException 行列の形状と量子ビット数が一致しない場合に発生します
     */
    public UnitaryGate(ZMatrixRMaj matrix, int... targetQubits) {
        if (matrix == null) {
            throw new IllegalArgumentException("matrix は null 不可です");
        }
        if (targetQubits == null) {
            throw new IllegalArgumentException("targetQubits は null 不可です");
        }
        int dim = 1 << targetQubits.length;
        if (matrix.numRows != dim || matrix.numCols != dim) {
            throw new IllegalArgumentException("ゲート行列の形状が量子ビット数と一致しません: " + matrix.numRows + "x"
                    + matrix.numCols + ", qubits=" + Arrays.toString(targetQubits));
        }
        this.matrix = matrix;
        this.targetQubits = targetQubits.clone();
    }

    /**
     * 対象量子ビット列のコピーを返します。
     *
     * @return 対象量子ビット列です
     */
    public int[] getTargetQubits() {
        return targetQubits.clone();
    }

    @Override
    public String toString() {
        return "UnitaryGate" + Arrays.toString(targetQubits);
    }
}
