package io.github.yok.hamterm.core.gate;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import org.ejml.data.ZMatrixRMaj;

/**
 * 密な状態ベクトル・密度行列にゲートを適用するクラスです。
 *
 * <p>
 * ゲートの対象量子ビット以外の添字を固定した 2^k 個の成分を集め、 ゲート行列を掛けて書き戻します。
 * </p>
 */
public final class DenseStateGateEngine implements GateEngine {

    @Override
    public ZMatrixRMaj apply(UnitaryGate gate, ZMatrixRMaj state) {
        checkNotNull(state, "state は null 不可です");
        checkArgument(state.numCols == 1, "状態ベクトルは 2^n×1 が必要です: %sx%s", state.numRows,
                state.numCols);
        return applyOnRows(gate, state);
    }

    @Override
    public ZMatrixRMaj densityMatrixHalfApply(UnitaryGate gate, ZMatrixRMaj densityMatrix) {
        checkNotNull(densityMatrix, "densityMatrix は null 不可です");
        checkArgument(densityMatrix.numRows == densityMatrix.numCols, "密度行列は正方行列が必要です: %sx%s",
                densityMatrix.numRows, densityMatrix.numCols);
        return applyOnRows(gate, densityMatrix);
    }

    /**
     * 行の添字に対してゲートを作用させます（各列に独立に適用します）。
     *
     * @param gate ゲートです
     * @param m 対象行列です（行数 2^n）
     * @return 適用後の行列です
     */
    private static ZMatrixRMaj applyOnRows(UnitaryGate gate, ZMatrixRMaj m) {
        checkNotNull(gate, "gate は null 不可です");

        int rows = m.numRows;
        checkArgument(rows > 0 && Integer.bitCount(rows) == 1, "状態の次元が 2 のべき乗ではありません: %s", rows);
        int n = Integer.numberOfTrailingZeros(rows);

        int[] qubits = gate.getTargetQubits();
        int k = qubits.length;
        int[] shifts = new int[k];
        int targetMask = 0;
        for (int t = 0; t < k; t++) {
            checkArgument(qubits[t] >= 0 && qubits[t] < n, "量子ビット %s は範囲外です（n=%s）", qubits[t], n);
            shifts[t] = n - 1 - qubits[t];
            checkArgument((targetMask & (1 << shifts[t])) == 0, "対象量子ビットが重複しています: %s", qubits[t]);
            targetMask |= 1 << shifts[t];
        }

        ZMatrixRMaj u = gate.getMatrix();
        int sub = 1 << k;
        int[] idx = new int[sub];
        double[] re = new double[sub];
        double[] im = new double[sub];
        ZMatrixRMaj out = new ZMatrixRMaj(rows, m.numCols);

        for (int base = 0; base < rows; base++) {
            if ((base & targetMask) != 0) {
                continue;
            }
            // ゲートの添字 s（先頭の量子ビットが最上位ビット）を状態の添字に写します。
            for (int s = 0; s < sub; s++) {
                int index = base;
                for (int t = 0; t < k; t++) {
                    if (((s >> (k - 1 - t)) & 1) != 0) {
                        index |= 1 << shifts[t];
                    }
                }
                idx[s] = index;
            }

            for (int col = 0; col < m.numCols; col++) {
                for (int s = 0; s < sub; s++) {
                    re[s] = m.getReal(idx[s], col);
                    im[s] = m.getImag(idx[s], col);
                }
                for (int r = 0; r < sub; r++) {
                    double accRe = 0.0;
                    double accIm = 0.0;
                    for (int s = 0; s < sub; s++) {
                        double uRe = u.getReal(r, s);
                        double uIm = u.getImag(r, s);
                        accRe += uRe * re[s] - uIm * im[s];
                        accIm += uRe * im[s] + uIm * re[s];
                    }
                    out.set(idx[r], col, accRe, accIm);
                }
            }
        }
        return out;
    }
}
