package io.github.yok.hamterm.core.evolution;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.hamterm.app.HamtermProperties;
import io.github.yok.hamterm.core.linearalgebra.ComplexTensorBackend;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;

/**
 * 状態ベクトルの生成と比較を行うユーティリティです。
 *
 * <p>
 * 状態ベクトルは 2^n×1 の複素行列で、基底インデックスの最上位ビットが量子ビット 0 です。
 * </p>
 */
public final class QuantumStates {

    private QuantumStates() {
    }

    /**
     * 初期状態を生成します。
     *
     * <ul>
     * <li>ZERO：{@code |00...0>}</li>
     * <li>PLUS：{@code |++...+>}</li>
     * <li>NEEL：{@code |0101...>}</li>
     * </ul>
     *
     * @param kind 初期状態の種類です
     * @param nqubits 量子ビット数です（1 以上）
     * @return 状態ベクトルです
     */
    public static ZMatrixRMaj initial(HamtermProperties.Evolution.InitialState kind, int nqubits) {
        checkNotNull(kind, "kind は null 不可です");
        checkArgument(nqubits > 0 && nqubits < 31, "nqubits が範囲外です: %s", nqubits);

        int dim = 1 << nqubits;
        ZMatrixRMaj state = new ZMatrixRMaj(dim, 1);
        switch (kind) {
            case ZERO:
                state.set(0, 0, 1.0, 0.0);
                break;
            case PLUS:
                double amp = 1.0 / Math.sqrt(dim);
                for (int i = 0; i < dim; i++) {
                    state.set(i, 0, amp, 0.0);
                }
                break;
            case NEEL:
                int index = 0;
                for (int q = 0; q < nqubits; q++) {
                    if (q % 2 == 1) {
                        index |= 1 << (nqubits - 1 - q);
                    }
                }
                state.set(index, 0, 1.0, 0.0);
                break;
            default:
                throw new IllegalArgumentException("未対応の初期状態です: " + kind);
        }
        return state;
    }

    /**
     * 厳密な 1 ステップの時間発展演算子 {@code exp(-i·dt·H)} を返します。
     *
     * @param backend テンソル演算のバックエンドです
     * @param hamiltonian 2^n×2^n のハミルトニアンです
     * @param dt 時間刻みです
     * @return 時間発展演算子です
     */
    public static ZMatrixRMaj exactPropagator(ComplexTensorBackend backend, ZMatrixRMaj hamiltonian,
            double dt) {
        checkNotNull(backend, "backend は null 不可です");
        return backend.expm(backend.scale(new Complex_F64(0.0, -dt), hamiltonian));
    }

    /**
     * 忠実度 {@code |<a|b>|^2} を返します。
     *
     * @param a 状態ベクトルです
     * @param b 状態ベクトルです
     * @return 忠実度です
     */
    public static double fidelity(ZMatrixRMaj a, ZMatrixRMaj b) {
        checkArgument(a.numRows == b.numRows && a.numCols == 1 && b.numCols == 1,
                "状態ベクトルの形状が一致しません: %sx%s, %sx%s", a.numRows, a.numCols, b.numRows, b.numCols);
        double re = 0.0;
        double im = 0.0;
        for (int i = 0; i < a.numRows; i++) {
            double aRe = a.getReal(i, 0);
            double aIm = a.getImag(i, 0);
            double bRe = b.getReal(i, 0);
            double bIm = b.getImag(i, 0);
            // conj(a) * b
            re += aRe * bRe + aIm * bIm;
            im += aRe * bIm - aIm * bRe;
        }
        return re * re + im * im;
    }

    /**
     * ノルム {@code <ψ|ψ>} の平方根を返します。
     *
     * @param state 状態ベクトルです
     * @return ノルムです
     */
    public static double norm(ZMatrixRMaj state) {
        double s = 0.0;
        for (int i = 0; i < state.numRows; i++) {
            double re = state.getReal(i, 0);
            double im = state.getImag(i, 0);
            s += re * re + im * im;
        }
        return Math.sqrt(s);
    }
}
