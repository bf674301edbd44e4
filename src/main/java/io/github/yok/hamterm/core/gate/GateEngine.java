package io.github.yok.hamterm.core.gate;

import org.ejml.data.ZMatrixRMaj;

/**
 * ゲートを量子状態に適用する処理を表すインタフェースです。
 *
 * <p>
 * 状態ベクトルは 2^n×1、密度行列は 2^n×2^n の複素行列で表します。 基底インデックスの最上位ビットが量子ビット 0 です。
 * </p>
 */
public interface GateEngine {

    /**
     * 状態ベクトルにゲートを適用した新しい状態を返します。
     *
     * @param gate ゲートです
     * @param state 状態ベクトル（2^n×1）です
     * @return 適用後の状態ベクトルです
     */
    ZMatrixRMaj apply(UnitaryGate gate, ZMatrixRMaj state);

    /**
     * 密度行列の左側（行の添字）だけにゲートを適用した {@code U·ρ} を返します。
     *
     * <p>
     * 右側の {@code U†} は呼び出し側で別途適用します。
     * </p>
     *
     * @param gate ゲートです
     * @param densityMatrix 密度行列（2^n×2^n）です
     * @return {@code U·ρ} です
     */
    ZMatrixRMaj densityMatrixHalfApply(UnitaryGate gate, ZMatrixRMaj densityMatrix);
}
