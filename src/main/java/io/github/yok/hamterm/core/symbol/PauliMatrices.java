package io.github.yok.hamterm.core.symbol;

import org.ejml.data.ZMatrixRMaj;

/**
 * 単一量子ビットのパウリ行列を生成するクラスです。
 *
 * <p>
 * 呼び出しごとに新しい行列を返します。
 * </p>
 */
public final class PauliMatrices {

    private PauliMatrices() {
    }

    /**
     * 2×2 の単位行列を返します。
     *
     * @return 単位行列です
     */
    public static ZMatrixRMaj identity() {
        return new ZMatrixRMaj(new double[][] {{1, 0, 0, 0}, {0, 0, 1, 0}});
    }

    /**
     * パウリ X 行列を返します。
     *
     * @return パウリ X 行列です
     */
    public static ZMatrixRMaj x() {
        return new ZMatrixRMaj(new double[][] {{0, 0, 1, 0}, {1, 0, 0, 0}});
    }

    /**
     * パウリ Y 行列を返します。
     *
     * @return パウリ Y 行列です
     */
    public static ZMatrixRMaj y() {
        return new ZMatrixRMaj(new double[][] {{0, 0, 0, -1}, {0, 1, 0, 0}});
    }

    /**
     * パウリ Z 行列を返します。
     *
     * @return パウリ Z 行列です
     */
    public static ZMatrixRMaj z() {
        return new ZMatrixRMaj(new double[][] {{1, 0, 0, 0}, {0, 0, -1, 0}});
    }
}
