package io.github.yok.hamterm.core.linearalgebra;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import org.ejml.data.Complex_F64;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;

/**
 * EJML の {@link ZMatrixRMaj} を用いて複素テンソル演算を行うクラスです。
 *
 * <p>
 * {@link ZMatrixRMaj#data} は行優先・実部虚部交互（{@code [re, im, re, im, ...]}）の配列です。
 * クロネッカー積や軸の並べ替えはこの配列を直接走査して計算します。
 * </p>
 */
public final class EjmlComplexTensorBackend implements ComplexTensorBackend {

    /**
     * 行列指数関数に用いる対角 Padé 近似の次数です。
     */
    private static final int PADE_DEGREE = 6;

    /**
     * 値をバックエンドの複素行列表現に変換します。
     *
     * @param value 変換対象です
     * @return 複素行列です（入力が行列の場合もコピーを返します）
     * @throws IllegalArgumentException 数値スカラーでも行列でもない場合に発生します
     */
    @Override
    public ZMatrixRMaj cast(Object value) {
        if (value instanceof ZMatrixRMaj) {
            return ((ZMatrixRMaj) value).copy();
        }
        if (value instanceof DMatrixRMaj) {
            DMatrixRMaj real = (DMatrixRMaj) value;
            ZMatrixRMaj out = new ZMatrixRMaj(real.numRows, real.numCols);
            for (int row = 0; row < real.numRows; row++) {
                for (int col = 0; col < real.numCols; col++) {
                    out.set(row, col, real.get(row, col), 0.0);
                }
            }
            return out;
        }
        if (value instanceof Complex_F64) {
            return scalar((Complex_F64) value);
        }
        if (value instanceof Number) {
            return scalar(new Complex_F64(((Number) value).doubleValue(), 0.0));
        }
        throw new IllegalArgumentException("行列として扱えない型です: "
                + (value == null ? "null" : value.getClass().getName()));
    }

    @Override
    public ZMatrixRMaj scalar(Complex_F64 value) {
        checkNotNull(value, "value は null 不可です");
        ZMatrixRMaj out = new ZMatrixRMaj(1, 1);
        out.set(0, 0, value.real, value.imaginary);
        return out;
    }

    @Override
    public ZMatrixRMaj identity(int dim) {
        checkArgument(dim > 0, "dim は 1 以上が必要です: %s", dim);
        return CommonOps_ZDRM.identity(dim);
    }

    /**
     * クロネッカー積 {@code a ⊗ b} を返します。
     *
     * <p>
     * 結果の要素は {@code out[ra*rb + i][ca*cb + j] = a[ra][ca] * b[i][j]} です。
     * </p>
     *
     * @param a 左側の行列です
     * @param b 右側の行列です
     * @return クロネッカー積です
     */
    @Override
    public ZMatrixRMaj kron(ZMatrixRMaj a, ZMatrixRMaj b) {
        checkNotNull(a, "a は null 不可です");
        checkNotNull(b, "b は null 不可です");

        int rows = a.numRows * b.numRows;
        int cols = a.numCols * b.numCols;
        ZMatrixRMaj out = new ZMatrixRMaj(rows, cols);

        for (int ar = 0; ar < a.numRows; ar++) {
            for (int ac = 0; ac < a.numCols; ac++) {
                double aRe = a.getReal(ar, ac);
                double aIm = a.getImag(ar, ac);
                if (aRe == 0.0 && aIm == 0.0) {
                    continue;
                }
                for (int br = 0; br < b.numRows; br++) {
                    for (int bc = 0; bc < b.numCols; bc++) {
                        double bRe = b.getReal(br, bc);
                        double bIm = b.getImag(br, bc);
                        out.set(ar * b.numRows + br, ac * b.numCols + bc,
                                aRe * bRe - aIm * bIm, aRe * bIm + aIm * bRe);
                    }
                }
            }
        }
        return out;
    }

    @Override
    public ZMatrixRMaj mult(ZMatrixRMaj a, ZMatrixRMaj b) {
        checkNotNull(a, "a は null 不可です");
        checkNotNull(b, "b は null 不可です");
        checkArgument(a.numCols == b.numRows, "行列積の次元が一致しません: %sx%s · %sx%s", a.numRows,
                a.numCols, b.numRows, b.numCols);
        ZMatrixRMaj out = new ZMatrixRMaj(a.numRows, b.numCols);
        CommonOps_ZDRM.mult(a, b, out);
        return out;
    }

    @Override
    public ZMatrixRMaj add(ZMatrixRMaj a, ZMatrixRMaj b) {
        checkNotNull(a, "a は null 不可です");
        checkNotNull(b, "b は null 不可です");
        checkArgument(a.numRows == b.numRows && a.numCols == b.numCols,
                "行列和の形状が一致しません: %sx%s + %sx%s", a.numRows, a.numCols, b.numRows, b.numCols);
        ZMatrixRMaj out = new ZMatrixRMaj(a.numRows, a.numCols);
        int len = a.numRows * a.numCols * 2;
        for (int i = 0; i < len; i++) {
            out.data[i] = a.data[i] + b.data[i];
        }
        return out;
    }

    @Override
    public ZMatrixRMaj scale(Complex_F64 alpha, ZMatrixRMaj a) {
        checkNotNull(alpha, "alpha は null 不可です");
        checkNotNull(a, "a は null 不可です");
        ZMatrixRMaj out = new ZMatrixRMaj(a.numRows, a.numCols);
        int len = a.numRows * a.numCols * 2;
        for (int i = 0; i < len; i += 2) {
            double re = a.data[i];
            double im = a.data[i + 1];
            out.data[i] = alpha.real * re - alpha.imaginary * im;
            out.data[i + 1] = alpha.real * im + alpha.imaginary * re;
        }
        return out;
    }

    /**
     * 2^k×2^k 行列の量子ビット軸を並べ替えます。
     *
     * <p>
     * 行列を各軸の長さが 2 の 2k 階テンソルとみなし、結果の軸 i を元の軸 {@code order[i]} とします。
     * 軸 0..k-1 が行、軸 k..2k-1 が列の量子ビットです。
     * </p>
     *
     * @param matrix 2^k×2^k 行列です
     * @param order {@code 0..2k-1} の置換です
     * @return 軸を並べ替えた行列です
     * @throws IllegalArgumentException 形状または置換が不正な場合に発生します
     */
    @Override
    public ZMatrixRMaj transposeQubitAxes(ZMatrixRMaj matrix, int[] order) {
        checkNotNull(matrix, "matrix は null 不可です");
        checkNotNull(order, "order は null 不可です");

        int dim = matrix.numRows;
        checkArgument(dim == matrix.numCols, "正方行列が必要です: %sx%s", dim, matrix.numCols);
        int k = log2Exact(dim);
        int rank = 2 * k;
        checkArgument(order.length == rank, "order の長さは %s が必要です: %s", rank, order.length);

        boolean[] seen = new boolean[rank];
        for (int axis : order) {
            checkArgument(axis >= 0 && axis < rank && !seen[axis], "order が置換になっていません: axis=%s",
                    axis);
            seen[axis] = true;
        }

        ZMatrixRMaj out = new ZMatrixRMaj(dim, dim);
        int[] dst = new int[rank];
        int[] src = new int[rank];

        for (int row = 0; row < dim; row++) {
            for (int col = 0; col < dim; col++) {
                // 出力側の多重インデックス（先頭が最上位ビット）
                for (int i = 0; i < k; i++) {
                    dst[i] = (row >> (k - 1 - i)) & 1;
                    dst[k + i] = (col >> (k - 1 - i)) & 1;
                }
                // 出力の軸 i は入力の軸 order[i]
                for (int i = 0; i < rank; i++) {
                    src[order[i]] = dst[i];
                }
                int srcRow = 0;
                int srcCol = 0;
                for (int i = 0; i < k; i++) {
                    srcRow = (srcRow << 1) | src[i];
                    srcCol = (srcCol << 1) | src[k + i];
                }
                out.set(row, col, matrix.getReal(srcRow, srcCol), matrix.getImag(srcRow, srcCol));
            }
        }
        return out;
    }

    /**
     * 行列指数関数を、スケーリング・スクエアリングと対角 Padé 近似で計算します。
     *
     * @param a 正方行列です
     * @return {@code exp(a)} です
     * @throws IllegalArgumentException 正方でない、または有限でない要素を含む場合に発生します
     * @throws IllegalStateException Padé 近似の分母行列が特異な場合に発生します
     */
    @Override
    public ZMatrixRMaj expm(ZMatrixRMaj a) {
        checkNotNull(a, "a は null 不可です");
        checkArgument(a.numRows == a.numCols, "行列指数関数には正方行列が必要です: %sx%s", a.numRows,
                a.numCols);
        for (int i = 0; i < a.numRows * a.numCols * 2; i++) {
            checkArgument(Double.isFinite(a.data[i]), "有限でない要素を含む行列の指数関数は計算できません");
        }

        int dim = a.numRows;

        // ||A||_inf / 2^s < 1/2 となるようにスケーリングします。
        double norm = infinityNorm(a);
        int s = norm > 0.0 ? Math.max(0, Math.getExponent(norm) + 2) : 0;
        ZMatrixRMaj scaled = scale(new Complex_F64(Math.scalb(1.0, -s), 0.0), a);

        ZMatrixRMaj x = scaled;
        double c = 0.5;
        ZMatrixRMaj numerator = add(identity(dim), scale(new Complex_F64(c, 0.0), scaled));
        ZMatrixRMaj denominator = add(identity(dim), scale(new Complex_F64(-c, 0.0), scaled));

        boolean positive = true;
        for (int k = 2; k <= PADE_DEGREE; k++) {
            c = c * (PADE_DEGREE - k + 1) / (k * (2.0 * PADE_DEGREE - k + 1));
            x = mult(scaled, x);
            ZMatrixRMaj cx = scale(new Complex_F64(c, 0.0), x);
            numerator = add(numerator, cx);
            denominator = positive ? add(denominator, cx)
                    : add(denominator, scale(new Complex_F64(-1.0, 0.0), cx));
            positive = !positive;
        }

        ZMatrixRMaj result = new ZMatrixRMaj(dim, dim);
        if (!CommonOps_ZDRM.solve(denominator.copy(), numerator, result)) {
            throw new IllegalStateException("行列指数関数の計算に失敗しました（Padé 分母が特異です）");
        }

        for (int k = 0; k < s; k++) {
            result = mult(result, result);
        }
        return result;
    }

    /**
     * 無限大ノルム（行ごとの絶対値和の最大値）を返します。
     *
     * @param a 行列です
     * @return 無限大ノルムです
     */
    private static double infinityNorm(ZMatrixRMaj a) {
        double max = 0.0;
        for (int row = 0; row < a.numRows; row++) {
            double sum = 0.0;
            for (int col = 0; col < a.numCols; col++) {
                sum += Math.hypot(a.getReal(row, col), a.getImag(row, col));
            }
            max = Math.max(max, sum);
        }
        return max;
    }

    /**
     * 2 のべき乗 {@code dim = 2^k} の指数 k を返します。
     *
     * @param dim 次元です
     * @return 指数 k です
     * @throws IllegalArgumentException dim が 2 のべき乗でない場合に発生します
     */
    static int log2Exact(int dim) {
        checkArgument(dim > 0 && Integer.bitCount(dim) == 1, "次元が 2 のべき乗ではありません: %s", dim);
        return Integer.numberOfTrailingZeros(dim);
    }
}
