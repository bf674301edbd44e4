package io.github.yok.hamterm.core.linearalgebra;

import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;

/**
 * 複素密行列（演算子）に対するテンソル演算を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 項の代数（クロネッカー積・軸の並べ替え・行列指数関数など）が使用する数値プリミティブの境界です。 使用するライブラリを差し替えやすくするためのインタフェースです。
 * </p>
 *
 * <p>
 * すべての演算は引数を変更せず、新しい行列を返します。
 * </p>
 */
public interface ComplexTensorBackend {

    /**
     * 値をバックエンドの複素行列表現に変換します。
     *
     * <p>
     * スカラー（{@link Number}、{@link Complex_F64}）は 1×1 行列になります。
     * </p>
     *
     * @param value 変換対象です
     * @return 複素行列です
     * @throws IllegalArgumentException 数値スカラーでも行列でもない場合に発生します
     */
    ZMatrixRMaj cast(Object value);

    /**
     * スカラーを 1×1 行列として返します。
     *
     * @param value スカラーです
     * @return 1×1 行列です
     */
    ZMatrixRMaj scalar(Complex_F64 value);

    /**
     * dim×dim の単位行列を返します。
     *
     * @param dim 次元です（1 以上）
     * @return 単位行列です
     */
    ZMatrixRMaj identity(int dim);

    /**
     * クロネッカー積 {@code a ⊗ b} を返します。
     *
     * @param a 左側の行列です
     * @param b 右側の行列です
     * @return クロネッカー積です
     */
    ZMatrixRMaj kron(ZMatrixRMaj a, ZMatrixRMaj b);

    /**
     * 行列積 {@code a · b} を返します。
     *
     * @param a 左側の行列です
     * @param b 右側の行列です
     * @return 行列積です
     */
    ZMatrixRMaj mult(ZMatrixRMaj a, ZMatrixRMaj b);

    /**
     * 要素ごとの和 {@code a + b} を返します。
     *
     * @param a 行列です
     * @param b 同じ形状の行列です
     * @return 和です
     */
    ZMatrixRMaj add(ZMatrixRMaj a, ZMatrixRMaj b);

    /**
     * スカラー倍 {@code alpha · a} を返します。
     *
     * @param alpha スカラーです
     * @param a 行列です
     * @return スカラー倍した行列です
     */
    ZMatrixRMaj scale(Complex_F64 alpha, ZMatrixRMaj a);

    /**
     * 2^k×2^k 行列を 2 値の脚を 2k 本もつテンソルとみなし、軸を並べ替えて行列に戻します。
     *
     * <p>
     * 行の脚が軸 {@code 0..k-1}、列の脚が軸 {@code k..2k-1} で、いずれも先頭が最上位ビットです。
     * 並べ替え後の軸 {@code i} は元の軸 {@code order[i]} に対応します。
     * </p>
     *
     * @param matrix 2^k×2^k 行列です
     * @param order {@code 0..2k-1} の置換です
     * @return 軸を並べ替えた行列です
     * @throws IllegalArgumentException 形状または置換が不正な場合に発生します
     */
    ZMatrixRMaj transposeQubitAxes(ZMatrixRMaj matrix, int[] order);

    /**
     * 行列指数関数 {@code exp(a)} を返します。
     *
     * @param a 正方行列です
     * @return 行列指数関数です
     * @throws IllegalArgumentException 正方でない、または有限でない要素を含む場合に発生します
     * @throws IllegalStateException 数値計算に失敗した場合に発生します
     */
    ZMatrixRMaj expm(ZMatrixRMaj a);
}
