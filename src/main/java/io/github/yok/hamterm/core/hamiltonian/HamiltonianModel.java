package io.github.yok.hamterm.core.hamiltonian;

/**
 * 量子ビット鎖上のハミルトニアンを構築するモデルを表すインタフェースです。
 *
 * <p>
 * 相互作用の種類を差し替えるための境界です。
 * </p>
 */
public interface HamiltonianModel {

    /**
     * モデル名を返します（出力ファイル名にも使用します）。
     *
     * @return モデル名です
     */
    String name();

    /**
     * 量子ビット数 n を返します。
     *
     * @return 量子ビット数です
     */
    int qubitCount();

    /**
     * 記号形式のハミルトニアンを構築して返します。
     *
     * @return ハミルトニアンです
     */
    SymbolicHamiltonian build();
}
