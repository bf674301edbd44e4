package io.github.yok.hamterm.core.hamiltonian;

import io.github.yok.hamterm.app.HamtermProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 1 次元の量子ビット鎖（最近接結合）を表すクラスです。
 *
 * <p>
 * 量子ビット番号は {@code 0..n-1} で、結合は {@code (i, i+1)} です。 周期境界では {@code (n-1, 0)} も加えます（n が 3 以上の場合）。
 * </p>
 */
public final class QubitChain {

    /**
     * 量子ビット数です。
     */
    private final int qubits;

    /**
     * 境界条件です。
     */
    private final HamtermProperties.Chain.Boundary boundary;

    /**
     * 量子ビット鎖を生成します。
     *
     * @param qubits 量子ビット数です（1 以上）
     * @param boundary 境界条件です（null 不可）
     * @throws IllegalArgumentException qubits が 1 未満、または boundary が null の場合に発生します
     */
    public QubitChain(int qubits, HamtermProperties.Chain.Boundary boundary) {
        if (qubits <= 0) {
            throw new IllegalArgumentException("qubits は 1 以上が必要です: " + qubits);
        }
        if (boundary == null) {
            throw new IllegalArgumentException("boundary は null 不可です");
        }
        this.qubits = qubits;
        this.boundary = boundary;
    }

    /**
     * 量子ビット数 n を返します。
     *
     * @return 量子ビット数です
     */
    public int qubitCount() {
        return qubits;
    }

    /**
     * 最近接結合の一覧を返します。
     *
     * @return {@code {i, j}} の配列のリストです（変更不可）
     */
    public List<int[]> bonds() {
        List<int[]> out = new ArrayList<>();
        for (int i = 0; i + 1 < qubits; i++) {
            out.add(new int[] {i, i + 1});
        }
        // n=2 の周期境界は (0,1) の重複になるため加えない
        if (boundary == HamtermProperties.Chain.Boundary.PERIODIC && qubits > 2) {
            out.add(new int[] {qubits - 1, 0});
        }
        return Collections.unmodifiableList(out);
    }
}
