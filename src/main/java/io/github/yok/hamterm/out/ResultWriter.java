package io.github.yok.hamterm.out;

import io.github.yok.hamterm.core.evolution.EvolutionSample;
import io.github.yok.hamterm.core.term.TermGroup;
import java.util.List;

/**
 * 計算結果を出力する処理のインタフェースです。
 *
 * <p>
 * 出力の命名規約に必要なモデル名と量子ビット数 {@code n} を受け取ります。
 * </p>
 */
public interface ResultWriter {

    /**
     * 項グループの一覧を出力します。
     *
     * @param modelName モデル名です
     * @param qubitCount 量子ビット数 n です
     * @param groups 項グループです
     */
    void writeGroups(String modelName, int qubitCount, List<TermGroup> groups);

    /**
     * 時間発展の記録を出力します。
     *
     * @param modelName モデル名です
     * @param qubitCount 量子ビット数 n です
     * @param dt 時間刻みです
     * @param samples ステップごとの記録です
     */
    void writeEvolution(String modelName, int qubitCount, double dt, List<EvolutionSample> samples);
}
