package io.github.yok.hamterm.core.evolution;

import lombok.Value;

/**
 * 時間発展の 1 ステップ分の記録です。
 */
@Value
public class EvolutionSample {

    /**
     * ステップ番号です（0 は初期状態）。
     */
    int step;

    /**
     * 時刻 t (= step·dt) です。
     */
    double time;

    /**
     * 厳密解との忠実度 {@code |<ψ_exact|ψ_trotter>|^2} です。
     */
    double fidelity;

    /**
     * Trotter 状態のノルムです。
     */
    double norm;
}
