package io.github.yok.hamterm.core.evolution;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.hamterm.app.HamtermProperties;
import io.github.yok.hamterm.core.gate.GateEngine;
import io.github.yok.hamterm.core.gate.UnitaryGate;
import io.github.yok.hamterm.core.term.TermGroup;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.ZMatrixRMaj;

/**
 * 項グループごとの {@code exp(-i·dt·H_g)} を順に作用させる Trotter 時間発展です。
 *
 * <p>
 * 1 次では各グループを 1 回ずつ、2 次では {@code dt/2} のゲートを順方向と逆方向に並べて作用させます。 ゲートは生成時に 1 回だけ構築します。
 * </p>
 */
@Slf4j
public final class TrotterEvolution {

    /**
     * ゲート適用エンジンです。
     */
    private final GateEngine engine;

    /**
     * 時間刻みです。
     */
    @Getter
    private final double dt;

    /**
     * Trotter 分解の次数です。
     */
    @Getter
    private final HamtermProperties.Evolution.Order order;

    /**
     * 1 ステップ分のゲート列です（作用順）。
     */
    private final List<UnitaryGate> stepGates;

    /**
     * Trotter 時間発展を生成します。
     *
     * @param engine ゲート適用エンジンです（null 不可）
     * @param groups 項グループです（1 個以上）
     * @param dt 時間刻みです（有限値）
     * @param order Trotter 分解の次数です（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public TrotterEvolution(GateEngine engine, List<TermGroup> groups, double dt,
            HamtermProperties.Evolution.Order order) {
        this.engine = checkNotNull(engine, "engine は null 不可です");
        checkNotNull(groups, "groups は null 不可です");
        checkArgument(!groups.isEmpty(), "groups は 1 個以上が必要です");
        checkArgument(Double.isFinite(dt), "dt は有限値が必要です: %s", dt);
        this.order = checkNotNull(order, "order は null 不可です");
        this.dt = dt;

        List<UnitaryGate> gates = new ArrayList<>();
        if (order == HamtermProperties.Evolution.Order.FIRST) {
            for (TermGroup g : groups) {
                gates.add(g.term().expGate(dt));
            }
        } else {
            List<UnitaryGate> half = new ArrayList<>();
            for (TermGroup g : groups) {
                half.add(g.term().expGate(0.5 * dt));
            }
            gates.addAll(half);
            List<UnitaryGate> reversed = new ArrayList<>(half);
            Collections.reverse(reversed);
            gates.addAll(reversed);
        }
        this.stepGates = Collections.unmodifiableList(gates);

        log.debug("Trotter ゲート列を構築しました。次数={}、dt={}、グループ数={}、ゲート数={}", order, dt,
                groups.size(), stepGates.size());
    }

    /**
     * 1 ステップ分のゲート数を返します。
     *
     * @return ゲート数です
     */
    public int gateCount() {
        return stepGates.size();
    }

    /**
     * 状態ベクトルを 1 ステップ発展させます。
     *
     * @param state 状態ベクトルです
     * @return 発展後の状態ベクトルです
     */
    public ZMatrixRMaj step(ZMatrixRMaj state) {
        ZMatrixRMaj current = state;
        for (UnitaryGate gate : stepGates) {
            current = engine.apply(gate, current);
        }
        return current;
    }

    /**
     * 状態ベクトルを指定ステップ数だけ発展させます。
     *
     * @param state 状態ベクトルです
     * @param steps ステップ数です（0 以上）
     * @return 発展後の状態ベクトルです
     */
    public ZMatrixRMaj evolve(ZMatrixRMaj state, int steps) {
        checkArgument(steps >= 0, "steps は 0 以上が必要です: %s", steps);
        ZMatrixRMaj current = state;
        for (int i = 0; i < steps; i++) {
            current = step(current);
        }
        return current;
    }
}
