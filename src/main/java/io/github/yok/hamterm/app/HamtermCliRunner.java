package io.github.yok.hamterm.app;

import io.github.yok.hamterm.core.evolution.EvolutionSample;
import io.github.yok.hamterm.core.evolution.QuantumStates;
import io.github.yok.hamterm.core.evolution.TrotterEvolution;
import io.github.yok.hamterm.core.gate.GateEngine;
import io.github.yok.hamterm.core.hamiltonian.HamiltonianModel;
import io.github.yok.hamterm.core.hamiltonian.SymbolicHamiltonian;
import io.github.yok.hamterm.core.linearalgebra.ComplexTensorBackend;
import io.github.yok.hamterm.core.term.SymbolicTerm;
import io.github.yok.hamterm.core.term.TermGroup;
import io.github.yok.hamterm.out.ResultWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.ZMatrixRMaj;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で hamterm を実行するクラスです。
 *
 * <p>
 * 設定したモデルのハミルトニアンを項に分解してグループ化し、グループごとのゲートで Trotter 時間発展を行います。
 * 各ステップで厳密な時間発展との忠実度を記録し、CSV に出力します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HamtermCliRunner implements CommandLineRunner {

    /**
     * 忠実度がこの値を下回った場合に警告します。
     */
    private static final double FIDELITY_WARN_THRESHOLD = 0.99;

    /**
     * hamterm の設定値（hamterm.*）です。
     */
    private final HamtermProperties properties;

    /**
     * ハミルトニアンモデルです。
     */
    private final HamiltonianModel model;

    /**
     * テンソル演算のバックエンドです。
     */
    private final ComplexTensorBackend backend;

    /**
     * ゲート適用エンジンです。
     */
    private final GateEngine engine;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== hamterm start: group terms and run Trotter evolution ===");
        System.out.print(properties.toMultilineString());

        int n = model.qubitCount();
        HamtermProperties.Evolution ev = properties.getEvolution();

        SymbolicHamiltonian hamiltonian = model.build();
        List<SymbolicTerm> terms = hamiltonian.terms(backend);
        List<TermGroup> groups = TermGroup.fromTerms(terms);

        log.info("ハミルトニアンを分解しました。モデル={}、量子ビット数={}、項数={}、グループ数={}", model.name(), n,
                terms.size(), groups.size());
        for (int g = 0; g < groups.size(); g++) {
            TermGroup group = groups.get(g);
            log.debug("グループ{}：台={}、メンバー数={}", g, group.getTargetQubits(), group.size());
        }
        resultWriter.writeGroups(model.name(), n, groups);

        // 厳密解の参照用に全体の密行列と 1 ステップの時間発展演算子を用意します。
        ZMatrixRMaj dense = hamiltonian.denseMatrix(backend, n);
        ZMatrixRMaj propagator = QuantumStates.exactPropagator(backend, dense, ev.getDt());

        TrotterEvolution trotter = new TrotterEvolution(engine, groups, ev.getDt(), ev.getOrder());

        ZMatrixRMaj trotterState = QuantumStates.initial(ev.getInitialState(), n);
        ZMatrixRMaj exactState = trotterState;

        List<EvolutionSample> samples = new ArrayList<>(ev.getSteps() + 1);
        samples.add(new EvolutionSample(0, 0.0, 1.0, QuantumStates.norm(trotterState)));

        for (int step = 1; step <= ev.getSteps(); step++) {
            trotterState = trotter.step(trotterState);
            exactState = backend.mult(propagator, exactState);

            double fidelity = QuantumStates.fidelity(exactState, trotterState);
            samples.add(new EvolutionSample(step, step * ev.getDt(), fidelity,
                    QuantumStates.norm(trotterState)));
            log.debug("ステップ{}：t={}、忠実度={}", step, fmt5(step * ev.getDt()), fmt5(fidelity));
        }

        EvolutionSample last = samples.get(samples.size() - 1);
        if (last.getFidelity() < FIDELITY_WARN_THRESHOLD) {
            log.warn("Trotter 誤差が大きくなっています。t={}、忠実度={}（dt={}、次数={}）", fmt5(last.getTime()),
                    fmt5(last.getFidelity()), ev.getDt(), ev.getOrder());
        }

        resultWriter.writeEvolution(model.name(), n, ev.getDt(), samples);

        System.out.println("結果: groups=" + groups.size() + ", gatesPerStep=" + trotter.gateCount()
                + ", t=" + fmt5(last.getTime()) + ", fidelity=" + fmt5(last.getFidelity()));
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
