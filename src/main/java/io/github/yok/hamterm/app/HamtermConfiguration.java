package io.github.yok.hamterm.app;

import io.github.yok.hamterm.core.gate.DenseStateGateEngine;
import io.github.yok.hamterm.core.gate.GateEngine;
import io.github.yok.hamterm.core.hamiltonian.HamiltonianModel;
import io.github.yok.hamterm.core.hamiltonian.QubitChain;
import io.github.yok.hamterm.core.hamiltonian.TransverseFieldIsingModel;
import io.github.yok.hamterm.core.hamiltonian.XxzHeisenbergModel;
import io.github.yok.hamterm.core.linearalgebra.ComplexTensorBackend;
import io.github.yok.hamterm.core.linearalgebra.EjmlComplexTensorBackend;
import io.github.yok.hamterm.out.CsvResultWriter;
import io.github.yok.hamterm.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 量子ビット鎖モデル + 項のグループ化 + Trotter 時間発展の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class HamtermConfiguration {

    /**
     * hamterm の設定値（hamterm.*）です。
     */
    private final HamtermProperties p;

    /**
     * 量子ビット鎖を生成します。
     *
     * @return 量子ビット鎖です
     */
    @Bean
    public QubitChain qubitChain() {
        return new QubitChain(p.getChain().getQubits(), p.getChain().getBoundary());
    }

    /**
     * 設定のモデル種別に応じたハミルトニアンモデルを生成します。
     *
     * @param chain 量子ビット鎖です
     * @return ハミルトニアンモデルです
     */
    @Bean
    public HamiltonianModel hamiltonianModel(QubitChain chain) {
        HamtermProperties.Model m = p.getModel();
        switch (m.getType()) {
            case XXZ:
                return new XxzHeisenbergModel(chain, m.getCoupling(), m.getAnisotropy());
            case TRANSVERSE_FIELD_ISING:
            default:
                return new TransverseFieldIsingModel(chain, m.getCoupling(), m.getField());
        }
    }

    /**
     * テンソル演算のバックエンドを生成します。
     *
     * @return バックエンドです
     */
    @Bean
    public ComplexTensorBackend complexTensorBackend() {
        return new EjmlComplexTensorBackend();
    }

    /**
     * ゲート適用エンジンを生成します。
     *
     * @return ゲート適用エンジンです
     */
    @Bean
    public GateEngine gateEngine() {
        return new DenseStateGateEngine();
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
