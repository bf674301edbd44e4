package io.github.yok.hamterm.app;

import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * hamterm の設定値（hamterm.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "hamterm")
public class HamtermProperties {

    /**
     * 量子ビット鎖の設定です。
     */
    @Valid
    private Chain chain = new Chain();

    /**
     * モデル設定です。
     */
    @Valid
    private Model model = new Model();

    /**
     * 時間発展の設定です。
     */
    @Valid
    private Evolution evolution = new Evolution();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "hamterm")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Chain c = getChain();
        Model m = getModel();
        Evolution e = getEvolution();
        Output o = getOutput();

        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "chain",
                // qubits: 量子ビット数
                "qubits", c.getQubits(),
                // boundary: 境界条件（OPEN/PERIODIC）
                "boundary", c.getBoundary());

        appendSection(sb, nl, "model",
                // type: モデル種別（TRANSVERSE_FIELD_ISING/XXZ）
                "type", m.getType(),
                // coupling: 最近接結合 J
                "coupling", m.getCoupling(),
                // field: 横磁場 h
                "field", m.getField(),
                // anisotropy: XXZ の異方性 Δ
                "anisotropy", m.getAnisotropy());

        appendSection(sb, nl, "evolution",
                // dt: 時間刻み
                "dt", e.getDt(),
                // steps: ステップ数
                "steps", e.getSteps(),
                // order: Trotter 分解の次数
                "order", e.getOrder(),
                // initialState: 初期状態
                "initialState", e.getInitialState());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Chain {

        /**
         * 量子ビット数です。
         *
         * <p>
         * 厳密解との比較で 2^n×2^n の密行列を扱うため、上限を設けています。
         * </p>
         */
        @Min(1)
        @Max(12)
        private int qubits = 6;

        /**
         * 境界条件です。
         */
        @NotNull
        private Boundary boundary = Boundary.OPEN;

        public enum Boundary {
            OPEN, PERIODIC
        }
    }

    @Data
    public static class Model {

        /**
         * モデル種別です。
         */
        @NotNull
        private Type type = Type.TRANSVERSE_FIELD_ISING;

        /**
         * 最近接結合 J です。
         */
        private double coupling = 1.0;

        /**
         * 横磁場 h です（横磁場イジング模型のみ参照）。
         */
        private double field = 0.7;

        /**
         * 異方性 Δ です（XXZ 模型のみ参照）。
         */
        private double anisotropy = 0.5;

        public enum Type {
            TRANSVERSE_FIELD_ISING, XXZ
        }
    }

    @Data
    public static class Evolution {

        /**
         * 時間刻み dt です。
         */
        @Positive
        private double dt = 0.05;

        /**
         * ステップ数です。
         */
        @Min(1)
        private int steps = 20;

        /**
         * Trotter 分解の次数です。
         */
        @NotNull
        private Order order = Order.SECOND;

        /**
         * 初期状態です。
         */
        @NotNull
        private InitialState initialState = InitialState.NEEL;

        public enum Order {
            FIRST, SECOND
        }

        public enum InitialState {
            ZERO, PLUS, NEEL
        }
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotEmpty
        private String dir = "./out";
    }
}
