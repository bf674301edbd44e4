package io.github.yok.hamterm.out;

import io.github.yok.hamterm.core.evolution.EvolutionSample;
import io.github.yok.hamterm.core.term.HamiltonianTerm;
import io.github.yok.hamterm.core.term.TermGroup;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 計算結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（model はモデル名、n は量子ビット数、dt は時間刻み）。
 * </p>
 *
 * <ul>
 * <li>{@code hamterm_groups_tfim_n=6.csv}</li>
 * <li>{@code hamterm_evolution_tfim_n=6_dt=0.0500.csv}</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "hamterm";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 項グループの一覧を出力します。
     *
     * <p>
     * 1 行が 1 グループで、台・メンバー数・各メンバーの対象量子ビットを含みます。
     * </p>
     *
     * @param modelName モデル名です
     * @param qubitCount 量子ビット数 n です
     * @param groups 項グループです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeGroups(String modelName, int qubitCount, List<TermGroup> groups) {
        requireModelName(modelName);
        if (groups == null) {
            throw new IllegalArgumentException("groups は null 不可です");
        }

        Path file = outputDir.resolve(FILE_HEAD + "_groups_" + modelName + "_n=" + qubitCount + ".csv");
        try {
            Files.createDirectories(outputDir);
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                    CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                            .setHeader("group", "support", "arity", "members", "memberSupports")
                            .build().print(w)) {

                for (int g = 0; g < groups.size(); g++) {
                    TermGroup group = groups.get(g);
                    String support = group.getTargetQubits().stream().map(String::valueOf)
                            .collect(Collectors.joining(" "));
                    String members = group.members().stream().map(CsvResultWriter::qubitsOf)
                            .collect(Collectors.joining(";"));
                    pr.printRecord(g, support, group.getTargetQubits().size(), group.size(),
                            members);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
    }

    /**
     * 時間発展の記録を出力します。
     *
     * @param modelName モデル名です
     * @param qubitCount 量子ビット数 n です
     * @param dt 時間刻みです
     * @param samples ステップごとの記録です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeEvolution(String modelName, int qubitCount, double dt,
            List<EvolutionSample> samples) {
        requireModelName(modelName);
        if (samples == null) {
            throw new IllegalArgumentException("samples は null 不可です");
        }
        if (!Double.isFinite(dt)) {
            throw new IllegalArgumentException("dt は有限値を指定してください: " + dt);
        }

        Path file = outputDir.resolve(FILE_HEAD + "_evolution_" + modelName + "_n=" + qubitCount
                + "_dt=" + String.format(Locale.ROOT, "%.4f", dt) + ".csv");
        try {
            Files.createDirectories(outputDir);
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                    CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                            .setHeader("step", "time", "fidelity", "norm").build().print(w)) {

                for (EvolutionSample s : samples) {
                    pr.printRecord(s.getStep(), s.getTime(), s.getFidelity(), s.getNorm());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
    }

    private static void requireModelName(String modelName) {
        if (modelName == null || modelName.isEmpty()) {
            throw new IllegalArgumentException("modelName は必須です");
        }
    }

    private static String qubitsOf(HamiltonianTerm term) {
        int[] qubits = term.getTargetQubits();
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < qubits.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(qubits[i]);
        }
        return sb.append(')').toString();
    }
}
