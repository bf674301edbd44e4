package io.github.yok.hamterm.out;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import io.github.yok.hamterm.core.evolution.EvolutionSample;
import io.github.yok.hamterm.core.linearalgebra.ComplexTensorBackend;
import io.github.yok.hamterm.core.linearalgebra.EjmlComplexTensorBackend;
import io.github.yok.hamterm.core.symbol.PauliMatrices;
import io.github.yok.hamterm.core.term.HamiltonianTerm;
import io.github.yok.hamterm.core.term.TermGroup;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * {@link CsvResultWriter} のテストです。
 */
class CsvResultWriterTest {

    private final ComplexTensorBackend backend = new EjmlComplexTensorBackend();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("グループの一覧を 1 行 1 グループで出力する")
    void writeGroups_oneRowPerGroup() throws IOException {
        HamiltonianTerm zz = new HamiltonianTerm(backend,
                backend.kron(PauliMatrices.z(), PauliMatrices.z()), 0, 1);
        HamiltonianTerm x0 = new HamiltonianTerm(backend, PauliMatrices.x(), 0);
        HamiltonianTerm x2 = new HamiltonianTerm(backend, PauliMatrices.x(), 2);
        List<TermGroup> groups = TermGroup.fromTerms(List.of(x0, zz, x2));

        Path dir = tempDir.resolve("nested");
        new CsvResultWriter(dir.toString()).writeGroups("tfim", 3, groups);

        List<String> lines =
                Files.readAllLines(dir.resolve("hamterm_groups_tfim_n=3.csv"), StandardCharsets.UTF_8);
        assertThat(lines).containsExactly("group,support,arity,members,memberSupports",
                "0,0 1,2,2,(0 1);(0)", "1,2,1,1,(2)");
    }

    @Test
    @DisplayName("時間発展の記録をステップ順に出力し、ファイル名に dt を含める")
    void writeEvolution_samples() throws IOException {
        List<EvolutionSample> samples = List.of(new EvolutionSample(0, 0.0, 1.0, 1.0),
                new EvolutionSample(1, 0.05, 0.5, 1.0));

        new CsvResultWriter(tempDir.toString()).writeEvolution("xxz", 4, 0.05, samples);

        List<String> lines = Files.readAllLines(
                tempDir.resolve("hamterm_evolution_xxz_n=4_dt=0.0500.csv"), StandardCharsets.UTF_8);
        assertThat(lines).containsExactly("step,time,fidelity,norm", "0,0.0,1.0,1.0",
                "1,0.05,0.5,1.0");
    }

    @Test
    @DisplayName("出力先やモデル名が空の場合は拒否される")
    void validatesArguments() {
        CsvResultWriter writer = new CsvResultWriter(tempDir.toString());

        assertThatThrownBy(() -> new CsvResultWriter(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> writer.writeGroups("", 1, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> writer.writeEvolution("tfim", 1, Double.NaN, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> writer.writeEvolution("tfim", 1, 0.1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("出力先がファイルで書き込めない場合は IllegalStateException になる")
    void writeFailure_wrapsIoException() throws IOException {
        Path file = Files.createFile(tempDir.resolve("occupied"));
        CsvResultWriter writer = new CsvResultWriter(file.toString());

        assertThatThrownBy(() -> writer.writeEvolution("tfim", 1, 0.1, List.of()))
                .isInstanceOf(IllegalStateException.class).hasCauseInstanceOf(IOException.class);
    }
}
