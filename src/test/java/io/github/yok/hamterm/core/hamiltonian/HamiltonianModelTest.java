package io.github.yok.hamterm.core.hamiltonian;

import static io.github.yok.hamterm.core.linearalgebra.MatrixAssert.assertMatrixEquals;
import static io.github.yok.hamterm.core.linearalgebra.MatrixAssert.embed;
import static org.assertj.core.api.Assertions.assertThat;
import io.github.yok.hamterm.app.HamtermProperties.Chain.Boundary;
import io.github.yok.hamterm.core.linearalgebra.ComplexTensorBackend;
import io.github.yok.hamterm.core.linearalgebra.EjmlComplexTensorBackend;
import io.github.yok.hamterm.core.symbol.PauliMatrices;
import io.github.yok.hamterm.core.term.TermGroup;
import java.util.List;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * {@link TransverseFieldIsingModel} と {@link XxzHeisenbergModel} のテストです。
 */
class HamiltonianModelTest {

    private final ComplexTensorBackend backend = new EjmlComplexTensorBackend();

    @Test
    @DisplayName("横磁場イジング模型は結合ごとの -J ZZ と量子ビットごとの -h X からなる")
    void tfim_terms() {
        TransverseFieldIsingModel model =
                new TransverseFieldIsingModel(new QubitChain(2, Boundary.OPEN), 1.5, 0.25);

        ZMatrixRMaj expected = backend.scale(new Complex_F64(-1.5, 0),
                backend.kron(PauliMatrices.z(), PauliMatrices.z()));
        expected = backend.add(expected, backend.scale(new Complex_F64(-0.25, 0),
                backend.kron(PauliMatrices.x(), PauliMatrices.identity())));
        expected = backend.add(expected, backend.scale(new Complex_F64(-0.25, 0),
                backend.kron(PauliMatrices.identity(), PauliMatrices.x())));

        assertThat(model.name()).isEqualTo("tfim");
        assertThat(model.qubitCount()).isEqualTo(2);
        assertThat(model.build().getEntries()).hasSize(3);
        assertMatrixEquals(expected, model.build().denseMatrix(backend, 2));
    }

    @Test
    @DisplayName("横磁場イジング模型の 1 量子ビット項は結合のグループに吸収される")
    void tfim_grouping() {
        TransverseFieldIsingModel model =
                new TransverseFieldIsingModel(new QubitChain(4, Boundary.OPEN), 1.0, 0.5);

        List<TermGroup> groups = model.build().groups(backend);

        assertThat(groups).hasSize(3);
        assertThat(groups.stream().mapToInt(TermGroup::size).sum()).isEqualTo(3 + 4);
    }

    @Test
    @DisplayName("XXZ 模型は結合ごとに XX、YY、Δ ZZ の 3 項を持つ")
    void xxz_terms() {
        XxzHeisenbergModel model =
                new XxzHeisenbergModel(new QubitChain(3, Boundary.PERIODIC), 2.0, 0.5);
        int[] space = {0, 1, 2};

        ZMatrixRMaj bond = backend.add(backend.kron(PauliMatrices.x(), PauliMatrices.x()),
                backend.kron(PauliMatrices.y(), PauliMatrices.y()));
        bond = backend.add(bond, backend.scale(new Complex_F64(0.5, 0),
                backend.kron(PauliMatrices.z(), PauliMatrices.z())));
        bond = backend.scale(new Complex_F64(2.0, 0), bond);

        ZMatrixRMaj expected = new ZMatrixRMaj(8, 8);
        for (int[] pair : new QubitChain(3, Boundary.PERIODIC).bonds()) {
            expected = backend.add(expected, embed(bond, pair, space));
        }

        assertThat(model.name()).isEqualTo("xxz");
        assertThat(model.build().getEntries()).hasSize(9);
        assertMatrixEquals(expected, model.build().denseMatrix(backend, 3));
    }
}
