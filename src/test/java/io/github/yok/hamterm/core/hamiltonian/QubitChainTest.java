package io.github.yok.hamterm.core.hamiltonian;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import io.github.yok.hamterm.app.HamtermProperties.Chain.Boundary;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * {@link QubitChain} のテストです。
 */
class QubitChainTest {

    @Test
    @DisplayName("開放境界では隣接する量子ビットの組だけを返す")
    void bonds_open() {
        List<int[]> bonds = new QubitChain(4, Boundary.OPEN).bonds();

        assertThat(bonds).containsExactly(new int[] {0, 1}, new int[] {1, 2}, new int[] {2, 3});
    }

    @Test
    @DisplayName("周期境界では末尾と先頭の組を加える")
    void bonds_periodic() {
        List<int[]> bonds = new QubitChain(3, Boundary.PERIODIC).bonds();

        assertThat(bonds).containsExactly(new int[] {0, 1}, new int[] {1, 2}, new int[] {2, 0});
    }

    @Test
    @DisplayName("2 量子ビットの周期境界では結合を重複させない")
    void bonds_periodicTwoQubits() {
        assertThat(new QubitChain(2, Boundary.PERIODIC).bonds()).hasSize(1);
        assertThat(new QubitChain(1, Boundary.PERIODIC).bonds()).isEmpty();
    }

    @Test
    @DisplayName("量子ビット数が 0 以下や境界条件が null の場合は拒否される")
    void constructor_validates() {
        assertThatThrownBy(() -> new QubitChain(0, Boundary.OPEN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new QubitChain(3, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
