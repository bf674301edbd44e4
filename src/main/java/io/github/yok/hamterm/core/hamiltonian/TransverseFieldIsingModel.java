package io.github.yok.hamterm.core.hamiltonian;

import static io.github.yok.hamterm.core.symbol.Symbols.x;
import static io.github.yok.hamterm.core.symbol.Symbols.z;
import lombok.RequiredArgsConstructor;

/**
 * 横磁場イジング模型 {@code H = -J Σ Z_i Z_j - h Σ X_i} です。
 */
@RequiredArgsConstructor
public final class TransverseFieldIsingModel implements HamiltonianModel {

    /**
     * 量子ビット鎖です。
     */
    private final QubitChain chain;

    /**
     * 最近接結合 J です。
     */
    private final double coupling;

    /**
     * 横磁場 h です。
     */
    private final double field;

    @Override
    public String name() {
        return "tfim";
    }

    @Override
    public int qubitCount() {
        return chain.qubitCount();
    }

    @Override
    public SymbolicHamiltonian build() {
        SymbolicHamiltonian.Builder b = SymbolicHamiltonian.builder(name());
        for (int[] bond : chain.bonds()) {
            b.add(-coupling, z(bond[0]), z(bond[1]));
        }
        for (int q = 0; q < chain.qubitCount(); q++) {
            b.add(-field, x(q));
        }
        return b.build();
    }
}
