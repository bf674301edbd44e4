package io.github.yok.hamterm.core.hamiltonian;

import static io.github.yok.hamterm.core.symbol.Symbols.x;
import static io.github.yok.hamterm.core.symbol.Symbols.y;
import static io.github.yok.hamterm.core.symbol.Symbols.z;
import lombok.RequiredArgsConstructor;

/**
 * XXZ ハイゼンベルク模型 {@code H = J Σ (X_i X_j + Y_i Y_j + Δ Z_i Z_j)} です。
 */
@RequiredArgsConstructor
public final class XxzHeisenbergModel implements HamiltonianModel {

    /**
     * 量子ビット鎖です。
     */
    private final QubitChain chain;

    /**
     * 最近接結合 J です。
     */
    private final double coupling;

    /**
     * 異方性 Δ です。
     */
    private final double anisotropy;

    @Override
    public String name() {
        return "xxz";
    }

    @Override
    public int qubitCount() {
        return chain.qubitCount();
    }

    @Override
    public SymbolicHamiltonian build() {
        SymbolicHamiltonian.Builder b = SymbolicHamiltonian.builder(name());
        for (int[] bond : chain.bonds()) {
            b.add(coupling, x(bond[0]), x(bond[1]));
            b.add(coupling, y(bond[0]), y(bond[1]));
            b.add(coupling * anisotropy, z(bond[0]), z(bond[1]));
        }
        return b.build();
    }
}
