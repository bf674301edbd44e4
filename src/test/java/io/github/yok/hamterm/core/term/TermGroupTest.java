package io.github.yok.hamterm.core.term;

import static io.github.yok.hamterm.core.linearalgebra.MatrixAssert.assertMatrixEquals;
import static io.github.yok.hamterm.core.linearalgebra.MatrixAssert.embed;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import io.github.yok.hamterm.core.hamiltonian.HamiltonianId;
import io.github.yok.hamterm.core.linearalgebra.ComplexTensorBackend;
import io.github.yok.hamterm.core.linearalgebra.EjmlComplexTensorBackend;
import io.github.yok.hamterm.core.symbol.PauliMatrices;
import io.github.yok.hamterm.core.symbol.ProductExpression;
import io.github.yok.hamterm.core.symbol.Symbols;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * {@link TermGroup} のテストです。
 */
class TermGroupTest {

    private final ComplexTensorBackend backend = new EjmlComplexTensorBackend();

    @Test
    @DisplayName("1 量子ビット項を先に渡しても 2 量子ビット項のグループにまとめられる")
    void fromTerms_processesLargerArityFirst() {
        HamiltonianTerm x0 = new HamiltonianTerm(backend, PauliMatrices.x(), 0);
        HamiltonianTerm zz = new HamiltonianTerm(backend,
                backend.kron(PauliMatrices.z(), PauliMatrices.z()), 0, 1);

        List<TermGroup> groups = TermGroup.fromTerms(List.of(x0, zz));

        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).size()).isEqualTo(2);
        assertThat(groups.get(0).members()).containsExactly(zz, x0);
        assertThat(groups.get(0).getTargetQubits()).containsExactly(0, 1);
    }

    @Test
    @DisplayName("各項は最初に追加できたグループに入り、同じ量子ビット数では入力順を保つ")
    void fromTerms_firstFitAndStableOrder() {
        HamiltonianTerm z01 = term(0, 1);
        HamiltonianTerm z12 = term(1, 2);
        HamiltonianTerm x1 = term(1);
        HamiltonianTerm x2 = term(2);
        HamiltonianTerm x3 = term(3);

        List<TermGroup> groups = TermGroup.fromTerms(List.of(x1, z01, x3, z12, x2));

        assertThat(groups).hasSize(3);
        assertThat(groups.get(0).members()).containsExactly(z01, x1);
        assertThat(groups.get(1).members()).containsExactly(z12, x2);
        assertThat(groups.get(2).members()).containsExactly(x3);
    }

    @Test
    @DisplayName("どの項もちょうど 1 つのグループに入り、グループの台に収まる")
    void fromTerms_coverageAndSoundness() {
        Random random = new Random(20240917L);
        List<HamiltonianTerm> terms = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            int arity = 1 + random.nextInt(3);
            Set<Integer> qubits = new TreeSet<>();
            while (qubits.size() < arity) {
                qubits.add(random.nextInt(6));
            }
            terms.add(term(qubits.stream().mapToInt(Integer::intValue).toArray()));
        }

        List<TermGroup> groups = TermGroup.fromTerms(terms);

        Map<HamiltonianTerm, Integer> seen = new IdentityHashMap<>();
        for (TermGroup group : groups) {
            Set<Integer> seedSupport = new TreeSet<>();
            Arrays.stream(group.members().get(0).getTargetQubits()).forEach(seedSupport::add);
            assertThat(group.getTargetQubits()).isEqualTo(seedSupport);
            for (HamiltonianTerm member : group.members()) {
                for (int q : member.getTargetQubits()) {
                    assertThat(seedSupport).contains(q);
                }
                seen.merge(member, 1, Integer::sum);
            }
        }
        assertThat(seen).hasSize(terms.size());
        assertThat(seen.values()).containsOnly(1);
    }

    @Test
    @DisplayName("空のリストからはグループが作られない")
    void fromTerms_empty() {
        assertThat(TermGroup.fromTerms(List.of())).isEmpty();
    }

    @Test
    @DisplayName("canAppend は台に含まれる項だけを受け付ける")
    void canAppend_checksSupport() {
        TermGroup group = new TermGroup(term(2, 0));

        assertThat(group.canAppend(term(0))).isTrue();
        assertThat(group.canAppend(term(0, 2))).isTrue();
        assertThat(group.canAppend(term(1))).isFalse();
        assertThat(group.canAppend(term(0, 1))).isFalse();
    }

    @Test
    @DisplayName("term() はキャッシュされ、append で破棄される")
    void term_cachedUntilAppend() {
        TermGroup group = new TermGroup(new HamiltonianTerm(backend,
                backend.kron(PauliMatrices.z(), PauliMatrices.z()), 0, 1));

        HamiltonianTerm first = group.term();
        assertThat(group.term()).isSameAs(first);

        group.append(new HamiltonianTerm(backend, PauliMatrices.x(), 1));
        HamiltonianTerm second = group.term();

        assertThat(second).isNotSameAs(first);
        assertMatrixEquals(backend.add(backend.kron(PauliMatrices.z(), PauliMatrices.z()),
                backend.kron(PauliMatrices.identity(), PauliMatrices.x())), second.matrix());
        assertMatrixEquals(second.matrix(), group.term().matrix());
    }

    @Test
    @DisplayName("toTerm は先頭メンバーから順にマージし、台の並びは先頭メンバーに従う")
    void toTerm_foldsInMemberOrder() {
        ZMatrixRMaj xz = backend.kron(PauliMatrices.x(), PauliMatrices.z());
        TermGroup group = new TermGroup(new HamiltonianTerm(backend, xz, 2, 0));
        group.append(new HamiltonianTerm(backend, PauliMatrices.y(), 0));
        group.append(new HamiltonianTerm(backend, PauliMatrices.x(), 2));

        HamiltonianTerm merged = group.toTerm();

        int[] space = {2, 0};
        ZMatrixRMaj expected = backend.add(xz, backend.add(
                embed(PauliMatrices.y(), new int[] {0}, space),
                embed(PauliMatrices.x(), new int[] {2}, space)));
        assertThat(merged.getTargetQubits()).containsExactly(2, 0);
        assertMatrixEquals(expected, merged.matrix());
    }

    @Test
    @DisplayName("取り出し元ハミルトニアンごとの係数でメンバーをスケールしてからマージする")
    void toTerm_coefficientOverrides() {
        HamiltonianId a = HamiltonianId.create("a");
        HamiltonianId b = HamiltonianId.create("b");

        SymbolicTerm zz = SymbolicTerm.fromFactors(backend, 1.0,
                ProductExpression.of(Symbols.z(0), Symbols.z(1)));
        zz.setHamiltonian(a);
        SymbolicTerm x1 = SymbolicTerm.fromFactors(backend, 1.0, ProductExpression.of(Symbols.x(1)));
        x1.setHamiltonian(b);
        SymbolicTerm y0 = SymbolicTerm.fromFactors(backend, 1.0, ProductExpression.of(Symbols.y(0)));

        TermGroup group = TermGroup.fromTerms(List.of(zz, x1, y0)).get(0);
        HamiltonianTerm merged = group.toTerm(Map.of(a, new Complex_F64(2, 0), b,
                new Complex_F64(0, -1)));

        ZMatrixRMaj expected = backend.scale(new Complex_F64(2, 0),
                backend.kron(PauliMatrices.z(), PauliMatrices.z()));
        expected = backend.add(expected, backend.scale(new Complex_F64(0, -1),
                backend.kron(PauliMatrices.identity(), PauliMatrices.x())));
        expected = backend.add(expected, backend.kron(PauliMatrices.y(), PauliMatrices.identity()));
        assertMatrixEquals(expected, merged.matrix());

        // 係数なしの場合は元の係数のまま
        assertMatrixEquals(backend.add(backend.add(
                backend.kron(PauliMatrices.z(), PauliMatrices.z()),
                backend.kron(PauliMatrices.identity(), PauliMatrices.x())),
                backend.kron(PauliMatrices.y(), PauliMatrices.identity())), group.term().matrix());
    }

    @Test
    @DisplayName("members() は変更できない")
    void members_isUnmodifiable() {
        TermGroup group = new TermGroup(term(0));

        assertThatThrownBy(() -> group.members().add(term(0)))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> group.getTargetQubits().add(5))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    private HamiltonianTerm term(int... qubits) {
        ZMatrixRMaj m = PauliMatrices.z();
        for (int i = 1; i < qubits.length; i++) {
            m = backend.kron(m, PauliMatrices.z());
        }
        return new HamiltonianTerm(backend, m, qubits);
    }
}
