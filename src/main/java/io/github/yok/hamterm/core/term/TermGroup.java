package io.github.yok.hamterm.core.term;

import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.hamterm.core.hamiltonian.HamiltonianId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.Complex_F64;

/**
 * 量子ビットの台を共有する項の集まりを表すクラスです。
 *
 * <p>
 * 最初の項（種）で台が決まり、台に収まる項だけを追加していきます。 {@link #term()} は全メンバーを 1 つの項にマージした結果を返し、
 * {@link #append(HamiltonianTerm)} までキャッシュします。
 * </p>
 */
@Slf4j
public final class TermGroup {

    /**
     * メンバーの項です（追加順）。
     */
    private final List<HamiltonianTerm> terms = new ArrayList<>();

    /**
     * メンバーの対象量子ビットの和集合です。
     */
    private final Set<Integer> targetQubits = new TreeSet<>();

    /**
     * マージ済みの項のキャッシュです。
     */
    private HamiltonianTerm term;

    /**
     * 1 つの項を種としてグループを生成します。
     *
     * @param seed 種となる項です（null 不可）
     */
    public TermGroup(HamiltonianTerm seed) {
        checkNotNull(seed, "seed は null 不可です");
        terms.add(seed);
        addQubits(seed);
    }

    /**
     * 項の対象量子ビットがグループの台に含まれるかどうかを返します。
     *
     * @param candidate 候補の項です
     * @return 含まれる場合は true です
     */
    public boolean canAppend(HamiltonianTerm candidate) {
        for (int q : candidate.getTargetQubits()) {
            if (!targetQubits.contains(q)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 項を追加します。
     *
     * <p>
     * {@link #canAppend(HamiltonianTerm)} の確認は呼び出し側の責務で、ここでは検証しません。 台は追加した項の量子ビットで拡張し、マージ済みの項のキャッシュは破棄します。
     * </p>
     *
     * @param member 追加する項です（null 不可）
     */
    public void append(HamiltonianTerm member) {
        checkNotNull(member, "member は null 不可です");
        terms.add(member);
        addQubits(member);
        term = null;
    }

    /**
     * 項のリストを、マージ可能なグループに貪欲法で分割します。
     *
     * <p>
     * 項を対象量子ビット数ごとに分け、量子ビット数の大きい順に処理します（同数の中では入力順）。 各項は作成順に走査したグループのうち最初に追加できるものへ追加し、
     * 追加できるグループがなければ新しいグループの種にします。
     * </p>
     *
     * @param terms 項のリストです（null 不可）
     * @return グループのリストです（作成順）
     */
    public static List<TermGroup> fromTerms(List<? extends HamiltonianTerm> terms) {
        checkNotNull(terms, "terms は null 不可です");

        SortedMap<Integer, List<HamiltonianTerm>> byArity =
                new TreeMap<>(Collections.reverseOrder());
        for (HamiltonianTerm t : terms) {
            checkNotNull(t, "terms に null が含まれています");
            byArity.computeIfAbsent(t.size(), k -> new ArrayList<>()).add(t);
        }

        List<TermGroup> groups = new ArrayList<>();
        for (List<HamiltonianTerm> bucket : byArity.values()) {
            for (HamiltonianTerm child : bucket) {
                TermGroup target = null;
                for (TermGroup group : groups) {
                    if (group.canAppend(child)) {
                        target = group;
                        break;
                    }
                }
                if (target != null) {
                    target.append(child);
                } else {
                    groups.add(new TermGroup(child));
                }
            }
        }

        log.debug("項をグループ化しました。項数={}、グループ数={}", terms.size(), groups.size());
        return groups;
    }

    /**
     * 全メンバーをマージした項を返します（キャッシュあり）。
     *
     * @return マージした項です
     */
    public HamiltonianTerm term() {
        if (term == null) {
            term = toTerm();
        }
        return term;
    }

    /**
     * 全メンバーを先頭から順にマージした項を返します。
     *
     * @return マージした項です
     */
    public HamiltonianTerm toTerm() {
        return toTerm(Map.of());
    }

    /**
     * 全メンバーを先頭から順にマージした項を返します。
     *
     * <p>
     * 各メンバーは、取り出し元のハミルトニアンに対応する係数が {@code coefficients} にあれば、その係数でスカラー倍してからマージします。
     * </p>
     *
     * @param coefficients ハミルトニアンごとの係数です（null 不可）
     * @return マージした項です
     * @throws IllegalArgumentException メンバーの台が先頭メンバーの台に収まらない場合に発生します
     */
    public HamiltonianTerm toTerm(Map<HamiltonianId, Complex_F64> coefficients) {
        checkNotNull(coefficients, "coefficients は null 不可です");
        HamiltonianTerm merged = rescaled(terms.get(0), coefficients);
        for (int i = 1; i < terms.size(); i++) {
            merged = merged.merge(rescaled(terms.get(i), coefficients));
        }
        return merged;
    }

    /**
     * メンバーの項を追加順に返します。
     *
     * @return 変更不可のリストです
     */
    public List<HamiltonianTerm> members() {
        return Collections.unmodifiableList(terms);
    }

    /**
     * グループの台（対象量子ビットの和集合）を返します。
     *
     * @return 変更不可の集合です（昇順）
     */
    public Set<Integer> getTargetQubits() {
        return Collections.unmodifiableSet(targetQubits);
    }

    /**
     * メンバー数を返します。
     *
     * @return メンバー数です
     */
    public int size() {
        return terms.size();
    }

    private void addQubits(HamiltonianTerm t) {
        for (int q : t.getTargetQubits()) {
            targetQubits.add(q);
        }
    }

    private static HamiltonianTerm rescaled(HamiltonianTerm t,
            Map<HamiltonianId, Complex_F64> coefficients) {
        HamiltonianId owner = t.getHamiltonian();
        Complex_F64 c = owner != null ? coefficients.get(owner) : null;
        return c != null ? t.scale(c) : t;
    }

    @Override
    public String toString() {
        return "TermGroup" + targetQubits + " x" + terms.size();
    }
}
