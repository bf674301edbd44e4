package io.github.yok.hamterm.core.term;

import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.hamterm.core.gate.GateEngine;
import io.github.yok.hamterm.core.gate.UnitaryGate;
import io.github.yok.hamterm.core.hamiltonian.HamiltonianId;
import io.github.yok.hamterm.core.linearalgebra.ComplexTensorBackend;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;

/**
 * ハミルトニアンの 1 項（テンソル積の演算子）を表すクラスです。
 *
 * <p>
 * 密行列と、その行列が作用する量子ビットの順序付き列を保持します。 行列の基底順序は {@code targetQubits} の並び（先頭が最上位ビット）です。
 * </p>
 *
 * <p>
 * 行列を変更する操作はなく、スカラー倍やマージは新しい項を返します。 {@link #matrix()} が返す行列は共有されるため、呼び出し側で変更しないでください。
 * </p>
 */
public class HamiltonianTerm {

    /**
     * テンソル演算のバックエンドです。
     */
    protected final ComplexTensorBackend backend;

    /**
     * 対象量子ビット列です（重複なし）。
     */
    private final int[] targetQubits;

    /**
     * 2^k×2^k の行列です（遅延生成するサブクラスでは null）。
     */
    private final ZMatrixRMaj matrix;

    /**
     * {@link #gate()} のキャッシュです。
     */
    private UnitaryGate gate;

    /**
     * この項の取り出し元のハミルトニアンです（非所有の参照、null 可）。
     */
    @Getter
    @Setter
    private HamiltonianId hamiltonian;

    /**
     * 行列と対象量子ビット列から項を生成します。
     *
     * @param backend テンソル演算のバックエンドです（null 不可）
     * @param matrix 2^k×2^k の行列です（null 不可）
     * @param targetQubits 対象量子ビット列です（k 個、重複なし、0 以上）
     * @throws IllegalArgumentException 形状や量子ビット列が不正な場合に発生します
     */
    public HamiltonianTerm(ComplexTensorBackend backend, ZMatrixRMaj matrix, int... targetQubits) {
        this.backend = checkNotNull(backend, "backend は null 不可です");
        this.targetQubits = validateQubits(targetQubits);
        if (matrix == null) {
            throw new IllegalArgumentException("matrix は null 不可です");
        }
        int dim = 1 << this.targetQubits.length;
        if (matrix.numRows != dim || matrix.numCols != dim) {
            throw new IllegalArgumentException("行列の形状が量子ビット数と一致しません: " + matrix.numRows + "x"
                    + matrix.numCols + "（期待値 " + dim + "x" + dim + "）, qubits="
                    + Arrays.toString(this.targetQubits));
        }
        this.matrix = matrix;
    }

    /**
     * 行列を遅延生成するサブクラス向けのコンストラクタです。
     *
     * @param backend テンソル演算のバックエンドです（null 不可）
     * @param targetQubits 対象量子ビット列です
     */
    protected HamiltonianTerm(ComplexTensorBackend backend, int[] targetQubits) {
        this.backend = checkNotNull(backend, "backend は null 不可です");
        this.targetQubits = validateQubits(targetQubits);
        this.matrix = null;
    }

    /**
     * 任意の数値表現から項を生成します。
     *
     * <p>
     * スカラー（{@link Number}、{@link Complex_F64}）や EJML の行列を受け付け、 バックエンドの複素行列に変換します。
     * </p>
     *
     * @param backend テンソル演算のバックエンドです（null 不可）
     * @param matrix 行列またはスカラーです
     * @param targetQubits 対象量子ビット列です
     * @return 項です
     * @throws IllegalArgumentException 型が不正な場合、または形状が一致しない場合に発生します
     */
    public static HamiltonianTerm of(ComplexTensorBackend backend, Object matrix,
            int... targetQubits) {
        checkNotNull(backend, "backend は null 不可です");
        return new HamiltonianTerm(backend, backend.cast(matrix), targetQubits);
    }

    /**
     * 項の行列を返します。
     *
     * @return 2^k×2^k の行列です
     */
    public ZMatrixRMaj matrix() {
        return matrix;
    }

    /**
     * 対象量子ビット列のコピーを返します。
     *
     * @return 対象量子ビット列です
     */
    public int[] getTargetQubits() {
        return targetQubits.clone();
    }

    /**
     * 対象量子ビット数 k を返します。
     *
     * @return 対象量子ビット数です
     */
    public int size() {
        return targetQubits.length;
    }

    /**
     * 指定した量子ビットが対象量子ビット列の何番目かを返します。
     *
     * @param qubit 量子ビット番号です
     * @return 位置です（含まれない場合は -1）
     */
    public int indexOf(int qubit) {
        for (int i = 0; i < targetQubits.length; i++) {
            if (targetQubits[i] == qubit) {
                return i;
            }
        }
        return -1;
    }

    /**
     * {@code exp(-i·dt·H)} を返します。
     *
     * @param dt 時間刻みです
     * @return 行列指数関数です
     * @throws IllegalArgumentException 行列が有限でない場合に発生します
     * @throws IllegalStateException 数値計算に失敗した場合に発生します
     */
    public ZMatrixRMaj exponential(double dt) {
        return backend.expm(backend.scale(new Complex_F64(0.0, -dt), matrix()));
    }

    /**
     * 項の作用を表すゲートを返します。
     *
     * <p>
     * 初回に生成したゲートをキャッシュし、以後は同じオブジェクトを返します。
     * </p>
     *
     * @return ゲートです
     */
    public UnitaryGate gate() {
        if (gate == null) {
            gate = new UnitaryGate(matrix(), targetQubits);
        }
        return gate;
    }

    /**
     * {@code exp(-i·dt·H)} を作用させるゲートを返します。
     *
     * @param dt 時間刻みです
     * @return ゲートです（呼び出しごとに新しく生成します）
     */
    public UnitaryGate expGate(double dt) {
        return new UnitaryGate(exponential(dt), targetQubits);
    }

    /**
     * 行列をスカラー倍した新しい項を返します。
     *
     * @param x スカラーです（null 不可）
     * @return スカラー倍した項です
     */
    public HamiltonianTerm scale(Complex_F64 x) {
        checkNotNull(x, "x は null 不可です");
        HamiltonianTerm scaled =
                new HamiltonianTerm(backend, backend.scale(x, matrix()), targetQubits);
        scaled.setHamiltonian(hamiltonian);
        return scaled;
    }

    /**
     * 行列を実数倍した新しい項を返します。
     *
     * @param x 実数です
     * @return スカラー倍した項です
     */
    public HamiltonianTerm scale(double x) {
        return scale(new Complex_F64(x, 0.0));
    }

    /**
     * 与えた項をこの項にマージした新しい項を返します。
     *
     * <p>
     * {@code other} の演算子を、この項の量子ビットのうち {@code other} が作用しないものについて単位行列とのテンソル積で拡張し、
     * この項の量子ビット順に軸を並べ替えてから行列を加算します。
     * </p>
     *
     * @param other マージする項です（対象量子ビットがこの項の部分集合であること）
     * @return 対象量子ビット列がこの項と同じ新しい項です
     * @throws IllegalArgumentException other の量子ビットがこの項の部分集合でない場合に発生します
     */
    public HamiltonianTerm merge(HamiltonianTerm other) {
        checkNotNull(other, "other は null 不可です");

        int k = size();
        int m = other.size();
        for (int q : other.targetQubits) {
            if (indexOf(q) < 0) {
                throw new IllegalArgumentException("マージする項の量子ビットが部分集合ではありません: "
                        + Arrays.toString(other.targetQubits) + " ⊄ " + Arrays.toString(targetQubits));
            }
        }

        // other の軸 [0, m) と、追加した単位行列の軸 [m, k) の順に並ぶ
        ZMatrixRMaj expanded = backend.kron(other.matrix(), backend.identity(1 << (k - m)));

        int[] order = new int[2 * k];
        int extra = m;
        for (int i = 0; i < k; i++) {
            int pos = other.indexOf(targetQubits[i]);
            order[i] = pos >= 0 ? pos : extra++;
        }
        for (int i = 0; i < k; i++) {
            order[k + i] = order[i] + k;
        }

        ZMatrixRMaj embedded = backend.transposeQubitAxes(expanded, order);
        return new HamiltonianTerm(backend, backend.add(matrix(), embedded), targetQubits);
    }

    /**
     * 項を状態に作用させます。
     *
     * @param engine ゲート適用エンジンです
     * @param state 状態ベクトル、または密度行列です
     * @param densityMatrix 密度行列として扱う場合は true です（左側からの作用 {@code H·ρ} を返します）
     * @return 作用後の状態です
     */
    public ZMatrixRMaj apply(GateEngine engine, ZMatrixRMaj state, boolean densityMatrix) {
        checkNotNull(engine, "engine は null 不可です");
        UnitaryGate g = gate();
        if (densityMatrix) {
            g.setDensityMatrix(true);
            return engine.densityMatrixHalfApply(g, state);
        }
        return engine.apply(g, state);
    }

    /**
     * 量子ビット列を検証してコピーを返します。
     *
     * @param qubits 量子ビット列です
     * @return 検証済みのコピーです
     * @throws IllegalArgumentException 負の番号や重複がある場合に発生します
     */
    private static int[] validateQubits(int[] qubits) {
        if (qubits == null) {
            throw new IllegalArgumentException("targetQubits は null 不可です");
        }
        Set<Integer> seen = new HashSet<>();
        for (int q : qubits) {
            if (q < 0) {
                throw new IllegalArgumentException("量子ビット番号は 0 以上が必要です: " + q);
            }
            if (!seen.add(q)) {
                throw new IllegalArgumentException(
                        "対象量子ビットが重複しています: " + Arrays.toString(qubits));
            }
        }
        return qubits.clone();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + Arrays.toString(targetQubits);
    }
}
