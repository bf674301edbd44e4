package io.github.yok.hamterm.core.linearalgebra;

import static io.github.yok.hamterm.core.linearalgebra.MatrixAssert.assertMatrixEquals;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import io.github.yok.hamterm.core.symbol.PauliMatrices;
import org.ejml.data.Complex_F64;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * {@link EjmlComplexTensorBackend} のテストです。
 */
class EjmlComplexTensorBackendTest {

    private final EjmlComplexTensorBackend backend = new EjmlComplexTensorBackend();

    @Test
    @DisplayName("kron(Z, X) は Z の各要素に X を掛けたブロック行列になる")
    void kron_blockStructure() {
        ZMatrixRMaj zx = backend.kron(PauliMatrices.z(), PauliMatrices.x());

        ZMatrixRMaj expected = new ZMatrixRMaj(4, 4);
        expected.set(0, 1, 1, 0);
        expected.set(1, 0, 1, 0);
        expected.set(2, 3, -1, 0);
        expected.set(3, 2, -1, 0);
        assertMatrixEquals(expected, zx);
    }

    @Test
    @DisplayName("1x1 のスカラー行列とのクロネッカー積はスカラー倍になる")
    void kron_withScalar() {
        ZMatrixRMaj scaled = backend.kron(backend.scalar(new Complex_F64(0, 2)), PauliMatrices.x());

        assertMatrixEquals(backend.scale(new Complex_F64(0, 2), PauliMatrices.x()), scaled);
    }

    @Test
    @DisplayName("行と列の脚をそれぞれ入れ替えると kron(A, B) が kron(B, A) になる")
    void transposeQubitAxes_swapsTensorFactors() {
        ZMatrixRMaj a = PauliMatrices.y();
        ZMatrixRMaj b = PauliMatrices.z();

        ZMatrixRMaj swapped = backend.transposeQubitAxes(backend.kron(a, b), new int[] {1, 0, 3, 2});

        assertMatrixEquals(backend.kron(b, a), swapped);
    }

    @Test
    @DisplayName("恒等置換では行列が変わらない")
    void transposeQubitAxes_identityOrder() {
        ZMatrixRMaj m = backend.kron(PauliMatrices.x(), PauliMatrices.y());

        assertMatrixEquals(m, backend.transposeQubitAxes(m, new int[] {0, 1, 2, 3}));
    }

    @Test
    @DisplayName("置換になっていない order は拒否される")
    void transposeQubitAxes_rejectsInvalidOrder() {
        ZMatrixRMaj m = backend.identity(4);

        assertThatThrownBy(() -> backend.transposeQubitAxes(m, new int[] {0, 0, 2, 3}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> backend.transposeQubitAxes(m, new int[] {0, 1}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> backend.transposeQubitAxes(backend.identity(3), new int[] {0, 1}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("exp(-iθX) = cosθ I - i sinθ X")
    void expm_pauliRotation() {
        double theta = 0.7;
        ZMatrixRMaj generator = backend.scale(new Complex_F64(0, -theta), PauliMatrices.x());

        ZMatrixRMaj expected = backend.add(
                backend.scale(new Complex_F64(Math.cos(theta), 0), PauliMatrices.identity()),
                backend.scale(new Complex_F64(0, -Math.sin(theta)), PauliMatrices.x()));
        assertMatrixEquals(expected, backend.expm(generator), 1e-9);
    }

    @Test
    @DisplayName("ノルムの大きい対角行列でもスケーリングにより exp が正しく求まる")
    void expm_largeNormDiagonal() {
        ZMatrixRMaj diag = new ZMatrixRMaj(2, 2);
        diag.set(0, 0, 10.0, 0.0);
        diag.set(1, 1, -3.0, 0.0);

        ZMatrixRMaj e = backend.expm(diag);

        assertThat(e.getReal(0, 0)).isCloseTo(Math.exp(10.0), within(Math.exp(10.0) * 1e-9));
        assertThat(e.getReal(1, 1)).isCloseTo(Math.exp(-3.0), within(1e-12));
        assertThat(e.getReal(0, 1)).isCloseTo(0.0, within(1e-12));
    }

    @Test
    @DisplayName("零行列の exp は単位行列")
    void expm_zero() {
        assertMatrixEquals(backend.identity(4), backend.expm(new ZMatrixRMaj(4, 4)));
    }

    @Test
    @DisplayName("正方でない行列や有限でない要素を含む行列の exp は拒否される")
    void expm_rejectsInvalidInput() {
        ZMatrixRMaj nan = new ZMatrixRMaj(2, 2);
        nan.set(0, 0, Double.NaN, 0.0);

        assertThatThrownBy(() -> backend.expm(new ZMatrixRMaj(2, 3)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> backend.expm(nan)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("cast は数値・複素数・実行列・複素行列を受け付け、それ以外は拒否する")
    void cast_acceptsNumericTypesOnly() {
        assertMatrixEquals(backend.scalar(new Complex_F64(3, 0)), backend.cast(3));
        assertMatrixEquals(backend.scalar(new Complex_F64(1, -2)),
                backend.cast(new Complex_F64(1, -2)));

        DMatrixRMaj real = new DMatrixRMaj(new double[][] {{0, 1}, {1, 0}});
        assertMatrixEquals(PauliMatrices.x(), backend.cast(real));

        ZMatrixRMaj y = PauliMatrices.y();
        ZMatrixRMaj copy = backend.cast(y);
        assertMatrixEquals(y, copy);
        assertThat(copy).isNotSameAs(y);

        assertThatThrownBy(() -> backend.cast("X")).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("java.lang.String");
        assertThatThrownBy(() -> backend.cast(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("行列積と和は形状の不一致を拒否する")
    void multAndAdd_checkShapes() {
        assertMatrixEquals(PauliMatrices.identity(),
                backend.mult(PauliMatrices.y(), PauliMatrices.y()));

        assertThatThrownBy(() -> backend.mult(new ZMatrixRMaj(2, 3), new ZMatrixRMaj(2, 3)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> backend.add(new ZMatrixRMaj(2, 2), new ZMatrixRMaj(4, 4)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
