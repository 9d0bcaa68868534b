package io.github.yok.pauli.core.linearalgebra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.pauli.core.operator.DensePauliOperator;
import io.github.yok.pauli.core.pauli.Pauli;
import io.github.yok.pauli.core.phase.Phase;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class EjmlPauliMatrixBackendTest {

    private static final double EPS = 1e-12;

    private final EjmlPauliMatrixBackend backend = new EjmlPauliMatrixBackend(6);

    @Test
    @DisplayName("Y の行列は [[0, -i], [i, 0]]")
    void testYMatrix() {
        ZMatrixRMaj y = backend.toMatrix(DensePauliOperator.withPaulis(Pauli.Y));

        assertEquals(2, y.numRows);
        assertEquals(2, y.numCols);
        assertEquals(0.0, y.getReal(0, 0), EPS);
        assertEquals(-1.0, y.getImag(0, 1), EPS);
        assertEquals(1.0, y.getImag(1, 0), EPS);
        assertEquals(0.0, y.getReal(1, 0), EPS);
    }

    @Test
    @DisplayName("長さ 0 の演算子は 1×1 の位相")
    void testEmptyOperator() {
        ZMatrixRMaj m = backend.toMatrix(DensePauliOperator.empty().multiply(Phase.minusI()));

        assertEquals(1, m.numRows);
        assertEquals(1, m.numCols);
        assertEquals(0.0, m.getReal(0, 0), EPS);
        assertEquals(-1.0, m.getImag(0, 0), EPS);
    }

    @Test
    @DisplayName("1 量子ビットの 16 通りの積で、積の行列と行列の積が一致する")
    void testSingleQubitProductsMatchMatrices() {
        for (Pauli a : Pauli.values()) {
            for (Pauli b : Pauli.values()) {
                DensePauliOperator da = DensePauliOperator.withPaulis(a);
                DensePauliOperator db = DensePauliOperator.withPaulis(b);

                ZMatrixRMaj expected = backend.multiply(backend.toMatrix(da), backend.toMatrix(db));
                ZMatrixRMaj actual = backend.toMatrix(da.multiply(db));
                assertTrue(backend.isEqual(expected, actual, EPS), a + "·" + b);
            }
        }
    }

    @Test
    @DisplayName("ランダムな 3 量子ビット演算子でも位相込みで一致する")
    void testRandomProductsMatchMatrices() {
        Random random = new Random(42);
        for (int trial = 0; trial < 50; trial++) {
            DensePauliOperator a = randomOperator(random, 3);
            DensePauliOperator b = randomOperator(random, 3);

            ZMatrixRMaj expected = backend.multiply(backend.toMatrix(a), backend.toMatrix(b));
            assertTrue(backend.isEqual(expected, backend.toMatrix(a.multiply(b)), EPS));
        }
    }

    @Test
    @DisplayName("位相が異なれば一致しない")
    void testPhaseIsDistinguished() {
        DensePauliOperator op = DensePauliOperator.withPaulis(Pauli.X, Pauli.Z);

        assertFalse(backend.isEqual(backend.toMatrix(op),
                backend.toMatrix(op.multiply(Phase.minusOne())), EPS));
        assertFalse(backend.isEqual(backend.toMatrix(op),
                backend.toMatrix(DensePauliOperator.withPaulis(Pauli.X)), EPS));
    }

    @Test
    @DisplayName("量子ビット数の上限を超えると IllegalArgumentException")
    void testQubitLimit() {
        EjmlPauliMatrixBackend small = new EjmlPauliMatrixBackend(2);

        assertEquals(4, small.toMatrix(DensePauliOperator.withPaulis(Pauli.X, Pauli.Y)).numRows);
        assertThrows(IllegalArgumentException.class,
                () -> small.toMatrix(DensePauliOperator.withPaulis(Pauli.X, Pauli.Y, Pauli.Z)));
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 13})
    @DisplayName("上限値の範囲外は IllegalArgumentException")
    void testInvalidMaxQubits(int maxQubits) {
        assertThrows(IllegalArgumentException.class, () -> new EjmlPauliMatrixBackend(maxQubits));
    }

    @Test
    @DisplayName("次元が合わない行列積は IllegalArgumentException")
    void testDimensionMismatch() {
        ZMatrixRMaj two = new ZMatrixRMaj(2, 2);
        ZMatrixRMaj four = new ZMatrixRMaj(4, 4);
        assertThrows(IllegalArgumentException.class, () -> backend.multiply(two, four));
    }

    private static DensePauliOperator randomOperator(Random random, int length) {
        List<Pauli> paulis = new ArrayList<>();
        for (int k = 0; k < length; k++) {
            paulis.add(Pauli.values()[random.nextInt(4)]);
        }
        return DensePauliOperator.withPhaseAndPaulis(Phase.values()[random.nextInt(4)], paulis);
    }
}
