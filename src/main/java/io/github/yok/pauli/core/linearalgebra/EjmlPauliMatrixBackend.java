package io.github.yok.pauli.core.linearalgebra;

import io.github.yok.pauli.core.operator.DensePauliOperator;
import io.github.yok.pauli.core.pauli.Pauli;
import io.github.yok.pauli.core.phase.Phase;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;

/**
 * EJML を用いて、Pauli 演算子の複素行列表現を構築するクラスです。
 *
 * <p>
 * 位置 0 の量子ビットをテンソル積の最上位の因子とし、{@code phase · P_0 ⊗ P_1 ⊗ ... ⊗ P_{n-1}} を返します。
 * 行列の次元は 2^n で増えるため、量子ビット数に上限を設けます。
 * </p>
 */
public final class EjmlPauliMatrixBackend implements PauliMatrixBackend {

    /**
     * 行列化を許可する最大量子ビット数の上限値です。
     */
    public static final int MAX_SUPPORTED_QUBITS = 12;

    /**
     * 行列化を許可する最大量子ビット数です。
     */
    private final int maxQubits;

    /**
     * 行列バックエンドを生成します。
     *
     * @param maxQubits 行列化を許可する最大量子ビット数です（0 以上 {@value #MAX_SUPPORTED_QUBITS} 以下）
     * @throws IllegalArgumentException maxQubits が範囲外の場合に発生します
     */
    public EjmlPauliMatrixBackend(int maxQubits) {
        if (maxQubits < 0 || maxQubits > MAX_SUPPORTED_QUBITS) {
            throw new IllegalArgumentException(
                    "maxQubits は 0 以上 " + MAX_SUPPORTED_QUBITS + " 以下が必要です: " + maxQubits);
        }
        this.maxQubits = maxQubits;
    }

    /**
     * 演算子の 2^n×2^n 複素行列を返します。
     *
     * @param operator 密な演算子です（null 不可）
     * @return 複素行列です（長さ 0 の場合は 1×1 の [phase]）
     * @throws IllegalArgumentException operator が null、または量子ビット数が上限を超える場合に発生します
     */
    @Override
    public ZMatrixRMaj toMatrix(DensePauliOperator operator) {
        if (operator == null) {
            throw new IllegalArgumentException("operator は null 不可です");
        }
        if (operator.length() > maxQubits) {
            throw new IllegalArgumentException(
                    "量子ビット数が上限を超えています: " + operator.length() + " > " + maxQubits);
        }

        Phase phase = operator.phase();
        ZMatrixRMaj result = new ZMatrixRMaj(1, 1);
        result.set(0, 0, phase.real(), phase.imaginary());

        // 左から順にクロネッカー積を取ります（位置 0 が最上位）。
        for (Pauli p : operator.paulis()) {
            result = kron(result, single(p));
        }
        return result;
    }

    /**
     * 行列積 {@code a · b} を返します。
     *
     * @param a 左の行列です（null 不可）
     * @param b 右の行列です（null 不可）
     * @return 行列積です
     * @throws IllegalArgumentException 引数が null、または次元が合わない場合に発生します
     */
    @Override
    public ZMatrixRMaj multiply(ZMatrixRMaj a, ZMatrixRMaj b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("行列は null 不可です");
        }
        if (a.numCols != b.numRows) {
            throw new IllegalArgumentException("行列の次元が一致しません: " + a.numRows + "x" + a.numCols
                    + " と " + b.numRows + "x" + b.numCols);
        }
        ZMatrixRMaj c = new ZMatrixRMaj(a.numRows, b.numCols);
        CommonOps_ZDRM.mult(a, b, c);
        return c;
    }

    @Override
    public boolean isEqual(ZMatrixRMaj a, ZMatrixRMaj b, double tolerance) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("行列は null 不可です");
        }
        if (a.numRows != b.numRows || a.numCols != b.numCols) {
            return false;
        }
        for (int row = 0; row < a.numRows; row++) {
            for (int col = 0; col < a.numCols; col++) {
                if (Math.abs(a.getReal(row, col) - b.getReal(row, col)) > tolerance
                        || Math.abs(a.getImag(row, col) - b.getImag(row, col)) > tolerance) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * 1 量子ビットの Pauli 行列（2×2）を返します。
     *
     * @param p Pauli 演算子です
     * @return 2×2 複素行列です
     */
    private static ZMatrixRMaj single(Pauli p) {
        ZMatrixRMaj m = new ZMatrixRMaj(2, 2);
        switch (p) {
            case I:
                m.set(0, 0, 1, 0);
                m.set(1, 1, 1, 0);
                break;
            case X:
                m.set(0, 1, 1, 0);
                m.set(1, 0, 1, 0);
                break;
            case Y:
                // [[0, -i], [i, 0]]
                m.set(0, 1, 0, -1);
                m.set(1, 0, 0, 1);
                break;
            default:
                m.set(0, 0, 1, 0);
                m.set(1, 1, -1, 0);
                break;
        }
        return m;
    }

    /**
     * クロネッカー積 {@code a ⊗ b} を返します。
     *
     * @param a 左の行列です
     * @param b 右の行列です
     * @return クロネッカー積です
     */
    private static ZMatrixRMaj kron(ZMatrixRMaj a, ZMatrixRMaj b) {
        ZMatrixRMaj out = new ZMatrixRMaj(a.numRows * b.numRows, a.numCols * b.numCols);
        for (int ar = 0; ar < a.numRows; ar++) {
            for (int ac = 0; ac < a.numCols; ac++) {
                double are = a.getReal(ar, ac);
                double aim = a.getImag(ar, ac);
                if (are == 0.0 && aim == 0.0) {
                    continue;
                }
                for (int br = 0; br < b.numRows; br++) {
                    for (int bc = 0; bc < b.numCols; bc++) {
                        double bre = b.getReal(br, bc);
                        double bim = b.getImag(br, bc);
                        out.set(ar * b.numRows + br, ac * b.numCols + bc, are * bre - aim * bim,
                                are * bim + aim * bre);
                    }
                }
            }
        }
        return out;
    }
}
