package io.github.yok.pauli.core.linearalgebra;

import io.github.yok.pauli.core.operator.DensePauliOperator;
import org.ejml.data.ZMatrixRMaj;

/**
 * Pauli 演算子の複素行列表現を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 記号的に求めた積（厳密な位相追跡）を、行列積と突き合わせて検証するために使用します。 使用するライブラリを差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface PauliMatrixBackend {

    /**
     * 演算子の 2^n×2^n 複素行列を返します。
     *
     * @param operator 密な演算子です
     * @return 複素行列です
     */
    ZMatrixRMaj toMatrix(DensePauliOperator operator);

    /**
     * 行列積 {@code a · b} を返します。
     *
     * @param a 左の行列です
     * @param b 右の行列です
     * @return 行列積です
     */
    ZMatrixRMaj multiply(ZMatrixRMaj a, ZMatrixRMaj b);

    /**
     * 2 つの行列が許容誤差内で一致するかどうかを返します。
     *
     * @param a 行列です
     * @param b 行列です
     * @param tolerance 成分ごとの許容誤差（絶対値）です
     * @return 形状が同じで全成分が許容誤差内の場合は true です
     */
    boolean isEqual(ZMatrixRMaj a, ZMatrixRMaj b, double tolerance);
}
