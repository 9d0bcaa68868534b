package io.github.yok.pauli.core.code;

import io.github.yok.pauli.core.operator.SparsePauliOperator;

/**
 * 誤り演算子からシンドロームを求める処理のインタフェースです。
 *
 * <p>
 * 符号（スタビライザの組）の表現や判定方法を差し替えるための境界です。
 * </p>
 */
public interface SyndromeExtractor {

    /**
     * 符号の量子ビット数を返します。
     *
     * @return 量子ビット数です
     */
    int codeLength();

    /**
     * 誤り演算子のシンドロームを返します。
     *
     * @param error 誤り演算子です（長さは符号長と一致が必要です）
     * @return シンドロームです
     */
    Syndrome extract(SparsePauliOperator error);
}
