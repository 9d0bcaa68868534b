package io.github.yok.pauli.core.operator;

import lombok.Value;

/**
 * 疎演算子を X 成分と Z 成分に分解した結果を保持するクラスです。
 *
 * <p>
 * 位相を無視すれば {@code xPart · zPart} は元の演算子に一致します。
 * </p>
 */
@Value
public class XzPartition {

    /**
     * X のみからなる成分です。
     */
    SparsePauliOperator xPart;

    /**
     * Z のみからなる成分です。
     */
    SparsePauliOperator zPart;
}
