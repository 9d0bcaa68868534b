package io.github.yok.pauli.core.composition;

import io.github.yok.pauli.core.operator.DensePauliOperator;
import java.util.List;
import lombok.Value;

/**
 * 演算子列の合成結果を保持するクラスです。
 */
@Value
public class CompositionResult {

    /**
     * 合成した演算子列（掛けた順）です。
     */
    List<DensePauliOperator> factors;

    /**
     * 積です。
     */
    DensePauliOperator product;

    /**
     * 行列表現による検証結果です。
     */
    MatrixCheck matrixCheck;

    /**
     * 行列表現による検証結果を表す列挙型です。
     */
    public enum MatrixCheck {

        /**
         * 検証を行っていません。
         */
        SKIPPED,

        /**
         * 行列積と一致しました。
         */
        MATCHED,

        /**
         * 行列積と一致しませんでした。
         */
        MISMATCHED
    }
}
