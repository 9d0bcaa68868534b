package io.github.yok.pauli.core.composition;

import com.google.common.base.Preconditions;
import io.github.yok.pauli.core.operator.DensePauliOperator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * 密な演算子の列を左から順に掛け合わせ、位相を厳密に追跡した積を求めるクラスです。
 *
 * <p>
 * ゲート列 {@code P_0, P_1, ..., P_{m-1}} に対して {@code P_0 · P_1 · ... · P_{m-1}} を返します。
 * </p>
 */
@Slf4j
public final class DenseOperatorComposer {

    /**
     * 演算子列の積を返します。
     *
     * @param operators 演算子列です（空不可、長さはすべて一致が必要です）
     * @return 積です
     * @throws NullPointerException operators が null の場合に発生します
     * @throws IllegalArgumentException 空の場合、または長さが異なる場合に発生します
     */
    public DensePauliOperator compose(List<DensePauliOperator> operators) {
        Preconditions.checkNotNull(operators, "演算子列が null です。");
        Preconditions.checkArgument(!operators.isEmpty(), "演算子列は 1 つ以上が必要です。");

        DensePauliOperator product = Preconditions.checkNotNull(operators.get(0), "演算子列に null が含まれています。");
        for (int k = 1; k < operators.size(); k++) {
            DensePauliOperator next =
                    Preconditions.checkNotNull(operators.get(k), "演算子列に null が含まれています。");
            product = product.multiply(next);
            log.debug("合成 {} / {}：×{} → {}", k, operators.size() - 1, next, product);
        }

        log.info("演算子列を合成しました。個数={}、長さ={}、結果={}（位相={}、重み={}）", operators.size(),
                product.length(), product, product.phase(), product.weight());
        return product;
    }
}
