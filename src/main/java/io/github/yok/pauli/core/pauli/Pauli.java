package io.github.yok.pauli.core.pauli;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.pauli.core.phase.Phase;

/**
 * 位相を持たない 1 量子ビットの Pauli 演算子を表す列挙型です。
 *
 * <p>
 * I を単位元とする群をなし、I 以外の元はすべて自身が逆元です。 X, Y, Z のうち異なる 2 つは反交換します。
 * </p>
 */
public enum Pauli {

    I, X, Y, Z;

    /**
     * 恒等演算子かどうかを返します。
     *
     * @return I の場合は true です
     */
    public boolean isTrivial() {
        return this == I;
    }

    /**
     * 恒等演算子以外かどうかを返します。
     *
     * @return I 以外の場合は true です
     */
    public boolean isNonTrivial() {
        return this != I;
    }

    /**
     * 他の演算子と交換するかどうかを返します。
     *
     * @param other 比較対象です（null 不可）
     * @return どちらかが I、または同じ演算子の場合は true です
     */
    public boolean commutesWith(Pauli other) {
        checkNotNull(other, "other が null です。");
        return this == I || other == I || this == other;
    }

    /**
     * 他の演算子と反交換するかどうかを返します。
     *
     * @param other 比較対象です（null 不可）
     * @return 反交換する場合は true です
     */
    public boolean anticommutesWith(Pauli other) {
        return !commutesWith(other);
    }

    /**
     * 位相を無視した積を返します。
     *
     * <p>
     * 符号を落とすため交換的です（{@code X.multiply(Y) == Y.multiply(X) == Z}）。
     * </p>
     *
     * @param other 右から掛ける演算子です（null 不可）
     * @return 積です
     */
    public Pauli multiply(Pauli other) {
        checkNotNull(other, "other が null です。");
        if (this == I) {
            return other;
        }
        if (this == other) {
            return I;
        }
        if (this == X && other == Y) {
            return Z;
        }
        if (this == Y && other == Z) {
            return X;
        }
        if (this == Z && other == X) {
            return Y;
        }
        return other.multiply(this);
    }

    /**
     * 位相付きの積を返します。
     *
     * <p>
     * 例えば {@code X·Y = iZ}、{@code Y·X = -iZ} です。
     * </p>
     *
     * @param other 右から掛ける演算子です（null 不可）
     * @return 補正位相と積の組です
     */
    public PauliProduct multiplyWithPhase(Pauli other) {
        checkNotNull(other, "other が null です。");
        switch (this) {
            case I:
                return new PauliProduct(Phase.one(), other);
            case X:
                switch (other) {
                    case I:
                        return new PauliProduct(Phase.one(), X);
                    case X:
                        return new PauliProduct(Phase.one(), I);
                    case Y:
                        return new PauliProduct(Phase.i(), Z);
                    default:
                        return new PauliProduct(Phase.minusI(), Y);
                }
            case Y:
                switch (other) {
                    case I:
                        return new PauliProduct(Phase.one(), Y);
                    case X:
                        return new PauliProduct(Phase.minusI(), Z);
                    case Y:
                        return new PauliProduct(Phase.one(), I);
                    default:
                        return new PauliProduct(Phase.i(), X);
                }
            default:
                switch (other) {
                    case I:
                        return new PauliProduct(Phase.one(), Z);
                    case X:
                        return new PauliProduct(Phase.i(), Y);
                    case Y:
                        return new PauliProduct(Phase.minusI(), X);
                    default:
                        return new PauliProduct(Phase.one(), I);
                }
        }
    }
}
