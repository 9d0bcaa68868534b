package io.github.yok.pauli.core.operator;

import lombok.Getter;

/**
 * 一致が必要な 2 つの長さが異なる場合に発生する例外です。
 *
 * <p>
 * 構築時の位置数と演算子数の不一致、および疎演算子同士の積における量子ビット数の不一致で使用します。
 * </p>
 */
@Getter
public class IncompatibleLengthException extends PauliOperatorException {

    private static final long serialVersionUID = 1L;

    /**
     * 1 つ目の長さです。
     */
    private final int first;

    /**
     * 2 つ目の長さです。
     */
    private final int second;

    /**
     * 例外を生成します。
     *
     * @param first 1 つ目の長さです
     * @param second 2 つ目の長さです
     */
    public IncompatibleLengthException(int first, int second) {
        super("長さが一致しません: " + first + " と " + second);
        this.first = first;
        this.second = second;
    }
}
