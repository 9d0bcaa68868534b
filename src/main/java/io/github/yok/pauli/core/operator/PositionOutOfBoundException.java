package io.github.yok.pauli.core.operator;

import lombok.Getter;

/**
 * 非自明な位置が演算子の長さの範囲外にある場合に発生する例外です。
 */
@Getter
public class PositionOutOfBoundException extends PauliOperatorException {

    private static final long serialVersionUID = 1L;

    /**
     * 範囲外の位置です。
     */
    private final int position;

    /**
     * 演算子の長さです。
     */
    private final int length;

    /**
     * 例外を生成します。
     *
     * @param position 範囲外の位置です
     * @param length 演算子の長さです
     */
    public PositionOutOfBoundException(int position, int length) {
        super("位置 " + position + " は長さ " + length + " の範囲外です");
        this.position = position;
        this.length = length;
    }
}
