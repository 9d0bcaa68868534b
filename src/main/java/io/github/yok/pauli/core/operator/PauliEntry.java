package io.github.yok.pauli.core.operator;

import io.github.yok.pauli.core.pauli.Pauli;
import lombok.Value;

/**
 * 量子ビット位置と Pauli 演算子の組を保持するクラスです。
 */
@Value
public class PauliEntry {

    /**
     * 量子ビット位置です（0 始まり）。
     */
    int position;

    /**
     * その位置に作用する Pauli 演算子です。
     */
    Pauli pauli;

    @Override
    public String toString() {
        return "(" + position + ", " + pauli + ")";
    }
}
