package io.github.yok.pauli.core.code;

import lombok.EqualsAndHashCode;

/**
 * スタビライザごとの測定結果（反交換なら 1）を保持するクラスです。
 */
@EqualsAndHashCode
public final class Syndrome {

    /**
     * スタビライザ順のビット列です。
     */
    private final boolean[] bits;

    /**
     * シンドロームを生成します。
     *
     * @param bits スタビライザ順のビット列です（null 不可、複製して保持します）
     */
    public Syndrome(boolean[] bits) {
        if (bits == null) {
            throw new IllegalArgumentException("bits は null 不可です");
        }
        this.bits = bits.clone();
    }

    /**
     * ビット列を返します。
     *
     * @return ビット列（複製）です
     */
    public boolean[] bits() {
        return bits.clone();
    }

    /**
     * 指定スタビライザのビットを返します。
     *
     * @param index スタビライザのインデックスです
     * @return 反交換する場合は true です
     */
    public boolean get(int index) {
        return bits[index];
    }

    /**
     * ビット数（スタビライザ数）を返します。
     *
     * @return ビット数です
     */
    public int size() {
        return bits.length;
    }

    /**
     * 1 のビット数を返します。
     *
     * @return 重みです
     */
    public int weight() {
        int w = 0;
        for (boolean b : bits) {
            if (b) {
                w++;
            }
        }
        return w;
    }

    /**
     * 全ビットが 0（検出されない）かどうかを返します。
     *
     * @return 自明なシンドロームの場合は true です
     */
    public boolean isTrivial() {
        return weight() == 0;
    }

    /**
     * {@code 0110} のような 0/1 文字列を返します。
     *
     * @return 文字列表現です
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(bits.length);
        for (boolean b : bits) {
            sb.append(b ? '1' : '0');
        }
        return sb.toString();
    }
}
