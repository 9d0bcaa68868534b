package io.github.yok.pauli.core.phase;

/**
 * Pauli 演算子の大域位相を表す列挙型です。
 *
 * <p>
 * 位相は {1, -1, i, -i} の 4 値に限定され、i で生成される位数 4 の巡回群をなします。 内部表現はガウス整数の組 (実部, 虚部)
 * であり、浮動小数点は使用しません。
 * </p>
 */
public enum Phase {

    /**
     * 1 です。
     */
    ONE(1, 0, "1"),

    /**
     * -1 です。
     */
    MINUS_ONE(-1, 0, "-1"),

    /**
     * i です。
     */
    IMAGINARY_UNIT(0, 1, "i"),

    /**
     * -i です。
     */
    MINUS_IMAGINARY_UNIT(0, -1, "-i");

    /**
     * 全定数です。
     */
    private static final Phase[] VALUES = values();

    /**
     * 実部です（-1, 0, 1 のいずれか）。
     */
    private final int real;

    /**
     * 虚部です（-1, 0, 1 のいずれか）。
     */
    private final int imaginary;

    /**
     * 表示用の記号です。
     */
    private final String symbol;

    Phase(int real, int imaginary, String symbol) {
        this.real = real;
        this.imaginary = imaginary;
        this.symbol = symbol;
    }

    /**
     * 位相 1 を返します。
     *
     * @return 位相 1 です
     */
    public static Phase one() {
        return ONE;
    }

    /**
     * 位相 -1 を返します。
     *
     * @return 位相 -1 です
     */
    public static Phase minusOne() {
        return MINUS_ONE;
    }

    /**
     * 位相 i を返します。
     *
     * @return 位相 i です
     */
    public static Phase i() {
        return IMAGINARY_UNIT;
    }

    /**
     * 位相 -i を返します。
     *
     * @return 位相 -i です
     */
    public static Phase minusI() {
        return MINUS_IMAGINARY_UNIT;
    }

    /**
     * 実部を返します。
     *
     * @return 実部です
     */
    public int real() {
        return real;
    }

    /**
     * 虚部を返します。
     *
     * @return 虚部です
     */
    public int imaginary() {
        return imaginary;
    }

    /**
     * 2 つの位相の積を返します。
     *
     * <p>
     * (a + bi)(c + di) = (ac - bd) + (ad + bc)i を整数で計算し、4 値のいずれかに戻します。
     * </p>
     *
     * @param other 右から掛ける位相です（null 不可）
     * @return 積の位相です
     */
    public Phase multiply(Phase other) {
        int re = real * other.real - imaginary * other.imaginary;
        int im = real * other.imaginary + imaginary * other.real;
        return of(re, im);
    }

    /**
     * 逆元（複素共役）を返します。
     *
     * @return 逆元の位相です
     */
    public Phase inverse() {
        return of(real, -imaginary);
    }

    /**
     * ガウス整数の組から位相を返します。
     *
     * @param re 実部です
     * @param im 虚部です
     * @return 対応する位相です
     * @throws IllegalStateException 4 値のいずれにも該当しない場合に発生します
     */
    private static Phase of(int re, int im) {
        for (Phase phase : VALUES) {
            if (phase.real == re && phase.imaginary == im) {
                return phase;
            }
        }
        // 単位元同士の積なので到達しません
        throw new IllegalStateException("位相が {1, -1, i, -i} の範囲外です: (" + re + ", " + im + ")");
    }

    @Override
    public String toString() {
        return symbol;
    }
}
