package io.github.yok.pauli.core.code;

import io.github.yok.pauli.core.operator.IncompatibleLengthException;
import io.github.yok.pauli.core.operator.SparsePauliOperator;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * スタビライザとの交換関係からシンドロームを求めるクラスです。
 *
 * <p>
 * k 番目のビットは、誤り演算子が k 番目のスタビライザと反交換する場合に 1 です。 疎な演算子の交換判定は重なる位置のみを走査するため、
 * 量子ビット数が大きく重みが小さい符号でも高速です。
 * </p>
 */
@Slf4j
public final class CommutationSyndromeExtractor implements SyndromeExtractor {

    /**
     * スタビライザ生成元の一覧です。
     */
    @Getter
    private final List<SparsePauliOperator> stabilizers;

    /**
     * 符号の量子ビット数です。
     */
    private final int codeLength;

    /**
     * シンドローム抽出器を生成します。
     *
     * <p>
     * 互いに交換しないスタビライザの組は警告を出力したうえで受け付けます。
     * </p>
     *
     * @param stabilizers スタビライザ生成元です（空不可、長さはすべて一致が必要です）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CommutationSyndromeExtractor(List<SparsePauliOperator> stabilizers) {
        if (stabilizers == null || stabilizers.isEmpty()) {
            throw new IllegalArgumentException("stabilizers は 1 つ以上が必要です");
        }
        for (SparsePauliOperator s : stabilizers) {
            if (s == null) {
                throw new IllegalArgumentException("stabilizers に null が含まれています");
            }
        }
        int n = stabilizers.get(0).length();
        for (int k = 1; k < stabilizers.size(); k++) {
            if (stabilizers.get(k).length() != n) {
                throw new IllegalArgumentException("スタビライザの長さが一致しません: index=" + k + ", 長さ="
                        + stabilizers.get(k).length() + ", 期待値=" + n);
            }
        }

        for (int a = 0; a < stabilizers.size(); a++) {
            for (int b = a + 1; b < stabilizers.size(); b++) {
                if (stabilizers.get(a).anticommutesWith(stabilizers.get(b))) {
                    log.warn("スタビライザ {} と {} が反交換します（{} / {}）", a, b, stabilizers.get(a),
                            stabilizers.get(b));
                }
            }
        }

        this.stabilizers = List.copyOf(stabilizers);
        this.codeLength = n;
        log.info("シンドローム抽出器を生成しました。量子ビット数={}、スタビライザ数={}", codeLength, this.stabilizers.size());
    }

    @Override
    public int codeLength() {
        return codeLength;
    }

    /**
     * 誤り演算子のシンドロームを返します。
     *
     * @param error 誤り演算子です（null 不可）
     * @return シンドロームです
     * @throws IllegalArgumentException error が null の場合に発生します
     * @throws IncompatibleLengthException error の長さが符号長と異なる場合に発生します
     */
    @Override
    public Syndrome extract(SparsePauliOperator error) {
        if (error == null) {
            throw new IllegalArgumentException("error は null 不可です");
        }
        if (error.length() != codeLength) {
            throw new IncompatibleLengthException(error.length(), codeLength);
        }
        boolean[] bits = new boolean[stabilizers.size()];
        for (int k = 0; k < bits.length; k++) {
            bits[k] = error.anticommutesWith(stabilizers.get(k));
        }
        Syndrome syndrome = new Syndrome(bits);
        log.debug("シンドロームを計算しました。誤り={}、シンドローム={}", error, syndrome);
        return syndrome;
    }
}
