package io.github.yok.pauli.text;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.pauli.core.operator.DensePauliOperator;
import io.github.yok.pauli.core.operator.SparsePauliOperator;
import io.github.yok.pauli.core.pauli.Pauli;
import io.github.yok.pauli.core.phase.Phase;
import java.util.ArrayList;
import java.util.List;

/**
 * Pauli 文字列（例: {@code -iXIYZ}）と演算子を相互変換するユーティリティです。
 *
 * <p>
 * 書式は「位相接頭辞（省略可）+ {@code IXYZ} の並び」です。 位相接頭辞は {@code +}, {@code -}, {@code i}, {@code +i},
 * {@code -i} のいずれかで、省略時は 1 とします。 文字の間の空白と {@code _} は読み飛ばします。
 * </p>
 */
public final class PauliStrings {

    private PauliStrings() {}

    /**
     * 文字列を密な演算子として解釈します。
     *
     * @param text Pauli 文字列です（null 不可）
     * @return 密な演算子です
     * @throws IllegalArgumentException 不正な文字を含む場合に発生します
     */
    public static DensePauliOperator parseDense(String text) {
        checkNotNull(text, "text が null です。");
        String s = text.trim();

        Phase phase = Phase.one();
        int start = 0;
        if (s.startsWith("+i")) {
            phase = Phase.i();
            start = 2;
        } else if (s.startsWith("-i")) {
            phase = Phase.minusI();
            start = 2;
        } else if (s.startsWith("i")) {
            phase = Phase.i();
            start = 1;
        } else if (s.startsWith("+")) {
            start = 1;
        } else if (s.startsWith("-")) {
            phase = Phase.minusOne();
            start = 1;
        }

        List<Pauli> paulis = new ArrayList<>(s.length());
        for (int k = start; k < s.length(); k++) {
            char c = s.charAt(k);
            if (Character.isWhitespace(c) || c == '_') {
                continue;
            }
            paulis.add(toPauli(c, k, s));
        }
        return DensePauliOperator.withPhaseAndPaulis(phase, paulis);
    }

    /**
     * 文字列を疎な演算子として解釈します。
     *
     * @param text Pauli 文字列です（null 不可、位相は 1 のみ許容）
     * @return 疎な演算子です
     * @throws IllegalArgumentException 不正な文字を含む場合、または位相が 1 以外の場合に発生します
     */
    public static SparsePauliOperator parseSparse(String text) {
        DensePauliOperator dense = parseDense(text);
        if (dense.phase() != Phase.ONE) {
            throw new IllegalArgumentException("疎な演算子は位相を持てません: " + text);
        }
        return dense.toSparse();
    }

    /**
     * 密な演算子を Pauli 文字列に整形します。
     *
     * @param operator 密な演算子です（null 不可）
     * @return Pauli 文字列です
     */
    public static String format(DensePauliOperator operator) {
        checkNotNull(operator, "operator が null です。");
        return operator.toString();
    }

    /**
     * 疎な演算子を Pauli 文字列（I を含む全長）に整形します。
     *
     * @param operator 疎な演算子です（null 不可）
     * @return Pauli 文字列です
     */
    public static String format(SparsePauliOperator operator) {
        checkNotNull(operator, "operator が null です。");
        return operator.toDense().toString();
    }

    private static Pauli toPauli(char c, int index, String text) {
        switch (c) {
            case 'I':
                return Pauli.I;
            case 'X':
                return Pauli.X;
            case 'Y':
                return Pauli.Y;
            case 'Z':
                return Pauli.Z;
            default:
                throw new IllegalArgumentException(
                        "Pauli 文字列に不正な文字 '" + c + "' があります（位置 " + index + "）: " + text);
        }
    }
}
