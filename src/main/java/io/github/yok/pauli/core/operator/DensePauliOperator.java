package io.github.yok.pauli.core.operator;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.pauli.core.pauli.Pauli;
import io.github.yok.pauli.core.pauli.PauliProduct;
import io.github.yok.pauli.core.phase.Phase;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 大域位相と、全量子ビット分の Pauli 演算子列からなる密な多量子ビット演算子を表すクラスです。
 *
 * <p>
 * 演算子列は I を含めて全位置を保持し、長さは生成後に変わりません。 積では位置ごとの補正位相を厳密に累積します。
 * </p>
 *
 * <p>
 * 二項演算（交換判定・積）は長さの一致を前提とし、不一致はプログラム誤りとして即座に失敗します。
 * </p>
 */
public final class DensePauliOperator {

    /**
     * 長さ 0、位相 1 の演算子です。
     */
    private static final DensePauliOperator EMPTY =
            new DensePauliOperator(Phase.one(), new Pauli[0]);

    /**
     * 各量子ビットの Pauli 演算子です。
     */
    private final Pauli[] paulis;

    /**
     * 大域位相です。
     */
    private final Phase phase;

    private DensePauliOperator(Phase phase, Pauli[] paulis) {
        this.phase = phase;
        this.paulis = paulis;
    }

    /**
     * 長さ 0、位相 1 の演算子を返します。
     *
     * @return 空の演算子です
     */
    public static DensePauliOperator empty() {
        return EMPTY;
    }

    /**
     * 位相 1 の演算子を生成します。
     *
     * @param paulis 各量子ビットの Pauli 演算子です（null 不可）
     * @return 演算子です
     */
    public static DensePauliOperator withPaulis(List<Pauli> paulis) {
        return withPhaseAndPaulis(Phase.one(), paulis);
    }

    /**
     * 位相 1 の演算子を生成します。
     *
     * @param paulis 各量子ビットの Pauli 演算子です（null 不可）
     * @return 演算子です
     */
    public static DensePauliOperator withPaulis(Pauli... paulis) {
        return withPhaseAndPaulis(Phase.one(), paulis);
    }

    /**
     * 位相と演算子列を指定して演算子を生成します。
     *
     * @param phase 大域位相です（null 不可）
     * @param paulis 各量子ビットの Pauli 演算子です（null 不可）
     * @return 演算子です
     */
    public static DensePauliOperator withPhaseAndPaulis(Phase phase, List<Pauli> paulis) {
        checkNotNull(paulis, "paulis が null です。");
        return withPhaseAndPaulis(phase, paulis.toArray(new Pauli[0]));
    }

    /**
     * 位相と演算子列を指定して演算子を生成します。
     *
     * @param phase 大域位相です（null 不可）
     * @param paulis 各量子ビットの Pauli 演算子です（null 不可）
     * @return 演算子です
     */
    public static DensePauliOperator withPhaseAndPaulis(Phase phase, Pauli... paulis) {
        checkNotNull(phase, "phase が null です。");
        checkNotNull(paulis, "paulis が null です。");
        Pauli[] copy = paulis.clone();
        for (Pauli p : copy) {
            checkNotNull(p, "paulis に null が含まれています。");
        }
        return new DensePauliOperator(phase, copy);
    }

    /**
     * 疎な演算子から位相 1 の密な演算子を生成します（省略された位置は I で埋めます）。
     *
     * @param sparse 疎な演算子です（null 不可）
     * @return 密な演算子です
     */
    public static DensePauliOperator fromSparse(SparsePauliOperator sparse) {
        checkNotNull(sparse, "sparse が null です。");
        Pauli[] out = new Pauli[sparse.length()];
        Arrays.fill(out, Pauli.I);
        for (PauliEntry e : sparse.entries()) {
            out[e.getPosition()] = e.getPauli();
        }
        return new DensePauliOperator(Phase.one(), out);
    }

    /**
     * 量子ビット数を返します。
     *
     * @return 量子ビット数です
     */
    public int length() {
        return paulis.length;
    }

    /**
     * 演算子列が空かどうかを返します。
     *
     * @return 長さ 0 の場合は true です
     */
    public boolean isEmpty() {
        return paulis.length == 0;
    }

    /**
     * 大域位相を返します。
     *
     * @return 位相です
     */
    public Phase phase() {
        return phase;
    }

    /**
     * 指定位置の Pauli 演算子を返します。
     *
     * @param position 量子ビット位置です（0 以上 length 未満）
     * @return Pauli 演算子です
     * @throws IndexOutOfBoundsException 範囲外の場合に発生します
     */
    public Pauli get(int position) {
        return paulis[position];
    }

    /**
     * 全位置の Pauli 演算子を返します。
     *
     * @return 変更不可のリストです
     */
    public List<Pauli> paulis() {
        return Collections.unmodifiableList(Arrays.asList(paulis));
    }

    /**
     * 非自明な位置の数を返します。
     *
     * @return 重みです
     */
    public int weight() {
        int w = 0;
        for (Pauli p : paulis) {
            if (p.isNonTrivial()) {
                w++;
            }
        }
        return w;
    }

    /**
     * I 以外が作用する位置を昇順で返します。
     *
     * @return 変更不可のリストです
     */
    public List<Integer> nonTrivialPositions() {
        List<Integer> out = new ArrayList<>();
        for (int k = 0; k < paulis.length; k++) {
            if (paulis[k].isNonTrivial()) {
                out.add(k);
            }
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * I 以外が作用する (位置, 値) の組を昇順で返します。
     *
     * @return 変更不可のリストです
     */
    public List<PauliEntry> nonTrivialPaulis() {
        List<PauliEntry> out = new ArrayList<>();
        for (int k = 0; k < paulis.length; k++) {
            if (paulis[k].isNonTrivial()) {
                out.add(new PauliEntry(k, paulis[k]));
            }
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * 他の演算子と交換するかどうかを返します。
     *
     * @param other 比較対象です（null 不可）
     * @return 反交換する位置の数が偶数の場合は true です
     * @throws IllegalArgumentException 長さが異なる場合に発生します
     */
    public boolean commutesWith(DensePauliOperator other) {
        return anticommutingCount(other) % 2 == 0;
    }

    /**
     * 他の演算子と反交換するかどうかを返します。
     *
     * @param other 比較対象です（null 不可）
     * @return 反交換する位置の数が奇数の場合は true です
     * @throws IllegalArgumentException 長さが異なる場合に発生します
     */
    public boolean anticommutesWith(DensePauliOperator other) {
        return anticommutingCount(other) % 2 == 1;
    }

    private int anticommutingCount(DensePauliOperator other) {
        checkSameLength(other);
        int count = 0;
        for (int k = 0; k < paulis.length; k++) {
            if (paulis[k].anticommutesWith(other.paulis[k])) {
                count++;
            }
        }
        return count;
    }

    /**
     * 他の演算子との積を返します。
     *
     * <p>
     * 位置ごとに位相付きの積を取り、補正位相の累積に両演算子の位相を掛けたものを結果の位相とします。
     * </p>
     *
     * @param other 右から掛ける演算子です（null 不可）
     * @return 積です
     * @throws IllegalArgumentException 長さが異なる場合に発生します
     */
    public DensePauliOperator multiply(DensePauliOperator other) {
        checkSameLength(other);
        Phase accumulated = Phase.one();
        Pauli[] out = new Pauli[paulis.length];
        for (int k = 0; k < paulis.length; k++) {
            PauliProduct product = paulis[k].multiplyWithPhase(other.paulis[k]);
            out[k] = product.getPauli();
            accumulated = accumulated.multiply(product.getPhase());
        }
        return new DensePauliOperator(accumulated.multiply(phase).multiply(other.phase), out);
    }

    /**
     * 位相を掛けた演算子を返します（スカラー倍なので左右どちらから掛けても同じです）。
     *
     * @param factor 掛ける位相です（null 不可）
     * @return 演算子列が同じで位相だけが異なる演算子です
     */
    public DensePauliOperator multiply(Phase factor) {
        checkNotNull(factor, "factor が null です。");
        return new DensePauliOperator(phase.multiply(factor), paulis);
    }

    /**
     * 全位置に同じ Pauli 演算子を右から掛けた演算子を返します。
     *
     * @param pauli 掛ける Pauli 演算子です（null 不可）
     * @return 積です
     */
    public DensePauliOperator multiply(Pauli pauli) {
        checkNotNull(pauli, "pauli が null です。");
        Phase accumulated = Phase.one();
        Pauli[] out = new Pauli[paulis.length];
        for (int k = 0; k < paulis.length; k++) {
            PauliProduct product = paulis[k].multiplyWithPhase(pauli);
            out[k] = product.getPauli();
            accumulated = accumulated.multiply(product.getPhase());
        }
        return new DensePauliOperator(phase.multiply(accumulated), out);
    }

    /**
     * 位相を捨てて疎な演算子に変換します。
     *
     * @return 疎な演算子です
     */
    public SparsePauliOperator toSparse() {
        List<Integer> positions = new ArrayList<>();
        List<Pauli> values = new ArrayList<>();
        for (int k = 0; k < paulis.length; k++) {
            if (paulis[k].isNonTrivial()) {
                positions.add(k);
                values.add(paulis[k]);
            }
        }
        return SparsePauliOperator.of(paulis.length, positions, values);
    }

    private void checkSameLength(DensePauliOperator other) {
        checkNotNull(other, "other が null です。");
        checkArgument(paulis.length == other.paulis.length, "演算子の長さが異なります: %s と %s",
                paulis.length, other.paulis.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DensePauliOperator)) {
            return false;
        }
        DensePauliOperator other = (DensePauliOperator) obj;
        return phase == other.phase && Arrays.equals(paulis, other.paulis);
    }

    @Override
    public int hashCode() {
        return 31 * phase.hashCode() + Arrays.hashCode(paulis);
    }

    /**
     * 位相接頭辞に続けて演算子列を並べた文字列を返します（例: {@code -iXYZ}）。
     *
     * <p>
     * 接頭辞は 1 なら省略、-1 なら {@code -}、i なら {@code i}、-i なら {@code -i} です。
     * {@link io.github.yok.pauli.text.PauliStrings#parseDense(String)} で元の演算子に戻せます。
     * </p>
     *
     * @return 文字列表現です
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(prefixOf(phase));
        for (Pauli p : paulis) {
            sb.append(p.name());
        }
        return sb.toString();
    }

    private static String prefixOf(Phase phase) {
        switch (phase) {
            case ONE:
                return "";
            case MINUS_ONE:
                return "-";
            case IMAGINARY_UNIT:
                return "i";
            default:
                return "-i";
        }
    }
}
