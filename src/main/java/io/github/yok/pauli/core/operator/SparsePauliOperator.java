package io.github.yok.pauli.core.operator;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.pauli.core.pauli.Pauli;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 非自明な位置のみを保持する、疎な多量子ビット Pauli 演算子を表すクラスです。
 *
 * <p>
 * 例えば {@code XIYIZ} は長さ 5、位置 {0, 2, 4}、値 {X, Y, Z} として保持します。 位置は昇順かつ重複なしで、I は保持しません。
 * 大域位相は扱いません（誤り訂正の文脈では位相は無関係なためです）。
 * </p>
 *
 * <p>
 * インスタンスは不変です。積や X/Z 成分などの派生演算子は常に新しいインスタンスとして生成します。
 * </p>
 */
public final class SparsePauliOperator {

    /**
     * 長さ 0 の演算子です。
     */
    private static final SparsePauliOperator EMPTY =
            new SparsePauliOperator(0, new int[0], new Pauli[0]);

    /**
     * 量子ビット数です。
     */
    private final int length;

    /**
     * 非自明な位置です（昇順、重複なし）。
     */
    private final int[] positions;

    /**
     * 各位置の Pauli 演算子です（I を含みません）。
     */
    private final Pauli[] paulis;

    /**
     * 正規形の配列から直接生成します。検証は行いません。
     */
    private SparsePauliOperator(int length, int[] positions, Pauli[] paulis) {
        this.length = length;
        this.positions = positions;
        this.paulis = paulis;
    }

    /**
     * 長さ・非自明な位置・値を指定して演算子を生成します。
     *
     * <p>
     * 位置は昇順に並べ替えます。同じ位置が複数回現れた場合は位相を無視した積にまとめ、I になった位置と I として渡された位置は保持しません。
     * </p>
     *
     * @param length 量子ビット数です（0 以上）
     * @param positions 非自明な位置です（null 不可）
     * @param paulis 各位置の Pauli 演算子です（null 不可）
     * @return 演算子です
     * @throws IncompatibleLengthException 位置数と演算子数が異なる場合に発生します
     * @throws PositionOutOfBoundException 位置が 0 未満または length 以上の場合に発生します
     * @throws IllegalArgumentException length が負の場合に発生します
     */
    public static SparsePauliOperator of(int length, List<Integer> positions,
            List<Pauli> paulis) {
        checkArgument(length >= 0, "length は 0 以上が必要です: %s", length);
        checkNotNull(positions, "positions が null です。");
        checkNotNull(paulis, "paulis が null です。");

        if (positions.size() != paulis.size()) {
            throw new IncompatibleLengthException(positions.size(), paulis.size());
        }
        for (Integer position : positions) {
            checkNotNull(position, "positions に null が含まれています。");
            if (position < 0 || position >= length) {
                throw new PositionOutOfBoundException(position, length);
            }
        }

        // 位置順に整列し、重複位置は積でまとめます
        TreeMap<Integer, Pauli> sorted = new TreeMap<>();
        for (int k = 0; k < positions.size(); k++) {
            Pauli pauli = checkNotNull(paulis.get(k), "paulis に null が含まれています。");
            sorted.merge(positions.get(k), pauli, Pauli::multiply);
        }
        sorted.values().removeIf(Pauli::isTrivial);

        int[] sortedPositions = new int[sorted.size()];
        Pauli[] sortedPaulis = new Pauli[sorted.size()];
        int n = 0;
        for (Map.Entry<Integer, Pauli> e : sorted.entrySet()) {
            sortedPositions[n] = e.getKey();
            sortedPaulis[n] = e.getValue();
            n++;
        }
        return new SparsePauliOperator(length, sortedPositions, sortedPaulis);
    }

    /**
     * 長さ・非自明な位置・値を配列で指定して演算子を生成します。
     *
     * @param length 量子ビット数です（0 以上）
     * @param positions 非自明な位置です（null 不可）
     * @param paulis 各位置の Pauli 演算子です（null 不可）
     * @return 演算子です
     * @throws IncompatibleLengthException 位置数と演算子数が異なる場合に発生します
     * @throws PositionOutOfBoundException 位置が 0 未満または length 以上の場合に発生します
     * @see #of(int, List, List)
     */
    public static SparsePauliOperator of(int length, int[] positions, Pauli... paulis) {
        checkNotNull(positions, "positions が null です。");
        checkNotNull(paulis, "paulis が null です。");
        List<Integer> boxed = new ArrayList<>(positions.length);
        for (int position : positions) {
            boxed.add(position);
        }
        return of(length, boxed, Arrays.asList(paulis));
    }

    /**
     * 長さ 0 の演算子を返します。
     *
     * @return 長さ 0 の演算子です
     */
    public static SparsePauliOperator empty() {
        return EMPTY;
    }

    /**
     * 量子ビット数を返します。
     *
     * @return 量子ビット数です
     */
    public int length() {
        return length;
    }

    /**
     * 非自明に作用する量子ビット数（重み）を返します。
     *
     * @return 重みです
     */
    public int weight() {
        return positions.length;
    }

    /**
     * 指定位置の Pauli 演算子を返します。
     *
     * @param position 量子ビット位置です
     * @return 保持されていればその値、範囲内で保持されていなければ I、範囲外の場合は空です
     */
    public Optional<Pauli> get(int position) {
        if (position < 0 || position >= length) {
            return Optional.empty();
        }
        int k = Arrays.binarySearch(positions, position);
        return Optional.of(k >= 0 ? paulis[k] : Pauli.I);
    }

    /**
     * 非自明な位置を昇順で返します。
     *
     * @return 非自明な位置の配列（複製）です
     */
    public int[] nonTrivialPositions() {
        return positions.clone();
    }

    /**
     * 非自明な (位置, 値) の組を位置の昇順で返します。
     *
     * @return 変更不可のリストです
     */
    public List<PauliEntry> entries() {
        List<PauliEntry> out = new ArrayList<>(positions.length);
        for (int k = 0; k < positions.length; k++) {
            out.add(new PauliEntry(positions[k], paulis[k]));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * 他の演算子と交換するかどうかを返します。
     *
     * <p>
     * 両方に非自明な値がある位置のうち反交換する位置の数を数え、偶数なら交換します。 片方にしかない位置は I と交換するため寄与しません。
     * そのため長さが異なっていても判定できます。
     * </p>
     *
     * @param other 比較対象です（null 不可）
     * @return 交換する場合は true です
     */
    public boolean commutesWith(SparsePauliOperator other) {
        int anticommuting = 0;
        int a = 0;
        int b = 0;
        while (a < positions.length && b < other.positions.length) {
            int pa = positions[a];
            int pb = other.positions[b];
            if (pa < pb) {
                a++;
            } else if (pa > pb) {
                b++;
            } else {
                if (paulis[a].anticommutesWith(other.paulis[b])) {
                    anticommuting++;
                }
                a++;
                b++;
            }
        }
        return anticommuting % 2 == 0;
    }

    /**
     * 他の演算子と反交換するかどうかを返します。
     *
     * @param other 比較対象です（null 不可）
     * @return 反交換する場合は true です
     */
    public boolean anticommutesWith(SparsePauliOperator other) {
        return !commutesWith(other);
    }

    /**
     * 位相を無視した位置ごとの積を返します。
     *
     * @param other 右から掛ける演算子です（null 不可）
     * @return 積です（I になった位置は保持しません）
     * @throws IncompatibleLengthException 長さが異なる場合に発生します
     */
    public SparsePauliOperator multiply(SparsePauliOperator other) {
        if (length != other.length) {
            throw new IncompatibleLengthException(length, other.length);
        }

        int capacity = positions.length + other.positions.length;
        int[] outPositions = new int[capacity];
        Pauli[] outPaulis = new Pauli[capacity];
        int n = 0;
        int a = 0;
        int b = 0;
        while (a < positions.length || b < other.positions.length) {
            if (b >= other.positions.length
                    || (a < positions.length && positions[a] < other.positions[b])) {
                outPositions[n] = positions[a];
                outPaulis[n++] = paulis[a++];
            } else if (a >= positions.length || positions[a] > other.positions[b]) {
                outPositions[n] = other.positions[b];
                outPaulis[n++] = other.paulis[b++];
            } else {
                Pauli product = paulis[a].multiply(other.paulis[b]);
                if (product.isNonTrivial()) {
                    outPositions[n] = positions[a];
                    outPaulis[n++] = product;
                }
                a++;
                b++;
            }
        }
        return new SparsePauliOperator(length, Arrays.copyOf(outPositions, n),
                Arrays.copyOf(outPaulis, n));
    }

    /**
     * X 成分を返します。
     *
     * <p>
     * Z 以外の値（X と Y）を X に置き換え、Z の位置は除きます。
     * </p>
     *
     * @return X のみからなる演算子です
     */
    public SparsePauliOperator xPart() {
        return project(Pauli.Z, Pauli.X);
    }

    /**
     * Z 成分を返します。
     *
     * <p>
     * X 以外の値（Y と Z）を Z に置き換え、X の位置は除きます。
     * </p>
     *
     * @return Z のみからなる演算子です
     */
    public SparsePauliOperator zPart() {
        return project(Pauli.X, Pauli.Z);
    }

    /**
     * X 成分と Z 成分の組を返します。
     *
     * @return 分解結果です
     */
    public XzPartition partitionXAndZ() {
        return new XzPartition(xPart(), zPart());
    }

    /**
     * excluded の位置を除き、残りをすべて target に置き換えた演算子を返します。
     *
     * @param excluded 除外する値です
     * @param target 置き換え後の値です
     * @return 射影した演算子です
     */
    private SparsePauliOperator project(Pauli excluded, Pauli target) {
        int[] outPositions = new int[positions.length];
        Pauli[] outPaulis = new Pauli[positions.length];
        int n = 0;
        for (int k = 0; k < positions.length; k++) {
            if (paulis[k] != excluded) {
                outPositions[n] = positions[k];
                outPaulis[n++] = target;
            }
        }
        return new SparsePauliOperator(length, Arrays.copyOf(outPositions, n),
                Arrays.copyOf(outPaulis, n));
    }

    /**
     * 非自明な位置の配列を返します。
     *
     * @return 位置の配列（複製）です
     */
    public int[] toRawPositions() {
        return positions.clone();
    }

    /**
     * 非自明な値を位置の昇順で返します。
     *
     * @return 値のリスト（変更可能な複製）です
     */
    public List<Pauli> toRawPaulis() {
        return new ArrayList<>(Arrays.asList(paulis));
    }

    /**
     * 位相 1 の密な演算子に変換します。
     *
     * @return 密な演算子です
     */
    public DensePauliOperator toDense() {
        return DensePauliOperator.fromSparse(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SparsePauliOperator)) {
            return false;
        }
        SparsePauliOperator other = (SparsePauliOperator) obj;
        return length == other.length && Arrays.equals(positions, other.positions)
                && Arrays.equals(paulis, other.paulis);
    }

    @Override
    public int hashCode() {
        int h = Integer.hashCode(length);
        h = 31 * h + Arrays.hashCode(positions);
        return 31 * h + Arrays.hashCode(paulis);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int k = 0; k < positions.length; k++) {
            if (k > 0) {
                sb.append(", ");
            }
            sb.append('(').append(positions[k]).append(", ").append(paulis[k]).append(')');
        }
        return sb.append(']').toString();
    }
}
