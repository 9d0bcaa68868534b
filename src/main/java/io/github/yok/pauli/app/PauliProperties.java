package io.github.yok.pauli.app;

import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * pauli-algebra の設定値（pauli.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。 演算子はすべて Pauli 文字列（例: {@code XZZXI}、
 * {@code -iXYZ}）で指定します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "pauli")
public class PauliProperties {

    /**
     * スタビライザ符号の設定です。
     */
    @Valid
    private Code code = new Code();

    /**
     * 演算子列の合成設定です。
     */
    @Valid
    private Composition composition = new Composition();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "pauli")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Code c = getCode();
        Composition m = getComposition();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "code",
                // stabilizers: スタビライザ生成元
                "stabilizers", c.getStabilizers(),
                // errors: シンドロームを求める誤り演算子
                "errors", c.getErrors());

        appendSection(sb, nl, "composition",
                // operators: 左から順に掛ける演算子列
                "operators", m.getOperators(),
                // verifyWithMatrices: 行列積で検証するかどうか
                "verifyWithMatrices", m.isVerifyWithMatrices(),
                // matrixMaxQubits: 行列化を許可する最大量子ビット数
                "matrixMaxQubits", m.getMatrixMaxQubits());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * 1 つのセクションを、見出し行と字下げした {@code key: value} 行として追記します。
     *
     * <pre>
     *   code:
     *     stabilizers: [XZZXI, IXZZX]
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section 見出しとなるセクション名です
     * @param entries キーと値を交互に並べた配列です（長さは偶数）
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... entries) {
        sb.append("  ").append(section).append(':').append(nl);
        for (int k = 0; k + 1 < entries.length; k += 2) {
            sb.append("    ").append(entries[k]).append(": ").append(entries[k + 1]).append(nl);
        }
    }

    @Data
    public static class Code {

        /**
         * スタビライザ生成元（位相なしの Pauli 文字列）です。
         */
        @NotEmpty
        private List<String> stabilizers = new ArrayList<>();

        /**
         * シンドロームを求める誤り演算子（位相なしの Pauli 文字列）です。
         */
        private List<String> errors = new ArrayList<>();
    }

    @Data
    public static class Composition {

        /**
         * 左から順に掛ける演算子列（位相付き Pauli 文字列）です。
         *
         * <p>
         * 空の場合は合成を行いません。
         * </p>
         */
        private List<String> operators = new ArrayList<>();

        /**
         * 合成結果を行列積で検証するかどうかです。
         */
        private boolean verifyWithMatrices = false;

        /**
         * 行列化を許可する最大量子ビット数です。
         */
        @Min(0)
        @Max(12)
        private int matrixMaxQubits = 8;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
