package io.github.yok.pauli.app;

import io.github.yok.pauli.core.code.Syndrome;
import io.github.yok.pauli.core.code.SyndromeExtractor;
import io.github.yok.pauli.core.composition.CompositionResult;
import io.github.yok.pauli.core.composition.CompositionResult.MatrixCheck;
import io.github.yok.pauli.core.composition.DenseOperatorComposer;
import io.github.yok.pauli.core.linearalgebra.PauliMatrixBackend;
import io.github.yok.pauli.core.operator.DensePauliOperator;
import io.github.yok.pauli.core.operator.SparsePauliOperator;
import io.github.yok.pauli.out.ResultWriter;
import io.github.yok.pauli.text.PauliStrings;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.ZMatrixRMaj;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で pauli-algebra を実行するクラスです。
 *
 * <p>
 * 設定された誤り演算子ごとにスタビライザ符号のシンドロームを求め、続けて演算子列を位相付きで合成します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PauliCliRunner implements CommandLineRunner {

    /**
     * 行列比較の許容誤差です。
     */
    private static final double MATRIX_TOLERANCE = 1e-12;

    /**
     * pauli-algebra の設定値（pauli.*）です。
     */
    private final PauliProperties properties;

    /**
     * シンドローム抽出ロジックです。
     */
    private final SyndromeExtractor syndromeExtractor;

    /**
     * 演算子列の合成ロジックです。
     */
    private final DenseOperatorComposer composer;

    /**
     * 行列表現バックエンドです。
     */
    private final PauliMatrixBackend matrixBackend;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     * @throws IllegalStateException 設定値が不正な場合に発生します
     */
    @Override
    public void run(String... args) {
        System.out.println("=== pauli-algebra start ===");
        System.out.print(properties.toMultilineString());

        runSyndromes();
        runComposition();
    }

    /**
     * 誤り演算子ごとのシンドロームを計算して出力します。
     */
    void runSyndromes() {
        List<String> errorTexts = properties.getCode().getErrors();
        if (errorTexts == null || errorTexts.isEmpty()) {
            log.info("誤り演算子が指定されていないため、シンドローム計算を省略します。");
            return;
        }

        List<SparsePauliOperator> errors = new ArrayList<>();
        List<Syndrome> syndromes = new ArrayList<>();

        System.out.println("=== シンドローム計算 ===");
        for (String text : errorTexts) {
            SparsePauliOperator error = parseSparse(text);
            if (error.length() != syndromeExtractor.codeLength()) {
                throw new IllegalStateException("code.errors の長さが符号長と一致しません: " + text + "（長さ="
                        + error.length() + "、符号長=" + syndromeExtractor.codeLength() + "）");
            }
            Syndrome syndrome = syndromeExtractor.extract(error);
            errors.add(error);
            syndromes.add(syndrome);

            System.out.println("誤り=" + PauliStrings.format(error) + " " + error + " → シンドローム="
                    + syndrome + (syndrome.isTrivial() ? "（検出されません）" : ""));
        }

        resultWriter.writeSyndromes(errors, syndromes);
    }

    /**
     * 演算子列を合成し、必要に応じて行列積で検証して出力します。
     */
    void runComposition() {
        List<String> operatorTexts = properties.getComposition().getOperators();
        if (operatorTexts == null || operatorTexts.isEmpty()) {
            log.info("合成する演算子列が指定されていないため、合成を省略します。");
            return;
        }

        List<DensePauliOperator> factors = new ArrayList<>();
        for (String text : operatorTexts) {
            factors.add(parseDense(text));
        }
        int length = factors.get(0).length();
        for (DensePauliOperator f : factors) {
            if (f.length() != length) {
                throw new IllegalStateException(
                        "composition.operators の長さが一致しません: " + f + "（長さ=" + f.length() + "、期待値=" + length + "）");
            }
        }

        System.out.println("=== 演算子列の合成 ===");
        DensePauliOperator product = composer.compose(factors);

        MatrixCheck check = MatrixCheck.SKIPPED;
        if (properties.getComposition().isVerifyWithMatrices()) {
            check = verifyWithMatrices(factors, product);
        }

        System.out.println("結果: " + PauliStrings.format(product) + "（位相=" + product.phase() + "、重み="
                + product.weight() + "、行列検証=" + check + "）");

        resultWriter.writeComposition(new CompositionResult(List.copyOf(factors), product, check));
    }

    /**
     * 因子の行列積と、記号的に求めた積の行列を比較します。
     *
     * @param factors 因子です
     * @param product 記号的に求めた積です
     * @return 検証結果です
     */
    MatrixCheck verifyWithMatrices(List<DensePauliOperator> factors, DensePauliOperator product) {
        ZMatrixRMaj expected = matrixBackend.toMatrix(factors.get(0));
        for (int k = 1; k < factors.size(); k++) {
            expected = matrixBackend.multiply(expected, matrixBackend.toMatrix(factors.get(k)));
        }
        ZMatrixRMaj actual = matrixBackend.toMatrix(product);

        if (matrixBackend.isEqual(expected, actual, MATRIX_TOLERANCE)) {
            log.info("行列積による検証に成功しました。次元={}", actual.numRows);
            return MatrixCheck.MATCHED;
        }
        log.warn("行列積と記号的な積が一致しません。積={}", product);
        return MatrixCheck.MISMATCHED;
    }

    private static SparsePauliOperator parseSparse(String text) {
        try {
            return PauliStrings.parseSparse(text);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Pauli 文字列を解釈できません: " + text, e);
        }
    }

    private static DensePauliOperator parseDense(String text) {
        try {
            return PauliStrings.parseDense(text);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Pauli 文字列を解釈できません: " + text, e);
        }
    }
}
