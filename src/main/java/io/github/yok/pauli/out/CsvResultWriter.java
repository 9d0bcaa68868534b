package io.github.yok.pauli.out;

import io.github.yok.pauli.core.code.Syndrome;
import io.github.yok.pauli.core.composition.CompositionResult;
import io.github.yok.pauli.core.operator.DensePauliOperator;
import io.github.yok.pauli.core.operator.SparsePauliOperator;
import io.github.yok.pauli.text.PauliStrings;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 計算結果を CSV に出力するクラスです。
 *
 * <ul>
 * <li>{@code pauli_syndrome.csv}（誤り演算子ごとのシンドローム。列 s0, s1, ... はスタビライザ順のビット）</li>
 * <li>{@code pauli_composition.csv}（合成した演算子列と積、位相、行列検証の結果）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * シンドロームの出力ファイル名です。
     */
    static final String SYNDROME_FILE = "pauli_syndrome.csv";

    /**
     * 合成結果の出力ファイル名です。
     */
    static final String COMPOSITION_FILE = "pauli_composition.csv";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException outputDir が null または空の場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 誤り演算子ごとのシンドロームを出力します。
     *
     * @param errors 誤り演算子の一覧です（null 不可）
     * @param syndromes errors と同じ順のシンドロームです（null 不可、件数一致が必要です）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeSyndromes(List<SparsePauliOperator> errors, List<Syndrome> syndromes) {
        if (errors == null || syndromes == null) {
            throw new IllegalArgumentException("errors/syndromes は null 不可です");
        }
        if (errors.size() != syndromes.size()) {
            throw new IllegalArgumentException("errors と syndromes の件数が一致しません: " + errors.size()
                    + " と " + syndromes.size());
        }

        int stabilizerCount = syndromes.isEmpty() ? 0 : syndromes.get(0).size();
        List<String> header = new ArrayList<>();
        header.add("error");
        header.add("syndrome");
        header.add("weight");
        for (int k = 0; k < stabilizerCount; k++) {
            header.add("s" + k);
        }

        Path file = outputDir.resolve(SYNDROME_FILE);
        try {
            Files.createDirectories(outputDir);
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                    CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                            .setHeader(header.toArray(new String[0])).build().print(w)) {

                for (int i = 0; i < errors.size(); i++) {
                    Syndrome s = syndromes.get(i);
                    List<Object> record = new ArrayList<>();
                    record.add(PauliStrings.format(errors.get(i)));
                    record.add(s.toString());
                    record.add(s.weight());
                    for (int k = 0; k < s.size(); k++) {
                        record.add(s.get(k) ? 1 : 0);
                    }
                    pr.printRecord(record);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
    }

    /**
     * 演算子列の合成結果を key/value 形式で出力します。
     *
     * @param result 合成結果です（null 不可）
     * @throws IllegalArgumentException result が null の場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeComposition(CompositionResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }

        Path file = outputDir.resolve(COMPOSITION_FILE);
        try {
            Files.createDirectories(outputDir);
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                    CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                            .setHeader("key", "value").build().print(w)) {

                List<DensePauliOperator> factors = result.getFactors();
                for (int k = 0; k < factors.size(); k++) {
                    pr.printRecord("factor." + k, PauliStrings.format(factors.get(k)));
                }

                DensePauliOperator product = result.getProduct();
                pr.printRecord("product", PauliStrings.format(product));
                pr.printRecord("product.phase", product.phase());
                pr.printRecord("product.length", product.length());
                pr.printRecord("product.weight", product.weight());
                pr.printRecord("matrixCheck", result.getMatrixCheck());
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
    }
}
