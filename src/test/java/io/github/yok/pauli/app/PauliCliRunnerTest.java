package io.github.yok.pauli.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.pauli.core.code.CommutationSyndromeExtractor;
import io.github.yok.pauli.core.composition.CompositionResult.MatrixCheck;
import io.github.yok.pauli.core.composition.DenseOperatorComposer;
import io.github.yok.pauli.core.linearalgebra.EjmlPauliMatrixBackend;
import io.github.yok.pauli.core.operator.DensePauliOperator;
import io.github.yok.pauli.core.operator.SparsePauliOperator;
import io.github.yok.pauli.out.CsvResultWriter;
import io.github.yok.pauli.text.PauliStrings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PauliCliRunnerTest {

    @TempDir
    Path tempDir;

    private static PauliProperties properties(Path outputDir) {
        PauliProperties p = new PauliProperties();
        p.getCode().setStabilizers(List.of("XZZXI", "IXZZX", "XIXZZ", "ZXIXZ"));
        p.getCode().setErrors(List.of("XIIII", "IZIII", "IIYII"));
        p.getComposition().setOperators(List.of("iIXYZ", "XZXZ", "-YYII"));
        p.getComposition().setVerifyWithMatrices(true);
        p.getComposition().setMatrixMaxQubits(4);
        p.getOutput().setDir(outputDir.toString());
        return p;
    }

    private static PauliCliRunner runner(PauliProperties p) {
        List<SparsePauliOperator> stabilizers = new ArrayList<>();
        for (String s : p.getCode().getStabilizers()) {
            stabilizers.add(PauliStrings.parseSparse(s));
        }
        return new PauliCliRunner(p, new CommutationSyndromeExtractor(stabilizers),
                new DenseOperatorComposer(),
                new EjmlPauliMatrixBackend(p.getComposition().getMatrixMaxQubits()),
                new CsvResultWriter(p.getOutput().getDir()));
    }

    @Test
    @DisplayName("シンドロームと合成結果を CSV に出力する")
    void testRun() throws IOException {
        PauliProperties p = properties(tempDir);
        runner(p).run();

        List<String> syndromes = Files.readAllLines(tempDir.resolve("pauli_syndrome.csv"),
                StandardCharsets.UTF_8);
        assertEquals(List.of("error,syndrome,weight,s0,s1,s2,s3", "XIIII,0001,1,0,0,0,1",
                "IZIII,0101,2,0,1,0,1", "IIYII,1110,3,1,1,1,0"), syndromes);

        List<String> composition = Files.readAllLines(tempDir.resolve("pauli_composition.csv"),
                StandardCharsets.UTF_8);
        assertTrue(composition.contains("product,-ZIZI"));
        assertTrue(composition.contains("product.phase,-1"));
        assertTrue(composition.contains("matrixCheck,MATCHED"));
    }

    @Test
    @DisplayName("行列検証を無効にすると SKIPPED")
    void testVerificationDisabled() throws IOException {
        PauliProperties p = properties(tempDir);
        p.getComposition().setVerifyWithMatrices(false);
        runner(p).runComposition();

        List<String> composition = Files.readAllLines(tempDir.resolve("pauli_composition.csv"),
                StandardCharsets.UTF_8);
        assertTrue(composition.contains("matrixCheck,SKIPPED"));
        assertFalse(Files.exists(tempDir.resolve("pauli_syndrome.csv")));
    }

    @Test
    @DisplayName("行列積と記号的な積の比較")
    void testVerifyWithMatrices() {
        PauliCliRunner r = runner(properties(tempDir));
        List<DensePauliOperator> factors =
                List.of(PauliStrings.parseDense("XZ"), PauliStrings.parseDense("ZX"));

        assertEquals(MatrixCheck.MATCHED,
                r.verifyWithMatrices(factors, PauliStrings.parseDense("YY")));
        assertEquals(MatrixCheck.MISMATCHED,
                r.verifyWithMatrices(factors, PauliStrings.parseDense("-YY")));
    }

    @Test
    @DisplayName("空の入力は省略する")
    void testEmptyInputsAreSkipped() {
        PauliProperties p = properties(tempDir);
        p.getCode().setErrors(List.of());
        p.getComposition().setOperators(List.of());
        runner(p).run();

        assertFalse(Files.exists(tempDir.resolve("pauli_syndrome.csv")));
        assertFalse(Files.exists(tempDir.resolve("pauli_composition.csv")));
    }

    @Test
    @DisplayName("不正な設定値は IllegalStateException")
    void testInvalidSettings() {
        PauliProperties wrongLength = properties(tempDir);
        wrongLength.getCode().setErrors(List.of("XII"));
        assertThrows(IllegalStateException.class, () -> runner(wrongLength).runSyndromes());

        PauliProperties badChar = properties(tempDir);
        badChar.getCode().setErrors(List.of("XQIII"));
        IllegalStateException e =
                assertThrows(IllegalStateException.class, () -> runner(badChar).runSyndromes());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());

        PauliProperties mixed = properties(tempDir);
        mixed.getComposition().setOperators(List.of("XX", "XXX"));
        assertThrows(IllegalStateException.class, () -> runner(mixed).runComposition());
    }

    @Test
    @DisplayName("設定値の整形文字列")
    void testPropertiesToString() {
        String text = properties(tempDir).toMultilineString();

        assertTrue(text.contains("code:"));
        assertTrue(text.contains("stabilizers: [XZZXI, IXZZX, XIXZZ, ZXIXZ]"));
        assertTrue(text.contains("matrixMaxQubits: 4"));
    }
}
