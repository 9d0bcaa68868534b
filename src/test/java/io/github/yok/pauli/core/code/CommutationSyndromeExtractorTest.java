package io.github.yok.pauli.core.code;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.pauli.core.operator.IncompatibleLengthException;
import io.github.yok.pauli.core.operator.SparsePauliOperator;
import io.github.yok.pauli.core.pauli.Pauli;
import io.github.yok.pauli.text.PauliStrings;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CommutationSyndromeExtractorTest {

    /**
     * [[5,1,3]] 符号のスタビライザ生成元です。
     */
    private static final List<String> FIVE_QUBIT_CODE =
            List.of("XZZXI", "IXZZX", "XIXZZ", "ZXIXZ");

    private static CommutationSyndromeExtractor fiveQubitCode() {
        List<SparsePauliOperator> stabilizers = new ArrayList<>();
        for (String s : FIVE_QUBIT_CODE) {
            stabilizers.add(PauliStrings.parseSparse(s));
        }
        return new CommutationSyndromeExtractor(stabilizers);
    }

    @Test
    @DisplayName("単一量子ビット誤りのシンドローム")
    void testSingleQubitErrors() {
        CommutationSyndromeExtractor code = fiveQubitCode();

        assertEquals(5, code.codeLength());
        assertEquals("0001", code.extract(PauliStrings.parseSparse("XIIII")).toString());
        assertEquals("0101", code.extract(PauliStrings.parseSparse("IZIII")).toString());
        assertEquals("1110", code.extract(PauliStrings.parseSparse("IIYII")).toString());
    }

    @Test
    @DisplayName("[[5,1,3]] 符号では 15 通りの単一量子ビット誤りがすべて異なる非自明なシンドロームを持つ")
    void testSyndromesAreDistinct() {
        CommutationSyndromeExtractor code = fiveQubitCode();
        Set<String> seen = new HashSet<>();
        for (int q = 0; q < 5; q++) {
            for (Pauli p : new Pauli[] {Pauli.X, Pauli.Y, Pauli.Z}) {
                Syndrome s = code.extract(SparsePauliOperator.of(5, new int[] {q}, p));
                assertFalse(s.isTrivial());
                assertTrue(seen.add(s.toString()), "重複: " + s);
            }
        }
        assertEquals(15, seen.size());
    }

    @Test
    @DisplayName("スタビライザ自身のシンドロームは自明")
    void testStabilizerHasTrivialSyndrome() {
        CommutationSyndromeExtractor code = fiveQubitCode();
        for (SparsePauliOperator s : code.getStabilizers()) {
            Syndrome syndrome = code.extract(s);
            assertTrue(syndrome.isTrivial());
            assertEquals(0, syndrome.weight());
            assertEquals(4, syndrome.size());
        }
        assertTrue(code.extract(SparsePauliOperator.of(5, new int[0])).isTrivial());
    }

    @Test
    @DisplayName("符号長と異なる誤りは IncompatibleLengthException")
    void testLengthMismatch() {
        CommutationSyndromeExtractor code = fiveQubitCode();
        IncompatibleLengthException e = assertThrows(IncompatibleLengthException.class,
                () -> code.extract(PauliStrings.parseSparse("XIII")));
        assertEquals(4, e.getFirst());
        assertEquals(5, e.getSecond());
    }

    @Test
    @DisplayName("不正なスタビライザ一覧は IllegalArgumentException")
    void testInvalidStabilizers() {
        assertThrows(IllegalArgumentException.class,
                () -> new CommutationSyndromeExtractor(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new CommutationSyndromeExtractor(
                List.of(PauliStrings.parseSparse("XX"), PauliStrings.parseSparse("ZZZ"))));
    }

    @Test
    @DisplayName("反交換するスタビライザも受け付ける")
    void testAnticommutingStabilizersAreAccepted() {
        CommutationSyndromeExtractor code = new CommutationSyndromeExtractor(
                List.of(PauliStrings.parseSparse("XI"), PauliStrings.parseSparse("ZI")));
        assertEquals("10", code.extract(PauliStrings.parseSparse("ZI")).toString());
    }

    @Test
    @DisplayName("シンドロームは生成後に変更されない")
    void testSyndromeIsImmutable() {
        boolean[] bits = {true, false};
        Syndrome s = new Syndrome(bits);
        bits[1] = true;
        s.bits()[0] = false;

        assertArrayEquals(new boolean[] {true, false}, s.bits());
        assertEquals(new Syndrome(new boolean[] {true, false}), s);
    }
}
