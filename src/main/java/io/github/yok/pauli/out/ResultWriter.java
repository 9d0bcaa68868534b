package io.github.yok.pauli.out;

import io.github.yok.pauli.core.code.Syndrome;
import io.github.yok.pauli.core.composition.CompositionResult;
import io.github.yok.pauli.core.operator.SparsePauliOperator;
import java.util.List;

/**
 * 計算結果を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * 誤り演算子ごとのシンドロームを出力します。
     *
     * @param errors 誤り演算子の一覧です
     * @param syndromes errors と同じ順のシンドロームです
     */
    void writeSyndromes(List<SparsePauliOperator> errors, List<Syndrome> syndromes);

    /**
     * 演算子列の合成結果を出力します。
     *
     * @param result 合成結果です
     */
    void writeComposition(CompositionResult result);
}
