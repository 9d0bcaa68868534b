package io.github.yok.pauli.app;

import io.github.yok.pauli.core.code.CommutationSyndromeExtractor;
import io.github.yok.pauli.core.code.SyndromeExtractor;
import io.github.yok.pauli.core.composition.DenseOperatorComposer;
import io.github.yok.pauli.core.linearalgebra.EjmlPauliMatrixBackend;
import io.github.yok.pauli.core.linearalgebra.PauliMatrixBackend;
import io.github.yok.pauli.core.operator.SparsePauliOperator;
import io.github.yok.pauli.out.CsvResultWriter;
import io.github.yok.pauli.out.ResultWriter;
import io.github.yok.pauli.text.PauliStrings;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * スタビライザ符号のシンドローム計算と演算子合成の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class PauliAlgebraConfiguration {

    /**
     * pauli-algebra の設定値（pauli.*）です。
     */
    private final PauliProperties p;

    /**
     * スタビライザ生成元から、シンドローム抽出器を生成します。
     *
     * @return シンドローム抽出器です
     * @throws IllegalArgumentException スタビライザの書式が不正な場合に発生します
     */
    @Bean
    public SyndromeExtractor syndromeExtractor() {
        List<SparsePauliOperator> stabilizers = new ArrayList<>();
        for (String s : p.getCode().getStabilizers()) {
            stabilizers.add(PauliStrings.parseSparse(s));
        }
        return new CommutationSyndromeExtractor(stabilizers);
    }

    /**
     * 演算子列の合成ロジックを生成します。
     *
     * @return 合成ロジックです
     */
    @Bean
    public DenseOperatorComposer denseOperatorComposer() {
        return new DenseOperatorComposer();
    }

    /**
     * 行列表現バックエンドを生成します。
     *
     * @return 行列表現バックエンドです
     */
    @Bean
    public PauliMatrixBackend pauliMatrixBackend() {
        return new EjmlPauliMatrixBackend(p.getComposition().getMatrixMaxQubits());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
