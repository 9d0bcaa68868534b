package io.github.yok.pauli.core.operator;

/**
 * 多量子ビット Pauli 演算子の構築・演算で検出される不正を表す例外の基底クラスです。
 *
 * <p>
 * 呼び出し側で回復可能な入力不正として扱うため、{@link IllegalArgumentException} を継承します。
 * </p>
 */
public abstract class PauliOperatorException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    protected PauliOperatorException(String message) {
        super(message);
    }
}
