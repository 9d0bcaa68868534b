package io.github.yok.pauli.core.pauli;

import io.github.yok.pauli.core.phase.Phase;
import lombok.Value;

/**
 * 位相付きの Pauli 積（補正位相と積の組）を保持するクラスです。
 */
@Value
public class PauliProduct {

    /**
     * 補正位相です。
     */
    Phase phase;

    /**
     * 位相を除いた積です。
     */
    Pauli pauli;
}
