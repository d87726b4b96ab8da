package io.github.yok.booz.core.transform;

import lombok.Value;

/**
 * 1 面分の共変ポテンシャル振幅と電流関数を保持するクラスです。
 */
@Value
public class CovariantPotential {

    /**
     * Nyquist モードごとのポテンシャル振幅 pmns です。
     */
    double[] pmns;

    /**
     * トロイダル共変電流関数 g(s)（B_v の (0,0) 成分）です。
     */
    double gpsi;

    /**
     * ポロイダル共変電流関数 I(s)（B_u の (0,0) 成分）です。
     */
    double ipsi;
}
