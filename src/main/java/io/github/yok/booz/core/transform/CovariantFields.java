package io.github.yok.booz.core.transform;

import lombok.Value;

/**
 * 1 面分の共変ポテンシャル w とその角度微分、および |B| の実空間値を保持するクラスです。
 */
@Value
public class CovariantFields {

    /**
     * w です。
     */
    double[] w;

    /**
     * ∂w/∂θ です。
     */
    double[] dwDTheta;

    /**
     * ∂w/∂ζ です。
     */
    double[] dwDZeta;

    /**
     * |B| です。
     */
    double[] bmod;
}
