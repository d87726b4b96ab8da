package io.github.yok.booz.core.transform;

import lombok.Value;

/**
 * 1 つのパリティについて合成した実空間量を保持するクラスです。
 *
 * <p>
 * λ とその微分はこのパリティに属するモードの寄与のみを含みます。
 * </p>
 */
@Value
public class ParityFields {

    /**
     * R です。
     */
    double[] r;

    /**
     * Z です。
     */
    double[] z;

    /**
     * λ です。
     */
    double[] lambda;

    /**
     * ∂λ/∂θ です。
     */
    double[] dLambdaDTheta;

    /**
     * ∂λ/∂ζ です。
     */
    double[] dLambdaDZeta;
}
