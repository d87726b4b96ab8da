package io.github.yok.booz.core.transform;

import lombok.Value;

/**
 * 1 面分の実空間幾何量（R, Z の偶奇成分と λ）を保持するクラスです。
 */
@Value
public class RealSpaceGeometry {

    /**
     * 偶数 m による R です。
     */
    double[] rEven;

    /**
     * 偶数 m による Z です。
     */
    double[] zEven;

    /**
     * 奇数 m による R（√s で割った振幅による）です。
     */
    double[] rOdd;

    /**
     * 奇数 m による Z（√s で割った振幅による）です。
     */
    double[] zOdd;

    /**
     * λ（全モードの和）です。
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
