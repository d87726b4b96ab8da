package io.github.yok.booz.core.transform;

import lombok.Value;

/**
 * 直線磁力線角の解（角度補正場とヤコビアン）を保持するクラスです。
 */
@Value
public class StraightFieldLineSolution {

    /**
     * ヤコビアン係数 g + ι·I です。
     */
    double jacfac;

    /**
     * ポロイダル角補正 uboz（θ_B = θ + uboz）です。
     */
    double[] uboz;

    /**
     * トロイダル角補正 vboz（ζ_B = ζ + vboz）です。
     */
    double[] vboz;

    /**
     * 格子点ごとの変換ヤコビアンです。
     */
    double[] xjac;

    /**
     * jacfac が 0 で、解が非有限値を含むかどうかです。
     */
    boolean degenerate;

    /**
     * xjac の最小値です。
     */
    double minJacobian;

    /**
     * xjac の最大値です。
     */
    double maxJacobian;

    /**
     * xjac が全格子点で同じ符号（0 を含まない）かどうかを返します。
     *
     * @return 符号が一定の場合は true です
     */
    public boolean hasConsistentJacobianSign() {
        return minJacobian > 0.0 || maxJacobian < 0.0;
    }
}
