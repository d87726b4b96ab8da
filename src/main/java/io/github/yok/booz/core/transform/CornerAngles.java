package io.github.yok.booz.core.transform;

import lombok.Value;

/**
 * 対称点 4 点の Boozer 角と、対応する格子点インデックスを保持するクラスです。
 *
 * <p>
 * 並びは (θ, ζ) = (0, 0), (π, 0), (0, π/nfp), (π, π/nfp) です。
 * </p>
 */
@Value
public class CornerAngles {

    /**
     * Boozer ポロイダル角 u です。
     */
    double[] u;

    /**
     * Boozer トロイダル角 v です。
     */
    double[] v;

    /**
     * 対応する評価格子点のインデックスです。
     */
    int[] gridPoints;
}
