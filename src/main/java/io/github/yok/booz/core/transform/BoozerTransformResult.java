package io.github.yok.booz.core.transform;

import io.github.yok.booz.core.equilibrium.EquilibriumData;
import io.github.yok.booz.core.mode.BoozerModeSet;
import lombok.Value;

/**
 * Boozer 変換の結果を保持するクラスです。
 */
@Value
public class BoozerTransformResult {

    /**
     * 入力の平衡データ（軸補正前）です。
     */
    EquilibriumData equilibrium;

    /**
     * Boozer モード集合です。
     */
    BoozerModeSet modes;

    /**
     * Boozer 振幅テーブルです。
     */
    BoozerSpectra spectra;

    /**
     * 面ごとのヤコビアン係数 jacfac です（面 0 は 0）。
     */
    double[] jacfac;

    /**
     * 面ごとの対称点 4 点での Boozer 級数 |B| です（面 0 は 0）。
     */
    double[][] cornerFieldStrength;

    /**
     * 面ごとの対称点での |B|（級数）と実空間 |B| の最大差です（面 0 は 0）。
     */
    double[] cornerDeviation;

    /**
     * 計算対象の面番号（1 始まり、2..ns）を返します。
     *
     * @return 面番号の配列です
     */
    public int[] computedSurfaceNumbers() {
        int ns = equilibrium.getNs();
        int[] out = new int[ns - 1];
        for (int j = 1; j < ns; j++) {
            out[j - 1] = j + 1;
        }
        return out;
    }
}
