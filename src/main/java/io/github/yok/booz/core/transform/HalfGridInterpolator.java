package io.github.yok.booz.core.transform;

/**
 * 偶奇パリティの実空間座標を合成し、半メッシュ面の座標を求めるクラスです。
 *
 * <p>
 * {@code x½ = even + √(hs·|js - 0.5|)·odd} です（hs は等間隔の s 刻み）。
 * 奇パリティ側で割った √s を半メッシュ位置の値で戻します。
 * </p>
 */
public final class HalfGridInterpolator {

    /**
     * 径方向刻み hs です。
     */
    private final double radialStep;

    /**
     * 補間器を生成します。
     *
     * @param radialStep 径方向刻み hs です（正）
     * @throws IllegalArgumentException radialStep が正でない場合に発生します
     */
    public HalfGridInterpolator(double radialStep) {
        if (!(radialStep > 0.0)) {
            throw new IllegalArgumentException("radialStep は正である必要があります: " + radialStep);
        }
        this.radialStep = radialStep;
    }

    /**
     * 面 js の半メッシュ係数 √(hs·|js - 0.5|) を返します。
     *
     * @param js 面インデックスです
     * @return 係数です
     */
    public double halfMeshFactor(int js) {
        return Math.sqrt(radialStep * Math.abs(js - 0.5));
    }

    /**
     * 偶奇成分を合成します。
     *
     * @param even 偶パリティ成分です（null 不可）
     * @param odd 奇パリティ成分です（even と同じ長さ）
     * @param js 面インデックスです
     * @return 半メッシュ面の座標です
     * @throws IllegalArgumentException 配列が不正な場合に発生します
     */
    public double[] interpolate(double[] even, double[] odd, int js) {
        if (even == null || odd == null || even.length != odd.length) {
            throw new IllegalArgumentException("even/odd は同じ長さの配列が必要です");
        }
        double shalf = halfMeshFactor(js);
        double[] out = new double[even.length];
        for (int k = 0; k < even.length; k++) {
            out[k] = even[k] + shalf * odd[k];
        }
        return out;
    }
}
