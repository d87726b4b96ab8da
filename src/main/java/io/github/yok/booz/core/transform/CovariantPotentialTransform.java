package io.github.yok.booz.core.transform;

import io.github.yok.booz.core.equilibrium.EquilibriumData;

/**
 * 共変磁場成分 (B_u, B_v) から共変ポテンシャル振幅を求めるクラスです。
 *
 * <p>
 * m≠0 のモードは {@code p = B_u/m}、m=0 かつ n≠0 のモードは {@code p = -B_v/n}、
 * (0,0) モードは p=0 とし、その B_v, B_u をそれぞれ g(s), I(s) として取り出します。
 * </p>
 */
public final class CovariantPotentialTransform {

    /**
     * 平衡データです。
     */
    private final EquilibriumData data;

    /**
     * 変換を生成します。
     *
     * @param data 平衡データです（null 不可）
     * @throws IllegalArgumentException data が null の場合に発生します
     */
    public CovariantPotentialTransform(EquilibriumData data) {
        if (data == null) {
            throw new IllegalArgumentException("data は null 不可です");
        }
        this.data = data;
    }

    /**
     * 指定した面の共変ポテンシャルを計算します。
     *
     * @param js 面インデックスです（1 以上 ns 未満）
     * @return 共変ポテンシャルです
     * @throws IllegalArgumentException js が範囲外の場合に発生します
     */
    public CovariantPotential transform(int js) {
        if (js <= 0 || js >= data.getNs()) {
            throw new IllegalArgumentException("面インデックスが範囲外です: js=" + js);
        }

        double[] xm = data.getXmNyq();
        double[] xn = data.getXnNyq();
        double[] pmns = new double[xm.length];
        double gpsi = 0.0;
        double ipsi = 0.0;

        for (int mn = 0; mn < xm.length; mn++) {
            double bsubu = data.getBsubumnc().get(js, mn);
            double bsubv = data.getBsubvmnc().get(js, mn);
            if ((int) xm[mn] != 0) {
                pmns[mn] = bsubu / xm[mn];
            } else if ((int) xn[mn] != 0) {
                pmns[mn] = -bsubv / xn[mn];
            } else {
                gpsi = bsubv;
                ipsi = bsubu;
            }
        }

        return new CovariantPotential(pmns, gpsi, ipsi);
    }
}
