package io.github.yok.booz.core.transform;

import io.github.yok.booz.core.equilibrium.EquilibriumData;
import io.github.yok.booz.core.trig.TrigTables;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;

/**
 * ネイティブ（VMEC）基底の Fourier 振幅を評価格子上の実空間量へ逆変換するクラスです。
 *
 * <p>
 * R, Z は面 js と js-1 の振幅を径方向に補間して合成し、パリティ（m の偶奇）ごとに分けて返します。
 * 奇パリティでは振幅を √s で割ってから補間します（奇数 m は軸で √s のように消えるため）。
 * λ は面 js の振幅をそのまま使います。
 * </p>
 *
 * <p>
 * 面 1 の奇パリティ補間は面 0 の m=1 振幅を参照するため、入力には
 * {@link io.github.yok.booz.core.equilibrium.AxisCorrection} 適用済みのデータを渡してください。
 * </p>
 */
@Getter
public final class RealSpaceSynthesizer {

    /**
     * 軸補正済みの平衡データです。
     */
    private final EquilibriumData data;

    /**
     * ネイティブモード用の cos/sin テーブル（格子角）です。
     */
    private final TrigTables nativeTables;

    /**
     * Nyquist モード用の cos/sin テーブル（格子角）です。
     */
    private final TrigTables nyquistTables;

    /**
     * 各面の √s です。
     */
    private final double[] sqrtS;

    /**
     * 逆変換器を生成します。
     *
     * @param data 軸補正済みの平衡データです（null 不可）
     * @param nativeTables ネイティブモード用テーブルです（null 不可）
     * @param nyquistTables Nyquist モード用テーブルです（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public RealSpaceSynthesizer(EquilibriumData data, TrigTables nativeTables,
            TrigTables nyquistTables) {
        if (data == null) {
            throw new IllegalArgumentException("data は null 不可です");
        }
        if (nativeTables == null || nyquistTables == null) {
            throw new IllegalArgumentException("nativeTables/nyquistTables は null 不可です");
        }
        if (nativeTables.pointCount() != nyquistTables.pointCount()) {
            throw new IllegalArgumentException("テーブルの評価点数が一致しません: "
                    + nativeTables.pointCount() + " vs " + nyquistTables.pointCount());
        }
        this.data = data;
        this.nativeTables = nativeTables;
        this.nyquistTables = nyquistTables;
        this.sqrtS = data.sqrtS();
    }

    /**
     * 両パリティを合成し、1 面分の実空間幾何量を返します。
     *
     * @param js 面インデックスです（1 以上 ns 未満）
     * @return 実空間幾何量です
     * @throws IllegalArgumentException js が範囲外の場合に発生します
     */
    public RealSpaceGeometry synthesizeGeometry(int js) {
        ParityFields even = synthesizeParity(js, Parity.EVEN);
        ParityFields odd = synthesizeParity(js, Parity.ODD);

        int points = nativeTables.pointCount();
        double[] lambda = new double[points];
        double[] lt = new double[points];
        double[] lz = new double[points];
        for (int k = 0; k < points; k++) {
            lambda[k] = even.getLambda()[k] + odd.getLambda()[k];
            lt[k] = even.getDLambdaDTheta()[k] + odd.getDLambdaDTheta()[k];
            lz[k] = even.getDLambdaDZeta()[k] + odd.getDLambdaDZeta()[k];
        }

        return new RealSpaceGeometry(even.getR(), even.getZ(), odd.getR(), odd.getZ(), lambda, lt,
                lz);
    }

    /**
     * 指定パリティのモードだけを合成します。
     *
     * @param js 面インデックスです（1 以上 ns 未満）
     * @param parity パリティです（null 不可）
     * @return パリティ別の実空間量です
     * @throws IllegalArgumentException js が範囲外、または parity が null の場合に発生します
     */
    public ParityFields synthesizeParity(int js, Parity parity) {
        requireSurface(js);
        if (parity == null) {
            throw new IllegalArgumentException("parity は null 不可です");
        }

        // 径方向補間の重み（偶: 単純平均、奇: √s で割った平均、面 1 は軸側を補正済み振幅で扱う）
        double t1;
        double t2;
        if (parity == Parity.EVEN) {
            t1 = 1.0;
            t2 = 1.0;
        } else if (js > 1) {
            t1 = 1.0 / sqrtS[js];
            t2 = 1.0 / sqrtS[js - 1];
        } else {
            t1 = 1.0 / sqrtS[1];
            t2 = 1.0;
        }
        t1 /= 2.0;
        t2 /= 2.0;

        int points = nativeTables.pointCount();
        double[] r = new double[points];
        double[] z = new double[points];
        double[] lambda = new double[points];
        double[] lt = new double[points];
        double[] lz = new double[points];

        DMatrixRMaj rmnc = data.getRmnc();
        DMatrixRMaj zmns = data.getZmns();
        DMatrixRMaj lmns = data.getLmns();
        double[] xm = data.getXm();
        double[] xn = data.getXn();
        int nfp = data.getNfp();

        for (int mn = 0; mn < xm.length; mn++) {
            int m = (int) xm[mn];
            if (!parity.matches(m)) {
                continue;
            }
            int n = (int) Math.round(Math.abs(xn[mn] / nfp));
            double sign = Math.signum(xn[mn]);

            double rc = t1 * rmnc.get(js, mn) + t2 * rmnc.get(js - 1, mn);
            double zs = t1 * zmns.get(js, mn) + t2 * zmns.get(js - 1, mn);
            double lc = lmns.get(js, mn);

            for (int k = 0; k < points; k++) {
                double tcos = nativeTables.cosMn(k, m, n, sign);
                double tsin = nativeTables.sinMn(k, m, n, sign);
                r[k] += tcos * rc;
                z[k] += tsin * zs;
                lt[k] += tcos * lc * m;
                lz[k] -= tcos * lc * xn[mn];
                lambda[k] += tsin * lc;
            }
        }

        return new ParityFields(r, z, lambda, lt, lz);
    }

    /**
     * 共変ポテンシャルの角度微分と |B| を Nyquist モードで合成します。
     *
     * @param js 面インデックスです（1 以上 ns 未満）
     * @param potential 同じ面の共変ポテンシャルです（null 不可）
     * @return 共変ポテンシャル場です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CovariantFields synthesizeCovariant(int js, CovariantPotential potential) {
        requireSurface(js);
        if (potential == null) {
            throw new IllegalArgumentException("potential は null 不可です");
        }

        int points = nyquistTables.pointCount();
        double[] w = new double[points];
        double[] wt = new double[points];
        double[] wz = new double[points];
        double[] bmod = new double[points];

        double[] xm = data.getXmNyq();
        double[] xn = data.getXnNyq();
        double[] pmns = potential.getPmns();
        DMatrixRMaj bmnc = data.getBmnc();
        int nfp = data.getNfp();

        for (int mn = 0; mn < xm.length; mn++) {
            int m = (int) xm[mn];
            int n = (int) Math.round(Math.abs(xn[mn] / nfp));
            double sign = Math.signum(xn[mn]);
            double p = pmns[mn];
            double b = bmnc.get(js, mn);

            for (int k = 0; k < points; k++) {
                double tcos = nyquistTables.cosMn(k, m, n, sign);
                double tsin = nyquistTables.sinMn(k, m, n, sign);
                w[k] += tsin * p;
                wt[k] += tcos * p * xm[mn];
                wz[k] -= tcos * p * xn[mn];
                bmod[k] += tcos * b;
            }
        }

        return new CovariantFields(w, wt, wz, bmod);
    }

    private void requireSurface(int js) {
        if (js <= 0) {
            throw new IllegalArgumentException("面インデックスは 1 以上が必要です（軸は計算対象外）: js=" + js);
        }
        if (js >= data.getNs()) {
            throw new IllegalArgumentException(
                    "面インデックスが範囲外です: js=" + js + ", ns=" + data.getNs());
        }
    }
}
