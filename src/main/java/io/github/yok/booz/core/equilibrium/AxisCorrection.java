package io.github.yok.booz.core.equilibrium;

import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 磁気軸（面 0）の m=1 振幅を外挿で置き換えた平衡データを作るクラスです。
 *
 * <p>
 * 奇数 m の振幅は軸近傍で √s に比例するため、面 1 の奇パリティ補間では軸の値として
 * {@code 2·a[1]/√s[1] - a[2]/√s[2]} を使います。面ループの開始前に 1 回だけ実行し、
 * 入力データは変更せずに補正済みのコピーを返します。
 * </p>
 */
@Slf4j
public final class AxisCorrection {

    private AxisCorrection() {
    }

    /**
     * 軸の m=1 振幅（rmnc, zmns）を外挿したコピーを返します。
     *
     * @param data 平衡データです（null 不可）
     * @return 補正済みの平衡データです。ns &lt; 3 の場合は入力をそのまま返します
     * @throws IllegalArgumentException data が null の場合に発生します
     */
    public static EquilibriumData apply(EquilibriumData data) {
        if (data == null) {
            throw new IllegalArgumentException("data は null 不可です");
        }
        if (data.getNs() < 3) {
            log.warn("面数が 3 未満のため、軸の m=1 外挿を行いません。ns={}", data.getNs());
            return data;
        }

        double[] sqrtS = data.sqrtS();
        DMatrixRMaj rmnc = data.getRmnc().copy();
        DMatrixRMaj zmns = data.getZmns().copy();
        double[] xm = data.getXm();

        int corrected = 0;
        for (int mn = 0; mn < xm.length; mn++) {
            if (Math.round(xm[mn]) != 1) {
                continue;
            }
            rmnc.set(0, mn, extrapolate(rmnc, mn, sqrtS));
            zmns.set(0, mn, extrapolate(zmns, mn, sqrtS));
            corrected++;
        }

        log.debug("軸の m=1 振幅を外挿しました。対象モード数={}", corrected);
        return data.toBuilder().rmnc(rmnc).zmns(zmns).build();
    }

    private static double extrapolate(DMatrixRMaj table, int mn, double[] sqrtS) {
        return 2.0 * table.get(1, mn) / sqrtS[1] - table.get(2, mn) / sqrtS[2];
    }
}
