package io.github.yok.booz.core.trig;

import lombok.Getter;
import org.ejml.data.DMatrixRMaj;

/**
 * 角度配列から cos/sin テーブルを生成するクラスです。
 *
 * <p>
 * m=0 は (1, 0)、m=1 は直接評価し、m≥2 は加法定理
 * {@code cos(mθ) = cos((m-1)θ)cosθ - sin((m-1)θ)sinθ}（sin も同様）による漸化式で求めます。
 * 格子角・Boozer 角・4 点評価のいずれも同じ生成器を使い、呼び出しごとに新しいテーブルを返します。
 * </p>
 *
 * <p>
 * {@code legacyToroidalGuard} が true の場合、トロイダル 1 次調和は ntor &gt; 1 のときだけ評価します
 * （ntor == 1 では 1 次列が 0 のまま残ります）。false の場合は ntor ≥ 1 で評価します。
 * </p>
 */
@Getter
public final class TrigTableBuilder {

    /**
     * 周期数 nfp です（トロイダル角に掛けます）。
     */
    private final int nfp;

    /**
     * トロイダル 1 次調和を ntor &gt; 1 のときだけ評価するかどうかです。
     */
    private final boolean legacyToroidalGuard;

    /**
     * 生成器を作成します。
     *
     * @param nfp 周期数です（1 以上）
     * @param legacyToroidalGuard トロイダル 1 次調和を ntor &gt; 1 のときだけ評価する場合は true です
     * @throws IllegalArgumentException nfp が 1 未満の場合に発生します
     */
    public TrigTableBuilder(int nfp, boolean legacyToroidalGuard) {
        if (nfp < 1) {
            throw new IllegalArgumentException("nfp は 1 以上が必要です: " + nfp);
        }
        this.nfp = nfp;
        this.legacyToroidalGuard = legacyToroidalGuard;
    }

    /**
     * 指定したトロイダル最大モードで 1 次調和が評価されないかを返します。
     *
     * @param ntor トロイダル最大モードです
     * @return 1 次調和列が 0 のまま残る場合は true です
     */
    public boolean skipsFirstToroidalHarmonic(int ntor) {
        return ntor >= 1 && !evaluatesFirstToroidalHarmonic(ntor);
    }

    /**
     * cos/sin テーブルを生成します。
     *
     * @param theta ポロイダル角の配列です（null 不可）
     * @param zeta トロイダル角の配列です（theta と同じ長さ）
     * @param mpol ポロイダル最大モードです（0 以上）
     * @param ntor トロイダル最大モードです（0 以上）
     * @return 新しく確保したテーブルです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public TrigTables build(double[] theta, double[] zeta, int mpol, int ntor) {
        if (theta == null || zeta == null) {
            throw new IllegalArgumentException("theta/zeta は null 不可です");
        }
        if (theta.length != zeta.length) {
            throw new IllegalArgumentException(
                    "theta と zeta の長さが一致しません: " + theta.length + " vs " + zeta.length);
        }
        if (mpol < 0 || ntor < 0) {
            throw new IllegalArgumentException("mpol/ntor は 0 以上が必要です: " + mpol + ", " + ntor);
        }

        int points = theta.length;
        DMatrixRMaj cosm = new DMatrixRMaj(points, mpol + 1);
        DMatrixRMaj sinm = new DMatrixRMaj(points, mpol + 1);
        DMatrixRMaj cosn = new DMatrixRMaj(points, ntor + 1);
        DMatrixRMaj sinn = new DMatrixRMaj(points, ntor + 1);

        fillHarmonics(cosm, sinm, theta, 1.0, mpol >= 1);
        fillHarmonics(cosn, sinn, zeta, nfp, evaluatesFirstToroidalHarmonic(ntor));

        return new TrigTables(cosm, sinm, cosn, sinn);
    }

    /**
     * トロイダル 1 次調和を評価するかどうかを返します。
     *
     * @param ntor トロイダル最大モードです
     * @return 評価する場合は true です
     */
    private boolean evaluatesFirstToroidalHarmonic(int ntor) {
        return legacyToroidalGuard ? ntor > 1 : ntor >= 1;
    }

    /**
     * 0 次・1 次を設定し、2 次以降を漸化式で埋めます。
     *
     * @param cos cos テーブルです
     * @param sin sin テーブルです
     * @param angle 角度配列です
     * @param scale 角度に掛ける係数です
     * @param evaluateFirst 1 次調和を直接評価するかどうかです
     */
    private static void fillHarmonics(DMatrixRMaj cos, DMatrixRMaj sin, double[] angle,
            double scale, boolean evaluateFirst) {
        int maxMode = cos.numCols - 1;
        for (int k = 0; k < angle.length; k++) {
            cos.unsafe_set(k, 0, 1.0);
            sin.unsafe_set(k, 0, 0.0);
            if (maxMode < 1) {
                continue;
            }
            if (evaluateFirst) {
                cos.unsafe_set(k, 1, Math.cos(angle[k] * scale));
                sin.unsafe_set(k, 1, Math.sin(angle[k] * scale));
            }

            double c1 = cos.unsafe_get(k, 1);
            double s1 = sin.unsafe_get(k, 1);
            for (int m = 2; m <= maxMode; m++) {
                double cPrev = cos.unsafe_get(k, m - 1);
                double sPrev = sin.unsafe_get(k, m - 1);
                cos.unsafe_set(k, m, cPrev * c1 - sPrev * s1);
                sin.unsafe_set(k, m, sPrev * c1 + cPrev * s1);
            }
        }
    }
}
