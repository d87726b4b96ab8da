package io.github.yok.booz.core.equilibrium;

import lombok.Builder;
import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * VMEC 平衡の Fourier 表現（読み取り専用）を保持するクラスです。
 *
 * <p>
 * 振幅テーブルは [面 × モード] の密行列で、面 0 が磁気軸です。
 * rmnc/zmns/lmns はネイティブモード（xm, xn）、bmnc/bsubumnc/bsubvmnc は Nyquist モード（xmNyq, xnNyq）で
 * インデックスされます。トロイダルモード番号は nfp 倍済みの値です。
 * </p>
 */
@Value
public class EquilibriumData {

    /**
     * 周期数 nfp です。
     */
    int nfp;

    /**
     * ネイティブのポロイダルモード数 mpol です（m は 0 以上 mpol 未満）。
     */
    int mpol;

    /**
     * ネイティブのトロイダルモード上限 ntor です。
     */
    int ntor;

    /**
     * Nyquist のポロイダルモード上限です。
     */
    int mnyq;

    /**
     * Nyquist のトロイダルモード上限です。
     */
    int nnyq;

    /**
     * 面の数 ns です。
     */
    int ns;

    /**
     * ネイティブモードのポロイダルモード番号です。
     */
    double[] xm;

    /**
     * ネイティブモードのトロイダルモード番号（nfp 倍済み）です。
     */
    double[] xn;

    /**
     * Nyquist モードのポロイダルモード番号です。
     */
    double[] xmNyq;

    /**
     * Nyquist モードのトロイダルモード番号（nfp 倍済み）です。
     */
    double[] xnNyq;

    /**
     * R の cos 振幅 [ns × mnmax] です。
     */
    DMatrixRMaj rmnc;

    /**
     * Z の sin 振幅 [ns × mnmax] です。
     */
    DMatrixRMaj zmns;

    /**
     * λ の sin 振幅 [ns × mnmax] です。
     */
    DMatrixRMaj lmns;

    /**
     * |B| の cos 振幅 [ns × mnmax_nyq] です。
     */
    DMatrixRMaj bmnc;

    /**
     * 共変成分 B_u の cos 振幅 [ns × mnmax_nyq] です。
     */
    DMatrixRMaj bsubumnc;

    /**
     * 共変成分 B_v の cos 振幅 [ns × mnmax_nyq] です。
     */
    DMatrixRMaj bsubvmnc;

    /**
     * 規格化トロイダル磁束 s です（面 0 が 0）。
     */
    double[] s;

    /**
     * 回転変換 ι です。
     */
    double[] iota;

    double[] pres;

    double[] betaVol;

    double[] phi;

    double[] phip;

    /**
     * トロイダル電流関数 bvco です。
     */
    double[] bvco;

    /**
     * ポロイダル電流関数 buco です。
     */
    double[] buco;

    double aspect;

    double rmaxSurf;

    double rminSurf;

    double zmaxSurf;

    double betaxis;

    /**
     * 平衡データを生成します。
     *
     * <p>
     * s を省略した場合は等間隔 {@code j/(ns-1)} を、pres などの補助プロファイルを省略した場合は 0 を使います。
     * </p>
     *
     * @throws IllegalArgumentException 配列長やモード番号が不整合な場合に発生します
     */
    @Builder(toBuilder = true)
    public EquilibriumData(int nfp, int mpol, int ntor, int mnyq, int nnyq, int ns, double[] xm,
            double[] xn, double[] xmNyq, double[] xnNyq, DMatrixRMaj rmnc, DMatrixRMaj zmns,
            DMatrixRMaj lmns, DMatrixRMaj bmnc, DMatrixRMaj bsubumnc, DMatrixRMaj bsubvmnc,
            double[] s, double[] iota, double[] pres, double[] betaVol, double[] phi, double[] phip,
            double[] bvco, double[] buco, double aspect, double rmaxSurf, double rminSurf,
            double zmaxSurf, double betaxis) {

        if (nfp < 1) {
            throw new IllegalArgumentException("nfp は 1 以上が必要です: " + nfp);
        }
        if (mpol < 1 || ntor < 0) {
            throw new IllegalArgumentException("mpol は 1 以上、ntor は 0 以上が必要です: " + mpol + ", " + ntor);
        }
        if (mnyq < 0 || nnyq < 0) {
            throw new IllegalArgumentException("mnyq/nnyq は 0 以上が必要です: " + mnyq + ", " + nnyq);
        }
        if (ns < 2) {
            throw new IllegalArgumentException("ns は 2 以上が必要です: " + ns);
        }

        requireModes("xm/xn", xm, xn, mpol - 1, ntor, nfp);
        requireModes("xmNyq/xnNyq", xmNyq, xnNyq, mnyq, nnyq, nfp);

        requireTable("rmnc", rmnc, ns, xm.length);
        requireTable("zmns", zmns, ns, xm.length);
        requireTable("lmns", lmns, ns, xm.length);
        requireTable("bmnc", bmnc, ns, xmNyq.length);
        requireTable("bsubumnc", bsubumnc, ns, xmNyq.length);
        requireTable("bsubvmnc", bsubvmnc, ns, xmNyq.length);

        requireProfile("iota", iota, ns);

        this.nfp = nfp;
        this.mpol = mpol;
        this.ntor = ntor;
        this.mnyq = mnyq;
        this.nnyq = nnyq;
        this.ns = ns;
        this.xm = xm;
        this.xn = xn;
        this.xmNyq = xmNyq;
        this.xnNyq = xnNyq;
        this.rmnc = rmnc;
        this.zmns = zmns;
        this.lmns = lmns;
        this.bmnc = bmnc;
        this.bsubumnc = bsubumnc;
        this.bsubvmnc = bsubvmnc;
        this.s = (s != null) ? requireProfile("s", s, ns) : uniformFlux(ns);
        this.iota = iota;
        this.pres = profileOrZero("pres", pres, ns);
        this.betaVol = profileOrZero("betaVol", betaVol, ns);
        this.phi = profileOrZero("phi", phi, ns);
        this.phip = profileOrZero("phip", phip, ns);
        this.bvco = profileOrZero("bvco", bvco, ns);
        this.buco = profileOrZero("buco", buco, ns);
        this.aspect = aspect;
        this.rmaxSurf = rmaxSurf;
        this.rminSurf = rminSurf;
        this.zmaxSurf = zmaxSurf;
        this.betaxis = betaxis;
    }

    /**
     * ネイティブモード数 mnmax を返します。
     *
     * @return モード数です
     */
    public int modeCount() {
        return xm.length;
    }

    /**
     * Nyquist モード数 mnmax_nyq を返します。
     *
     * @return モード数です
     */
    public int nyquistModeCount() {
        return xmNyq.length;
    }

    /**
     * 各面の √s を返します。
     *
     * @return √s の配列です
     */
    public double[] sqrtS() {
        double[] out = new double[ns];
        for (int j = 0; j < ns; j++) {
            out[j] = Math.sqrt(s[j]);
        }
        return out;
    }

    /**
     * 等間隔の径方向刻み hs = 1/(ns-1) を返します。
     *
     * @return 刻み幅です
     */
    public double radialStep() {
        return 1.0 / (ns - 1);
    }

    private static void requireModes(String name, double[] m, double[] n, int maxM, int maxN,
            int nfp) {
        if (m == null || n == null) {
            throw new IllegalArgumentException(name + " は null 不可です");
        }
        if (m.length != n.length || m.length == 0) {
            throw new IllegalArgumentException(
                    name + " の長さが不正です: " + m.length + " vs " + n.length);
        }
        for (int i = 0; i < m.length; i++) {
            long harmonic = Math.round(Math.abs(n[i] / nfp));
            if (m[i] < 0 || m[i] > maxM || harmonic > maxN) {
                throw new IllegalArgumentException(name + " のモード番号が上限を超えています: index=" + i
                        + ", m=" + m[i] + ", n=" + n[i] + "（上限 m=" + maxM + ", n=" + maxN + "）");
            }
        }
    }

    private static void requireTable(String name, DMatrixRMaj table, int rows, int cols) {
        if (table == null) {
            throw new IllegalArgumentException(name + " は null 不可です");
        }
        if (table.numRows != rows || table.numCols != cols) {
            throw new IllegalArgumentException(name + " の形状が不正です: " + table.numRows + "x"
                    + table.numCols + "（期待値 " + rows + "x" + cols + "）");
        }
    }

    private static double[] requireProfile(String name, double[] profile, int ns) {
        if (profile == null || profile.length != ns) {
            throw new IllegalArgumentException(name + " は長さ ns=" + ns + " の配列が必要です");
        }
        return profile;
    }

    private static double[] profileOrZero(String name, double[] profile, int ns) {
        return (profile == null) ? new double[ns] : requireProfile(name, profile, ns);
    }

    private static double[] uniformFlux(int ns) {
        double[] out = new double[ns];
        for (int j = 0; j < ns; j++) {
            out[j] = j / (double) (ns - 1);
        }
        return out;
    }
}
