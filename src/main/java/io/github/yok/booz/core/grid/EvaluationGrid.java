package io.github.yok.booz.core.grid;

/**
 * 1 周期分の (θ, ζ) 評価格子を表すクラスです。
 *
 * <p>
 * θ は [0, π] を nu3 点、ζ は [0, 2π/nfp) を nv 点で刻み、インデックス変換は
 * {@code index = lt * nv + lz}（θ が外側ループ）です。
 * ステラレータ対称性を使う半区間求積のため、θ=0 と θ=π の行は後段で半分の重みになります。
 * </p>
 */
public final class EvaluationGrid {

    /**
     * θ 方向の全周分割数 nu_boz です。
     */
    private final int nu;

    /**
     * ζ 方向の分割数 nv_boz です。
     */
    private final int nv;

    /**
     * θ 方向の半周点数 nu2_b（両端を含む）です。
     */
    private final int nu2;

    /**
     * ζ 方向の半周インデックス nv2_b です。
     */
    private final int nv2;

    /**
     * 周期数です。
     */
    private final int nfp;

    /**
     * 各格子点の θ です。
     */
    private final double[] theta;

    /**
     * 各格子点の ζ です。
     */
    private final double[] zeta;

    /**
     * Boozer モード上限から評価格子を生成します。
     *
     * @param mboz ポロイダルモード数の上限です（1 以上）
     * @param nboz トロイダルモード番号の上限です（0 以上）
     * @param nfp 周期数です（1 以上）
     * @throws IllegalArgumentException 引数が範囲外の場合に発生します
     */
    public EvaluationGrid(int mboz, int nboz, int nfp) {
        if (mboz < 1) {
            throw new IllegalArgumentException("mboz は 1 以上が必要です: " + mboz);
        }
        if (nboz < 0) {
            throw new IllegalArgumentException("nboz は 0 以上が必要です: " + nboz);
        }
        if (nfp < 1) {
            throw new IllegalArgumentException("nfp は 1 以上が必要です: " + nfp);
        }
        this.nfp = nfp;
        this.nu = 2 * (2 * mboz + 1);
        this.nv = 2 * (2 * nboz + 1);
        this.nu2 = nu / 2 + 1;
        this.nv2 = nv / 2 + 1;

        int nu3 = nu2;
        int points = nu3 * nv;
        double dth = Math.PI / (nu3 - 1);
        double dzt = 2.0 * Math.PI / (nv * nfp);

        this.theta = new double[points];
        this.zeta = new double[points];
        int k = 0;
        for (int lt = 0; lt < nu3; lt++) {
            for (int lz = 0; lz < nv; lz++) {
                theta[k] = lt * dth;
                zeta[k] = lz * dzt;
                k++;
            }
        }
    }

    /**
     * 格子点数 nunv を返します。
     *
     * @return 格子点数です
     */
    public int pointCount() {
        return theta.length;
    }

    public int nu() {
        return nu;
    }

    public int nv() {
        return nv;
    }

    public int nu2() {
        return nu2;
    }

    public int nv2() {
        return nv2;
    }

    public int nfp() {
        return nfp;
    }

    /**
     * θ 行 lt、ζ 列 lz の格子点インデックスを返します。
     *
     * @param lt θ 行（0 以上 nu2 未満）です
     * @param lz ζ 列（0 以上 nv 未満）です
     * @return 格子点インデックスです
     */
    public int indexOf(int lt, int lz) {
        return lt * nv + lz;
    }

    /**
     * θ=π の行の先頭インデックスを返します。
     *
     * @return 先頭インデックスです
     */
    public int lastRowStart() {
        return nv * (nu2 - 1);
    }

    /**
     * θ 配列を返します。
     *
     * <p>
     * 共有配列をそのまま返すため、呼び出し側で変更しないでください。
     * </p>
     *
     * @return θ 配列です
     */
    public double[] theta() {
        return theta;
    }

    /**
     * ζ 配列を返します（共有配列です）。
     *
     * @return ζ 配列です
     */
    public double[] zeta() {
        return zeta;
    }
}
