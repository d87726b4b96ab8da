package io.github.yok.booz.core.transform;

import io.github.yok.booz.core.grid.EvaluationGrid;
import io.github.yok.booz.core.mode.BoozerModeSet;
import io.github.yok.booz.core.trig.TrigTableBuilder;
import io.github.yok.booz.core.trig.TrigTables;

/**
 * 合成した |B| の Boozer 級数を 4 つの対称点で評価するクラスです。
 *
 * <p>
 * 格子の角 (0,0), (π,0), (0,π/nfp), (π,π/nfp) に角度補正場を加えた Boozer 角で評価します。
 * 同じ点の実空間 |B| と一致するはずなので、調和合成の独立な検算に使います。
 * </p>
 */
public final class AngleSampler {

    /**
     * 評価点数です。
     */
    public static final int CORNER_COUNT = 4;

    private final BoozerModeSet modes;

    private final EvaluationGrid grid;

    private final TrigTableBuilder tableBuilder;

    /**
     * 評価器を生成します。
     *
     * @param modes Boozer モード集合です（null 不可）
     * @param grid 評価格子です（null 不可）
     * @param tableBuilder テーブル生成器です（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public AngleSampler(BoozerModeSet modes, EvaluationGrid grid, TrigTableBuilder tableBuilder) {
        if (modes == null || grid == null || tableBuilder == null) {
            throw new IllegalArgumentException("modes/grid/tableBuilder は null 不可です");
        }
        this.modes = modes;
        this.grid = grid;
        this.tableBuilder = tableBuilder;
    }

    /**
     * 4 つの対称点の Boozer 角を求めます。
     *
     * @param solution 直線磁力線角の解です（null 不可）
     * @return 対称点の Boozer 角です
     */
    public CornerAngles cornerAngles(StraightFieldLineSolution solution) {
        if (solution == null) {
            throw new IllegalArgumentException("solution は null 不可です");
        }
        double[] uboz = solution.getUboz();
        double[] vboz = solution.getVboz();

        int halfPeriod = grid.nv2() - 1;
        int lastRow = grid.lastRowStart();
        int[] points = {0, lastRow, halfPeriod, lastRow + halfPeriod};
        double piu = grid.theta()[lastRow];
        double piv = grid.zeta()[halfPeriod];

        double[] u = new double[CORNER_COUNT];
        double[] v = new double[CORNER_COUNT];
        u[0] = uboz[points[0]];
        v[0] = vboz[points[0]];
        u[1] = piu + uboz[points[1]];
        v[1] = vboz[points[1]];
        u[2] = uboz[points[2]];
        v[2] = piv + vboz[points[2]];
        u[3] = piu + uboz[points[3]];
        v[3] = piv + vboz[points[3]];

        return new CornerAngles(u, v, points);
    }

    /**
     * 面 js の |B| 級数を対称点で評価します。
     *
     * @param spectra Boozer 振幅テーブルです（null 不可）
     * @param js 面インデックスです
     * @param angles 評価する Boozer 角です（null 不可）
     * @return 各点の |B| です
     */
    public double[] sample(BoozerSpectra spectra, int js, CornerAngles angles) {
        if (spectra == null || angles == null) {
            throw new IllegalArgumentException("spectra/angles は null 不可です");
        }
        double[] bmnc = BoozerSpectra.column(spectra.getBmnc(), js);
        return evaluate(bmnc, angles.getU(), angles.getV());
    }

    /**
     * cos 級数 {@code Σ bmnc·cos(m·u - xn·v)} を任意の角度で評価します。
     *
     * @param bmnc モード振幅です（長さ mnboz）
     * @param u Boozer ポロイダル角です
     * @param v Boozer トロイダル角です（u と同じ長さ）
     * @return 各点の値です
     */
    public double[] evaluate(double[] bmnc, double[] u, double[] v) {
        if (bmnc == null || bmnc.length != modes.size()) {
            throw new IllegalArgumentException("bmnc は長さ " + modes.size() + " の配列が必要です");
        }
        TrigTables tables = tableBuilder.build(u, v, modes.mboz(), modes.nboz());

        double[] out = new double[u.length];
        for (int a = 0; a < u.length; a++) {
            for (int mn = 0; mn < modes.size(); mn++) {
                double sign = Math.signum(modes.xn(mn));
                out[a] += bmnc[mn] * tables.cosMn(a, modes.m(mn), modes.toroidalHarmonic(mn), sign);
            }
        }
        return out;
    }
}
