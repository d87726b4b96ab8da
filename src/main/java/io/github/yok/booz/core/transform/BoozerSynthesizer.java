package io.github.yok.booz.core.transform;

import io.github.yok.booz.core.grid.EvaluationGrid;
import io.github.yok.booz.core.mode.BoozerModeSet;
import io.github.yok.booz.core.trig.TrigTableBuilder;
import io.github.yok.booz.core.trig.TrigTables;

/**
 * 実空間量を Boozer 基底のモード振幅へ順変換（求積）するクラスです。
 *
 * <p>
 * Boozer 角 (θ + uboz, ζ + vboz) で cos/sin テーブルを作り直し、ヤコビアン xjac を掛けた基底関数と
 * 実空間量の積を全格子点で単純和します。θ=0 と θ=π の行は半区間求積の重複を避けるため重み 1/2 とし、
 * 最後にモードごとの規格化係数を掛けます。
 * </p>
 */
public final class BoozerSynthesizer {

    /**
     * 境界行に掛ける重みです。
     */
    private static final double BOUNDARY_ROW_WEIGHT = 0.5;

    /**
     * Boozer モード集合です。
     */
    private final BoozerModeSet modes;

    /**
     * 評価格子です。
     */
    private final EvaluationGrid grid;

    /**
     * Boozer 角でのテーブル生成器です。
     */
    private final TrigTableBuilder tableBuilder;

    /**
     * モードごとの規格化係数です。
     */
    private final double[] normalization;

    /**
     * 順変換器を生成します。
     *
     * @param modes Boozer モード集合です（null 不可）
     * @param grid 評価格子です（null 不可）
     * @param tableBuilder テーブル生成器です（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public BoozerSynthesizer(BoozerModeSet modes, EvaluationGrid grid,
            TrigTableBuilder tableBuilder) {
        if (modes == null || grid == null || tableBuilder == null) {
            throw new IllegalArgumentException("modes/grid/tableBuilder は null 不可です");
        }
        this.modes = modes;
        this.grid = grid;
        this.tableBuilder = tableBuilder;
        this.normalization = buildNormalization(modes, grid);
    }

    /**
     * 規格化係数 {@code 2/((nu2-1)·nv)} を作ります。(0,0) モードだけは半分です。
     *
     * @param modes モード集合です
     * @param grid 評価格子です
     * @return モードごとの係数です
     */
    private static double[] buildNormalization(BoozerModeSet modes, EvaluationGrid grid) {
        double fac = 2.0 / ((grid.nu2() - 1) * grid.nv());
        double[] scl = new double[modes.size()];
        for (int mn = 0; mn < scl.length; mn++) {
            boolean constantMode = modes.m(mn) == 0 && modes.xn(mn) == 0;
            scl[mn] = constantMode ? fac / 2.0 : fac;
        }
        return scl;
    }

    /**
     * 1 面分の Boozer 振幅を計算し、spectra の列 js に書き込みます。
     *
     * @param js 面インデックスです（1 以上 ns 未満）
     * @param bmod 実空間 |B| です
     * @param rHalf 半メッシュ面の R です
     * @param zHalf 半メッシュ面の Z です
     * @param solution 直線磁力線角の解です（null 不可）
     * @param spectra 書き込み先テーブルです（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 列 js が既に書き込み済みの場合に発生します
     */
    public void synthesize(int js, double[] bmod, double[] rHalf, double[] zHalf,
            StraightFieldLineSolution solution, BoozerSpectra spectra) {
        if (solution == null || spectra == null) {
            throw new IllegalArgumentException("solution/spectra は null 不可です");
        }
        int points = grid.pointCount();
        requireLength("bmod", bmod, points);
        requireLength("rHalf", rHalf, points);
        requireLength("zHalf", zHalf, points);
        requireLength("xjac", solution.getXjac(), points);
        if (spectra.modeCount() != modes.size()) {
            throw new IllegalArgumentException("spectra のモード数が一致しません: " + spectra.modeCount()
                    + " vs " + modes.size());
        }

        double[] uboz = solution.getUboz();
        double[] vboz = solution.getVboz();
        double[] xjac = solution.getXjac();
        double jacfac = solution.getJacfac();

        double[] uang = new double[points];
        double[] vang = new double[points];
        for (int k = 0; k < points; k++) {
            uang[k] = grid.theta()[k] + uboz[k];
            vang[k] = grid.zeta()[k] + vboz[k];
        }

        TrigTables tables = tableBuilder.build(uang, vang, modes.mboz(), modes.nboz());
        int nv = grid.nv();
        int lastRow = grid.lastRowStart();
        tables.scalePoloidalRows(0, nv, BOUNDARY_ROW_WEIGHT);
        tables.scalePoloidalRows(lastRow, lastRow + nv, BOUNDARY_ROW_WEIGHT);

        double[] bbjac = new double[points];
        for (int k = 0; k < points; k++) {
            bbjac[k] = jacfac / (bmod[k] * bmod[k]);
        }

        spectra.claimColumn(js);
        for (int mn = 0; mn < modes.size(); mn++) {
            int m = modes.m(mn);
            int n = modes.toroidalHarmonic(mn);
            double sign = Math.signum(modes.xn(mn));

            double sumB = 0.0;
            double sumR = 0.0;
            double sumZ = 0.0;
            double sumP = 0.0;
            double sumG = 0.0;
            for (int k = 0; k < points; k++) {
                double cost = tables.cosMn(k, m, n, sign) * xjac[k];
                double sint = tables.sinMn(k, m, n, sign) * xjac[k];
                sumB += bmod[k] * cost;
                sumR += rHalf[k] * cost;
                sumZ += zHalf[k] * sint;
                sumP += vboz[k] * sint;
                sumG += bbjac[k] * cost;
            }

            double scl = normalization[mn];
            spectra.getBmnc().set(mn, js, sumB * scl);
            spectra.getRmnc().set(mn, js, sumR * scl);
            spectra.getZmns().set(mn, js, sumZ * scl);
            spectra.getPmns().set(mn, js, -sumP * scl);
            spectra.getGmnc().set(mn, js, sumG * scl);
        }
    }

    /**
     * 規格化係数のコピーを返します。
     *
     * @return モードごとの規格化係数です
     */
    public double[] normalization() {
        return normalization.clone();
    }

    private static void requireLength(String name, double[] values, int points) {
        if (values == null || values.length != points) {
            throw new IllegalArgumentException(name + " は長さ " + points + " の配列が必要です");
        }
    }
}
