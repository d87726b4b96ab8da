package io.github.yok.booz.core.transform;

import io.github.yok.booz.core.equilibrium.AxisCorrection;
import io.github.yok.booz.core.equilibrium.EquilibriumData;
import io.github.yok.booz.core.grid.EvaluationGrid;
import io.github.yok.booz.core.mode.BoozerModeSet;
import io.github.yok.booz.core.trig.TrigTableBuilder;
import io.github.yok.booz.core.trig.TrigTables;
import java.util.Arrays;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * VMEC 平衡を面ごとに Boozer 座標へ変換するクラスです。
 *
 * <p>
 * 準備として、モード集合・評価格子・ネイティブ/Nyquist の cos/sin テーブルを作り、軸の m=1 振幅を外挿したデータを用意します。
 * その後、面 1 から ns-1 まで順に、共変ポテンシャル → 実空間合成 → 直線磁力線角 → 半メッシュ補間 → 順変換 → 対称点評価、
 * を実行します。面 0（磁気軸）は計算しません。
 * </p>
 */
@Getter
@Slf4j
public final class BoozerTransformer {

    /**
     * トロイダル 1 次調和を ntor &gt; 1 のときだけ評価するかどうかです。
     */
    private final boolean legacyToroidalGuard;

    /**
     * jacfac が 0 になった面の扱いです。
     */
    private final DegenerateJacobianPolicy degenerateJacobianPolicy;

    /**
     * 直線磁力線角のソルバです。
     */
    private final StraightFieldLineSolver solver = new StraightFieldLineSolver();

    /**
     * 変換器を生成します。
     *
     * @param legacyToroidalGuard トロイダル 1 次調和を ntor &gt; 1 のときだけ評価する場合は true です
     * @param degenerateJacobianPolicy jacfac が 0 になった面の扱いです（null 不可）
     * @throws IllegalArgumentException degenerateJacobianPolicy が null の場合に発生します
     */
    public BoozerTransformer(boolean legacyToroidalGuard,
            DegenerateJacobianPolicy degenerateJacobianPolicy) {
        if (degenerateJacobianPolicy == null) {
            throw new IllegalArgumentException("degenerateJacobianPolicy は null 不可です");
        }
        this.legacyToroidalGuard = legacyToroidalGuard;
        this.degenerateJacobianPolicy = degenerateJacobianPolicy;
    }

    /**
     * 全ての面（軸を除く）を Boozer 座標へ変換します。
     *
     * @param data 平衡データです（null 不可、変更しません）
     * @param mboz Boozer ポロイダルモード数です（1 以上）
     * @param nboz Boozer トロイダルモード上限です（0 以上）
     * @return 変換結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException モード列挙が宣言容量と一致しない場合に発生します
     */
    public BoozerTransformResult transform(EquilibriumData data, int mboz, int nboz) {
        if (data == null) {
            throw new IllegalArgumentException("data は null 不可です");
        }
        int ns = data.getNs();
        int nfp = data.getNfp();

        long t0 = System.nanoTime();

        BoozerModeSet modes = BoozerModeSet.of(mboz, nboz, nfp);
        EvaluationGrid grid = new EvaluationGrid(mboz, nboz, nfp);

        log.info("Boozer 変換を開始します。mboz={}、nboz={}、mnboz={}、nfp={}、ns={}、格子点数={}（nu2={}、nv={}）", mboz,
                nboz, modes.size(), nfp, ns, grid.pointCount(), grid.nu2(), grid.nv());

        TrigTableBuilder gridTables = new TrigTableBuilder(nfp, legacyToroidalGuard);
        warnIfFirstHarmonicSkipped(gridTables, "ネイティブ", data.getNtor());
        warnIfFirstHarmonicSkipped(gridTables, "Nyquist", data.getNnyq());
        warnIfFirstHarmonicSkipped(gridTables, "Boozer", nboz);

        TrigTables nativeTables =
                gridTables.build(grid.theta(), grid.zeta(), data.getMpol() - 1, data.getNtor());
        TrigTables nyquistTables =
                gridTables.build(grid.theta(), grid.zeta(), data.getMnyq(), data.getNnyq());

        EquilibriumData corrected = AxisCorrection.apply(data);

        RealSpaceSynthesizer realSpace =
                new RealSpaceSynthesizer(corrected, nativeTables, nyquistTables);
        CovariantPotentialTransform covariantTransform = new CovariantPotentialTransform(corrected);
        HalfGridInterpolator halfGrid = new HalfGridInterpolator(corrected.radialStep());
        BoozerSynthesizer boozer = new BoozerSynthesizer(modes, grid, gridTables);
        // 4 点評価は常に 1 次調和を評価する
        AngleSampler sampler = new AngleSampler(modes, grid, new TrigTableBuilder(nfp, false));

        BoozerSpectra spectra = new BoozerSpectra(modes.size(), ns);
        double[] jacfac = new double[ns];
        double[][] cornerB = new double[ns][AngleSampler.CORNER_COUNT];
        double[] cornerDeviation = new double[ns];
        int invalidCount = 0;

        for (int js = 1; js < ns; js++) {
            CovariantPotential potential = covariantTransform.transform(js);
            RealSpaceGeometry geometry = realSpace.synthesizeGeometry(js);
            CovariantFields covariant = realSpace.synthesizeCovariant(js, potential);

            double iota = corrected.getIota()[js];
            StraightFieldLineSolution solution =
                    solver.solve(js, potential, iota, geometry, covariant);
            jacfac[js] = solution.getJacfac();

            if (solution.isDegenerate()
                    && degenerateJacobianPolicy == DegenerateJacobianPolicy.MARK_INVALID) {
                log.warn("面 {} の出力を無効（NaN）として次の面へ進みます", js);
                spectra.markInvalid(js);
                cornerB[js] = nanArray(AngleSampler.CORNER_COUNT);
                cornerDeviation[js] = Double.NaN;
                invalidCount++;
                continue;
            }

            double[] rHalf = halfGrid.interpolate(geometry.getREven(), geometry.getROdd(), js);
            double[] zHalf = halfGrid.interpolate(geometry.getZEven(), geometry.getZOdd(), js);

            boozer.synthesize(js, covariant.getBmod(), rHalf, zHalf, solution, spectra);

            CornerAngles corners = sampler.cornerAngles(solution);
            cornerB[js] = sampler.sample(spectra, js, corners);
            cornerDeviation[js] = maxDeviation(cornerB[js], covariant.getBmod(),
                    corners.getGridPoints());

            log.debug("面 {}: jacfac={}、xjac=[{}, {}]、bmnc(0,0)={}、対称点 |B| の最大差={}", js,
                    fmt(solution.getJacfac()), fmt(solution.getMinJacobian()),
                    fmt(solution.getMaxJacobian()), fmt(spectra.getBmnc().get(0, js)),
                    fmt(cornerDeviation[js]));
        }

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        if (invalidCount > 0) {
            log.warn("Boozer 変換が終了しました。無効な面={} / {}、所要時間={}ms", invalidCount, ns - 1, elapsedMs);
        } else {
            log.info("Boozer 変換が終了しました。計算した面={}、所要時間={}ms", ns - 1, elapsedMs);
        }

        return new BoozerTransformResult(data, modes, spectra, jacfac, cornerB, cornerDeviation);
    }

    /**
     * トロイダル 1 次調和が評価されない条件なら警告を出します。
     *
     * @param builder テーブル生成器です
     * @param label テーブルの種類です
     * @param ntor トロイダル最大モードです
     */
    private static void warnIfFirstHarmonicSkipped(TrigTableBuilder builder, String label,
            int ntor) {
        if (builder.skipsFirstToroidalHarmonic(ntor)) {
            log.warn("{} テーブルはトロイダル上限 {} のため 1 次調和を評価しません（legacy-toroidal-guard=true）。"
                    + "n=1 の寄与は 0 になります", label, ntor);
        }
    }

    private static double maxDeviation(double[] sampled, double[] bmod, int[] gridPoints) {
        double max = 0.0;
        for (int a = 0; a < sampled.length; a++) {
            max = Math.max(max, Math.abs(sampled[a] - bmod[gridPoints[a]]));
        }
        return max;
    }

    private static double[] nanArray(int length) {
        double[] out = new double[length];
        Arrays.fill(out, Double.NaN);
        return out;
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.6e", v);
    }
}
