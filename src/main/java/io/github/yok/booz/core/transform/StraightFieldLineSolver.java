package io.github.yok.booz.core.transform;

import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * λ と共変ポテンシャル w から、Boozer 角の補正場と変換ヤコビアンを求めるクラスです。
 *
 * <p>
 * jacfac = g + ι·I とし、
 * </p>
 *
 * <pre>
 *   vboz  = w/jacfac - (I/jacfac)·λ
 *   uboz  = λ + ι·vboz
 *   psubu = (∂w/∂θ)/jacfac - (I/jacfac)·∂λ/∂θ
 *   psubv = (∂w/∂ζ)/jacfac - (I/jacfac)·∂λ/∂ζ
 *   xjac  = (1 + ∂λ/∂θ)(1 + psubv) + (ι - ∂λ/∂ζ)·psubu
 * </pre>
 */
@Slf4j
public final class StraightFieldLineSolver {

    /**
     * 直線磁力線角を求めます。
     *
     * <p>
     * jacfac が 0 の場合は警告を出し、非有限値を含む解を degenerate として返します。
     * </p>
     *
     * @param js 面インデックスです（ログ用）
     * @param potential 共変ポテンシャル（g, I を含む）です（null 不可）
     * @param iota 面の回転変換 ι です
     * @param geometry 実空間幾何量（λ とその微分）です（null 不可）
     * @param covariant 共変ポテンシャル場です（null 不可）
     * @return 直線磁力線角の解です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public StraightFieldLineSolution solve(int js, CovariantPotential potential, double iota,
            RealSpaceGeometry geometry, CovariantFields covariant) {
        if (potential == null || geometry == null || covariant == null) {
            throw new IllegalArgumentException("potential/geometry/covariant は null 不可です");
        }
        double[] lambda = geometry.getLambda();
        double[] lt = geometry.getDLambdaDTheta();
        double[] lz = geometry.getDLambdaDZeta();
        double[] w = covariant.getW();
        double[] wt = covariant.getDwDTheta();
        double[] wz = covariant.getDwDZeta();
        if (lambda.length != w.length) {
            throw new IllegalArgumentException(
                    "評価点数が一致しません: " + lambda.length + " vs " + w.length);
        }

        double jacfac = potential.getGpsi() + iota * potential.getIpsi();
        boolean degenerate = jacfac == 0.0;
        if (degenerate) {
            log.warn("ヤコビアン係数 jacfac が 0 です（g={}, I={}, ι={}）。面 {} は退化しています", potential.getGpsi(),
                    potential.getIpsi(), iota, js);
        }

        double dem = 1.0 / jacfac;
        double ipsi1 = potential.getIpsi() * dem;

        int points = lambda.length;
        double[] uboz = new double[points];
        double[] vboz = new double[points];
        double[] xjac = new double[points];
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;

        for (int k = 0; k < points; k++) {
            vboz[k] = dem * w[k] - ipsi1 * lambda[k];
            uboz[k] = lambda[k] + iota * vboz[k];

            double psubv = dem * wz[k] - ipsi1 * lz[k];
            double psubu = dem * wt[k] - ipsi1 * lt[k];
            double bsupv = 1.0 + lt[k];
            double bsupu = iota - lz[k];
            xjac[k] = bsupv * (1.0 + psubv) + bsupu * psubu;

            min = Math.min(min, xjac[k]);
            max = Math.max(max, xjac[k]);
        }

        StraightFieldLineSolution solution =
                new StraightFieldLineSolution(jacfac, uboz, vboz, xjac, degenerate, min, max);
        if (!degenerate && !solution.hasConsistentJacobianSign()) {
            log.warn("面 {} のヤコビアンの符号が一定ではありません（min={}, max={}）", js, fmt(min), fmt(max));
        }
        return solution;
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.5e", v);
    }
}
