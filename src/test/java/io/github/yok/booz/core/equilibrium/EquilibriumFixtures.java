package io.github.yok.booz.core.equilibrium;

import org.ejml.data.DMatrixRMaj;

/**
 * テスト用の小さな平衡データです。
 *
 * <p>
 * nfp=5, ns=3, mpol=2, ntor=1, mnyq=1, nnyq=1。モードは (0,0), (1,0), (1,5) の 3 つで、
 * ネイティブと Nyquist で共通です。
 * </p>
 */
public final class EquilibriumFixtures {

    private EquilibriumFixtures() {
    }

    public static EquilibriumData.EquilibriumDataBuilder smallTorusBuilder() {
        double[] xm = {0, 1, 1};
        double[] xn = {0, 0, 5};
        return EquilibriumData.builder()
                .nfp(5)
                .mpol(2)
                .ntor(1)
                .mnyq(1)
                .nnyq(1)
                .ns(3)
                .xm(xm.clone())
                .xn(xn.clone())
                .xmNyq(xm.clone())
                .xnNyq(xn.clone())
                .rmnc(new DMatrixRMaj(new double[][] {
                        {10.0, 0.0, 0.0}, {10.0, 0.7, 0.05}, {10.0, 1.0, 0.08}}))
                .zmns(new DMatrixRMaj(new double[][] {
                        {0.0, 0.0, 0.0}, {0.0, 0.7, 0.04}, {0.0, 1.0, 0.06}}))
                .lmns(new DMatrixRMaj(new double[][] {
                        {0.0, 0.0, 0.0}, {0.0, 0.02, 0.004}, {0.0, 0.03, 0.006}}))
                .bmnc(new DMatrixRMaj(new double[][] {
                        {0.0, 0.0, 0.0}, {2.0, -0.1, 0.02}, {2.0, -0.14, 0.03}}))
                .bsubumnc(new DMatrixRMaj(new double[][] {
                        {0.0, 0.0, 0.0}, {0.05, 0.002, 0.001}, {0.1, 0.003, 0.0015}}))
                .bsubvmnc(new DMatrixRMaj(new double[][] {
                        {0.0, 0.0, 0.0}, {20.0, 0.01, 0.004}, {20.0, 0.015, 0.006}}))
                .s(new double[] {0.0, 0.5, 1.0})
                .iota(new double[] {0.0, 0.42, 0.45})
                .aspect(10.0)
                .rmaxSurf(11.08)
                .rminSurf(8.92)
                .zmaxSurf(1.06)
                .betaxis(0.01);
    }

    public static EquilibriumData smallTorus() {
        return smallTorusBuilder().build();
    }
}
