package io.github.yok.booz.core.equilibrium;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class AxisCorrectionTest {

    private static final double EPS = 1e-14;

    @Test
    void extrapolatesPoloidalModeOneOnAxis() {
        EquilibriumData data = EquilibriumFixtures.smallTorus();

        EquilibriumData corrected = AxisCorrection.apply(data);

        double sqrtS1 = Math.sqrt(0.5);
        assertEquals(2 * 0.7 / sqrtS1 - 1.0, corrected.getRmnc().get(0, 1), EPS);
        assertEquals(2 * 0.05 / sqrtS1 - 0.08, corrected.getRmnc().get(0, 2), EPS);
        assertEquals(2 * 0.04 / sqrtS1 - 0.06, corrected.getZmns().get(0, 2), EPS);
        // m=0 と軸以外の面は変わらない
        assertEquals(10.0, corrected.getRmnc().get(0, 0));
        assertEquals(0.7, corrected.getRmnc().get(1, 1));
    }

    @Test
    void inputIsNotModified() {
        EquilibriumData data = EquilibriumFixtures.smallTorus();
        DMatrixRMaj before = data.getRmnc().copy();

        EquilibriumData corrected = AxisCorrection.apply(data);

        assertNotSame(data.getRmnc(), corrected.getRmnc());
        assertNotSame(data.getZmns(), corrected.getZmns());
        assertEquals(before.get(0, 1), data.getRmnc().get(0, 1));
        assertEquals(0.0, data.getZmns().get(0, 1));
        assertSame(data.getLmns(), corrected.getLmns());
    }

    @Test
    void twoSurfacesAreReturnedUnchanged() {
        EquilibriumData data = EquilibriumData.builder()
                .nfp(1).mpol(2).ntor(0).mnyq(0).nnyq(0).ns(2)
                .xm(new double[] {0, 1}).xn(new double[] {0, 0})
                .xmNyq(new double[] {0}).xnNyq(new double[] {0})
                .rmnc(new DMatrixRMaj(new double[][] {{3, 0}, {3, 1}}))
                .zmns(new DMatrixRMaj(new double[][] {{0, 0}, {0, 1}}))
                .lmns(new DMatrixRMaj(2, 2))
                .bmnc(new DMatrixRMaj(new double[][] {{1}, {1}}))
                .bsubumnc(new DMatrixRMaj(2, 1))
                .bsubvmnc(new DMatrixRMaj(new double[][] {{3}, {3}}))
                .iota(new double[] {0.3, 0.3})
                .build();

        assertSame(data, AxisCorrection.apply(data));
    }
}
