package io.github.yok.booz.core.transform;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.booz.core.equilibrium.EquilibriumData;
import io.github.yok.booz.core.equilibrium.EquilibriumFixtures;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BoozerTransformerTest {

    private static final double EPS = 1e-10;

    /**
     * legacyToroidalGuard=true のときの面 1 の bmnc です。
     */
    private static final double[] BMNC_LEGACY_JS1 = {1.9989989511013415, 3.4258310474147684e-16,
            4.440892098500626e-17, 2.3473286806360453e-16, 1.586032892321652e-17,
            -0.09998496893495104, -3.8064789415719653e-17, -1.8715188129395496e-16,
            -1.9349601286324157e-16, -3.489272363107635e-17, 0.0010007814120941332,
            -5.3925118338936174e-17, -1.5225915766287861e-16};

    /**
     * legacyToroidalGuard=false のときの面 1 の bmnc です。
     */
    private static final double[] BMNC_JS1 = {1.9990371210229259, -3.1267157484978928e-06,
            7.764741230939112e-14, -4.011110491372197e-12, 1.0335304337028005e-06,
            -0.09998535975876968, 0.020001906915333472, -1.7597226876934055e-07,
            2.9846284174287315e-13, -2.7376488999562653e-08, 0.001000781162772611,
            3.0496147320630786e-06, -3.816978537098471e-05};

    @Nested
    @DisplayName("ns=3, mpol=2, ntor=1, nfp=5 を mboz=3, nboz=2 で変換")
    class SmallTorus {

        @Test
        void legacyGuardMatchesReference() {
            BoozerTransformResult result =
                    new BoozerTransformer(true, DegenerateJacobianPolicy.MARK_INVALID)
                            .transform(EquilibriumFixtures.smallTorus(), 3, 2);
            BoozerSpectra spectra = result.getSpectra();

            assertArrayEquals(new int[] {0, 0, 0, 1, 1, 1, 1, 1, 2, 2, 2, 2, 2},
                    result.getModes().poloidalModes());
            assertArrayEquals(new int[] {0, 5, 10, -10, -5, 0, 5, 10, -10, -5, 0, 5, 10},
                    result.getModes().toroidalModes());
            assertArrayEquals(BMNC_LEGACY_JS1, BoozerSpectra.column(spectra.getBmnc(), 1), EPS);

            // (m, n) = (0,0), (1,0), (2,0) は index 0, 5, 10
            assertEquals(10.004929786631033, spectra.getRmnc().get(0, 1), EPS);
            assertEquals(0.4923880979442304, spectra.getRmnc().get(5, 1), EPS);
            assertEquals(-0.004928469361025327, spectra.getRmnc().get(10, 1), EPS);
            assertEquals(0.49243744587059257, spectra.getZmns().get(5, 1), EPS);
            assertEquals(-0.004929127979523999, spectra.getZmns().get(10, 1), EPS);
            assertEquals(-4.994505248948374e-05, spectra.getPmns().get(5, 1), EPS);
            assertEquals(5.029107862597343, spectra.getGmnc().get(0, 1), EPS);
            assertEquals(0.5027097745089846, spectra.getGmnc().get(5, 1), EPS);

            assertEquals(1.9979, spectra.getBmnc().get(0, 2), EPS);
            assertEquals(-0.1399527529530467, spectra.getBmnc().get(5, 2), EPS);
            assertEquals(0.0020987402126075544, spectra.getBmnc().get(10, 2), EPS);
        }

        @Test
        void fullFirstHarmonicMatchesReference() {
            BoozerTransformResult result =
                    new BoozerTransformer(false, DegenerateJacobianPolicy.MARK_INVALID)
                            .transform(EquilibriumFixtures.smallTorus(), 3, 2);

            assertArrayEquals(BMNC_JS1,
                    BoozerSpectra.column(result.getSpectra().getBmnc(), 1), EPS);
        }

        @Test
        @DisplayName("軸の列は 0 のまま、計算面は 2..ns")
        void axisColumnStaysZero() {
            BoozerTransformResult result =
                    new BoozerTransformer(true, DegenerateJacobianPolicy.MARK_INVALID)
                            .transform(EquilibriumFixtures.smallTorus(), 3, 2);

            for (DMatrixRMaj table : result.getSpectra().tables()) {
                for (int mn = 0; mn < table.numRows; mn++) {
                    assertEquals(0.0, table.get(mn, 0));
                }
            }
            assertFalse(result.getSpectra().isWritten(0));
            assertArrayEquals(new int[] {2, 3}, result.computedSurfaceNumbers());
            assertEquals(20.0 + 0.42 * 0.05, result.getJacfac()[1], 1e-14);
        }

        @Test
        @DisplayName("対称点の Boozer 級数は実空間 |B| と一致する")
        void cornerSamplesMatchRealSpaceField() {
            BoozerTransformResult result =
                    new BoozerTransformer(true, DegenerateJacobianPolicy.MARK_INVALID)
                            .transform(EquilibriumFixtures.smallTorus(), 3, 2);

            assertArrayEquals(new double[] {1.9000147635784845, 2.099984701448387,
                    1.9000147635784836, 2.099984701448386}, result.getCornerFieldStrength()[1],
                    1e-9);
            assertArrayEquals(new double[] {1.8600459872595605, 2.1399514931656536,
                    1.86004598725956, 2.1399514931656527}, result.getCornerFieldStrength()[2],
                    1e-9);
            for (int js = 1; js < 3; js++) {
                assertTrue(result.getCornerDeviation()[js] < 1e-3, "js=" + js);
            }
        }

        @Test
        void inputIsNotModified() {
            EquilibriumData data = EquilibriumFixtures.smallTorus();

            BoozerTransformResult result =
                    new BoozerTransformer(true, DegenerateJacobianPolicy.MARK_INVALID)
                            .transform(data, 3, 2);

            assertSame(data, result.getEquilibrium());
            assertEquals(0.0, data.getRmnc().get(0, 1));
        }
    }

    @Nested
    @DisplayName("jacfac=0 の面")
    class DegenerateSurface {

        private EquilibriumData degenerateSecondSurface() {
            EquilibriumData data = EquilibriumFixtures.smallTorus();
            DMatrixRMaj bsubu = data.getBsubumnc().copy();
            DMatrixRMaj bsubv = data.getBsubvmnc().copy();
            bsubu.set(2, 0, 0.0);
            bsubv.set(2, 0, 0.0);
            return data.toBuilder().bsubumnc(bsubu).bsubvmnc(bsubv).build();
        }

        @Test
        void markInvalidFillsNanAndContinues() {
            BoozerTransformResult result =
                    new BoozerTransformer(true, DegenerateJacobianPolicy.MARK_INVALID)
                            .transform(degenerateSecondSurface(), 3, 2);
            BoozerSpectra spectra = result.getSpectra();

            assertTrue(spectra.isValid(1));
            assertArrayEquals(BMNC_LEGACY_JS1, BoozerSpectra.column(spectra.getBmnc(), 1), EPS);
            assertFalse(spectra.isValid(2));
            assertTrue(Double.isNaN(spectra.getBmnc().get(0, 2)));
            assertTrue(Double.isNaN(spectra.getGmnc().get(5, 2)));
            assertTrue(Double.isNaN(result.getCornerDeviation()[2]));
        }

        @Test
        void propagateKeepsNonFiniteArithmetic() {
            BoozerTransformResult result =
                    new BoozerTransformer(true, DegenerateJacobianPolicy.PROPAGATE)
                            .transform(degenerateSecondSurface(), 3, 2);
            BoozerSpectra spectra = result.getSpectra();

            assertTrue(spectra.isWritten(2));
            assertTrue(Double.isNaN(spectra.getBmnc().get(0, 2)));
            assertArrayEquals(BMNC_LEGACY_JS1, BoozerSpectra.column(spectra.getBmnc(), 1), EPS);
        }
    }

    @Test
    void rejectsInvalidModeLimits() {
        BoozerTransformer transformer =
                new BoozerTransformer(true, DegenerateJacobianPolicy.MARK_INVALID);
        EquilibriumData data = EquilibriumFixtures.smallTorus();

        assertThrows(IllegalArgumentException.class, () -> transformer.transform(data, 0, 2));
        assertThrows(IllegalArgumentException.class, () -> transformer.transform(data, 3, -1));
        assertThrows(IllegalArgumentException.class, () -> transformer.transform(null, 3, 2));
        assertThrows(IllegalArgumentException.class, () -> new BoozerTransformer(true, null));
    }
}
