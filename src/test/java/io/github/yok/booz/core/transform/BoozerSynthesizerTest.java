package io.github.yok.booz.core.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.booz.core.grid.EvaluationGrid;
import io.github.yok.booz.core.mode.BoozerModeSet;
import io.github.yok.booz.core.trig.TrigTableBuilder;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BoozerSynthesizerTest {

    private static final int NFP = 5;

    private BoozerModeSet modes;

    private EvaluationGrid grid;

    private BoozerSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        modes = BoozerModeSet.of(3, 2, NFP);
        grid = new EvaluationGrid(3, 2, NFP);
        synthesizer = new BoozerSynthesizer(modes, grid, new TrigTableBuilder(NFP, false));
    }

    @Test
    @DisplayName("規格化係数は (0,0) だけ半分")
    void normalizationHalvesConstantMode() {
        double[] scl = synthesizer.normalization();

        assertEquals(2.0 / (7 * 10), scl[1], 1e-15);
        for (int mn = 1; mn < scl.length; mn++) {
            assertEquals(scl[0] * 2.0, scl[mn], 1e-15);
        }
    }

    @Test
    @DisplayName("角度補正なしでは既知の級数を 1e-8 で復元する")
    void recoversKnownSeriesWithoutAngleCorrection() {
        int points = grid.pointCount();
        double[] r = new double[points];
        double[] z = new double[points];
        double[] b = new double[points];
        for (int k = 0; k < points; k++) {
            double th = grid.theta()[k];
            double zt = grid.zeta()[k];
            r[k] = 10.0 + 0.5 * Math.cos(th) + 0.1 * Math.cos(th - 5 * zt)
                    + 0.05 * Math.cos(2 * th + 5 * zt) + 0.02 * Math.cos(-10 * zt);
            z[k] = 0.6 * Math.sin(th) + 0.07 * Math.sin(th + 5 * zt)
                    + 0.01 * Math.sin(2 * th - 10 * zt);
            b[k] = 2.0 + 0.1 * Math.cos(th);
        }
        double[] ones = new double[points];
        Arrays.fill(ones, 1.0);
        StraightFieldLineSolution solution = new StraightFieldLineSolution(1.0,
                new double[points], new double[points], ones, false, 1.0, 1.0);
        BoozerSpectra spectra = new BoozerSpectra(modes.size(), 2);

        synthesizer.synthesize(1, b, r, z, solution, spectra);

        for (int mn = 0; mn < modes.size(); mn++) {
            int m = modes.m(mn);
            int xn = modes.xn(mn);
            assertEquals(expectedR(m, xn), spectra.getRmnc().get(mn, 1), 1e-8, "rmnc " + mn);
            assertEquals(expectedZ(m, xn), spectra.getZmns().get(mn, 1), 1e-8, "zmns " + mn);
            assertEquals(0.0, spectra.getPmns().get(mn, 1), 1e-15);
        }
        assertEquals(2.0, spectra.getBmnc().get(modes.indexOf(0, 0), 1), 1e-8);
        assertEquals(0.1, spectra.getBmnc().get(modes.indexOf(1, 0), 1), 1e-8);
        assertTrue(spectra.isValid(1));
        // 軸の列は書き込まれない
        assertEquals(0.0, spectra.getRmnc().get(0, 0));
    }

    @Test
    @DisplayName("同じ面の列を 2 回書き込むと IllegalStateException")
    void columnIsWrittenOnce() {
        int points = grid.pointCount();
        double[] ones = new double[points];
        Arrays.fill(ones, 1.0);
        StraightFieldLineSolution solution = new StraightFieldLineSolution(1.0,
                new double[points], new double[points], ones, false, 1.0, 1.0);
        BoozerSpectra spectra = new BoozerSpectra(modes.size(), 3);

        synthesizer.synthesize(2, ones, ones, ones, solution, spectra);

        assertThrows(IllegalStateException.class,
                () -> synthesizer.synthesize(2, ones, ones, ones, solution, spectra));
        assertThrows(IllegalArgumentException.class,
                () -> synthesizer.synthesize(0, ones, ones, ones, solution, spectra));
    }

    @Test
    void rejectsWrongFieldLength() {
        BoozerSpectra spectra = new BoozerSpectra(modes.size(), 2);
        double[] shortField = new double[3];
        StraightFieldLineSolution solution = new StraightFieldLineSolution(1.0, shortField,
                shortField, shortField, false, 1.0, 1.0);

        assertThrows(IllegalArgumentException.class, () -> synthesizer.synthesize(1, shortField,
                shortField, shortField, solution, spectra));
    }

    private static double expectedR(int m, int xn) {
        if (m == 0 && xn == 0) {
            return 10.0;
        }
        if (m == 1 && xn == 0) {
            return 0.5;
        }
        if (m == 1 && xn == 5) {
            return 0.1;
        }
        if (m == 2 && xn == -5) {
            return 0.05;
        }
        if (m == 0 && xn == 10) {
            return 0.02;
        }
        return 0.0;
    }

    private static double expectedZ(int m, int xn) {
        if (m == 1 && xn == 0) {
            return 0.6;
        }
        if (m == 1 && xn == -5) {
            return 0.07;
        }
        if (m == 2 && xn == 10) {
            return 0.01;
        }
        return 0.0;
    }
}
