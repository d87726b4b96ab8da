package io.github.yok.booz.core.transform;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.booz.core.grid.EvaluationGrid;
import io.github.yok.booz.core.mode.BoozerModeSet;
import io.github.yok.booz.core.trig.TrigTableBuilder;
import org.junit.jupiter.api.Test;

class AngleSamplerTest {

    private static final double EPS = 1e-13;

    private final BoozerModeSet modes = BoozerModeSet.of(3, 1, 5);

    private final EvaluationGrid grid = new EvaluationGrid(3, 1, 5);

    private final AngleSampler sampler =
            new AngleSampler(modes, grid, new TrigTableBuilder(5, false));

    @Test
    void cornersWithoutCorrectionAreSymmetryPoints() {
        int points = grid.pointCount();
        StraightFieldLineSolution solution = new StraightFieldLineSolution(1.0,
                new double[points], new double[points], new double[points], false, 1.0, 1.0);

        CornerAngles corners = sampler.cornerAngles(solution);

        int i1 = grid.lastRowStart();
        int h = grid.nv2() - 1;
        assertArrayEquals(new int[] {0, i1, h, i1 + h}, corners.getGridPoints());
        assertArrayEquals(new double[] {0.0, Math.PI, 0.0, Math.PI}, corners.getU(), EPS);
        assertArrayEquals(new double[] {0.0, 0.0, Math.PI / 5, Math.PI / 5}, corners.getV(), EPS);
    }

    @Test
    void cornersAddAngleCorrection() {
        int points = grid.pointCount();
        double[] uboz = new double[points];
        double[] vboz = new double[points];
        int i1 = grid.lastRowStart();
        uboz[i1] = 0.01;
        vboz[i1] = 0.02;

        CornerAngles corners = sampler.cornerAngles(
                new StraightFieldLineSolution(1.0, uboz, vboz, new double[points], false, 1, 1));

        assertEquals(Math.PI + 0.01, corners.getU()[1], EPS);
        assertEquals(0.02, corners.getV()[1], EPS);
    }

    @Test
    void evaluatesCosineSeries() {
        double[] bmnc = new double[modes.size()];
        bmnc[modes.indexOf(0, 0)] = 2.0;
        bmnc[modes.indexOf(1, 0)] = 0.1;
        bmnc[modes.indexOf(1, 5)] = 0.05;
        bmnc[modes.indexOf(2, -5)] = 0.01;
        double[] u = {0.0, 0.7, 2.0};
        double[] v = {0.0, 0.3, -0.1};

        double[] out = sampler.evaluate(bmnc, u, v);

        for (int a = 0; a < u.length; a++) {
            double expected = 2.0 + 0.1 * Math.cos(u[a]) + 0.05 * Math.cos(u[a] - 5 * v[a])
                    + 0.01 * Math.cos(2 * u[a] + 5 * v[a]);
            assertEquals(expected, out[a], EPS);
        }
    }

    @Test
    void rejectsWrongAmplitudeLength() {
        assertThrows(IllegalArgumentException.class,
                () -> sampler.evaluate(new double[2], new double[1], new double[1]));
    }
}
