package io.github.yok.booz.core.transform;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.booz.core.equilibrium.EquilibriumData;
import io.github.yok.booz.core.equilibrium.EquilibriumFixtures;
import org.junit.jupiter.api.Test;

class CovariantPotentialTransformTest {

    private static final double EPS = 1e-15;

    @Test
    void poloidalModesDivideByM() {
        CovariantPotential p =
                new CovariantPotentialTransform(EquilibriumFixtures.smallTorus()).transform(2);

        assertArrayEquals(new double[] {0.0, 0.003, 0.0015}, p.getPmns(), EPS);
        assertEquals(20.0, p.getGpsi());
        assertEquals(0.1, p.getIpsi());
    }

    @Test
    void purelyToroidalModesDivideByMinusN() {
        EquilibriumData data = EquilibriumFixtures.smallTorusBuilder()
                .xmNyq(new double[] {0, 0, 1})
                .xnNyq(new double[] {0, 5, 0})
                .build();

        CovariantPotential p = new CovariantPotentialTransform(data).transform(1);

        assertEquals(0.0, p.getPmns()[0]);
        assertEquals(-0.01 / 5, p.getPmns()[1], EPS);
        assertEquals(0.001, p.getPmns()[2], EPS);
        assertEquals(20.0, p.getGpsi());
        assertEquals(0.05, p.getIpsi());
    }

    @Test
    void rejectsAxis() {
        CovariantPotentialTransform t =
                new CovariantPotentialTransform(EquilibriumFixtures.smallTorus());
        assertThrows(IllegalArgumentException.class, () -> t.transform(0));
        assertThrows(IllegalArgumentException.class, () -> t.transform(3));
    }
}
