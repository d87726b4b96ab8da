package io.github.yok.booz.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.booz.core.equilibrium.EquilibriumFixtures;
import io.github.yok.booz.core.transform.BoozerTransformResult;
import io.github.yok.booz.core.transform.BoozerTransformer;
import io.github.yok.booz.core.transform.DegenerateJacobianPolicy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TextReportWriterTest {

    @TempDir
    Path dir;

    @Test
    void writesHeaderThenTablesPerSurface() throws IOException {
        BoozerTransformResult result =
                new BoozerTransformer(true, DegenerateJacobianPolicy.MARK_INVALID)
                        .transform(EquilibriumFixtures.smallTorus(), 3, 2);

        new TextReportWriter(dir.toString(), "booz_out.txt").write(result);

        List<String> lines = Files.readAllLines(dir.resolve("booz_out.txt"));
        assertEquals("mboz: 3", lines.get(0));
        assertEquals("nboz: 2", lines.get(1));
        assertEquals("mnboz: 13", lines.get(2));
        assertEquals("xmb: 0 0 0 1 1 1 1 1 2 2 2 2 2", lines.get(3));
        assertEquals("xnb: 0 5 10 -10 -5 0 5 10 -10 -5 0 5 10", lines.get(4));
        assertEquals("ns: 3", lines.get(5));
        assertEquals("s: 0.0 0.5 1.0", lines.get(6));
        assertEquals("bmnc_b", lines.get(7));
        assertEquals("jindex: 1", lines.get(8));
        assertEquals(13, lines.get(9).split(" ").length);
        assertEquals("jindex: 2", lines.get(10));
        assertEquals("rmnc_b", lines.get(12));
        // 7 行のヘッダ + 5 テーブル × (タイトル + 2 面 × 2 行)
        assertEquals(7 + 5 * 5, lines.size());
        assertEquals("gmnc_b", lines.get(7 + 4 * 5));
    }

    @Test
    void rejectsMissingFileName() {
        assertThrows(IllegalArgumentException.class, () -> new TextReportWriter("out", ""));
    }
}
