package io.github.yok.booz.out;

import io.github.yok.booz.core.equilibrium.EquilibriumData;
import io.github.yok.booz.core.mode.BoozerModeSet;
import io.github.yok.booz.core.transform.BoozerSpectra;
import io.github.yok.booz.core.transform.BoozerTransformResult;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.StringJoiner;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 変換結果を人が読むためのテキストとして出力するクラスです。
 *
 * <p>
 * 先頭に mboz, nboz, mnboz, xmb, xnb, ns, s を 1 行ずつ書き、続けて 5 つの振幅テーブルを
 * 面（jindex = 1..ns-1）ごとに 1 行で書きます。
 * </p>
 */
@Slf4j
public final class TextReportWriter implements ResultWriter {

    /**
     * 出力ファイルのパスです。
     */
    private final Path file;

    /**
     * テキスト出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @param fileName ファイル名です
     * @throws IllegalArgumentException 引数が空の場合に発生します
     */
    public TextReportWriter(String outputDir, String fileName) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        if (fileName == null || fileName.isEmpty()) {
            throw new IllegalArgumentException("output.text-file-name は必須です");
        }
        this.file = Paths.get(outputDir).resolve(fileName);
    }

    @Override
    public void write(BoozerTransformResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
        BoozerModeSet modes = result.getModes();
        EquilibriumData eq = result.getEquilibrium();
        BoozerSpectra spectra = result.getSpectra();

        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                writeLine(w, "mboz: " + modes.mboz());
                writeLine(w, "nboz: " + modes.nboz());
                writeLine(w, "mnboz: " + modes.size());
                writeLine(w, "xmb: " + join(modes.poloidalModes()));
                writeLine(w, "xnb: " + join(modes.toroidalModes()));
                writeLine(w, "ns: " + eq.getNs());
                writeLine(w, "s: " + join(eq.getS()));

                writeTable(w, "bmnc_b", spectra.getBmnc());
                writeTable(w, "rmnc_b", spectra.getRmnc());
                writeTable(w, "zmns_b", spectra.getZmns());
                writeTable(w, "pmns_b", spectra.getPmns());
                writeTable(w, "gmnc_b", spectra.getGmnc());
            }
        } catch (IOException e) {
            throw new IllegalStateException("テキスト出力に失敗しました: " + file, e);
        }
        log.info("テキスト出力を書き込みました。file={}", file);
    }

    private static void writeTable(BufferedWriter w, String title, DMatrixRMaj table)
            throws IOException {
        writeLine(w, title);
        for (int js = 1; js < table.numCols; js++) {
            writeLine(w, "jindex: " + js);
            writeLine(w, join(BoozerSpectra.column(table, js)));
        }
    }

    private static void writeLine(BufferedWriter w, String line) throws IOException {
        w.write(line);
        w.newLine();
    }

    private static String join(int[] values) {
        StringJoiner sj = new StringJoiner(" ");
        for (int v : values) {
            sj.add(Integer.toString(v));
        }
        return sj.toString();
    }

    private static String join(double[] values) {
        StringJoiner sj = new StringJoiner(" ");
        for (double v : values) {
            sj.add(Double.toString(v));
        }
        return sj.toString();
    }
}
