package io.github.yok.booz.out;

import io.github.yok.booz.core.equilibrium.EquilibriumData;
import io.github.yok.booz.core.mode.BoozerModeSet;
import io.github.yok.booz.core.transform.BoozerTransformResult;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 変換結果を boozmn と同じ構成の CSV 群として出力するクラスです。
 *
 * <ul>
 * <li>{@code boozmn_meta.csv}: 次元（radius, comput_surfs, mn_mode, pack_rad）とスカラー</li>
 * <li>{@code boozmn_radius.csv}: 面ごとのプロファイル（iota_b, pres_b, ...）</li>
 * <li>{@code boozmn_jlist.csv}: 計算した面番号（1 始まり、2..ns）</li>
 * <li>{@code boozmn_modes.csv}: Boozer モード番号（ixm_b, inm_b）</li>
 * <li>{@code bmnc_b.csv} など: [pack_rad × mn_mode] の振幅（軸の行は含みません）</li>
 * </ul>
 */
@Slf4j
public final class CsvResultWriter implements ResultWriter {

    /**
     * version に書き込む識別文字列です。
     */
    public static final String VERSION = "jbooz V1.0";

    /**
     * 振幅テーブルのファイル名（拡張子なし）です。BoozerSpectra#tables() の順に対応します。
     */
    static final String[] SPECTRA_NAMES = {"bmnc_b", "rmnc_b", "zmns_b", "pmns_b", "gmn_b"};

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException outputDir が空の場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    @Override
    public void write(BoozerTransformResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);

            writeMeta(result);
            writeRadius(result.getEquilibrium());
            writeJlist(result);
            writeModes(result.getModes());

            DMatrixRMaj[] tables = result.getSpectra().tables();
            for (int i = 0; i < tables.length; i++) {
                writeSpectrum(SPECTRA_NAMES[i], tables[i]);
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
        log.info("boozmn 形式の CSV を出力しました。dir={}", outputDir);
    }

    private void writeMeta(BoozerTransformResult result) throws IOException {
        EquilibriumData eq = result.getEquilibrium();
        BoozerModeSet modes = result.getModes();
        int ns = eq.getNs();

        try (Writer w = Files.newBufferedWriter(outputDir.resolve("boozmn_meta.csv"),
                StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            // 次元
            pr.printRecord("radius", ns);
            pr.printRecord("comput_surfs", ns - 1);
            pr.printRecord("mn_mode", modes.size());
            pr.printRecord("pack_rad", ns - 1);

            pr.printRecord("nfp_b", eq.getNfp());
            pr.printRecord("ns_b", ns);
            pr.printRecord("aspect_b", eq.getAspect());
            pr.printRecord("rmax_b", eq.getRmaxSurf());
            pr.printRecord("rmin_b", eq.getRminSurf());
            pr.printRecord("zmax_b", eq.getZmaxSurf());
            pr.printRecord("betaxis_b", eq.getBetaxis());
            pr.printRecord("mboz_b", modes.mboz());
            pr.printRecord("nboz_b", modes.nboz());
            pr.printRecord("version", VERSION);
            // ステラレータ対称のみ扱う
            pr.printRecord("lasym__logical__", 0);
        }
    }

    private void writeRadius(EquilibriumData eq) throws IOException {
        try (Writer w = Files.newBufferedWriter(outputDir.resolve("boozmn_radius.csv"),
                StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("iota_b", "pres_b", "beta_b", "phip_b", "phi_b", "bvco_b",
                                "buco_b")
                        .build().print(w)) {

            for (int j = 0; j < eq.getNs(); j++) {
                pr.printRecord(eq.getIota()[j], eq.getPres()[j], eq.getBetaVol()[j],
                        eq.getPhip()[j], eq.getPhi()[j], eq.getBvco()[j], eq.getBuco()[j]);
            }
        }
    }

    private void writeJlist(BoozerTransformResult result) throws IOException {
        try (Writer w = Files.newBufferedWriter(outputDir.resolve("boozmn_jlist.csv"),
                StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader("jlist")
                        .build().print(w)) {

            for (int j : result.computedSurfaceNumbers()) {
                pr.printRecord(j);
            }
        }
    }

    private void writeModes(BoozerModeSet modes) throws IOException {
        try (Writer w = Files.newBufferedWriter(outputDir.resolve("boozmn_modes.csv"),
                StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("ixm_b", "inm_b").build().print(w)) {

            for (int mn = 0; mn < modes.size(); mn++) {
                pr.printRecord(modes.m(mn), modes.xn(mn));
            }
        }
    }

    /**
     * [mnboz × ns] のテーブルを転置し、軸の行を除いた [ns-1 × mnboz] として出力します。
     *
     * @param name ファイル名（拡張子なし）です
     * @param table 振幅テーブルです
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeSpectrum(String name, DMatrixRMaj table) throws IOException {
        DMatrixRMaj packed = packRadial(table);

        try (Writer w = Files.newBufferedWriter(outputDir.resolve(name + ".csv"),
                StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.DEFAULT.print(w)) {

            Double[] row = new Double[packed.numCols];
            for (int r = 0; r < packed.numRows; r++) {
                for (int c = 0; c < packed.numCols; c++) {
                    row[c] = packed.get(r, c);
                }
                pr.printRecord((Object[]) row);
            }
        }
    }

    /**
     * 転置して面 0 の行を取り除きます。
     *
     * @param table [mnboz × ns] のテーブルです
     * @return [ns-1 × mnboz] のテーブルです
     */
    static DMatrixRMaj packRadial(DMatrixRMaj table) {
        DMatrixRMaj transposed = CommonOps_DDRM.transpose(table, null);
        return CommonOps_DDRM.extract(transposed, 1, transposed.numRows, 0, transposed.numCols);
    }
}
