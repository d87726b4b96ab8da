package io.github.yok.booz.io;

import io.github.yok.booz.core.equilibrium.EquilibriumData;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.ejml.data.DMatrixRMaj;

/**
 * CSV ディレクトリから VMEC 平衡を読み込むクラスです。
 *
 * <p>
 * ディレクトリには以下のファイルを置きます。
 * </p>
 *
 * <ul>
 * <li>{@code scalars.csv}（ヘッダ {@code key,value}）: nfp, mpol, ntor, mnyq, nnyq, ns と補助スカラー</li>
 * <li>{@code profiles.csv}（ヘッダ {@code s,iota,pres,beta_vol,phi,phip,bvco,buco}）: 面ごとのプロファイル</li>
 * <li>{@code modes.csv}, {@code modes_nyq.csv}（ヘッダ {@code xm,xn}）: モード番号（xn は nfp 倍済み）</li>
 * <li>{@code rmnc.csv} などの振幅テーブル（ヘッダなし）: 1 行が 1 面、1 列が 1 モード</li>
 * </ul>
 */
@Slf4j
public final class CsvEquilibriumSource implements EquilibriumSource {

    /**
     * プロファイル CSV のヘッダです。
     */
    static final String[] PROFILE_HEADER =
            {"s", "iota", "pres", "beta_vol", "phi", "phip", "bvco", "buco"};

    /**
     * 入力ディレクトリです。
     */
    private final Path inputDir;

    /**
     * CSV 入力を生成します。
     *
     * @param inputDir 入力ディレクトリです
     * @throws IllegalArgumentException inputDir が空の場合に発生します
     */
    public CsvEquilibriumSource(String inputDir) {
        if (inputDir == null || inputDir.isEmpty()) {
            throw new IllegalArgumentException("input.dir は必須です");
        }
        this.inputDir = Paths.get(inputDir);
    }

    /**
     * 平衡データを読み込みます。
     *
     * @return 平衡データです
     * @throws IllegalStateException ファイルが無い、または値が不正な場合に発生します
     */
    @Override
    public EquilibriumData load() {
        try {
            Map<String, Double> scalars = readScalars(inputDir.resolve("scalars.csv"));
            int ns = requireInt(scalars, "ns");

            Map<String, double[]> profiles = readProfiles(inputDir.resolve("profiles.csv"), ns);
            double[][] modes = readModes(inputDir.resolve("modes.csv"));
            double[][] modesNyq = readModes(inputDir.resolve("modes_nyq.csv"));

            EquilibriumData data = EquilibriumData.builder()
                    .nfp(requireInt(scalars, "nfp"))
                    .mpol(requireInt(scalars, "mpol"))
                    .ntor(requireInt(scalars, "ntor"))
                    .mnyq(requireInt(scalars, "mnyq"))
                    .nnyq(requireInt(scalars, "nnyq"))
                    .ns(ns)
                    .xm(modes[0])
                    .xn(modes[1])
                    .xmNyq(modesNyq[0])
                    .xnNyq(modesNyq[1])
                    .rmnc(readTable(inputDir.resolve("rmnc.csv")))
                    .zmns(readTable(inputDir.resolve("zmns.csv")))
                    .lmns(readTable(inputDir.resolve("lmns.csv")))
                    .bmnc(readTable(inputDir.resolve("bmnc.csv")))
                    .bsubumnc(readTable(inputDir.resolve("bsubumnc.csv")))
                    .bsubvmnc(readTable(inputDir.resolve("bsubvmnc.csv")))
                    .s(profiles.get("s"))
                    .iota(profiles.get("iota"))
                    .pres(profiles.get("pres"))
                    .betaVol(profiles.get("beta_vol"))
                    .phi(profiles.get("phi"))
                    .phip(profiles.get("phip"))
                    .bvco(profiles.get("bvco"))
                    .buco(profiles.get("buco"))
                    .aspect(scalars.getOrDefault("aspect", 0.0))
                    .rmaxSurf(scalars.getOrDefault("rmax_surf", 0.0))
                    .rminSurf(scalars.getOrDefault("rmin_surf", 0.0))
                    .zmaxSurf(scalars.getOrDefault("zmax_surf", 0.0))
                    .betaxis(scalars.getOrDefault("betaxis", 0.0))
                    .build();

            log.info("平衡データを読み込みました。dir={}、ns={}、mnmax={}、mnmax_nyq={}", inputDir, ns,
                    data.modeCount(), data.nyquistModeCount());
            return data;

        } catch (IOException e) {
            throw new IllegalStateException("平衡データの読み込みに失敗しました: " + inputDir, e);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("平衡データの内容が不正です: " + inputDir, e);
        }
    }

    private static Map<String, Double> readScalars(Path file) throws IOException {
        Map<String, Double> out = new HashMap<>();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = headerFormat().parse(r)) {
            for (CSVRecord rec : parser) {
                out.put(rec.get("key").trim(), parseDouble(file, rec.get("value")));
            }
        }
        return out;
    }

    private static Map<String, double[]> readProfiles(Path file, int ns) throws IOException {
        Map<String, double[]> out = new HashMap<>();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = headerFormat().parse(r)) {
            List<CSVRecord> records = parser.getRecords();
            if (records.size() != ns) {
                throw new IllegalArgumentException(
                        file + " の行数が ns と一致しません: " + records.size() + " vs " + ns);
            }
            for (String column : PROFILE_HEADER) {
                if (!parser.getHeaderMap().containsKey(column)) {
                    // 省略した列は EquilibriumData 側の既定値を使う
                    continue;
                }
                double[] values = new double[ns];
                for (int j = 0; j < ns; j++) {
                    values[j] = parseDouble(file, records.get(j).get(column));
                }
                out.put(column, values);
            }
        }
        return out;
    }

    private static double[][] readModes(Path file) throws IOException {
        List<double[]> rows = new ArrayList<>();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = headerFormat().parse(r)) {
            for (CSVRecord rec : parser) {
                rows.add(new double[] {parseDouble(file, rec.get("xm")),
                        parseDouble(file, rec.get("xn"))});
            }
        }
        double[] xm = new double[rows.size()];
        double[] xn = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            xm[i] = rows.get(i)[0];
            xn[i] = rows.get(i)[1];
        }
        return new double[][] {xm, xn};
    }

    private static DMatrixRMaj readTable(Path file) throws IOException {
        List<double[]> rows = new ArrayList<>();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = CSVFormat.DEFAULT.parse(r)) {
            for (CSVRecord rec : parser) {
                double[] row = new double[rec.size()];
                for (int c = 0; c < row.length; c++) {
                    row[c] = parseDouble(file, rec.get(c));
                }
                if (!rows.isEmpty() && rows.get(0).length != row.length) {
                    throw new IllegalArgumentException(file + " の列数が行ごとに異なります: 行 "
                            + (rows.size() + 1));
                }
                rows.add(row);
            }
        }
        if (rows.isEmpty()) {
            throw new IllegalArgumentException(file + " が空です");
        }
        return new DMatrixRMaj(rows.toArray(new double[0][]));
    }

    private static CSVFormat headerFormat() {
        return CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader().setSkipHeaderRecord(true)
                .setTrim(true).build();
    }

    private static int requireInt(Map<String, Double> scalars, String key) {
        Double v = scalars.get(key);
        if (v == null) {
            throw new IllegalArgumentException("scalars.csv に " + key + " がありません");
        }
        return (int) Math.round(v);
    }

    private static double parseDouble(Path file, String text) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(file + " の数値が不正です: '" + text + "'", e);
        }
    }
}
