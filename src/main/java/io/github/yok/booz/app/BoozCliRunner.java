package io.github.yok.booz.app;

import io.github.yok.booz.core.equilibrium.EquilibriumData;
import io.github.yok.booz.core.transform.BoozerSpectra;
import io.github.yok.booz.core.transform.BoozerTransformResult;
import io.github.yok.booz.core.transform.BoozerTransformer;
import io.github.yok.booz.io.EquilibriumSource;
import io.github.yok.booz.out.ResultWriter;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で booz-xform を実行するクラスです。
 *
 * <p>
 * 平衡データを読み込み、全ての面を Boozer 座標へ変換して、有効な出力形式で書き出します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class BoozCliRunner implements CommandLineRunner {

    /**
     * booz-xform の設定値（booz.*）です。
     */
    private final BoozProperties properties;

    /**
     * 平衡データの入力元です。
     */
    private final EquilibriumSource equilibriumSource;

    /**
     * Boozer 変換器です。
     */
    private final BoozerTransformer boozerTransformer;

    /**
     * 結果出力ロジックの一覧です。
     */
    private final List<ResultWriter> resultWriters;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== booz-xform start: VMEC -> Boozer coordinates ===");
        System.out.print(properties.toMultilineString());

        EquilibriumData data = equilibriumSource.load();
        System.out.println("入力: nfp=" + data.getNfp() + ", ns=" + data.getNs() + ", mpol="
                + data.getMpol() + ", ntor=" + data.getNtor() + ", mnmax=" + data.modeCount()
                + ", mnmax_nyq=" + data.nyquistModeCount());

        BoozProperties.Boozer b = properties.getBoozer();
        BoozerTransformResult result = boozerTransformer.transform(data, b.getMboz(), b.getNboz());

        BoozerSpectra spectra = result.getSpectra();
        for (int js = 1; js < data.getNs(); js++) {
            String status = spectra.isValid(js) ? "" : "（無効）";
            System.out.println("面 " + js + ": bmnc(0,0)=" + fmt5(spectra.getBmnc().get(0, js))
                    + ", jacfac=" + fmt5(result.getJacfac()[js]) + ", 対称点 |B| 差="
                    + fmt5(result.getCornerDeviation()[js]) + status);
        }

        if (resultWriters.isEmpty()) {
            System.out.println("出力形式が 1 つも有効になっていません（booz.output.*-enabled）");
        }
        for (ResultWriter writer : resultWriters) {
            writer.write(result);
        }
        System.out.println("=== booz-xform end: mnboz=" + result.getModes().size() + " ===");
    }

    /**
     * 数値を指数表記 5 桁の文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5e", v);
    }
}
