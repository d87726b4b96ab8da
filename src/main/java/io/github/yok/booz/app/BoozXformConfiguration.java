package io.github.yok.booz.app;

import io.github.yok.booz.core.transform.BoozerTransformer;
import io.github.yok.booz.io.CsvEquilibriumSource;
import io.github.yok.booz.io.EquilibriumSource;
import io.github.yok.booz.out.CsvResultWriter;
import io.github.yok.booz.out.ResultWriter;
import io.github.yok.booz.out.TextReportWriter;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * CSV 入力 + Boozer 変換 + 結果出力の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class BoozXformConfiguration {

    /**
     * booz-xform の設定値（booz.*）です。
     */
    private final BoozProperties p;

    /**
     * 平衡データの入力元を生成します。
     *
     * @return 入力元です
     */
    @Bean
    public EquilibriumSource equilibriumSource() {
        return new CsvEquilibriumSource(p.getInput().getDir());
    }

    /**
     * Boozer 変換器を生成します。
     *
     * @return 変換器です
     */
    @Bean
    public BoozerTransformer boozerTransformer() {
        BoozProperties.Numerics n = p.getNumerics();
        return new BoozerTransformer(n.isLegacyToroidalGuard(), n.getDegenerateJacobianPolicy());
    }

    /**
     * 有効な結果出力ロジックの一覧を生成します。
     *
     * @return 結果出力ロジックの一覧です（空の場合もあります）
     */
    @Bean
    public List<ResultWriter> resultWriters() {
        BoozProperties.Output o = p.getOutput();
        List<ResultWriter> writers = new ArrayList<>();
        if (o.isCsvEnabled()) {
            writers.add(new CsvResultWriter(o.getDir()));
        }
        if (o.isTextEnabled()) {
            writers.add(new TextReportWriter(o.getDir(), o.getTextFileName()));
        }
        return writers;
    }
}
