package io.github.yok.booz.app;

import io.github.yok.booz.core.transform.DegenerateJacobianPolicy;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * booz-xform の設定値（booz.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "booz")
public class BoozProperties {

    /**
     * Boozer 展開の設定です。
     */
    @Valid
    private Boozer boozer = new Boozer();

    /**
     * 入力設定です。
     */
    @Valid
    private Input input = new Input();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 数値処理の設定です。
     */
    @Valid
    private Numerics numerics = new Numerics();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "booz")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Boozer b = getBoozer();
        Input i = getInput();
        Output o = getOutput();
        Numerics n = getNumerics();

        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "boozer",
                // mboz: ポロイダルモード数（m は 0..mboz-1）
                "mboz", b.getMboz(),
                // nboz: トロイダルモード上限（n は -nboz..nboz）
                "nboz", b.getNboz());

        appendSection(sb, nl, "input",
                // dir: 平衡 CSV のディレクトリ
                "dir", i.getDir());

        appendSection(sb, nl, "output",
                "dir", o.getDir(),
                "csvEnabled", o.isCsvEnabled(),
                "textEnabled", o.isTextEnabled(),
                "textFileName", o.getTextFileName());

        appendSection(sb, nl, "numerics",
                // legacyToroidalGuard: トロイダル 1 次調和を ntor > 1 のときだけ評価する
                "legacyToroidalGuard", n.isLegacyToroidalGuard(),
                // degenerateJacobianPolicy: jacfac=0 の面の扱い
                "degenerateJacobianPolicy", n.getDegenerateJacobianPolicy());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int k = 0; k < kvPairs.length; k += 2) {
            Object val = (k + 1 < kvPairs.length) ? kvPairs[k + 1] : null;
            sb.append("    ").append(kvPairs[k]).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Boozer {

        /**
         * Boozer ポロイダルモード数です。
         */
        @Min(1)
        private int mboz = 32;

        /**
         * Boozer トロイダルモード上限です。
         */
        @Min(0)
        private int nboz = 16;
    }

    @Data
    public static class Input {

        /**
         * 平衡 CSV のディレクトリです。
         */
        @NotBlank
        private String dir = "./wout";
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotBlank
        private String dir = "./out";

        /**
         * boozmn 形式の CSV を出力するかどうかです。
         */
        private boolean csvEnabled = true;

        /**
         * テキスト出力を行うかどうかです。
         */
        private boolean textEnabled = false;

        /**
         * テキスト出力のファイル名です。
         */
        @NotBlank
        private String textFileName = "booz_out.txt";
    }

    @Data
    public static class Numerics {

        /**
         * トロイダル 1 次調和を ntor &gt; 1 のときだけ評価するかどうかです。
         *
         * <p>
         * true は従来の出力と一致させるための設定で、ntor == 1 の入力では n=1 の寄与が 0 になります。
         * </p>
         */
        private boolean legacyToroidalGuard = true;

        /**
         * jacfac が 0 になった面の扱いです。
         */
        @NotNull
        private DegenerateJacobianPolicy degenerateJacobianPolicy =
                DegenerateJacobianPolicy.MARK_INVALID;
    }
}
