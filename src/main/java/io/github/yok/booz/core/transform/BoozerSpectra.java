package io.github.yok.booz.core.transform;

import java.util.Arrays;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;

/**
 * Boozer 基底のモード振幅テーブル（[mnboz × ns]）を保持するクラスです。
 *
 * <p>
 * 面ループを駆動する側が所有し、各面の合成処理は自分の列 js だけを 1 回書き込みます。
 * 列 0（磁気軸）は書き込まれず 0 のままです。
 * </p>
 */
public final class BoozerSpectra {

    /**
     * |B| の cos 振幅です。
     */
    @Getter
    private final DMatrixRMaj bmnc;

    /**
     * R の cos 振幅です。
     */
    @Getter
    private final DMatrixRMaj rmnc;

    /**
     * Z の sin 振幅です。
     */
    @Getter
    private final DMatrixRMaj zmns;

    /**
     * トロイダル角補正ポテンシャルの sin 振幅です（ζ_B = ζ + Σ pmns·sin(...)）。
     */
    @Getter
    private final DMatrixRMaj pmns;

    /**
     * 計量規格化因子（Boozer ヤコビアン）の cos 振幅です。
     */
    @Getter
    private final DMatrixRMaj gmnc;

    /**
     * 列が書き込み済みかどうかです。
     */
    private final boolean[] written;

    /**
     * 列が有効（退化していない）かどうかです。
     */
    private final boolean[] valid;

    /**
     * 0 で初期化したテーブルを生成します。
     *
     * @param modeCount モード数 mnboz です（1 以上）
     * @param surfaceCount 面数 ns です（1 以上）
     * @throws IllegalArgumentException 引数が 1 未満の場合に発生します
     */
    public BoozerSpectra(int modeCount, int surfaceCount) {
        if (modeCount <= 0 || surfaceCount <= 0) {
            throw new IllegalArgumentException(
                    "modeCount/surfaceCount は 1 以上が必要です: " + modeCount + ", " + surfaceCount);
        }
        this.bmnc = new DMatrixRMaj(modeCount, surfaceCount);
        this.rmnc = new DMatrixRMaj(modeCount, surfaceCount);
        this.zmns = new DMatrixRMaj(modeCount, surfaceCount);
        this.pmns = new DMatrixRMaj(modeCount, surfaceCount);
        this.gmnc = new DMatrixRMaj(modeCount, surfaceCount);
        this.written = new boolean[surfaceCount];
        this.valid = new boolean[surfaceCount];
    }

    public int modeCount() {
        return bmnc.numRows;
    }

    public int surfaceCount() {
        return bmnc.numCols;
    }

    /**
     * 列 js への書き込みを開始します。
     *
     * @param js 面インデックスです（1 以上 ns 未満）
     * @throws IllegalArgumentException js が範囲外の場合に発生します
     * @throws IllegalStateException 既に書き込み済みの場合に発生します
     */
    void claimColumn(int js) {
        if (js <= 0 || js >= surfaceCount()) {
            throw new IllegalArgumentException("書き込み対象の面インデックスが範囲外です: js=" + js);
        }
        if (written[js]) {
            throw new IllegalStateException("面 " + js + " の列は既に書き込み済みです");
        }
        written[js] = true;
        valid[js] = true;
    }

    /**
     * 列 js を NaN で埋め、無効としてマークします。
     *
     * @param js 面インデックスです（1 以上 ns 未満）
     */
    void markInvalid(int js) {
        claimColumn(js);
        valid[js] = false;
        for (DMatrixRMaj table : tables()) {
            for (int mn = 0; mn < table.numRows; mn++) {
                table.set(mn, js, Double.NaN);
            }
        }
    }

    /**
     * 列 js が有効な値を持つかを返します。
     *
     * @param js 面インデックスです
     * @return 書き込み済みかつ有効な場合は true です
     */
    public boolean isValid(int js) {
        return written[js] && valid[js];
    }

    /**
     * 列 js が書き込み済みかを返します。
     *
     * @param js 面インデックスです
     * @return 書き込み済みの場合は true です
     */
    public boolean isWritten(int js) {
        return written[js];
    }

    /**
     * テーブルの列 js を配列として取り出します。
     *
     * @param table 対象テーブルです（このオブジェクトが保持するもの）
     * @param js 面インデックスです
     * @return 列の値です
     */
    public static double[] column(DMatrixRMaj table, int js) {
        double[] out = new double[table.numRows];
        for (int mn = 0; mn < out.length; mn++) {
            out[mn] = table.get(mn, js);
        }
        return out;
    }

    /**
     * 5 つのテーブルを出力順（bmnc, rmnc, zmns, pmns, gmnc）で返します。
     *
     * @return テーブル配列です
     */
    public DMatrixRMaj[] tables() {
        return new DMatrixRMaj[] {bmnc, rmnc, zmns, pmns, gmnc};
    }

    @Override
    public String toString() {
        return "BoozerSpectra[modes=" + modeCount() + ", surfaces=" + surfaceCount() + ", written="
                + Arrays.toString(written) + "]";
    }
}
