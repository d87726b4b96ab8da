package io.github.yok.booz.core.trig;

import lombok.Getter;
import org.ejml.data.DMatrixRMaj;

/**
 * 評価点ごとの cos/sin テーブル（ポロイダル・トロイダル）を保持するクラスです。
 *
 * <p>
 * 各テーブルは [評価点 × (最大モード+1)] の密行列で、列 m が cos(mθ) などに対応します。
 * トロイダル側は nfp 倍した角度 {@code nfp·ζ} の調和です。
 * </p>
 */
@Getter
public final class TrigTables {

    /**
     * cos(mθ) です。
     */
    private final DMatrixRMaj cosm;

    /**
     * sin(mθ) です。
     */
    private final DMatrixRMaj sinm;

    /**
     * cos(n·nfp·ζ) です。
     */
    private final DMatrixRMaj cosn;

    /**
     * sin(n·nfp·ζ) です。
     */
    private final DMatrixRMaj sinn;

    TrigTables(DMatrixRMaj cosm, DMatrixRMaj sinm, DMatrixRMaj cosn, DMatrixRMaj sinn) {
        this.cosm = cosm;
        this.sinm = sinm;
        this.cosn = cosn;
        this.sinn = sinn;
    }

    /**
     * 評価点数を返します。
     *
     * @return 評価点数です
     */
    public int pointCount() {
        return cosm.numRows;
    }

    /**
     * 保持しているポロイダル最大モードを返します。
     *
     * @return 最大モード mpol です
     */
    public int maxPoloidalMode() {
        return cosm.numCols - 1;
    }

    /**
     * 保持しているトロイダル最大モードを返します。
     *
     * @return 最大モード ntor です
     */
    public int maxToroidalMode() {
        return cosn.numCols - 1;
    }

    /**
     * cos(mθ - sgn·n·nfp·ζ) を合成します。
     *
     * @param point 評価点インデックスです
     * @param m ポロイダルモード番号です
     * @param n トロイダル調和次数 |n| です
     * @param sign トロイダルモード番号の符号（-1, 0, +1）です
     * @return 合成した cos 値です
     */
    public double cosMn(int point, int m, int n, double sign) {
        return cosm.unsafe_get(point, m) * cosn.unsafe_get(point, n)
                + sinm.unsafe_get(point, m) * sinn.unsafe_get(point, n) * sign;
    }

    /**
     * sin(mθ - sgn·n·nfp·ζ) を合成します。
     *
     * @param point 評価点インデックスです
     * @param m ポロイダルモード番号です
     * @param n トロイダル調和次数 |n| です
     * @param sign トロイダルモード番号の符号（-1, 0, +1）です
     * @return 合成した sin 値です
     */
    public double sinMn(int point, int m, int n, double sign) {
        return sinm.unsafe_get(point, m) * cosn.unsafe_get(point, n)
                - cosm.unsafe_get(point, m) * sinn.unsafe_get(point, n) * sign;
    }

    /**
     * 指定した評価点行のポロイダルテーブル（cos/sin 両方）に係数を掛けます。
     *
     * <p>
     * 半区間求積で境界行の重みを調整するために使います。
     * </p>
     *
     * @param fromPoint 開始評価点（含む）です
     * @param toPoint 終了評価点（含まない）です
     * @param factor 係数です
     */
    public void scalePoloidalRows(int fromPoint, int toPoint, double factor) {
        for (int k = fromPoint; k < toPoint; k++) {
            for (int m = 0; m < cosm.numCols; m++) {
                cosm.unsafe_set(k, m, factor * cosm.unsafe_get(k, m));
                sinm.unsafe_set(k, m, factor * sinm.unsafe_get(k, m));
            }
        }
    }
}
