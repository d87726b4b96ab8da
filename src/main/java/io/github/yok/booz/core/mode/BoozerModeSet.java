package io.github.yok.booz.core.mode;

import java.util.Arrays;

/**
 * Boozer 座標で展開するモード番号 (m, n) の集合を表すクラスです。
 *
 * <p>
 * 列挙順は m 昇順、同じ m の中では n 昇順です。m=0 では n≥0 のみを含みます。
 * この順序（線形インデックス）は出力テーブルすべての行インデックスとして共有されます。
 * </p>
 *
 * <p>
 * モード総数は {@code mnboz = nboz + 1 + (mboz-1)(1 + 2 nboz)} で、m は 0 以上 mboz 未満です。
 * </p>
 */
public final class BoozerModeSet {

    /**
     * ポロイダルモード数の上限 mboz です。
     */
    private final int mboz;

    /**
     * トロイダルモード番号の上限 nboz です。
     */
    private final int nboz;

    /**
     * 周期数 nfp です。
     */
    private final int nfp;

    /**
     * 各モードのポロイダルモード番号 m です。
     */
    private final int[] xm;

    /**
     * 各モードのトロイダルモード番号（nfp 倍済み）です。
     */
    private final int[] xn;

    private BoozerModeSet(int mboz, int nboz, int nfp, int[] xm, int[] xn) {
        this.mboz = mboz;
        this.nboz = nboz;
        this.nfp = nfp;
        this.xm = xm;
        this.xn = xn;
    }

    /**
     * Boozer モード集合を生成します。
     *
     * @param mboz ポロイダルモード数の上限です（1 以上）
     * @param nboz トロイダルモード番号の上限です（0 以上）
     * @param nfp 周期数です（1 以上）
     * @return モード集合です
     * @throws IllegalArgumentException 引数が範囲外の場合に発生します
     * @throws IllegalStateException 列挙数が宣言容量を超えた場合に発生します
     */
    public static BoozerModeSet of(int mboz, int nboz, int nfp) {
        return enumerate(mboz, nboz, nfp, expectedSize(mboz, nboz));
    }

    /**
     * 宣言容量 mnboz を計算します。
     *
     * @param mboz ポロイダルモード数の上限です
     * @param nboz トロイダルモード番号の上限です
     * @return モード総数です
     */
    public static int expectedSize(int mboz, int nboz) {
        return nboz + 1 + (mboz - 1) * (1 + 2 * nboz);
    }

    /**
     * 指定容量でモードを列挙します。
     *
     * @param mboz ポロイダルモード数の上限です
     * @param nboz トロイダルモード番号の上限です
     * @param nfp 周期数です
     * @param capacity 宣言容量です
     * @return モード集合です
     */
    static BoozerModeSet enumerate(int mboz, int nboz, int nfp, int capacity) {
        if (mboz < 1) {
            throw new IllegalArgumentException("mboz は 1 以上が必要です: " + mboz);
        }
        if (nboz < 0) {
            throw new IllegalArgumentException("nboz は 0 以上が必要です: " + nboz);
        }
        if (nfp < 1) {
            throw new IllegalArgumentException("nfp は 1 以上が必要です: " + nfp);
        }
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity は 0 以上が必要です: " + capacity);
        }

        int[] xm = new int[capacity];
        int[] xn = new int[capacity];

        int count = 0;
        for (int m = 0; m < mboz; m++) {
            int n1 = (m == 0) ? 0 : -nboz;
            for (int n = n1; n <= nboz; n++) {
                if (count >= capacity) {
                    throw new IllegalStateException(
                            "モード列挙数が宣言容量を超えました: capacity=" + capacity + ", m=" + m + ", n=" + n);
                }
                xm[count] = m;
                xn[count] = n * nfp;
                count++;
            }
        }

        if (count != capacity) {
            throw new IllegalStateException(
                    "モード列挙数が宣言容量と一致しません: count=" + count + ", capacity=" + capacity);
        }
        return new BoozerModeSet(mboz, nboz, nfp, xm, xn);
    }

    /**
     * モード総数 mnboz を返します。
     *
     * @return モード総数です
     */
    public int size() {
        return xm.length;
    }

    public int mboz() {
        return mboz;
    }

    public int nboz() {
        return nboz;
    }

    public int nfp() {
        return nfp;
    }

    /**
     * 指定インデックスのポロイダルモード番号を返します。
     *
     * @param index モードインデックスです
     * @return m です
     */
    public int m(int index) {
        return xm[index];
    }

    /**
     * 指定インデックスのトロイダルモード番号（nfp 倍済み）を返します。
     *
     * @param index モードインデックスです
     * @return n·nfp です
     */
    public int xn(int index) {
        return xn[index];
    }

    /**
     * 指定インデックスのトロイダル調和次数 |n|（nfp で割った値）を返します。
     *
     * @param index モードインデックスです
     * @return |n| です
     */
    public int toroidalHarmonic(int index) {
        return Math.abs(xn[index]) / nfp;
    }

    /**
     * (m, n·nfp) に対応するインデックスを返します。
     *
     * @param m ポロイダルモード番号です
     * @param scaledN トロイダルモード番号（nfp 倍済み）です
     * @return インデックスです。存在しない場合は -1 です
     */
    public int indexOf(int m, int scaledN) {
        for (int i = 0; i < xm.length; i++) {
            if (xm[i] == m && xn[i] == scaledN) {
                return i;
            }
        }
        return -1;
    }

    /**
     * ポロイダルモード番号の配列（コピー）を返します。
     *
     * @return xm 配列です
     */
    public int[] poloidalModes() {
        return Arrays.copyOf(xm, xm.length);
    }

    /**
     * トロイダルモード番号（nfp 倍済み）の配列（コピー）を返します。
     *
     * @return xn 配列です
     */
    public int[] toroidalModes() {
        return Arrays.copyOf(xn, xn.length);
    }
}
