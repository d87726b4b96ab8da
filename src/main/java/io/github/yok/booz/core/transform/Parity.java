package io.github.yok.booz.core.transform;

/**
 * ポロイダルモード番号 m の偶奇（パリティ）です。
 */
public enum Parity {

    /**
     * m が偶数のモードです（径方向の √s 補正なし）。
     */
    EVEN(0),

    /**
     * m が奇数のモードです（振幅を √s で割って補間します）。
     */
    ODD(1);

    private final int remainder;

    Parity(int remainder) {
        this.remainder = remainder;
    }

    /**
     * ポロイダルモード番号がこのパリティに属するかを返します。
     *
     * @param m ポロイダルモード番号です（0 以上）
     * @return 属する場合は true です
     */
    public boolean matches(int m) {
        return m % 2 == remainder;
    }
}
