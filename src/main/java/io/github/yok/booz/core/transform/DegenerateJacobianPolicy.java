package io.github.yok.booz.core.transform;

/**
 * ヤコビアン係数 jacfac が 0 になった面の扱いです。
 */
public enum DegenerateJacobianPolicy {

    /**
     * 面の出力列を NaN で埋めて無効とし、次の面へ進みます。
     */
    MARK_INVALID,

    /**
     * 非有限値のまま順変換を続けます（従来の挙動）。
     */
    PROPAGATE
}
