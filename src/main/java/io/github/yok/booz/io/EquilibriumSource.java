package io.github.yok.booz.io;

import io.github.yok.booz.core.equilibrium.EquilibriumData;

/**
 * 平衡データを読み込む処理のインタフェースです。
 */
public interface EquilibriumSource {

    /**
     * 平衡データを読み込みます。
     *
     * @return 平衡データです
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    EquilibriumData load();
}
