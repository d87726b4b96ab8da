package io.github.yok.booz.out;

import io.github.yok.booz.core.transform.BoozerTransformResult;

/**
 * Boozer 変換の結果を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * 変換結果を出力します。
     *
     * @param result 変換結果です
     * @throws IllegalArgumentException result が null の場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    void write(BoozerTransformResult result);
}
