package io.github.yok.psfpr.core.solver;

import lombok.Value;

/**
 * 瞳関数の表示用スナップショットです。
 *
 * <p>
 * 配列は {@code size x size} を行優先で平坦化したもので、零周波数が中央に来るように並べ替え済みです。
 * </p>
 */
@Value
public class PupilSnapshot {

    int size;

    double[] magnitude;

    /**
     * 位相（rad）です。
     */
    double[] phase;

    /**
     * 開口内かどうかです。
     */
    boolean[] mask;
}
