package io.github.yok.psfpr.core.solver;

/**
 * ソルバ内部状態です。呼び出し側からは不透明で、表示用のスナップショットのみ取り出せます。
 */
public interface PhaseRetrievalState {

    /**
     * 現在の瞳関数を複製して返します。
     *
     * @return 瞳関数のスナップショットです
     */
    PupilSnapshot snapshotPupil();
}
