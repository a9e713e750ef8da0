package io.github.yok.psfpr.core.acquisition;

import java.nio.file.Path;

/**
 * PSF ファイルを読み込むサービスの抽象です。
 *
 * <p>
 * 実装は読み込み用の資源をプロセス終了まで保持してよく、{@link #close()} で解放します。
 * </p>
 */
public interface AcquisitionService extends AutoCloseable {

    /**
     * PSF ファイルを読み込みます。
     *
     * @param file 読み込むファイルです
     * @return 取得条件と画素データです
     * @throws AcquisitionException 読み込めない場合に発生します
     */
    PsfAcquisition acquire(Path file);

    /**
     * 保持している資源を解放します。
     */
    @Override
    void close();
}
