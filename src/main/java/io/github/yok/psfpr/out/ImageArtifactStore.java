package io.github.yok.psfpr.out;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * エンコード済み画像（PNG）を名前ごとに保持するストアです。
 *
 * <p>
 * {@link #replace} は以前の内容を破棄して差し替えます。 書き込み・読み出しともにコピーを扱うため、呼び出し側が配列を保持し続けても
 * ストアの内容は変化しません。
 * </p>
 */
public final class ImageArtifactStore {

    private final Map<ArtifactName, byte[]> buffers = new ConcurrentHashMap<>();

    /**
     * 画像を差し替えます。
     *
     * @param name 名前です
     * @param encoded エンコード済み画像です（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public void replace(ArtifactName name, byte[] encoded) {
        if (name == null) {
            throw new IllegalArgumentException("name は null 不可です");
        }
        if (encoded == null) {
            throw new IllegalArgumentException("encoded は null 不可です");
        }
        buffers.put(name, encoded.clone());
    }

    /**
     * 画像を読み出します。
     *
     * @param name 名前です
     * @return 画像のコピーです（未登録の場合は空）
     */
    public Optional<byte[]> read(ArtifactName name) {
        byte[] b = buffers.get(name);
        return b == null ? Optional.empty() : Optional.of(b.clone());
    }

    public boolean contains(ArtifactName name) {
        return buffers.containsKey(name);
    }

    /**
     * 登録済みの全画像のコピーを返します。
     *
     * @return 名前から画像への対応です
     */
    public Map<ArtifactName, byte[]> snapshot() {
        Map<ArtifactName, byte[]> copy = new EnumMap<>(ArtifactName.class);
        for (Map.Entry<ArtifactName, byte[]> e : buffers.entrySet()) {
            copy.put(e.getKey(), e.getValue().clone());
        }
        return copy;
    }
}
