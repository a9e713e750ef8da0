package io.github.yok.psfpr.core.acquisition;

import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.stream.ImageInputStream;
import lombok.extern.slf4j.Slf4j;

/**
 * OME-TIFF 形式の PSF を読み込むサービスです。
 *
 * <p>
 * 先頭ページの ImageDescription に格納された OME-XML から取得条件を取り出し、 z 枚数分のページを画素スタックとして読み込みます。
 * TIFF リーダはプロセス中で使い回し、{@link #close()} で破棄します。
 * </p>
 */
@Slf4j
public final class OmeTiffAcquisitionService implements AcquisitionService {

    private final OmeXmlMetadataParser metadataParser;

    private ImageReader reader;

    private boolean closed;

    /**
     * サービスを生成します。
     *
     * @param metadataParser OME-XML 解析器です（null 不可）
     * @throws IllegalArgumentException metadataParser が null の場合に発生します
     */
    public OmeTiffAcquisitionService(OmeXmlMetadataParser metadataParser) {
        if (metadataParser == null) {
            throw new IllegalArgumentException("metadataParser は null 不可です");
        }
        this.metadataParser = metadataParser;
    }

    @Override
    public synchronized PsfAcquisition acquire(Path file) {
        if (closed) {
            throw new IllegalStateException("取得サービスは既に終了しています");
        }
        if (file == null || !Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new AcquisitionException(AcquisitionException.Kind.INVALID_PATH,
                    "PSF ファイルを読み込めません: " + file);
        }

        try (ImageInputStream in = ImageIO.createImageInputStream(file.toFile())) {
            if (in == null) {
                throw new AcquisitionException(AcquisitionException.Kind.INVALID_PATH,
                        "PSF ファイルを開けません: " + file);
            }
            if (!isTiff(in)) {
                throw new AcquisitionException(AcquisitionException.Kind.UNSUPPORTED_FORMAT,
                        "Only OME-tif file format is supported: " + file);
            }
            ImageReader r = tiffReader();
            r.setInput(in, false, false);
            try {
                OmeXmlMetadata meta = metadataParser.parse(imageDescription(r.getImageMetadata(0)));
                PixelStack stack = readStack(r, meta);
                log.info("PSF を読み込みました: {} ({} x {} x {}, xy={}nm, z={}nm, NA={}, RI={})",
                        file.getFileName(), meta.getImageSizeZ(), meta.getImageSizeXy(),
                        meta.getImageSizeXy(), meta.getPixelSizeXy(), meta.getPixelSizeZ(),
                        meta.getNumericalAperture(), meta.getRefractiveIndex());
                return new PsfAcquisition(meta.getNumericalAperture(), meta.getRefractiveIndex(),
                        meta.getPixelSizeXy(), meta.getPixelSizeZ(), meta.getImageSizeXy(),
                        meta.getImageSizeZ(), stack);
            } finally {
                r.reset();
            }
        } catch (IOException e) {
            throw new AcquisitionException(AcquisitionException.Kind.UNSUPPORTED_FORMAT,
                    "PSF ファイルの読み込みに失敗しました: " + file, e);
        }
    }

    @Override
    public synchronized void close() {
        if (reader != null) {
            reader.dispose();
            reader = null;
        }
        closed = true;
    }

    /**
     * 先頭バイトが TIFF のバイトオーダーマーク（II* / MM*）かどうかを判定します。
     */
    private static boolean isTiff(ImageInputStream in) throws IOException {
        byte[] head = new byte[4];
        in.mark();
        int read;
        try {
            read = in.read(head);
        } finally {
            in.reset();
        }
        if (read < 4) {
            return false;
        }
        boolean little = head[0] == 'I' && head[1] == 'I' && head[2] == 42 && head[3] == 0;
        boolean big = head[0] == 'M' && head[1] == 'M' && head[2] == 0 && head[3] == 42;
        return little || big;
    }

    private ImageReader tiffReader() {
        if (reader == null) {
            Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName("tiff");
            if (!readers.hasNext()) {
                throw new AcquisitionException(AcquisitionException.Kind.UNSUPPORTED_FORMAT,
                        "TIFF リーダが利用できません");
            }
            reader = readers.next();
        }
        return reader;
    }

    private static String imageDescription(IIOMetadata metadata) throws IOException {
        TIFFDirectory dir = TIFFDirectory.createFromMetadata(metadata);
        TIFFField field = dir.getTIFFField(BaselineTIFFTagSet.TAG_IMAGE_DESCRIPTION);
        if (field == null || field.getCount() == 0) {
            throw new AcquisitionException(AcquisitionException.Kind.UNSUPPORTED_FORMAT,
                    "Only OME-tif file format is supported");
        }
        return field.getAsString(0);
    }

    private static PixelStack readStack(ImageReader r, OmeXmlMetadata meta) throws IOException {
        int nz = meta.getImageSizeZ();
        int n = meta.getImageSizeXy();
        int pages = r.getNumImages(true);
        if (pages < nz) {
            throw new AcquisitionException(AcquisitionException.Kind.UNSUPPORTED_FORMAT,
                    "TIFF のページ数が SizeZ より少ないです: pages=" + pages + ", SizeZ=" + nz);
        }
        double[] data = new double[nz * n * n];
        for (int z = 0; z < nz; z++) {
            Raster raster = r.read(z).getRaster();
            if (raster.getWidth() != n || raster.getHeight() != n) {
                throw new AcquisitionException(AcquisitionException.Kind.UNSUPPORTED_FORMAT,
                        "ページ " + z + " の画素数が SizeX/SizeY と一致しません");
            }
            for (int y = 0; y < n; y++) {
                for (int x = 0; x < n; x++) {
                    data[(z * n + y) * n + x] = raster.getSampleDouble(x, y, 0);
                }
            }
        }
        return new PixelStack(nz, n, n, data);
    }
}
