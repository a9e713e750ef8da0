package io.github.yok.psfpr.core.acquisition;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;
import javax.imageio.stream.ImageOutputStream;

/**
 * テスト用の OME-TIFF を生成します。
 */
public final class OmeTiffFixtures {

    private OmeTiffFixtures() {}

    public static String omeXml(String pixelsAttributes, String objective, String settings) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<OME xmlns=\"http://www.openmicroscopy.org/Schemas/OME/2016-06\">"
                + "<Instrument ID=\"Instrument:0\">" + objective + "</Instrument>"
                + "<Image ID=\"Image:0\">" + settings
                + "<Pixels ID=\"Pixels:0\" DimensionOrder=\"XYZCT\" Type=\"uint16\" "
                + pixelsAttributes + "/></Image></OME>";
    }

    /**
     * 4 x 4 x 3、xy 100 nm、z 250 nm、NA 1.4 の油浸です。
     */
    public static String standardXml() {
        return xml(3, 4);
    }

    public static String xml(int nz, int n) {
        return omeXml(String.format(Locale.ROOT,
                "SizeX=\"%d\" SizeY=\"%d\" SizeZ=\"%d\" SizeC=\"1\" SizeT=\"1\" "
                        + "PhysicalSizeX=\"0.1\" PhysicalSizeY=\"0.1\" PhysicalSizeXUnit=\"um\" "
                        + "PhysicalSizeZ=\"0.25\" PhysicalSizeZUnit=\"um\"",
                n, n, nz),
                "<Objective ID=\"Objective:0\" LensNA=\"1.4\" Immersion=\"Oil\"/>", "");
    }

    /**
     * {@code 100 z + 10 y + x} の値を持つスタックです。
     */
    public static int[][][] ramp(int nz, int n) {
        int[][][] v = new int[nz][n][n];
        for (int z = 0; z < nz; z++) {
            for (int y = 0; y < n; y++) {
                for (int x = 0; x < n; x++) {
                    v[z][y][x] = 100 * z + 10 * y + x;
                }
            }
        }
        return v;
    }

    /**
     * 中央に z とともに広がるスポットを持つスタックです。
     */
    public static int[][][] spot(int nz, int n) {
        int[][][] v = new int[nz][n][n];
        int c = n / 2;
        for (int z = 0; z < nz; z++) {
            double sigma = 1.2 + 0.4 * Math.abs(z - nz / 2);
            for (int y = 0; y < n; y++) {
                for (int x = 0; x < n; x++) {
                    double r2 = (x - c) * (x - c) + (y - c) * (y - c);
                    v[z][y][x] = (int) (10 + 1000 * Math.exp(-r2 / (2 * sigma * sigma)));
                }
            }
        }
        return v;
    }

    /**
     * 先頭ページの ImageDescription に OME-XML を持つ 16 bit の多ページ TIFF を書きます。
     *
     * @param file 出力先です
     * @param xml OME-XML です
     * @param values {@code [z][y][x]} の画素値です
     * @throws IOException 書き込みに失敗した場合に発生します
     */
    public static void write(Path file, String xml, int[][][] values) throws IOException {
        ImageWriter writer = ImageIO.getImageWritersByFormatName("tiff").next();
        try (ImageOutputStream out = ImageIO.createImageOutputStream(file.toFile())) {
            writer.setOutput(out);
            writer.prepareWriteSequence(null);
            for (int z = 0; z < values.length; z++) {
                int n = values[z].length;
                BufferedImage img = new BufferedImage(n, n, BufferedImage.TYPE_USHORT_GRAY);
                WritableRaster raster = img.getRaster();
                for (int y = 0; y < n; y++) {
                    for (int x = 0; x < n; x++) {
                        raster.setSample(x, y, 0, values[z][y][x]);
                    }
                }
                IIOMetadata meta = null;
                if (z == 0) {
                    IIOMetadata defaults = writer.getDefaultImageMetadata(
                            ImageTypeSpecifier.createFromRenderedImage(img), null);
                    TIFFDirectory dir = TIFFDirectory.createFromMetadata(defaults);
                    TIFFTag tag = BaselineTIFFTagSet.getInstance()
                            .getTag(BaselineTIFFTagSet.TAG_IMAGE_DESCRIPTION);
                    dir.addTIFFField(
                            new TIFFField(tag, TIFFTag.TIFF_ASCII, 1, new String[] {xml}));
                    meta = dir.getAsMetadata();
                }
                writer.writeToSequence(new IIOImage(img, null, meta), null);
            }
            writer.endWriteSequence();
        } finally {
            writer.dispose();
        }
    }
}
