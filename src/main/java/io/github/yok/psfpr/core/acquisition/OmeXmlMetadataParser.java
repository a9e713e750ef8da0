package io.github.yok.psfpr.core.acquisition;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * OME-XML（OME-TIFF の ImageDescription）から PSF の取得条件を取り出すクラスです。
 *
 * <p>
 * 要素は名前空間に依存せずローカル名で探索します。以下を満たさない場合は
 * {@link AcquisitionException.Kind#UNSUPPORTED_FORMAT} とします。
 * </p>
 *
 * <ul>
 * <li>PhysicalSizeX と PhysicalSizeY が等しいこと</li>
 * <li>長さの単位が um / µm / micron / nm のいずれかであること（省略時は µm）</li>
 * <li>SizeC と SizeT が 1 であること</li>
 * <li>SizeX と SizeY が等しいこと</li>
 * </ul>
 */
public final class OmeXmlMetadataParser {

    /**
     * 液浸媒質名から屈折率への対応です。
     */
    private static final Map<String, Double> IMMERSION_TO_RI =
            Map.of("oil", 1.518, "glycerol", 1.472, "water", 1.333, "air", 1.0);

    /**
     * OME-XML を解析します。
     *
     * @param xml OME-XML 文字列です
     * @return 取得条件です
     * @throws AcquisitionException 形式が対応外の場合に発生します
     */
    public OmeXmlMetadata parse(String xml) {
        if (xml == null || xml.isBlank()) {
            throw unsupported("Only OME-tif file format is supported", null);
        }
        Document doc = readDocument(xml);

        Element pixels = firstByLocalName(doc.getDocumentElement(), "Pixels");
        if (pixels == null) {
            throw unsupported("OME-XML に Pixels 要素がありません", null);
        }

        // 1) 画素サイズと単位
        String sizeX = pixels.getAttribute("PhysicalSizeX");
        String sizeY = pixels.getAttribute("PhysicalSizeY");
        if (sizeX.isEmpty() || !sizeX.equals(sizeY)
                && parseDouble(sizeX, "PhysicalSizeX") != parseDouble(sizeY, "PhysicalSizeY")) {
            throw unsupported("Identical pixel size required for X and Y", null);
        }
        String unitX = pixels.getAttribute("PhysicalSizeXUnit");
        String unitZ = pixels.getAttribute("PhysicalSizeZUnit");
        int pixelSizeXy = toNanometres(parseDouble(sizeX, "PhysicalSizeX"), unitX,
                "Unit of pixel size not recognized: Must be um, µm, micron or, nm");
        int pixelSizeZ = toNanometres(parseDouble(pixels.getAttribute("PhysicalSizeZ"),
                "PhysicalSizeZ"), unitZ,
                "Unit of z-step not recognized: Must be um, µm, micron or, nm");

        // 2) 画像サイズ
        int sizeC = parseInt(pixels.getAttribute("SizeC"), "SizeC");
        int sizeT = parseInt(pixels.getAttribute("SizeT"), "SizeT");
        if (sizeC != 1 || sizeT != 1) {
            throw unsupported("Only single channel images and no time series are supported",
                    null);
        }
        int sizeXpx = parseInt(pixels.getAttribute("SizeX"), "SizeX");
        int sizeYpx = parseInt(pixels.getAttribute("SizeY"), "SizeY");
        if (sizeXpx != sizeYpx) {
            throw unsupported("Images with equal pixel numbers for X and Y are required", null);
        }
        int sizeZ = parseInt(pixels.getAttribute("SizeZ"), "SizeZ");

        // 3) 対物レンズ
        Element objective = firstByLocalName(doc.getDocumentElement(), "Objective");
        if (objective == null || objective.getAttribute("LensNA").isEmpty()) {
            throw unsupported("OME-XML に Objective/LensNA がありません", null);
        }
        double na = parseDouble(objective.getAttribute("LensNA"), "LensNA");
        double roundedNa = BigDecimal.valueOf(na)
                .setScale(na >= 1.0 ? 3 : 2, RoundingMode.HALF_EVEN).doubleValue();

        return new OmeXmlMetadata(roundedNa, refractiveIndex(doc, objective), pixelSizeXy,
                pixelSizeZ, sizeXpx, sizeZ);
    }

    /**
     * 屈折率を ObjectiveSettings から、無ければ Objective の Immersion から求めます。
     *
     * @return 屈折率です（判別できない場合は 0）
     */
    private static double refractiveIndex(Document doc, Element objective) {
        Element settings = firstByLocalName(doc.getDocumentElement(), "ObjectiveSettings");
        if (settings != null && !settings.getAttribute("RefractiveIndex").isEmpty()) {
            return parseDouble(settings.getAttribute("RefractiveIndex"), "RefractiveIndex");
        }
        String immersion = objective.getAttribute("Immersion");
        Double ri = IMMERSION_TO_RI.get(immersion.toLowerCase(Locale.ROOT));
        return ri == null ? 0.0 : ri;
    }

    private static int toNanometres(double value, String unit, String message) {
        String u = unit.isEmpty() ? "µm" : unit;
        switch (u) {
            case "um":
            case "µm":
            case "micron":
                return (int) (value * 1000.0);
            case "nm":
                return (int) value;
            default:
                throw unsupported(message + ": " + unit, null);
        }
    }

    private static Document readDocument(String xml) {
        try {
            DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
            f.setNamespaceAware(true);
            f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            f.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            DocumentBuilder builder = f.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw unsupported("OME-XML を解析できません", e);
        }
    }

    private static Element firstByLocalName(Element root, String localName) {
        NodeList list = root.getElementsByTagNameNS("*", localName);
        for (int i = 0; i < list.getLength(); i++) {
            Node n = list.item(i);
            if (n instanceof Element) {
                return (Element) n;
            }
        }
        return null;
    }

    private static double parseDouble(String text, String name) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw unsupported(name + " を数値として解釈できません: '" + text + "'", e);
        }
    }

    private static int parseInt(String text, String name) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw unsupported(name + " を整数として解釈できません: '" + text + "'", e);
        }
    }

    private static AcquisitionException unsupported(String message, Throwable cause) {
        return new AcquisitionException(AcquisitionException.Kind.UNSUPPORTED_FORMAT, message,
                cause);
    }
}
