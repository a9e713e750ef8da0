package io.github.yok.psfpr.core.acquisition;

import lombok.Value;

/**
 * OME-XML から取り出した取得条件です。長さは nm に換算済みです。
 */
@Value
public class OmeXmlMetadata {

    double numericalAperture;

    double refractiveIndex;

    int pixelSizeXy;

    int pixelSizeZ;

    int imageSizeXy;

    int imageSizeZ;
}
