package io.github.yok.psfpr.core.acquisition;

import io.github.yok.psfpr.core.parameter.FitParameterKey;
import io.github.yok.psfpr.core.parameter.FitParameters;
import lombok.Value;

/**
 * PSF ファイルから読み取った取得条件と画素データです。
 */
@Value
public class PsfAcquisition {

    /**
     * 開口数です。
     */
    double numericalAperture;

    /**
     * 液浸媒質の屈折率です。
     */
    double refractiveIndex;

    /**
     * xy ボクセルサイズ（nm）です。
     */
    int pixelSizeXy;

    /**
     * z ステップ（nm）です。
     */
    int pixelSizeZ;

    /**
     * xy 方向の画素数です。
     */
    int imageSizeXy;

    /**
     * z 方向の枚数です。
     */
    int imageSizeZ;

    /**
     * 画素データです。
     */
    PixelStack pixelStack;

    /**
     * 取得条件をパラメータへ反映します。発光波長はファイルに含まれないため変更しません。
     *
     * @param parameters 反映先です
     */
    public void applyTo(FitParameters parameters) {
        parameters.set(FitParameterKey.NUMERICAL_APERTURE, numericalAperture);
        parameters.set(FitParameterKey.REFRACTIVE_INDEX, refractiveIndex);
        parameters.set(FitParameterKey.XY_RESOLUTION, pixelSizeXy);
        parameters.set(FitParameterKey.Z_RESOLUTION, pixelSizeZ);
        parameters.setXySize(imageSizeXy);
        parameters.setZSize(imageSizeZ);
    }
}
