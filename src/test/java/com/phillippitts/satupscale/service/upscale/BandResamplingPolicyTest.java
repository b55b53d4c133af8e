package com.phillippitts.satupscale.service.upscale;

import com.phillippitts.satupscale.service.raster.BandInfo;
import com.phillippitts.satupscale.service.raster.Resampling;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BandResamplingPolicyTest {

    @Test
    void descriptionTokensMarkBandsCategorical() {
        assertThat(BandResamplingPolicy.forBand(new BandInfo("Scene Classification (SCL)", Map.of(), "uint16")))
                .isEqualTo(Resampling.NEAREST);
        assertThat(BandResamplingPolicy.isCategorical(new BandInfo("QA60", null, "uint16"))).isTrue();
    }

    @Test
    void tagKeysAndValuesAreInspected() {
        assertThat(BandResamplingPolicy.isCategorical(new BandInfo(null, Map.of("role", "cloud_probability"), "float32")))
                .isTrue();
        assertThat(BandResamplingPolicy.isCategorical(new BandInfo(null, Map.of("flag_values", "1 2 4"), "float32")))
                .isTrue();
    }

    @Test
    void byteAndBooleanBandsAreCategoricalUnlessReflectance() {
        assertThat(BandResamplingPolicy.isCategorical(new BandInfo(null, Map.of(), "uint8"))).isTrue();
        assertThat(BandResamplingPolicy.isCategorical(new BandInfo(null, Map.of(), "bool"))).isTrue();
        assertThat(BandResamplingPolicy.isCategorical(new BandInfo("Surface reflectance", Map.of(), "uint8"))).isFalse();
    }

    @Test
    void continuousBandsUseBilinear() {
        assertThat(BandResamplingPolicy.forBand(new BandInfo("Near infrared", Map.of("wavelength", "842"), "uint16")))
                .isEqualTo(Resampling.BILINEAR);
    }
}
