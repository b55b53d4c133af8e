package com.phillippitts.satupscale.service.upscale;

import com.phillippitts.satupscale.service.raster.BandInfo;
import com.phillippitts.satupscale.service.raster.Resampling;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Chooses resampling per band: nearest for categorical bands so class values survive, bilinear
 * for continuous measurements.
 */
public final class BandResamplingPolicy {

    private static final List<String> CATEGORICAL_TOKENS = List.of("qa", "mask", "class", "label", "cloud", "flag", "scl");

    private BandResamplingPolicy() {
    }

    public static Resampling forBand(BandInfo band) {
        return isCategorical(band) ? Resampling.NEAREST : Resampling.BILINEAR;
    }

    /**
     * A band is categorical when its description or any tag key or value mentions a categorical
     * token, or when it is stored as {@code bool} or {@code uint8} and not described as reflectance.
     */
    public static boolean isCategorical(BandInfo band) {
        StringBuilder text = new StringBuilder();
        if (band.description() != null) {
            text.append(band.description().toLowerCase(Locale.ROOT));
        }
        for (Map.Entry<String, String> tag : band.tags().entrySet()) {
            text.append(' ').append(tag.getKey().toLowerCase(Locale.ROOT));
            text.append(' ').append(String.valueOf(tag.getValue()).toLowerCase(Locale.ROOT));
        }
        String joined = text.toString();
        for (String token : CATEGORICAL_TOKENS) {
            if (joined.contains(token)) {
                return true;
            }
        }
        String dtype = band.dataType().toLowerCase(Locale.ROOT);
        return (dtype.equals("bool") || dtype.equals("uint8")) && !joined.contains("reflectance");
    }
}
