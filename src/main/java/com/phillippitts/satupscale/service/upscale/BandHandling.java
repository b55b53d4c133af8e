package com.phillippitts.satupscale.service.upscale;

import java.util.Arrays;
import java.util.List;

/**
 * How many bands an export keeps. Labels match the operator-facing wording.
 */
public enum BandHandling {
    RGB_ONLY("RGB only"),
    RGB_PLUS_ALL("RGB + all bands"),
    ALL_BANDS("All bands");

    private final String label;

    BandHandling(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(BandHandling::label).toList();
    }

    /**
     * @throws IllegalArgumentException for an unknown label
     */
    public static BandHandling fromLabel(String label) {
        for (BandHandling value : values()) {
            if (value.label.equals(label)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown band handling label: " + label);
    }
}
