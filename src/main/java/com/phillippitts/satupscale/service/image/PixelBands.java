package com.phillippitts.satupscale.service.image;

import java.util.List;

/**
 * Decoded image as separate float bands of equal size, row-major.
 */
public record PixelBands(int width, int height, List<float[]> bands) {

    public PixelBands {
        bands = List.copyOf(bands);
        if (bands.isEmpty()) {
            throw new IllegalArgumentException("image has no bands");
        }
        for (float[] band : bands) {
            if (band.length != width * height) {
                throw new IllegalArgumentException("band size does not match " + width + "x" + height);
            }
        }
    }

    public int bandCount() {
        return bands.size();
    }

    /**
     * @param bandNumbers one-based band numbers, may repeat
     */
    public PixelBands select(int... bandNumbers) {
        float[][] selected = new float[bandNumbers.length][];
        for (int i = 0; i < bandNumbers.length; i++) {
            selected[i] = bands.get(bandNumbers[i] - 1);
        }
        return new PixelBands(width, height, List.of(selected));
    }
}
