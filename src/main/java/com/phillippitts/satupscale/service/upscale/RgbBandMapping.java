package com.phillippitts.satupscale.service.upscale;

/**
 * Zero-based band indexes used as red, green and blue when reducing a many-band raster to three
 * display channels. Negative indexes select the first band.
 *
 * @param source human-readable origin of the mapping (provider default, fallback, user choice)
 */
public record RgbBandMapping(int red, int green, int blue, String source) {

    /**
     * Default mapping by band count: one band is repeated, two bands reuse the second for blue,
     * three or more take the first three.
     */
    public static RgbBandMapping defaultFor(int bandCount) {
        if (bandCount <= 1) {
            return new RgbBandMapping(0, 0, 0, "single-band fallback");
        }
        if (bandCount == 2) {
            return new RgbBandMapping(0, 1, 1, "two-band fallback");
        }
        return new RgbBandMapping(0, 1, 2, "rgb-first fallback");
    }

    /**
     * Converts to one-based band numbers clamped to {@code bandCount}.
     */
    public int[] toBandNumbers(int bandCount) {
        int[] candidates = {red, green, blue};
        int[] numbers = new int[3];
        for (int i = 0; i < 3; i++) {
            int value = candidates[i];
            numbers[i] = value < 0 ? 1 : Math.min(value + 1, bandCount);
        }
        return numbers;
    }
}
