package com.phillippitts.satupscale.service.upscale;

import java.util.List;
import java.util.Objects;

/**
 * Formats to produce for one input.
 *
 * @param masterFormat format label of the primary output (e.g. "GeoTIFF", "PNG")
 * @param visualFormat format label of the optional display output, or null
 * @param criticalWarnings warnings about metadata the plan will lose
 */
public record OutputPlan(String masterFormat, String visualFormat, List<String> criticalWarnings) {

    public OutputPlan {
        Objects.requireNonNull(masterFormat, "masterFormat");
        criticalWarnings = criticalWarnings == null ? List.of() : List.copyOf(criticalWarnings);
    }

    public static OutputPlan masterOnly(String masterFormat) {
        return new OutputPlan(masterFormat, null, List.of());
    }

    public boolean hasVisual() {
        return visualFormat != null && !visualFormat.isBlank();
    }
}
