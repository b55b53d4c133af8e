package com.phillippitts.satupscale.service.raster;

import java.util.Map;

/**
 * Per-band metadata carried through a geospatial rewrite.
 *
 * @param description band description, or null
 * @param tags band-level metadata tags
 * @param dataType storage type name such as {@code uint16}, {@code float32} or {@code bool}
 */
public record BandInfo(String description, Map<String, String> tags, String dataType) {

    public BandInfo {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        dataType = dataType == null ? "float32" : dataType;
    }
}
