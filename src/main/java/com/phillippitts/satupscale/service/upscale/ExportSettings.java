package com.phillippitts.satupscale.service.upscale;

import java.util.Objects;

/** Band policy and output format label chosen for a run; recorded in processing reports. */
public record ExportSettings(BandHandling bandHandling, String outputFormat) {

    public ExportSettings {
        Objects.requireNonNull(bandHandling, "bandHandling");
        Objects.requireNonNull(outputFormat, "outputFormat");
    }
}
