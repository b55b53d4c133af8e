package com.phillippitts.satupscale.service.upscale.event;

import java.time.Instant;

/** Published when every strategy of an upscale chain failed. */
public record AllStrategiesFailedEvent(String chain, String reason, Instant at) { }
