package com.phillippitts.satupscale.service.upscale.event;

import java.time.Instant;

/** Published when an upscale strategy fails and the next one in its chain is attempted. */
public record UpscaleFallbackEvent(String chain, String strategy, String reason, Instant at) { }
