package com.phillippitts.satupscale.service.upscale;

import java.nio.file.Path;

/** Called after each request of a batch finishes. */
@FunctionalInterface
public interface BatchProgressListener {

    void onRequestCompleted(int completed, int total, Path masterOutputPath);
}
