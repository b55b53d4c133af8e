package com.phillippitts.satupscale.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Job queue worker settings. Binds to properties prefixed with "job-queue".
 *
 * @param pollIntervalMillis how long the idle worker blocks before re-checking for shutdown
 * @param threadName name of the worker thread
 */
@ConfigurationProperties(prefix = "job-queue")
@Validated
public record JobQueueProperties(
        @DefaultValue("100")
        @Positive(message = "Poll interval must be positive")
        long pollIntervalMillis,

        @DefaultValue("job-queue")
        @NotBlank(message = "Thread name must not be blank")
        String threadName
) {
}
