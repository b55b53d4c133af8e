package com.phillippitts.satupscale.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * General upscale settings. Binds to properties prefixed with "upscale".
 *
 * <p>Example application.properties:
 * <pre>
 * upscale.default-output-dir=upscaled_output
 * upscale.model-registry-path=models/registry.json
 * upscale.events-log-component=job-runner
 * </pre>
 *
 * @param defaultOutputDir output directory used when a submission names none
 * @param modelRegistryPath JSON registry used to resolve model versions for reports
 * @param eventsLogComponent {@code component} field stamped on structured job events
 */
@ConfigurationProperties(prefix = "upscale")
@Validated
public record UpscaleProperties(
        @DefaultValue("upscaled_output")
        @NotBlank(message = "Default output directory must not be blank")
        String defaultOutputDir,

        @DefaultValue("models/registry.json")
        @NotBlank(message = "Model registry path must not be blank")
        String modelRegistryPath,

        @DefaultValue("job-runner")
        @NotBlank(message = "Event log component must not be blank")
        String eventsLogComponent
) {
}
