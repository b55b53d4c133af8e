package com.phillippitts.satupscale.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.Map;

/**
 * External model runtime settings. Binds to properties prefixed with "upscale.model".
 *
 * <p>Example application.properties:
 * <pre>
 * upscale.model.cache-dir=models
 * upscale.model.timeout-seconds=3600
 * upscale.model.max-stderr-bytes=65536
 * upscale.model.entrypoints.SatelliteSR=satellitesr_wrapper.py
 * upscale.model.entrypoints.[SRGAN adapted to EO]=srgan_eo.infer
 * </pre>
 *
 * @param cacheDir root of installed models
 * @param timeoutSeconds maximum runtime of one model invocation
 * @param maxStderrBytes stderr kept for error reports
 * @param entrypoints python module or script per model name
 */
@ConfigurationProperties(prefix = "upscale.model")
@Validated
public record ModelRuntimeProperties(
        @DefaultValue("models")
        @NotBlank(message = "Model cache directory must not be blank")
        String cacheDir,

        @DefaultValue("3600")
        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @DefaultValue("65536")
        @Positive(message = "Max stderr bytes must be positive")
        int maxStderrBytes,

        Map<String, String> entrypoints
) {
    public ModelRuntimeProperties {
        entrypoints = entrypoints == null ? Map.of() : Map.copyOf(entrypoints);
    }
}
