package com.phillippitts.satupscale.service.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Looks up a model's version in the model registry, a JSON array of
 * {@code {"name": ..., "weights_url": ...}} entries.
 *
 * <p>The version comes from the weights URL: the {@code /download/v.../} release segment if
 * present, otherwise the first {@code vX.Y[.Z]} token. Anything else, including an unreadable
 * registry, yields {@value #UNKNOWN}.
 */
public final class ModelVersionResolver {

    private static final Logger LOG = LogManager.getLogger(ModelVersionResolver.class);

    public static final String UNKNOWN = "Unknown";

    private static final Pattern RELEASE_SEGMENT = Pattern.compile("/download/(v[^/]+)/");
    private static final Pattern VERSION_TOKEN = Pattern.compile("\\bv\\d+\\.\\d+(?:\\.\\d+)?\\b");

    private final Path defaultRegistry;

    public ModelVersionResolver(Path defaultRegistry) {
        this.defaultRegistry = Objects.requireNonNull(defaultRegistry, "defaultRegistry");
    }

    /**
     * @param registryPath registry to read, or null for the default
     */
    public String resolve(String modelName, Path registryPath) {
        if (modelName == null || modelName.isEmpty()) {
            return UNKNOWN;
        }
        JSONArray models = load(registryPath != null ? registryPath : defaultRegistry);
        for (int i = 0; i < models.length(); i++) {
            JSONObject entry = models.optJSONObject(i);
            if (entry == null || !modelName.equals(entry.optString("name"))) {
                continue;
            }
            String version = extractVersion(entry.optString("weights_url"));
            return version != null ? version : UNKNOWN;
        }
        return UNKNOWN;
    }

    static String extractVersion(String weightsUrl) {
        if (weightsUrl == null || weightsUrl.isEmpty()) {
            return null;
        }
        Matcher release = RELEASE_SEGMENT.matcher(weightsUrl);
        if (release.find()) {
            return release.group(1);
        }
        Matcher token = VERSION_TOKEN.matcher(weightsUrl);
        return token.find() ? token.group() : null;
    }

    private static JSONArray load(Path registry) {
        try {
            String text = Files.readString(registry, StandardCharsets.UTF_8);
            Object parsed = new JSONTokener(text).nextValue();
            if (parsed instanceof JSONArray array) {
                return array;
            }
            LOG.debug("Model registry {} is not a JSON array", registry);
        } catch (IOException | JSONException e) {
            LOG.debug("Model registry {} unreadable: {}", registry, e.toString());
        }
        return new JSONArray();
    }
}
