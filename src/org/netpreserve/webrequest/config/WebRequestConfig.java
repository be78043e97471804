package org.netpreserve.webrequest.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.webrequest.util.DurationDeserializer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings of the registry and dispatcher. Values come from the bundled {@code defaults.yaml}, overridden key by
 * key by an optional user file.
 *
 * @param listenerThreadName  name prefix of listener threads
 * @param slowDecisionWarning age at which a still pending decision is logged; zero disables the warning
 * @param maxLoggedUrlLength  URLs in log output are shortened to this length; zero disables shortening
 */
public record WebRequestConfig(
        String listenerThreadName,
        @JsonDeserialize(using = DurationDeserializer.class) Duration slowDecisionWarning,
        int maxLoggedUrlLength
) {
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();

    public static WebRequestConfig defaults() {
        try {
            return load(null);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load default web request config", e);
        }
    }

    public static WebRequestConfig load(@Nullable Path configFile) throws IOException {
        JsonNode configTree;
        try (InputStream stream = WebRequestConfig.class.getResourceAsStream("defaults.yaml")) {
            if (stream == null) throw new IOException("defaults.yaml missing from classpath");
            configTree = YAML.readTree(stream);
        }
        if (configFile != null && Files.exists(configFile)) {
            JsonNode overrides = YAML.readTree(configFile.toFile());
            if (overrides != null && !overrides.isMissingNode()) {
                configTree = deepMerge(configTree, overrides);
            }
        }
        return YAML.treeToValue(configTree, WebRequestConfig.class);
    }

    public boolean slowDecisionWarningEnabled() {
        return slowDecisionWarning != null && !slowDecisionWarning.isZero() && !slowDecisionWarning.isNegative();
    }

    private static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }
}
