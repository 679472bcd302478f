package com.fxtrace.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Tracer settings, read from {@value #RESOURCE} on the classpath when present.
 *
 * <pre>
 * {
 *   "friendlyNames": true,
 *   "methodCatalog": "tensor-methods.json"
 * }
 * </pre>
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TracerConfig {
    public static final String RESOURCE = "fxtrace.json";

    /** Whether operands are renamed after the caller's bound names. */
    private boolean friendlyNames = true;

    /** Classpath resource listing the methods of the traced value type. */
    private String methodCatalog = MethodCatalog.DEFAULT_RESOURCE;

    private static final class Holder {
        static final TracerConfig DEFAULTS = load(RESOURCE);
    }

    /**
     * Settings from {@value #RESOURCE}. The file is read once; each call
     * returns a fresh copy, so changing it affects only its holder.
     */
    public static TracerConfig defaults() {
        TracerConfig copy = new TracerConfig();
        copy.setFriendlyNames(Holder.DEFAULTS.isFriendlyNames());
        copy.setMethodCatalog(Holder.DEFAULTS.getMethodCatalog());
        return copy;
    }

    /**
     * Loads settings from a classpath resource, or built-in defaults if it
     * does not exist.
     *
     * @throws UncheckedIOException if the resource exists but cannot be parsed.
     */
    public static TracerConfig load(String resource) {
        try (InputStream in = TracerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", resource);
                return new TracerConfig();
            }
            return new ObjectMapper().readValue(in, TracerConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read tracer config " + resource, e);
        }
    }
}
