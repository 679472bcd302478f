package com.fxtrace.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * The declared methods of the traced value type.
 *
 * Generic dispatch records an operation as {@code call_method} when its name
 * is listed here and as {@code call_function} otherwise.
 *
 * Catalog files are JSON:
 *
 * <pre>
 * { "type": "Tensor", "methods": ["add", "relu", "view"] }
 * </pre>
 */
@Log4j2
public final class MethodCatalog {
    public static final String DEFAULT_RESOURCE = "tensor-methods.json";

    private static final MethodCatalog EMPTY = new MethodCatalog("", Set.of());
    private static final Map<String, MethodCatalog> LOADED = new ConcurrentHashMap<>();

    private final String typeName;
    private final Set<String> methods;

    private MethodCatalog(String typeName, Set<String> methods) {
        this.typeName = typeName;
        this.methods = methods;
    }

    public static MethodCatalog empty() {
        return EMPTY;
    }

    public static MethodCatalog of(String typeName, String... methods) {
        return new MethodCatalog(typeName, Set.copyOf(List.of(methods)));
    }

    /**
     * Loads a catalog from the classpath. Each resource is read once.
     *
     * @throws IllegalArgumentException if the resource does not exist.
     * @throws UncheckedIOException     if it cannot be parsed.
     */
    public static MethodCatalog fromResource(String resource) {
        return LOADED.computeIfAbsent(resource, MethodCatalog::read);
    }

    private static MethodCatalog read(String resource) {
        try (InputStream in = MethodCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Method catalog not found on classpath: " + resource);
            var def = new ObjectMapper().readValue(in, CatalogDef.class);
            List<String> names = def.getMethods() != null ? def.getMethods() : List.of();
            var catalog = new MethodCatalog(def.getType() != null ? def.getType() : "", Set.copyOf(names));
            log.info("Loaded method catalog {} for type '{}' ({} methods)", resource, catalog.typeName,
                    catalog.methods.size());
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read method catalog " + resource, e);
        }
    }

    public String typeName() {
        return typeName;
    }

    public boolean isMethod(String name) {
        return methods.contains(name);
    }

    public Set<String> methods() {
        return methods;
    }

    /** JSON shape of a catalog file. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CatalogDef {
        private String type;
        private List<String> methods;
    }
}
