package com.pdm.engine.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pdm.common.util.JsonUtil;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Reads JSON catalog resources, translating any failure into a
 * {@link CatalogLoadException} that names the resource.
 */
public final class CatalogReader {

    private CatalogReader() {}

    public static <T> T read(Resource resource, TypeReference<T> type) {
        if (resource == null || !resource.exists()) {
            throw new CatalogLoadException("Catalog resource not found: " + resource);
        }
        try (InputStream in = resource.getInputStream()) {
            T value = JsonUtil.fromJson(in, type);
            if (value == null) {
                throw new CatalogLoadException("Catalog resource is empty: " + resource.getDescription());
            }
            return value;
        } catch (IOException | UncheckedIOException e) {
            throw new CatalogLoadException("Failed to read catalog " + resource.getDescription(), e);
        }
    }
}
