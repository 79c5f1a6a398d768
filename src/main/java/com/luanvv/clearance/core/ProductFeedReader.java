package com.luanvv.clearance.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.luanvv.clearance.model.Product;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads a {@code data.json} back the way the storefront does: a missing file means no data for
 * that store, anything that is not a JSON array means zero products.
 */
@Slf4j
public class ProductFeedReader {
    private final ObjectMapper objectMapper;

    public ProductFeedReader() {
        this(new ObjectMapper());
    }

    public ProductFeedReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Product> read(Path path) {
        if (!Files.isRegularFile(path)) {
            log.debug("No feed at {}", path);
            return new ArrayList<>();
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            if (root == null || !root.isArray()) {
                log.warn("Feed {} is not a JSON array, treating as empty", path);
                return new ArrayList<>();
            }
            return objectMapper.convertValue(root, new TypeReference<List<Product>>() { });
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Feed {} is unreadable, treating as empty: {}", path, e.getMessage());
            return new ArrayList<>();
        }
    }
}
