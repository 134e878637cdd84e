package com.memberassist.orchestrator.service.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a catalog document of the form {@code tools: [ {name, description, endpoint, capabilities, parameters, examples} ]}.
 */
public class ToolCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(ToolCatalogLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper yamlMapper;

    public ToolCatalogLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ToolCatalog load(String location) {
        log.info("Loading tool catalog from {}", location);
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogConfigurationException("Tool catalog not found: " + location);
        }
        JsonNode root;
        try (InputStream input = resource.getInputStream()) {
            root = yamlMapper.readTree(input);
        } catch (IOException e) {
            throw new CatalogConfigurationException("Failed to read tool catalog " + location, e);
        }
        ToolCatalog catalog = new ToolCatalog(parse(root));
        log.info("Loaded {} tools from {}: {}", catalog.size(), location, catalog.names());
        return catalog;
    }

    List<ToolDefinition> parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new CatalogConfigurationException("Tool catalog must be a mapping with a top-level 'tools' key");
        }
        JsonNode toolsNode = root.get("tools");
        if (toolsNode == null) {
            throw new CatalogConfigurationException("Tool catalog must contain a top-level 'tools' key");
        }
        if (!toolsNode.isArray()) {
            throw new CatalogConfigurationException("'tools' must be a list, got " + toolsNode.getNodeType());
        }
        List<ToolDefinition> tools = new ArrayList<>();
        for (int i = 0; i < toolsNode.size(); i++) {
            try {
                tools.add(yamlMapper.treeToValue(toolsNode.get(i), ToolDefinition.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new CatalogConfigurationException("Failed to parse tool at index %d: %s".formatted(i, e.getMessage()), e);
            }
        }
        return tools;
    }
}
