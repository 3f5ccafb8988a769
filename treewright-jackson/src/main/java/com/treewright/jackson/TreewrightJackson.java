package com.treewright.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for syntax tree serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = TreewrightJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(tree.getRoot());
 * AstNode node = mapper.readValue(json, AstNode.class);
 * </pre>
 */
public final class TreewrightJackson {

    private TreewrightJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper with the {@link AstModule} registered. Unknown properties are
     * ignored on input and null values are left out on output.
     */
    public static ObjectMapper createObjectMapper() {
        return configure(new ObjectMapper());
    }

    /**
     * Same configuration as {@link #createObjectMapper()}, reading and writing YAML.
     */
    public static ObjectMapper createYamlMapper() {
        return configure(new ObjectMapper(new YAMLFactory()));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.registerModule(new ParameterNamesModule());
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new AstModule());
        return mapper;
    }
}
