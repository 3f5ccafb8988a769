package com.treewright.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.treewright.ast.ConfigurationException;
import com.treewright.rewrite.RewriteOptions;
import com.treewright.rewrite.TriviaPrecedence;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads {@link RewriteOptions} from YAML.
 *
 * <pre>
 * rewrite:
 *   triviaPrecedence: REMOVED_NODE   # REMOVED_NODE | REPLACEMENT | MERGE
 *   inheritTrailingTrivia: true
 * analyzers:
 *   testAttributeNames: [Test, TestCase, Fact]
 * </pre>
 *
 * Missing or invalid values fall back to the defaults with a warning. An unreadable file falls
 * back to the bundled {@code /treewright-default.yml}.
 */
public final class RewriteOptionsLoader {

    private static final Logger LOG = Logger.getLogger(RewriteOptionsLoader.class.getName());
    static final String DEFAULT_CONFIG_RESOURCE = "/treewright-default.yml";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static volatile RewriteOptions cachedDefaults;

    private RewriteOptionsLoader() {
    }

    /**
     * Loads options from a file, falling back to the bundled defaults when the file is missing or
     * cannot be parsed.
     */
    public static RewriteOptions load(Path configPath) {
        if (configPath == null) {
            LOG.warning("No config path provided, using default rewrite options");
            return loadDefaults();
        }
        if (!Files.exists(configPath)) {
            LOG.warning(() -> "Configuration file not found: " + configPath + ", using default rewrite options");
            return loadDefaults();
        }
        try {
            LOG.fine(() -> "Loading rewrite options from " + configPath);
            return fromMap(yamlMapper().readValue(configPath.toFile(), MAP_TYPE));
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Error parsing configuration file " + configPath + ": " + e.getMessage(), e);
            return loadDefaults();
        }
    }

    /**
     * Parses options from YAML text. Unlike {@link #load(Path)} malformed YAML is an error.
     *
     * @throws ConfigurationException if the text is not valid YAML
     */
    public static RewriteOptions parse(String yaml) {
        try {
            Map<String, Object> config = yamlMapper().readValue(yaml, MAP_TYPE);
            return fromMap(config);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid rewrite options YAML: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * The options in the bundled default configuration, or {@link RewriteOptions#defaults()} when
     * the resource cannot be read.
     */
    public static RewriteOptions loadDefaults() {
        RewriteOptions defaults = cachedDefaults;
        if (defaults != null) {
            return defaults;
        }
        try (InputStream in = RewriteOptionsLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                LOG.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return RewriteOptions.defaults();
            }
            defaults = fromMap(yamlMapper().readValue(in, MAP_TYPE));
            cachedDefaults = defaults;
            return defaults;
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Failed to load default configuration", e);
            return RewriteOptions.defaults();
        }
    }

    private static RewriteOptions fromMap(Map<String, Object> config) {
        RewriteOptions defaults = RewriteOptions.defaults();
        if (config == null) {
            return defaults;
        }
        Map<String, Object> rewrite = section(config, "rewrite");
        Map<String, Object> analyzers = section(config, "analyzers");

        TriviaPrecedence precedence = defaults.triviaPrecedence();
        Object precedenceValue = rewrite.get("triviaPrecedence");
        if (precedenceValue instanceof String text) {
            try {
                precedence = TriviaPrecedence.valueOf(text.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                LOG.warning(() -> "Unknown triviaPrecedence '" + text + "', using " + defaults.triviaPrecedence());
            }
        } else if (precedenceValue != null) {
            LOG.warning("Invalid triviaPrecedence, using " + defaults.triviaPrecedence());
        }

        boolean inherit = defaults.inheritTrailingTrivia();
        Object inheritValue = rewrite.get("inheritTrailingTrivia");
        if (inheritValue instanceof Boolean b) {
            inherit = b;
        } else if (inheritValue != null) {
            LOG.warning("Invalid inheritTrailingTrivia, using " + inherit);
        }

        List<String> testAttributes = defaults.testAttributeNames();
        Object attributesValue = analyzers.get("testAttributeNames");
        if (attributesValue instanceof List<?> list) {
            List<String> names = new ArrayList<>();
            for (Object item : list) {
                if (item instanceof String name && !name.isBlank()) {
                    names.add(name.trim());
                }
            }
            testAttributes = names;
        } else if (attributesValue != null) {
            LOG.warning("Invalid testAttributeNames, using " + testAttributes);
        }

        return new RewriteOptions(precedence, inherit, testAttributes);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> config, String name) {
        Object value = config.get(name);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        if (value != null) {
            LOG.warning(() -> "Invalid '" + name + "' section in config, using defaults");
        }
        return Map.of();
    }

    private static ObjectMapper yamlMapper() {
        return TreewrightJackson.createYamlMapper();
    }
}
