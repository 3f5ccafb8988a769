package com.treewright.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.treewright.TreewrightException;
import com.treewright.ast.AstNode;
import com.treewright.ast.SyntaxTree;
import com.treewright.json.AstJsonDeserializer;
import com.treewright.json.AstJsonException;
import com.treewright.json.AstJsonProvider;
import com.treewright.json.AstJsonSerializer;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(TreewrightJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(AstNode node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.getKind().displayName(), e);
            }
        }

        @Override
        public String serializePretty(AstNode node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.getKind().displayName(), e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public SyntaxTree deserializeTree(String json) throws AstJsonException {
            AstNode root = read(json, "syntax tree");
            try {
                return new SyntaxTree(root);
            } catch (IllegalStateException e) {
                throw new AstJsonException("Deserialized tree is not well formed", e);
            }
        }

        @Override
        public <T extends AstNode> T deserialize(String json, Class<T> type) throws AstJsonException {
            AstNode node = read(json, type.getSimpleName());
            if (!type.isInstance(node)) {
                throw new AstJsonException("Expected " + type.getSimpleName() + " but JSON holds "
                    + node.getKind().displayName());
            }
            return type.cast(node);
        }

        private AstNode read(String json, String what) {
            AstNode node;
            try {
                node = mapper.readValue(json, AstNode.class);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize " + what, e);
            } catch (TreewrightException | IllegalArgumentException e) {
                // Role, category and enum violations raised while rebuilding the nodes
                throw new AstJsonException("Failed to deserialize " + what + ": " + e.getMessage(), e);
            }
            if (node == null) {
                throw new AstJsonException("No " + what + " in JSON input");
            }
            return node;
        }
    }
}
