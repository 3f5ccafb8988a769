package com.treewright.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.treewright.ast.AstNode;
import com.treewright.ast.Attachment;
import com.treewright.ast.NodeKind;
import com.treewright.ast.Role;
import com.treewright.ast.Roles;
import com.treewright.ast.Token;
import com.treewright.ast.TokenKind;
import com.treewright.ast.TokenNode;
import com.treewright.ast.Trivia;
import com.treewright.ast.TriviaKind;
import com.treewright.parser.SyntaxFactory;
import com.treewright.pattern.AnyNode;
import com.treewright.pattern.Repeat;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Jackson module that maps syntax trees to JSON and back.
 *
 * <p>Every node is written as its kind plus its children in document order, each tagged with the
 * id of the role it fills:</p>
 * <pre>{@code
 * {"kind":"WhileStatement","children":[{"role":"WhileKeyword","node":{"kind":"Token","token":{...}}}, ...]}
 * }</pre>
 * Tokens carry kind, text, offset and both trivia lists, so a deserialized tree prints back to the
 * exact source text. Placeholders carry their binding name and kind restriction.
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.treewright", "treewright-jackson"));
        addSerializer(AstNode.class, new AstNodeSerializer());
        addDeserializer(AstNode.class, new AstNodeDeserializer());
    }

    // ==================== Serialization ====================

    private static class AstNodeSerializer extends JsonSerializer<AstNode> {

        @Override
        public Class<AstNode> handledType() {
            return AstNode.class;
        }

        @Override
        public void serialize(AstNode node, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("kind", node.getKind().displayName());
            if (node instanceof TokenNode tokenNode) {
                gen.writeFieldName("token");
                writeToken(tokenNode.getToken(), gen);
            } else if (node instanceof AnyNode anyNode) {
                writeNullableString(gen, "name", anyNode.getName());
                if (anyNode.getRestriction() != null) {
                    gen.writeStringField("restriction", anyNode.getRestriction().displayName());
                }
            } else if (node instanceof Repeat repeat) {
                writeNullableString(gen, "name", repeat.getName());
            }
            if (node.hasChildren()) {
                gen.writeArrayFieldStart("children");
                for (Attachment attachment : node.getAttachments()) {
                    gen.writeStartObject();
                    gen.writeStringField("role", attachment.role().getId());
                    gen.writeFieldName("node");
                    serialize(attachment.node(), gen, serializers);
                    gen.writeEndObject();
                }
                gen.writeEndArray();
            }
            gen.writeEndObject();
        }

        private static void writeToken(Token token, JsonGenerator gen) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("kind", token.kind().name());
            gen.writeStringField("text", token.text());
            gen.writeNumberField("offset", token.offset());
            writeTrivia(gen, "leading", token.leadingTrivia());
            writeTrivia(gen, "trailing", token.trailingTrivia());
            gen.writeEndObject();
        }

        private static void writeTrivia(JsonGenerator gen, String field, List<Trivia> trivia) throws IOException {
            if (trivia.isEmpty()) {
                return;
            }
            gen.writeArrayFieldStart(field);
            for (Trivia t : trivia) {
                gen.writeStartObject();
                gen.writeStringField("kind", t.kind().name());
                gen.writeStringField("text", t.text());
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }

        private static void writeNullableString(JsonGenerator gen, String field, String value) throws IOException {
            if (value != null) {
                gen.writeStringField(field, value);
            }
        }
    }

    // ==================== Deserialization ====================

    private static class AstNodeDeserializer extends JsonDeserializer<AstNode> {

        @Override
        public AstNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode json = p.readValueAsTree();
            return toNode(json, ctxt);
        }

        private AstNode toNode(JsonNode json, DeserializationContext ctxt) throws IOException {
            if (json == null || !json.isObject() || !json.hasNonNull("kind")) {
                return ctxt.reportInputMismatch(AstNode.class, "Expected a node object with a 'kind' field");
            }
            NodeKind kind;
            try {
                kind = NodeKind.fromDisplayName(json.get("kind").asText());
            } catch (IllegalArgumentException e) {
                return ctxt.reportInputMismatch(AstNode.class, e.getMessage());
            }
            AstNode node = switch (kind) {
                case TOKEN -> new TokenNode(readToken(json.get("token"), ctxt));
                case ANY_NODE -> new AnyNode(textOrNull(json, "name"), json.hasNonNull("restriction")
                    ? NodeKind.fromDisplayName(json.get("restriction").asText()) : null);
                case REPEAT -> new Repeat(textOrNull(json, "name"));
                default -> SyntaxFactory.createEmpty(kind);
            };
            JsonNode children = json.get("children");
            if (children != null && children.isArray()) {
                for (JsonNode child : children) {
                    Role role = Roles.registry().findRole(child.path("role").asText());
                    if (role == null) {
                        return ctxt.reportInputMismatch(AstNode.class, "Unknown role '%s' in %s",
                            child.path("role").asText(), kind.displayName());
                    }
                    node.addChild(role, toNode(child.get("node"), ctxt));
                }
            }
            return node;
        }

        private static Token readToken(JsonNode json, DeserializationContext ctxt) throws IOException {
            if (json == null || !json.isObject()) {
                return ctxt.reportInputMismatch(Token.class, "Token node without a 'token' object");
            }
            return new Token(
                TokenKind.valueOf(json.path("kind").asText()),
                json.path("text").asText(),
                json.path("offset").asInt(-1),
                readTrivia(json.get("leading")),
                readTrivia(json.get("trailing")));
        }

        private static List<Trivia> readTrivia(JsonNode json) {
            List<Trivia> trivia = new ArrayList<>();
            if (json != null && json.isArray()) {
                for (JsonNode t : json) {
                    trivia.add(new Trivia(TriviaKind.valueOf(t.path("kind").asText()), t.path("text").asText()));
                }
            }
            return trivia;
        }

        private static String textOrNull(JsonNode json, String field) {
            return json.hasNonNull(field) ? json.get(field).asText() : null;
        }
    }
}
