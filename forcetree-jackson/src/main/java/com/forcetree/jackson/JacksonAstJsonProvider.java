package com.forcetree.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forcetree.ast.CompilationUnit;
import com.forcetree.ast.Node;
import com.forcetree.json.AstJsonDeserializer;
import com.forcetree.json.AstJsonException;
import com.forcetree.json.AstJsonProvider;
import com.forcetree.json.AstJsonSerializer;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonSerializer compactSerializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this.mapper = ForceTreeJackson.createObjectMapper(true);
        this.serializer = new JacksonSerializer(mapper);
        this.compactSerializer = new JacksonSerializer(ForceTreeJackson.createObjectMapper(false));
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonSerializer getCompactSerializer() {
        return compactSerializer;
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
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException(typeOf(node), "Failed to serialize " + describe(node), e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException(typeOf(node), "Failed to serialize " + describe(node), e);
            }
        }

        private static Class<? extends Node> typeOf(Node node) {
            return node != null ? node.getClass() : null;
        }

        private static String describe(Node node) {
            return node != null ? node.getClass().getSimpleName() + " at " + node.loc() : "null node";
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public CompilationUnit deserializeCompilationUnit(String json) throws AstJsonException {
            return deserialize(json, CompilationUnit.class);
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            T node;
            try {
                node = mapper.readValue(json, type);
            } catch (Exception e) {
                throw new AstJsonException(type, "Failed to deserialize " + type.getSimpleName(), e);
            }
            if (node == null) {
                throw new AstJsonException(type, "No " + type.getSimpleName() + " found in JSON input", null);
            }
            Node.linkParents(node);
            return node;
        }
    }
}
