package com.forcetree.jackson;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances configured for AST serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = ForceTreeJackson.createObjectMapper(true);
 * String json = mapper.writeValueAsString(unit);
 * CompilationUnit unit = mapper.readValue(json, CompilationUnit.class);
 * Node.linkParents(unit);
 * </pre>
 */
public final class ForceTreeJackson {

    private ForceTreeJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper for AST serialization and deserialization.
     *
     * The returned mapper:
     * - Reads and writes node state through fields and binds constructors by parameter name
     * - Tags every node with an "@type" property holding its class name
     * - Omits null values, so absent optional children do not appear
     * - Never writes parent links
     *
     * @param includeLocations whether source locations are written
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper(boolean includeLocations) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        mapper.setVisibility(PropertyAccessor.CREATOR, JsonAutoDetect.Visibility.PUBLIC_ONLY);

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Ignore unknown properties during deserialization
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule(includeLocations));

        return mapper;
    }
}
