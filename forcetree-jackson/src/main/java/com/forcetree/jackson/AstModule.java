package com.forcetree.jackson;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.cfg.MapperConfig;
import com.fasterxml.jackson.databind.introspect.Annotated;
import com.fasterxml.jackson.databind.introspect.AnnotatedConstructor;
import com.fasterxml.jackson.databind.introspect.NopAnnotationIntrospector;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.forcetree.ast.Node;
import com.forcetree.ast.SourceLocation;
import com.forcetree.ast.TypeRef;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Jackson module that configures serialization/deserialization for the AST classes.
 *
 * This module handles:
 * - Polymorphic node types via an "@type" property, with subtypes found from the sealed hierarchy
 * - Constructor binding for the immutable node classes
 * - Dropping parent links and, in compact mode, source locations
 */
public class AstModule extends SimpleModule {

    public static final String TYPE_PROPERTY = "@type";

    // Tree links are rebuilt on deserialization
    private static final Set<String> EXCLUDED_FIELDS = Set.of("parent", "children");

    private final boolean includeLocations;

    public AstModule(boolean includeLocations) {
        super("AstModule", new Version(1, 0, 0, null, "com.forcetree", "forcetree-jackson"));
        this.includeLocations = includeLocations;
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.registerSubtypes(concreteNodeTypes().toArray(new NamedType[0]));

        context.insertAnnotationIntrospector(new AstAnnotationIntrospector());
        context.addBeanSerializerModifier(new AstSerializerModifier(includeLocations));
    }

    /**
     * Walks the sealed hierarchy below {@link Node} and names every concrete class by its simple name.
     */
    static List<NamedType> concreteNodeTypes() {
        List<NamedType> result = new ArrayList<>();
        collectConcreteTypes(Node.class, result);
        return result;
    }

    private static void collectConcreteTypes(Class<?> type, List<NamedType> out) {
        if (!Modifier.isAbstract(type.getModifiers())) {
            out.add(new NamedType(type, type.getSimpleName()));
        }
        Class<?>[] permitted = type.getPermittedSubclasses();
        if (permitted != null) {
            for (Class<?> subtype : permitted) {
                collectConcreteTypes(subtype, out);
            }
        }
    }

    // ==================== Mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = TYPE_PROPERTY)
    private abstract static class NodeMixin {
    }

    // ==================== Creator detection ====================

    /**
     * Treats the public constructor of each AST class as a properties-based creator, so the AST
     * needs no Jackson annotations.
     */
    private static class AstAnnotationIntrospector extends NopAnnotationIntrospector {
        @Override
        public JsonCreator.Mode findCreatorAnnotation(MapperConfig<?> config, Annotated a) {
            if (a instanceof AnnotatedConstructor constructor && isAstClass(constructor.getDeclaringClass())) {
                return JsonCreator.Mode.PROPERTIES;
            }
            return null;
        }

        private static boolean isAstClass(Class<?> type) {
            return Node.class.isAssignableFrom(type)
                || type == TypeRef.Component.class
                || type == SourceLocation.class;
        }
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {
        private final boolean includeLocations;

        AstSerializerModifier(boolean includeLocations) {
            this.includeLocations = includeLocations;
        }

        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            if (!Node.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }
            List<BeanPropertyWriter> filtered = new ArrayList<>();
            for (BeanPropertyWriter prop : beanProperties) {
                if (EXCLUDED_FIELDS.contains(prop.getName())) {
                    continue;
                }
                if (!includeLocations && prop.getType().hasRawClass(SourceLocation.class)) {
                    continue;
                }
                filtered.add(prop);
            }
            return filtered;
        }
    }
}
