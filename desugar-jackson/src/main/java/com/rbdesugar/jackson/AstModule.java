package com.rbdesugar.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.rbdesugar.ast.Expression;
import com.rbdesugar.ast.Literal;
import com.rbdesugar.names.Name;
import com.rbdesugar.parser.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Jackson module for the parse tree and the lowered tree.
 *
 * This module handles:
 * - Polymorphic node types, keyed by the record's simple name in a "type" property
 * - Names written as their display text
 * - Literal values, with non-finite floats written as null
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.rbdesugar", "desugar-jackson"));
        registerSubtypes(namedSubtypes(Node.class).toArray(new NamedType[0]));
        registerSubtypes(namedSubtypes(Expression.class).toArray(new NamedType[0]));
        addSerializer(Name.class, new NameSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(Literal.class, LiteralMixin.class);
    }

    /**
     * Every concrete record below {@code root}, following sealed sub-interfaces.
     */
    static List<NamedType> namedSubtypes(Class<?> root) {
        List<NamedType> result = new ArrayList<>();
        Class<?>[] permitted = root.getPermittedSubclasses();
        if (permitted == null) {
            return result;
        }
        for (Class<?> subclass : permitted) {
            if (subclass.isInterface()) {
                result.addAll(namedSubtypes(subclass));
            } else {
                result.add(new NamedType(subclass, subclass.getSimpleName()));
            }
        }
        return result;
    }

    // ==================== Mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    private abstract static class NodeMixin {
    }

    private abstract static class LiteralMixin {
        @JsonSerialize(using = LiteralValueSerializer.class)
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Object value();
    }
}
