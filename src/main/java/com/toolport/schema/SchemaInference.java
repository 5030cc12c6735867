package com.toolport.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.toolport.errors.ToolDefinitionException;
import com.toolport.errors.UnsupportedParameterTypeException;
import com.toolport.tools.Field;
import com.toolport.tools.NotInferrable;
import com.toolport.tools.Param;
import com.toolport.tools.ToolContext;
import com.toolport.tools.ToolSpec;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Derives the wire contract of a tool method from its signature and
 * annotations. Pure and deterministic: the method is never called, and every
 * problem is reported as a {@link ToolDefinitionException}.
 */
public final class SchemaInference {

    public static final String NO_DESCRIPTION = "No description provided.";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Map<Class<?>, WireType> SCALARS = Map.ofEntries(
            Map.entry(String.class, WireType.STRING),
            Map.entry(Character.class, WireType.STRING),
            Map.entry(char.class, WireType.STRING),
            Map.entry(Boolean.class, WireType.BOOLEAN),
            Map.entry(boolean.class, WireType.BOOLEAN),
            Map.entry(Byte.class, WireType.INTEGER),
            Map.entry(byte.class, WireType.INTEGER),
            Map.entry(Short.class, WireType.INTEGER),
            Map.entry(short.class, WireType.INTEGER),
            Map.entry(Integer.class, WireType.INTEGER),
            Map.entry(int.class, WireType.INTEGER),
            Map.entry(Long.class, WireType.INTEGER),
            Map.entry(long.class, WireType.INTEGER),
            Map.entry(BigInteger.class, WireType.INTEGER),
            Map.entry(Float.class, WireType.FLOAT),
            Map.entry(float.class, WireType.FLOAT),
            Map.entry(Double.class, WireType.FLOAT),
            Map.entry(double.class, WireType.FLOAT),
            Map.entry(BigDecimal.class, WireType.FLOAT));

    private SchemaInference() {}

    public static ToolSchema infer(ToolSpec spec) {
        var inputs = new ArrayList<InputParameter>();
        var bindings = new ArrayList<ParameterBinding>();
        var seen = new HashSet<String>();
        for (var p : spec.method().getParameters()) {
            if (p.getType() == ToolContext.class) {
                bindings.add(ParameterBinding.context());
                continue;
            }
            var field = inferParameter(p);
            if (!seen.add(field.input().name())) {
                throw new ToolDefinitionException("Tool " + spec.name()
                        + " declares parameter '" + field.input().name() + "' more than once");
            }
            inputs.add(field.input());
            bindings.add(field.binding());
        }
        return new ToolSchema(inputs, inferOutput(spec), spec.authRequirement(), bindings);
    }

    static InferredParameter inferParameter(Parameter p) {
        Type type = p.getParameterizedType();
        boolean optional = false;
        if (rawClass(type) == Optional.class) {
            type = typeArgument(type);
            optional = true;
        }

        String name = p.isNamePresent() ? p.getName() : null;
        String description = null;
        String defaultLiteral = Param.UNSET;

        var param = p.getAnnotation(Param.class);
        if (param != null) {
            var texts = param.value();
            if (texts.length == 1) {
                description = texts[0];
            } else if (texts.length == 2) {
                name = texts[0];
                description = texts[1];
            } else if (texts.length > 2) {
                throw new ToolDefinitionException("Parameter " + p.getName()
                        + " has too many descriptions. Expected 0, 1, or 2, got " + texts.length + ".");
            }
            defaultLiteral = param.defaultValue();
        }

        // @Field wins over @Param where both say something
        var field = p.getAnnotation(Field.class);
        if (field != null) {
            if (!field.name().isBlank()) name = field.name();
            if (!field.description().isBlank()) description = field.description();
            if (!Param.UNSET.equals(field.defaultValue())) defaultLiteral = field.defaultValue();
        }

        if (name == null || name.isBlank()) {
            throw new ToolDefinitionException("Parameter names of " + p.getDeclaringExecutable().getName()
                    + " are not available; compile with -parameters or name the parameter explicitly");
        }
        if (description == null || description.isBlank()) {
            throw new ToolDefinitionException("Parameter " + name + " is missing a description");
        }

        var wireType = wireType(type);
        var defaultValue = Param.UNSET.equals(defaultLiteral) ? null : parseDefault(name, defaultLiteral, type);
        boolean required = !optional && defaultValue == null;

        var input = new InputParameter(
                name,
                description,
                required,
                !p.isAnnotationPresent(NotInferrable.class),
                new ValueSchema(wireType, enumValues(type)));
        return new InferredParameter(input,
                new ParameterBinding(name, type, optional, defaultValue, required));
    }

    static OutputSpec inferOutput(ToolSpec spec) {
        var method = spec.method();
        Type type = method.getGenericReturnType();
        if (CompletionStage.class.isAssignableFrom(rawClass(type))) {
            if (!(type instanceof ParameterizedType)) {
                throw new ToolDefinitionException("Tool " + spec.name()
                        + " must declare the type its future completes with");
            }
            type = typeArgument(type);
        }
        var description = spec.returns() != null ? spec.returns() : NO_DESCRIPTION;

        var raw = rawClass(type);
        if (raw == void.class || raw == Void.class) {
            return new OutputSpec(description, List.of(OutputMode.NULL), null);
        }
        if (raw == Object.class) {
            throw new ToolDefinitionException("Tool " + spec.name() + " must declare a concrete return type");
        }

        boolean optional = false;
        if (raw == Optional.class) {
            type = typeArgument(type);
            optional = true;
        }
        var modes = optional
                ? List.of(OutputMode.VALUE, OutputMode.ERROR, OutputMode.NULL)
                : List.of(OutputMode.VALUE, OutputMode.ERROR);
        return new OutputSpec(description, modes, new ValueSchema(wireType(type), enumValues(type)));
    }

    /** Maps a native type onto its wire type, or fails for anything outside the table. */
    public static WireType wireType(Type type) {
        if (type instanceof Class<?> c) {
            var scalar = SCALARS.get(c);
            if (scalar != null) return scalar;
            if (c.isEnum()) return WireType.STRING;
            if (isStructured(c)) return WireType.JSON;
        } else if (type instanceof ParameterizedType pt && pt.getRawType() instanceof Class<?> raw) {
            if (Map.class.isAssignableFrom(raw) || Collection.class.isAssignableFrom(raw)) {
                return WireType.JSON;
            }
        } else if (type instanceof GenericArrayType) {
            return WireType.JSON;
        }
        throw new UnsupportedParameterTypeException(type);
    }

    private static boolean isStructured(Class<?> c) {
        return c.isArray()
                || c.isRecord()
                || Map.class.isAssignableFrom(c)
                || Collection.class.isAssignableFrom(c)
                || JsonNode.class.isAssignableFrom(c);
    }

    private static List<String> enumValues(Type type) {
        if (type instanceof Class<?> c && c.isEnum()) {
            return Arrays.stream(c.getEnumConstants()).map(e -> ((Enum<?>) e).name()).toList();
        }
        return null;
    }

    private static JsonNode parseDefault(String name, String literal, Type type) {
        JsonNode node;
        try {
            node = literal.isEmpty() ? TextNode.valueOf("") : MAPPER.readTree(literal);
        } catch (JsonProcessingException e) {
            node = TextNode.valueOf(literal);
        }
        try {
            MAPPER.convertValue(node, MAPPER.constructType(type));
        } catch (IllegalArgumentException e) {
            throw new ToolDefinitionException("Default value for parameter " + name
                    + " is not a valid " + type.getTypeName(), e);
        }
        return node;
    }

    static Class<?> rawClass(Type type) {
        if (type instanceof Class<?> c) return c;
        if (type instanceof ParameterizedType pt && pt.getRawType() instanceof Class<?> c) return c;
        if (type instanceof GenericArrayType) return Object[].class;
        return Object.class;
    }

    private static Type typeArgument(Type type) {
        if (type instanceof ParameterizedType pt) {
            return pt.getActualTypeArguments()[0];
        }
        // raw Optional or raw future: nothing to map
        return Object.class;
    }

    record InferredParameter(InputParameter input, ParameterBinding binding) {}
}
