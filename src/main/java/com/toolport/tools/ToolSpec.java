package com.toolport.tools;

import com.toolport.schema.AuthRequirement;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Registration-time descriptor of one tool: the method to call, the object to
 * call it on, and the metadata read from {@link Tool} and {@link RequiresAuth}
 * (or set through the builder). The method itself is never modified.
 */
public final class ToolSpec {

    private final Object target;
    private final Method method;
    private final String name;
    private final String description;
    private final String returns;
    private final AuthRequirement authRequirement;

    private ToolSpec(Builder b) {
        this.target = b.target;
        this.method = b.method;
        this.name = b.name;
        this.description = b.description;
        this.returns = b.returns;
        this.authRequirement = b.authRequirement;
    }

    public static ToolSpec of(Object target, Method method) {
        return builder(target, method).build();
    }

    /** Looks up a single method by name on the target's class. */
    public static ToolSpec of(Object target, String methodName) {
        var type = target instanceof Class<?> c ? c : target.getClass();
        var matches = Arrays.stream(type.getDeclaredMethods())
                .filter(m -> m.getName().equals(methodName) && !m.isSynthetic())
                .toList();
        if (matches.size() != 1) {
            throw new IllegalArgumentException("Expected exactly one method named '" + methodName
                    + "' on " + type.getName() + ", found " + matches.size());
        }
        return of(target instanceof Class<?> ? null : target, matches.get(0));
    }

    /**
     * Collects every {@link Tool}-annotated method. A {@code Class} argument
     * yields its static tool methods; any other object its instance ones.
     */
    public static List<ToolSpec> scan(Object target) {
        boolean statics = target instanceof Class<?>;
        var type = statics ? (Class<?>) target : target.getClass();
        return Arrays.stream(type.getDeclaredMethods())
                .filter(m -> m.isAnnotationPresent(Tool.class))
                .filter(m -> Modifier.isStatic(m.getModifiers()) == statics)
                .sorted(Comparator.comparing(Method::getName))
                .map(m -> of(statics ? null : target, m))
                .toList();
    }

    public static Builder builder(Object target, Method method) {
        return new Builder(target, method);
    }

    public Object target() { return target; }
    public Method method() { return method; }
    public String name() { return name; }
    public String description() { return description; }
    public String returns() { return returns; }
    public AuthRequirement authRequirement() { return authRequirement; }

    public Class<?> declaringClass() {
        return method.getDeclaringClass();
    }

    static String pascalCase(String identifier) {
        var sb = new StringBuilder();
        for (var part : identifier.split("_")) {
            if (part.isEmpty()) continue;
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return name + " (" + method.getDeclaringClass().getSimpleName() + "#" + method.getName() + ")";
    }

    public static final class Builder {
        private final Object target;
        private final Method method;
        private String name;
        private String description;
        private String returns;
        private AuthRequirement authRequirement;

        private Builder(Object target, Method method) {
            Objects.requireNonNull(method, "method");
            boolean isStatic = Modifier.isStatic(method.getModifiers());
            if (!isStatic && target == null) {
                throw new IllegalArgumentException("Instance method " + method.getName() + " needs a target");
            }
            if (!isStatic && !method.getDeclaringClass().isInstance(target)) {
                throw new IllegalArgumentException("Target is not a " + method.getDeclaringClass().getName());
            }
            method.trySetAccessible();
            this.target = isStatic ? null : target;
            this.method = method;

            var tool = method.getAnnotation(Tool.class);
            this.name = tool != null && !tool.name().isBlank() ? tool.name() : pascalCase(method.getName());
            this.description = tool != null && !tool.description().isBlank() ? tool.description() : null;
            this.returns = tool != null && !tool.returns().isBlank() ? tool.returns() : null;

            var auth = method.getAnnotation(RequiresAuth.class);
            if (auth != null) {
                this.authRequirement = new AuthRequirement(
                        auth.provider(), auth.type(),
                        auth.id().isBlank() ? null : auth.id(),
                        List.of(auth.scopes()));
            }
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder returns(String returns) {
            this.returns = returns;
            return this;
        }

        public Builder requiresAuth(AuthRequirement authRequirement) {
            this.authRequirement = authRequirement;
            return this;
        }

        public ToolSpec build() {
            return new ToolSpec(this);
        }
    }
}
