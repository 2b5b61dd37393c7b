package org.pragmatica.rewrite.type;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import org.pragmatica.rewrite.tree.JavaType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Known classes and their members - the classpath as seen by attribution.
 *
 * <p>Example:
 * <pre>{@code
 * var types = TypeTable.builder()
 *                      .addClass("java.io.File")
 *                      .addClass("com.google.common.io.Files")
 *                      .addMethod("com.google.common.io.Files", "java.io.File", "createTempDir")
 *                      .build();
 * }</pre>
 */
public final class TypeTable {
    public static final String OBJECT = "java.lang.Object";
    public static final String STRING = "java.lang.String";

    private static final TypeTable EMPTY = builder().build();

    private final Map<String, JavaType.Class> classes;
    private final ImmutableListMultimap<String, JavaType.Method> methods;

    private TypeTable(Map<String, JavaType.Class> classes, ImmutableListMultimap<String, JavaType.Method> methods) {
        this.classes = ImmutableMap.copyOf(classes);
        this.methods = methods;
    }

    /**
     * Table with only the implicit {@code java.lang} basics.
     */
    public static TypeTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<JavaType.Class> lookup(String fullyQualifiedName) {
        return Optional.ofNullable(classes.get(fullyQualifiedName));
    }

    public boolean contains(String fullyQualifiedName) {
        return classes.containsKey(fullyQualifiedName);
    }

    public List<JavaType.Class> classesInPackage(String packageName) {
        return classes.values()
                      .stream()
                      .filter(c -> c.packageName().equals(packageName))
                      .toList();
    }

    public List<JavaType.Method> declaredMethods(String ownerName) {
        return methods.get(ownerName);
    }

    /**
     * Methods of the given name visible on the owner: declared ones first, then inherited ones
     * not overridden by an already collected signature.
     */
    public List<JavaType.Method> methods(JavaType.Class owner, String name) {
        var result = new ArrayList<JavaType.Method>();
        var seen = new HashSet<String>();
        var queue = new ArrayDeque<JavaType.Class>();
        queue.add(owner);
        while (!queue.isEmpty()) {
            var current = queue.poll();
            if (!seen.add(current.fullyQualifiedName())) {
                continue;
            }
            var known = lookup(current.fullyQualifiedName()).orElse(current);
            for (var method : declaredMethods(known.fullyQualifiedName())) {
                if (method.name().equals(name) && !isOverridden(result, method)) {
                    result.add(method);
                }
            }
            known.supertype().ifPresent(queue::add);
            queue.addAll(known.interfaces());
        }
        return result;
    }

    private static boolean isOverridden(List<JavaType.Method> collected, JavaType.Method candidate) {
        return collected.stream()
                        .anyMatch(m -> m.parameterTypes().equals(candidate.parameterTypes()));
    }

    /**
     * Resolve a fully-qualified type name, a primitive keyword, or either followed by {@code []}.
     */
    public Optional<JavaType> resolve(String typeName) {
        if (typeName.endsWith("[]")) {
            return resolve(typeName.substring(0, typeName.length() - 2)).map(JavaType.Array::new);
        }
        var primitive = JavaType.Primitive.fromKeyword(typeName);
        if (primitive.isPresent()) {
            return primitive.map(JavaType.class::cast);
        }
        return lookup(typeName).map(JavaType.class::cast);
    }

    /**
     * A new table with the given classes and methods added; existing entries with the same
     * name are replaced.
     */
    public TypeTable with(List<JavaType.Class> extraClasses, List<JavaType.Method> extraMethods) {
        if (extraClasses.isEmpty() && extraMethods.isEmpty()) {
            return this;
        }
        var mergedClasses = new LinkedHashMap<>(classes);
        extraClasses.forEach(c -> mergedClasses.put(c.fullyQualifiedName(), c));
        var replacedOwners = new HashSet<String>();
        extraClasses.forEach(c -> replacedOwners.add(c.fullyQualifiedName()));
        var mergedMethods = ImmutableListMultimap.<String, JavaType.Method>builder();
        methods.entries()
               .stream()
               .filter(e -> !replacedOwners.contains(e.getKey()))
               .forEach(e -> mergedMethods.put(e.getKey(), e.getValue()));
        extraMethods.forEach(m -> mergedMethods.put(m.declaringType().fullyQualifiedName(), m));
        return new TypeTable(mergedClasses, mergedMethods.build());
    }

    public int size() {
        return classes.size();
    }

    public static final class Builder {
        private final Map<String, Declaration> declarations = new LinkedHashMap<>();
        private final ListMultimap<String, MethodDeclaration> methodDeclarations =
            MultimapBuilder.linkedHashKeys().arrayListValues().build();

        private Builder() {
            declarations.put(OBJECT, new Declaration(null, List.of()));
            declarations.put("java.lang.CharSequence", new Declaration(null, List.of()));
            declarations.put(STRING, new Declaration(OBJECT, List.of("java.lang.CharSequence")));
        }

        /**
         * Declare a class extending {@code java.lang.Object}.
         */
        public Builder addClass(String name) {
            return addClass(name, OBJECT);
        }

        public Builder addClass(String name, String supertype, String... interfaces) {
            declarations.put(name, new Declaration(supertype, Arrays.asList(interfaces)));
            return this;
        }

        public Builder addInterface(String name, String... superInterfaces) {
            declarations.put(name, new Declaration(null, Arrays.asList(superInterfaces)));
            return this;
        }

        /**
         * Declare a method. A parameter type ending in {@code ...} makes the method varargs.
         */
        public Builder addMethod(String owner, String returnType, String name, String... parameterTypes) {
            methodDeclarations.put(owner, new MethodDeclaration(returnType, name, Arrays.asList(parameterTypes)));
            return this;
        }

        public Builder addConstructor(String owner, String... parameterTypes) {
            return addMethod(owner, "void", JavaType.CONSTRUCTOR_NAME, parameterTypes);
        }

        public TypeTable build() {
            var resolved = new HashMap<String, JavaType.Class>();
            for (var name : declarations.keySet()) {
                resolveClass(name, resolved, new HashSet<>());
            }
            var methods = ImmutableListMultimap.<String, JavaType.Method>builder();
            for (var entry : methodDeclarations.entries()) {
                var owner = resolveClass(entry.getKey(), resolved, new HashSet<>());
                methods.put(entry.getKey(), entry.getValue().toMethod(owner, resolved));
            }
            var ordered = new LinkedHashMap<String, JavaType.Class>();
            declarations.keySet().forEach(name -> ordered.put(name, resolved.get(name)));
            return new TypeTable(ordered, methods.build());
        }

        private JavaType.Class resolveClass(String name, Map<String, JavaType.Class> resolved, Set<String> inProgress) {
            var existing = resolved.get(name);
            if (existing != null) {
                return existing;
            }
            var declaration = declarations.get(name);
            if (declaration == null) {
                return JavaType.Class.of(name);
            }
            if (!inProgress.add(name)) {
                throw new IllegalArgumentException("Cyclic type hierarchy involving " + name);
            }
            var supertype = Optional.ofNullable(declaration.supertype())
                                    .map(s -> resolveClass(s, resolved, inProgress));
            var interfaces = declaration.interfaces()
                                        .stream()
                                        .map(i -> resolveClass(i, resolved, inProgress))
                                        .toList();
            var result = new JavaType.Class(name, List.of(), supertype, interfaces);
            resolved.put(name, result);
            inProgress.remove(name);
            return result;
        }

        private record Declaration(String supertype, List<String> interfaces) {}

        private record MethodDeclaration(String returnType, String name, List<String> parameterTypes) {
            JavaType.Method toMethod(JavaType.Class owner, Map<String, JavaType.Class> resolved) {
                boolean varargs = !parameterTypes.isEmpty()
                                  && parameterTypes.get(parameterTypes.size() - 1).endsWith("...");
                var params = new ArrayList<JavaType>();
                for (var param : parameterTypes) {
                    var normalized = param.endsWith("...")
                                     ? param.substring(0, param.length() - 3) + "[]"
                                     : param;
                    params.add(typeOf(normalized, resolved));
                }
                return new JavaType.Method(owner, name, typeOf(returnType, resolved), params, varargs);
            }

            private static JavaType typeOf(String name, Map<String, JavaType.Class> resolved) {
                if (name.endsWith("[]")) {
                    return new JavaType.Array(typeOf(name.substring(0, name.length() - 2), resolved));
                }
                return JavaType.Primitive.fromKeyword(name)
                                         .map(JavaType.class::cast)
                                         .orElseGet(() -> Optional.<JavaType>ofNullable(resolved.get(name))
                                                                  .orElseGet(() -> JavaType.Class.of(name)));
            }
        }
    }
}
