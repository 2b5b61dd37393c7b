package org.pragmatica.rewrite.type;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.pragmatica.rewrite.tree.JavaType;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Optional;

/**
 * Assignability checks over resolved types.
 */
public final class TypeUtils {
    private static final ImmutableMap<String, String> WRAPPERS = ImmutableMap.<String, String>builder()
                                                                            .put("boolean", "java.lang.Boolean")
                                                                            .put("byte", "java.lang.Byte")
                                                                            .put("char", "java.lang.Character")
                                                                            .put("short", "java.lang.Short")
                                                                            .put("int", "java.lang.Integer")
                                                                            .put("long", "java.lang.Long")
                                                                            .put("float", "java.lang.Float")
                                                                            .put("double", "java.lang.Double")
                                                                            .build();

    private static final ImmutableSet<String> NUMERIC = ImmutableSet.of("byte", "short", "int", "long", "float",
                                                                        "double");

    // Supertypes every wrapper shares
    private static final ImmutableSet<String> WRAPPER_SUPERTYPES = ImmutableSet.of(TypeTable.OBJECT,
                                                                                   "java.io.Serializable",
                                                                                   "java.lang.Comparable");

    private TypeUtils() {}

    /**
     * The {@code java.lang} wrapper class of a primitive keyword.
     */
    public static Optional<String> wrapperOf(String primitiveKeyword) {
        return Optional.ofNullable(WRAPPERS.get(primitiveKeyword));
    }

    public static Optional<String> fullyQualifiedName(JavaType type) {
        return type instanceof JavaType.Class c
               ? Optional.of(c.fullyQualifiedName())
               : Optional.empty();
    }

    public static boolean isOfClassType(JavaType type, String fullyQualifiedName) {
        return fullyQualifiedName(type).map(fullyQualifiedName::equals)
                                       .orElse(false);
    }

    /**
     * Whether a value of {@code type} can be assigned to the class named {@code target},
     * judged by the supertype chain recorded on the type.
     */
    public static boolean isAssignableTo(String target, JavaType type) {
        if (type instanceof JavaType.Primitive primitive) {
            return primitive.equals(JavaType.Primitive.NULL) && !JavaType.Primitive.fromKeyword(target).isPresent()
                   || primitive.keyword().equals(target)
                   || isBoxingTarget(primitive.keyword(), target);
        }
        if (type instanceof JavaType.Array) {
            return TypeTable.OBJECT.equals(target);
        }
        if (!(type instanceof JavaType.Class start)) {
            return false;
        }
        if (TypeTable.OBJECT.equals(target)) {
            return true;
        }
        var seen = new HashSet<String>();
        var queue = new ArrayDeque<JavaType.Class>();
        queue.add(start);
        while (!queue.isEmpty()) {
            var current = queue.poll();
            if (current.fullyQualifiedName().equals(target)) {
                return true;
            }
            if (seen.add(current.fullyQualifiedName())) {
                current.supertype().ifPresent(queue::add);
                queue.addAll(current.interfaces());
            }
        }
        return false;
    }

    public static boolean isAssignableTo(JavaType target, JavaType type) {
        if (target instanceof JavaType.Class targetClass) {
            return isAssignableTo(targetClass.fullyQualifiedName(), type);
        }
        if (target instanceof JavaType.Array targetArray) {
            return type.equals(JavaType.Primitive.NULL)
                   || type instanceof JavaType.Array array && isAssignableTo(targetArray.elementType(),
                                                                             array.elementType());
        }
        if (target instanceof JavaType.Primitive targetPrimitive) {
            return targetPrimitive.equals(type) || isWidening(targetPrimitive, type) || isUnboxing(targetPrimitive, type);
        }
        return false;
    }

    private static boolean isBoxingTarget(String keyword, String target) {
        var wrapper = WRAPPERS.get(keyword);
        return wrapper != null
               && (wrapper.equals(target)
                   || WRAPPER_SUPERTYPES.contains(target)
                   || NUMERIC.contains(keyword) && "java.lang.Number".equals(target));
    }

    // Unboxing followed by an optional widening conversion
    private static boolean isUnboxing(JavaType.Primitive target, JavaType type) {
        if (!(type instanceof JavaType.Class source)) {
            return false;
        }
        return WRAPPERS.entrySet()
                       .stream()
                       .filter(entry -> entry.getValue().equals(source.fullyQualifiedName()))
                       .map(entry -> new JavaType.Primitive(entry.getKey()))
                       .anyMatch(unboxed -> unboxed.equals(target) || isWidening(target, unboxed));
    }

    private static boolean isWidening(JavaType.Primitive target, JavaType type) {
        if (!(type instanceof JavaType.Primitive source)) {
            return false;
        }
        var order = "byte short char int long float double";
        int from = order.indexOf(source.keyword());
        int to = order.indexOf(target.keyword());
        // char is reachable from no other primitive, and reaches neither byte nor short
        return from >= 0 && to >= 0 && from < to
               && !"char".equals(target.keyword())
               && !("char".equals(source.keyword()) && "short".equals(target.keyword()));
    }
}
