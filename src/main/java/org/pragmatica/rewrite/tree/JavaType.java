package org.pragmatica.rewrite.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolved semantic type attached to a node after attribution.
 */
public sealed interface JavaType {

    String CONSTRUCTOR_NAME = "<constructor>";

    /**
     * Fully-qualified textual form, e.g. {@code java.util.List<java.lang.String>}.
     */
    String describe();

    record Primitive(String keyword) implements JavaType {
        public static final Primitive VOID = new Primitive("void");
        public static final Primitive BOOLEAN = new Primitive("boolean");
        public static final Primitive INT = new Primitive("int");
        public static final Primitive LONG = new Primitive("long");
        public static final Primitive DOUBLE = new Primitive("double");
        public static final Primitive CHAR = new Primitive("char");
        public static final Primitive NULL = new Primitive("null");

        private static final List<String> KEYWORDS = List.of(
            "void", "boolean", "byte", "char", "short", "int", "long", "float", "double");

        public static Optional<Primitive> fromKeyword(String keyword) {
            return KEYWORDS.contains(keyword)
                   ? Optional.of(new Primitive(keyword))
                   : Optional.empty();
        }

        @Override
        public String describe() {
            return keyword;
        }
    }

    /**
     * A class or interface, with its supertype chain as far as it is known.
     */
    record Class(
    String fullyQualifiedName,
    List<JavaType> typeParameters,
    Optional<Class> supertype,
    List<Class> interfaces) implements JavaType {

        public Class {
            typeParameters = ImmutableList.copyOf(typeParameters);
            interfaces = ImmutableList.copyOf(interfaces);
        }

        public static Class of(String fullyQualifiedName) {
            return new Class(fullyQualifiedName, List.of(), Optional.empty(), List.of());
        }

        public String simpleName() {
            int dot = fullyQualifiedName.lastIndexOf('.');
            return dot < 0 ? fullyQualifiedName : fullyQualifiedName.substring(dot + 1);
        }

        public String packageName() {
            int dot = fullyQualifiedName.lastIndexOf('.');
            return dot < 0 ? "" : fullyQualifiedName.substring(0, dot);
        }

        public Class withTypeParameters(List<JavaType> parameters) {
            return new Class(fullyQualifiedName, parameters, supertype, interfaces);
        }

        @Override
        public String describe() {
            if (typeParameters.isEmpty()) {
                return fullyQualifiedName;
            }
            return typeParameters.stream()
                                 .map(JavaType::describe)
                                 .collect(Collectors.joining(",", fullyQualifiedName + "<", ">"));
        }
    }

    record Array(JavaType elementType) implements JavaType {
        @Override
        public String describe() {
            return elementType.describe() + "[]";
        }
    }

    /**
     * A method or constructor signature. Constructors are named {@value #CONSTRUCTOR_NAME}.
     */
    record Method(
    Class declaringType,
    String name,
    JavaType returnType,
    List<JavaType> parameterTypes,
    boolean varargs) implements JavaType {

        public Method {
            parameterTypes = ImmutableList.copyOf(parameterTypes);
        }

        public boolean isConstructor() {
            return CONSTRUCTOR_NAME.equals(name);
        }

        public Method withName(String newName) {
            return new Method(declaringType, newName, returnType, parameterTypes, varargs);
        }

        public Method withDeclaringType(Class owner) {
            return new Method(owner, name, returnType, parameterTypes, varargs);
        }

        @Override
        public String describe() {
            var params = parameterTypes.stream()
                                       .map(JavaType::describe)
                                       .collect(Collectors.joining(","));
            return returnType.describe() + " " + declaringType.fullyQualifiedName() + "." + name + "(" + params + ")";
        }
    }
}
