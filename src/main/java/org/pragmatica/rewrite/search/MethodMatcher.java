package org.pragmatica.rewrite.search;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.pragmatica.rewrite.tree.JavaType;
import org.pragmatica.rewrite.tree.Kind;
import org.pragmatica.rewrite.tree.Syntax;
import org.pragmatica.rewrite.tree.Tree;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Pointcut-style method signature matcher.
 *
 * <p>Pattern syntax:
 * <pre>
 *   [returnType] declaringType.methodName(parameters)
 *   declaringType methodName(parameters)
 * </pre>
 * Types follow {@link TypePattern}. The method name may contain {@code *}; constructors are
 * named {@code <constructor>}. Parameters are a comma separated list of type patterns, where
 * {@code *} stands for exactly one parameter of any type, {@code ..} for any number of
 * parameters, and a trailing {@code Type...} for a varargs parameter.
 *
 * <p>Examples: {@code java.io.File com.google.common.io.Files.createTempDir()},
 * {@code * foo(..)}, {@code java.util.List add(*)}.
 *
 * <p>A method matches when its declaring type matches (or, with {@code matchOverrides}, one of
 * its supertypes does), its name matches, and each declared parameter type equals or is a
 * subtype of the corresponding parameter pattern. Trees without a resolved method type never
 * match, except that the fully wildcard shape {@code * name(..)} without a return type falls
 * back to the spelled method name.
 *
 * <p>Matchers are immutable and can be shared between threads.
 */
public final class MethodMatcher {
    private static final String ANY_PARAMETERS = "..";
    private static final String ANY_TYPE = "*";

    private final String pattern;
    private final Optional<TypePattern> returnType;
    private final TypePattern declaringType;
    private final Pattern name;
    private final List<ParameterPattern> parameters;
    private final boolean matchOverrides;

    private MethodMatcher(String pattern,
                          Optional<TypePattern> returnType,
                          TypePattern declaringType,
                          Pattern name,
                          List<ParameterPattern> parameters,
                          boolean matchOverrides) {
        this.pattern = pattern;
        this.returnType = returnType;
        this.declaringType = declaringType;
        this.name = name;
        this.parameters = parameters;
        this.matchOverrides = matchOverrides;
    }

    public static MethodMatcher compile(String pattern) {
        return compile(pattern, false);
    }

    /**
     * @param matchOverrides also accept methods whose declaring type is a subtype of the pattern's
     */
    public static MethodMatcher compile(String pattern, boolean matchOverrides) {
        var trimmed = pattern.trim();
        int open = trimmed.indexOf('(');
        if (open < 0 || !trimmed.endsWith(")")) {
            throw new IllegalArgumentException("Method pattern must end with a parameter list: " + pattern);
        }
        int close = trimmed.length() - 1;
        var head = Splitter.onPattern("\\s+").omitEmptyStrings().splitToList(trimmed.substring(0, open));
        Optional<TypePattern> returnType;
        String declaring;
        String method;
        switch (head.size()) {
            case 1 -> {
                returnType = Optional.empty();
                int dot = head.get(0).lastIndexOf('.');
                declaring = dot < 0 ? ANY_TYPE : head.get(0).substring(0, dot);
                method = head.get(0).substring(dot + 1);
            }
            case 2 -> {
                if (head.get(1).contains(".")) {
                    returnType = Optional.of(TypePattern.compile(head.get(0)));
                    int dot = head.get(1).lastIndexOf('.');
                    declaring = head.get(1).substring(0, dot);
                    method = head.get(1).substring(dot + 1);
                } else {
                    returnType = Optional.empty();
                    declaring = head.get(0);
                    method = head.get(1);
                }
            }
            case 3 -> {
                returnType = Optional.of(TypePattern.compile(head.get(0)));
                declaring = head.get(1);
                method = head.get(2);
            }
            default -> throw new IllegalArgumentException("Malformed method pattern: " + pattern);
        }
        if (method.isEmpty() || declaring.isEmpty()) {
            throw new IllegalArgumentException("Malformed method pattern: " + pattern);
        }
        return new MethodMatcher(trimmed,
                                 returnType,
                                 TypePattern.compile(declaring),
                                 Pattern.compile(nameRegex(method)),
                                 parameterPatterns(trimmed.substring(open + 1, close)),
                                 matchOverrides);
    }

    private static String nameRegex(String method) {
        if (!method.matches("[\\w$*]+|<constructor>")) {
            throw new IllegalArgumentException("Malformed method name pattern: " + method);
        }
        return method.equals(JavaType.CONSTRUCTOR_NAME)
               ? Pattern.quote(method)
               : method.replace("$", "\\$").replace("*", ".*");
    }

    private static List<ParameterPattern> parameterPatterns(String list) {
        var trimmed = list.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        var result = ImmutableList.<ParameterPattern>builder();
        var items = Splitter.on(',').trimResults().splitToList(trimmed);
        for (int i = 0; i < items.size(); i++) {
            var item = items.get(i);
            if (item.equals(ANY_PARAMETERS)) {
                result.add(ParameterPattern.Wildcard.INSTANCE);
            } else if (item.endsWith("...")) {
                if (i != items.size() - 1) {
                    throw new IllegalArgumentException("Varargs parameter must be last: " + list);
                }
                var element = item.substring(0, item.length() - 3);
                var arrayType = element.equals(ANY_TYPE) ? ANY_TYPE : element + "[]";
                result.add(new ParameterPattern.Varargs(TypePattern.compile(arrayType)));
            } else {
                result.add(new ParameterPattern.Single(TypePattern.compile(item)));
            }
        }
        return result.build();
    }

    /**
     * One entry of a parameter list pattern.
     */
    private sealed interface ParameterPattern {
        enum Wildcard implements ParameterPattern {
            INSTANCE
        }

        record Single(TypePattern type) implements ParameterPattern {}

        record Varargs(TypePattern arrayType) implements ParameterPattern {}
    }

    public boolean matchOverrides() {
        return matchOverrides;
    }

    /**
     * Match a resolved method signature.
     */
    public boolean matches(JavaType.Method method) {
        if (!name.matcher(method.name()).matches()) {
            return false;
        }
        if (returnType.isPresent() && !method.isConstructor() && !returnType.get().matches(method.returnType())) {
            return false;
        }
        return matchesDeclaringType(method.declaringType()) && matchesParameters(method, 0, 0);
    }

    /**
     * Match an invocation, constructor call or method declaration by its attributed method type.
     */
    public boolean matches(Tree tree) {
        if (!(tree instanceof Tree.Node node) || !isMethodKind(node.kind())) {
            return false;
        }
        var type = node.type();
        if (type.isPresent()) {
            return type.get() instanceof JavaType.Method method && matches(method);
        }
        return matchesUnresolved(node);
    }

    private static boolean isMethodKind(Kind kind) {
        return kind == Kind.METHOD_INVOCATION || kind == Kind.METHOD_DECLARATION || kind == Kind.NEW_CLASS;
    }

    private boolean matchesUnresolved(Tree.Node node) {
        boolean fullyWildcard = declaringType.isAny()
                                && returnType.isEmpty()
                                && parameters.size() == 1
                                && parameters.get(0) == ParameterPattern.Wildcard.INSTANCE;
        if (!fullyWildcard || node.kind() == Kind.NEW_CLASS) {
            return false;
        }
        return name.matcher(Syntax.methodName(node).text()).matches();
    }

    private boolean matchesDeclaringType(JavaType.Class type) {
        if (declaringType.matches(type)) {
            return true;
        }
        if (!matchOverrides) {
            return false;
        }
        var seen = new HashSet<String>();
        var queue = new ArrayDeque<JavaType.Class>();
        type.supertype().ifPresent(queue::add);
        queue.addAll(type.interfaces());
        while (!queue.isEmpty()) {
            var current = queue.poll();
            if (!seen.add(current.fullyQualifiedName())) {
                continue;
            }
            if (declaringType.matches(current)) {
                return true;
            }
            current.supertype().ifPresent(queue::add);
            queue.addAll(current.interfaces());
        }
        return false;
    }

    private boolean matchesParameters(JavaType.Method method, int patternIndex, int typeIndex) {
        var types = method.parameterTypes();
        if (patternIndex == parameters.size()) {
            return typeIndex == types.size();
        }
        var current = parameters.get(patternIndex);
        if (current instanceof ParameterPattern.Wildcard) {
            for (int skip = typeIndex; skip <= types.size(); skip++) {
                if (matchesParameters(method, patternIndex + 1, skip)) {
                    return true;
                }
            }
            return false;
        }
        if (typeIndex == types.size()) {
            return false;
        }
        var type = types.get(typeIndex);
        if (current instanceof ParameterPattern.Varargs varargs) {
            return method.varargs()
                   && typeIndex == types.size() - 1
                   && varargs.arrayType().matchesSubtype(type);
        }
        var single = (ParameterPattern.Single) current;
        return single.type().matchesSubtype(type) && matchesParameters(method, patternIndex + 1, typeIndex + 1);
    }

    @Override
    public String toString() {
        return "MethodMatcher(" + pattern + ")";
    }
}
