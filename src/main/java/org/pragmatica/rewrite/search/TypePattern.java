package org.pragmatica.rewrite.search;

import org.pragmatica.rewrite.tree.JavaType;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Compiled pattern for a single type name.
 *
 * <p>Supported forms: a fully-qualified name or primitive keyword, {@code *} for any type,
 * {@code *} inside a name (matches within one segment), {@code ..} between packages (any
 * number of intermediate segments) and a trailing {@code []}. Type arguments are ignored;
 * types are compared by erasure.
 */
public final class TypePattern {
    private static final TypePattern ANY = new TypePattern("*", null);

    private final String source;
    private final Pattern regex;

    private TypePattern(String source, Pattern regex) {
        this.source = source;
        this.regex = regex;
    }

    public static TypePattern compile(String pattern) {
        var trimmed = pattern.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Empty type pattern");
        }
        if (trimmed.equals("*")) {
            return ANY;
        }
        var erased = eraseTypeArguments(trimmed);
        if (!erased.matches("[\\w$.*]+(\\[])*")) {
            throw new IllegalArgumentException("Malformed type pattern: " + pattern);
        }
        return new TypePattern(erased, Pattern.compile(toRegex(erased)));
    }

    public static TypePattern any() {
        return ANY;
    }

    public boolean isAny() {
        return regex == null;
    }

    /**
     * Whether the pattern is a plain name without wildcards.
     */
    public boolean isExact() {
        return !isAny() && !source.contains("*") && !source.contains("..");
    }

    /**
     * Match the type itself by erased name.
     */
    public boolean matches(JavaType type) {
        if (isAny()) {
            return true;
        }
        return erasure(type).map(name -> regex.matcher(name).matches()).orElse(false);
    }

    /**
     * Match the type or any of its supertypes. Arrays match when their element types do.
     */
    public boolean matchesSubtype(JavaType type) {
        if (matches(type)) {
            return true;
        }
        if (type instanceof JavaType.Array array && source.endsWith("[]")) {
            var element = new TypePattern(source.substring(0, source.length() - 2),
                                          Pattern.compile(toRegex(source.substring(0, source.length() - 2))));
            return element.matchesSubtype(array.elementType());
        }
        if (!(type instanceof JavaType.Class start)) {
            return false;
        }
        var seen = new HashSet<String>();
        var queue = new ArrayDeque<JavaType.Class>();
        queue.add(start);
        while (!queue.isEmpty()) {
            var current = queue.poll();
            if (!seen.add(current.fullyQualifiedName())) {
                continue;
            }
            if (regex.matcher(current.fullyQualifiedName()).matches()) {
                return true;
            }
            current.supertype().ifPresent(queue::add);
            queue.addAll(current.interfaces());
        }
        return false;
    }

    /**
     * Erased name of a type as it is written in patterns, e.g. {@code java.lang.String[]}.
     */
    static Optional<String> erasure(JavaType type) {
        if (type instanceof JavaType.Primitive primitive) {
            return Optional.of(primitive.keyword());
        }
        if (type instanceof JavaType.Class c) {
            return Optional.of(c.fullyQualifiedName());
        }
        if (type instanceof JavaType.Array array) {
            return erasure(array.elementType()).map(name -> name + "[]");
        }
        return Optional.empty();
    }

    private static String eraseTypeArguments(String pattern) {
        var sb = new StringBuilder();
        int depth = 0;
        for (char c : pattern.toCharArray()) {
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                if (--depth < 0) {
                    throw new IllegalArgumentException("Unbalanced type arguments: " + pattern);
                }
            } else if (depth == 0) {
                sb.append(c);
            }
        }
        if (depth != 0) {
            throw new IllegalArgumentException("Unbalanced type arguments: " + pattern);
        }
        return sb.toString();
    }

    private static String toRegex(String pattern) {
        var sb = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '.' && i + 1 < pattern.length() && pattern.charAt(i + 1) == '.') {
                sb.append("\\.(?:[^.]+\\.)*");
                i++;
            } else if (c == '.') {
                sb.append("\\.");
            } else if (c == '*') {
                sb.append("[^.]*");
            } else if (c == '[' || c == ']' || c == '$') {
                sb.append('\\').append(c);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return source;
    }
}
