package org.pragmatica.rewrite.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Formatting that precedes a token: a run of whitespace and comments, in source order.
 */
public record Space(List<Trivia> trivia) {

    public static final Space EMPTY = new Space(List.of());
    public static final Space SINGLE_SPACE = new Space(List.of(new Trivia.Whitespace(" ")));

    public Space {
        trivia = ImmutableList.copyOf(trivia);
    }

    /**
     * Split formatting text into trivia. The text must consist only of whitespace,
     * line comments and block comments.
     */
    public static Space format(String text) {
        if (text.isEmpty()) {
            return EMPTY;
        }
        var items = ImmutableList.<Trivia>builder();
        int pos = 0;
        while (pos < text.length()) {
            int start = pos;
            if (text.startsWith("//", pos)) {
                while (pos < text.length() && text.charAt(pos) != '\n') {
                    pos++;
                }
                items.add(new Trivia.LineComment(text.substring(start, pos)));
            } else if (text.startsWith("/*", pos)) {
                int end = text.indexOf("*/", pos + 2);
                if (end < 0) {
                    throw new IllegalArgumentException("Unterminated block comment in formatting: " + text);
                }
                pos = end + 2;
                items.add(new Trivia.BlockComment(text.substring(start, pos)));
            } else if (Character.isWhitespace(text.charAt(pos))) {
                while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                    pos++;
                }
                items.add(new Trivia.Whitespace(text.substring(start, pos)));
            } else {
                throw new IllegalArgumentException("Formatting may only contain whitespace and comments: " + text);
            }
        }
        return new Space(items.build());
    }

    public boolean isEmpty() {
        return trivia.isEmpty();
    }

    /**
     * Whitespace following the last line break, or empty if the formatting stays on one line.
     */
    public String indent() {
        var text = print();
        int newline = text.lastIndexOf('\n');
        return newline < 0 ? "" : text.substring(newline + 1);
    }

    public String print() {
        if (trivia.size() == 1) {
            return trivia.get(0).text();
        }
        var sb = new StringBuilder();
        for (var item : trivia) {
            sb.append(item.text());
        }
        return sb.toString();
    }

    public List<Trivia> comments() {
        return trivia.stream()
                     .filter(t -> !(t instanceof Trivia.Whitespace))
                     .toList();
    }

    @Override
    public String toString() {
        return "Space(" + print().replace("\n", "\\n") + ")";
    }
}
