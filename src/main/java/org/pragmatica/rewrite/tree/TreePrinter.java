package org.pragmatica.rewrite.tree;

/**
 * Renders trees back to source text.
 */
public final class TreePrinter {
    private TreePrinter() {}

    public static String print(Tree tree) {
        var sb = new StringBuilder();
        append(tree, sb);
        return sb.toString();
    }

    private static void append(Tree tree, StringBuilder sb) {
        if (tree instanceof Tree.Token token) {
            for (var trivia : token.prefix().trivia()) {
                sb.append(trivia.text());
            }
            sb.append(token.text());
        } else if (tree instanceof Tree.Node node) {
            for (var child : node.children()) {
                append(child, sb);
            }
        }
    }

    /**
     * Drop leading blank lines and trailing whitespace, then remove the smallest
     * indentation shared by all non-blank lines.
     */
    public static String trimIndent(String text) {
        var lines = text.replace("\r\n", "\n").split("\n", -1);
        int first = 0;
        while (first < lines.length && lines[first].isBlank()) {
            first++;
        }
        int last = lines.length - 1;
        while (last >= first && lines[last].isBlank()) {
            last--;
        }
        if (first > last) {
            return "";
        }
        int margin = Integer.MAX_VALUE;
        for (int i = first; i <= last; i++) {
            if (!lines[i].isBlank()) {
                margin = Math.min(margin, leadingWhitespace(lines[i]));
            }
        }
        var sb = new StringBuilder();
        for (int i = first; i <= last; i++) {
            var line = lines[i];
            sb.append(line.isBlank() ? "" : line.substring(margin).stripTrailing());
            if (i < last) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    private static int leadingWhitespace(String line) {
        int count = 0;
        while (count < line.length() && Character.isWhitespace(line.charAt(count))) {
            count++;
        }
        return count;
    }
}
