package org.pragmatica.rewrite.change;

import java.util.List;

/**
 * Renders a line diff as a git-style unified patch.
 *
 * <p>Example output:
 * <pre>
 * diff --git a/src/A.java b/src/A.java
 * --- a/src/A.java
 * +++ b/src/A.java
 * &#64;&#64; -3,3 +3,3 &#64;&#64;
 *  class A {
 * -    String name;
 * +    CharSequence name;
 *  }
 * </pre>
 * An absent side is written as {@code /dev/null}. Identical texts render as an empty string.
 */
public final class UnifiedDiff {
    public static final String DEV_NULL = "/dev/null";
    private static final String NO_NEWLINE = "\\ No newline at end of file\n";

    private UnifiedDiff() {}

    /**
     * @param oldPath      path of the original, or {@code null} for a new file
     * @param newPath      path of the result, or {@code null} for a deleted file
     * @param contextLines unchanged lines shown around each change
     */
    public static String render(String oldPath, String newPath, String before, String after, int contextLines) {
        if (contextLines < 0) {
            throw new IllegalArgumentException("Context lines must not be negative: " + contextLines);
        }
        var edits = LineDiff.diff(before, after);
        if (edits.stream().noneMatch(LineDiff.Edit::isChange)) {
            return "";
        }
        var displayPath = oldPath != null ? oldPath : newPath;
        var sb = new StringBuilder();
        sb.append("diff --git a/").append(displayPath).append(" b/").append(newPath != null ? newPath : oldPath)
          .append('\n');
        if (oldPath == null) {
            sb.append("new file mode 100644\n");
        } else if (newPath == null) {
            sb.append("deleted file mode 100644\n");
        }
        sb.append("--- ").append(oldPath == null ? DEV_NULL : "a/" + oldPath).append('\n');
        sb.append("+++ ").append(newPath == null ? DEV_NULL : "b/" + newPath).append('\n');
        appendHunks(edits, contextLines, sb);
        return sb.toString();
    }

    private static void appendHunks(List<LineDiff.Edit> edits, int context, StringBuilder sb) {
        int size = edits.size();
        int index = 0;
        while (index < size) {
            if (!edits.get(index).isChange()) {
                index++;
                continue;
            }
            int start = Math.max(0, index - context);
            int lastChange = index;
            int cursor = index + 1;
            while (cursor < size) {
                if (edits.get(cursor).isChange()) {
                    lastChange = cursor++;
                    continue;
                }
                int run = cursor;
                while (run < size && !edits.get(run).isChange()) {
                    run++;
                }
                if (run < size && run - cursor <= 2 * context) {
                    cursor = run;
                } else {
                    break;
                }
            }
            int end = Math.min(size, lastChange + 1 + context);
            appendHunk(edits.subList(start, end), sb);
            index = end;
        }
    }

    private static void appendHunk(List<LineDiff.Edit> hunk, StringBuilder sb) {
        int oldCount = 0;
        int newCount = 0;
        for (var edit : hunk) {
            if (edit.operation() != LineDiff.Operation.INSERT) {
                oldCount++;
            }
            if (edit.operation() != LineDiff.Operation.DELETE) {
                newCount++;
            }
        }
        var first = hunk.get(0);
        sb.append("@@ -").append(range(first.oldIndex(), oldCount))
          .append(" +").append(range(first.newIndex(), newCount))
          .append(" @@\n");
        for (var edit : hunk) {
            sb.append(switch (edit.operation()) {
                case EQUAL -> ' ';
                case DELETE -> '-';
                case INSERT -> '+';
            });
            var line = edit.line();
            if (line.endsWith("\n")) {
                sb.append(line);
            } else {
                sb.append(line).append('\n').append(NO_NEWLINE);
            }
        }
    }

    private static String range(int index, int count) {
        if (count == 0) {
            return index + ",0";
        }
        return count == 1 ? String.valueOf(index + 1) : (index + 1) + "," + count;
    }
}
