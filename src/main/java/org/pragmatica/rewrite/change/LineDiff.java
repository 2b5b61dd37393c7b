package org.pragmatica.rewrite.change;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-level diff based on the longest common subsequence.
 *
 * <p>Common leading and trailing lines are matched first, so the quadratic table only covers
 * the changed middle region. A line keeps its terminating newline, so the last line of a
 * file differs from the same text followed by a newline.
 */
public final class LineDiff {
    private static final Logger log = LoggerFactory.getLogger(LineDiff.class);

    /**
     * Largest middle region (old lines times new lines) solved exactly, about 16 MB of table
     * per diff and so per runner worker. Beyond it the region is reported as replaced wholesale.
     */
    static final long MAX_TABLE_CELLS = 4_000_000L;

    private LineDiff() {}

    public enum Operation {
        EQUAL,
        DELETE,
        INSERT
    }

    /**
     * One line of the edit script. {@code oldIndex} and {@code newIndex} are zero-based
     * positions; for an insertion {@code oldIndex} is the number of old lines before it, for
     * a deletion {@code newIndex} is the number of new lines before it.
     */
    public record Edit(Operation operation, int oldIndex, int newIndex, String line) {
        public boolean isChange() {
            return operation != Operation.EQUAL;
        }
    }

    /**
     * Split text into lines, each keeping its {@code \n}. The last line has none when the
     * text does not end with a newline.
     */
    public static List<String> lines(String text) {
        var result = new ArrayList<String>();
        int start = 0;
        while (start < text.length()) {
            int newline = text.indexOf('\n', start);
            int end = newline < 0 ? text.length() : newline + 1;
            result.add(text.substring(start, end));
            start = end;
        }
        return result;
    }

    public static List<Edit> diff(String before, String after) {
        return diff(lines(before), lines(after));
    }

    public static List<Edit> diff(List<String> before, List<String> after) {
        int prefix = 0;
        while (prefix < before.size() && prefix < after.size() && before.get(prefix).equals(after.get(prefix))) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < before.size() - prefix && suffix < after.size() - prefix
               && before.get(before.size() - 1 - suffix).equals(after.get(after.size() - 1 - suffix))) {
            suffix++;
        }
        var edits = ImmutableList.<Edit>builder();
        for (int i = 0; i < prefix; i++) {
            edits.add(new Edit(Operation.EQUAL, i, i, before.get(i)));
        }
        middle(before.subList(prefix, before.size() - suffix), after.subList(prefix, after.size() - suffix),
               prefix, prefix, edits);
        int oldStart = before.size() - suffix;
        int newStart = after.size() - suffix;
        for (int i = 0; i < suffix; i++) {
            edits.add(new Edit(Operation.EQUAL, oldStart + i, newStart + i, before.get(oldStart + i)));
        }
        return edits.build();
    }

    private static void middle(List<String> before,
                               List<String> after,
                               int oldOffset,
                               int newOffset,
                               ImmutableList.Builder<Edit> edits) {
        int n = before.size();
        int m = after.size();
        if ((long) n * m > MAX_TABLE_CELLS) {
            log.debug("Changed region of {}x{} lines is too large for an exact diff", n, m);
            for (int i = 0; i < n; i++) {
                edits.add(new Edit(Operation.DELETE, oldOffset + i, newOffset, before.get(i)));
            }
            for (int j = 0; j < m; j++) {
                edits.add(new Edit(Operation.INSERT, oldOffset + n, newOffset + j, after.get(j)));
            }
            return;
        }
        // lcs[i][j] = length of the LCS of before[i..] and after[j..]
        var lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                lcs[i][j] = before.get(i).equals(after.get(j))
                            ? lcs[i + 1][j + 1] + 1
                            : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }
        int i = 0;
        int j = 0;
        while (i < n || j < m) {
            if (i < n && j < m && before.get(i).equals(after.get(j))) {
                edits.add(new Edit(Operation.EQUAL, oldOffset + i, newOffset + j, before.get(i)));
                i++;
                j++;
            } else if (j == m || i < n && lcs[i + 1][j] >= lcs[i][j + 1]) {
                edits.add(new Edit(Operation.DELETE, oldOffset + i, newOffset + j, before.get(i)));
                i++;
            } else {
                edits.add(new Edit(Operation.INSERT, oldOffset + i, newOffset + j, after.get(j)));
                j++;
            }
        }
    }
}
