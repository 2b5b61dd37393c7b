package org.pragmatica.rewrite.change;

import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class UnifiedDiffTest {

    private static String numbered(int count, int replaced1, int replaced2) {
        return IntStream.rangeClosed(1, count)
                        .mapToObj(i -> (i == replaced1 || i == replaced2 ? "L" : "l") + i + "\n")
                        .collect(Collectors.joining());
    }

    @Test
    void modifiedLine_rendersSingleHunk() {
        var diff = UnifiedDiff.render("src/A.java", "src/A.java",
                                      "class A {\n    String name;\n}\n",
                                      "class A {\n    CharSequence name;\n}\n",
                                      3);

        assertEquals("""
            diff --git a/src/A.java b/src/A.java
            --- a/src/A.java
            +++ b/src/A.java
            @@ -1,3 +1,3 @@
             class A {
            -    String name;
            +    CharSequence name;
             }
            """, diff);
    }

    @Test
    void newFile_usesDevNullAsOrigin() {
        assertEquals("""
            diff --git a/A.java b/A.java
            new file mode 100644
            --- /dev/null
            +++ b/A.java
            @@ -0,0 +1 @@
            +x
            """, UnifiedDiff.render(null, "A.java", "", "x\n", 3));
    }

    @Test
    void deletedFile_usesDevNullAsTarget() {
        assertEquals("""
            diff --git a/A.java b/A.java
            deleted file mode 100644
            --- a/A.java
            +++ /dev/null
            @@ -1,2 +0,0 @@
            -x
            -y
            """, UnifiedDiff.render("A.java", null, "x\ny\n", "", 3));
    }

    @Test
    void missingFinalNewline_isMarked() {
        assertEquals("""
            diff --git a/A b/A
            --- a/A
            +++ b/A
            @@ -1,2 +1,2 @@
             a
            -b
            \\ No newline at end of file
            +c
            \\ No newline at end of file
            """, UnifiedDiff.render("A", "A", "a\nb", "a\nc", 3));
    }

    @Test
    void distantChanges_renderSeparateHunks() {
        var diff = UnifiedDiff.render("A", "A", numbered(20, 0, 0), numbered(20, 2, 19), 3);

        assertEquals("""
            diff --git a/A b/A
            --- a/A
            +++ b/A
            @@ -1,5 +1,5 @@
             l1
            -l2
            +L2
             l3
             l4
             l5
            @@ -16,5 +16,5 @@
             l16
             l17
             l18
            -l19
            +L19
             l20
            """, diff);
    }

    @Test
    void nearbyChanges_shareOneHunk() {
        var diff = UnifiedDiff.render("A", "A", numbered(20, 0, 0), numbered(20, 2, 19), 8);

        assertEquals(1, diff.lines().filter(line -> line.startsWith("@@")).count());
        assertTrue(diff.contains("@@ -1,20 +1,20 @@"));
    }

    @Test
    void zeroContext_showsOnlyChangedLines() {
        var diff = UnifiedDiff.render("A", "A", "a\nb\nc\n", "a\nB\nc\n", 0);

        assertTrue(diff.endsWith("@@ -2 +2 @@\n-b\n+B\n"));
    }

    @Test
    void identicalTexts_renderNothing() {
        assertEquals("", UnifiedDiff.render("A", "A", "same\n", "same\n", 3));
    }

    @Test
    void negativeContext_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> UnifiedDiff.render("A", "A", "a", "b", -1));
    }
}
