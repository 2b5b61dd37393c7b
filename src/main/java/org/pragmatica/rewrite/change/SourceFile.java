package org.pragmatica.rewrite.change;

import org.pragmatica.rewrite.parser.JavaParser;
import org.pragmatica.rewrite.tree.Kind;
import org.pragmatica.rewrite.tree.Tree;

import java.nio.file.Path;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A parsed compilation unit and the path it was read from.
 */
public record SourceFile(Path path, Tree.Node root) {
    public SourceFile {
        checkNotNull(path, "path");
        checkNotNull(root, "root");
        checkArgument(root.kind() == Kind.COMPILATION_UNIT, "Source file root must be a compilation unit, got %s",
                      root.kind());
    }

    /**
     * Parse source text; fails with {@link IllegalStateException} if it does not parse.
     */
    public static SourceFile parse(JavaParser parser, Path path, String source) {
        return new SourceFile(path, parser.parse(source).unwrap());
    }

    public SourceFile withRoot(Tree.Node newRoot) {
        return newRoot == root ? this : new SourceFile(path, newRoot);
    }

    public String print() {
        return root.print();
    }
}
