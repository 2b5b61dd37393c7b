package org.pragmatica.rewrite.change;

import org.pragmatica.rewrite.visitor.Pipeline;
import org.pragmatica.rewrite.visitor.RefactorVisitor;

/**
 * Applies refactor visitors to source files and packages the result as a {@link Change}.
 */
public final class Refactor {
    private Refactor() {}

    public static Change refactor(SourceFile sourceFile, Pipeline pipeline) {
        var result = pipeline.run(sourceFile.root());
        return Change.of(sourceFile.path(), sourceFile.root(), result);
    }

    public static Change refactor(SourceFile sourceFile, RefactorVisitor visitor) {
        return refactor(sourceFile, Pipeline.of(visitor));
    }
}
