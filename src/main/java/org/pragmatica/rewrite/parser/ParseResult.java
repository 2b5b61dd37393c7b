package org.pragmatica.rewrite.parser;

import org.pragmatica.rewrite.error.ParseError;
import org.pragmatica.rewrite.tree.Tree;

/**
 * Result of parsing a source file - either a compilation unit or the error that stopped the parser.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The parsed compilation unit; throws {@link IllegalStateException} for a failure.
     */
    Tree.Node unwrap();

    record Success(Tree.Node compilationUnit) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Tree.Node unwrap() {
            return compilationUnit;
        }
    }

    record Failure(ParseError error) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Tree.Node unwrap() {
            throw new IllegalStateException("Parse failed: " + error.message());
        }
    }
}
