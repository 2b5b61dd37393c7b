package org.pragmatica.rewrite.tree;

/**
 * Trivia represents non-semantic content: whitespace and comments.
 * Each item keeps its exact source text.
 */
public sealed interface Trivia {
    String text();

    record Whitespace(String text) implements Trivia {}

    record LineComment(String text) implements Trivia {}

    record BlockComment(String text) implements Trivia {}
}
