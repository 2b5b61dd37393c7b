package org.pragmatica.rewrite.visitor;

import org.pragmatica.rewrite.traversal.Cursor;
import org.pragmatica.rewrite.tree.Tree;

/**
 * A tree found by a search, with the cursor it was found at.
 */
public record Match(Tree tree, Cursor cursor) {

    public String print() {
        return tree.print();
    }

    public String printTrimmed() {
        return tree.printTrimmed();
    }
}
