package org.pragmatica.rewrite.change;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.pragmatica.rewrite.traversal.TreeWalker;
import org.pragmatica.rewrite.tree.Tree;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The outcome of refactoring one file: the original tree, the transformed tree and the
 * identity correlation between them.
 *
 * <p>Either side may be absent: no original means the file was synthesized, no result means
 * it was deleted. Both trees are kept as they are; unchanged subtrees are shared between them
 * and the correlation map is built once, so a change can be read from several threads.
 */
public final class Change {
    private final Path path;
    private final Optional<Tree.Node> before;
    private final Optional<Tree.Node> after;
    private final Map<UUID, Tree> originals;

    private Change(Path path, Optional<Tree.Node> before, Optional<Tree.Node> after) {
        if (before.isEmpty() && after.isEmpty()) {
            throw new IllegalArgumentException("A change needs an original or a result: " + path);
        }
        this.path = path;
        this.before = before;
        this.after = after;
        this.originals = before.map(Change::index).orElse(ImmutableMap.of());
    }

    public static Change of(Path path, Tree.Node before, Tree.Node after) {
        return new Change(path, Optional.of(before), Optional.of(after));
    }

    public static Change added(Path path, Tree.Node after) {
        return new Change(path, Optional.empty(), Optional.of(after));
    }

    public static Change deleted(Path path, Tree.Node before) {
        return new Change(path, Optional.of(before), Optional.empty());
    }

    private static Map<UUID, Tree> index(Tree.Node root) {
        var result = new HashMap<UUID, Tree>();
        TreeWalker.preOrder(root, false)
                  .forEach(visit -> result.putIfAbsent(visit.tree().id(), visit.tree()));
        return ImmutableMap.copyOf(result);
    }

    public Path path() {
        return path;
    }

    public Optional<Tree.Node> before() {
        return before;
    }

    public Optional<Tree.Node> after() {
        return after;
    }

    public boolean isAddition() {
        return before.isEmpty();
    }

    public boolean isDeletion() {
        return after.isEmpty();
    }

    /**
     * Printed source of the result; empty for a deleted file.
     */
    public String printed() {
        return after.map(Tree::print).orElse("");
    }

    /**
     * Whether the printed result differs from the original. Identical roots are decided
     * without printing.
     */
    public boolean hasChanges() {
        if (before.isEmpty() || after.isEmpty()) {
            return true;
        }
        if (before.get() == after.get()) {
            return false;
        }
        return !before.get().print().equals(after.get().print());
    }

    /**
     * Ids of result trees that are not the very same instance as their original: new trees and
     * rebuilt ancestors of changed ones. Subtrees shared with the original are skipped whole.
     */
    public Set<UUID> changedIds() {
        if (after.isEmpty()) {
            return ImmutableSet.of();
        }
        var result = ImmutableSet.<UUID>builder();
        var pending = new ArrayDeque<Tree>();
        pending.push(after.get());
        while (!pending.isEmpty()) {
            var tree = pending.pop();
            if (originals.get(tree.id()) == tree) {
                continue;
            }
            result.add(tree.id());
            if (tree instanceof Tree.Node node) {
                node.children().forEach(pending::push);
            }
        }
        return result.build();
    }

    /**
     * The original tree with the given id, if it existed before the change.
     */
    public Optional<Tree> original(UUID id) {
        return Optional.ofNullable(originals.get(id));
    }

    public String diff() {
        return diff(null, RewriteConfig.DEFAULT.contextLines());
    }

    /**
     * Unified diff with the path shown relative to {@code basePath} when it lies below it.
     */
    public String diff(Path basePath) {
        return diff(basePath, RewriteConfig.DEFAULT.contextLines());
    }

    public String diff(Path basePath, int contextLines) {
        if (!hasChanges()) {
            return "";
        }
        var shown = displayPath(basePath);
        return UnifiedDiff.render(before.isPresent() ? shown : null,
                                  after.isPresent() ? shown : null,
                                  before.map(Tree::print).orElse(""),
                                  printed(),
                                  contextLines);
    }

    private String displayPath(Path basePath) {
        var shown = path;
        if (basePath != null && path.isAbsolute() == basePath.isAbsolute() && path.startsWith(basePath)) {
            shown = basePath.relativize(path);
        }
        return shown.toString().replace('\\', '/');
    }

    @Override
    public String toString() {
        var state = isAddition() ? "added" : isDeletion() ? "deleted" : hasChanges() ? "modified" : "unchanged";
        return "Change(" + path + ", " + state + ")";
    }
}
