package org.pragmatica.rewrite.visitor;

import com.google.common.collect.ImmutableList;
import org.pragmatica.rewrite.tree.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Ordered composition of refactor visitors. Each stage receives the fully materialised tree
 * produced by the previous one; when two stages touch the same subtree the later one wins.
 */
public final class Pipeline {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private static final Pipeline EMPTY = new Pipeline(List.of());

    private final List<RefactorVisitor> stages;

    private Pipeline(List<RefactorVisitor> stages) {
        this.stages = ImmutableList.copyOf(stages);
    }

    public static Pipeline empty() {
        return EMPTY;
    }

    public static Pipeline of(RefactorVisitor... stages) {
        return new Pipeline(List.of(stages));
    }

    public static Pipeline of(List<RefactorVisitor> stages) {
        return new Pipeline(stages);
    }

    public Pipeline andThen(RefactorVisitor next) {
        return new Pipeline(ImmutableList.<RefactorVisitor>builder()
                                         .addAll(stages)
                                         .add(next)
                                         .build());
    }

    public Pipeline andThen(Pipeline next) {
        return new Pipeline(ImmutableList.<RefactorVisitor>builder()
                                         .addAll(stages)
                                         .addAll(next.stages)
                                         .build());
    }

    public List<RefactorVisitor> stages() {
        return stages;
    }

    public boolean isEmpty() {
        return stages.isEmpty();
    }

    /**
     * Apply every stage in order and return the final tree.
     */
    public Tree.Node run(Tree.Node root) {
        var current = root;
        for (var stage : stages) {
            var next = stage.visitRoot(current);
            if (log.isDebugEnabled()) {
                log.debug("Stage {} {}", stage.name(), next == current ? "made no change" : "changed the tree");
            }
            current = next;
        }
        return current;
    }

    @Override
    public String toString() {
        return "Pipeline" + stages.stream().map(RefactorVisitor::name).toList();
    }
}
