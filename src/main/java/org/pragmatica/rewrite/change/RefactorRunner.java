package org.pragmatica.rewrite.change;

import com.google.common.collect.ImmutableList;
import org.pragmatica.rewrite.visitor.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs one pipeline over many source files on a fixed pool of workers.
 *
 * <p>Each file is refactored by a single task; trees are immutable and visitors hold no
 * traversal state, so tasks share nothing mutable. Changes are returned in input order.
 */
public final class RefactorRunner {
    private static final Logger log = LoggerFactory.getLogger(RefactorRunner.class);

    private final RewriteConfig config;

    public RefactorRunner(RewriteConfig config) {
        this.config = config;
    }

    public static RefactorRunner create() {
        return new RefactorRunner(RewriteConfig.DEFAULT);
    }

    public RewriteConfig config() {
        return config;
    }

    /**
     * Refactor every file. Unless the configuration asks for unchanged files, only changes
     * with a textual difference are returned. A failure in any file is rethrown.
     */
    public List<Change> run(List<SourceFile> sourceFiles, Pipeline pipeline) {
        if (sourceFiles.isEmpty()) {
            return List.of();
        }
        int workers = Math.min(config.parallelism(), sourceFiles.size());
        log.debug("Running {} over {} files with {} workers", pipeline, sourceFiles.size(), workers);
        var executor = Executors.newFixedThreadPool(workers);
        try {
            var futures = new ArrayList<Future<Change>>(sourceFiles.size());
            for (var sourceFile : sourceFiles) {
                futures.add(executor.submit(() -> Refactor.refactor(sourceFile, pipeline)));
            }
            var result = ImmutableList.<Change>builder();
            for (var future : futures) {
                var change = await(future);
                if (config.includeUnchanged() || change.hasChanges()) {
                    result.add(change);
                }
            }
            return result.build();
        } finally {
            executor.shutdownNow();
        }
    }

    private static Change await(Future<Change> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while refactoring", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Refactoring failed", e.getCause());
        }
    }
}
