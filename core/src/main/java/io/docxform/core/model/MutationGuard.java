package io.docxform.core.model;

/**
 * Veto hook consulted by every mutating operation on a tree whose root carries the guard. The
 * converter engine installs one on both the source and the output tree so that node converters can
 * only touch the nodes they own.
 *
 * <p>A guard either returns {@code false}, in which case the mutation is silently skipped, or
 * throws to abort the pass.
 */
@FunctionalInterface
public interface MutationGuard {

    /**
     * Decides whether {@code node} may be mutated right now.
     *
     * @param node the node about to change
     * @return {@code true} to let the mutation proceed
     */
    boolean permits(Node node);
}
