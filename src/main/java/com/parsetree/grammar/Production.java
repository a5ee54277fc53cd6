package com.parsetree.grammar;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * All alternatives of one non-terminal, in the order they are tried.
 */
public record Production(String head, ImmutableList<ImmutableList<String>> alternatives) {
    public boolean isEmpty() {
        return alternatives.isEmpty();
    }

    public boolean isLeftRecursive(ImmutableList<String> alternative) {
        return alternative.notEmpty() && alternative.getFirst().equals(head);
    }

    @Override
    public String toString() {
        return head + " -> " + alternatives.collect(alt -> alt.makeString(" ")).makeString(" | ");
    }
}
