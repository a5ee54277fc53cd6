package com.parsetree.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.stack.MutableStack;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Stacks;

/**
 * A parse tree node. Terminals carry the matched token text (or {@code ε})
 * as their label and have no children; non-terminals carry the symbol name.
 * Walks over a tree use an explicit stack, since right-recursive grammars
 * produce trees as deep as the input is long.
 */
public record TreeNode(int id, String label, boolean terminal, ImmutableList<TreeNode> children) {
    public static TreeNode terminal(int id, String label) {
        return new TreeNode(id, label, true, Lists.immutable.empty());
    }

    public static TreeNode nonTerminal(int id, String label, ImmutableList<TreeNode> children) {
        return new TreeNode(id, label, false, children);
    }

    public boolean isEpsilon() {
        return terminal && "ε".equals(label);
    }

    /**
     * Number of nodes in this subtree, including this one.
     */
    public int size() {
        int size = 0;
        MutableStack<TreeNode> pending = Stacks.mutable.with(this);
        while (pending.notEmpty()) {
            TreeNode node = pending.pop();
            size++;
            node.children.each(pending::push);
        }
        return size;
    }

    /**
     * Labels of the matched terminals, left to right, without ε leaves.
     */
    public ImmutableList<String> frontier() {
        MutableList<String> labels = Lists.mutable.empty();
        MutableStack<TreeNode> pending = Stacks.mutable.with(this);
        while (pending.notEmpty()) {
            TreeNode node = pending.pop();
            if (node.terminal) {
                if (!node.isEpsilon()) {
                    labels.add(node.label);
                }
            } else {
                // reversed so the leftmost child is popped first
                node.children.reverseForEach(pending::push);
            }
        }
        return labels.toImmutable();
    }
}
