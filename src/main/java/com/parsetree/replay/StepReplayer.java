package com.parsetree.replay;

import com.parsetree.model.Step;
import com.parsetree.model.TreeNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rebuilds a partial parse tree from the first {@code k} steps of a step log,
 * the way an animating renderer does. Labels and terminal-ness are read back
 * from the step descriptions.
 */
public class StepReplayer {
    private static final Pattern EXPAND = Pattern.compile("^" + Pattern.quote(Step.EXPAND_PREFIX) + "<(.*)>$");
    private static final Pattern MATCH = Pattern.compile("^" + Pattern.quote(Step.MATCH_PREFIX) + "'(.*)'$");

    /**
     * @return the tree after all steps, or {@code null} for an empty log
     */
    public TreeNode replayAll(ListIterable<Step> steps) {
        return replay(steps, steps.size());
    }

    /**
     * @param count number of leading steps to apply, {@code 0 <= count <= steps.size()}
     * @return the root of the partial tree, or {@code null} when {@code count} is 0
     * @throws IllegalArgumentException if a step names a parent that no earlier step created,
     *                                  or its description is not one the parser writes
     */
    public TreeNode replay(ListIterable<Step> steps, int count) {
        if (count < 0 || count > steps.size()) {
            throw new IllegalArgumentException("Step count " + count + " out of range 0.." + steps.size());
        }

        MutableMap<Integer, PartialNode> nodes = Maps.mutable.empty();
        PartialNode root = null;

        for (int i = 0; i < count; i++) {
            Step step = steps.get(i);
            PartialNode node = describe(step);
            nodes.put(step.nodeId(), node);

            if (step.isRoot()) {
                if (root != null) {
                    throw new IllegalArgumentException("Step " + (i + 1) + " adds a second root node " + step.nodeId());
                }
                root = node;
            } else {
                PartialNode parent = nodes.get(step.parentId());
                if (parent == null) {
                    throw new IllegalArgumentException(
                        "Step " + (i + 1) + " references unknown parent " + step.parentId());
                }
                parent.children.add(node);
            }
        }

        return root == null ? null : root.toTreeNode();
    }

    private static PartialNode describe(Step step) {
        String description = step.description();
        if (description.equals(Step.EPSILON_DESCRIPTION)) {
            return new PartialNode(step.nodeId(), "ε", true);
        }

        Matcher match = MATCH.matcher(description);
        if (match.matches()) {
            return new PartialNode(step.nodeId(), match.group(1), true);
        }

        Matcher expand = EXPAND.matcher(description);
        if (expand.matches()) {
            return new PartialNode(step.nodeId(), expand.group(1), false);
        }

        throw new IllegalArgumentException("Unrecognized step description: " + description);
    }

    private static final class PartialNode {
        private final int id;
        private final String label;
        private final boolean terminal;
        private final MutableList<PartialNode> children = Lists.mutable.empty();

        PartialNode(int id, String label, boolean terminal) {
            this.id = id;
            this.label = label;
            this.terminal = terminal;
        }

        TreeNode toTreeNode() {
            ImmutableList<TreeNode> built = children.collect(PartialNode::toTreeNode).toImmutable();
            return new TreeNode(id, label, terminal, built);
        }
    }
}
