package com.parsetree.model;

/**
 * One node-creation event. Replaying steps in order and attaching each
 * {@code nodeId} under {@code parentId} rebuilds the tree as it stood after
 * that step.
 */
public record Step(StepAction action, String description, int nodeId, int parentId) {
    /** Parent id of the root node. */
    public static final int NO_PARENT = -1;

    public static final String EXPAND_PREFIX = "Expand non-terminal ";
    public static final String MATCH_PREFIX = "Match terminal ";
    public static final String EPSILON_DESCRIPTION = "Match epsilon (empty string)";

    public static Step expand(int nodeId, int parentId, String symbol) {
        return new Step(StepAction.ADD, EXPAND_PREFIX + "<" + symbol + ">", nodeId, parentId);
    }

    public static Step match(int nodeId, int parentId, String text) {
        return new Step(StepAction.ADD, MATCH_PREFIX + "'" + text + "'", nodeId, parentId);
    }

    public static Step epsilon(int nodeId, int parentId) {
        return new Step(StepAction.ADD, EPSILON_DESCRIPTION, nodeId, parentId);
    }

    public boolean isRoot() {
        return parentId == NO_PARENT;
    }
}
