package com.parsetree.model;

public enum StepAction {
    ADD("add");

    private final String wireName;

    StepAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
