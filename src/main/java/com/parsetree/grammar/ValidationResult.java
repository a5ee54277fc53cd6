package com.parsetree.grammar;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

public record ValidationResult(boolean valid, ImmutableList<String> errors, ImmutableList<String> warnings) {
    public static ValidationResult invalid(String error) {
        return new ValidationResult(false, Lists.immutable.of(error), Lists.immutable.empty());
    }
}
