package com.sailfish.retry.service.impl;

/**
 * Derives a readable name for an operation that was not given one.
 */
final class OperationNames {

    private static final String LAMBDA_MARKER = "$$Lambda";

    private OperationNames() {
    }

    static String nameOf(Object operation) {
        String name = operation.getClass().getSimpleName();
        int lambda = name.indexOf(LAMBDA_MARKER);
        if (lambda > 0) {
            return name.substring(0, lambda) + "::lambda";
        }
        return name.isEmpty() ? operation.getClass().getName() : name;
    }
}
