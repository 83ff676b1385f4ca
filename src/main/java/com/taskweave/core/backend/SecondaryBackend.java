package com.taskweave.core.backend;

/**
 * Free-text backend used when the primary cannot serve a request.
 * It takes a plain prompt and returns unstructured text.
 */
@FunctionalInterface
public non-sealed interface SecondaryBackend extends Backend {

    String call(String prompt) throws Exception;

    @Override
    default String name() {
        return "secondary";
    }
}
