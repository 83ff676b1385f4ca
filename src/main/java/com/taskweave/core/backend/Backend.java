package com.taskweave.core.backend;

/**
 * An execution backend the invocation controller can route a task to.
 * There are exactly two variants; which one is called is decided by the
 * controller's failure policy, never by inspecting the implementation.
 */
public sealed interface Backend permits PrimaryBackend, SecondaryBackend {

    String name();

    /**
     * Cheap local check, e.g. whether the executable is on the PATH.
     * Used by health checks; never performs a real call.
     */
    default boolean isAvailable() {
        return true;
    }
}
