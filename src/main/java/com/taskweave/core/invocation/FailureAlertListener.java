package com.taskweave.core.invocation;

/**
 * Receives repeated-failure alerts. Listeners must not throw; if one does, the
 * invocation that triggered the alert still succeeds.
 */
@FunctionalInterface
public interface FailureAlertListener {
    void onAlert(RepeatedFailureAlert alert);
}
