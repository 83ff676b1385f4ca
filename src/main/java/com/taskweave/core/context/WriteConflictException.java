package com.taskweave.core.context;

/**
 * Raised under {@link WriteConflictPolicy#REJECT} when a unit writes an artifact key
 * that another unit already wrote in the same parallel section.
 */
public class WriteConflictException extends ContextStateException {
    public WriteConflictException(String key, String owner, String writer) {
        super("Artifact '" + key + "' already written by " + owner + "; rejected write from " + writer);
    }
}
