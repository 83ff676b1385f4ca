package com.taskweave.core.backend;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Tools the primary backend may use while working on a task.
 */
public record ToolPermissions(List<String> allowed) {

    public ToolPermissions {
        allowed = allowed == null ? List.of() : List.copyOf(new LinkedHashSet<>(allowed));
    }

    public static ToolPermissions of(String... tools) {
        return new ToolPermissions(List.of(tools));
    }

    public static ToolPermissions of(Collection<String> tools) {
        return new ToolPermissions(tools == null ? List.of() : List.copyOf(tools));
    }

    public static ToolPermissions none() {
        return new ToolPermissions(List.of());
    }

    public boolean allows(String tool) {
        return allowed.contains(tool);
    }
}
