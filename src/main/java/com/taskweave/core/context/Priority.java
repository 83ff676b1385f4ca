package com.taskweave.core.context;

public enum Priority {
    HIGH,
    NORMAL,
    LOW;

    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        for (Priority value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
