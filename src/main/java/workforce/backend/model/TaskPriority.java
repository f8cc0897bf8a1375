package workforce.backend.model;

import java.util.Locale;

public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH;

    public static TaskPriority parseOrDefault(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return TaskPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown priority: " + value);
        }
    }
}
