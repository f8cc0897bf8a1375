package workforce.backend.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable domain model of a unit of work assigned to an employee.
 * Owned by a tenant, mutated only through the lifecycle, never hard-deleted.
 */
public final class Task {
    private final String id;
    private final String tenantId;
    private final String assigneeId; // employee id or null
    private final String title;
    private final String description;
    private final TaskStatus status;
    private final TaskPriority priority;
    private final int complexity; // 1..5
    private final List<String> requiredSkills;
    private final Instant dueDate;
    private final Instant completedAt;
    private final boolean active;
    private final Instant createdAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.tenantId = Objects.requireNonNull(builder.tenantId, "tenantId is required");
        this.assigneeId = builder.assigneeId;
        this.title = builder.title;
        this.description = builder.description;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.priority = builder.priority != null ? builder.priority : TaskPriority.MEDIUM;
        this.complexity = builder.complexity;
        this.requiredSkills = builder.requiredSkills != null ? List.copyOf(builder.requiredSkills) : List.of();
        this.dueDate = builder.dueDate;
        this.completedAt = builder.completedAt;
        this.active = builder.active;
        this.createdAt = builder.createdAt;

        if (complexity < 1 || complexity > 5) {
            throw new IllegalArgumentException("complexity must be between 1 and 5");
        }
        if ((status == TaskStatus.COMPLETED) != (completedAt != null)) {
            throw new IllegalStateException(
                    "completedAt must be set if and only if status is COMPLETED (task " + id + ")");
        }
    }

    public String id() {
        return id;
    }

    public String tenantId() {
        return tenantId;
    }

    public String assigneeId() {
        return assigneeId;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public TaskStatus status() {
        return status;
    }

    public TaskPriority priority() {
        return priority;
    }

    public int complexity() {
        return complexity;
    }

    public List<String> requiredSkills() {
        return requiredSkills;
    }

    public Instant dueDate() {
        return dueDate;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public boolean active() {
        return active;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }

    public boolean hasAssignee() {
        return assigneeId != null && !assigneeId.isBlank();
    }

    /** Completed with a deadline and not later than it */
    public boolean completedOnTime() {
        return isCompleted() && dueDate != null && !completedAt.isAfter(dueDate);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .tenantId(tenantId)
                .assigneeId(assigneeId)
                .title(title)
                .description(description)
                .status(status)
                .priority(priority)
                .complexity(complexity)
                .requiredSkills(requiredSkills)
                .dueDate(dueDate)
                .completedAt(completedAt)
                .active(active)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String tenantId;
        private String assigneeId;
        private String title;
        private String description;
        private TaskStatus status = TaskStatus.ASSIGNED;
        private TaskPriority priority = TaskPriority.MEDIUM;
        private int complexity = 3;
        private List<String> requiredSkills;
        private Instant dueDate;
        private Instant completedAt;
        private boolean active = true;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder assigneeId(String assigneeId) {
            this.assigneeId = assigneeId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder complexity(int complexity) {
            this.complexity = complexity;
            return this;
        }

        public Builder requiredSkills(List<String> requiredSkills) {
            this.requiredSkills = requiredSkills;
            return this;
        }

        public Builder dueDate(Instant dueDate) {
            this.dueDate = dueDate;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', status=" + status + ", assigneeId='" + assigneeId + "'}";
    }
}
