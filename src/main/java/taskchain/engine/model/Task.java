package taskchain.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing one step of a workflow.
 * <p>
 * The dependency is held as the step number of a sibling task, never as a
 * reference to the sibling itself. Resolve it through the workflow's tasks.
 */
public final class Task {
    private final String id;
    private final String workflowId;
    private final String clientId;
    private final int stepNumber;
    private final String taskType;
    private final TaskStatus status;
    private final Integer dependsOn; // step number or null
    private final String payload; // job input, e.g. GeoJSON
    private final String progress;
    private final String resultId;
    private final String claimedBy; // worker ID or null
    private final Instant claimedAt;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.workflowId = Objects.requireNonNull(builder.workflowId, "workflowId is required");
        this.clientId = builder.clientId;
        this.stepNumber = builder.stepNumber;
        this.taskType = Objects.requireNonNull(builder.taskType, "taskType is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.dependsOn = builder.dependsOn;
        this.payload = builder.payload;
        this.progress = builder.progress;
        this.resultId = builder.resultId;
        this.claimedBy = builder.claimedBy;
        this.claimedAt = builder.claimedAt;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String workflowId() {
        return workflowId;
    }

    public String clientId() {
        return clientId;
    }

    public int stepNumber() {
        return stepNumber;
    }

    public String taskType() {
        return taskType;
    }

    public TaskStatus status() {
        return status;
    }

    public Integer dependsOn() {
        return dependsOn;
    }

    public String payload() {
        return payload;
    }

    public String progress() {
        return progress;
    }

    public String resultId() {
        return resultId;
    }

    public String claimedBy() {
        return claimedBy;
    }

    public Instant claimedAt() {
        return claimedAt;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean hasDependency() {
        return dependsOn != null;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Start a builder for this task moved to {@code next}.
     *
     * @throws IllegalTaskTransitionException if the state machine forbids the move
     */
    public Builder transitionTo(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalTaskTransitionException(id, status, next);
        }
        return toBuilder().status(next);
    }

    /** The read-only view handed to jobs */
    public TaskView view() {
        return new TaskView(id, workflowId, stepNumber, taskType, payload);
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .workflowId(workflowId)
                .clientId(clientId)
                .stepNumber(stepNumber)
                .taskType(taskType)
                .status(status)
                .dependsOn(dependsOn)
                .payload(payload)
                .progress(progress)
                .resultId(resultId)
                .claimedBy(claimedBy)
                .claimedAt(claimedAt)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String workflowId;
        private String clientId;
        private int stepNumber;
        private String taskType;
        private TaskStatus status = TaskStatus.QUEUED;
        private Integer dependsOn;
        private String payload;
        private String progress;
        private String resultId;
        private String claimedBy;
        private Instant claimedAt;
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder stepNumber(int stepNumber) {
            this.stepNumber = stepNumber;
            return this;
        }

        public Builder taskType(String taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder dependsOn(Integer dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder progress(String progress) {
            this.progress = progress;
            return this;
        }

        public Builder resultId(String resultId) {
            this.resultId = resultId;
            return this;
        }

        public Builder claimedBy(String claimedBy) {
            this.claimedBy = claimedBy;
            return this;
        }

        public Builder claimedAt(Instant claimedAt) {
            this.claimedAt = claimedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
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
        return "Task{id='" + id + "', step=" + stepNumber + ", type='" + taskType + "', status=" + status
                + (dependsOn != null ? ", dependsOn=" + dependsOn : "") + "}";
    }
}
