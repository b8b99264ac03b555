package taskchain.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing one client submission: a named set of
 * tasks with an aggregate status.
 */
public final class Workflow {
    private final String id;
    private final String clientId;
    private final String name;
    private final WorkflowStatus status;
    private final String finalResult;
    private final Instant createdAt;
    private final Instant finishedAt;

    private Workflow(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.clientId = builder.clientId;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.finalResult = builder.finalResult;
        this.createdAt = builder.createdAt;
        this.finishedAt = builder.finishedAt;
    }

    public String id() {
        return id;
    }

    public String clientId() {
        return clientId;
    }

    public String name() {
        return name;
    }

    public WorkflowStatus status() {
        return status;
    }

    public String finalResult() {
        return finalResult;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .clientId(clientId)
                .name(name)
                .status(status)
                .finalResult(finalResult)
                .createdAt(createdAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String clientId;
        private String name;
        private WorkflowStatus status = WorkflowStatus.INITIAL;
        private String finalResult;
        private Instant createdAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder status(WorkflowStatus status) {
            this.status = status;
            return this;
        }

        public Builder finalResult(String finalResult) {
            this.finalResult = finalResult;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Workflow build() {
            return new Workflow(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Workflow workflow))
            return false;
        return Objects.equals(id, workflow.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Workflow{id='" + id + "', name='" + name + "', status=" + status + "}";
    }
}
