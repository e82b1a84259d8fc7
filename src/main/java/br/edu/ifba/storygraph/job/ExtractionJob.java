package br.edu.ifba.storygraph.job;

import br.edu.ifba.storygraph.exception.ExtractionException;
import br.edu.ifba.storygraph.extraction.ExtractionStrategy;
import br.edu.ifba.storygraph.extraction.ExtractionUsage;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Future;

/**
 * One asynchronous extraction of one scene with one strategy.
 *
 * <p>State changes go through the synchronized transition methods, which refuse to leave a
 * terminal state. A transition returns false when it was refused, so the caller can tell a job
 * that was cancelled in the meantime.</p>
 *
 * <p>Once the worker calls {@link #beginCommit()} the job can no longer be cancelled: its result
 * is being written and it ends COMPLETED or FAILED.</p>
 */
public class ExtractionJob {

    @JsonProperty("job_id")
    private final String id;

    @JsonProperty("project_id")
    private final String projectId;

    @JsonProperty("scene_id")
    private final String sceneId;

    @JsonProperty("extractor_type")
    private final ExtractionStrategy strategy;

    @JsonProperty("model_name")
    private final String modelName;

    @JsonProperty("status")
    private JobStatus status = JobStatus.PENDING;

    @JsonProperty("entities_extracted")
    private int entitiesExtracted;

    @JsonProperty("relationships_extracted")
    private int relationshipsExtracted;

    @JsonProperty("tokens_used")
    private long tokensUsed;

    @JsonProperty("cost")
    private BigDecimal cost = BigDecimal.ZERO;

    @JsonProperty("created_at")
    private final Instant createdAt;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("error_kind")
    private ExtractionException.Kind errorKind;

    @JsonIgnore
    private boolean committing;

    @JsonIgnore
    private volatile Future<?> inFlight;

    public ExtractionJob(@NotNull String projectId, @NotNull String sceneId,
                         @NotNull ExtractionStrategy strategy, @Nullable String modelName) {
        this.id = UUID.randomUUID().toString();
        this.projectId = Objects.requireNonNull(projectId, "projectId must not be null");
        this.sceneId = Objects.requireNonNull(sceneId, "sceneId must not be null");
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.modelName = modelName;
        this.createdAt = Instant.now();
    }

    // ===== transitions =====

    public synchronized boolean markRunning() {
        if (status != JobStatus.PENDING) {
            return false;
        }
        status = JobStatus.RUNNING;
        startedAt = Instant.now();
        return true;
    }

    /**
     * Claims the right to persist this job's result.
     *
     * @return false if the job is no longer running, typically because it was cancelled
     */
    public synchronized boolean beginCommit() {
        if (status != JobStatus.RUNNING) {
            return false;
        }
        committing = true;
        return true;
    }

    public synchronized boolean complete(int entities, int relationships, @NotNull ExtractionUsage usage,
                                         @NotNull BigDecimal cost) {
        if (status.isTerminal()) {
            return false;
        }
        this.entitiesExtracted = entities;
        this.relationshipsExtracted = relationships;
        this.tokensUsed = usage.totalTokens();
        this.cost = cost;
        finish(JobStatus.COMPLETED);
        return true;
    }

    public synchronized boolean fail(@Nullable ExtractionException.Kind kind, @NotNull String message) {
        if (status.isTerminal()) {
            return false;
        }
        this.errorKind = kind;
        this.errorMessage = message;
        finish(JobStatus.FAILED);
        return true;
    }

    /**
     * Marks the job cancelled and interrupts its in-flight extraction call, if any.
     *
     * @return false if the job already finished or is committing its result
     */
    public boolean cancel() {
        synchronized (this) {
            if (status.isTerminal() || committing) {
                return false;
            }
            finish(JobStatus.CANCELLED);
        }
        Future<?> call = inFlight;
        if (call != null) {
            call.cancel(true);
        }
        return true;
    }

    @JsonIgnore
    public synchronized boolean isCancelled() {
        return status == JobStatus.CANCELLED;
    }

    @JsonIgnore
    public synchronized boolean isCommitting() {
        return committing;
    }

    void attach(@Nullable Future<?> call) {
        boolean cancelled;
        synchronized (this) {
            cancelled = status == JobStatus.CANCELLED;
            this.inFlight = cancelled ? null : call;
        }
        if (cancelled && call != null) {
            call.cancel(true);
        }
    }

    private void finish(JobStatus terminal) {
        status = terminal;
        committing = false;
        completedAt = Instant.now();
        inFlight = null;
    }

    // ===== accessors =====

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public String getProjectId() {
        return projectId;
    }

    @NotNull
    public String getSceneId() {
        return sceneId;
    }

    @NotNull
    public ExtractionStrategy getStrategy() {
        return strategy;
    }

    @Nullable
    public String getModelName() {
        return modelName;
    }

    @NotNull
    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized int getEntitiesExtracted() {
        return entitiesExtracted;
    }

    public synchronized int getRelationshipsExtracted() {
        return relationshipsExtracted;
    }

    public synchronized long getTokensUsed() {
        return tokensUsed;
    }

    @NotNull
    public synchronized BigDecimal getCost() {
        return cost;
    }

    @NotNull
    public Instant getCreatedAt() {
        return createdAt;
    }

    @Nullable
    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    @Nullable
    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    @Nullable
    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    @Nullable
    public synchronized ExtractionException.Kind getErrorKind() {
        return errorKind;
    }

    /**
     * Wall-clock run time, null until the job has both started and finished.
     */
    @JsonProperty("duration_seconds")
    @Nullable
    public synchronized Double getDurationSeconds() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt).toMillis() / 1000.0;
    }

    @Override
    public synchronized String toString() {
        return "ExtractionJob{" +
                "id='" + id + '\'' +
                ", projectId='" + projectId + '\'' +
                ", sceneId='" + sceneId + '\'' +
                ", strategy=" + strategy +
                ", status=" + status +
                '}';
    }
}
