package br.edu.ifba.storygraph.job;

import br.edu.ifba.storygraph.config.StoryGraphConfig;
import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.KnowledgeGraph;
import br.edu.ifba.storygraph.core.Relationship;
import br.edu.ifba.storygraph.exception.ConcurrencyException;
import br.edu.ifba.storygraph.exception.EntityNotFoundException;
import br.edu.ifba.storygraph.exception.ExtractionException;
import br.edu.ifba.storygraph.extraction.ExtractionPrompts;
import br.edu.ifba.storygraph.extraction.ExtractionResult;
import br.edu.ifba.storygraph.extraction.ExtractionStrategy;
import br.edu.ifba.storygraph.extraction.SceneExtractor;
import br.edu.ifba.storygraph.extraction.SceneExtractorRegistry;
import br.edu.ifba.storygraph.notify.GraphChangeNotifier;
import br.edu.ifba.storygraph.notify.GraphEventType;
import br.edu.ifba.storygraph.storage.GraphRepository;
import br.edu.ifba.storygraph.utils.ProjectLockManager;
import br.edu.ifba.storygraph.utils.TokenUtil;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Runs scene extractions as asynchronous jobs and tracks their lifecycle.
 *
 * <p>A job holds its project's lock for the whole load, extract, merge and persist sequence,
 * so concurrent jobs on one project are applied one after the other against the latest graph.
 * Jobs on different projects run in parallel on the worker pool.</p>
 *
 * <p>Failures never escape a worker: they end up on the job as {@link JobStatus#FAILED} with a
 * message and, for model failures, the {@link ExtractionException.Kind}.</p>
 */
@ApplicationScoped
public class ExtractionJobService {

    private static final Logger LOG = Logger.getLogger(ExtractionJobService.class);

    private static final String MDC_PROJECT_ID = "project.id";
    private static final String MDC_JOB_ID = "job.id";

    private static final ClassLoader QUARKUS_CLASSLOADER = ExtractionJobService.class.getClassLoader();
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private static final ThreadFactory THREAD_FACTORY = task -> {
        Thread thread = new Thread(() -> {
            Thread.currentThread().setContextClassLoader(QUARKUS_CLASSLOADER);
            task.run();
        }, "storygraph-job-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    };

    // entity prompt + relationship prompt per scene
    private static final int SEMANTIC_CALLS_PER_SCENE = 2;

    private SceneExtractorRegistry extractors;
    private GraphRepository repository;
    private ProjectLockManager locks;
    private GraphChangeNotifier notifier;
    private SceneSource sceneSource;
    private StoryGraphConfig config;
    private ExecutorService workers;

    private final Map<String, ExtractionJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<ExtractionJob>> completions = new ConcurrentHashMap<>();

    protected ExtractionJobService() {
        // CDI proxy
    }

    @Inject
    public ExtractionJobService(SceneExtractorRegistry extractors, GraphRepository repository,
                                ProjectLockManager locks, GraphChangeNotifier notifier,
                                SceneSource sceneSource, StoryGraphConfig config) {
        this(extractors, repository, locks, notifier, sceneSource, config,
            Executors.newFixedThreadPool(config.jobs().workerThreads(), THREAD_FACTORY));
    }

    public ExtractionJobService(@NotNull SceneExtractorRegistry extractors, @NotNull GraphRepository repository,
                                @NotNull ProjectLockManager locks, @NotNull GraphChangeNotifier notifier,
                                @NotNull SceneSource sceneSource, @NotNull StoryGraphConfig config,
                                @NotNull ExecutorService workers) {
        this.extractors = extractors;
        this.repository = repository;
        this.locks = locks;
        this.notifier = notifier;
        this.sceneSource = sceneSource;
        this.config = config;
        this.workers = workers;
    }

    // ===== submission =====

    /**
     * Queues the extraction of one scene.
     *
     * @throws IllegalArgumentException if no extractor is registered for the strategy
     */
    @NotNull
    public ExtractionJob submit(@NotNull String projectId, @NotNull String sceneId,
                                @NotNull ExtractionStrategy strategy) {
        SceneExtractor extractor = extractors.get(strategy);
        ExtractionJob job = new ExtractionJob(projectId, sceneId, strategy, extractor.getModelName());
        jobs.put(job.getId(), job);
        LOG.infof("Queued extraction job %s: project=%s, scene=%s, strategy=%s",
            job.getId(), projectId, sceneId, strategy.getValue());

        try {
            CompletableFuture<ExtractionJob> done = CompletableFuture
                .runAsync(() -> run(job), workers)
                .handle((ignored, error) -> job);
            completions.put(job.getId(), done);
        } catch (RejectedExecutionException e) {
            LOG.errorf("Worker pool rejected job %s", job.getId());
            job.fail(null, "Extraction service is shutting down");
            completions.put(job.getId(), CompletableFuture.completedFuture(job));
        }
        return job;
    }

    /**
     * Queues the extraction of many scenes of one project.
     *
     * <p>At most {@code storygraph.batch.max-scenes} scenes are processed per call; the rest are
     * reported as skipped. For a paid strategy whose estimate exceeds the confirmation threshold,
     * nothing is queued unless the request confirms the cost.</p>
     *
     * @throws IllegalArgumentException if a requested scene id does not exist
     */
    @NotNull
    public BatchExtractionResponse submitBatch(@NotNull BatchExtractionRequest request) {
        String projectId = request.projectId();
        extractors.get(request.strategy());

        List<Scene> selected = selectScenes(projectId, request.sceneIds());
        if (selected.isEmpty()) {
            return new BatchExtractionResponse(BatchExtractionResponse.Outcome.NO_SCENES, List.of(), List.of(),
                null, "Project " + projectId + " has no scenes to extract");
        }

        int cap = config.batch().maxScenes();
        List<Scene> toProcess = selected.size() > cap ? selected.subList(0, cap) : selected;
        List<String> skipped = selected.subList(toProcess.size(), selected.size()).stream()
            .map(Scene::id)
            .collect(Collectors.toList());
        if (!skipped.isEmpty()) {
            LOG.warnf("Batch for project %s capped at %d scenes, %d skipped", projectId, cap, skipped.size());
        }

        CostEstimate estimate = estimate(request.strategy(), toProcess);
        if (estimate.requiresConfirmation() && !request.confirmCost()) {
            LOG.infof("Batch for project %s needs cost confirmation: estimated %s over threshold %s",
                projectId, estimate.estimatedCost(), estimate.threshold());
            return new BatchExtractionResponse(BatchExtractionResponse.Outcome.CONFIRMATION_REQUIRED, List.of(),
                skipped, estimate, "Estimated cost " + estimate.estimatedCost()
                    + " exceeds " + estimate.threshold() + "; resubmit with confirm_cost to proceed");
        }

        List<ExtractionJob> created = new ArrayList<>(toProcess.size());
        for (Scene scene : toProcess) {
            created.add(submit(projectId, scene.id(), request.strategy()));
        }
        LOG.infof("Submitted %d extraction jobs for project %s", created.size(), projectId);
        return new BatchExtractionResponse(BatchExtractionResponse.Outcome.SUBMITTED, created, skipped, estimate,
            "Submitted " + created.size() + " extraction jobs");
    }

    /**
     * Estimates the spend of extracting every scene of a project, up to the batch cap.
     */
    @NotNull
    public CostEstimate estimateCost(@NotNull String projectId, @NotNull ExtractionStrategy strategy) {
        List<Scene> all = sceneSource.listScenes(projectId);
        int cap = config.batch().maxScenes();
        return estimate(strategy, all.size() > cap ? all.subList(0, cap) : all);
    }

    // ===== status =====

    @NotNull
    public Optional<ExtractionJob> getJob(@NotNull String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @NotNull
    public List<ExtractionJob> listJobs(@NotNull String projectId) {
        return jobs.values().stream()
            .filter(job -> job.getProjectId().equals(projectId))
            .sorted(Comparator.comparing(ExtractionJob::getCreatedAt))
            .collect(Collectors.toList());
    }

    /**
     * Future completed with the job once it reaches a terminal state.
     */
    @NotNull
    public CompletableFuture<ExtractionJob> completion(@NotNull String jobId) {
        CompletableFuture<ExtractionJob> done = completions.get(jobId);
        if (done == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown job: " + jobId));
        }
        return done;
    }

    /**
     * Cancels a job that has not finished. Its result, if any arrives, is discarded.
     *
     * @return true if the job was pending or running and is now cancelled
     */
    public boolean cancel(@NotNull String jobId) {
        ExtractionJob job = jobs.get(jobId);
        if (job == null || !job.cancel()) {
            return false;
        }
        LOG.infof("Cancelled extraction job %s", jobId);
        notifier.publish(GraphEventType.EXTRACTION_CANCELLED, job.getProjectId(), jobPayload(job));
        return true;
    }

    /**
     * Forgets finished jobs of a project, e.g. after the project is deleted.
     */
    public int purgeFinished(@NotNull String projectId) {
        List<String> finished = jobs.values().stream()
            .filter(job -> job.getProjectId().equals(projectId) && job.getStatus().isTerminal())
            .map(ExtractionJob::getId)
            .collect(Collectors.toList());
        finished.forEach(id -> {
            jobs.remove(id);
            completions.remove(id);
        });
        return finished.size();
    }

    @PreDestroy
    public void shutdown() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    // ===== worker =====

    void run(ExtractionJob job) {
        MDC.put(MDC_PROJECT_ID, job.getProjectId());
        MDC.put(MDC_JOB_ID, job.getId());
        try {
            if (!job.markRunning()) {
                LOG.debugf("Job %s was cancelled before it started", job.getId());
                return;
            }
            notifier.publish(GraphEventType.EXTRACTION_STARTED, job.getProjectId(), jobPayload(job));
            execute(job);
        } finally {
            MDC.remove(MDC_JOB_ID);
            MDC.remove(MDC_PROJECT_ID);
        }
    }

    private void execute(ExtractionJob job) {
        String projectId = job.getProjectId();
        ReentrantLock lock;
        try {
            lock = locks.acquire(projectId);
        } catch (ConcurrencyException e) {
            markFailed(job, null, e.getMessage());
            return;
        }

        KnowledgeGraph graph = null;
        try {
            if (job.isCancelled()) {
                return;
            }
            graph = repository.load(projectId);

            Optional<Scene> scene = sceneSource.findScene(projectId, job.getSceneId());
            if (scene.isEmpty()) {
                recordFailure(graph, job, null, "Scene not found: " + job.getSceneId());
                return;
            }

            ExtractionResult result = awaitExtraction(job, graph, scene.get());
            if (result == null) {
                return;
            }
            if (!job.beginCommit()) {
                LOG.infof("Job %s cancelled before commit, discarded its result", job.getId());
                return;
            }

            MergeOutcome merged = merge(graph, result);
            graph.recordExtraction(job.getSceneId(), true);
            repository.save(graph);

            BigDecimal cost = job.getStrategy().isPaid()
                ? TokenUtil.cost(result.usage().totalTokens(), config.batch().costPer1kTokens())
                : BigDecimal.ZERO;
            if (job.complete(result.entities().size(), result.relationships().size(), result.usage(), cost)) {
                LOG.infof("Job %s completed: %d entities (%d new), %d relationships (%d new), %d tokens",
                    job.getId(), result.entities().size(), merged.newEntities.size(),
                    result.relationships().size(), merged.newRelationships.size(), result.usage().totalTokens());
                publishMutations(projectId, merged);
                Map<String, Object> payload = jobPayload(job);
                payload.put("entities_added", merged.newEntities.size());
                payload.put("relationships_added", merged.newRelationships.size());
                notifier.publish(GraphEventType.EXTRACTION_COMPLETED, projectId, payload);
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Extraction job %s failed", job.getId());
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            if (graph != null && job.isCommitting()) {
                // the merge may be half applied, count the failure on the last durable graph
                repository.evict(projectId);
                graph = reload(projectId);
            }
            if (graph != null) {
                recordFailure(graph, job, null, message);
            } else {
                markFailed(job, null, message);
            }
        } finally {
            locks.release(lock);
        }
    }

    /**
     * Runs the extractor under the per-call timeout.
     *
     * @return the result, or null when the job ended (failed or cancelled) while waiting
     */
    private ExtractionResult awaitExtraction(ExtractionJob job, KnowledgeGraph graph, Scene scene) {
        SceneExtractor extractor = extractors.get(job.getStrategy());
        Duration timeout = config.extraction().timeout();

        CompletableFuture<ExtractionResult> call;
        try {
            call = extractor.extract(scene.text(), scene.id(), graph.entities());
        } catch (ExtractionException e) {
            recordFailure(graph, job, e.getKind(), e.getMessage());
            return null;
        }
        job.attach(call);

        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            recordFailure(graph, job, ExtractionException.Kind.TIMEOUT,
                "Extraction timed out after " + timeout.toSeconds() + "s");
            return null;
        } catch (CancellationException e) {
            if (!job.isCancelled()) {
                recordFailure(graph, job, null, "Extraction call was cancelled");
            }
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!job.isCancelled()) {
                recordFailure(graph, job, null, "Interrupted while waiting for extraction");
            }
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            ExtractionException.Kind kind = cause instanceof ExtractionException extraction
                ? extraction.getKind()
                : ExtractionException.Kind.PROVIDER;
            recordFailure(graph, job, kind, cause.getMessage() != null ? cause.getMessage() : cause.toString());
            return null;
        } finally {
            job.attach(null);
        }
    }

    private MergeOutcome merge(KnowledgeGraph graph, ExtractionResult result) {
        MergeOutcome outcome = new MergeOutcome();
        for (Entity entity : result.entities()) {
            if (graph.addEntity(entity)) {
                outcome.newEntities.add(entity.getId());
            } else {
                outcome.updatedEntities.add(entity.getId());
            }
        }
        for (Relationship relationship : result.relationships()) {
            try {
                if (graph.addRelationship(relationship)) {
                    outcome.newRelationships.add(relationship);
                } else {
                    outcome.updatedRelationships.add(relationship);
                }
            } catch (EntityNotFoundException e) {
                LOG.warnf("Skipping relationship %s: %s", relationship.key(), e.getMessage());
            }
        }
        return outcome;
    }

    private KnowledgeGraph reload(String projectId) {
        try {
            return repository.load(projectId);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Could not reload graph for project %s", projectId);
            return null;
        }
    }

    /**
     * Counts the failed attempt on the graph, persists the counters, and fails the job.
     */
    private void recordFailure(KnowledgeGraph graph, ExtractionJob job, ExtractionException.Kind kind,
                               String message) {
        if (!job.beginCommit()) {
            return;
        }
        graph.recordExtraction(job.getSceneId(), false);
        try {
            repository.save(graph);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Could not persist failure counters for project %s", job.getProjectId());
        }
        markFailed(job, kind, message);
    }

    private void markFailed(ExtractionJob job, ExtractionException.Kind kind, String message) {
        if (job.fail(kind, message)) {
            LOG.errorf("Extraction job %s failed (%s): %s", job.getId(), kind, message);
            Map<String, Object> payload = jobPayload(job);
            payload.put("error", message);
            payload.put("error_kind", kind != null ? kind.name() : null);
            payload.put("retryable", kind != null && kind.isTransient());
            notifier.publish(GraphEventType.EXTRACTION_FAILED, job.getProjectId(), payload);
        }
    }

    private void publishMutations(String projectId, MergeOutcome merged) {
        merged.newEntities.forEach(id -> notifier.publish(GraphEventType.ENTITY_ADDED, projectId,
            Map.of("entity_id", id)));
        merged.updatedEntities.forEach(id -> notifier.publish(GraphEventType.ENTITY_UPDATED, projectId,
            Map.of("entity_id", id)));
        merged.newRelationships.forEach(rel -> notifier.publish(GraphEventType.RELATIONSHIP_ADDED, projectId,
            relationshipPayload(rel)));
        merged.updatedRelationships.forEach(rel -> notifier.publish(GraphEventType.RELATIONSHIP_UPDATED, projectId,
            relationshipPayload(rel)));
    }

    // ===== cost =====

    private CostEstimate estimate(ExtractionStrategy strategy, List<Scene> scenes) {
        BigDecimal threshold = config.batch().costConfirmationThreshold();
        if (!strategy.isPaid()) {
            return CostEstimate.free(strategy, scenes.size(), threshold);
        }

        int overhead = promptOverheadTokens();
        long inputTokens = 0;
        for (Scene scene : scenes) {
            inputTokens += (long) SEMANTIC_CALLS_PER_SCENE * (TokenUtil.estimateTokensSafe(scene.text()) + overhead);
        }
        long outputTokens = (long) scenes.size() * config.batch().expectedOutputTokens();
        BigDecimal cost = TokenUtil.cost(inputTokens + outputTokens, config.batch().costPer1kTokens());

        return new CostEstimate(strategy, scenes.size(), inputTokens, outputTokens, cost, threshold,
            cost.compareTo(threshold) > 0);
    }

    private static int promptOverheadTokens() {
        return TokenUtil.estimateTokensSafe(ExtractionPrompts.SYSTEM_PROMPT)
            + TokenUtil.estimateTokensSafe(ExtractionPrompts.entityPrompt("", List.of(), 0));
    }

    private List<Scene> selectScenes(String projectId, List<String> sceneIds) {
        List<Scene> all = sceneSource.listScenes(projectId);
        if (sceneIds.isEmpty()) {
            return all;
        }
        Map<String, Scene> byId = new LinkedHashMap<>();
        all.forEach(scene -> byId.put(scene.id(), scene));
        List<Scene> selected = new ArrayList<>(sceneIds.size());
        for (String sceneId : sceneIds) {
            Scene scene = byId.get(sceneId);
            if (scene == null) {
                throw new IllegalArgumentException("Scene not found in project " + projectId + ": " + sceneId);
            }
            selected.add(scene);
        }
        return selected;
    }

    private static Map<String, Object> jobPayload(ExtractionJob job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("job_id", job.getId());
        payload.put("scene_id", job.getSceneId());
        payload.put("strategy", job.getStrategy().getValue());
        payload.put("status", job.getStatus().getValue());
        return payload;
    }

    private static Map<String, Object> relationshipPayload(Relationship relationship) {
        return Map.of(
            "source", relationship.getSourceId(),
            "target", relationship.getTargetId(),
            "relation", relationship.getRelationType().getValue());
    }

    private static final class MergeOutcome {
        private final List<String> newEntities = new ArrayList<>();
        private final List<String> updatedEntities = new ArrayList<>();
        private final List<Relationship> newRelationships = new ArrayList<>();
        private final List<Relationship> updatedRelationships = new ArrayList<>();
    }
}
