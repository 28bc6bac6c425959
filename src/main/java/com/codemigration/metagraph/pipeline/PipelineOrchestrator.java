package com.codemigration.metagraph.pipeline;

import com.codemigration.metagraph.exception.MigrationException;
import com.codemigration.metagraph.feedback.FeedbackService;
import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.logging.MdcContext;
import com.codemigration.metagraph.model.entity.Project;
import com.codemigration.metagraph.model.entity.ProjectState;
import com.codemigration.metagraph.model.entity.Report;
import com.codemigration.metagraph.model.graph.GraphBatch;
import com.codemigration.metagraph.model.graph.GraphEdge;
import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.NodeRef;
import com.codemigration.metagraph.model.graph.RelationshipType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Per-project state machine:
 * <pre>
 *   uploaded -> structure_analyzed -> content_analyzed -> classified -> mapped -> strategized -> done
 * </pre>
 * plus {@code failed} and {@code cancelled} (terminal) and {@code needs_feedback}, entered after
 * {@code mapped} or {@code strategized} while feedback is pending. {@code needs_feedback} does not
 * block: the next advance continues from the last completed stage.
 *
 * <p>Each advance runs exactly one stage and commits the new state only after the stage returns,
 * so the stored state is always the last committed stage. Retryable failures are retried with
 * backoff; anything else, or retries running out, moves the project to {@code failed} with a
 * Report tagged by the error kind.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    private final Map<ProjectState, PipelineStage> stagesByRequirement = new EnumMap<>(ProjectState.class);
    private final ProjectRegistry projects;
    private final GraphStore graphStore;
    private final FeedbackService feedbackService;
    private final RetryExecutor retryExecutor;
    private final Executor pipelineExecutor;

    // One lock object per project keeps its stages strictly sequential
    private final ConcurrentHashMap<String, Object> projectLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<ProjectState>> running = new ConcurrentHashMap<>();

    public PipelineOrchestrator(List<PipelineStage> stages, ProjectRegistry projects, GraphStore graphStore,
                                FeedbackService feedbackService, RetryExecutor retryExecutor,
                                @Qualifier("pipelineExecutor") Executor pipelineExecutor) {
        for (PipelineStage stage : stages) {
            PipelineStage previous = stagesByRequirement.put(stage.requires(), stage);
            if (previous != null) {
                throw new IllegalStateException("Two stages run from " + stage.requires() + ": "
                    + previous.name() + ", " + stage.name());
            }
        }
        this.projects = projects;
        this.graphStore = graphStore;
        this.feedbackService = feedbackService;
        this.retryExecutor = retryExecutor;
        this.pipelineExecutor = pipelineExecutor;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    public Project createProject(ProjectIntake intake) {
        if (intake.getSourceDir() == null || intake.getSourceDir().isBlank()) {
            throw new IllegalArgumentException("Source directory is required");
        }
        Project project = projects.create(intake);
        log.info("📥 Project {} created from {}", project.getId(), project.getSourceDir());
        return project;
    }

    /**
     * Run the next stage of a project, if any.
     *
     * @return State after the advance
     */
    public ProjectState advance(String projectId) {
        synchronized (lockFor(projectId)) {
            Project project = projects.load(projectId);
            if (project.getStatus().isTerminal()) {
                return project.getStatus();
            }
            if (project.isCancelRequested()) {
                projects.commit(projectId, ProjectState.CANCELLED, project.getLastCompletedStage(), "", null);
                log.info("Project {} cancelled after {}", projectId, project.getLastCompletedStage().tag());
                return ProjectState.CANCELLED;
            }
            PipelineStage stage = stagesByRequirement.get(project.getLastCompletedStage());
            if (stage == null) {
                throw new IllegalStateException("No stage runs from " + project.getLastCompletedStage().tag());
            }
            return runStage(project, stage);
        }
    }

    /**
     * Advance until the project reaches a terminal state.
     */
    public ProjectState runToCompletion(String projectId) {
        ProjectState state = getState(projectId);
        while (!state.isTerminal()) {
            state = advance(projectId);
        }
        log.info("🏁 Project {} finished as {}", projectId, state.tag());
        return state;
    }

    /**
     * Run the pipeline on the pipeline pool. A project already running returns the in-flight run.
     */
    public CompletableFuture<ProjectState> runAsync(String projectId) {
        CompletableFuture<ProjectState> future = new CompletableFuture<>();
        CompletableFuture<ProjectState> inFlight = running.putIfAbsent(projectId, future);
        if (inFlight != null) {
            return inFlight;
        }
        pipelineExecutor.execute(() -> {
            try {
                ProjectState state = runToCompletion(projectId);
                running.remove(projectId, future);
                future.complete(state);
            } catch (RuntimeException e) {
                running.remove(projectId, future);
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    /**
     * Request cancellation. It takes effect at the next stage boundary; a stage in flight
     * finishes its writes first.
     */
    public void cancel(String projectId) {
        Project project = projects.load(projectId);
        if (project.getStatus().isTerminal()) {
            return;
        }
        projects.requestCancel(projectId);
        log.info("Cancellation requested for project {}", projectId);
    }

    /**
     * Delete the project's whole subgraph.
     *
     * @throws IllegalStateException while a run is in flight
     */
    public long purge(String projectId) {
        if (running.containsKey(projectId)) {
            throw new IllegalStateException("Project " + projectId + " is running; cancel it first");
        }
        synchronized (lockFor(projectId)) {
            long deleted = graphStore.deleteProject(projectId);
            log.info("🗑️ Purged project {} ({} nodes)", projectId, deleted);
            projectLocks.remove(projectId);
            return deleted;
        }
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public ProjectState getState(String projectId) {
        return projects.load(projectId).getStatus();
    }

    public ProjectStatus getStatus(String projectId) {
        Project project = projects.load(projectId);
        String error = project.getError() == null || project.getError().isBlank() ? null : project.getError();
        return new ProjectStatus(
            projectId,
            project.getStatus(),
            project.getLastCompletedStage(),
            project.getProgress(),
            project.getCurrentStep(),
            feedbackService.countPending(projectId),
            graphStore.countNodes(projectId, NodeLabel.REPORT),
            error,
            project.getUpdatedAt(),
            running.containsKey(projectId));
    }

    public Optional<PipelineStage> nextStage(String projectId) {
        Project project = projects.load(projectId);
        if (project.getStatus().isTerminal()) {
            return Optional.empty();
        }
        return Optional.ofNullable(stagesByRequirement.get(project.getLastCompletedStage()));
    }

    // =========================================================================
    // Stage execution
    // =========================================================================

    private ProjectState runStage(Project project, PipelineStage stage) {
        String projectId = project.getId();
        MdcContext.setStage(projectId, stage.name());
        try {
            log.info("▶️ Stage {} starting ({} -> {})", stage.name(), stage.requires().tag(), stage.produces().tag());
            projects.markStep(projectId, stage.name());
            long start = System.currentTimeMillis();

            retryExecutor.run(stage.name(), () -> stage.run(project));

            ProjectState produced = stage.produces();
            ProjectState state = produced;
            if ((produced == ProjectState.MAPPED || produced == ProjectState.STRATEGIZED)
                && feedbackService.countPending(projectId) > 0) {
                state = ProjectState.NEEDS_FEEDBACK;
            }
            projects.commit(projectId, state, produced, stage.name(), null);
            log.info("✅ Stage {} done in {}ms, project now {}", stage.name(), System.currentTimeMillis() - start,
                state.tag());
            return state;
        } catch (RuntimeException e) {
            fail(project, stage, e);
            return ProjectState.FAILED;
        } finally {
            MdcContext.clear();
        }
    }

    private void fail(Project project, PipelineStage stage, RuntimeException cause) {
        String tag = cause instanceof MigrationException migration ? migration.getKind().getTag() : "UnexpectedError";
        log.error("❌ Stage {} failed for project {} [{}]: {}", stage.name(), project.getId(), tag,
            cause.getMessage(), cause);
        String projectId = project.getId();
        GraphNode report = Report.appended(tag, String.valueOf(cause.getMessage()))
            .detail("stage", stage.name())
            .detail("last_completed_stage", project.getLastCompletedStage().tag())
            .detail("exception", cause.getClass().getSimpleName())
            .build()
            .toNode(projectId);
        try {
            graphStore.applyBatch(projectId, GraphBatch.builder()
                .node(report)
                .edge(GraphEdge.of(RelationshipType.REPORTED_IN, NodeRef.of(NodeLabel.PROJECT, projectId), report.ref()))
                .build());
            projects.commit(projectId, ProjectState.FAILED, project.getLastCompletedStage(), stage.name(),
                tag + ": " + cause.getMessage());
        } catch (RuntimeException storeFailure) {
            log.error("Could not record failure of project {}: {}", projectId, storeFailure.getMessage());
            cause.addSuppressed(storeFailure);
            throw cause;
        }
    }

    private Object lockFor(String projectId) {
        return projectLocks.computeIfAbsent(projectId, id -> new Object());
    }
}
