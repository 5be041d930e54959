package io.github.orkee.live;

import com.google.gson.annotations.SerializedName;

import java.util.Objects;
import java.util.Set;

/**
 * Snapshot of an autonomous agent run, as returned by {@code GET /api/agent-runs/{id}}.
 */
public final class AgentRun {

    /** statuses after which a run never changes again */
    public static final Set<String> TERMINAL_STATUSES = Set.of("completed", "failed", "cancelled");

    private final String id;

    @SerializedName("project_id")
    private final String projectId;

    private final String status;

    @SerializedName("current_iteration")
    private final long currentIteration;

    @SerializedName("max_iterations")
    private final long maxIterations;

    @SerializedName("stories_total")
    private final long storiesTotal;

    @SerializedName("stories_completed")
    private final long storiesCompleted;

    @SerializedName("total_cost")
    private final double totalCost;

    private final String error;

    /**
     * Creates a new AgentRun instance.
     *
     * @param id               the run id
     * @param projectId        the owning project
     * @param status           pending, running, completed, failed or cancelled
     * @param currentIteration the iteration in progress
     * @param maxIterations    the iteration limit
     * @param storiesTotal     number of stories in the PRD
     * @param storiesCompleted number of stories that pass
     * @param totalCost        accumulated cost in USD
     * @param error            failure message, may be null
     */
    public AgentRun(String id, String projectId, String status, long currentIteration, long maxIterations,
                    long storiesTotal, long storiesCompleted, double totalCost, String error) {
        this.id = id;
        this.projectId = projectId;
        this.status = status;
        this.currentIteration = currentIteration;
        this.maxIterations = maxIterations;
        this.storiesTotal = storiesTotal;
        this.storiesCompleted = storiesCompleted;
        this.totalCost = totalCost;
        this.error = error;
    }

    public String getId() {
        return id;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getStatus() {
        return status;
    }

    public long getCurrentIteration() {
        return currentIteration;
    }

    public long getMaxIterations() {
        return maxIterations;
    }

    public long getStoriesTotal() {
        return storiesTotal;
    }

    public long getStoriesCompleted() {
        return storiesCompleted;
    }

    public double getTotalCost() {
        return totalCost;
    }

    public String getError() {
        return error;
    }

    /**
     * Checks if the run has finished.
     *
     * @return true if the status is completed, failed or cancelled
     */
    public boolean isTerminal() {
        return status != null && TERMINAL_STATUSES.contains(status);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AgentRun that = (AgentRun) o;
        return currentIteration == that.currentIteration &&
                maxIterations == that.maxIterations &&
                storiesTotal == that.storiesTotal &&
                storiesCompleted == that.storiesCompleted &&
                Double.compare(totalCost, that.totalCost) == 0 &&
                Objects.equals(id, that.id) &&
                Objects.equals(projectId, that.projectId) &&
                Objects.equals(status, that.status) &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, projectId, status, currentIteration, maxIterations, storiesTotal,
                storiesCompleted, totalCost, error);
    }

    @Override
    public String toString() {
        return "AgentRun{" +
                "id='" + id + '\'' +
                ", status='" + status + '\'' +
                ", iteration=" + currentIteration + "/" + maxIterations +
                ", stories=" + storiesCompleted + "/" + storiesTotal +
                '}';
    }
}
