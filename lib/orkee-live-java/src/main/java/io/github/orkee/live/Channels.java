package io.github.orkee.live;

import java.util.Set;

/**
 * Channels for the resources the dashboard follows live.
 */
public final class Channels {

    /** subscription key for the preview server list, which has no id of its own */
    public static final String PREVIEW_SERVERS_ID = "servers";

    private static final Set<String> RUN_COMPLETION_EVENTS = Set.of("run_completed", "run_failed");
    private static final Set<String> RUN_ERROR_EVENTS = Set.of("run_failed", "iteration_failed");

    private static final Channel<AgentRun, LiveEvent> AGENT_RUN =
            Channel.<AgentRun, LiveEvent>builder("agent-run", AgentRun.class, LiveEventDecoder.INSTANCE)
                    .endpoint(runId -> "/api/agent-runs/" + EndpointResolver.encodePath(runId))
                    .terminal(AgentRun::isTerminal)
                    .completion(event -> RUN_COMPLETION_EVENTS.contains(event.getType()))
                    .heartbeat(event -> event.is("heartbeat"))
                    .resourceIdOf(event -> event.getString("run_id"))
                    .reportedErrorOf(event -> RUN_ERROR_EVENTS.contains(event.getType()) ? event.getString("error") : null)
                    .build();

    private static final Channel<ServerList, LiveEvent> PREVIEW_SERVERS =
            Channel.<ServerList, LiveEvent>builder("preview-servers", ServerList.class, LiveEventDecoder.INSTANCE)
                    .endpoint(ignored -> "/api/preview")
                    .snapshotPath(ignored -> "/api/preview/servers")
                    .heartbeat(event -> event.is("heartbeat"))
                    .resourceIdOf(event -> event.getString("project_id"))
                    .reportedErrorOf(event -> event.is("server_error") ? event.getString("error") : null)
                    .build();

    private Channels() {
    }

    /**
     * Follows one agent run: events from {@code /api/agent-runs/{id}/events}, snapshot from
     * {@code /api/agent-runs/{id}}. Completed, failed and cancelled runs are terminal.
     *
     * @return the channel
     */
    public static Channel<AgentRun, LiveEvent> agentRun() {
        return AGENT_RUN;
    }

    /**
     * Follows the set of running preview servers: events from {@code /api/preview/events},
     * snapshot from {@code /api/preview/servers}. Never terminal.
     *
     * @return the channel
     */
    public static Channel<ServerList, LiveEvent> previewServers() {
        return PREVIEW_SERVERS;
    }
}
